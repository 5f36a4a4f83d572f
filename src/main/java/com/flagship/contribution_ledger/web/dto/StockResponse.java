package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.InventoryLevel;
import lombok.Value;

@Value
public class StockResponse {

    @JsonProperty("category")
    String category;

    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("quantity")
    long quantity;

    public static StockResponse from(InventoryLevel level) {
        return new StockResponse(level.getCategory(), level.getItemName(), level.getQuantity());
    }
}
