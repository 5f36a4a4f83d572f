package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.AdjustmentOperation;
import com.flagship.contribution_ledger.ledger.AdjustmentResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdjustmentResponse {

    @JsonProperty("category")
    String category;

    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("operation")
    AdjustmentOperation operation;

    @JsonProperty("previous_stock")
    long previousStock;

    @JsonProperty("new_stock")
    long newStock;

    @JsonProperty("quantity_change_id")
    long quantityChangeId;

    @JsonProperty("redistributed")
    boolean redistributed;

    public static AdjustmentResponse from(AdjustmentResult result) {
        return AdjustmentResponse.builder()
            .category(result.getItemKey().getCategory())
            .itemName(result.getItemKey().getItemName())
            .operation(result.getOperation())
            .previousStock(result.getPreviousStock())
            .newStock(result.getNewStock())
            .quantityChangeId(result.getQuantityChangeEventId())
            .redistributed(result.isRedistributed())
            .build();
    }
}
