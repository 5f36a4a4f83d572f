package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.RedistributionResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RedistributionResponse {

    @JsonProperty("category")
    String category;

    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("applied")
    boolean applied;

    @JsonProperty("previous_total")
    long previousTotal;

    @JsonProperty("new_total")
    long newTotal;

    @JsonProperty("rows_updated")
    int rowsUpdated;

    @JsonProperty("rows_removed")
    int rowsRemoved;

    @JsonProperty("quantity_change_id")
    Long quantityChangeId;

    public static RedistributionResponse from(RedistributionResult result) {
        return RedistributionResponse.builder()
            .category(result.getItemKey().getCategory())
            .itemName(result.getItemKey().getItemName())
            .applied(result.isApplied())
            .previousTotal(result.getPreviousTotal())
            .newTotal(result.getNewTotal())
            .rowsUpdated(result.getRowsUpdated())
            .rowsRemoved(result.getRowsRemoved())
            .quantityChangeId(result.getQuantityChangeEventId())
            .build();
    }
}
