package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.AdjustmentOperation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AdjustInventoryRequest {

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    String category;

    @NotBlank(message = "Item name is required")
    @JsonProperty("item_name")
    String itemName;

    @NotNull(message = "Operation is required")
    @JsonProperty("operation")
    AdjustmentOperation operation;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;

    @NotNull(message = "Actor ID is required")
    @JsonProperty("actor_id")
    Long actorId;
}
