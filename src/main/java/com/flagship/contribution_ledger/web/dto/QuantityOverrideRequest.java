package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QuantityOverrideRequest {

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    String category;

    @NotBlank(message = "Item name is required")
    @JsonProperty("item_name")
    String itemName;

    @NotNull(message = "New quantity is required")
    @PositiveOrZero(message = "New quantity cannot be negative")
    @JsonProperty("new_quantity")
    Long newQuantity;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;

    @NotNull(message = "Actor ID is required")
    @JsonProperty("actor_id")
    Long actorId;
}
