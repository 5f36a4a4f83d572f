package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reason, notes and actor are optional; omitted values fall back to a system redistribution.
 */
@Value
@Builder
@Jacksonized
public class RedistributeRequest {

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    String category;

    @NotBlank(message = "Item name is required")
    @JsonProperty("item_name")
    String itemName;

    @NotNull(message = "New total is required")
    @PositiveOrZero(message = "New total cannot be negative")
    @JsonProperty("new_total")
    Long newTotal;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("actor_id")
    Long actorId;
}
