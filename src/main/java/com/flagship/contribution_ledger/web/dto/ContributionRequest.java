package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ContributionRequest {

    @NotNull(message = "Actor ID is required")
    @JsonProperty("actor_id")
    Long actorId;

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    String category;

    @NotBlank(message = "Item name is required")
    @JsonProperty("item_name")
    String itemName;

    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Long quantity;
}
