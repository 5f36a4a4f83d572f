package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateArchiveRequest {

    @NotBlank(message = "Archive name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @JsonProperty("notes")
    String notes;

    @NotNull(message = "Created-by actor ID is required")
    @JsonProperty("created_by")
    Long createdBy;
}
