package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.EventKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class BulkRemovalRequest {

    @NotNull(message = "Removed-by actor ID is required")
    @JsonProperty("removed_by")
    Long removedBy;

    @NotEmpty(message = "At least one event is required")
    @JsonProperty("events")
    List<@Valid Entry> events;

    @Value
    @Builder
    @Jacksonized
    public static class Entry {

        @NotNull(message = "Event kind is required")
        @JsonProperty("kind")
        EventKind kind;

        @NotNull(message = "Event ID is required")
        @JsonProperty("id")
        Long id;
    }
}
