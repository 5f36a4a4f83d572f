package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.archive.ArchiveSnapshot;
import com.flagship.contribution_ledger.archive.ArchiveSummary;
import com.flagship.contribution_ledger.archive.LedgerArchive;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Archive metadata, plus the snapshot contents when a single archive is fetched.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("created_by")
    long createdBy;

    @JsonProperty("total_contributions")
    Integer totalContributions;

    @JsonProperty("total_quantity_changes")
    Integer totalQuantityChanges;

    @JsonProperty("quantity_changes_cleared")
    Boolean quantityChangesCleared;

    @JsonProperty("contributions")
    List<EventResponse> contributions;

    @JsonProperty("quantity_changes")
    List<EventResponse> quantityChanges;

    public static ArchiveResponse from(ArchiveSummary summary) {
        return builderFor(summary).build();
    }

    public static ArchiveResponse from(LedgerArchive archive) {
        ArchiveSnapshot snapshot = archive.getSnapshot();
        return builderFor(archive.getSummary())
            .totalContributions(snapshot.getTotalContributions())
            .totalQuantityChanges(snapshot.getTotalQuantityChanges())
            .quantityChangesCleared(snapshot.isQuantityChangesCleared())
            .contributions(snapshot.getContributions().stream().map(EventResponse::from).toList())
            .quantityChanges(snapshot.getQuantityChanges().stream().map(EventResponse::from).toList())
            .build();
    }

    private static ArchiveResponseBuilder builderFor(ArchiveSummary summary) {
        return ArchiveResponse.builder()
            .id(summary.getId())
            .name(summary.getName())
            .description(summary.getDescription())
            .notes(summary.getNotes())
            .createdAt(summary.getCreatedAt())
            .createdBy(summary.getCreatedBy());
    }
}
