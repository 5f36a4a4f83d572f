package com.flagship.contribution_ledger.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.contribution_ledger.ledger.ContributionEvent;
import com.flagship.contribution_ledger.ledger.QuantityChangeEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Frozen copy of a guild's ledger at the moment of archiving, stored as JSON.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveSnapshot {
    Instant archivedAt;
    int totalContributions;
    int totalQuantityChanges;
    List<ContributionEvent> contributions;
    /** Most recent quantity changes, oldest first; may be fewer than totalQuantityChanges. */
    List<QuantityChangeEvent> quantityChanges;
    boolean quantityChangesCleared;
}
