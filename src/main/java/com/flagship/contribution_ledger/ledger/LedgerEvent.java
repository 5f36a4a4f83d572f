package com.flagship.contribution_ledger.ledger;

import java.time.Instant;

/**
 * Common view of both event kinds, as used by replay and the audit trail.
 */
public interface LedgerEvent {

    /**
     * Row id within the event's own table.
     */
    long getId();

    /**
     * Ledger-wide insertion order, shared by both tables. Breaks timestamp ties.
     */
    long getSequenceNumber();

    long getGuildId();

    String getCategory();

    String getItemName();

    long getActorId();

    Instant getOccurredAt();

    EventKind getKind();

    default ItemKey getItemKey() {
        return new ItemKey(getCategory(), getItemName());
    }
}
