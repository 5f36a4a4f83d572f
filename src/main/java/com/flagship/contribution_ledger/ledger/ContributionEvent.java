package com.flagship.contribution_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A donation of {@code quantity} units of an item.
 *
 * The quantity is rewritten in place by redistribution; every other field is
 * fixed once written.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContributionEvent implements LedgerEvent {
    long id;
    long sequenceNumber;
    long guildId;
    long actorId;
    String category;
    String itemName;
    long quantity;
    Instant createdAt;

    @Override
    public Instant getOccurredAt() {
        return createdAt;
    }

    @Override
    public EventKind getKind() {
        return EventKind.CONTRIBUTION;
    }
}
