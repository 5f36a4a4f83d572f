package com.flagship.contribution_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Administrative override: from {@code changedAt} on, the stock of the item is
 * {@code newQuantity}.
 *
 * {@code oldQuantity} is a snapshot taken by whoever wrote the event. It is audit
 * metadata only and never feeds reconstruction.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuantityChangeEvent implements LedgerEvent {
    long id;
    long sequenceNumber;
    long guildId;
    String itemName;
    String category;
    long oldQuantity;
    long newQuantity;
    String reason;
    String notes;
    long actorId;
    Instant changedAt;

    @Override
    public Instant getOccurredAt() {
        return changedAt;
    }

    @Override
    public EventKind getKind() {
        return EventKind.QUANTITY_CHANGE;
    }

    /**
     * Difference the writer believed it was applying.
     */
    public long getQuantityDelta() {
        return newQuantity - oldQuantity;
    }
}
