package com.flagship.contribution_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * An event paired with the stock of its item right after the event was applied.
 */
@Value
public class BalancePoint {
    LedgerEvent event;
    long balance;

    public Instant getOccurredAt() {
        return event.getOccurredAt();
    }

    public ItemKey getItemKey() {
        return event.getItemKey();
    }
}
