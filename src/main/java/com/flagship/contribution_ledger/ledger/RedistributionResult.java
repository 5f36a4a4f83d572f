package com.flagship.contribution_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one redistribution. When the item had no contribution rows nothing
 * was written and {@code applied} is false.
 */
@Value
@Builder
public class RedistributionResult {
    long guildId;
    ItemKey itemKey;
    boolean applied;
    long previousTotal;
    long newTotal;
    int rowsUpdated;
    int rowsRemoved;
    /** Id of the correction event, or null when nothing was applied. */
    Long quantityChangeEventId;

    static RedistributionResult skipped(long guildId, ItemKey key, long newTotal) {
        return RedistributionResult.builder()
            .guildId(guildId)
            .itemKey(key)
            .applied(false)
            .newTotal(newTotal)
            .build();
    }
}
