package com.flagship.contribution_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Input to {@link QuantityRedistributor#redistribute}. Reason and actor default to
 * a plain redistribution by the system.
 */
@Value
@Builder
public class RedistributionRequest {
    public static final String DEFAULT_REASON = "Redistribution";
    public static final long SYSTEM_ACTOR_ID = 0L;

    long guildId;
    String category;
    String itemName;
    long newTotal;
    @Builder.Default
    String reason = DEFAULT_REASON;
    String notes;
    @Builder.Default
    long actorId = SYSTEM_ACTOR_ID;

    public ItemKey getItemKey() {
        return ItemKey.of(category, itemName);
    }
}
