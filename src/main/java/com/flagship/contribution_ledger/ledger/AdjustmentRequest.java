package com.flagship.contribution_ledger.ledger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdjustmentRequest {
    long guildId;
    String category;
    String itemName;
    AdjustmentOperation operation;
    long amount;
    String reason;
    String notes;
    long actorId;

    public ItemKey getItemKey() {
        return ItemKey.of(category, itemName);
    }
}
