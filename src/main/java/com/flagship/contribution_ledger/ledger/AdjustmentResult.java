package com.flagship.contribution_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an inventory adjustment. {@code redistribution} is null when the item
 * had no contribution rows and a plain quantity change was recorded instead.
 */
@Value
@Builder
public class AdjustmentResult {
    ItemKey itemKey;
    AdjustmentOperation operation;
    long previousStock;
    long newStock;
    long quantityChangeEventId;
    RedistributionResult redistribution;

    public boolean isRedistributed() {
        return redistribution != null;
    }
}
