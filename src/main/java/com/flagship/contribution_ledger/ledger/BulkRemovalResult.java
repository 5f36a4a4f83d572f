package com.flagship.contribution_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * Counts of removed events plus one message per reference that matched nothing.
 */
@Value
public class BulkRemovalResult {
    int contributionsRemoved;
    int quantityChangesRemoved;
    List<String> failures;

    public int getTotalRemoved() {
        return contributionsRemoved + quantityChangesRemoved;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
