package com.flagship.contribution_ledger.ledger;

/**
 * Quantity changes must say why they were made.
 */
public class MissingReasonException extends IllegalArgumentException {

    public MissingReasonException() {
        super("A reason is required for quantity changes");
    }
}
