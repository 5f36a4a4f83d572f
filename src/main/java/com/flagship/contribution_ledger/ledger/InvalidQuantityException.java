package com.flagship.contribution_ledger.ledger;

/**
 * A quantity outside its allowed range: contributions must be positive,
 * overrides, totals and adjustment amounts must not be negative.
 */
public class InvalidQuantityException extends IllegalArgumentException {

    public InvalidQuantityException(String message) {
        super(message);
    }
}
