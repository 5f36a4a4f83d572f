package com.flagship.contribution_ledger.storage;

import lombok.Getter;

/**
 * Raised once the store could not be reached after every retry attempt.
 * The caller decides whether to surface it to the user or abort.
 */
@Getter
public class StorageUnavailableException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public StorageUnavailableException(String operation, int attempts, Throwable cause) {
        super(String.format("Storage unavailable for '%s' after %d attempt(s): %s",
                operation, attempts, cause.getMessage()), cause);
        this.operation = operation;
        this.attempts = attempts;
    }
}
