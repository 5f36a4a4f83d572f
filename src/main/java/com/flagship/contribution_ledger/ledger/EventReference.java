package com.flagship.contribution_ledger.ledger;

import lombok.Value;

/**
 * Points at one stored event for removal.
 */
@Value
public class EventReference {
    EventKind kind;
    long id;

    public static EventReference of(EventKind kind, long id) {
        return new EventReference(kind, id);
    }
}
