package com.flagship.contribution_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two kinds of inventory-affecting events.
 */
public enum EventKind {
    /** Additive donation of a positive quantity. */
    CONTRIBUTION("contribution"),
    /** Absolute administrative override of the aggregate stock. */
    QUANTITY_CHANGE("quantity_change");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts the wire name ("quantity_change") or the constant name, any case.
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static EventKind fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (EventKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + value);
    }
}
