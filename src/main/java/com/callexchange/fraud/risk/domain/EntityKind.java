package com.callexchange.fraud.risk.domain;

import java.util.Locale;

/**
 * Kind of entity a fraud check is about.
 */
public enum EntityKind {
    CALL,
    BID,
    ACCOUNT;

    /** Lower-case name used in stored rows and log lines. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntityKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("entity kind must not be blank");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
