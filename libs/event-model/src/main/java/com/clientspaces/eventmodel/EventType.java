package com.clientspaces.eventmodel;

/**
 * Audit event types, with the name written to {@code eventType}.
 */
public enum EventType {

    /** A protected operation was refused by the quota gate. */
    QUOTA_DENIED("QuotaDenied");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
