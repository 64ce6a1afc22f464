package com.chainwatch.domain;

/**
 * Result of one risk check. UNKNOWN means the upstream lookup failed or its input was not resolved yet.
 */
public enum CheckOutcome {
    TRUE,
    FALSE,
    UNKNOWN;

    public static CheckOutcome of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }
}
