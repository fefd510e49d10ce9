package io.trading.replica.config;

import java.util.Locale;

/**
 * Where merged books are published.
 */
public enum PublishSinkType {
    /** Latest payload per symbol kept in process */
    MEMORY,
    /** Aeron IPC stream, in addition to the in-process copy */
    AERON;

    public static PublishSinkType fromString(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("publish sink cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown publish sink: " + value, e);
        }
    }
}
