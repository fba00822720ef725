package com.flowmable.avatarcolor;

import java.util.Locale;

/**
 * How many colors an extraction reports.
 */
public enum ExtractionMode {
    /** One color: the dominant cluster. */
    SINGLE,
    /** Primary and secondary colors, by cluster mass. */
    DUAL;

    /**
     * Parse a mode flag ({@code single} or {@code dual}, case-insensitive).
     */
    public static ExtractionMode fromFlag(String flag) {
        if (flag == null) {
            throw new IllegalArgumentException("Mode flag must not be null");
        }
        switch (flag.trim().toLowerCase(Locale.ROOT)) {
            case "single":
                return SINGLE;
            case "dual":
                return DUAL;
            default:
                throw new IllegalArgumentException("Unknown mode: " + flag + " (expected single or dual)");
        }
    }
}
