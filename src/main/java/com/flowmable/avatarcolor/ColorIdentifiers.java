package com.flowmable.avatarcolor;

import java.util.Locale;

/**
 * Helpers for packed 24-bit {@code 0xRRGGBB} color identifiers.
 */
public final class ColorIdentifiers {

    /** Largest valid color identifier. */
    public static final int MAX_VALUE = 0xFFFFFF;

    private ColorIdentifiers() {}

    public static int pack(int r, int g, int b) {
        return (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
    }

    public static int red(int rgb) {
        return (rgb >> 16) & 0xFF;
    }

    public static int green(int rgb) {
        return (rgb >> 8) & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }

    public static boolean isValid(int rgb) {
        return rgb >= 0 && rgb <= MAX_VALUE;
    }

    /**
     * Format as {@code #RRGGBB}, uppercase.
     *
     * @throws IllegalArgumentException if the value does not fit in 24 bits
     */
    public static String toHexString(int rgb) {
        if (!isValid(rgb)) {
            throw new IllegalArgumentException("Not a 24-bit color: " + rgb);
        }
        return String.format(Locale.ROOT, "#%06X", rgb);
    }

    /**
     * Parse {@code #RRGGBB}, {@code RRGGBB} or {@code 0xRRGGBB}, or the
     * three-digit shorthand {@code #RGB}.
     *
     * @throws IllegalArgumentException if the input is not three or six hex digits
     */
    public static int parseHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Color hex must not be null");
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        } else if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        if (digits.length() == 3) {
            // Shorthand: #F0A -> #FF00AA
            char r = digits.charAt(0);
            char g = digits.charAt(1);
            char b = digits.charAt(2);
            digits = new String(new char[]{r, r, g, g, b, b});
        }
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Expected three or six hex digits: " + hex);
        }
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("Invalid hex color: " + hex);
            }
        }
        return Integer.parseInt(digits, 16);
    }

    private static int clamp(int channel) {
        return Math.min(255, Math.max(0, channel));
    }
}
