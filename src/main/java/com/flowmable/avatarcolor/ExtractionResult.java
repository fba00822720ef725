package com.flowmable.avatarcolor;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction call.
 * <p>
 * In {@link ExtractionMode#SINGLE} mode {@code secondary} equals {@code primary}.
 * {@code primary} is always safe to apply on its own to a target that accepts a
 * single color.
 *
 * @param mode      Mode the extraction ran in
 * @param primary   Color of the largest cluster (or histogram mode)
 * @param secondary Color of the second-largest cluster, or {@code primary} if there is none
 * @param source    Strategy that produced the colors
 */
public record ExtractionResult(
        ExtractionMode mode,
        int primary,
        int secondary,
        Source source
) {
    public enum Source {
        /** k-means over Lab samples. */
        CLUSTERING,
        /** Quantized histogram, either as fallback or on request. */
        HISTOGRAM
    }

    public ExtractionResult {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(source, "source");
        if (!ColorIdentifiers.isValid(primary) || !ColorIdentifiers.isValid(secondary)) {
            throw new IllegalArgumentException("Colors must fit in 24 bits");
        }
    }

    /**
     * One color in single mode, (primary, secondary) in dual mode.
     */
    public List<Integer> colors() {
        return mode == ExtractionMode.SINGLE ? List.of(primary) : List.of(primary, secondary);
    }

    public boolean isUniform() {
        return primary == secondary;
    }

    public String primaryHex() {
        return ColorIdentifiers.toHexString(primary);
    }

    public String secondaryHex() {
        return ColorIdentifiers.toHexString(secondary);
    }
}
