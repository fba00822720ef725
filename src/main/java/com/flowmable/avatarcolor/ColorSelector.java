package com.flowmable.avatarcolor;

import java.util.List;

/**
 * Turns clustering or histogram output into the public {@link ExtractionResult}.
 */
public final class ColorSelector {

    private ColorSelector() {}

    /**
     * Select from clusters ranked by member count descending.
     *
     * @throws IllegalArgumentException if {@code ranked} is empty
     */
    public static ExtractionResult fromClusters(List<ColorCluster> ranked, ExtractionMode mode) {
        if (ranked.isEmpty()) {
            throw new IllegalArgumentException("No clusters to select from");
        }
        int primary = ranked.get(0).rgb();
        int secondary = primary;
        if (mode == ExtractionMode.DUAL && ranked.size() > 1) {
            secondary = ranked.get(1).rgb();
        }
        return new ExtractionResult(mode, primary, secondary, ExtractionResult.Source.CLUSTERING);
    }

    public static ExtractionResult fromHistogram(int color, ExtractionMode mode) {
        return new ExtractionResult(mode, color, color, ExtractionResult.Source.HISTOGRAM);
    }
}
