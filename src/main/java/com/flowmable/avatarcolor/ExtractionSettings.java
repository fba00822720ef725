package com.flowmable.avatarcolor;

/**
 * Tunable parameters for the extraction pipeline.
 *
 * @param maxDimension   Larger image side after normalization, in pixels
 * @param clusterCount   Number of k-means clusters (k)
 * @param iterations     Maximum Lloyd iterations per clustering run
 * @param alphaThreshold Minimum alpha (0–255) for a pixel to count as opaque
 * @param defaultColor   Color returned when the image has no opaque content
 */
public record ExtractionSettings(
        int maxDimension,
        int clusterCount,
        int iterations,
        int alphaThreshold,
        int defaultColor
) {
    /** Blurple, returned for fully transparent images. */
    public static final int DEFAULT_COLOR = 0x5865F2;

    public static final ExtractionSettings DEFAULT = new ExtractionSettings(
            256,          // maxDimension
            5,            // clusterCount
            20,           // iterations
            128,          // alphaThreshold (50% opacity)
            DEFAULT_COLOR // defaultColor
    );

    public ExtractionSettings {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        if (clusterCount < 1) {
            throw new IllegalArgumentException("clusterCount must be positive: " + clusterCount);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        if (alphaThreshold < 0 || alphaThreshold > 255) {
            throw new IllegalArgumentException("alphaThreshold must be within [0, 255]: " + alphaThreshold);
        }
        if (!ColorIdentifiers.isValid(defaultColor)) {
            throw new IllegalArgumentException("defaultColor must be a 24-bit color: " + defaultColor);
        }
    }

    public ExtractionSettings withClusterCount(int k) {
        return new ExtractionSettings(maxDimension, k, iterations, alphaThreshold, defaultColor);
    }

    public ExtractionSettings withDefaultColor(int rgb) {
        return new ExtractionSettings(maxDimension, clusterCount, iterations, alphaThreshold, rgb);
    }
}
