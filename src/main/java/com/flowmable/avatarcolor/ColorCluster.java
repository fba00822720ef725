package com.flowmable.avatarcolor;

/**
 * One k-means cluster from a single extraction call.
 *
 * @param rgb    Centroid converted back to a packed {@code 0xRRGGBB} color
 * @param count  Number of samples assigned to this cluster
 * @param weight Coverage weight: count / total samples. Range [0, 1].
 * @param labL   Centroid CIELAB L* component
 * @param labA   Centroid CIELAB a* component
 * @param labB   Centroid CIELAB b* component
 */
public record ColorCluster(
        int rgb,
        int count,
        double weight,
        double labL, double labA, double labB
) {
    /**
     * Create a ColorCluster from a Lab centroid, auto-computing the sRGB identifier.
     */
    public static ColorCluster of(double labL, double labA, double labB, int count, int totalSamples) {
        int rgb = ColorSpaceUtils.labToRgb(labL, labA, labB);
        return new ColorCluster(rgb, count, (double) count / totalSamples, labL, labA, labB);
    }
}
