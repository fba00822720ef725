package com.flowmable.avatarcolor;

import java.awt.image.BufferedImage;

/**
 * Quantized-histogram mode estimator.
 * <p>
 * Each opaque pixel's channels are truncated to their high nibble ({@code c & 0xF0}),
 * giving 4096 buckets. The most populated bucket's quantized value is returned as-is;
 * equal counts resolve to the lowest packed value. Never fails: an image with no
 * opaque pixels yields the configured default color.
 */
public final class HistogramQuantizer {

    private static final int BUCKETS = 1 << 12;

    private final int alphaThreshold;
    private final int defaultColor;

    public HistogramQuantizer() {
        this(ExtractionSettings.DEFAULT.alphaThreshold(), ExtractionSettings.DEFAULT.defaultColor());
    }

    public HistogramQuantizer(int alphaThreshold, int defaultColor) {
        if (alphaThreshold < 0 || alphaThreshold > 255) {
            throw new IllegalArgumentException("alphaThreshold must be within [0, 255]: " + alphaThreshold);
        }
        if (!ColorIdentifiers.isValid(defaultColor)) {
            throw new IllegalArgumentException("defaultColor must be a 24-bit color: " + defaultColor);
        }
        this.alphaThreshold = alphaThreshold;
        this.defaultColor = defaultColor;
    }

    public int dominantColor(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        int[] argb = img.getRGB(0, 0, w, h, null, 0, w);

        int[] histogram = new int[BUCKETS];
        boolean any = false;
        for (int p : argb) {
            if ((p >>> 24) < alphaThreshold) continue;
            int bucket = ((p >> 12) & 0xF00) | ((p >> 8) & 0x0F0) | ((p >> 4) & 0x00F);
            histogram[bucket]++;
            any = true;
        }
        if (!any) {
            return defaultColor;
        }

        int best = 0;
        for (int i = 1; i < BUCKETS; i++) {
            if (histogram[i] > histogram[best]) {
                best = i;
            }
        }
        return ((best & 0xF00) << 12) | ((best & 0x0F0) << 8) | ((best & 0x00F) << 4);
    }
}
