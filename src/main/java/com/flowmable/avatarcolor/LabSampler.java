package com.flowmable.avatarcolor;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Converts the opaque pixels of an image into CIELAB samples.
 * <p>
 * Pixels are visited in decode order (row-major). Pixels with alpha below the
 * threshold are background and are skipped entirely. The result is flattened as
 * {@code [L, a, b, L, a, b, ...]}, three doubles per sample.
 */
public final class LabSampler {

    private LabSampler() {}

    public static double[] sample(BufferedImage img, int alphaThreshold) {
        int w = img.getWidth();
        int h = img.getHeight();
        int[] argb = img.getRGB(0, 0, w, h, null, 0, w);

        double[] samples = new double[argb.length * 3];
        int count = 0;
        for (int p : argb) {
            int a = (p >>> 24);
            if (a < alphaThreshold) continue;

            double[] lab = ColorSpaceUtils.srgbToLab((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF);
            samples[count * 3] = lab[0];
            samples[count * 3 + 1] = lab[1];
            samples[count * 3 + 2] = lab[2];
            count++;
        }

        return count == argb.length ? samples : Arrays.copyOf(samples, count * 3);
    }
}
