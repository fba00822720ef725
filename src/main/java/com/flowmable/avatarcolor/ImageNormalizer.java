package com.flowmable.avatarcolor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Bounds the pixel count fed to clustering.
 * <p>
 * Images whose sides are both within {@code maxDimension} are returned as-is.
 * Larger images are scaled so the longer side equals {@code maxDimension},
 * preserving aspect ratio, with a separable Lanczos-3 filter. Filtering runs on
 * premultiplied alpha so transparent borders do not darken opaque edges.
 */
public class ImageNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ImageNormalizer.class);

    private static final int LANCZOS_LOBES = 3;

    private final int maxDimension;

    public ImageNormalizer() {
        this(ExtractionSettings.DEFAULT.maxDimension());
    }

    public ImageNormalizer(int maxDimension) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        this.maxDimension = maxDimension;
    }

    /**
     * Downscale {@code src} if either side exceeds the bound.
     *
     * @return {@code src} itself when no scaling is needed, otherwise a new ARGB image
     */
    public BufferedImage normalize(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        if (w <= maxDimension && h <= maxDimension) {
            return src;
        }

        // Integer math: w * (256.0 / w) can land just under the bound in floating point
        int nw;
        int nh;
        if (w >= h) {
            nw = maxDimension;
            nh = Math.max(1, (int) ((long) h * maxDimension / w));
        } else {
            nh = maxDimension;
            nw = Math.max(1, (int) ((long) w * maxDimension / h));
        }
        logger.debug("Downscaling {}x{} to {}x{}", w, h, nw, nh);

        // 1. Unpack into premultiplied float planes
        int[] argb = src.getRGB(0, 0, w, h, null, 0, w);
        float[][] planes = new float[4][w * h];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            float a = (p >>> 24) / 255f;
            planes[0][i] = (p >>> 24);
            planes[1][i] = ((p >> 16) & 0xFF) * a;
            planes[2][i] = ((p >> 8) & 0xFF) * a;
            planes[3][i] = (p & 0xFF) * a;
        }

        // 2. Horizontal then vertical pass
        float[][] horizontal = resampleRows(planes, w, h, nw);
        float[][] scaled = resampleColumns(horizontal, nw, h, nh);

        // 3. Un-premultiply and pack
        int[] out = new int[nw * nh];
        for (int i = 0; i < out.length; i++) {
            int a = toByte(scaled[0][i]);
            if (a == 0) {
                continue;
            }
            float unmul = 255f / a;
            int r = toByte(scaled[1][i] * unmul);
            int g = toByte(scaled[2][i] * unmul);
            int b = toByte(scaled[3][i] * unmul);
            out[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }

        BufferedImage dst = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_ARGB);
        dst.setRGB(0, 0, nw, nh, out, 0, nw);
        return dst;
    }

    private static float[][] resampleRows(float[][] src, int w, int h, int nw) {
        Kernel[] kernels = kernels(w, nw);
        float[][] dst = new float[src.length][nw * h];
        for (int c = 0; c < src.length; c++) {
            float[] in = src[c];
            float[] out = dst[c];
            for (int y = 0; y < h; y++) {
                int row = y * w;
                for (int x = 0; x < nw; x++) {
                    Kernel k = kernels[x];
                    double sum = 0;
                    for (int j = 0; j < k.weights.length; j++) {
                        sum += in[row + k.start + j] * k.weights[j];
                    }
                    out[y * nw + x] = (float) sum;
                }
            }
        }
        return dst;
    }

    private static float[][] resampleColumns(float[][] src, int w, int h, int nh) {
        Kernel[] kernels = kernels(h, nh);
        float[][] dst = new float[src.length][w * nh];
        for (int c = 0; c < src.length; c++) {
            float[] in = src[c];
            float[] out = dst[c];
            for (int y = 0; y < nh; y++) {
                Kernel k = kernels[y];
                for (int x = 0; x < w; x++) {
                    double sum = 0;
                    for (int j = 0; j < k.weights.length; j++) {
                        sum += in[(k.start + j) * w + x] * k.weights[j];
                    }
                    out[y * w + x] = (float) sum;
                }
            }
        }
        return dst;
    }

    /**
     * Normalized filter taps for each destination index along one axis.
     */
    private static Kernel[] kernels(int srcLen, int dstLen) {
        double ratio = (double) srcLen / dstLen;
        double filterScale = Math.max(1.0, ratio);
        double support = LANCZOS_LOBES * filterScale;

        Kernel[] kernels = new Kernel[dstLen];
        for (int i = 0; i < dstLen; i++) {
            double center = (i + 0.5) * ratio;
            int start = Math.max(0, (int) Math.floor(center - support));
            int end = Math.min(srcLen - 1, (int) Math.ceil(center + support));

            double[] weights = new double[end - start + 1];
            double total = 0;
            for (int j = start; j <= end; j++) {
                double wgt = lanczos((j + 0.5 - center) / filterScale);
                weights[j - start] = wgt;
                total += wgt;
            }
            if (total != 0) {
                for (int j = 0; j < weights.length; j++) {
                    weights[j] /= total;
                }
            } else {
                // Degenerate window; fall back to nearest sample
                int nearest = Math.min(srcLen - 1, Math.max(0, (int) center)) - start;
                weights[nearest] = 1.0;
            }
            kernels[i] = new Kernel(start, weights);
        }
        return kernels;
    }

    private static double lanczos(double x) {
        if (x == 0) return 1.0;
        if (x <= -LANCZOS_LOBES || x >= LANCZOS_LOBES) return 0.0;
        double px = Math.PI * x;
        return LANCZOS_LOBES * Math.sin(px) * Math.sin(px / LANCZOS_LOBES) / (px * px);
    }

    private static int toByte(float v) {
        return Math.min(255, Math.max(0, Math.round(v)));
    }

    private record Kernel(int start, double[] weights) {}
}
