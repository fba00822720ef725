package com.flowmable.avatarcolor;

/**
 * Color space conversion between sRGB and CIELAB (D65 illuminant).
 * <p>
 * Both directions are pure functions. The inverse clamps each channel to the
 * encodable sRGB range instead of failing on out-of-gamut Lab values, so any
 * centroid can be turned back into a color identifier.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double LAB_EPSILON = 0.008856;
    private static final double LAB_KAPPA = 903.3;

    /**
     * Convert sRGB (0–255 per channel) to CIELAB [L*, a*, b*].
     */
    public static double[] srgbToLab(int r, int g, int b) {
        // 1. sRGB → linear RGB
        double rl = gammaExpand(r / 255.0);
        double gl = gammaExpand(g / 255.0);
        double bl = gammaExpand(b / 255.0);

        // 2. Linear RGB → XYZ (D65 illuminant)
        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        // 3. XYZ → Lab
        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return new double[]{L, a, bStar};
    }

    /**
     * Convert a packed {@code 0xRRGGBB} color to CIELAB.
     */
    public static double[] srgbToLab(int rgb) {
        return srgbToLab(ColorIdentifiers.red(rgb), ColorIdentifiers.green(rgb), ColorIdentifiers.blue(rgb));
    }

    /**
     * Convert CIELAB back to a packed {@code 0xRRGGBB} color.
     * Channels that fall outside the sRGB gamut are clamped independently to [0, 255].
     */
    public static int labToRgb(double L, double a, double bStar) {
        // 1. Lab → XYZ
        double fy = (L + 16.0) / 116.0;
        double fx = fy + a / 500.0;
        double fz = fy - bStar / 200.0;

        double x = XN * labFInverse(fx);
        double y = YN * labFInverse(fy);
        double z = ZN * labFInverse(fz);

        // 2. XYZ → linear RGB
        double rl = 3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
        double gl = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
        double bl = 0.0556434 * x - 0.2040259 * y + 1.0572252 * z;

        // 3. linear RGB → sRGB, clamped per channel
        return ColorIdentifiers.pack(toChannel(rl), toChannel(gl), toChannel(bl));
    }

    /**
     * Squared Euclidean distance in Lab. Monotonic in ΔE*ab, so it ranks
     * nearest centroids identically without the square root.
     */
    public static double distanceSquared(double L1, double a1, double b1,
                                         double L2, double a2, double b2) {
        double dL = L1 - L2;
        double da = a1 - a2;
        double db = b1 - b2;
        return dL * dL + da * da + db * db;
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double gammaCompress(double c) {
        return c <= 0.0031308 ? 12.92 * c : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    private static double labF(double t) {
        return t > LAB_EPSILON ? Math.cbrt(t) : (LAB_KAPPA * t + 16.0) / 116.0;
    }

    private static double labFInverse(double f) {
        double cube = f * f * f;
        return cube > LAB_EPSILON ? cube : (116.0 * f - 16.0) / LAB_KAPPA;
    }

    private static int toChannel(double linear) {
        if (Double.isNaN(linear) || linear <= 0.0) return 0;
        if (linear >= 1.0) return 255;
        long v = Math.round(gammaCompress(linear) * 255.0);
        return (int) Math.min(255, Math.max(0, v));
    }
}
