package com.flowmable.avatarcolor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Top-level entry point for avatar color extraction.
 * <p>
 * Pipeline:
 * 1. Normalize: downscale so the longer side is at most 256 px.
 * 2. Sample: convert opaque pixels (alpha &ge; 128) to CIELAB.
 * 3. Cluster: k-means (k = 5, 20 passes) in Lab.
 * 4. Fallback: quantized histogram when clustering has no samples.
 * 5. Select: dominant color, or primary/secondary by cluster mass.
 * <p>
 * Instances are immutable and hold no per-call state, so one extractor can be
 * shared across threads. Every decoded image yields a color; only decoding can fail.
 */
public class AvatarColorExtractor {

    private static final Logger logger = LoggerFactory.getLogger(AvatarColorExtractor.class);

    private final ExtractionSettings settings;
    private final ImageNormalizer normalizer;
    private final KMeansClusterer clusterer;
    private final HistogramQuantizer quantizer;

    public AvatarColorExtractor() {
        this(ExtractionSettings.DEFAULT);
    }

    public AvatarColorExtractor(ExtractionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.normalizer = new ImageNormalizer(settings.maxDimension());
        this.clusterer = new KMeansClusterer(settings.clusterCount(), settings.iterations());
        this.quantizer = new HistogramQuantizer(settings.alphaThreshold(), settings.defaultColor());
    }

    public ExtractionSettings settings() {
        return settings;
    }

    /**
     * Decode raw image bytes (PNG, JPEG, GIF first frame, WEBP) and extract colors.
     *
     * @throws IOException if the bytes cannot be decoded as an image
     */
    public ExtractionResult extract(byte[] imageBytes, ExtractionMode mode) throws IOException {
        return extract(decode(imageBytes), mode);
    }

    public ExtractionResult extract(Path imageFile, ExtractionMode mode) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return extract(image, mode);
    }

    /**
     * Extract colors from an already decoded image. Never fails for a valid image.
     */
    public ExtractionResult extract(BufferedImage image, ExtractionMode mode) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(mode, "mode");

        // 1. Normalize
        BufferedImage img = normalizer.normalize(image);

        // 2. Sample opaque pixels in Lab
        double[] samples = LabSampler.sample(img, settings.alphaThreshold());

        // 3. Cluster
        List<ColorCluster> clusters = clusterer.cluster(samples);

        // 4. Select, falling back to the histogram on no result
        ExtractionResult result;
        if (clusters.isEmpty()) {
            logger.debug("No opaque samples in {}x{} image; using histogram fallback", img.getWidth(), img.getHeight());
            result = ColorSelector.fromHistogram(quantizer.dominantColor(img), mode);
        } else {
            result = ColorSelector.fromClusters(clusters, mode);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Extracted {} {} / {} via {} from {} samples",
                    mode, result.primaryHex(), result.secondaryHex(), result.source(), samples.length / 3);
        }
        return result;
    }

    /**
     * Histogram-only extraction: cheaper, without perceptual accuracy.
     */
    public ExtractionResult extractFast(BufferedImage image, ExtractionMode mode) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(mode, "mode");
        int color = quantizer.dominantColor(normalizer.normalize(image));
        return ColorSelector.fromHistogram(color, mode);
    }

    public int extractDominantColor(byte[] imageBytes) throws IOException {
        return extract(imageBytes, ExtractionMode.SINGLE).primary();
    }

    public int extractDominantColor(BufferedImage image) {
        return extract(image, ExtractionMode.SINGLE).primary();
    }

    public ExtractionResult extractDualColors(byte[] imageBytes) throws IOException {
        return extract(imageBytes, ExtractionMode.DUAL);
    }

    public ExtractionResult extractDualColors(BufferedImage image) {
        return extract(image, ExtractionMode.DUAL);
    }

    /**
     * Decode image bytes with whatever ImageIO readers are on the classpath.
     *
     * @throws IOException if no reader accepts the bytes
     */
    static BufferedImage decode(byte[] imageBytes) throws IOException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IOException("Failed to decode image: no data");
        }
        BufferedImage image;
        try (ByteArrayInputStream in = new ByteArrayInputStream(imageBytes)) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException("Failed to decode image: unsupported or corrupt data (" + imageBytes.length + " bytes)");
        }
        return image;
    }
}
