package com.flowmable.avatarcolor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Lloyd's k-means over CIELAB samples.
 * <p>
 * Deterministic: seeds are every {@code ⌊N/k⌋}-th sample in decode order, a sample
 * equidistant from several centroids joins the lowest-indexed one, and ties in the
 * final ranking keep centroid order. A centroid that loses all its members stays
 * where it was.
 * <p>
 * Runs at most {@code iterations} passes. It stops early once a pass reassigns no
 * sample, since every further pass would reproduce the same centroids.
 */
public final class KMeansClusterer {

    private static final Logger logger = LoggerFactory.getLogger(KMeansClusterer.class);

    private final int k;
    private final int iterations;

    public KMeansClusterer() {
        this(ExtractionSettings.DEFAULT.clusterCount(), ExtractionSettings.DEFAULT.iterations());
    }

    public KMeansClusterer(int k, int iterations) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        }
        this.k = k;
        this.iterations = iterations;
    }

    /**
     * Cluster flattened Lab samples.
     *
     * @param samples {@code [L, a, b, L, a, b, ...]}, as produced by {@link LabSampler}
     * @return Non-empty clusters sorted by member count descending; empty when there are no samples
     */
    public List<ColorCluster> cluster(double[] samples) {
        if (samples.length % 3 != 0) {
            throw new IllegalArgumentException("Sample buffer length must be a multiple of 3: " + samples.length);
        }
        int n = samples.length / 3;
        if (n == 0) {
            return List.of();
        }

        // 1. Seed. With fewer samples than clusters, use each sample once.
        int seeds = Math.min(n, k);
        int stride = Math.max(1, n / k);
        double[] centroids = new double[seeds * 3];
        for (int c = 0; c < seeds; c++) {
            System.arraycopy(samples, c * stride * 3, centroids, c * 3, 3);
        }

        int[] assignments = new int[n];
        int[] counts = new int[seeds];
        double[] sums = new double[seeds * 3];

        for (int iter = 0; iter < iterations; iter++) {
            // 2. Assign each sample to its nearest centroid
            boolean changed = iter == 0;
            for (int i = 0; i < n; i++) {
                int closest = nearest(samples, i, centroids, seeds);
                if (assignments[i] != closest) {
                    assignments[i] = closest;
                    changed = true;
                }
            }
            if (!changed) {
                logger.trace("k-means converged after {} iterations", iter);
                break;
            }

            // 3. Move centroids to the mean of their members
            Arrays.fill(counts, 0);
            Arrays.fill(sums, 0.0);
            for (int i = 0; i < n; i++) {
                int c = assignments[i];
                sums[c * 3] += samples[i * 3];
                sums[c * 3 + 1] += samples[i * 3 + 1];
                sums[c * 3 + 2] += samples[i * 3 + 2];
                counts[c]++;
            }
            for (int c = 0; c < seeds; c++) {
                if (counts[c] == 0) continue; // empty: keep previous position
                centroids[c * 3] = sums[c * 3] / counts[c];
                centroids[c * 3 + 1] = sums[c * 3 + 1] / counts[c];
                centroids[c * 3 + 2] = sums[c * 3 + 2] / counts[c];
            }
        }

        // 4. Final membership, reported for non-empty clusters only
        Arrays.fill(counts, 0);
        for (int c : assignments) {
            counts[c]++;
        }

        List<ColorCluster> result = new ArrayList<>(seeds);
        for (int c = 0; c < seeds; c++) {
            if (counts[c] == 0) continue;
            result.add(ColorCluster.of(centroids[c * 3], centroids[c * 3 + 1], centroids[c * 3 + 2], counts[c], n));
        }

        // Stable sort keeps centroid order for equal counts
        result.sort(Comparator.comparingInt(ColorCluster::count).reversed());
        logger.debug("k-means produced {} non-empty clusters from {} samples", result.size(), n);
        return result;
    }

    private static int nearest(double[] samples, int i, double[] centroids, int seeds) {
        double l = samples[i * 3];
        double a = samples[i * 3 + 1];
        double b = samples[i * 3 + 2];
        double minDist = Double.MAX_VALUE;
        int closest = 0;
        for (int c = 0; c < seeds; c++) {
            double dist = ColorSpaceUtils.distanceSquared(l, a, b,
                    centroids[c * 3], centroids[c * 3 + 1], centroids[c * 3 + 2]);
            if (dist < minDist) {
                minDist = dist;
                closest = c;
            }
        }
        return closest;
    }
}
