package com.flowmable.avatarcolor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColorSelectorTest {

    private static ColorCluster cluster(int rgb, int count) {
        double[] lab = ColorSpaceUtils.srgbToLab(rgb);
        return ColorCluster.of(lab[0], lab[1], lab[2], count, 100);
    }

    @Test
    void singleMode_returnsDominantOnly() {
        ExtractionResult result = ColorSelector.fromClusters(
                List.of(cluster(0xFF0000, 70), cluster(0x0000FF, 30)), ExtractionMode.SINGLE);

        assertEquals(0xFF0000, result.primary());
        assertEquals(0xFF0000, result.secondary());
        assertEquals(List.of(0xFF0000), result.colors());
        assertEquals(ExtractionResult.Source.CLUSTERING, result.source());
    }

    @Test
    void dualMode_returnsTopTwo() {
        ExtractionResult result = ColorSelector.fromClusters(
                List.of(cluster(0xFF0000, 60), cluster(0x0000FF, 30), cluster(0x00FF00, 10)), ExtractionMode.DUAL);

        assertEquals(List.of(0xFF0000, 0x0000FF), result.colors());
        assertFalse(result.isUniform());
    }

    @Test
    void dualMode_singleCluster_secondaryEqualsPrimary() {
        ExtractionResult result = ColorSelector.fromClusters(List.of(cluster(0x00FF00, 100)), ExtractionMode.DUAL);

        assertEquals(0x00FF00, result.primary());
        assertEquals(0x00FF00, result.secondary());
        assertTrue(result.isUniform());
    }

    @Test
    void noClusters_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ColorSelector.fromClusters(List.of(), ExtractionMode.DUAL));
    }

    @Test
    void histogram_pairIsUniform() {
        ExtractionResult result = ColorSelector.fromHistogram(0x5865F2, ExtractionMode.DUAL);

        assertEquals(List.of(0x5865F2, 0x5865F2), result.colors());
        assertEquals(ExtractionResult.Source.HISTOGRAM, result.source());
        assertEquals("#5865F2", result.primaryHex());
        assertEquals("#5865F2", result.secondaryHex());
    }

    @Test
    void result_rejectsOutOfRangeColor() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExtractionResult(ExtractionMode.SINGLE, 0x1000000, 0, ExtractionResult.Source.HISTOGRAM));
    }
}
