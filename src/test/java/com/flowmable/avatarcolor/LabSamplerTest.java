package com.flowmable.avatarcolor;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class LabSamplerTest {

    @Test
    void opaquePixels_sampledInDecodeOrder() {
        double[] samples = LabSampler.sample(
                TestImages.fromArgb(2, 1, 0xFFFF0000, 0xFF0000FF), 128);

        assertEquals(6, samples.length);
        double[] red = ColorSpaceUtils.srgbToLab(0xFF0000);
        double[] blue = ColorSpaceUtils.srgbToLab(0x0000FF);
        assertArrayEquals(red, new double[]{samples[0], samples[1], samples[2]}, 1e-9);
        assertArrayEquals(blue, new double[]{samples[3], samples[4], samples[5]}, 1e-9);
    }

    @Test
    void alphaBelowThreshold_excluded() {
        double[] samples = LabSampler.sample(
                TestImages.fromArgb(3, 1, 0x7FFF0000, 0x80FF0000, 0x00FFFFFF), 128);

        assertEquals(3, samples.length, "Only the alpha=128 pixel should be kept");
    }

    @Test
    void fullyTransparent_noSamples() {
        assertEquals(0, LabSampler.sample(TestImages.fullyTransparent(16, 16), 128).length);
    }

    @Test
    void opaqueImageWithoutAlpha_allSampled() {
        BufferedImage rgb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        assertEquals(16 * 3, LabSampler.sample(rgb, 128).length);
    }
}
