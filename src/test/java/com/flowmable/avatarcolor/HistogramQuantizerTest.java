package com.flowmable.avatarcolor;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class HistogramQuantizerTest {

    private final HistogramQuantizer quantizer = new HistogramQuantizer();

    @Test
    void fullyTransparent_returnsDefault() {
        assertEquals(0x5865F2, quantizer.dominantColor(TestImages.fullyTransparent(32, 32)));
    }

    @Test
    void fullyTransparent_customDefault() {
        HistogramQuantizer custom = new HistogramQuantizer(128, 0x123456);
        assertEquals(0x123456, custom.dominantColor(TestImages.fullyTransparent(8, 8)));
    }

    @Test
    void invalidParameters_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new HistogramQuantizer(128, -1));
        assertThrows(IllegalArgumentException.class, () -> new HistogramQuantizer(128, 0x1000000));
        assertThrows(IllegalArgumentException.class, () -> new HistogramQuantizer(-1, 0x5865F2));
        assertThrows(IllegalArgumentException.class, () -> new HistogramQuantizer(256, 0x5865F2));
    }

    @Test
    void solidColor_returnsQuantizedValue() {
        assertEquals(0xF00000, quantizer.dominantColor(TestImages.solidColor(16, 16, 0xFF0000)));
        assertEquals(0x103050, quantizer.dominantColor(TestImages.solidColor(16, 16, 0x1A3B5C)));
    }

    @Test
    void nearbyShades_shareBucket() {
        // 30 + 30 pixels in the 0x10 bucket beat 50 pixels of mid gray
        int[] argb = new int[110];
        for (int i = 0; i < 30; i++) argb[i] = 0xFF101010;
        for (int i = 30; i < 60; i++) argb[i] = 0xFF1F1F1F;
        for (int i = 60; i < 110; i++) argb[i] = 0xFF808080;

        assertEquals(0x101010, quantizer.dominantColor(TestImages.fromArgb(110, 1, argb)));
    }

    @Test
    void alphaThreshold_isInclusive() {
        BufferedImage img = TestImages.fromArgb(3, 1, 0x7F00FF00, 0x7F00FF00, 0x80FF0000);
        assertEquals(0xF00000, quantizer.dominantColor(img));
    }

    @Test
    void ties_resolveToLowestPackedValue() {
        BufferedImage img = TestImages.fromArgb(2, 1, 0xFFFFFFFF, 0xFF000000);
        assertEquals(0x000000, quantizer.dominantColor(img));
    }

    @Test
    void opaqueRgbImage_counted() {
        BufferedImage img = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        assertEquals(0x000000, quantizer.dominantColor(img));
    }
}
