package com.flowmable.optimizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorSpaceUtilsTest {

    @Test
    void luma_primariesAndExtremes() {
        assertEquals(0, ColorSpaceUtils.luma(0, 0, 0));
        assertEquals(255, ColorSpaceUtils.luma(255, 255, 255));
        assertEquals(76, ColorSpaceUtils.luma(255, 0, 0));
        assertEquals(150, ColorSpaceUtils.luma(0, 255, 0));
        assertEquals(29, ColorSpaceUtils.luma(0, 0, 255));
    }

    @Test
    void rgbToHsv_pureRed() {
        double[] hsv = ColorSpaceUtils.rgbToHsv(255, 0, 0);
        assertEquals(0.0, hsv[0], 1e-9);
        assertEquals(1.0, hsv[1], 1e-9);
        assertEquals(1.0, hsv[2], 1e-9);
    }

    @Test
    void rgbToHsv_grayHasNoSaturation() {
        double[] hsv = ColorSpaceUtils.rgbToHsv(128, 128, 128);
        assertEquals(0.0, hsv[1], 1e-9);
        assertEquals(128 / 255.0, hsv[2], 1e-9);
    }

    @Test
    void rgbToHsv_skinToneHueInSkinBand() {
        double[] hsv = ColorSpaceUtils.rgbToHsv(224, 172, 140);
        assertEquals(22.857, hsv[0], 0.01);
        assertEquals(0.375, hsv[1], 1e-9);
    }

    @Test
    void rgbToHsv_magentaWrapsBelow360() {
        double[] hsv = ColorSpaceUtils.rgbToHsv(255, 0, 128);
        assertTrue(hsv[0] > 300 && hsv[0] < 360, "Hue should wrap into [0, 360), got: " + hsv[0]);
    }

    @Test
    void hsvRoundTrip_preservesColor() {
        int[][] colors = {{224, 172, 140}, {30, 200, 90}, {12, 40, 230}, {250, 250, 10}, {90, 0, 160}};
        for (int[] c : colors) {
            double[] hsv = ColorSpaceUtils.rgbToHsv(c[0], c[1], c[2]);
            double[] rgb = ColorSpaceUtils.hsvToRgb(hsv[0], hsv[1], hsv[2]);
            assertEquals(c[0] / 255.0, rgb[0], 1e-9);
            assertEquals(c[1] / 255.0, rgb[1], 1e-9);
            assertEquals(c[2] / 255.0, rgb[2], 1e-9);
        }
    }

    @Test
    void hueDistance_takesShortestArc() {
        assertEquals(20.0, ColorSpaceUtils.hueDistance(350, 10), 1e-9);
        assertEquals(180.0, ColorSpaceUtils.hueDistance(0, 180), 1e-9);
        assertEquals(0.0, ColorSpaceUtils.hueDistance(45, 45), 1e-9);
    }
}
