package com.flowmable.optimizer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Metric ranges, degenerate inputs, scene classification and metadata fallback.
 */
class ImageAnalyzerTest {

    private final ImageAnalyzer analyzer = new ImageAnalyzer();

    static void assertInRange(ImageMetrics m) {
        assertTrue(m.exposureLevel() >= -2.0 && m.exposureLevel() <= 2.0, "exposure: " + m.exposureLevel());
        assertTrue(m.contrastLevel() >= 0.0 && m.contrastLevel() <= 1.0, "contrast: " + m.contrastLevel());
        assertTrue(m.shadowClipPercent() >= 0.0 && m.shadowClipPercent() <= 100.0, "shadow: " + m.shadowClipPercent());
        assertTrue(m.highlightClipPercent() >= 0.0 && m.highlightClipPercent() <= 100.0, "highlight: " + m.highlightClipPercent());
        assertTrue(m.saturationLevel() >= 0.0 && m.saturationLevel() <= 2.0, "saturation: " + m.saturationLevel());
        assertTrue(m.sharpnessScore() >= 0.0 && m.sharpnessScore() <= 1.0, "sharpness: " + m.sharpnessScore());
        assertTrue(m.noiseLevel() >= 0.0 && m.noiseLevel() <= 1.0, "noise: " + m.noiseLevel());
        assertNotNull(m.captureMetadata());
        assertEquals(m.skinToneDetected(), m.skinToneHueRange() != null);
    }

    @Test
    void midGray_scenario() {
        ImageMetrics m = analyzer.analyze(TestImages.midGray());

        assertTrue(m.exposureLevel() >= -0.1 && m.exposureLevel() <= 0.1,
                "Mid-gray exposure should be near zero, got: " + m.exposureLevel());
        assertEquals(0.0, m.contrastLevel(), 1e-9);
        assertFalse(m.skinToneDetected());
        assertFalse(m.backlit());
        assertFalse(m.lowLight());
        assertEquals(0.0, m.shadowClipPercent());
        assertEquals(0.0, m.highlightClipPercent());
    }

    @Test
    void allMetricsInRange_forDegenerateAndRandomInputs() {
        List<PixelArray> images = List.of(
                TestImages.solid(1, 1, 0, 0, 0),
                TestImages.solid(1, 1, 255, 255, 255),
                TestImages.solid(1, 1, 224, 172, 140),
                TestImages.solid(2, 2, 10, 200, 30),
                TestImages.solid(50, 30, 0, 0, 0),
                TestImages.solid(50, 30, 255, 255, 255),
                TestImages.random(1, 7, 1L),
                TestImages.random(64, 64, 2L),
                TestImages.random(13, 3, 3L),
                TestImages.checkerboard(40, 40),
                TestImages.gradient(256, 4)
        );
        for (PixelArray image : images) {
            assertInRange(analyzer.analyze(image));
        }
    }

    @Test
    void allBlack_resolvesToDefinedValues() {
        ImageMetrics m = analyzer.analyze(TestImages.solid(20, 20, 0, 0, 0));

        assertEquals(-2.0, m.exposureLevel());
        assertEquals(100.0, m.shadowClipPercent());
        assertEquals(0.0, m.highlightClipPercent());
        assertEquals(0.0, m.saturationLevel());
        assertEquals(0.0, m.noiseLevel());
        assertTrue(m.lowLight());
        assertFalse(m.backlit(), "A uniform image has no darker center");
    }

    @Test
    void allWhite_isFullyClipped() {
        ImageMetrics m = analyzer.analyze(TestImages.solid(20, 20, 255, 255, 255));

        assertEquals(100.0, m.highlightClipPercent());
        assertEquals(1.0, m.exposureLevel(), 1e-9);
        assertFalse(m.lowLight());
    }

    @Test
    void singlePixel_hasNoSharpnessOrNoise() {
        ImageMetrics m = analyzer.analyze(TestImages.solid(1, 1, 90, 60, 30));

        assertEquals(0.0, m.sharpnessScore());
        assertEquals(0.0, m.noiseLevel());
        assertFalse(m.backlit());
        assertFalse(m.skinToneDetected(), "One pixel is below the minimum skin pixel count");
    }

    @Test
    void checkerboard_isSharperThanUniform() {
        ImageMetrics sharp = analyzer.analyze(TestImages.checkerboard(32, 32));
        ImageMetrics flat = analyzer.analyze(TestImages.solid(32, 32, 128, 128, 128));

        assertEquals(1.0, sharp.sharpnessScore(), 1e-9);
        assertEquals(0.0, flat.sharpnessScore(), 1e-9);
    }

    @Test
    void gradient_hasHigherContrastThanGray() {
        ImageMetrics ramp = analyzer.analyze(TestImages.gradient(256, 8));
        ImageMetrics gray = analyzer.analyze(TestImages.midGray());

        assertTrue(ramp.contrastLevel() > 0.5, "Full ramp should be contrasty, got: " + ramp.contrastLevel());
        assertTrue(ramp.contrastLevel() > gray.contrastLevel());
    }

    @Test
    void noisyImage_hasMeasurableNoise() {
        ImageMetrics noisy = analyzer.analyze(TestImages.noisyGray(64, 64, 128, 8, 7L));
        ImageMetrics clean = analyzer.analyze(TestImages.solid(64, 64, 128, 128, 128));

        assertTrue(noisy.noiseLevel() > 0.05, "Expected visible noise, got: " + noisy.noiseLevel());
        assertEquals(0.0, clean.noiseLevel(), 1e-9);
    }

    @Test
    void highIso_amplifiesNoise() {
        PixelArray image = TestImages.noisyGray(64, 64, 128, 8, 7L);
        ImageMetrics base = analyzer.analyze(image);
        ImageMetrics iso3200 = analyzer.analyze(image, CaptureMetadata.builder().iso(3200).build());
        ImageMetrics iso200 = analyzer.analyze(image, CaptureMetadata.builder().iso(200).build());

        assertTrue(iso3200.noiseLevel() > base.noiseLevel(),
                "ISO 3200 should raise noise: " + iso3200.noiseLevel() + " vs " + base.noiseLevel());
        assertEquals(base.noiseLevel(), iso200.noiseLevel(), 1e-12, "Low ISO leaves the image estimate alone");
    }

    @Test
    void skinPatch_isDetectedWithHueRange() {
        ImageMetrics m = analyzer.analyze(TestImages.skinPatch(100, 100, 60));

        assertTrue(m.skinToneDetected());
        HueRange range = m.skinToneHueRange();
        assertNotNull(range);
        assertEquals(22.857, range.minHue(), 0.01);
        assertEquals(22.857, range.maxHue(), 0.01);
    }

    @Test
    void tinySkinPatch_isNotDetected() {
        // 9 skin pixels out of 10,000
        ImageMetrics m = analyzer.analyze(TestImages.skinPatch(100, 100, 3));

        assertFalse(m.skinToneDetected());
        assertNull(m.skinToneHueRange());
    }

    @Test
    void fullCoverageButTooFewPixels_isNotDetected() {
        ImageMetrics nine = analyzer.analyze(TestImages.solid(3, 3, 224, 172, 140));
        ImageMetrics sixteen = analyzer.analyze(TestImages.solid(4, 4, 224, 172, 140));

        assertFalse(nine.skinToneDetected(), "Nine pixels are below the minimum count");
        assertTrue(sixteen.skinToneDetected());
    }

    @Test
    void saturatedBlue_isNotSkin() {
        ImageMetrics m = analyzer.analyze(TestImages.solid(40, 40, 30, 60, 220));

        assertFalse(m.skinToneDetected());
        assertTrue(m.saturationLevel() > 1.5, "Saturated blue should score high, got: " + m.saturationLevel());
    }

    @Test
    void darkCenterBrightBorder_isBacklit() {
        assertTrue(analyzer.analyze(TestImages.backlit(100, 100)).backlit());
        assertTrue(analyzer.analyze(TestImages.backlit(40, 30)).backlit());
    }

    @Test
    void uniformOrTinyImages_areNotBacklit() {
        assertFalse(analyzer.analyze(TestImages.midGray()).backlit());
        assertFalse(analyzer.analyze(TestImages.backlit(4, 4)).backlit());
    }

    @Test
    void lowLight_fromLuminanceOrMetadata() {
        PixelArray gray = TestImages.midGray();

        assertTrue(analyzer.analyze(TestImages.solid(30, 30, 40, 40, 40)).lowLight());
        assertTrue(analyzer.analyze(gray, CaptureMetadata.builder().iso(800).build()).lowLight());
        assertTrue(analyzer.analyze(gray, CaptureMetadata.builder().exposureTime(1.0 / 15).build()).lowLight());
        assertTrue(analyzer.analyze(gray, CaptureMetadata.builder().exposureTime(1.0 / 30).build()).lowLight());
        assertFalse(analyzer.analyze(gray, CaptureMetadata.builder().iso(100).exposureTime(1.0 / 250).build()).lowLight());
    }

    @Test
    void exposureCompensation_shiftsExposureLevel() {
        PixelArray gray = TestImages.midGray();
        double base = analyzer.analyze(gray).exposureLevel();
        double compensated = analyzer.analyze(gray,
                CaptureMetadata.builder().exposureCompensation(1.0).build()).exposureLevel();

        assertEquals(base + 0.5, compensated, 1e-9);
    }

    @Test
    void exposure_tracksBrightness() {
        double dark = analyzer.analyze(TestImages.solid(10, 10, 64, 64, 64)).exposureLevel();
        double mid = analyzer.analyze(TestImages.midGray()).exposureLevel();
        double bright = analyzer.analyze(TestImages.solid(10, 10, 220, 220, 220)).exposureLevel();

        assertEquals(-1.0, dark, 0.02);
        assertTrue(dark < mid && mid < bright);
    }

    @Test
    void nullOrPartialMetadata_neverThrows() {
        PixelArray image = TestImages.random(32, 24, 9L);
        ImageMetrics withNull = assertDoesNotThrow(() -> analyzer.analyze(image, null));
        ImageMetrics withEmpty = analyzer.analyze(image, CaptureMetadata.EMPTY);

        assertEquals(withEmpty, withNull);
        assertSame(CaptureMetadata.EMPTY, withNull.captureMetadata());

        List<CaptureMetadata> partial = List.of(
                CaptureMetadata.builder().flashFired(true).build(),
                CaptureMetadata.builder().iso(-5).build(),
                CaptureMetadata.builder().exposureTime(0.0).build(),
                CaptureMetadata.builder().exposureCompensation(Double.NaN).build(),
                CaptureMetadata.builder().exposureCompensation(40.0).sceneType("night").build(),
                CaptureMetadata.builder().meteringMode("spot").brightnessValue(-3.2).build()
        );
        for (CaptureMetadata meta : partial) {
            assertInRange(assertDoesNotThrow(() -> analyzer.analyze(image, meta)));
        }
    }

    @Test
    void nullPixels_isCallerError() {
        assertThrows(NullPointerException.class, () -> analyzer.analyze(null));
    }

    @Test
    void analysis_isDeterministic() {
        PixelArray image = TestImages.random(48, 32, 11L);
        CaptureMetadata meta = CaptureMetadata.builder().iso(1600).exposureTime(0.01).build();

        assertEquals(analyzer.analyze(image, meta), analyzer.analyze(image, meta));
    }

    @Test
    void differentImages_haveDifferentMetrics() {
        ImageMetrics gray = analyzer.analyze(TestImages.midGray());
        ImageMetrics backlit = analyzer.analyze(TestImages.backlit(100, 100));
        ImageMetrics skin = analyzer.analyze(TestImages.skinPatch(100, 100, 60));

        assertNotEquals(gray, backlit);
        assertNotEquals(gray, skin);
        assertNotEquals(backlit, skin);
    }
}
