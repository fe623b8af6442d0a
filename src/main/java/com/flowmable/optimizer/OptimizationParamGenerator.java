package com.flowmable.optimizer;

import java.util.Objects;

/**
 * Stage 2: per-image parameter derivation.
 * <p>
 * Maps measured {@link ImageMetrics} to corrective {@link OptimizationParams},
 * biased by the run's {@link StylePreferences}. Pure and total: every input
 * range is already clamped by the analyzer, so there are no error cases.
 */
public class OptimizationParamGenerator {

    private static final double TARGET_CONTRAST = 0.65;
    private static final double TARGET_SATURATION = 1.0;
    private static final double TARGET_SHARPNESS = 0.65;

    private static final double NATURAL_EXPOSURE_GAIN = 0.5;
    private static final double STRONG_EXPOSURE_GAIN = 0.8;

    // Backlit shadow lift band
    private static final double BACKLIT_LIFT_BASE = 0.5;
    private static final double BACKLIT_LIFT_STEP = 0.15;
    private static final double BACKLIT_LIFT_MAX = 0.8;

    private static final double HIGHLIGHT_FLOOR = 0.1;
    private static final double BACKLIT_HIGHLIGHT_FLOOR = 0.12;
    private static final double STRONG_NOISE_REDUCTION = 0.5;
    private static final double SHARPNESS_CAP_UNDER_SMOOTHING = 0.6;

    // Gentleness ceilings applied with avoid_filter_look
    private static final double GENTLE_EXPOSURE = 1.0;
    private static final double GENTLE_MULTIPLIER_MIN = 0.8;
    private static final double GENTLE_MULTIPLIER_MAX = 1.2;
    private static final double GENTLE_SHARPNESS = 1.0;
    private static final double GENTLE_SHADOW_LIFT = 0.8;

    private final StylePreferences preferences;

    public OptimizationParamGenerator() {
        this(StylePreferences.DEFAULT);
    }

    public OptimizationParamGenerator(StylePreferences preferences) {
        this.preferences = Objects.requireNonNull(preferences, "style preferences must not be null");
    }

    /**
     * One-shot derivation for callers that do not keep a generator around.
     */
    public static OptimizationParams derive(ImageMetrics metrics, StylePreferences preferences) {
        return new OptimizationParamGenerator(preferences).generate(metrics);
    }

    /**
     * Derive the corrective parameters for one image.
     */
    public OptimizationParams generate(ImageMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics must not be null");

        double exposure = calculateExposure(metrics);
        double contrast = calculateContrast(metrics);
        double shadowLift = calculateShadowLift(metrics);
        double highlightRecovery = calculateHighlightRecovery(metrics);
        double saturation = calculateSaturation(metrics);
        double noiseReduction = calculateNoiseReduction(metrics);
        double sharpness = calculateSharpness(metrics, noiseReduction);
        boolean skinProtection = metrics.skinToneDetected() && preferences.stableSkinTones();

        // Highlight recovery and noise reduction protect detail and stay exempt
        if (preferences.avoidFilterLook()) {
            exposure = clamp(exposure, -GENTLE_EXPOSURE, GENTLE_EXPOSURE);
            contrast = clamp(contrast, GENTLE_MULTIPLIER_MIN, GENTLE_MULTIPLIER_MAX);
            saturation = clamp(saturation, GENTLE_MULTIPLIER_MIN, GENTLE_MULTIPLIER_MAX);
            sharpness = Math.min(sharpness, GENTLE_SHARPNESS);
            shadowLift = Math.min(shadowLift, GENTLE_SHADOW_LIFT);
        }

        return new OptimizationParams(
                exposure,
                contrast,
                shadowLift,
                highlightRecovery,
                saturation,
                sharpness,
                noiseReduction,
                skinProtection
        );
    }

    private double calculateExposure(ImageMetrics metrics) {
        double gain = preferences.naturalAppearance() ? NATURAL_EXPOSURE_GAIN : STRONG_EXPOSURE_GAIN;
        return clamp(-metrics.exposureLevel() * gain, -2.0, 2.0);
    }

    private double calculateContrast(ImageMetrics metrics) {
        double c = metrics.contrastLevel();
        double raise = preferences.naturalAppearance() ? 0.3 : 0.5;
        double lower = preferences.naturalAppearance() ? 0.2 : 0.4;
        double adjustment = c < TARGET_CONTRAST
                ? 1.0 + (TARGET_CONTRAST - c) * raise
                : 1.0 - (c - TARGET_CONTRAST) * lower;
        return clamp(adjustment, 0.5, 1.5);
    }

    private double calculateHighlightRecovery(ImageMetrics metrics) {
        double p = metrics.highlightClipPercent();
        double recovery;
        if (p > 10.0) {
            // Heavy clipping escalates regardless of preferences
            recovery = 0.8 + (p - 10.0) / 100.0;
        } else if (p > 5.0) {
            recovery = 0.5 + (p - 5.0) / 20.0;
            if (!preferences.preserveHighlights()) recovery *= 0.6;
        } else if (p > 1.0) {
            recovery = 0.2 + (p - 1.0) / 20.0;
            if (!preferences.preserveHighlights()) recovery *= 0.6;
        } else {
            recovery = 0.0;
        }

        if (preferences.preserveHighlights()) {
            recovery = Math.max(recovery, HIGHLIGHT_FLOOR);
        }
        // Backlit scenes that are not underexposed get their bright surround protected
        if (metrics.backlit() && metrics.exposureLevel() > -0.2) {
            recovery = Math.max(recovery, BACKLIT_HIGHLIGHT_FLOOR);
        }
        return clamp(recovery, 0.0, 1.0);
    }

    private double calculateShadowLift(ImageMetrics metrics) {
        double clip = metrics.shadowClipPercent();
        double lift;
        if (clip > 12.0) {
            lift = 0.4;
        } else if (clip > 6.0) {
            lift = 0.2;
        } else if (clip > 2.0) {
            lift = 0.1;
        } else {
            lift = 0.0;
        }
        if (preferences.naturalAppearance()) {
            lift *= 0.85;
        }

        if (metrics.backlit()) {
            double boost = BACKLIT_LIFT_BASE;
            if (metrics.exposureLevel() < -0.35) boost += BACKLIT_LIFT_STEP;
            if (clip > 10.0) boost += BACKLIT_LIFT_STEP;
            lift = Math.max(lift, clamp(boost, BACKLIT_LIFT_BASE, BACKLIT_LIFT_MAX));
        }

        // Flash already brightened the foreground
        if (metrics.captureMetadata().flashKnownFired()) {
            lift *= 0.5;
        }
        return clamp(lift, 0.0, 1.0);
    }

    private double calculateSaturation(ImageMetrics metrics) {
        double gain;
        if (metrics.skinToneDetected() && preferences.stableSkinTones()) {
            gain = 0.1;
        } else if (preferences.avoidFilterLook()) {
            gain = 0.2;
        } else {
            gain = 0.3;
        }
        return clamp(1.0 + (TARGET_SATURATION - metrics.saturationLevel()) * gain, 0.5, 1.5);
    }

    /**
     * Monotone in measured noise; with ISO metadata the measured noise selects a
     * position inside the ISO's band, and the bands are contiguous so a higher
     * ISO never yields less reduction.
     */
    private double calculateNoiseReduction(ImageMetrics metrics) {
        double base = metrics.noiseLevel();
        if (metrics.lowLight()) {
            base = Math.min(1.0, base * 1.2);
        }

        CaptureMetadata meta = metrics.captureMetadata();
        if (!meta.hasIso()) {
            return clamp(base, 0.0, 1.0);
        }
        double[] band = isoBand(meta.iso());
        return clamp(band[0] + (band[1] - band[0]) * base, 0.0, 1.0);
    }

    static double[] isoBand(int iso) {
        if (iso < 400) {
            return new double[]{0.0, 0.2};
        } else if (iso < 800) {
            return new double[]{0.2, 0.5};
        } else if (iso <= 1600) {
            return new double[]{0.5, 0.7};
        }
        return new double[]{0.7, 0.9};
    }

    private double calculateSharpness(ImageMetrics metrics, double noiseReduction) {
        double s = metrics.sharpnessScore();
        double amount = s < TARGET_SHARPNESS ? (TARGET_SHARPNESS - s) * 2.0 : 0.0;
        if (preferences.naturalAppearance()) {
            amount *= 0.7;
        }
        // Avoid re-amplifying what noise reduction removes
        if (noiseReduction >= STRONG_NOISE_REDUCTION) {
            amount = Math.min(amount * 0.5, SHARPNESS_CAP_UNDER_SMOOTHING);
        }
        return clamp(amount, 0.0, 2.0);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
