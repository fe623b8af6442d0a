package com.flowmable.optimizer;

/**
 * Per-call state threaded through the transform steps of one image.
 * Created fresh by {@link TransformPipeline#apply} and never shared.
 */
final class TransformContext {

    private final int width;
    private final int height;
    private final OptimizationParams params;
    private final Integer iso;
    private final HueRange protectedHues;
    private double smoothingStrength;

    TransformContext(int width, int height, OptimizationParams params, Integer iso, HueRange protectedHues) {
        this.width = width;
        this.height = height;
        this.params = params;
        this.iso = iso;
        this.protectedHues = protectedHues;
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }

    OptimizationParams params() {
        return params;
    }

    /**
     * Position of the capture ISO between {@code low} and {@code high}, on [0, 1].
     * Unknown ISO counts as 0.
     */
    double isoRamp(int low, int high) {
        if (iso == null || iso <= low) {
            return 0.0;
        }
        return Math.min(1.0, (iso - low) / (double) (high - low));
    }

    HueRange protectedHues() {
        return protectedHues;
    }

    /** Strength the noise reduction step ran with; 0 when it was skipped. */
    double smoothingStrength() {
        return smoothingStrength;
    }

    void recordSmoothing(double strength) {
        this.smoothingStrength = strength;
    }
}
