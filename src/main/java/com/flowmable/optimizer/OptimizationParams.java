package com.flowmable.optimizer;

/**
 * Per-image corrective parameters consumed by {@link TransformPipeline}.
 *
 * @param exposureAdjustment   Exposure shift in EV [-2, 2]
 * @param contrastAdjustment   Contrast multiplier around mid-gray [0.5, 1.5]
 * @param shadowLift           Shadow lift amount [0, 1]
 * @param highlightRecovery    Highlight compression amount [0, 1]
 * @param saturationAdjustment Saturation multiplier [0.5, 1.5]
 * @param sharpnessAmount      Unsharp mask amount [0, 2]
 * @param noiseReduction       Edge-preserving smoothing strength [0, 1]
 * @param skinToneProtection   Leave skin hues out of the saturation change
 */
public record OptimizationParams(
        double exposureAdjustment,
        double contrastAdjustment,
        double shadowLift,
        double highlightRecovery,
        double saturationAdjustment,
        double sharpnessAmount,
        double noiseReduction,
        boolean skinToneProtection
) {
    /** Parameters under which every transform step is skipped. */
    public static final OptimizationParams NEUTRAL =
            new OptimizationParams(0.0, 1.0, 0.0, 0.0, 1.0, 0.0, 0.0, false);

    public OptimizationParams {
        requireRange("exposureAdjustment", exposureAdjustment, -2.0, 2.0);
        requireRange("contrastAdjustment", contrastAdjustment, 0.5, 1.5);
        requireRange("shadowLift", shadowLift, 0.0, 1.0);
        requireRange("highlightRecovery", highlightRecovery, 0.0, 1.0);
        requireRange("saturationAdjustment", saturationAdjustment, 0.5, 1.5);
        requireRange("sharpnessAmount", sharpnessAmount, 0.0, 2.0);
        requireRange("noiseReduction", noiseReduction, 0.0, 1.0);
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(
                    name + " must be within [" + min + ", " + max + "], got " + value);
        }
    }
}
