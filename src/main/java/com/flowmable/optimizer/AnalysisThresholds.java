package com.flowmable.optimizer;

/**
 * Configurable thresholds for metric analysis and scene classification.
 * <p>
 * The highlight threshold is shared with {@link TransformPipeline} so that the
 * pipeline's highlight ceiling agrees with what the analyzer counts as clipped.
 *
 * @param shadowClipMax              Highest luma counted as shadow clipping
 * @param highlightClipMin           Lowest luma counted as highlight clipping
 * @param exposureCompensationWeight EV shift per EV of recorded exposure bias
 * @param skinHueMin                 Skin hue band lower bound (degrees)
 * @param skinHueMax                 Skin hue band upper bound (degrees)
 * @param skinHueMargin              Degrees added around a detected skin hue range when protecting it
 * @param skinSaturationMin          Lowest plausible skin saturation [0, 1]
 * @param skinSaturationMax          Highest plausible skin saturation [0, 1]
 * @param skinValueMin               Lowest plausible skin value [0, 1]
 * @param skinCoverageMinPercent     Skin pixels must exceed this share of the image
 * @param skinMinPixels              ...and number at least this many
 * @param lowLightLuminance          Mean luminance [0, 1] below which a scene is low-light
 * @param highIso                    ISO at or above which capture counts as low-light and noisy
 * @param slowShutterSeconds         Exposure time at or above which capture counts as low-light
 * @param backlitMargin              Border-minus-center luminance [0, 1] needed for backlit
 * @param backlitRatio               Border/center luminance ratio needed for backlit
 */
public record AnalysisThresholds(
        int shadowClipMax,
        int highlightClipMin,
        double exposureCompensationWeight,
        double skinHueMin,
        double skinHueMax,
        double skinHueMargin,
        double skinSaturationMin,
        double skinSaturationMax,
        double skinValueMin,
        double skinCoverageMinPercent,
        int skinMinPixels,
        double lowLightLuminance,
        int highIso,
        double slowShutterSeconds,
        double backlitMargin,
        double backlitRatio
) {
    public static final AnalysisThresholds DEFAULT = new AnalysisThresholds(
            5,            // shadowClipMax
            250,          // highlightClipMin
            0.5,          // exposureCompensationWeight
            0.0,          // skinHueMin
            50.0,         // skinHueMax
            5.0,          // skinHueMargin
            20.0 / 255.0, // skinSaturationMin
            170.0 / 255.0,// skinSaturationMax
            50.0 / 255.0, // skinValueMin
            5.0,          // skinCoverageMinPercent
            16,           // skinMinPixels
            0.3,          // lowLightLuminance
            800,          // highIso
            1.0 / 30.0,   // slowShutterSeconds
            0.15,         // backlitMargin
            1.5           // backlitRatio
    );

    public AnalysisThresholds {
        if (shadowClipMax < 0 || highlightClipMin > 255 || shadowClipMax >= highlightClipMin) {
            throw new IllegalArgumentException("clip thresholds must satisfy 0 <= shadow < highlight <= 255");
        }
        if (skinHueMin > skinHueMax) {
            throw new IllegalArgumentException("skin hue band is empty");
        }
        if (skinHueMargin < 0) {
            throw new IllegalArgumentException("skin hue margin must not be negative");
        }
    }

    public HueRange skinHueBand() {
        return new HueRange(skinHueMin, skinHueMax);
    }
}
