package com.flowmable.optimizer;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Immutable result of per-image quality analysis.
 * <p>
 * Every numeric field is already clamped to its declared range by
 * {@link ImageAnalyzer}, so downstream derivation has no error cases.
 *
 * @param exposureLevel        EV deviation from ideal midpoint exposure [-2, 2]
 * @param contrastLevel        Luminance spread [0, 1]
 * @param shadowClipPercent    Pixels at luma 0–5, percent [0, 100]
 * @param highlightClipPercent Pixels at luma 250–255, percent [0, 100]
 * @param saturationLevel      Mean HSV saturation scaled to [0, 2]
 * @param sharpnessScore       Normalized Laplacian variance [0, 1]
 * @param noiseLevel           High-frequency residual energy, ISO-adjusted [0, 1]
 * @param skinToneDetected     Whether enough skin-like pixels were found
 * @param skinToneHueRange     Observed skin hue sub-range; null when not detected
 * @param backlit              Center notably darker than the border
 * @param lowLight             Dark image or low-light capture settings
 * @param captureMetadata      Metadata the metrics were computed with (never null)
 */
public record ImageMetrics(
        double exposureLevel,
        double contrastLevel,
        double shadowClipPercent,
        double highlightClipPercent,
        double saturationLevel,
        double sharpnessScore,
        double noiseLevel,
        boolean skinToneDetected,
        HueRange skinToneHueRange,
        boolean backlit,
        boolean lowLight,
        @JsonIgnore CaptureMetadata captureMetadata
) {
    public ImageMetrics {
        if (captureMetadata == null) {
            captureMetadata = CaptureMetadata.EMPTY;
        }
        if (skinToneDetected != (skinToneHueRange != null)) {
            throw new IllegalArgumentException(
                    "skin tone hue range must be present exactly when skin tones are detected");
        }
    }
}
