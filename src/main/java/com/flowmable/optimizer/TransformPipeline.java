package com.flowmable.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Stage 3: the ordered transform chain.
 * <p>
 * Converts the input to a private float buffer, runs the active
 * {@link TransformStep}s in {@link #STEPS} order, and quantizes back to 8 bits.
 * The input is never mutated and the output has the input's exact dimensions.
 * <p>
 * Quantization carries a highlight ceiling: a pixel that was below the
 * clipping threshold in the source is rescaled to stay below it in the output,
 * so the output never has more clipped highlights than the input.
 */
public class TransformPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TransformPipeline.class);

    /** Application order. Each step's output is the next step's domain. */
    public static final List<TransformStep> STEPS = List.of(
            TransformStep.EXPOSURE,
            TransformStep.CONTRAST,
            TransformStep.SHADOW_LIFT,
            TransformStep.HIGHLIGHT_RECOVERY,
            TransformStep.SATURATION,
            TransformStep.NOISE_REDUCTION,
            TransformStep.SHARPENING
    );

    // Guarded pixels land two levels under the threshold so rounding cannot reach it
    private static final int HIGHLIGHT_HEADROOM = 2;

    private final AnalysisThresholds thresholds;

    public TransformPipeline() {
        this(AnalysisThresholds.DEFAULT);
    }

    public TransformPipeline(AnalysisThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    /**
     * Steps that will run for {@code params}, in application order.
     */
    public static List<TransformStep> activeSteps(OptimizationParams params) {
        Objects.requireNonNull(params, "params must not be null");
        return STEPS.stream().filter(step -> step.isActive(params)).toList();
    }

    public PixelArray apply(PixelArray pixels, OptimizationParams params) {
        return apply(pixels, params, null);
    }

    /**
     * Apply the chain using what analysis learned about the image.
     *
     * @param pixels  Source image (not modified)
     * @param params  Corrective parameters
     * @param metrics Metrics of {@code pixels}, or {@code null}. Supplies the
     *                detected skin hue range and the capture ISO.
     * @return New image of the same dimensions
     */
    public PixelArray apply(PixelArray pixels, OptimizationParams params, ImageMetrics metrics) {
        Objects.requireNonNull(pixels, "pixels must not be null");
        Objects.requireNonNull(params, "params must not be null");

        int w = pixels.width();
        int h = pixels.height();

        HueRange protectedHues = metrics != null && metrics.skinToneHueRange() != null
                ? metrics.skinToneHueRange().widen(thresholds.skinHueMargin())
                : thresholds.skinHueBand();
        Integer iso = metrics != null ? metrics.captureMetadata().iso() : null;
        TransformContext ctx = new TransformContext(w, h, params, iso, protectedHues);

        List<TransformStep> active = activeSteps(params);
        LOG.debug("apply: {}x{} running {}", w, h, active);
        if (active.isEmpty()) {
            return pixels;
        }

        byte[] source = pixels.samples();
        float[] rgb = new float[source.length];
        for (int i = 0; i < source.length; i++) {
            rgb[i] = (source[i] & 0xFF) / 255.0f;
        }

        for (TransformStep step : active) {
            rgb = step.apply(rgb, ctx);
        }

        return PixelArray.wrap(w, h, quantize(source, rgb));
    }

    private byte[] quantize(byte[] source, float[] rgb) {
        int clipLevel = thresholds.highlightClipMin();
        double ceiling = (clipLevel - HIGHLIGHT_HEADROOM) / 255.0;
        byte[] out = new byte[rgb.length];
        int guarded = 0;

        for (int i = 0; i < rgb.length; i += 3) {
            int r = toByte(rgb[i]);
            int g = toByte(rgb[i + 1]);
            int b = toByte(rgb[i + 2]);

            int sourceLuma = ColorSpaceUtils.luma(source[i] & 0xFF, source[i + 1] & 0xFF, source[i + 2] & 0xFF);
            if (sourceLuma < clipLevel && ColorSpaceUtils.luma(r, g, b) >= clipLevel) {
                double l = ColorSpaceUtils.luminance(rgb[i], rgb[i + 1], rgb[i + 2]);
                double scale = ceiling / l;
                r = toByte((float) (rgb[i] * scale));
                g = toByte((float) (rgb[i + 1] * scale));
                b = toByte((float) (rgb[i + 2] * scale));
                guarded++;
            }
            out[i] = (byte) r;
            out[i + 1] = (byte) g;
            out[i + 2] = (byte) b;
        }
        if (guarded > 0) {
            LOG.debug("quantize: held {} pixels below highlight clipping", guarded);
        }
        return out;
    }

    private static int toByte(float v) {
        int q = Math.round(v * 255.0f);
        return q < 0 ? 0 : (q > 255 ? 255 : q);
    }
}
