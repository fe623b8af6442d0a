package com.flowmable.optimizer;

/**
 * The seven print-optimization transforms, declared in application order.
 * <p>
 * Every step works on an interleaved RGB float buffer with samples on [0, 1].
 * Pointwise steps update the buffer in place; spatial steps return a new
 * buffer. A step whose parameter is within {@link #IDENTITY_TOLERANCE} of its
 * identity value is not applied.
 * <p>
 * Tonal steps never clip a channel on its own. They apply one affine map to
 * all three channels of a pixel and scale it back toward identity where a
 * channel would leave [0, 1], which keeps every pixel's hue.
 */
public enum TransformStep {

    /** Multiplicative shift: channels × 2^ev, capped where the brightest channel reaches 1. */
    EXPOSURE {
        @Override
        public boolean isActive(OptimizationParams params) {
            return Math.abs(params.exposureAdjustment()) > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double factor = Math.pow(2.0, ctx.params().exposureAdjustment());
            for (int i = 0; i < rgb.length; i += 3) {
                applyHueSafe(rgb, i, factor, 0.0);
            }
            return rgb;
        }
    },

    /** Linear curve around mid-gray: (x - 0.5) × k + 0.5. */
    CONTRAST {
        @Override
        public boolean isActive(OptimizationParams params) {
            return Math.abs(params.contrastAdjustment() - 1.0) > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double k = ctx.params().contrastAdjustment();
            for (int i = 0; i < rgb.length; i += 3) {
                applyHueSafe(rgb, i, k, 0.5 * (1.0 - k));
            }
            return rgb;
        }
    },

    /** Adds amount × 0.3 × (1 - L)² to every channel, concentrated in the shadows. */
    SHADOW_LIFT {
        @Override
        public boolean isActive(OptimizationParams params) {
            return params.shadowLift() > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double strength = ctx.params().shadowLift() * SHADOW_LIFT_SCALE;
            for (int i = 0; i < rgb.length; i += 3) {
                double l = clamp01(luminance(rgb, i));
                applyHueSafe(rgb, i, 1.0, strength * (1.0 - l) * (1.0 - l));
            }
            return rgb;
        }
    },

    /**
     * Compresses luminance above the knee by 1 - 0.35 × amount. Channels are
     * scaled by the luminance ratio, so hue and saturation are kept and no
     * pixel gets brighter.
     */
    HIGHLIGHT_RECOVERY {
        @Override
        public boolean isActive(OptimizationParams params) {
            return params.highlightRecovery() > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double compression = 1.0 - HIGHLIGHT_COMPRESSION * ctx.params().highlightRecovery();
            for (int i = 0; i < rgb.length; i += 3) {
                double l = luminance(rgb, i);
                if (l <= HIGHLIGHT_KNEE) continue;
                double target = HIGHLIGHT_KNEE + (l - HIGHLIGHT_KNEE) * compression;
                float ratio = (float) (target / l);
                rgb[i] = clamp01(rgb[i] * ratio);
                rgb[i + 1] = clamp01(rgb[i + 1] * ratio);
                rgb[i + 2] = clamp01(rgb[i + 2] * ratio);
            }
            return rgb;
        }
    },

    /** HSV saturation × k; protected hues are identity-mapped when skin protection is on. */
    SATURATION {
        @Override
        public boolean isActive(OptimizationParams params) {
            return Math.abs(params.saturationAdjustment() - 1.0) > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double k = ctx.params().saturationAdjustment();
            boolean protect = ctx.params().skinToneProtection();
            HueRange protectedHues = ctx.protectedHues();
            for (int i = 0; i < rgb.length; i += 3) {
                double[] hsv = ColorSpaceUtils.rgbToHsv(rgb[i], rgb[i + 1], rgb[i + 2]);
                if (hsv[1] <= 0.0) continue;
                if (protect && protectedHues.contains(hsv[0])) continue;
                double[] out = ColorSpaceUtils.hsvToRgb(hsv[0], Math.min(1.0, hsv[1] * k), hsv[2]);
                rgb[i] = clamp01((float) out[0]);
                rgb[i + 1] = clamp01((float) out[1]);
                rgb[i + 2] = clamp01((float) out[2]);
            }
            return rgb;
        }
    },

    /**
     * Bilateral smoothing. Radius and color tolerance grow with the amount and
     * with ISO from {@value #ISO_RAMP_START} to {@value #ISO_RAMP_END}; the
     * strength used is recorded for sharpening.
     */
    NOISE_REDUCTION {
        @Override
        public boolean isActive(OptimizationParams params) {
            return params.noiseReduction() > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double amount = ctx.params().noiseReduction();
            double isoBoost = ctx.isoRamp(ISO_RAMP_START, ISO_RAMP_END);
            int radius = 1 + (int) Math.round(2.0 * amount) + (int) Math.round(ISO_EXTRA_RADIUS * isoBoost);
            double rangeSigma = (0.05 + 0.15 * amount) * (1.0 + ISO_SIGMA_GAIN * isoBoost);
            ctx.recordSmoothing(amount);
            return ImageFilters.bilateral(rgb, ctx.width(), ctx.height(), radius, rangeSigma);
        }
    },

    /**
     * Unsharp mask on luminance over a 5x5 Gaussian, halved after strong
     * smoothing. The detail is added equally to all three channels.
     */
    SHARPENING {
        @Override
        public boolean isActive(OptimizationParams params) {
            return params.sharpnessAmount() > IDENTITY_TOLERANCE;
        }

        @Override
        float[] apply(float[] rgb, TransformContext ctx) {
            double amount = ctx.params().sharpnessAmount();
            if (ctx.smoothingStrength() >= STRONG_SMOOTHING) {
                amount *= 0.5;
            }
            int pixels = rgb.length / 3;
            float[] luma = new float[pixels];
            for (int p = 0; p < pixels; p++) {
                luma[p] = (float) luminance(rgb, p * 3);
            }
            float[] blurred = ImageFilters.gaussianBlur5x5(luma, ctx.width(), ctx.height(), 1);
            for (int p = 0; p < pixels; p++) {
                applyHueSafe(rgb, p * 3, 1.0, amount * (luma[p] - blurred[p]));
            }
            return rgb;
        }
    };

    public static final double IDENTITY_TOLERANCE = 0.01;

    static final double SHADOW_LIFT_SCALE = 0.3;
    static final double HIGHLIGHT_KNEE = 0.7;
    static final double HIGHLIGHT_COMPRESSION = 0.35;
    static final int ISO_RAMP_START = 800;
    static final int ISO_RAMP_END = 3200;
    static final double ISO_EXTRA_RADIUS = 2.0;
    static final double ISO_SIGMA_GAIN = 0.5;
    static final double STRONG_SMOOTHING = 0.5;

    /**
     * Whether this step changes the image under {@code params}.
     */
    public abstract boolean isActive(OptimizationParams params);

    abstract float[] apply(float[] rgb, TransformContext ctx);

    /**
     * Maps the pixel at {@code i} through {@code x -> scale * x + offset} on all
     * three channels. Where a channel would leave [0, 1] the map is blended
     * toward identity just enough to land on the bound; the blended map is
     * still affine with equal coefficients, so hue is unchanged.
     */
    static void applyHueSafe(float[] rgb, int i, double scale, double offset) {
        double t = 1.0;
        for (int c = 0; c < 3; c++) {
            double x = rgb[i + c];
            double delta = (scale - 1.0) * x + offset;
            if (delta > 0.0) {
                t = Math.min(t, (1.0 - x) / delta);
            } else if (delta < 0.0) {
                t = Math.min(t, x / -delta);
            }
        }
        t = Math.max(0.0, t);
        for (int c = 0; c < 3; c++) {
            double x = rgb[i + c];
            rgb[i + c] = clamp01((float) (x + t * ((scale - 1.0) * x + offset)));
        }
    }

    private static double luminance(float[] rgb, int i) {
        return ColorSpaceUtils.luminance(rgb[i], rgb[i + 1], rgb[i + 2]);
    }

    private static float clamp01(float v) {
        return v < 0f ? 0f : (v > 1f ? 1f : v);
    }

    private static double clamp01(double v) {
        return v < 0.0 ? 0.0 : (v > 1.0 ? 1.0 : v);
    }
}
