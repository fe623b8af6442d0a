package com.flowmable.optimizer;

import java.util.Objects;

/**
 * Stage 1: per-image quality measurement.
 * <p>
 * Computes exposure, contrast, clipping, saturation, sharpness and noise from
 * 8-bit luma and HSV, detects skin tones, and classifies backlit and low-light
 * scenes. Capture metadata refines exposure, noise and low-light when present;
 * every field is optional and absence falls back to the image-only estimate.
 * <p>
 * Degenerate inputs (1x1, uniform, all-black, all-white) resolve to defined
 * neutral values. The analyzer holds no per-image state and may be shared
 * across threads.
 */
public class ImageAnalyzer {

    private static final int LUMA_LEVELS = 256;
    private static final double MIDPOINT = 0.5;
    private static final double EV_LIMIT = 2.0;

    private static final double CONTRAST_NORMALIZER = 128.0;
    private static final double SATURATION_SCALE = 2.0;
    private static final double SHARPNESS_NORMALIZER = 1000.0;
    private static final double NOISE_NORMALIZER = 20.0;
    private static final double ISO_NOISE_REFERENCE = 3200.0;

    // Center box spans 30%-70% of each axis; border bands are the outer 20%
    private static final double CENTER_START = 0.3;
    private static final double CENTER_END = 0.7;
    private static final double BORDER_FRACTION = 0.2;
    private static final int MIN_BACKLIT_SIDE = 5;

    private final AnalysisThresholds thresholds;

    public ImageAnalyzer() {
        this(AnalysisThresholds.DEFAULT);
    }

    public ImageAnalyzer(AnalysisThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    public ImageMetrics analyze(PixelArray pixels) {
        return analyze(pixels, CaptureMetadata.EMPTY);
    }

    /**
     * Analyze an image and its capture metadata.
     *
     * @param pixels   Decoded RGB image
     * @param metadata Capture metadata; {@code null} means none is available
     * @return Complete metrics record, every field within its declared range
     */
    public ImageMetrics analyze(PixelArray pixels, CaptureMetadata metadata) {
        Objects.requireNonNull(pixels, "pixels must not be null");
        CaptureMetadata meta = metadata != null ? metadata : CaptureMetadata.EMPTY;

        int w = pixels.width();
        int h = pixels.height();
        int totalPixels = pixels.pixelCount();

        // 1. Luma plane, histogram, HSV saturation and skin mask
        float[] luma = new float[totalPixels];
        int[] histogram = new int[LUMA_LEVELS];
        double lumaSum = 0;
        double saturationSum = 0;
        int skinCount = 0;
        double skinHueMin = Double.MAX_VALUE;
        double skinHueMax = -Double.MAX_VALUE;

        for (int i = 0; i < totalPixels; i++) {
            int r = pixels.sample(i, 0);
            int g = pixels.sample(i, 1);
            int b = pixels.sample(i, 2);

            int y = ColorSpaceUtils.luma(r, g, b);
            luma[i] = y;
            histogram[y]++;
            lumaSum += y;

            double[] hsv = ColorSpaceUtils.rgbToHsv(r, g, b);
            saturationSum += hsv[1];
            if (isSkinLike(hsv)) {
                skinCount++;
                skinHueMin = Math.min(skinHueMin, hsv[0]);
                skinHueMax = Math.max(skinHueMax, hsv[0]);
            }
        }
        double meanLuma = lumaSum / totalPixels;

        // 2. Exposure from the middle 50% of the histogram
        double exposure = calculateExposure(histogram, totalPixels, meta);

        // 3. Contrast and clipping
        double contrast = clamp(standardDeviation(luma, meanLuma) / CONTRAST_NORMALIZER, 0.0, 1.0);
        double shadowClip = 0;
        double highlightClip = 0;
        for (int v = 0; v < LUMA_LEVELS; v++) {
            if (v <= thresholds.shadowClipMax()) shadowClip += histogram[v];
            if (v >= thresholds.highlightClipMin()) highlightClip += histogram[v];
        }
        shadowClip = 100.0 * shadowClip / totalPixels;
        highlightClip = 100.0 * highlightClip / totalPixels;

        // 4. Saturation
        double saturation = clamp(saturationSum / totalPixels * SATURATION_SCALE, 0.0, 2.0);

        // 5. Sharpness and noise from the luma plane
        double sharpness = calculateSharpness(luma, w, h);
        double noise = calculateNoise(luma, w, h, meta);

        // 6. Skin tones
        double skinCoverage = 100.0 * skinCount / totalPixels;
        boolean skinDetected = skinCount >= thresholds.skinMinPixels()
                && skinCoverage > thresholds.skinCoverageMinPercent();
        HueRange skinRange = skinDetected ? new HueRange(skinHueMin, skinHueMax) : null;

        // 7. Scene classification
        boolean backlit = detectBacklit(luma, w, h);
        boolean lowLight = detectLowLight(meanLuma / 255.0, meta);

        return new ImageMetrics(
                exposure,
                contrast,
                clamp(shadowClip, 0.0, 100.0),
                clamp(highlightClip, 0.0, 100.0),
                saturation,
                sharpness,
                noise,
                skinDetected,
                skinRange,
                backlit,
                lowLight,
                meta
        );
    }

    /**
     * Histogram-weighted mean of the bins between the 25th and 75th percentile,
     * expressed as EV relative to mid-gray, shifted by recorded exposure bias.
     */
    private double calculateExposure(int[] histogram, int totalPixels, CaptureMetadata meta) {
        int lowBin = percentileBin(histogram, totalPixels * 0.25);
        int highBin = percentileBin(histogram, totalPixels * 0.75);

        double weighted = 0;
        long count = 0;
        for (int v = lowBin; v <= highBin; v++) {
            weighted += (double) v * histogram[v];
            count += histogram[v];
        }
        double baseline = count > 0 ? weighted / count / 255.0 : 0.0;

        double ev = baseline > 0 ? Math.log(baseline / MIDPOINT) / Math.log(2.0) : -EV_LIMIT;
        if (meta.hasExposureCompensation()) {
            ev += meta.exposureCompensation() * thresholds.exposureCompensationWeight();
        }
        if (Double.isNaN(ev)) {
            return 0.0;
        }
        return clamp(ev, -EV_LIMIT, EV_LIMIT);
    }

    private static int percentileBin(int[] histogram, double target) {
        long cumulative = 0;
        for (int v = 0; v < histogram.length; v++) {
            cumulative += histogram[v];
            if (cumulative >= target) {
                return v;
            }
        }
        return histogram.length - 1;
    }

    /**
     * Variance of the 4-neighbour Laplacian over interior pixels.
     */
    private double calculateSharpness(float[] luma, int w, int h) {
        if (w < 3 || h < 3) {
            return 0.0;
        }
        double sum = 0;
        double sumSq = 0;
        int count = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int idx = y * w + x;
                double lap = luma[idx - w] + luma[idx + w] + luma[idx - 1] + luma[idx + 1] - 4.0 * luma[idx];
                sum += lap;
                sumSq += lap * lap;
                count++;
            }
        }
        double mean = sum / count;
        double variance = Math.max(0.0, sumSq / count - mean * mean);
        return clamp(variance / SHARPNESS_NORMALIZER, 0.0, 1.0);
    }

    /**
     * Standard deviation of the high-frequency residual (luma minus its 5x5 blur),
     * amplified at high ISO where sensor noise dominates.
     */
    private double calculateNoise(float[] luma, int w, int h, CaptureMetadata meta) {
        float[] blurred = ImageFilters.gaussianBlur5x5(luma, w, h, 1);
        float[] residual = new float[luma.length];
        double sum = 0;
        for (int i = 0; i < luma.length; i++) {
            residual[i] = luma[i] - blurred[i];
            sum += residual[i];
        }
        double noise = standardDeviation(residual, sum / residual.length) / NOISE_NORMALIZER;

        if (meta.hasIso() && meta.iso() >= thresholds.highIso()) {
            noise *= 1.0 + Math.min(meta.iso() / ISO_NOISE_REFERENCE, 1.0);
        }
        return clamp(noise, 0.0, 1.0);
    }

    private boolean isSkinLike(double[] hsv) {
        return hsv[0] >= thresholds.skinHueMin() && hsv[0] <= thresholds.skinHueMax()
                && hsv[1] >= thresholds.skinSaturationMin() && hsv[1] <= thresholds.skinSaturationMax()
                && hsv[2] >= thresholds.skinValueMin();
    }

    private boolean detectBacklit(float[] luma, int w, int h) {
        if (Math.min(w, h) < MIN_BACKLIT_SIDE) {
            return false;
        }
        int cx0 = (int) (w * CENTER_START);
        int cx1 = (int) Math.ceil(w * CENTER_END);
        int cy0 = (int) (h * CENTER_START);
        int cy1 = (int) Math.ceil(h * CENTER_END);
        int bx0 = (int) Math.ceil(w * BORDER_FRACTION);
        int bx1 = w - bx0;
        int by0 = (int) Math.ceil(h * BORDER_FRACTION);
        int by1 = h - by0;

        double centerSum = 0;
        int centerCount = 0;
        double borderSum = 0;
        int borderCount = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = luma[y * w + x] / 255.0;
                if (x >= cx0 && x < cx1 && y >= cy0 && y < cy1) {
                    centerSum += v;
                    centerCount++;
                } else if (x < bx0 || x >= bx1 || y < by0 || y >= by1) {
                    borderSum += v;
                    borderCount++;
                }
            }
        }
        if (centerCount == 0 || borderCount == 0) {
            return false;
        }
        double center = centerSum / centerCount;
        double border = borderSum / borderCount;

        boolean darkerByMargin = border - center > thresholds.backlitMargin();
        // A black center is infinitely darker by ratio
        boolean darkerByRatio = center <= 0.0 || border / center > thresholds.backlitRatio();
        return darkerByMargin && darkerByRatio;
    }

    private boolean detectLowLight(double meanLuminance, CaptureMetadata meta) {
        if (meanLuminance < thresholds.lowLightLuminance()) {
            return true;
        }
        if (meta.hasIso() && meta.iso() >= thresholds.highIso()) {
            return true;
        }
        return meta.hasExposureTime() && meta.exposureTime() >= thresholds.slowShutterSeconds();
    }

    private static double standardDeviation(float[] values, double mean) {
        double sumSq = 0;
        for (float v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
