package com.flowmable.optimizer;

/**
 * Color space conversion utilities shared by analysis and transforms.
 * <p>
 * Provides 8-bit luma (Rec. 601 weights, as used for grayscale conversion),
 * normalized luminance on [0, 1] samples, and RGB ↔ HSV conversion with hue
 * in degrees.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // Rec. 601 luma weights
    static final double LUMA_R = 0.299;
    static final double LUMA_G = 0.587;
    static final double LUMA_B = 0.114;

    /**
     * 8-bit luma of an sRGB pixel (0–255 per channel).
     * Returns value in [0, 255].
     */
    public static int luma(int r, int g, int b) {
        return (int) Math.round(LUMA_R * r + LUMA_G * g + LUMA_B * b);
    }

    /**
     * Luminance of a normalized pixel (channels in [0, 1]).
     */
    public static double luminance(double r, double g, double b) {
        return LUMA_R * r + LUMA_G * g + LUMA_B * b;
    }

    /**
     * Convert normalized RGB (0–1 per channel) to HSV.
     *
     * @return [hue in degrees [0, 360), saturation [0, 1], value [0, 1]]
     */
    public static double[] rgbToHsv(double r, double g, double b) {
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;

        double h;
        if (delta == 0) {
            h = 0.0;
        } else if (max == r) {
            h = 60.0 * ((g - b) / delta);
        } else if (max == g) {
            h = 60.0 * ((b - r) / delta + 2.0);
        } else {
            h = 60.0 * ((r - g) / delta + 4.0);
        }
        if (h < 0) h += 360.0;

        double s = max == 0 ? 0.0 : delta / max;
        return new double[]{h, s, max};
    }

    /**
     * Convert 8-bit RGB to HSV.
     */
    public static double[] rgbToHsv(int r, int g, int b) {
        return rgbToHsv(r / 255.0, g / 255.0, b / 255.0);
    }

    /**
     * Convert HSV (hue in degrees) back to normalized RGB.
     */
    public static double[] hsvToRgb(double h, double s, double v) {
        if (s <= 0) {
            return new double[]{v, v, v};
        }
        double hh = (h % 360.0 + 360.0) % 360.0 / 60.0;
        int sector = (int) Math.floor(hh);
        double f = hh - sector;
        double p = v * (1.0 - s);
        double q = v * (1.0 - s * f);
        double t = v * (1.0 - s * (1.0 - f));

        return switch (sector) {
            case 0 -> new double[]{v, t, p};
            case 1 -> new double[]{q, v, p};
            case 2 -> new double[]{p, v, t};
            case 3 -> new double[]{p, q, v};
            case 4 -> new double[]{t, p, v};
            default -> new double[]{v, p, q};
        };
    }

    /**
     * Shortest angular distance between two hues, in degrees [0, 180].
     */
    public static double hueDistance(double h1, double h2) {
        double d = Math.abs(h1 - h2) % 360.0;
        return d > 180.0 ? 360.0 - d : d;
    }
}
