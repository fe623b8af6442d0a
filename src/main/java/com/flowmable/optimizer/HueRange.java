package com.flowmable.optimizer;

/**
 * Bounded interval of hue angles, in degrees.
 *
 * @param minHue Lower bound [0, 360)
 * @param maxHue Upper bound, at least {@code minHue}
 */
public record HueRange(double minHue, double maxHue) {

    public HueRange {
        if (Double.isNaN(minHue) || Double.isNaN(maxHue) || minHue > maxHue) {
            throw new IllegalArgumentException("invalid hue range [" + minHue + ", " + maxHue + "]");
        }
    }

    public boolean contains(double hue) {
        return hue >= minHue && hue <= maxHue;
    }

    /**
     * Range grown by {@code margin} degrees on both sides, kept within [0, 360].
     */
    public HueRange widen(double margin) {
        return new HueRange(Math.max(0.0, minHue - margin), Math.min(360.0, maxHue + margin));
    }
}
