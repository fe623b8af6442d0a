package com.flowmable.optimizer;

/**
 * Spatial filters over float planes, shared by analysis and transforms.
 * <p>
 * Buffers are row-major with {@code channels} interleaved samples per pixel.
 * Borders are handled by clamping coordinates to the nearest edge pixel, so
 * every output sample is defined, including on images smaller than the kernel.
 */
final class ImageFilters {

    private ImageFilters() {}

    // 5x5 Gaussian Kernel (Sum = 256)
    private static final float[] GAUSSIAN_5X5 = {
            1,  4,  6,  4,  1,
            4, 16, 24, 16,  4,
            6, 24, 36, 24,  6,
            4, 16, 24, 16,  4,
            1,  4,  6,  4,  1
    };

    private static final int RANGE_LUT_SIZE = 512;

    static float[] gaussianBlur5x5(float[] input, int w, int h, int channels) {
        float[] output = new float[input.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                for (int c = 0; c < channels; c++) {
                    float sum = 0;
                    for (int ky = -2; ky <= 2; ky++) {
                        int sy = clamp(y + ky, h);
                        for (int kx = -2; kx <= 2; kx++) {
                            int sx = clamp(x + kx, w);
                            sum += input[(sy * w + sx) * channels + c] * GAUSSIAN_5X5[(ky + 2) * 5 + (kx + 2)];
                        }
                    }
                    output[(y * w + x) * channels + c] = sum / 256.0f;
                }
            }
        }
        return output;
    }

    /**
     * Edge-preserving smoothing of an interleaved RGB buffer.
     * <p>
     * Each neighbour within {@code radius} is weighted by its spatial distance and
     * by its RGB distance to the centre pixel; one weight is shared by all three
     * channels, so every output pixel is a convex mix of neighbouring colors.
     *
     * @param rgb         Interleaved RGB samples on [0, 1]
     * @param radius      Half window size, at least 1
     * @param rangeSigma  RGB distance at which a neighbour's weight falls to e^-0.5
     */
    static float[] bilateral(float[] rgb, int w, int h, int radius, double rangeSigma) {
        double spatialSigma = Math.max(1.0, radius / 2.0);
        int size = 2 * radius + 1;
        float[] spatial = new float[size * size];
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                spatial[(dy + radius) * size + (dx + radius)] =
                        (float) Math.exp(-(dx * dx + dy * dy) / (2.0 * spatialSigma * spatialSigma));
            }
        }

        // Range weights indexed by squared RGB distance; the maximum squared distance is 3
        float[] range = new float[RANGE_LUT_SIZE + 1];
        double lutScale = RANGE_LUT_SIZE / 3.0;
        for (int i = 0; i <= RANGE_LUT_SIZE; i++) {
            double d2 = i / lutScale;
            range[i] = (float) Math.exp(-d2 / (2.0 * rangeSigma * rangeSigma));
        }

        float[] output = new float[rgb.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int center = (y * w + x) * 3;
                float cr = rgb[center];
                float cg = rgb[center + 1];
                float cb = rgb[center + 2];
                float sumR = 0, sumG = 0, sumB = 0, sumW = 0;
                for (int dy = -radius; dy <= radius; dy++) {
                    int sy = clamp(y + dy, h);
                    for (int dx = -radius; dx <= radius; dx++) {
                        int sx = clamp(x + dx, w);
                        int idx = (sy * w + sx) * 3;
                        float r = rgb[idx];
                        float g = rgb[idx + 1];
                        float b = rgb[idx + 2];
                        float dr = r - cr, dg = g - cg, db = b - cb;
                        int bin = (int) Math.min(RANGE_LUT_SIZE, (dr * dr + dg * dg + db * db) * lutScale);
                        float weight = spatial[(dy + radius) * size + (dx + radius)] * range[bin];
                        sumR += r * weight;
                        sumG += g * weight;
                        sumB += b * weight;
                        sumW += weight;
                    }
                }
                // The centre pixel always contributes weight 1
                output[center] = sumR / sumW;
                output[center + 1] = sumG / sumW;
                output[center + 2] = sumB / sumW;
            }
        }
        return output;
    }

    private static int clamp(int v, int size) {
        return v < 0 ? 0 : (v >= size ? size - 1 : v);
    }
}
