package com.flowmable.optimizer;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable height × width × 3 grid of 8-bit RGB samples.
 * <p>
 * Samples are stored interleaved, row-major: index {@code (y * width + x) * 3 + channel}.
 * The shape is validated on construction; an inconsistent shape is a caller error.
 */
public final class PixelArray {

    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final byte[] samples;

    /**
     * @param width   Image width, at least 1
     * @param height  Image height, at least 1
     * @param samples Interleaved RGB samples, exactly {@code width * height * 3} long (copied)
     * @throws IllegalArgumentException if the shape is inconsistent
     */
    public PixelArray(int width, int height, byte[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        checkShape(width, height, samples.length);
        this.width = width;
        this.height = height;
        this.samples = samples.clone();
    }

    private PixelArray(byte[] ownedSamples, int width, int height) {
        checkShape(width, height, ownedSamples.length);
        this.width = width;
        this.height = height;
        this.samples = ownedSamples;
    }

    private static void checkShape(int width, int height, int sampleCount) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                    "pixel array dimensions must be positive, got " + width + "x" + height);
        }
        long expected = (long) width * height * CHANNELS;
        if (sampleCount != expected) {
            throw new IllegalArgumentException(
                    "pixel array of " + width + "x" + height + " needs " + expected +
                    " samples, got " + sampleCount);
        }
    }

    /** Takes ownership of {@code samples} without copying. */
    static PixelArray wrap(int width, int height, byte[] samples) {
        return new PixelArray(samples, width, height);
    }

    public static PixelArray fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] data = new byte[w * h * CHANNELS];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                int idx = (y * w + x) * CHANNELS;
                data[idx] = (byte) ((rgb >> 16) & 0xFF);
                data[idx + 1] = (byte) ((rgb >> 8) & 0xFF);
                data[idx + 2] = (byte) (rgb & 0xFF);
            }
        }
        return wrap(w, h, data);
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int idx = (y * width + x) * CHANNELS;
                row[x] = ((samples[idx] & 0xFF) << 16)
                       | ((samples[idx + 1] & 0xFF) << 8)
                       | (samples[idx + 2] & 0xFF);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * @param index   Pixel index ({@code y * width + x})
     * @param channel 0 = red, 1 = green, 2 = blue
     * @return sample in [0, 255]
     */
    public int sample(int index, int channel) {
        return samples[index * CHANNELS + channel] & 0xFF;
    }

    public int sample(int x, int y, int channel) {
        return sample(y * width + x, channel);
    }

    public byte[] toByteArray() {
        return samples.clone();
    }

    /** Direct view for package-internal readers that never write to it. */
    byte[] samples() {
        return samples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelArray other)) return false;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelArray[" + width + "x" + height + "]";
    }
}
