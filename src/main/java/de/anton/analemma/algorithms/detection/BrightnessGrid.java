package de.anton.analemma.algorithms.detection;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Objects;

/**
 * Single-channel brightness of an image, row-major. Colour pixels use the maximum of their
 * R, G and B samples; grayscale images are used as they are. Alpha is ignored.
 * Values are held as {@code float}, which is exact for 8 and 16 bit samples.
 */
public final class BrightnessGrid {

    /** Fraction of the maximum brightness a pixel needs to count as part of the Sun. */
    public static final double THRESHOLD_FRACTION = 0.999;

    private final int width;
    private final int height;
    private final float[] values;
    private final double maxValue;

    public BrightnessGrid(int width, int height, double[] values) {
        this(width, height, toFloats(width, height, values));
    }

    private BrightnessGrid(int width, int height, float[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            if (Float.isNaN(v)) throw new IllegalArgumentException("Brightness values cannot be NaN.");
            if (v > max) max = v;
        }
        this.maxValue = max;
    }

    private static float[] toFloats(int width, int height, double[] values) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive. Got: " + width + "x" + height);
        }
        Objects.requireNonNull(values, "Brightness values cannot be null.");
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        float[] result = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (float) values[i];
        }
        return result;
    }

    public static BrightnessGrid fromImage(BufferedImage image) {
        Objects.requireNonNull(image, "Image cannot be null.");
        int width = image.getWidth();
        int height = image.getHeight();
        float[] values = new float[width * height];

        if (image.getColorModel() instanceof IndexColorModel) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int rgb = image.getRGB(x, y);
                    values[y * width + x] = Math.max((rgb >> 16) & 0xFF, Math.max((rgb >> 8) & 0xFF, rgb & 0xFF));
                }
            }
            return new BrightnessGrid(width, height, values);
        }

        Raster raster = image.getRaster();
        int colorBands = raster.getNumBands() >= 3 ? 3 : 1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float brightness = raster.getSampleFloat(x, y, 0);
                for (int b = 1; b < colorBands; b++) {
                    brightness = Math.max(brightness, raster.getSampleFloat(x, y, b));
                }
                values[y * width + x] = brightness;
            }
        }
        return new BrightnessGrid(width, height, values);
    }

    // --- Getters ---
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public double getMaxValue() { return maxValue; }
    public int size() { return values.length; }

    public double get(int x, int y) { return values[y * width + x]; }
    double getAt(int index) { return values[index]; }

    public double getThreshold() { return maxValue * THRESHOLD_FRACTION; }

    /** Row-major mask of the pixels at or above {@link #getThreshold()}. */
    public boolean[] thresholdMask() {
        double threshold = getThreshold();
        boolean[] mask = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            mask[i] = values[i] >= threshold;
        }
        return mask;
    }
}
