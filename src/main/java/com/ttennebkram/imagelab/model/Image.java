package com.ttennebkram.imagelab.model;

import com.ttennebkram.imagelab.ValidationException;

import java.util.Arrays;

/**
 * Immutable 8-bit raster, row-major, interleaved channels.
 * Three-channel images hold samples in R, G, B order.
 *
 * Samples are copied on construction and on {@link #toByteArray()}, so an Image never
 * changes after it is built. Every processing step produces a new Image.
 */
public final class Image {

    private final int rows;
    private final int cols;
    private final int channels;
    private final byte[] data;

    private Image(int rows, int cols, int channels, byte[] data) {
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.data = data;
    }

    /**
     * Build an image from interleaved unsigned samples.
     *
     * @param rows     image height, at least 1
     * @param cols     image width, at least 1
     * @param channels 1 (grayscale) or 3 (RGB)
     * @param samples  rows * cols * channels samples, copied
     */
    public static Image of(int rows, int cols, int channels, byte[] samples) {
        validateShape(rows, cols, channels);
        if (samples == null || samples.length != rows * cols * channels) {
            throw new ValidationException("Expected " + (rows * cols * channels) + " samples for a "
                    + rows + "x" + cols + "x" + channels + " image, got "
                    + (samples == null ? "none" : String.valueOf(samples.length)));
        }
        return new Image(rows, cols, channels, samples.clone());
    }

    /**
     * Build a single-channel image from a 2D array of values in [0, 255].
     */
    public static Image ofGray(int[][] values) {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new ValidationException("Grayscale image needs at least one row and one column");
        }
        int rows = values.length;
        int cols = values[0].length;
        byte[] samples = new byte[rows * cols];
        for (int y = 0; y < rows; y++) {
            if (values[y].length != cols) {
                throw new ValidationException("Ragged row " + y + ": expected " + cols + " columns");
            }
            for (int x = 0; x < cols; x++) {
                samples[y * cols + x] = toSample(values[y][x]);
            }
        }
        return new Image(rows, cols, 1, samples);
    }

    /**
     * Build an image where every pixel has the same value in every channel.
     */
    public static Image filled(int rows, int cols, int channels, int value) {
        validateShape(rows, cols, channels);
        byte[] samples = new byte[rows * cols * channels];
        Arrays.fill(samples, toSample(value));
        return new Image(rows, cols, channels, samples);
    }

    private static void validateShape(int rows, int cols, int channels) {
        if (rows < 1 || cols < 1) {
            throw new ValidationException("Image dimensions must be positive: " + rows + "x" + cols);
        }
        if (channels != 1 && channels != 3) {
            throw new ValidationException("Unsupported channel count: " + channels + " (expected 1 or 3)");
        }
    }

    private static byte toSample(int value) {
        if (value < 0 || value > 255) {
            throw new ValidationException("Sample out of range [0, 255]: " + value);
        }
        return (byte) value;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int channels() {
        return channels;
    }

    public int pixelCount() {
        return rows * cols;
    }

    /**
     * Unsigned sample at (row, col, channel).
     */
    public int get(int row, int col, int channel) {
        return data[(row * cols + col) * channels + channel] & 0xFF;
    }

    /**
     * Unsigned sample at (row, col) of a single-channel image, or of channel 0.
     */
    public int get(int row, int col) {
        return get(row, col, 0);
    }

    /**
     * Copy of the interleaved samples.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Single channel extracted as an unsigned 2D array, mostly useful for inspection and tests.
     */
    public int[][] toArray(int channel) {
        int[][] out = new int[rows][cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                out[y][x] = get(y, x, channel);
            }
        }
        return out;
    }

    public boolean sameShape(Image other) {
        return other != null && rows == other.rows && cols == other.cols && channels == other.channels;
    }

    public String shape() {
        return rows + "x" + cols + "x" + channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Image)) return false;
        Image other = (Image) o;
        return sameShape(other) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = rows;
        result = 31 * result + cols;
        result = 31 * result + channels;
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "Image[" + shape() + "]";
    }
}
