package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Arrays;

/**
 * Small rectangular array of real-valued weights used by {@link KernelMath}.
 * The anchor is ((rows - 1) / 2, (cols - 1) / 2): the center of an odd kernel, the
 * top-left element of a 2 x 2 one.
 */
public final class Kernel {

    private final int rows;
    private final int cols;
    private final float[] weights;

    private Kernel(int rows, int cols, float[] weights) {
        this.rows = rows;
        this.cols = cols;
        this.weights = weights;
    }

    public static Kernel of(double[][] values) {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new ValidationException("Kernel must have at least one weight");
        }
        int rows = values.length;
        int cols = values[0].length;
        float[] weights = new float[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (values[i].length != cols) {
                throw new ValidationException("Kernel row " + i + " has " + values[i].length + " weights, expected " + cols);
            }
            for (int j = 0; j < cols; j++) {
                weights[i * cols + j] = (float) values[i][j];
            }
        }
        return new Kernel(rows, cols, weights);
    }

    /**
     * Square kernel of uniform weight 1/(size*size).
     */
    public static Kernel box(int size) {
        float[] weights = new float[size * size];
        Arrays.fill(weights, 1.0f / (size * size));
        return new Kernel(size, size, weights);
    }

    /**
     * Square kernel sampling exp(-(dx^2 + dy^2) / (2 sigma^2)) at integer offsets from the
     * center, renormalized so the weights sum to 1.
     */
    public static Kernel gaussian(int size, double sigma) {
        int center = size / 2;
        double variance2 = 2.0 * sigma * sigma;
        if (!(variance2 > 0)) {
            // sigma too small to represent: the limit is all weight on the center
            return delta(size);
        }
        double[] raw = new double[size * size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int dy = i - center;
            for (int j = 0; j < size; j++) {
                int dx = j - center;
                double w = Math.exp(-(dx * dx + dy * dy) / variance2);
                raw[i * size + j] = w;
                sum += w;
            }
        }
        if (!(sum > 0) || Double.isInfinite(sum)) {
            return delta(size);
        }
        float[] weights = new float[size * size];
        for (int k = 0; k < raw.length; k++) {
            weights[k] = (float) (raw[k] / sum);
        }
        return new Kernel(size, size, weights);
    }

    /**
     * Square kernel with weight 1 at the center and 0 elsewhere.
     */
    public static Kernel delta(int size) {
        float[] weights = new float[size * size];
        weights[(size / 2) * size + size / 2] = 1.0f;
        return new Kernel(size, size, weights);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double weight(int row, int col) {
        return weights[row * cols + col];
    }

    /** Anchor column handed to filter2D. */
    int anchorX() {
        return (cols - 1) / 2;
    }

    /** Anchor row handed to filter2D. */
    int anchorY() {
        return (rows - 1) / 2;
    }

    public double sum() {
        double s = 0;
        for (float w : weights) {
            s += w;
        }
        return s;
    }

    /**
     * CV_32F copy of the weights. Caller must release.
     */
    Mat toMat() {
        OpenCvLoader.ensureLoaded();
        Mat mat = new Mat(rows, cols, CvType.CV_32F);
        mat.put(0, 0, weights);
        return mat;
    }
}
