package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.FrequencyResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * Ideal low/high-pass filtering in the frequency domain.
 *
 * Pipeline: luma -> DFT -> shift zero frequency to (rows/2, cols/2) -> circular binary mask
 * -> inverse shift -> inverse DFT -> magnitude, rounded and clamped to [0, 255].
 * The transform is taken at the image's own size (no padding), so odd sizes are shifted
 * with fftshift semantics.
 */
public class FrequencyFilterEngine {

    public static final int DEFAULT_CUTOFF = 30;

    public FrequencyFilterEngine() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * Validate and return a processor that filters the luma and replicates it back to the
     * input's channel count, so a session keeps its shape.
     */
    public ImageProcessor processor(FrequencyFilterType type, int cutoff) {
        if (type == null) {
            throw new ValidationException("frequency filter type is required");
        }
        return input -> Mats.expandChannels(apply(input, type, cutoff).filtered(), input.channels());
    }

    /**
     * Filter the luma of an image. cutoff is clamped into [0, min(rows, cols) / 2].
     */
    public FrequencyResult apply(Image image, FrequencyFilterType type, int cutoff) {
        if (type == null) {
            throw new ValidationException("frequency filter type is required");
        }
        Mat src = Mats.toMat(image);
        Mat gray = null;
        Mat floatPlane = new Mat();
        Mat zeros = null;
        Mat complex = new Mat();
        Mat shifted = null;
        Mat mask = null;
        List<Mat> dftPlanes = new ArrayList<>();
        Mat masked = new Mat();
        Mat unshifted = null;
        Mat inverse = new Mat();
        List<Mat> inversePlanes = new ArrayList<>();
        Mat magnitude = new Mat();
        Mat output = new Mat();
        try {
            gray = Mats.luma(src);
            int rows = gray.rows();
            int cols = gray.cols();
            int radius = clampCutoff(cutoff, rows, cols);

            gray.convertTo(floatPlane, CvType.CV_32F);
            zeros = Mat.zeros(floatPlane.size(), CvType.CV_32F);
            List<Mat> planes = new ArrayList<>();
            planes.add(floatPlane);
            planes.add(zeros);
            Core.merge(planes, complex);

            Core.dft(complex, complex);
            shifted = circularShift(complex, rows / 2, cols / 2);
            Image spectrum = logSpectrum(shifted);

            mask = createMask(rows, cols, radius, type);
            Core.split(shifted, dftPlanes);
            Core.multiply(dftPlanes.get(0), mask, dftPlanes.get(0));
            Core.multiply(dftPlanes.get(1), mask, dftPlanes.get(1));
            Core.merge(dftPlanes, masked);
            Image filteredSpectrum = logSpectrum(masked);

            // inverse of fftshift moves by ceil(n / 2)
            unshifted = circularShift(masked, rows - rows / 2, cols - cols / 2);
            Core.idft(unshifted, inverse, Core.DFT_SCALE);
            Core.split(inverse, inversePlanes);
            Core.magnitude(inversePlanes.get(0), inversePlanes.get(1), magnitude);

            Core.min(magnitude, new Scalar(255), magnitude);
            Core.max(magnitude, new Scalar(0), magnitude);
            magnitude.convertTo(output, CvType.CV_8U);

            return new FrequencyResult(Mats.toImage(output), spectrum, maskImage(mask), filteredSpectrum, radius);
        } finally {
            Mats.release(dftPlanes);
            Mats.release(inversePlanes);
            Mats.release(src, gray, floatPlane, zeros, complex, shifted, mask, masked, unshifted,
                    inverse, magnitude, output);
        }
    }

    /**
     * Largest radius allowed is half the smaller dimension; negative radii become 0.
     */
    public static int clampCutoff(int cutoff, int rows, int cols) {
        int max = Math.min(rows, cols) / 2;
        return Math.max(0, Math.min(cutoff, max));
    }

    // ===== FFT Helper Methods =====

    /**
     * Roll a Mat by (dy, dx) with wrap-around: out[(y + dy) % rows][(x + dx) % cols] = in[y][x].
     * Caller must release the result.
     */
    static Mat circularShift(Mat input, int dy, int dx) {
        int rows = input.rows();
        int cols = input.cols();
        dy = ((dy % rows) + rows) % rows;
        dx = ((dx % cols) + cols) % cols;

        Mat output = new Mat(input.size(), input.type());
        int[] srcRowStarts = {0, rows - dy};
        int[] rowLengths = {rows - dy, dy};
        int[] dstRowStarts = {dy, 0};
        int[] srcColStarts = {0, cols - dx};
        int[] colLengths = {cols - dx, dx};
        int[] dstColStarts = {dx, 0};

        for (int r = 0; r < 2; r++) {
            if (rowLengths[r] == 0) continue;
            for (int c = 0; c < 2; c++) {
                if (colLengths[c] == 0) continue;
                Mat from = new Mat(input, new Rect(srcColStarts[c], srcRowStarts[r], colLengths[c], rowLengths[r]));
                Mat to = new Mat(output, new Rect(dstColStarts[c], dstRowStarts[r], colLengths[c], rowLengths[r]));
                from.copyTo(to);
                from.release();
                to.release();
            }
        }
        return output;
    }

    /**
     * Binary CV_32F mask centered on (rows/2, cols/2). LOW keeps distance <= radius,
     * HIGH keeps distance > radius. Caller must release.
     */
    static Mat createMask(int rows, int cols, int radius, FrequencyFilterType type) {
        int crow = rows / 2;
        int ccol = cols / 2;
        float[] maskData = new float[rows * cols];
        for (int y = 0; y < rows; y++) {
            int dy = y - crow;
            for (int x = 0; x < cols; x++) {
                int dx = x - ccol;
                double distance = Math.sqrt(dx * dx + dy * dy);
                boolean keep = switch (type) {
                    case LOW -> distance <= radius;
                    case HIGH -> distance > radius;
                };
                maskData[y * cols + x] = keep ? 1.0f : 0.0f;
            }
        }
        Mat mask = new Mat(rows, cols, CvType.CV_32F);
        mask.put(0, 0, maskData);
        return mask;
    }

    /**
     * log(1 + |F|) of a complex Mat, min/max scaled to [0, 255].
     */
    private static Image logSpectrum(Mat complex) {
        List<Mat> planes = new ArrayList<>();
        Mat magnitude = new Mat();
        Mat scaled = new Mat();
        try {
            Core.split(complex, planes);
            Core.magnitude(planes.get(0), planes.get(1), magnitude);
            Core.add(magnitude, Scalar.all(1), magnitude);
            Core.log(magnitude, magnitude);
            Core.normalize(magnitude, scaled, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
            return Mats.toImage(scaled);
        } finally {
            Mats.release(planes);
            Mats.release(magnitude, scaled);
        }
    }

    private static Image maskImage(Mat mask) {
        Mat scaled = new Mat();
        try {
            mask.convertTo(scaled, CvType.CV_8U, 255.0);
            return Mats.toImage(scaled);
        } finally {
            scaled.release();
        }
    }
}
