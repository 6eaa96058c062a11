package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.EdgeResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Gradient-kernel edge operators and Canny edge tracing.
 * Every operator works on the luma plane and never modifies its input.
 */
public class EdgeDetector {

    static final Kernel SOBEL_X = Kernel.of(new double[][]{{-1, 0, 1}, {-2, 0, 2}, {-1, 0, 1}});
    static final Kernel SOBEL_Y = Kernel.of(new double[][]{{-1, -2, -1}, {0, 0, 0}, {1, 2, 1}});
    static final Kernel PREWITT_X = Kernel.of(new double[][]{{-1, 0, 1}, {-1, 0, 1}, {-1, 0, 1}});
    static final Kernel PREWITT_Y = Kernel.of(new double[][]{{-1, -1, -1}, {0, 0, 0}, {1, 1, 1}});
    static final Kernel ROBERTS_X = Kernel.of(new double[][]{{1, 0}, {0, -1}});
    static final Kernel ROBERTS_Y = Kernel.of(new double[][]{{0, 1}, {-1, 0}});

    public static final double DEFAULT_THRESHOLD1 = 100;
    public static final double DEFAULT_THRESHOLD2 = 200;

    public EdgeDetector() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * Run the requested operator. Thresholds are only read for {@link EdgeOperator#CANNY}.
     */
    public EdgeResult detect(Image image, EdgeOperator operator, double threshold1, double threshold2) {
        return switch (operator) {
            case SOBEL -> sobel(image);
            case PREWITT -> prewitt(image);
            case ROBERTS -> roberts(image);
            case CANNY -> canny(image, threshold1, threshold2);
        };
    }

    public EdgeResult sobel(Image image) {
        return gradient(image, SOBEL_X, SOBEL_Y);
    }

    public EdgeResult prewitt(Image image) {
        return gradient(image, PREWITT_X, PREWITT_Y);
    }

    public EdgeResult roberts(Image image) {
        return gradient(image, ROBERTS_X, ROBERTS_Y);
    }

    /**
     * Canny pipeline: Sobel gradients, non-maximum suppression, double threshold and
     * hysteresis linking from strong to connected weak edges. Output is 0/255.
     */
    public EdgeResult canny(Image image, double threshold1, double threshold2) {
        validateThresholds(threshold1, threshold2);
        Mat src = Mats.toMat(image);
        Mat gray = null;
        Mat edges = new Mat();
        try {
            gray = Mats.luma(src);
            Imgproc.Canny(gray, edges, threshold1, threshold2);
            return EdgeResult.single(Mats.toImage(edges));
        } finally {
            Mats.release(src, gray, edges);
        }
    }

    private EdgeResult gradient(Image image, Kernel kx, Kernel ky) {
        Mat src = Mats.toMat(image);
        Mat gray = null;
        Mat gx = null;
        Mat gy = null;
        Mat absX = new Mat();
        Mat absY = new Mat();
        Mat magnitude = new Mat();
        Mat magnitude8u = new Mat();
        try {
            gray = Mats.luma(src);
            gx = KernelMath.convolveFloat(gray, kx);
            gy = KernelMath.convolveFloat(gray, ky);

            // Display form of each gradient: |response| saturated to 8 bits
            Core.convertScaleAbs(gx, absX);
            Core.convertScaleAbs(gy, absY);

            Core.magnitude(gx, gy, magnitude);
            magnitude.convertTo(magnitude8u, CvType.CV_8U);

            return EdgeResult.multi(Mats.toImage(absX), Mats.toImage(absY), Mats.toImage(magnitude8u));
        } finally {
            Mats.release(src, gray, gx, gy, absX, absY, magnitude, magnitude8u);
        }
    }

    static void validateThresholds(double threshold1, double threshold2) {
        if (!Double.isFinite(threshold1) || !Double.isFinite(threshold2)) {
            throw new ValidationException("Canny thresholds must be finite numbers");
        }
        if (threshold1 < 0) {
            throw new ValidationException("threshold1 must be >= 0, got " + threshold1);
        }
        if (threshold1 >= threshold2) {
            throw new ValidationException("threshold1 must be lower than threshold2, got "
                    + threshold1 + " >= " + threshold2);
        }
    }
}
