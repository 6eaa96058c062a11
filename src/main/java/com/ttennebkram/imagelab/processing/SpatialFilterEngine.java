package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Average, Gaussian and median smoothing.
 * All three return a constant image unchanged for any valid kernel size.
 */
public class SpatialFilterEngine {

    public static final int MIN_KERNEL_SIZE = 3;

    public SpatialFilterEngine() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * Validate the parameters and return a processor applying the filter.
     * sigma is only read for {@link SpatialFilterType#GAUSSIAN}.
     */
    public ImageProcessor processor(SpatialFilterType type, int kernelSize, double sigma) {
        validate(type, kernelSize, sigma);
        return input -> apply(input, type, kernelSize, sigma);
    }

    public Image apply(Image image, SpatialFilterType type, int kernelSize, double sigma) {
        validate(type, kernelSize, sigma);
        return switch (type) {
            case AVERAGE -> average(image, kernelSize);
            case GAUSSIAN -> gaussian(image, kernelSize, sigma);
            case MEDIAN -> median(image, kernelSize);
        };
    }

    public Image average(Image image, int kernelSize) {
        validateKernelSize(kernelSize);
        return KernelMath.convolve(image, Kernel.box(kernelSize));
    }

    public Image gaussian(Image image, int kernelSize, double sigma) {
        validateKernelSize(kernelSize);
        validateSigma(sigma);
        return KernelMath.convolve(image, Kernel.gaussian(kernelSize, sigma));
    }

    /**
     * Per-channel median of the k x k neighborhood. Imgproc.medianBlur replicates
     * border pixels, the same policy {@link KernelMath} uses.
     */
    public Image median(Image image, int kernelSize) {
        validateKernelSize(kernelSize);
        Mat src = Mats.toMat(image);
        Mat output = new Mat();
        try {
            Imgproc.medianBlur(src, output, kernelSize);
            return Mats.toImage(output);
        } finally {
            Mats.release(src, output);
        }
    }

    static void validate(SpatialFilterType type, int kernelSize, double sigma) {
        if (type == null) {
            throw new ValidationException("filter type is required");
        }
        validateKernelSize(kernelSize);
        if (type == SpatialFilterType.GAUSSIAN) {
            validateSigma(sigma);
        }
    }

    static void validateKernelSize(int kernelSize) {
        if (kernelSize < MIN_KERNEL_SIZE || kernelSize % 2 == 0) {
            throw new ValidationException("kernel_size must be odd and >= " + MIN_KERNEL_SIZE + ", got " + kernelSize);
        }
    }

    private static void validateSigma(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new ValidationException("sigma must be > 0 for a Gaussian filter, got " + sigma);
        }
    }
}
