package com.ttennebkram.imagelab.util;

import com.ttennebkram.imagelab.model.Image;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Conversions between {@link Image} and OpenCV {@link Mat}, plus release helpers.
 *
 * Mats hold native memory, so every Mat created by a processing step is released
 * in a finally block once its samples have been copied out.
 */
public final class Mats {

    static {
        OpenCvLoader.ensureLoaded();
    }

    private Mats() {
    }

    /**
     * Copy an image into a new CV_8UC1 or CV_8UC3 Mat (channel order preserved, so RGB).
     * Caller must release.
     */
    public static Mat toMat(Image image) {
        Mat mat = new Mat(image.rows(), image.cols(), CvType.CV_8UC(image.channels()));
        mat.put(0, 0, image.toByteArray());
        return mat;
    }

    /**
     * Copy an 8-bit Mat with 1 or 3 channels into an Image. The Mat is not released.
     */
    public static Image toImage(Mat mat) {
        if (mat.depth() != CvType.CV_8U) {
            throw new IllegalArgumentException("Expected an 8-bit Mat, got " + CvType.typeToString(mat.type()));
        }
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] samples = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.get(0, 0, samples);
            return Image.of(continuous.rows(), continuous.cols(), continuous.channels(), samples);
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    /**
     * Luma plane (0.299R + 0.587G + 0.114B) of an RGB Mat, or a copy of a single-channel Mat.
     * Caller must release.
     */
    public static Mat luma(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_RGB2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }

    /**
     * Luma of an image as a single-channel image. Single-channel input is returned as is.
     */
    public static Image luma(Image image) {
        if (image.channels() == 1) {
            return image;
        }
        Mat rgb = toMat(image);
        Mat gray = null;
        try {
            gray = luma(rgb);
            return toImage(gray);
        } finally {
            release(rgb, gray);
        }
    }

    /**
     * Replicate a single-channel image into the requested channel count.
     */
    public static Image expandChannels(Image gray, int channels) {
        if (gray.channels() == channels) {
            return gray;
        }
        if (gray.channels() != 1 || channels != 3) {
            throw new IllegalArgumentException("Cannot expand " + gray.shape() + " to " + channels + " channels");
        }
        Mat src = toMat(gray);
        Mat rgb = new Mat();
        try {
            Imgproc.cvtColor(src, rgb, Imgproc.COLOR_GRAY2RGB);
            return toImage(rgb);
        } finally {
            release(src, rgb);
        }
    }

    /**
     * Release every non-null Mat.
     */
    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }

    public static void release(Iterable<Mat> mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }
}
