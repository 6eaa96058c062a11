package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

/**
 * Discrete convolution shared by every spatial operator.
 *
 * For each output pixel and channel: sum of src[clamp(y + dy)][clamp(x + dx)] * kernel[dy][dx]
 * over the kernel support, dy and dx measured from the kernel anchor (the center of an odd
 * kernel, the top-left of a 2 x 2 one). Out-of-range coordinates are clamped to the nearest
 * edge row/column (edge replication), so filters and edge detectors see identical borders.
 */
public final class KernelMath {

    /** Border policy used by every convolution-based operator. */
    public static final int BORDER_POLICY = Core.BORDER_REPLICATE;

    static {
        OpenCvLoader.ensureLoaded();
    }

    private KernelMath() {
    }

    /**
     * Convolve every channel independently; results are rounded to nearest and clamped to [0, 255].
     */
    public static Image convolve(Image image, Kernel kernel) {
        Mat src = Mats.toMat(image);
        Mat dst = null;
        try {
            dst = convolve(src, kernel, -1);
            return Mats.toImage(dst);
        } finally {
            Mats.release(src, dst);
        }
    }

    /**
     * Signed, unrounded CV_32F response of a single-channel plane. Caller must release.
     */
    public static Mat convolveFloat(Mat plane, Kernel kernel) {
        return convolve(plane, kernel, CvType.CV_32F);
    }

    private static Mat convolve(Mat src, Kernel kernel, int ddepth) {
        Mat k = kernel.toMat();
        Mat dst = new Mat();
        try {
            Point anchor = new Point(kernel.anchorX(), kernel.anchorY());
            Imgproc.filter2D(src, dst, ddepth, k, anchor, 0, BORDER_POLICY);
            return dst;
        } finally {
            k.release();
        }
    }
}
