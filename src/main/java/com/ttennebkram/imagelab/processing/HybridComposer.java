package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.MismatchedDimensionsException;
import com.ttennebkram.imagelab.model.HybridResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Hybrid images: the low band of one image plus the high band of another.
 *
 * The high band (luma minus its own low-pass) is kept signed while summing, so equal
 * inputs with equal cutoffs reproduce the luma exactly. For display it is re-centered on
 * mid-gray and clamped. Stateless; sessions are never involved.
 */
public class HybridComposer {

    public static final int DEFAULT_CUTOFF_LOW = 30;
    public static final int DEFAULT_CUTOFF_HIGH = 10;

    /** Offset added to the signed high band for display. */
    public static final int MID_GRAY = 128;

    private final FrequencyFilterEngine frequencyFilterEngine;

    public HybridComposer(FrequencyFilterEngine frequencyFilterEngine) {
        OpenCvLoader.ensureLoaded();
        this.frequencyFilterEngine = frequencyFilterEngine;
    }

    /**
     * @throws MismatchedDimensionsException if the images differ in size or channel count
     */
    public HybridResult compose(Image image1, Image image2, int cutoffLow, int cutoffHigh) {
        if (!image1.sameShape(image2)) {
            throw new MismatchedDimensionsException(image1, image2);
        }

        Image lowFrequency = frequencyFilterEngine.apply(image1, FrequencyFilterType.LOW, cutoffLow).filtered();
        Image gray2 = Mats.luma(image2);
        Image lowOfSecond = frequencyFilterEngine.apply(image2, FrequencyFilterType.LOW, cutoffHigh).filtered();

        Mat low = Mats.toMat(lowFrequency);
        Mat second = Mats.toMat(gray2);
        Mat secondLow = Mats.toMat(lowOfSecond);
        Mat noMask = new Mat();
        Mat band = new Mat();
        Mat low16 = new Mat();
        Mat sum = new Mat();
        Mat centered = new Mat();
        Mat highDisplay = new Mat();
        Mat hybrid = new Mat();
        try {
            Core.subtract(second, secondLow, band, noMask, CvType.CV_16S);

            Core.add(band, Scalar.all(MID_GRAY), centered);
            centered.convertTo(highDisplay, CvType.CV_8U);

            low.convertTo(low16, CvType.CV_16S);
            Core.add(low16, band, sum);
            sum.convertTo(hybrid, CvType.CV_8U);

            return new HybridResult(lowFrequency, Mats.toImage(highDisplay), Mats.toImage(hybrid));
        } finally {
            Mats.release(low, second, secondLow, noMask, band, low16, sum, centered, highDisplay, hybrid);
        }
    }
}
