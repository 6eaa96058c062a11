package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Cdf;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.model.NormalizationResult;
import com.ttennebkram.imagelab.util.Mats;
import com.ttennebkram.imagelab.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Histogram equalization, min/max normalization and luma conversion.
 */
public class EnhancementEngine {

    private final HistogramAnalyzer histogramAnalyzer;
    private final EqualizationMode equalizationMode;

    public EnhancementEngine(HistogramAnalyzer histogramAnalyzer, EqualizationMode equalizationMode) {
        OpenCvLoader.ensureLoaded();
        this.histogramAnalyzer = histogramAnalyzer;
        this.equalizationMode = equalizationMode;
    }

    public EnhancementEngine() {
        this(new HistogramAnalyzer(), EqualizationMode.PER_CHANNEL);
    }

    public EqualizationMode getEqualizationMode() {
        return equalizationMode;
    }

    /**
     * Validate and return a processor. range is only read for {@link EnhancementType#NORMALIZATION}.
     */
    public ImageProcessor processor(EnhancementType type, NormalizationRange range) {
        if (type == null) {
            throw new ValidationException("enhancement type is required");
        }
        if (type == EnhancementType.NORMALIZATION && range == null) {
            throw new ValidationException("range_type is required for normalization");
        }
        return switch (type) {
            case EQUALIZATION -> this::equalize;
            case NORMALIZATION -> input -> normalize(input, range).image();
            case GRAYSCALE -> this::grayscale;
        };
    }

    // ===== Equalization =====

    /**
     * Remap v -> round(255 * cdf[v]). Color images follow the configured {@link EqualizationMode}.
     */
    public Image equalize(Image image) {
        if (image.channels() == 1 || equalizationMode == EqualizationMode.PER_CHANNEL) {
            return equalizePerChannel(image);
        }
        return equalizeLuma(image);
    }

    private Image equalizePerChannel(Image image) {
        Mat src = Mats.toMat(image);
        List<Mat> planes = new ArrayList<>();
        List<Mat> mapped = new ArrayList<>();
        Mat output = new Mat();
        try {
            Core.split(src, planes);
            for (int c = 0; c < planes.size(); c++) {
                Cdf cdf = histogramAnalyzer.histogram(image, c, "c" + c).cdf();
                mapped.add(applyLut(planes.get(c), cdf));
            }
            Core.merge(mapped, output);
            return Mats.toImage(output);
        } finally {
            Mats.release(planes);
            Mats.release(mapped);
            Mats.release(src, output);
        }
    }

    private Image equalizeLuma(Image image) {
        Mat src = Mats.toMat(image);
        Mat yuv = new Mat();
        List<Mat> planes = new ArrayList<>();
        Mat merged = new Mat();
        Mat output = new Mat();
        try {
            Imgproc.cvtColor(src, yuv, Imgproc.COLOR_RGB2YUV);
            Core.split(yuv, planes);
            Mat luma = planes.get(0);
            Image lumaImage = Mats.toImage(luma);
            Cdf cdf = histogramAnalyzer.histogram(lumaImage, 0, "y").cdf();
            Mat equalized = applyLut(luma, cdf);
            planes.set(0, equalized);
            luma.release();
            Core.merge(planes, merged);
            Imgproc.cvtColor(merged, output, Imgproc.COLOR_YUV2RGB);
            return Mats.toImage(output);
        } finally {
            Mats.release(planes);
            Mats.release(src, yuv, merged, output);
        }
    }

    /**
     * Equalization lookup table for one channel. Caller must release the returned plane.
     */
    private Mat applyLut(Mat plane, Cdf cdf) {
        Mat lut = new Mat(1, 256, CvType.CV_8U);
        Mat out = new Mat();
        try {
            byte[] table = new byte[256];
            for (int v = 0; v < 256; v++) {
                table[v] = (byte) Math.round(255.0 * cdf.at(v));
            }
            lut.put(0, 0, table);
            Core.LUT(plane, lut, out);
            return out;
        } finally {
            lut.release();
        }
    }

    // ===== Normalization =====

    /**
     * Per-channel min/max stretch: new = (old - lo) / (hi - lo) * (max - min) + min.
     *
     * The stored image is 8-bit, so the 0-1 range is scaled back to [0, 255]; the true
     * [0, 1] samples come back separately in the result. A constant channel is left as it is
     * (its unit samples are value / 255).
     */
    public NormalizationResult normalize(Image image, NormalizationRange range) {
        int channels = image.channels();
        Mat src = Mats.toMat(image);
        List<Mat> planes = new ArrayList<>();
        List<Mat> stretched = new ArrayList<>();
        Mat output = new Mat();
        double[] lo = new double[channels];
        double[] hi = new double[channels];
        try {
            Core.split(src, planes);
            double storageScale = 255.0 / range.max();
            for (int c = 0; c < channels; c++) {
                Mat plane = planes.get(c);
                Core.MinMaxLocResult mm = Core.minMaxLoc(plane);
                lo[c] = mm.minVal;
                hi[c] = mm.maxVal;
                Mat out = new Mat();
                if (hi[c] == lo[c]) {
                    plane.copyTo(out);
                } else {
                    Core.normalize(plane, out, range.min() * storageScale, range.max() * storageScale,
                            Core.NORM_MINMAX, CvType.CV_8U);
                }
                stretched.add(out);
            }
            Core.merge(stretched, output);
            Image normalized = Mats.toImage(output);
            float[] unit = range == NormalizationRange.ZERO_TO_ONE ? unitSamples(image, lo, hi) : null;
            return new NormalizationResult(normalized, unit);
        } finally {
            Mats.release(planes);
            Mats.release(stretched);
            Mats.release(src, output);
        }
    }

    private static float[] unitSamples(Image image, double[] lo, double[] hi) {
        byte[] samples = image.toByteArray();
        int channels = image.channels();
        float[] unit = new float[samples.length];
        for (int i = 0; i < samples.length; i++) {
            int c = i % channels;
            int v = samples[i] & 0xFF;
            unit[i] = hi[c] == lo[c]
                    ? (float) (v / 255.0)
                    : (float) ((v - lo[c]) / (hi[c] - lo[c]));
        }
        return unit;
    }

    // ===== Grayscale =====

    /**
     * Luma conversion, single-channel output.
     */
    public Image grayscale(Image image) {
        return Mats.luma(image);
    }
}
