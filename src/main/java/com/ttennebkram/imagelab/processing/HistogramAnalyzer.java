package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.model.Histogram;
import com.ttennebkram.imagelab.model.HistogramResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;

import java.util.ArrayList;
import java.util.List;

/**
 * Intensity distributions and their cumulative form.
 * Rendering the arrays as charts is left to the caller.
 */
public class HistogramAnalyzer {

    private static final String[] RGB_LABELS = {"r", "g", "b"};

    public HistogramResult analyze(Image image, HistogramType type) {
        return switch (type) {
            case GRAYSCALE -> grayscale(image);
            case RGB -> rgb(image);
        };
    }

    /**
     * Histogram and CDF of the luma plane.
     */
    public HistogramResult grayscale(Image image) {
        return HistogramResult.grayscale(histogram(Mats.luma(image), 0, "gray"));
    }

    /**
     * One histogram per channel, without grayscale conversion.
     * A single-channel image yields a single "gray" histogram.
     */
    public HistogramResult rgb(Image image) {
        List<Histogram> histograms = new ArrayList<>();
        if (image.channels() == 1) {
            histograms.add(histogram(image, 0, "gray"));
        } else {
            for (int c = 0; c < image.channels(); c++) {
                histograms.add(histogram(image, c, RGB_LABELS[c]));
            }
        }
        return HistogramResult.perChannel(histograms);
    }

    /**
     * Count occurrences of each level in one channel.
     */
    public Histogram histogram(Image image, int channel, String label) {
        long[] counts = new long[Histogram.BINS];
        byte[] samples = image.toByteArray();
        int channels = image.channels();
        for (int i = channel; i < samples.length; i += channels) {
            counts[samples[i] & 0xFF]++;
        }
        return new Histogram(label, counts);
    }
}
