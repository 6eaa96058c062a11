package com.ttennebkram.imagelab.model;

import java.util.Collections;
import java.util.List;

/**
 * Numeric histogram artifacts. Grayscale results carry one histogram and its CDF;
 * RGB results carry one histogram per channel and no CDF.
 */
public final class HistogramResult {

    private final List<Histogram> histograms;
    private final Cdf cdf;

    private HistogramResult(List<Histogram> histograms, Cdf cdf) {
        this.histograms = Collections.unmodifiableList(histograms);
        this.cdf = cdf;
    }

    public static HistogramResult grayscale(Histogram histogram) {
        return new HistogramResult(List.of(histogram), histogram.cdf());
    }

    public static HistogramResult perChannel(List<Histogram> histograms) {
        return new HistogramResult(List.copyOf(histograms), null);
    }

    public List<Histogram> histograms() {
        return histograms;
    }

    /** The single histogram of a grayscale result, or the first channel of an RGB one. */
    public Histogram histogram() {
        return histograms.get(0);
    }

    /** CDF of the grayscale histogram, or null for per-channel results. */
    public Cdf cdf() {
        return cdf;
    }

    public boolean hasCdf() {
        return cdf != null;
    }
}
