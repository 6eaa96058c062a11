package com.ttennebkram.imagelab.model;

/**
 * Cumulative distribution over the 256 intensity levels, values in [0, 1], non-decreasing.
 */
public final class Cdf {

    private final double[] values;

    Cdf(double[] values) {
        this.values = values;
    }

    public double at(int level) {
        return values[level];
    }

    public double[] values() {
        return values.clone();
    }
}
