package com.ttennebkram.imagelab.model;

import java.util.Arrays;

/**
 * 256 intensity counts for one channel.
 */
public final class Histogram {

    public static final int BINS = 256;

    private final String channel;
    private final long[] counts;

    public Histogram(String channel, long[] counts) {
        if (counts == null || counts.length != BINS) {
            throw new IllegalArgumentException("Histogram needs exactly " + BINS + " bins");
        }
        for (long c : counts) {
            if (c < 0) {
                throw new IllegalArgumentException("Negative histogram count: " + c);
            }
        }
        this.channel = channel;
        this.counts = counts.clone();
    }

    /** Channel label: "gray", "r", "g" or "b". */
    public String channel() {
        return channel;
    }

    public long count(int level) {
        return counts[level];
    }

    public long[] counts() {
        return counts.clone();
    }

    public long total() {
        long sum = 0;
        for (long c : counts) {
            sum += c;
        }
        return sum;
    }

    /**
     * Running sum normalized by the total: cdf[i] = sum(counts[0..i]) / total.
     */
    public Cdf cdf() {
        double[] values = new double[BINS];
        long total = total();
        long running = 0;
        for (int i = 0; i < BINS; i++) {
            running += counts[i];
            values[i] = total == 0 ? 0.0 : (double) running / total;
        }
        return new Cdf(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Histogram)) return false;
        Histogram other = (Histogram) o;
        return channel.equals(other.channel) && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * channel.hashCode() + Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "Histogram[" + channel + ", total=" + total() + "]";
    }
}
