package com.ttennebkram.imagelab.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HistogramTest {

    @Test
    void cdfIsNormalizedRunningSum() {
        long[] counts = new long[Histogram.BINS];
        counts[0] = 1;
        counts[10] = 2;
        counts[255] = 1;
        Histogram histogram = new Histogram("gray", counts);

        assertEquals(4, histogram.total());
        Cdf cdf = histogram.cdf();
        assertEquals(0.25, cdf.at(0), 1e-12);
        assertEquals(0.25, cdf.at(9), 1e-12);
        assertEquals(0.75, cdf.at(10), 1e-12);
        assertEquals(1.0, cdf.at(255), 1e-12);
    }

    @Test
    void cdfIsNonDecreasing() {
        long[] counts = new long[Histogram.BINS];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = (i * 37L) % 11;
        }
        double[] values = new Histogram("r", counts).cdf().values();
        for (int i = 1; i < values.length; i++) {
            assertTrue(values[i] >= values[i - 1]);
        }
        assertEquals(1.0, values[255], 1e-12);
    }

    @Test
    void rejectsWrongBinCount() {
        assertThrows(IllegalArgumentException.class, () -> new Histogram("gray", new long[10]));
    }
}
