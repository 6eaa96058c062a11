package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.FrequencyResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyFilterEngineTest {

    private final FrequencyFilterEngine engine = new FrequencyFilterEngine();

    @Test
    void lowPassWithZeroCutoffKeepsOnlyTheMean() {
        Image image = TestImages.randomGray(32, 32, 21L);
        FrequencyResult result = engine.apply(image, FrequencyFilterType.LOW, 0);

        assertEquals(0, result.effectiveCutoff());
        assertTrue(TestImages.variance(result.filtered()) < TestImages.variance(image) / 100);
        assertEquals(TestImages.mean(image), TestImages.mean(result.filtered()), 1.0);
    }

    @Test
    void highPassWithMaxCutoffIsNearZero() {
        Image stripes = TestImages.cosineStripes(32, 32, 8);
        FrequencyResult result = engine.apply(stripes, FrequencyFilterType.HIGH, 1000);

        assertEquals(16, result.effectiveCutoff());
        assertTrue(TestImages.max(result.filtered()) <= 1);
    }

    @Test
    void lowPassPreservesLowFrequencyPattern() {
        Image stripes = TestImages.cosineStripes(32, 32, 16);
        Image filtered = engine.apply(stripes, FrequencyFilterType.LOW, 8).filtered();
        for (int x = 0; x < 32; x++) {
            assertEquals(stripes.get(10, x), filtered.get(10, x), 1);
        }
    }

    @Test
    void artifactsShareTheImageSize() {
        Image image = TestImages.randomRgb(15, 21, 3L);
        FrequencyResult result = engine.apply(image, FrequencyFilterType.HIGH, 4);

        assertEquals(1, result.filtered().channels());
        for (Image artifact : new Image[]{result.spectrum(), result.mask(), result.filteredSpectrum()}) {
            assertEquals(15, artifact.rows());
            assertEquals(21, artifact.cols());
        }
        // high-pass mask blocks the center and passes the corners
        assertEquals(0, result.mask().get(15 / 2, 21 / 2));
        assertEquals(255, result.mask().get(0, 0));
    }

    @Test
    void processorKeepsChannelCount() {
        Image image = TestImages.randomRgb(16, 16, 5L);
        Image output = engine.processor(FrequencyFilterType.LOW, 5).process(image);
        assertTrue(output.sameShape(image));
        assertEquals(output.get(3, 3, 0), output.get(3, 3, 2));
    }

    @Test
    void cutoffIsClamped() {
        assertEquals(0, FrequencyFilterEngine.clampCutoff(-5, 40, 60));
        assertEquals(20, FrequencyFilterEngine.clampCutoff(100, 40, 60));
        assertEquals(12, FrequencyFilterEngine.clampCutoff(12, 40, 60));
    }

    @Test
    void typeIsRequired() {
        assertThrows(ValidationException.class, () -> engine.processor(null, 10));
    }

    @Test
    void circularShiftRoundTripsOddSizes() {
        int rows = 3;
        int cols = 5;
        Mat input = new Mat(rows, cols, CvType.CV_32F);
        float[] values = new float[rows * cols];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        input.put(0, 0, values);

        Mat shifted = FrequencyFilterEngine.circularShift(input, rows / 2, cols / 2);
        Mat restored = FrequencyFilterEngine.circularShift(shifted, rows - rows / 2, cols - cols / 2);
        try {
            // element (0, 0) moves to (rows / 2, cols / 2)
            assertEquals(0.0, shifted.get(1, 2)[0], 0.0);
            assertEquals(values[rows * cols - 1], (float) shifted.get(0, 1)[0], 0.0f);

            float[] back = new float[values.length];
            restored.get(0, 0, back);
            assertArrayEquals(values, back);
        } finally {
            Mats.release(input, shifted, restored);
        }
    }
}
