package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Image;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NoiseSynthesizerTest {

    private final NoiseSynthesizer noise = new NoiseSynthesizer(new Random(7));

    @Test
    void gaussianWithZeroSigmaIsIdentity() {
        Image image = TestImages.randomRgb(8, 8, 1L);
        assertEquals(image, noise.gaussian(image, 0, 0));
    }

    @Test
    void gaussianShiftsMeanAndKeepsShape() {
        Image image = Image.filled(64, 64, 1, 100);
        Image noisy = noise.gaussian(image, 20, 5);
        assertTrue(noisy.sameShape(image));
        assertEquals(120, TestImages.mean(noisy), 1.0);
    }

    @Test
    void gaussianSaturatesInsteadOfWrapping() {
        Image bright = Image.filled(32, 32, 1, 250);
        Image noisy = noise.gaussian(bright, 100, 1);
        assertEquals(255, TestImages.min(noisy));
    }

    @Test
    void uniformStaysWithinBounds() {
        Image image = Image.filled(32, 32, 3, 100);
        Image noisy = noise.uniform(image, -10, 10);
        assertTrue(TestImages.min(noisy) >= 90);
        assertTrue(TestImages.max(noisy) <= 110);
    }

    @Test
    void saltAndPepperRatioZeroIsIdentity() {
        Image image = TestImages.randomGray(10, 10, 5L);
        assertEquals(image, noise.saltAndPepper(image, 0));
    }

    @Test
    void saltAndPepperRatioOneReplacesEveryPixel() {
        Image image = Image.filled(16, 16, 3, 128);
        Image noisy = noise.saltAndPepper(image, 1.0);
        for (byte b : noisy.toByteArray()) {
            int v = b & 0xFF;
            assertTrue(v == 0 || v == 255, "unexpected sample " + v);
        }
        // channels of one pixel move together
        for (int y = 0; y < noisy.rows(); y++) {
            for (int x = 0; x < noisy.cols(); x++) {
                assertEquals(noisy.get(y, x, 0), noisy.get(y, x, 2));
            }
        }
    }

    @Test
    void saltProbabilityOneGivesOnlySalt() {
        Image noisy = noise.saltAndPepper(Image.filled(8, 8, 1, 128), 1.0, 1.0);
        assertEquals(255, TestImages.min(noisy));
    }

    @Test
    void sameSeedSameNoise() {
        Image image = TestImages.randomRgb(8, 8, 2L);
        Image a = new NoiseSynthesizer(new Random(42)).gaussian(image, 0, 25);
        Image b = new NoiseSynthesizer(new Random(42)).gaussian(image, 0, 25);
        assertEquals(a, b);
    }

    @Test
    void invalidParametersRejectedWhenProcessorIsBuilt() {
        assertThrows(ValidationException.class, () -> noise.gaussianProcessor(0, -1));
        assertThrows(ValidationException.class, () -> noise.gaussianProcessor(Double.NaN, 1));
        assertThrows(ValidationException.class, () -> noise.uniformProcessor(10, -10));
        assertThrows(ValidationException.class, () -> noise.saltAndPepperProcessor(1.5, 0.5));
        assertThrows(ValidationException.class, () -> noise.saltAndPepperProcessor(0.1, -0.1));
    }
}
