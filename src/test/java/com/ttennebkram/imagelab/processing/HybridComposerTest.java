package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.MismatchedDimensionsException;
import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.model.HybridResult;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.util.Mats;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HybridComposerTest {

    private final HybridComposer composer = new HybridComposer(new FrequencyFilterEngine());

    @Test
    void mismatchedDimensionsRejected() {
        Image a = TestImages.randomRgb(16, 16, 1L);
        Image b = TestImages.randomRgb(16, 20, 2L);
        assertThrows(MismatchedDimensionsException.class, () -> composer.compose(a, b, 30, 10));
        assertThrows(MismatchedDimensionsException.class,
                () -> composer.compose(a, Mats.luma(a), 30, 10));
    }

    @Test
    void sameImageAndCutoffReconstructsLuma() {
        Image image = TestImages.randomRgb(24, 24, 6L);
        HybridResult result = composer.compose(image, image, 6, 6);
        assertEquals(Mats.luma(image), result.hybrid());
    }

    @Test
    void highBandOfConstantImageIsMidGray() {
        Image flat = Image.filled(16, 16, 1, 90);
        HybridResult result = composer.compose(flat, flat, 3, 3);
        assertEquals(Image.filled(16, 16, 1, HybridComposer.MID_GRAY), result.highFrequency());
        assertEquals(flat, result.lowFrequency());
    }

    @Test
    void outputsAreSingleChannelOfInputSize() {
        Image a = TestImages.randomRgb(12, 18, 3L);
        Image b = TestImages.randomRgb(12, 18, 4L);
        HybridResult result = composer.compose(a, b, 5, 3);
        for (Image image : new Image[]{result.lowFrequency(), result.highFrequency(), result.hybrid()}) {
            assertEquals(12, image.rows());
            assertEquals(18, image.cols());
            assertEquals(1, image.channels());
        }
    }
}
