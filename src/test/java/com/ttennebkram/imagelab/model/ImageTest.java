package com.ttennebkram.imagelab.model;

import com.ttennebkram.imagelab.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageTest {

    @Test
    void samplesAreCopiedOnTheWayInAndOut() {
        byte[] samples = {1, 2, 3, 4};
        Image image = Image.of(2, 2, 1, samples);
        samples[0] = 99;
        assertEquals(1, image.get(0, 0));

        byte[] out = image.toByteArray();
        out[1] = 99;
        assertEquals(2, image.get(0, 1));
    }

    @Test
    void interleavedRgbAccess() {
        Image image = Image.of(1, 2, 3, new byte[]{10, 20, 30, (byte) 200, (byte) 210, (byte) 220});
        assertEquals(20, image.get(0, 0, 1));
        assertEquals(220, image.get(0, 1, 2));
        assertEquals("1x2x3", image.shape());
    }

    @Test
    void rejectsWrongSampleCount() {
        assertThrows(ValidationException.class, () -> Image.of(2, 2, 3, new byte[4]));
    }

    @Test
    void rejectsUnsupportedChannelCount() {
        assertThrows(ValidationException.class, () -> Image.filled(2, 2, 4, 0));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(ValidationException.class, () -> Image.ofGray(new int[][]{{0, 256}}));
        assertThrows(ValidationException.class, () -> Image.ofGray(new int[][]{{0, 1}, {2}}));
    }

    @Test
    void equalityIsByShapeAndSamples() {
        Image a = Image.filled(3, 3, 1, 7);
        Image b = Image.ofGray(new int[][]{{7, 7, 7}, {7, 7, 7}, {7, 7, 7}});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Image.filled(3, 3, 3, 7));
        assertFalse(a.sameShape(Image.filled(3, 4, 1, 7)));
    }
}
