package com.ttennebkram.imagelab;

import com.ttennebkram.imagelab.model.Image;

/**
 * Two images that must share a shape do not. No implicit resize is attempted.
 */
public class MismatchedDimensionsException extends ImageLabException {

    public MismatchedDimensionsException(Image first, Image second) {
        super("Image dimensions differ: " + first.shape() + " vs " + second.shape());
    }
}
