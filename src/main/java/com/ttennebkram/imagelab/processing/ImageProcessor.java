package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.model.Image;

/**
 * A validated, ready-to-run image transformation.
 * No session dependencies - just takes an Image and returns a new one.
 *
 * Instances are produced by the engines' factory methods, which check every parameter
 * up front; {@link #process} only fails on conditions that depend on the input image.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (never modified)
     * @return The processed output image
     */
    Image process(Image input);
}
