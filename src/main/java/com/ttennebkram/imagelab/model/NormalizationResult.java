package com.ttennebkram.imagelab.model;

/**
 * Normalized image in 8-bit storage form, plus the samples in the true [0, 1] range
 * when that range was requested.
 */
public final class NormalizationResult {

    private final Image image;
    private final float[] unitSamples;

    public NormalizationResult(Image image, float[] unitSamples) {
        this.image = image;
        this.unitSamples = unitSamples;
    }

    public Image image() {
        return image;
    }

    /**
     * Interleaved samples in [0, 1] (same layout as the image), or null if the
     * 0-255 range was requested.
     */
    public float[] unitSamples() {
        return unitSamples == null ? null : unitSamples.clone();
    }

    public boolean hasUnitSamples() {
        return unitSamples != null;
    }
}
