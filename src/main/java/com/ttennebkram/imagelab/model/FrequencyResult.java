package com.ttennebkram.imagelab.model;

/**
 * Frequency-domain filter output plus inspection artifacts.
 * Only {@link #filtered()} is ever stored on a session.
 */
public final class FrequencyResult {

    private final Image filtered;
    private final Image spectrum;
    private final Image mask;
    private final Image filteredSpectrum;
    private final int effectiveCutoff;

    public FrequencyResult(Image filtered, Image spectrum, Image mask, Image filteredSpectrum, int effectiveCutoff) {
        this.filtered = filtered;
        this.spectrum = spectrum;
        this.mask = mask;
        this.filteredSpectrum = filteredSpectrum;
        this.effectiveCutoff = effectiveCutoff;
    }

    /** Filtered luma, single channel. */
    public Image filtered() {
        return filtered;
    }

    /** log(1 + |F|) of the unfiltered, center-shifted transform, scaled to [0, 255]. */
    public Image spectrum() {
        return spectrum;
    }

    /** Binary pass mask in shifted coordinates: 255 where frequencies were kept. */
    public Image mask() {
        return mask;
    }

    /** Spectrum after masking, scaled like {@link #spectrum()}. */
    public Image filteredSpectrum() {
        return filteredSpectrum;
    }

    /** Cutoff radius after clamping into [0, min(rows, cols) / 2]. */
    public int effectiveCutoff() {
        return effectiveCutoff;
    }
}
