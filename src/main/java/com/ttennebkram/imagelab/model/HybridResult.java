package com.ttennebkram.imagelab.model;

/**
 * Low band of the first image, high band of the second (re-centered on mid-gray for
 * display) and their sum. Not tied to any session.
 */
public final class HybridResult {

    private final Image lowFrequency;
    private final Image highFrequency;
    private final Image hybrid;

    public HybridResult(Image lowFrequency, Image highFrequency, Image hybrid) {
        this.lowFrequency = lowFrequency;
        this.highFrequency = highFrequency;
        this.hybrid = hybrid;
    }

    public Image lowFrequency() {
        return lowFrequency;
    }

    public Image highFrequency() {
        return highFrequency;
    }

    public Image hybrid() {
        return hybrid;
    }
}
