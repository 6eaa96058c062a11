package com.ttennebkram.imagelab.processing;

/**
 * Target range of {@link EnhancementEngine#normalize}.
 */
public enum NormalizationRange implements WireNamed {
    ZERO_TO_ONE("0-1", 0.0, 1.0),
    ZERO_TO_255("0-255", 0.0, 255.0);

    private final String wireName;
    private final double min;
    private final double max;

    NormalizationRange(String wireName, double min, double max) {
        this.wireName = wireName;
        this.min = min;
        this.max = max;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public static NormalizationRange fromWireName(String value) {
        return WireNamed.parse(NormalizationRange.class, value, "range type");
    }
}
