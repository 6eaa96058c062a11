package com.ttennebkram.imagelab.processing;

/**
 * Edge operators offered by {@link EdgeDetector}.
 */
public enum EdgeOperator implements WireNamed {
    SOBEL("sobel"),
    PREWITT("prewitt"),
    ROBERTS("roberts"),
    CANNY("canny");

    private final String wireName;

    EdgeOperator(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static EdgeOperator fromWireName(String value) {
        return WireNamed.parse(EdgeOperator.class, value, "edge type");
    }
}
