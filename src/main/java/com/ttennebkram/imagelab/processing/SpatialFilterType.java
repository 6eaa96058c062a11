package com.ttennebkram.imagelab.processing;

/**
 * Smoothing filters offered by {@link SpatialFilterEngine}.
 */
public enum SpatialFilterType implements WireNamed {
    AVERAGE("average"),
    GAUSSIAN("gaussian"),
    MEDIAN("median");

    private final String wireName;

    SpatialFilterType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static SpatialFilterType fromWireName(String value) {
        return WireNamed.parse(SpatialFilterType.class, value, "filter type");
    }
}
