package com.ttennebkram.imagelab.processing;

public enum HistogramType implements WireNamed {
    GRAYSCALE("grayscale"),
    RGB("rgb");

    private final String wireName;

    HistogramType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static HistogramType fromWireName(String value) {
        return WireNamed.parse(HistogramType.class, value, "histogram type");
    }
}
