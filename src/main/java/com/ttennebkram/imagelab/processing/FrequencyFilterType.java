package com.ttennebkram.imagelab.processing;

/**
 * Ideal circular pass bands of {@link FrequencyFilterEngine}.
 */
public enum FrequencyFilterType implements WireNamed {
    LOW("low"),
    HIGH("high");

    private final String wireName;

    FrequencyFilterType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static FrequencyFilterType fromWireName(String value) {
        return WireNamed.parse(FrequencyFilterType.class, value, "frequency filter type");
    }
}
