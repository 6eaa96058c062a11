package com.ttennebkram.imagelab.processing;

/**
 * Kinds of synthetic noise offered by {@link NoiseSynthesizer}.
 */
public enum NoiseType implements WireNamed {
    GAUSSIAN("gaussian"),
    UNIFORM("uniform"),
    SALT_PEPPER("salt_pepper");

    private final String wireName;

    NoiseType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static NoiseType fromWireName(String value) {
        return WireNamed.parse(NoiseType.class, value, "noise type");
    }
}
