package com.ttennebkram.imagelab.processing;

/**
 * Intensity enhancements offered by {@link EnhancementEngine}. All of them replace the working image.
 */
public enum EnhancementType implements WireNamed {
    EQUALIZATION("equalization"),
    NORMALIZATION("normalization"),
    GRAYSCALE("grayscale");

    private final String wireName;

    EnhancementType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static EnhancementType fromWireName(String value) {
        return WireNamed.parse(EnhancementType.class, value, "enhancement type");
    }
}
