package com.ttennebkram.imagelab.processing;

/**
 * How {@link EnhancementEngine#equalize} treats color images.
 */
public enum EqualizationMode implements WireNamed {
    /** Equalize R, G and B independently. */
    PER_CHANNEL("per_channel"),
    /** Equalize only the luma of a YUV decomposition, leaving chroma untouched. */
    LUMA("luma");

    private final String wireName;

    EqualizationMode(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public static EqualizationMode fromWireName(String value) {
        return WireNamed.parse(EqualizationMode.class, value, "equalization mode");
    }
}
