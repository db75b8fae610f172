package com.ttennebkram.fftmixer.model;

/**
 * Masking policy applied to every slot's spectrum before mixing.
 */
public enum RegionMode {

    /** No masking, the whole spectrum is used. */
    NONE("None"),
    /** Keep only the frequencies inside the selector (low-pass). */
    INNER("Inner"),
    /** Keep only the frequencies outside the selector (high-pass). */
    OUTER("Outer");

    private final String label;

    RegionMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Map selector text such as "Inner Region" to a mode. Anything that
     * mentions neither Inner nor Outer is NONE.
     */
    public static RegionMode fromLabel(String text) {
        if (text == null) {
            return NONE;
        }
        String lower = text.toLowerCase();
        if (lower.contains("inner")) {
            return INNER;
        }
        if (lower.contains("outer")) {
            return OUTER;
        }
        return NONE;
    }

    @Override
    public String toString() {
        return label;
    }
}
