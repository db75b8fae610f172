package com.ttennebkram.fftmixer.model;

import org.opencv.imgproc.Imgproc;

/**
 * Spectral component extracted from a centered spectrum.
 */
public enum ComponentVariant {

    MAGNITUDE("FT Magnitude", Imgproc.COLORMAP_TURBO),
    PHASE("FT Phase", Imgproc.COLORMAP_JET),
    REAL("FT Real", Imgproc.COLORMAP_RAINBOW),
    IMAGINARY("FT Imaginary", Imgproc.COLORMAP_VIRIDIS);

    private final String label;
    private final int colorMap;

    ComponentVariant(String label, int colorMap) {
        this.label = label;
        this.colorMap = colorMap;
    }

    public String getLabel() {
        return label;
    }

    /**
     * OpenCV palette used when previewing this component.
     */
    public int getColorMap() {
        return colorMap;
    }

    public ComponentMode getMode() {
        switch (this) {
            case MAGNITUDE:
            case PHASE:
                return ComponentMode.MAGNITUDE_PHASE;
            case REAL:
            case IMAGINARY:
            default:
                return ComponentMode.REAL_IMAGINARY;
        }
    }

    /**
     * Parse a variant from its label ("FT Phase"), its short name ("phase")
     * or its constant name. Returns null for the placeholder and unknown text.
     */
    public static ComponentVariant fromLabel(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        for (ComponentVariant variant : values()) {
            if (variant.label.equalsIgnoreCase(trimmed) || variant.name().equalsIgnoreCase(trimmed)) {
                return variant;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
