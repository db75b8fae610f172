package com.ttennebkram.fftmixer.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Globally active pairing of component variants.
 * Only the variants of the active mode can be selected for a slot.
 */
public enum ComponentMode {

    MAGNITUDE_PHASE("Magnitude / Phase", ComponentVariant.MAGNITUDE, ComponentVariant.PHASE),
    REAL_IMAGINARY("Real / Imaginary", ComponentVariant.REAL, ComponentVariant.IMAGINARY);

    private final String label;
    private final List<ComponentVariant> variants;

    ComponentMode(String label, ComponentVariant... variants) {
        this.label = label;
        this.variants = Collections.unmodifiableList(Arrays.asList(variants));
    }

    public String getLabel() {
        return label;
    }

    /**
     * The two variants offered while this mode is active, in display order.
     */
    public List<ComponentVariant> variants() {
        return variants;
    }

    public ComponentVariant getDefaultVariant() {
        return variants.get(0);
    }

    public boolean offers(ComponentVariant variant) {
        return variant != null && variants.contains(variant);
    }

    /**
     * Parse a mode from its label or constant name, case-insensitive.
     * Returns null if nothing matches.
     */
    public static ComponentMode fromLabel(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        for (ComponentMode mode : values()) {
            if (mode.label.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
