package com.ttennebkram.fftmixer.model;

/**
 * The two output viewports a finished mix can be routed to.
 */
public enum OutputTarget {
    OUTPUT_1("Output 1"),
    OUTPUT_2("Output 2");

    private final String label;

    OutputTarget(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
