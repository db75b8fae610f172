package com.ttennebkram.fftmixer.model;

import org.opencv.core.Mat;
import org.opencv.core.Size;

/**
 * Common working resolution shared by every loaded slot.
 * Height and width are the minimums over all loaded raw images.
 */
public final class WorkingFrame {

    private final int height;
    private final int width;

    public WorkingFrame(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Working frame must be positive: " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
    }

    /**
     * Frame matching the dimensions of an existing raster.
     */
    public static WorkingFrame of(Mat raster) {
        return new WorkingFrame(raster.rows(), raster.cols());
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /**
     * OpenCV size (width first) for resize calls.
     */
    public Size toSize() {
        return new Size(width, height);
    }

    public boolean matches(Mat raster) {
        return raster != null && raster.rows() == height && raster.cols() == width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkingFrame)) return false;
        WorkingFrame other = (WorkingFrame) o;
        return height == other.height && width == other.width;
    }

    @Override
    public int hashCode() {
        return 31 * height + width;
    }

    @Override
    public String toString() {
        return "WorkingFrame[" + height + "x" + width + "]";
    }
}
