package com.ttennebkram.fftmixer.model;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * One of the four input viewports.
 * Owned by the control side; the mixing thread only ever sees snapshots.
 */
public class Slot {

    public static final int DEFAULT_BRIGHTNESS = 0;
    public static final double DEFAULT_CONTRAST = 1.0;

    private final int index;

    private Mat image;
    private int brightness = DEFAULT_BRIGHTNESS;
    private double contrast = DEFAULT_CONTRAST;
    private double weight = 0.0;
    private ComponentVariant component;

    public Slot(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public boolean isLoaded() {
        return image != null && !image.empty();
    }

    /**
     * Raw grayscale raster, or null when the slot is empty.
     */
    public Mat getImage() {
        return image;
    }

    /**
     * Replace the raster. The slot takes ownership of a grayscale copy;
     * color input is converted and non-8-bit input is saturated to 8 bits.
     */
    public void setImage(Mat source) {
        Mat gray = null;
        if (source != null && !source.empty()) {
            gray = new Mat();
            if (source.channels() == 3) {
                Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGR2GRAY);
            } else if (source.channels() == 4) {
                Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGRA2GRAY);
            } else {
                source.copyTo(gray);
            }
            if (gray.type() != CvType.CV_8UC1) {
                gray.convertTo(gray, CvType.CV_8U);
            }
        }
        releaseImage();
        image = gray;
    }

    public int getBrightness() {
        return brightness;
    }

    public void setBrightness(int brightness) {
        this.brightness = brightness;
    }

    public double getContrast() {
        return contrast;
    }

    /**
     * Contrast is never negative; negative requests become 0.
     */
    public void setContrast(double contrast) {
        this.contrast = Math.max(0.0, contrast);
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Mix weight, clamped to [0, 1].
     */
    public void setWeight(double weight) {
        if (Double.isNaN(weight)) {
            weight = 0.0;
        }
        this.weight = Math.max(0.0, Math.min(1.0, weight));
    }

    /**
     * Selected component, or null for the "Select Component" placeholder.
     */
    public ComponentVariant getComponent() {
        return component;
    }

    public void setComponent(ComponentVariant component) {
        this.component = component;
    }

    public void resetAdjustments() {
        brightness = DEFAULT_BRIGHTNESS;
        contrast = DEFAULT_CONTRAST;
    }

    /**
     * Empty the slot and restore brightness, contrast, weight and selection defaults.
     */
    public void clear() {
        releaseImage();
        resetAdjustments();
        weight = 0.0;
        component = null;
    }

    private void releaseImage() {
        if (image != null) {
            image.release();
            image = null;
        }
    }

    @Override
    public String toString() {
        return "Slot " + (index + 1) + (isLoaded() ? " [" + image.rows() + "x" + image.cols() + "]" : " [empty]")
            + " B:" + brightness + " C:" + String.format("%.2f", contrast)
            + " W:" + String.format("%.2f", weight) + " " + (component != null ? component.getLabel() : "-");
    }
}
