package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.model.SelectorRegion;
import com.ttennebkram.fftmixer.model.WorkingFrame;
import com.ttennebkram.fftmixer.util.MatTracker;
import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Immutable snapshot of everything one mix needs.
 * Rasters are deep copies taken at submission time, so the mixing thread
 * never sees later changes to the live slots.
 *
 * The job owns its rasters; {@link #release()} frees them.
 */
public final class MixJob {

    public static final int SLOT_COUNT = 4;

    private final WorkingFrame frame;
    private final Mat[] images;
    private final double[] weights;
    private final ComponentVariant[] components;
    private final SelectorRegion region;
    private final RegionMode regionMode;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private MixJob(WorkingFrame frame, Mat[] images, double[] weights, ComponentVariant[] components,
                   SelectorRegion region, RegionMode regionMode) {
        this.frame = frame;
        this.images = images;
        this.weights = weights;
        this.components = components;
        this.region = region;
        this.regionMode = regionMode;
    }

    /**
     * Copy the given per-slot state into a new job.
     *
     * @param frame      working frame, or null when no image is loaded
     * @param images     four normalized rasters, null entries for empty slots (copied)
     * @param weights    four weights
     * @param components four selected variants, null for "no selection"
     * @param region     selector region
     * @param regionMode masking policy
     */
    public static MixJob snapshot(WorkingFrame frame, Mat[] images, double[] weights,
                                  ComponentVariant[] components, SelectorRegion region, RegionMode regionMode) {
        checkLength("images", images.length);
        checkLength("weights", weights.length);
        checkLength("components", components.length);

        Mat[] copies = new Mat[SLOT_COUNT];
        for (int i = 0; i < SLOT_COUNT; i++) {
            if (images[i] != null && !images[i].empty()) {
                copies[i] = MatTracker.track(images[i].clone());
            }
        }
        return new MixJob(frame, copies, weights.clone(), components.clone(),
            region != null ? region : SelectorRegion.DEFAULT,
            regionMode != null ? regionMode : RegionMode.NONE);
    }

    /**
     * Snapshot whose working frame is taken from the first loaded raster.
     * All loaded rasters are expected to share that size already.
     */
    public static MixJob of(Mat[] images, double[] weights, ComponentVariant[] components,
                            SelectorRegion region, RegionMode regionMode) {
        WorkingFrame frame = null;
        for (Mat image : images) {
            if (image != null && !image.empty()) {
                frame = WorkingFrame.of(image);
                break;
            }
        }
        return snapshot(frame, images, weights, components, region, regionMode);
    }

    private static void checkLength(String name, int length) {
        if (length != SLOT_COUNT) {
            throw new IllegalArgumentException(name + " must have " + SLOT_COUNT + " entries, got " + length);
        }
    }

    /**
     * Check the preconditions for running this job.
     *
     * @throws MixValidationException if no slot is loaded, a weighted slot has no
     *                                component selection, or every loaded slot has weight 0
     */
    public void validate() {
        if (!hasAnyImage()) {
            throw new MixValidationException(MixValidationException.Reason.NO_IMAGES,
                "Load at least one image.");
        }

        boolean canMix = false;
        for (int i = 0; i < SLOT_COUNT; i++) {
            if (images[i] != null && weights[i] > 0.0) {
                if (components[i] == null) {
                    throw new MixValidationException(MixValidationException.Reason.MISSING_COMPONENT, i,
                        "Error: Select a component for Viewport " + (i + 1));
                }
                canMix = true;
            }
        }

        if (!canMix) {
            throw new MixValidationException(MixValidationException.Reason.NO_WEIGHTS,
                "Set non-zero weights for loaded images.");
        }
    }

    public boolean hasAnyImage() {
        for (Mat image : images) {
            if (image != null) {
                return true;
            }
        }
        return false;
    }

    public WorkingFrame getFrame() {
        return frame;
    }

    /**
     * Normalized raster of a slot, or null. Callers must not modify it.
     */
    public Mat getImage(int index) {
        return images[index];
    }

    public double getWeight(int index) {
        return weights[index];
    }

    public ComponentVariant getComponent(int index) {
        return components[index];
    }

    public SelectorRegion getRegion() {
        return region;
    }

    public RegionMode getRegionMode() {
        return regionMode;
    }

    /**
     * True if the slot takes part in the mix (loaded and weight above zero).
     */
    public boolean contributes(int index) {
        return images[index] != null && weights[index] > 0.0;
    }

    /**
     * Free the snapshot rasters. Safe to call more than once.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < SLOT_COUNT; i++) {
            MatTracker.release(images[i]);
            images[i] = null;
        }
    }

    @Override
    public String toString() {
        return "MixJob[" + frame + ", weights=" + Arrays.toString(weights)
            + ", components=" + Arrays.toString(components) + ", " + region + ", " + regionMode + "]";
    }
}
