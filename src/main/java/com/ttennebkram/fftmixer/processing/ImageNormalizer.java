package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.model.WorkingFrame;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Applies per-slot brightness/contrast and resizes every loaded raster
 * to the common working frame.
 */
public class ImageNormalizer {

    private WorkingFrame workingFrame;

    /**
     * Result of one normalization pass: four optional rasters sharing one frame.
     */
    public static class NormalizedImages {
        private final Mat[] images;
        private final WorkingFrame frame;

        NormalizedImages(Mat[] images, WorkingFrame frame) {
            this.images = images;
            this.frame = frame;
        }

        /**
         * Normalized raster of a slot, or null for an empty slot.
         */
        public Mat get(int index) {
            return images[index];
        }

        /**
         * All four slots; empty slots are null. The array is a copy, the Mats are not.
         */
        public Mat[] toArray() {
            return images.clone();
        }

        /**
         * Common frame, or null when nothing is loaded.
         */
        public WorkingFrame getFrame() {
            return frame;
        }

        public boolean isEmpty() {
            return frame == null;
        }

        public void release() {
            for (int i = 0; i < images.length; i++) {
                if (images[i] != null) {
                    images[i].release();
                    images[i] = null;
                }
            }
        }
    }

    /**
     * Normalize up to four rasters.
     *
     * @param rasters    raw grayscale rasters, null for empty slots
     * @param brightness additive offset per slot
     * @param contrast   multiplier per slot
     * @return new rasters (caller must release) and the working frame
     */
    public NormalizedImages normalize(Mat[] rasters, int[] brightness, double[] contrast) {
        workingFrame = computeWorkingFrame(rasters);

        Mat[] output = new Mat[rasters.length];
        if (workingFrame == null) {
            return new NormalizedImages(output, null);
        }

        for (int i = 0; i < rasters.length; i++) {
            Mat raster = rasters[i];
            if (raster == null || raster.empty()) {
                continue;
            }
            output[i] = adjustAndResize(raster, brightness[i], contrast[i], workingFrame);
        }
        return new NormalizedImages(output, workingFrame);
    }

    /**
     * Frame computed by the most recent {@link #normalize} call, or null.
     */
    public WorkingFrame getWorkingFrame() {
        return workingFrame;
    }

    /**
     * (min height, min width) over the loaded rasters, or null if none is loaded.
     */
    public static WorkingFrame computeWorkingFrame(Mat[] rasters) {
        int minHeight = Integer.MAX_VALUE;
        int minWidth = Integer.MAX_VALUE;
        boolean any = false;
        for (Mat raster : rasters) {
            if (raster == null || raster.empty()) {
                continue;
            }
            any = true;
            minHeight = Math.min(minHeight, raster.rows());
            minWidth = Math.min(minWidth, raster.cols());
        }
        return any ? new WorkingFrame(minHeight, minWidth) : null;
    }

    /**
     * out = clamp(contrast * in + brightness, 0, 255), then bilinear resize to the frame.
     */
    public static Mat adjustAndResize(Mat raster, int brightness, double contrast, WorkingFrame frame) {
        Mat adjusted = new Mat();
        raster.convertTo(adjusted, CvType.CV_8U, Math.max(0.0, contrast), brightness);

        if (frame.matches(adjusted)) {
            return adjusted;
        }

        Mat resized = new Mat();
        Imgproc.resize(adjusted, resized, frame.toSize(), 0, 0, Imgproc.INTER_LINEAR);
        adjusted.release();
        return resized;
    }
}
