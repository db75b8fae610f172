package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.model.SelectorRegion;
import com.ttennebkram.fftmixer.model.WorkingFrame;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

/**
 * Frequency-domain mixer.
 *
 * Each contributing slot's centered spectrum is masked by the region policy,
 * turned into a weighted complex contribution according to its component,
 * and summed. The sum is inverse-shifted, inverse-transformed, and its
 * magnitude rescaled to an 8-bit raster.
 */
public class MixEngine {

    /** Side of the zero raster returned when there is no working frame. */
    public static final int PLACEHOLDER_SIZE = 100;

    // Progress reported at the cancellation checkpoints
    static final int PROGRESS_FIRST_SLOT = 10;
    static final int PROGRESS_SLOTS_SPAN = 80;
    static final int PROGRESS_BEFORE_INVERSE = 90;

    /**
     * Mix without progress reporting or cancellation.
     */
    public Mat mix(MixJob job) {
        return mix(job, MixMonitor.NONE);
    }

    /**
     * Mix loose inputs; the frame is taken from the first loaded raster.
     */
    public Mat mix(Mat[] images, double[] weights, ComponentVariant[] components,
                   SelectorRegion region, RegionMode regionMode) {
        MixJob job = MixJob.of(images, weights, components, region, regionMode);
        try {
            return mix(job);
        } finally {
            job.release();
        }
    }

    /**
     * Run the full mix. The monitor is polled before every per-slot transform
     * and once more before the inverse transform.
     *
     * @return new CV_8UC1 raster (caller must release)
     * @throws MixCancelledException if the monitor cancels
     */
    public Mat mix(MixJob job, MixMonitor monitor) {
        WorkingFrame frame = job.getFrame();
        if (frame == null) {
            return Mat.zeros(PLACEHOLDER_SIZE, PLACEHOLDER_SIZE, CvType.CV_8UC1);
        }

        Mat combined = accumulate(job, monitor);
        try {
            monitor.checkpoint(PROGRESS_BEFORE_INVERSE);
            return invert(combined);
        } finally {
            combined.release();
        }
    }

    /**
     * Sum of all weighted slot contributions, before the inverse transform.
     *
     * @return new CV_64FC2 centered spectrum (caller must release)
     */
    public Mat accumulate(MixJob job, MixMonitor monitor) {
        WorkingFrame frame = job.getFrame();
        if (frame == null) {
            throw new IllegalStateException("No working frame to accumulate into");
        }

        int contributing = 0;
        for (int i = 0; i < MixJob.SLOT_COUNT; i++) {
            if (job.contributes(i)) {
                contributing++;
            }
        }

        Mat combined = Mat.zeros(frame.getHeight(), frame.getWidth(), CvType.CV_64FC2);
        Mat mask = createRegionMask(frame, job.getRegion(), job.getRegionMode());
        try {
            int done = 0;
            for (int i = 0; i < MixJob.SLOT_COUNT; i++) {
                if (!job.contributes(i)) {
                    continue;
                }
                monitor.checkpoint(PROGRESS_FIRST_SLOT + PROGRESS_SLOTS_SPAN * done / contributing);

                Mat image = job.getImage(i);
                if (!frame.matches(image)) {
                    throw new IllegalStateException("Slot " + (i + 1) + " is " + image.rows() + "x" + image.cols()
                        + " but the working frame is " + frame.getHeight() + "x" + frame.getWidth());
                }

                Mat spectrum = SpectrumMath.centeredSpectrum(image);
                Mat masked = applyMask(spectrum, mask);
                spectrum.release();

                Mat contribution = reconstruct(masked, job.getComponent(i), job.getWeight(i));
                masked.release();

                Core.add(combined, contribution, combined);
                contribution.release();
                done++;
            }
        } catch (RuntimeException e) {
            combined.release();
            throw e;
        } finally {
            mask.release();
        }
        return combined;
    }

    /**
     * Inverse-shift, inverse DFT, magnitude, and min-max rescale to 8 bits.
     *
     * @return new CV_8UC1 raster (caller must release)
     */
    public Mat invert(Mat combined) {
        Mat unshifted = SpectrumMath.ifftShift(combined);
        Core.idft(unshifted, unshifted, Core.DFT_SCALE);

        List<Mat> planes = SpectrumMath.split(unshifted);
        unshifted.release();

        Mat magnitude = new Mat();
        Core.magnitude(planes.get(0), planes.get(1), magnitude);
        for (Mat p : planes) p.release();

        Mat result = SpectrumMath.normalizeTo8U(magnitude);
        magnitude.release();
        return result;
    }

    // ===== Masking =====

    /**
     * Real-valued 0/1 mask the size of the frame.
     * NONE is all ones; INNER is one inside the clamped selector only;
     * OUTER is the exact complement of INNER.
     *
     * @return new CV_64FC1 mask (caller must release)
     */
    public Mat createRegionMask(WorkingFrame frame, SelectorRegion region, RegionMode regionMode) {
        int rows = frame.getHeight();
        int cols = frame.getWidth();

        switch (regionMode) {
            case INNER: {
                Mat mask = Mat.zeros(rows, cols, CvType.CV_64F);
                Mat inside = mask.submat(region.toRect(frame));
                inside.setTo(new Scalar(1.0));
                inside.release();
                return mask;
            }
            case OUTER: {
                Mat mask = Mat.ones(rows, cols, CvType.CV_64F);
                Mat inside = mask.submat(region.toRect(frame));
                inside.setTo(new Scalar(0.0));
                inside.release();
                return mask;
            }
            case NONE:
            default:
                return Mat.ones(rows, cols, CvType.CV_64F);
        }
    }

    /**
     * Mask a spectrum for the given region policy.
     *
     * @return new masked CV_64FC2 spectrum (caller must release)
     */
    public Mat applyRegionMask(Mat spectrum, WorkingFrame frame, SelectorRegion region, RegionMode regionMode) {
        Mat mask = createRegionMask(frame, region, regionMode);
        try {
            return applyMask(spectrum, mask);
        } finally {
            mask.release();
        }
    }

    /**
     * Multiply real and imaginary planes by the same real mask.
     */
    protected Mat applyMask(Mat spectrum, Mat mask) {
        List<Mat> planes = SpectrumMath.split(spectrum);
        Mat real = planes.get(0);
        Mat imag = planes.get(1);
        Core.multiply(real, mask, real);
        Core.multiply(imag, mask, imag);
        return SpectrumMath.mergeAndRelease(real, imag);
    }

    // ===== Reconstruction =====

    /**
     * Weighted complex contribution of one masked spectrum.
     * <ul>
     *   <li>MAGNITUDE: weight * |S| * exp(i arg S), i.e. the masked value scaled by weight</li>
     *   <li>PHASE: weight * exp(i arg S), unit magnitude</li>
     *   <li>REAL: weight * Re(S) on the real axis only</li>
     *   <li>IMAGINARY: weight * i Im(S) on the imaginary axis only</li>
     * </ul>
     *
     * @return new CV_64FC2 Mat (caller must release)
     */
    public Mat reconstruct(Mat masked, ComponentVariant variant, double weight) {
        if (variant == null) {
            throw new IllegalStateException("No component selected for a weighted slot");
        }

        List<Mat> planes = SpectrumMath.split(masked);
        Mat real = planes.get(0);
        Mat imag = planes.get(1);

        switch (variant) {
            case MAGNITUDE:
                Core.multiply(real, Scalar.all(weight), real);
                Core.multiply(imag, Scalar.all(weight), imag);
                return SpectrumMath.mergeAndRelease(real, imag);
            case PHASE: {
                Mat phasor = SpectrumMath.weightedUnitPhasor(real, imag, weight);
                real.release();
                imag.release();
                return phasor;
            }
            case REAL:
                Core.multiply(real, Scalar.all(weight), real);
                imag.setTo(Scalar.all(0));
                return SpectrumMath.mergeAndRelease(real, imag);
            case IMAGINARY:
            default:
                real.setTo(Scalar.all(0));
                Core.multiply(imag, Scalar.all(weight), imag);
                return SpectrumMath.mergeAndRelease(real, imag);
        }
    }
}
