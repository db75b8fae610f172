package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.model.ComponentMode;
import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.model.SelectorRegion;
import com.ttennebkram.fftmixer.model.WorkingFrame;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Turns normalized rasters into false-color previews of one spectral component
 * and owns the selector region geometry.
 */
public class SpectralAnalyzer {

    // Overlay drawing defaults (BGR red)
    private static final Scalar OVERLAY_COLOR = new Scalar(0, 0, 255);
    public static final double DEFAULT_OVERLAY_ALPHA = 0.4;
    public static final int DEFAULT_OVERLAY_THICKNESS = 2;

    private final int defaultRegionSize;

    private WorkingFrame workingFrame;
    private SelectorRegion region;
    private ComponentMode mode = ComponentMode.MAGNITUDE_PHASE;

    public SpectralAnalyzer() {
        this(SelectorRegion.DEFAULT.getSize());
    }

    /**
     * @param defaultRegionSize selector size used when a working frame is first established
     */
    public SpectralAnalyzer(int defaultRegionSize) {
        this.defaultRegionSize = Math.max(SelectorRegion.MIN_SIZE, defaultRegionSize);
        this.region = new SelectorRegion(0, 0, this.defaultRegionSize);
    }

    // ===== Component extraction =====

    /**
     * Colored preview of one component of the raster's centered spectrum.
     *
     * @return new BGR Mat (caller must release), or null if there is no raster or no selection
     */
    public Mat analyzeComponent(Mat raster, ComponentVariant variant) {
        Mat scalar = computeComponent(raster, variant);
        if (scalar == null) {
            return null;
        }
        Mat visual = new Mat();
        Imgproc.applyColorMap(scalar, visual, variant.getColorMap());
        scalar.release();
        return visual;
    }

    /**
     * 8-bit scalar field of one component, before the palette is applied.
     *
     * @return new CV_8UC1 Mat (caller must release), or null if there is no raster or no selection
     */
    public Mat computeComponent(Mat raster, ComponentVariant variant) {
        if (raster == null || raster.empty() || variant == null) {
            return null;
        }

        Mat spectrum = SpectrumMath.centeredSpectrum(raster);
        List<Mat> planes = SpectrumMath.split(spectrum);
        spectrum.release();
        Mat real = planes.get(0);
        Mat imag = planes.get(1);

        try {
            switch (variant) {
                case MAGNITUDE: {
                    Mat magnitude = new Mat();
                    Core.magnitude(real, imag, magnitude);
                    Mat logMag = SpectrumMath.log1pAbs(magnitude);
                    magnitude.release();
                    Mat result = SpectrumMath.normalizeTo8U(logMag);
                    logMag.release();
                    return result;
                }
                case PHASE: {
                    // (phase + pi) / (2 pi) * 255
                    Mat phase = SpectrumMath.phase(real, imag);
                    Mat result = new Mat();
                    double scale = 255.0 / (2 * Math.PI);
                    phase.convertTo(result, CvType.CV_8U, scale, Math.PI * scale);
                    phase.release();
                    return result;
                }
                case REAL:
                case IMAGINARY:
                default: {
                    Mat logPart = SpectrumMath.log1pAbs(variant == ComponentVariant.REAL ? real : imag);
                    Mat result = SpectrumMath.normalizeTo8U(logPart);
                    logPart.release();
                    return result;
                }
            }
        } finally {
            real.release();
            imag.release();
        }
    }

    /**
     * Previews for all slots. Entries are null where a slot has no raster or no selection.
     */
    public Mat[] computeComponents(Mat[] rasters, ComponentVariant[] selections) {
        Mat[] visuals = new Mat[rasters.length];
        for (int i = 0; i < rasters.length; i++) {
            visuals[i] = workingFrame == null ? null : analyzeComponent(rasters[i], selections[i]);
        }
        return visuals;
    }

    /**
     * Blend a semi-transparent selector rectangle with a solid border into a BGR preview.
     * Returns a new Mat; previews are returned as a plain copy when the region mode is NONE.
     */
    public Mat drawRegionOverlay(Mat visual, RegionMode regionMode, double alpha, int thickness) {
        Mat result = visual.clone();
        if (regionMode == RegionMode.NONE || workingFrame == null || visual.channels() != 3) {
            return result;
        }

        Rect rect = region.toRect(workingFrame);
        Point topLeft = new Point(rect.x, rect.y);
        Point bottomRight = new Point(rect.x + rect.width, rect.y + rect.height);

        Mat overlay = result.clone();
        Imgproc.rectangle(overlay, topLeft, bottomRight, OVERLAY_COLOR, -1);
        Core.addWeighted(overlay, alpha, result, 1 - alpha, 0, result);
        overlay.release();

        Imgproc.rectangle(result, topLeft, bottomRight, OVERLAY_COLOR, thickness);
        return result;
    }

    // ===== Selector region =====

    /**
     * Update the working frame. The selector is recentered whenever the frame changes;
     * a null frame (nothing loaded) keeps the current size for later.
     */
    public void setWorkingFrame(WorkingFrame frame) {
        if (frame == null) {
            workingFrame = null;
            return;
        }
        if (!frame.equals(workingFrame)) {
            workingFrame = frame;
            region = SelectorRegion.centered(frame, region.getSize());
        }
    }

    public WorkingFrame getWorkingFrame() {
        return workingFrame;
    }

    /**
     * Set the selector side to max(50, size) and center it on the working frame.
     *
     * @return false (and no change) when no working frame is defined
     */
    public boolean setRegionSize(int size) {
        if (workingFrame == null) {
            return false;
        }
        region = SelectorRegion.centered(workingFrame, size);
        return true;
    }

    /**
     * Move the selector to a requested origin, clamped to the frame.
     *
     * @return false (and no change) when no working frame is defined
     */
    public boolean moveRegionTo(int x, int y) {
        if (workingFrame == null) {
            return false;
        }
        region = region.moveTo(x, y, workingFrame);
        return true;
    }

    public SelectorRegion getRegion() {
        return region;
    }

    public int getDefaultRegionSize() {
        return defaultRegionSize;
    }

    // ===== Component mode =====

    /**
     * Switch the offered variant pair. Does not recompute anything.
     */
    public void setMode(ComponentMode mode) {
        this.mode = mode != null ? mode : ComponentMode.MAGNITUDE_PHASE;
    }

    public ComponentMode getMode() {
        return mode;
    }

    public List<ComponentVariant> getComponentOptions() {
        return mode.variants();
    }
}
