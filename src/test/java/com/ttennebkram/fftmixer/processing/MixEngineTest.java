package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.TestImages;
import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.model.SelectorRegion;
import com.ttennebkram.fftmixer.model.WorkingFrame;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MixEngineTest {

    private final MixEngine engine = new MixEngine();

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    private static MixJob single(Mat image, ComponentVariant variant, double weight,
                                 SelectorRegion region, RegionMode mode) {
        return MixJob.of(new Mat[]{image, null, null, null}, new double[]{weight, 0, 0, 0},
            new ComponentVariant[]{variant, null, null, null}, region, mode);
    }

    @Test
    void noFrameGivesZeroPlaceholder() {
        MixJob job = MixJob.of(new Mat[4], new double[4], new ComponentVariant[4], null, null);
        Mat result = engine.mix(job);

        assertEquals(MixEngine.PLACEHOLDER_SIZE, result.rows());
        assertEquals(MixEngine.PLACEHOLDER_SIZE, result.cols());
        assertEquals(CvType.CV_8UC1, result.type());
        assertEquals(0, Core.countNonZero(result));
    }

    @Test
    void fullMagnitudeRoundTripsTheImage() {
        Mat image = TestImages.gradient(64, 80);
        Mat result = engine.mix(new Mat[]{image, null, null, null}, new double[]{1, 0, 0, 0},
            new ComponentVariant[]{ComponentVariant.MAGNITUDE, null, null, null},
            SelectorRegion.DEFAULT, RegionMode.NONE);

        assertEquals(64, result.rows());
        assertEquals(80, result.cols());
        assertTrue(TestImages.maxAbsDiff(image, result) <= 1.0);
    }

    @Test
    void oddSizedImageRoundTrips() {
        Mat image = TestImages.gradient(45, 33);
        Mat result = engine.mix(new Mat[]{image, null, null, null}, new double[]{1, 0, 0, 0},
            new ComponentVariant[]{ComponentVariant.MAGNITUDE, null, null, null},
            SelectorRegion.DEFAULT, RegionMode.NONE);
        assertTrue(TestImages.maxAbsDiff(image, result) <= 1.0);
    }

    @Test
    void realPlusImaginaryRebuildsTheImage() {
        Mat image = TestImages.checkerboard(48, 48, 6);
        Mat result = engine.mix(new Mat[]{image, image, null, null}, new double[]{1, 1, 0, 0},
            new ComponentVariant[]{ComponentVariant.REAL, ComponentVariant.IMAGINARY, null, null},
            SelectorRegion.DEFAULT, RegionMode.NONE);
        assertTrue(TestImages.maxAbsDiff(image, result) <= 1.0);
    }

    @Test
    void sameInputsGiveIdenticalOutput() {
        Mat a = TestImages.gradient(40, 40);
        Mat b = TestImages.checkerboard(40, 40, 5);
        Mat[] images = {a, b, null, null};
        double[] weights = {0.7, 0.3, 0, 0};
        ComponentVariant[] components = {ComponentVariant.MAGNITUDE, ComponentVariant.PHASE, null, null};
        SelectorRegion region = new SelectorRegion(5, 5, 50);

        Mat first = engine.mix(images, weights, components, region, RegionMode.INNER);
        Mat second = engine.mix(images, weights, components, region, RegionMode.INNER);
        assertEquals(0.0, TestImages.maxAbsDiff(first, second));
    }

    @Test
    void innerAndOuterMasksAreComplements() {
        WorkingFrame frame = new WorkingFrame(100, 120);
        SelectorRegion region = new SelectorRegion(30, 20, 50);

        Mat inner = engine.createRegionMask(frame, region, RegionMode.INNER);
        Mat outer = engine.createRegionMask(frame, region, RegionMode.OUTER);
        Mat none = engine.createRegionMask(frame, region, RegionMode.NONE);

        assertEquals(50.0 * 50.0, Core.sumElems(inner).val[0], 0.0);
        assertEquals(100.0 * 120.0 - 50.0 * 50.0, Core.sumElems(outer).val[0], 0.0);
        assertEquals(100.0 * 120.0, Core.sumElems(none).val[0], 0.0);

        Mat sum = new Mat();
        Core.add(inner, outer, sum);
        assertArrayEquals(TestImages.doubles(none), TestImages.doubles(sum), 0.0);

        assertEquals(1.0, inner.get(20, 30)[0]);
        assertEquals(0.0, inner.get(19, 30)[0]);
        assertEquals(0.0, inner.get(70, 30)[0]);
    }

    @Test
    void innerPlusOuterSpectrumEqualsUnmasked() {
        Mat image = TestImages.gradient(100, 120);
        WorkingFrame frame = WorkingFrame.of(image);
        SelectorRegion region = SelectorRegion.centered(frame, 60);
        Mat spectrum = SpectrumMath.centeredSpectrum(image);

        Mat inner = engine.applyRegionMask(spectrum, frame, region, RegionMode.INNER);
        Mat outer = engine.applyRegionMask(spectrum, frame, region, RegionMode.OUTER);
        Mat sum = new Mat();
        Core.add(inner, outer, sum);

        assertArrayEquals(TestImages.doubles(spectrum), TestImages.doubles(sum), 0.0);
    }

    @Test
    void oversizedRegionCoversWholeFrame() {
        WorkingFrame frame = new WorkingFrame(60, 80);
        SelectorRegion region = SelectorRegion.centered(frame, 300);
        Mat inner = engine.createRegionMask(frame, region, RegionMode.INNER);
        assertEquals(60.0 * 80.0, Core.sumElems(inner).val[0], 0.0);
    }

    @Test
    void contributionScalesLinearlyWithWeight() {
        Mat image = TestImages.gradient(32, 40);
        for (ComponentVariant variant : ComponentVariant.values()) {
            MixJob unit = single(image, variant, 1.0, SelectorRegion.DEFAULT, RegionMode.NONE);
            MixJob scaled = single(image, variant, 0.37, SelectorRegion.DEFAULT, RegionMode.NONE);

            Mat unitSum = engine.accumulate(unit, MixMonitor.NONE);
            Mat scaledSum = engine.accumulate(scaled, MixMonitor.NONE);
            Mat expected = new Mat();
            Core.multiply(unitSum, Scalar.all(0.37), expected);

            assertArrayEquals(TestImages.doubles(expected), TestImages.doubles(scaledSum), 0.0, variant.name());
            unit.release();
            scaled.release();
        }
    }

    @Test
    void phaseContributionHasWeightMagnitude() {
        Mat image = TestImages.gradient(24, 24);
        Mat spectrum = SpectrumMath.centeredSpectrum(image);
        Mat phasor = engine.reconstruct(spectrum, ComponentVariant.PHASE, 0.25);

        List<Mat> planes = SpectrumMath.split(phasor);
        Mat magnitude = new Mat();
        Core.magnitude(planes.get(0), planes.get(1), magnitude);
        Core.MinMaxLocResult range = Core.minMaxLoc(magnitude);
        assertEquals(0.25, range.minVal, 1e-12);
        assertEquals(0.25, range.maxVal, 1e-12);
    }

    @Test
    void realAndImaginaryKeepOneAxis() {
        Mat image = TestImages.checkerboard(16, 16, 3);
        Mat spectrum = SpectrumMath.centeredSpectrum(image);

        List<Mat> realOnly = SpectrumMath.split(engine.reconstruct(spectrum, ComponentVariant.REAL, 1.0));
        assertEquals(0, Core.countNonZero(realOnly.get(1)));

        List<Mat> imagOnly = SpectrumMath.split(engine.reconstruct(spectrum, ComponentVariant.IMAGINARY, 1.0));
        assertEquals(0, Core.countNonZero(imagOnly.get(0)));
    }

    @Test
    void missingVariantIsRejected() {
        Mat spectrum = SpectrumMath.centeredSpectrum(TestImages.gradient(8, 8));
        assertThrows(IllegalStateException.class, () -> engine.reconstruct(spectrum, null, 1.0));
    }

    @Test
    void mismatchedRasterIsRejected() {
        Mat small = TestImages.gradient(16, 16);
        MixJob job = MixJob.snapshot(new WorkingFrame(32, 32), new Mat[]{small, null, null, null},
            new double[]{1, 0, 0, 0}, new ComponentVariant[]{ComponentVariant.MAGNITUDE, null, null, null},
            null, null);
        assertThrows(IllegalStateException.class, () -> engine.mix(job));
        job.release();
    }

    @Test
    void monitorSeesIncreasingCheckpoints() {
        Mat image = TestImages.gradient(16, 16);
        MixJob job = MixJob.of(new Mat[]{image, image, null, null}, new double[]{1, 1, 0, 0},
            new ComponentVariant[]{ComponentVariant.MAGNITUDE, ComponentVariant.PHASE, null, null}, null, null);
        List<Integer> seen = new ArrayList<>();

        engine.mix(job, seen::add).release();

        assertEquals(Arrays.asList(10, 50, 90), seen);
        job.release();
    }

    @Test
    void monitorCanStopBeforeInverse() {
        Mat image = TestImages.gradient(16, 16);
        MixJob job = single(image, ComponentVariant.MAGNITUDE, 1.0, null, null);

        assertThrows(MixCancelledException.class, () -> engine.mix(job, progress -> {
            if (progress >= MixEngine.PROGRESS_BEFORE_INVERSE) {
                throw new MixCancelledException(7);
            }
        }));
        job.release();
    }
}
