package com.ttennebkram.fftmixer;

import com.ttennebkram.fftmixer.model.ComponentMode;
import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.serialization.MixerSettings;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FFTMixerLauncherTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void parsesAllOptions() {
        FFTMixerLauncher.Options options = FFTMixerLauncher.parseArgs(new String[]{
            "--mode", "real_imaginary", "--components", "real,FT Imaginary", "--weights", "0.5, 1",
            "--region", "outer", "--region-size", "80", "--out", "result.png", "a.png", "b.png"});

        assertEquals(ComponentMode.REAL_IMAGINARY, options.mode);
        assertEquals(Arrays.asList(ComponentVariant.REAL, ComponentVariant.IMAGINARY), options.components);
        assertEquals(Arrays.asList(0.5, 1.0), options.weights);
        assertEquals(RegionMode.OUTER, options.regionMode);
        assertEquals(Integer.valueOf(80), options.regionSize);
        assertEquals(Paths.get("result.png"), options.output);
        assertEquals(Arrays.asList(Paths.get("a.png"), Paths.get("b.png")), options.images);
    }

    @Test
    void defaultsWhenOnlyImagesGiven() {
        FFTMixerLauncher.Options options = FFTMixerLauncher.parseArgs(new String[]{"only.png"});
        assertEquals(ComponentMode.MAGNITUDE_PHASE, options.mode);
        assertEquals(RegionMode.NONE, options.regionMode);
        assertTrue(options.components.isEmpty());
        assertTrue(options.weights.isEmpty());
        assertNull(options.regionSize);
        assertNull(options.output);
    }

    @Test
    void rejectsBadCommandLines() {
        String[][] bad = {
            {},
            {"--bogus", "a.png"},
            {"a.png", "--weights"},
            {"--weights", "heavy", "a.png"},
            {"--region-size", "big", "a.png"},
            {"--mode", "sideways", "a.png"},
            {"--components", "colour", "a.png"},
            {"--components", "real", "a.png"},
            {"a.png", "b.png", "c.png", "d.png", "e.png"}
        };
        for (String[] args : bad) {
            assertThrows(IllegalArgumentException.class, () -> FFTMixerLauncher.parseArgs(args),
                Arrays.toString(args));
        }
    }

    @Test
    void mixesFilesEndToEnd() {
        Path first = tempDir.resolve("first.png");
        Path second = tempDir.resolve("second.png");
        Path out = tempDir.resolve("out.png");
        assertTrue(Imgcodecs.imwrite(first.toString(), TestImages.gradient(50, 70)));
        assertTrue(Imgcodecs.imwrite(second.toString(), TestImages.checkerboard(60, 64, 8)));

        FFTMixerLauncher.Options options = FFTMixerLauncher.parseArgs(new String[]{
            "--components", "magnitude,phase", "--weights", "0.6,0.4", "--region", "inner",
            "--region-size", "40", "--out", out.toString(), first.toString(), second.toString()});
        MixerController controller = new MixerController(MixerSettings.defaults());

        assertEquals(0, FFTMixerLauncher.run(options, controller));
        assertTrue(Files.exists(out));

        Mat written = Imgcodecs.imread(out.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        assertEquals(50, written.rows());
        assertEquals(64, written.cols());
        written.release();
    }

    @Test
    void unreadableImageFails() {
        FFTMixerLauncher.Options options = FFTMixerLauncher.parseArgs(
            new String[]{tempDir.resolve("nope.png").toString()});
        assertEquals(1, FFTMixerLauncher.run(options, new MixerController(MixerSettings.defaults())));
    }

    @Test
    void zeroWeightsFail() {
        Path image = tempDir.resolve("image.png");
        assertTrue(Imgcodecs.imwrite(image.toString(), TestImages.gradient(20, 20)));
        FFTMixerLauncher.Options options = FFTMixerLauncher.parseArgs(
            new String[]{"--weights", "0", image.toString()});

        MixerController controller = new MixerController(MixerSettings.defaults());
        assertEquals(1, FFTMixerLauncher.run(options, controller));
        assertEquals("Set non-zero weights for loaded images.", controller.getStatus());
    }
}
