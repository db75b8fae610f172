package com.ttennebkram.fftmixer.serialization;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MixerSettingsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        System.clearProperty(MixerSettings.SETTINGS_PROPERTY);
    }

    private static void assertDefaults(MixerSettings settings) {
        assertEquals(200, settings.getDefaultRegionSize());
        assertEquals(0.4, settings.getOverlayAlpha());
        assertEquals(2, settings.getOverlayBorderThickness());
        assertEquals(0.01, settings.getContrastPerPixel());
        assertEquals(1, settings.getBrightnessPerPixel());
        assertEquals("mixed_image.png", settings.getOutputFileName());
        assertTrue(settings.isAutoMix());
    }

    @Test
    void builtInDefaults() {
        assertDefaults(MixerSettings.defaults());
    }

    @Test
    void bundledResourceMatchesDefaults() {
        assertDefaults(MixerSettings.load());
    }

    @Test
    void missingKeysKeepDefaults() {
        MixerSettings settings = MixerSettings.fromJson("{\"defaultRegionSize\": 120, \"outputFileName\": \"out.jpg\"}");
        assertEquals(120, settings.getDefaultRegionSize());
        assertEquals("out.jpg", settings.getOutputFileName());
        assertEquals(0.4, settings.getOverlayAlpha());
        assertEquals(2, settings.getOverlayBorderThickness());
    }

    @Test
    void autoMixCanBeSwitchedOff() {
        MixerSettings settings = MixerSettings.fromJson("{\"autoMix\": false}");
        assertFalse(settings.isAutoMix());
        assertEquals(200, settings.getDefaultRegionSize());
    }

    @Test
    void unknownKeysAreIgnored() {
        MixerSettings settings = MixerSettings.fromJson("{\"theme\": \"dark\", \"brightnessPerPixel\": 3}");
        assertEquals(3, settings.getBrightnessPerPixel());
    }

    @Test
    void outOfRangeValuesAreRepaired() {
        MixerSettings settings = MixerSettings.fromJson("{\"defaultRegionSize\": 10, \"overlayAlpha\": 3.5,"
            + " \"overlayBorderThickness\": 0, \"contrastPerPixel\": -1, \"outputFileName\": \"  \"}");
        assertEquals(50, settings.getDefaultRegionSize());
        assertEquals(1.0, settings.getOverlayAlpha());
        assertEquals(1, settings.getOverlayBorderThickness());
        assertEquals(0.0, settings.getContrastPerPixel());
        assertEquals("mixed_image.png", settings.getOutputFileName());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        assertDefaults(MixerSettings.fromJson(""));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(JsonParseException.class, () -> MixerSettings.fromJson("{\"defaultRegionSize\": \"big\"}"));
    }

    @Test
    void overrideFileWins() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.write(file, "{\"overlayAlpha\": 0.7}".getBytes(StandardCharsets.UTF_8));
        System.setProperty(MixerSettings.SETTINGS_PROPERTY, file.toString());

        MixerSettings settings = MixerSettings.load();
        assertEquals(0.7, settings.getOverlayAlpha());
        assertEquals(200, settings.getDefaultRegionSize());
    }

    @Test
    void brokenOverrideFallsBack() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));
        System.setProperty(MixerSettings.SETTINGS_PROPERTY, file.toString());
        assertDefaults(MixerSettings.load());

        System.setProperty(MixerSettings.SETTINGS_PROPERTY, tempDir.resolve("missing.json").toString());
        assertDefaults(MixerSettings.load());
    }
}
