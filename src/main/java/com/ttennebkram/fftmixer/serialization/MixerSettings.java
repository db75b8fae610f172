package com.ttennebkram.fftmixer.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Tunable defaults for the mixer, read from JSON.
 *
 * Lookup order for {@link #load()}:
 * 1. the file named by the {@code fftmixer.settings} system property
 * 2. the {@code fftmixer-settings.json} classpath resource
 * 3. built-in defaults
 *
 * Missing keys keep their defaults and unknown keys are ignored.
 */
public class MixerSettings {

    public static final String SETTINGS_PROPERTY = "fftmixer.settings";
    public static final String SETTINGS_RESOURCE = "/fftmixer-settings.json";

    private static final Gson GSON = new GsonBuilder().create();

    // Properties with defaults
    private int defaultRegionSize = 200;
    private double overlayAlpha = 0.4;
    private int overlayBorderThickness = 2;
    private double contrastPerPixel = 0.01;
    private int brightnessPerPixel = 1;
    private String outputFileName = "mixed_image.png";
    private boolean autoMix = true;

    public static MixerSettings defaults() {
        return new MixerSettings();
    }

    /**
     * Load settings from the override file, the bundled resource, or the defaults.
     * An unreadable or malformed source is reported and skipped.
     */
    public static MixerSettings load() {
        String overridePath = System.getProperty(SETTINGS_PROPERTY);
        if (overridePath != null && !overridePath.isEmpty()) {
            Path path = Paths.get(overridePath);
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return fromReader(reader);
            } catch (IOException | JsonParseException e) {
                System.err.println("Could not read settings from " + path + ": " + e.getMessage() + " (using defaults)");
            }
        }

        try (InputStream in = MixerSettings.class.getResourceAsStream(SETTINGS_RESOURCE)) {
            if (in != null) {
                return fromReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException | JsonParseException e) {
            System.err.println("Could not read bundled settings: " + e.getMessage() + " (using defaults)");
        }
        return defaults();
    }

    /**
     * Parse settings from JSON text.
     *
     * @throws JsonParseException if the text is not valid settings JSON
     */
    public static MixerSettings fromJson(String json) {
        MixerSettings settings = GSON.fromJson(json, MixerSettings.class);
        return settings != null ? settings.sanitized() : defaults();
    }

    public static MixerSettings fromReader(Reader reader) {
        MixerSettings settings = GSON.fromJson(reader, MixerSettings.class);
        return settings != null ? settings.sanitized() : defaults();
    }

    // Gson bypasses setters, so out-of-range values are repaired here
    private MixerSettings sanitized() {
        if (defaultRegionSize < 50) defaultRegionSize = 50;
        if (Double.isNaN(overlayAlpha) || overlayAlpha < 0.0) overlayAlpha = 0.0;
        if (overlayAlpha > 1.0) overlayAlpha = 1.0;
        if (overlayBorderThickness < 1) overlayBorderThickness = 1;
        if (contrastPerPixel < 0.0) contrastPerPixel = 0.0;
        if (outputFileName == null || outputFileName.trim().isEmpty()) outputFileName = "mixed_image.png";
        return this;
    }

    public int getDefaultRegionSize() {
        return defaultRegionSize;
    }

    public double getOverlayAlpha() {
        return overlayAlpha;
    }

    public int getOverlayBorderThickness() {
        return overlayBorderThickness;
    }

    public double getContrastPerPixel() {
        return contrastPerPixel;
    }

    public int getBrightnessPerPixel() {
        return brightnessPerPixel;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    /**
     * Whether weight, component and mode changes start a new mix on their own.
     */
    public boolean isAutoMix() {
        return autoMix;
    }
}
