package com.ttennebkram.fftmixer;

import com.ttennebkram.fftmixer.model.ComponentMode;
import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.processing.MixEvent;
import com.ttennebkram.fftmixer.processing.MixJobHandle;
import com.ttennebkram.fftmixer.serialization.MixerSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Headless entry point: mixes up to four images from the command line
 * and writes the result.
 *
 * <pre>
 * FFTMixerLauncher [--mode magnitude_phase|real_imaginary]
 *                  [--components c1,c2,..] [--weights w1,w2,..]
 *                  [--region none|inner|outer] [--region-size N]
 *                  [--out file] image1 [image2 [image3 [image4]]]
 * </pre>
 */
public class FFTMixerLauncher {

    private static final long JOB_TIMEOUT_MINUTES = 5;

    /**
     * Parsed command line.
     */
    static class Options {
        final List<Path> images = new ArrayList<>();
        ComponentMode mode = ComponentMode.MAGNITUDE_PHASE;
        final List<ComponentVariant> components = new ArrayList<>();
        final List<Double> weights = new ArrayList<>();
        RegionMode regionMode = RegionMode.NONE;
        Integer regionSize;
        Path output;
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        MixerSettings settings = MixerSettings.load();
        System.exit(run(options, new MixerController(settings)));
    }

    /**
     * Apply the options to a controller, run one job and save the result.
     *
     * @return process exit code
     */
    static int run(Options options, MixerController controller) {
        // One mix after everything is configured
        controller.setAutoMix(false);
        controller.setComponentMode(options.mode);
        for (int i = 0; i < options.images.size(); i++) {
            if (!controller.loadImage(i, options.images.get(i))) {
                System.err.println(options.images.get(i) + ": " + controller.getStatus());
                return 1;
            }
            controller.setWeight(i, i < options.weights.size() ? options.weights.get(i) : 1.0);
            if (i < options.components.size()) {
                controller.setComponent(i, options.components.get(i));
            }
        }
        controller.setRegionMode(options.regionMode);
        if (options.regionSize != null) {
            controller.setRegionSize(options.regionSize);
        }

        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<MixEvent> terminal = new AtomicReference<>();
        controller.setEventListener(event -> {
            if (event.getType() == MixEvent.Type.PROGRESS) {
                System.out.println("Progress: " + event.getProgress() + "%");
            } else {
                terminal.set(event);
                done.countDown();
            }
        });

        MixJobHandle handle = controller.startMixing();
        if (handle == null) {
            System.err.println(controller.getStatus());
            return 1;
        }

        try {
            if (!done.await(JOB_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                controller.shutdown();
                System.err.println("Mixing did not finish within " + JOB_TIMEOUT_MINUTES + " minutes");
                return 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            controller.shutdown();
            return 1;
        }

        if (terminal.get().getType() != MixEvent.Type.COMPLETED) {
            System.err.println(controller.getStatus());
            return 1;
        }

        Path output = options.output != null ? options.output : Paths.get(controller.getSettings().getOutputFileName());
        if (!controller.saveOutput(output)) {
            System.err.println(controller.getStatus());
            return 1;
        }
        System.out.println(controller.getStatus());
        return 0;
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--mode":
                    options.mode = ComponentMode.fromLabel(requireValue(args, ++i, arg));
                    if (options.mode == null) {
                        throw new IllegalArgumentException("Unknown mode: " + args[i]);
                    }
                    break;
                case "--components":
                    for (String part : requireValue(args, ++i, arg).split(",")) {
                        ComponentVariant variant = ComponentVariant.fromLabel(part);
                        if (variant == null) {
                            throw new IllegalArgumentException("Unknown component: " + part);
                        }
                        options.components.add(variant);
                    }
                    break;
                case "--weights":
                    for (String part : requireValue(args, ++i, arg).split(",")) {
                        try {
                            options.weights.add(Double.parseDouble(part.trim()));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid weight: " + part);
                        }
                    }
                    break;
                case "--region":
                    options.regionMode = RegionMode.fromLabel(requireValue(args, ++i, arg));
                    break;
                case "--region-size":
                    try {
                        options.regionSize = Integer.parseInt(requireValue(args, ++i, arg).trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid region size: " + args[i]);
                    }
                    break;
                case "--out":
                    options.output = Paths.get(requireValue(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    options.images.add(Paths.get(arg));
                    break;
            }
        }

        if (options.images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required");
        }
        if (options.images.size() > MixerController.SLOT_COUNT) {
            throw new IllegalArgumentException("At most " + MixerController.SLOT_COUNT + " images can be mixed");
        }
        for (ComponentVariant variant : options.components) {
            if (!options.mode.offers(variant)) {
                throw new IllegalArgumentException(variant.getLabel() + " is not available in " + options.mode.getLabel() + " mode");
            }
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void printUsage() {
        System.err.println("Usage: FFTMixerLauncher [--mode magnitude_phase|real_imaginary] "
            + "[--components c1,c2,..] [--weights w1,w2,..] [--region none|inner|outer] "
            + "[--region-size N] [--out file] image1 [image2 [image3 [image4]]]");
    }
}
