package com.ttennebkram.fftmixer;

import com.ttennebkram.fftmixer.model.ComponentMode;
import com.ttennebkram.fftmixer.model.ComponentVariant;
import com.ttennebkram.fftmixer.model.OutputTarget;
import com.ttennebkram.fftmixer.model.RegionMode;
import com.ttennebkram.fftmixer.model.SelectorRegion;
import com.ttennebkram.fftmixer.model.Slot;
import com.ttennebkram.fftmixer.model.WorkingFrame;
import com.ttennebkram.fftmixer.processing.ImageNormalizer;
import com.ttennebkram.fftmixer.processing.MixEvent;
import com.ttennebkram.fftmixer.processing.MixJob;
import com.ttennebkram.fftmixer.processing.MixJobHandle;
import com.ttennebkram.fftmixer.processing.MixJobScheduler;
import com.ttennebkram.fftmixer.processing.MixValidationException;
import com.ttennebkram.fftmixer.processing.SpectralAnalyzer;
import com.ttennebkram.fftmixer.serialization.MixerSettings;
import com.ttennebkram.fftmixer.util.MatTracker;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Control-side owner of the four slots, the selector region, the active modes
 * and the two output viewports. UI layers call into this class; mixing runs
 * on {@link MixJobScheduler} threads against immutable {@link MixJob} snapshots.
 *
 * Every change runs an update cycle. Loading or clearing an image, and changing a
 * weight, a component, the component mode or the region mode, refresh the previews
 * and start a new mix (superseding a running one). Brightness/contrast changes and
 * selector resizing or moving only refresh the previews; {@link #finishRegionAdjustment()}
 * mixes once the selector is released. With auto-mix off, mixing happens only
 * through {@link #startMixing()}.
 */
public class MixerController {

    public static final int SLOT_COUNT = MixJob.SLOT_COUNT;

    private final MixerSettings settings;
    private final Slot[] slots = new Slot[SLOT_COUNT];
    private final ImageNormalizer normalizer = new ImageNormalizer();
    private final SpectralAnalyzer analyzer;
    private final MixJobScheduler scheduler;

    // Guards slots, analyzer, normalizer and the modes; held while taking a job snapshot
    private final Object stateLock = new Object();
    private RegionMode regionMode = RegionMode.NONE;

    // Guards the output viewports
    private final Object outputLock = new Object();
    private final Mat[] outputs = new Mat[OutputTarget.values().length];
    private OutputTarget selectedOutput = OutputTarget.OUTPUT_1;

    // Serializes job submission against event handling so the current job id is always known
    private final Object eventLock = new Object();
    private long currentJobId = 0;

    private volatile String status = "";
    private volatile int progress = 0;
    private volatile Consumer<MixEvent> eventListener;
    private volatile Consumer<Preview> previewListener;
    private volatile boolean autoMix;

    /**
     * Normalized rasters and spectrum previews of one refresh.
     */
    public static class Preview {
        private final WorkingFrame frame;
        private final Mat[] normalized;
        private final Mat[] spectra;

        Preview(WorkingFrame frame, Mat[] normalized, Mat[] spectra) {
            this.frame = frame;
            this.normalized = normalized;
            this.spectra = spectra;
        }

        public WorkingFrame getFrame() {
            return frame;
        }

        public Mat getNormalized(int index) {
            return normalized[index];
        }

        /**
         * Colored spectrum preview (with selector overlay when a region mode is active), or null.
         */
        public Mat getSpectrum(int index) {
            return spectra[index];
        }

        public void release() {
            for (int i = 0; i < SLOT_COUNT; i++) {
                if (normalized[i] != null) normalized[i].release();
                if (spectra[i] != null) spectra[i].release();
                normalized[i] = null;
                spectra[i] = null;
            }
        }
    }

    public MixerController() {
        this(MixerSettings.load());
    }

    public MixerController(MixerSettings settings) {
        this(settings, new MixJobScheduler());
    }

    public MixerController(MixerSettings settings, MixJobScheduler scheduler) {
        this.settings = settings;
        this.analyzer = new SpectralAnalyzer(settings.getDefaultRegionSize());
        this.scheduler = scheduler;
        this.autoMix = settings.isAutoMix();
        for (int i = 0; i < SLOT_COUNT; i++) {
            slots[i] = new Slot(i);
        }
        scheduler.setOnEvent(this::onMixEvent);
    }

    /**
     * Receive every event of the current job after the controller has applied it.
     * COMPLETED results stay owned by the controller; use {@link #getOutput} for a copy.
     */
    public void setEventListener(Consumer<MixEvent> listener) {
        this.eventListener = listener;
    }

    /**
     * Receive a fresh preview after every update cycle. The listener owns the
     * preview and must release it.
     */
    public void setPreviewListener(Consumer<Preview> listener) {
        this.previewListener = listener;
    }

    /**
     * Turn automatic re-mixing on parameter changes on or off.
     */
    public void setAutoMix(boolean autoMix) {
        this.autoMix = autoMix;
    }

    public boolean isAutoMix() {
        return autoMix;
    }

    // ===== Slots =====

    /**
     * Load an image file into a slot as 8-bit grayscale.
     *
     * @return false if the file could not be decoded
     */
    public boolean loadImage(int index, Path path) {
        checkIndex(index);
        Mat image = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        if (image.empty()) {
            image.release();
            status = "Error: Could not read the image file.";
            return false;
        }
        try {
            setImage(index, image);
        } finally {
            image.release();
        }
        return true;
    }

    /**
     * Put a copy of an in-memory raster into a slot. Brightness and contrast are reset
     * and the first component of the active mode is pre-selected if the slot had none.
     */
    public void setImage(int index, Mat image) {
        checkIndex(index);
        synchronized (stateLock) {
            Slot slot = slots[index];
            slot.setImage(image);
            slot.resetAdjustments();
            if (slot.getComponent() == null) {
                slot.setComponent(analyzer.getMode().getDefaultVariant());
            }
            updateWorkingFrame();
        }
        status = "Viewport " + (index + 1) + " loaded.";
        updateCycle(true);
    }

    /**
     * Empty a slot and reset its brightness, contrast, weight and selection.
     * Clearing the last loaded slot cancels any running mix and clears both outputs.
     */
    public void clearImage(int index) {
        checkIndex(index);
        boolean anyLoaded;
        synchronized (stateLock) {
            slots[index].clear();
            updateWorkingFrame();
            anyLoaded = analyzer.getWorkingFrame() != null;
        }
        if (!anyLoaded) {
            abandonCurrentJob();
            clearOutputs();
            Consumer<Preview> listener = previewListener;
            if (listener != null) {
                listener.accept(refreshPreview());
            }
            status = "All viewports cleared.";
        } else {
            updateCycle(true);
            status = "Viewport " + (index + 1) + " cleared.";
        }
    }

    public boolean isLoaded(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            return slots[index].isLoaded();
        }
    }

    public void setWeight(int index, double weight) {
        checkIndex(index);
        synchronized (stateLock) {
            slots[index].setWeight(weight);
        }
        updateCycle(true);
    }

    /**
     * Weight from a 0-100 slider position.
     */
    public void setWeightPercent(int index, int percent) {
        setWeight(index, percent / 100.0);
    }

    public double getWeight(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            return slots[index].getWeight();
        }
    }

    public void setBrightness(int index, int brightness) {
        checkIndex(index);
        synchronized (stateLock) {
            slots[index].setBrightness(brightness);
        }
        updateCycle(false);
    }

    public int getBrightness(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            return slots[index].getBrightness();
        }
    }

    /**
     * Contrast multiplier; negative values are stored as 0.
     */
    public void setContrast(int index, double contrast) {
        checkIndex(index);
        synchronized (stateLock) {
            slots[index].setContrast(contrast);
        }
        updateCycle(false);
    }

    public double getContrast(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            return slots[index].getContrast();
        }
    }

    /**
     * Mouse-drag adjustment: vertical movement changes brightness,
     * horizontal movement changes contrast.
     */
    public void adjustByDrag(int index, int dx, int dy) {
        checkIndex(index);
        synchronized (stateLock) {
            Slot slot = slots[index];
            slot.setBrightness(slot.getBrightness() + dy * settings.getBrightnessPerPixel());
            slot.setContrast(slot.getContrast() + dx * settings.getContrastPerPixel());
        }
        updateCycle(false);
    }

    public void resetAdjustments(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            slots[index].resetAdjustments();
        }
        updateCycle(false);
    }

    // ===== Components =====

    /**
     * Select a slot's component. Null restores the "Select Component" placeholder.
     *
     * @throws IllegalArgumentException if the variant is not offered by the active mode
     */
    public void setComponent(int index, ComponentVariant variant) {
        checkIndex(index);
        synchronized (stateLock) {
            ComponentMode mode = analyzer.getMode();
            if (variant != null && !mode.offers(variant)) {
                throw new IllegalArgumentException(variant.getLabel() + " is not available in " + mode.getLabel() + " mode");
            }
            slots[index].setComponent(variant);
        }
        updateCycle(true);
    }

    public ComponentVariant getComponent(int index) {
        checkIndex(index);
        synchronized (stateLock) {
            return slots[index].getComponent();
        }
    }

    /**
     * Switch the active component mode; every slot is reset to the mode's first variant.
     */
    public void setComponentMode(ComponentMode mode) {
        synchronized (stateLock) {
            analyzer.setMode(mode);
            ComponentVariant first = analyzer.getMode().getDefaultVariant();
            for (Slot slot : slots) {
                slot.setComponent(first);
            }
        }
        updateCycle(true);
    }

    public ComponentMode getComponentMode() {
        synchronized (stateLock) {
            return analyzer.getMode();
        }
    }

    // ===== Region =====

    public void setRegionMode(RegionMode mode) {
        synchronized (stateLock) {
            regionMode = mode != null ? mode : RegionMode.NONE;
        }
        updateCycle(true);
    }

    public RegionMode getRegionMode() {
        synchronized (stateLock) {
            return regionMode;
        }
    }

    /**
     * Resize and recenter the selector.
     *
     * @return false when no image is loaded
     */
    public boolean setRegionSize(int size) {
        boolean resized;
        synchronized (stateLock) {
            resized = analyzer.setRegionSize(size);
        }
        if (!resized) {
            status = "Load an image before changing region size.";
            return false;
        }
        updateCycle(false);
        return true;
    }

    /**
     * Drag the selector to a new origin, clamped to the working frame.
     *
     * @return false when no image is loaded
     */
    public boolean moveRegionTo(int x, int y) {
        boolean moved;
        synchronized (stateLock) {
            moved = analyzer.moveRegionTo(x, y);
        }
        if (moved) {
            updateCycle(false);
        }
        return moved;
    }

    /**
     * The selector was released after resizing or dragging: refresh and mix.
     */
    public void finishRegionAdjustment() {
        updateCycle(true);
    }

    public SelectorRegion getRegion() {
        synchronized (stateLock) {
            return analyzer.getRegion();
        }
    }

    /**
     * Current working frame, or null when no image is loaded.
     */
    public WorkingFrame getWorkingFrame() {
        synchronized (stateLock) {
            return analyzer.getWorkingFrame();
        }
    }

    // ===== Preview =====

    /**
     * Normalize all slots and compute their spectrum previews.
     * The caller must release the returned preview.
     */
    public Preview refreshPreview() {
        synchronized (stateLock) {
            ImageNormalizer.NormalizedImages normalized = normalizer.normalize(rawImages(), brightness(), contrast());
            analyzer.setWorkingFrame(normalized.getFrame());

            Mat[] images = normalized.toArray();
            Mat[] spectra = analyzer.computeComponents(images, components());
            if (regionMode != RegionMode.NONE) {
                for (int i = 0; i < SLOT_COUNT; i++) {
                    if (spectra[i] != null) {
                        Mat withOverlay = analyzer.drawRegionOverlay(spectra[i], regionMode,
                            settings.getOverlayAlpha(), settings.getOverlayBorderThickness());
                        spectra[i].release();
                        spectra[i] = withOverlay;
                    }
                }
            }
            return new Preview(normalized.getFrame(), images, spectra);
        }
    }

    // ===== Mixing =====

    /**
     * Snapshot the current state and submit it. A running job is superseded even
     * when the new request is rejected; its late events are then ignored.
     *
     * @return the new job, or null if validation failed (see {@link #getStatus()})
     */
    public MixJobHandle startMixing() {
        MixJob job = snapshotJob();
        synchronized (eventLock) {
            boolean wasRunning = scheduler.isRunning();
            try {
                MixJobHandle handle = scheduler.submit(job);
                currentJobId = handle.getId();
                progress = 0;
                status = "Mixing...";
                return handle;
            } catch (MixValidationException e) {
                job.release();
                currentJobId = 0;
                status = e.getMessage();
                if (wasRunning) {
                    // A cancelled mix never leaves an output behind
                    progress = 0;
                    clearOutputs();
                } else if (e.getReason() == MixValidationException.Reason.NO_WEIGHTS) {
                    clearOutputs();
                }
                return null;
            }
        }
    }

    /**
     * Immutable copy of everything the mixing thread needs.
     */
    MixJob snapshotJob() {
        synchronized (stateLock) {
            ImageNormalizer.NormalizedImages normalized = normalizer.normalize(rawImages(), brightness(), contrast());
            try {
                analyzer.setWorkingFrame(normalized.getFrame());
                double[] weights = new double[SLOT_COUNT];
                for (int i = 0; i < SLOT_COUNT; i++) {
                    weights[i] = slots[i].getWeight();
                }
                return MixJob.snapshot(normalized.getFrame(), normalized.toArray(), weights, components(),
                    analyzer.getRegion(), regionMode);
            } finally {
                normalized.release();
            }
        }
    }

    /**
     * Request cancellation of the running job. Never blocks.
     */
    public void cancelMixing() {
        if (!scheduler.cancelActive()) {
            status = "No active mixing job.";
        }
    }

    public boolean isMixing() {
        return scheduler.isRunning();
    }

    /**
     * Cancel any running job without waiting for it.
     */
    public void shutdown() {
        if (scheduler.cancelActive()) {
            System.out.println("Cleaning up active worker thread...");
        }
    }

    private void onMixEvent(MixEvent event) {
        synchronized (eventLock) {
            if (event.getJobId() != currentJobId) {
                // Superseded job
                MatTracker.release(event.getResult());
                return;
            }

            switch (event.getType()) {
                case PROGRESS:
                    progress = event.getProgress();
                    break;
                case COMPLETED:
                    synchronized (outputLock) {
                        int target = selectedOutput.ordinal();
                        MatTracker.release(outputs[target]);
                        outputs[target] = event.getResult();
                    }
                    progress = 100;
                    status = "Mixing Complete";
                    break;
                case CANCELLED:
                    progress = 0;
                    status = "Mixing Canceled";
                    clearOutputs();
                    break;
                case FAILED:
                    progress = 0;
                    status = "Error: " + event.getMessage();
                    clearOutputs();
                    break;
                default:
                    break;
            }

            Consumer<MixEvent> listener = eventListener;
            if (listener != null) {
                listener.accept(event);
            }
        }
    }

    // ===== Outputs =====

    public void selectOutput(OutputTarget target) {
        synchronized (outputLock) {
            selectedOutput = target != null ? target : OutputTarget.OUTPUT_1;
        }
    }

    public OutputTarget getSelectedOutput() {
        synchronized (outputLock) {
            return selectedOutput;
        }
    }

    /**
     * Copy of an output raster (caller must release), or null when it is empty.
     */
    public Mat getOutput(OutputTarget target) {
        synchronized (outputLock) {
            Mat output = outputs[target.ordinal()];
            return output != null ? output.clone() : null;
        }
    }

    public boolean hasOutput(OutputTarget target) {
        synchronized (outputLock) {
            return outputs[target.ordinal()] != null;
        }
    }

    public void clearOutputs() {
        synchronized (outputLock) {
            for (int i = 0; i < outputs.length; i++) {
                MatTracker.release(outputs[i]);
                outputs[i] = null;
            }
        }
    }

    /**
     * Write the selected output to a file; the format follows the extension.
     *
     * @return false if the output is empty or could not be written
     */
    public boolean saveOutput(Path path) {
        synchronized (outputLock) {
            Mat output = outputs[selectedOutput.ordinal()];
            if (output == null) {
                status = "Error: The selected output is empty. Nothing to save.";
                return false;
            }
            if (Imgcodecs.imwrite(path.toString(), output)) {
                status = "Output saved to: " + path.getFileName();
                return true;
            }
            status = "Error: Could not save the image file.";
            return false;
        }
    }

    public String getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public MixerSettings getSettings() {
        return settings;
    }

    // ===== Helpers =====

    private void updateCycle(boolean triggerMixing) {
        synchronized (stateLock) {
            if (analyzer.getWorkingFrame() == null) {
                return;
            }
        }
        Consumer<Preview> listener = previewListener;
        if (listener != null) {
            listener.accept(refreshPreview());
        }
        if (triggerMixing && autoMix) {
            startMixing();
        }
    }

    // Cancel the running job and stop applying its events
    private void abandonCurrentJob() {
        synchronized (eventLock) {
            if (scheduler.cancelActive()) {
                progress = 0;
            }
            currentJobId = 0;
        }
    }

    // Called with stateLock held
    private void updateWorkingFrame() {
        analyzer.setWorkingFrame(ImageNormalizer.computeWorkingFrame(rawImages()));
    }

    private Mat[] rawImages() {
        Mat[] images = new Mat[SLOT_COUNT];
        for (int i = 0; i < SLOT_COUNT; i++) {
            images[i] = slots[i].isLoaded() ? slots[i].getImage() : null;
        }
        return images;
    }

    private int[] brightness() {
        int[] values = new int[SLOT_COUNT];
        for (int i = 0; i < SLOT_COUNT; i++) {
            values[i] = slots[i].getBrightness();
        }
        return values;
    }

    private double[] contrast() {
        double[] values = new double[SLOT_COUNT];
        for (int i = 0; i < SLOT_COUNT; i++) {
            values[i] = slots[i].getContrast();
        }
        return values;
    }

    private ComponentVariant[] components() {
        ComponentVariant[] values = new ComponentVariant[SLOT_COUNT];
        for (int i = 0; i < SLOT_COUNT; i++) {
            values[i] = slots[i].getComponent();
        }
        return values;
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= SLOT_COUNT) {
            throw new IndexOutOfBoundsException("Slot index " + index + " outside 0.." + (SLOT_COUNT - 1));
        }
    }
}
