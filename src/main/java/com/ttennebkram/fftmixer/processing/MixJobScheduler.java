package com.ttennebkram.fftmixer.processing;

import com.ttennebkram.fftmixer.util.MatTracker;
import org.opencv.core.Mat;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs each mix on its own background thread and pushes progress and
 * terminal events to a single callback.
 *
 * At most one job is active: submitting a new job flags the previous one
 * for cancellation and starts the new one immediately, without waiting for
 * the old thread to unwind. Cancellation is cooperative and checked at the
 * engine's checkpoints.
 *
 * Delivery guarantees:
 * - a job's progress values never decrease and 100 is only sent right before COMPLETED
 * - every delivered job ends with exactly one terminal event
 * - a job that was cancelled before its result was delivered ends with CANCELLED, never COMPLETED
 * - once a job's terminal event has been delivered, nothing from older jobs is delivered
 */
public class MixJobScheduler {

    private static final DateTimeFormatter LOG_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final MixEngine engine;
    private final AtomicLong nextJobId = new AtomicLong(1);

    // Serializes event delivery so ordering checks and callbacks are atomic
    private final Object deliveryLock = new Object();
    private long newestTerminalJobId = 0;

    private volatile MixJobHandle activeJob;
    private volatile Consumer<MixEvent> onEvent;

    public MixJobScheduler() {
        this(new MixEngine());
    }

    public MixJobScheduler(MixEngine engine) {
        this.engine = engine;
    }

    /**
     * Set the callback that receives all events. It is invoked on the job
     * threads, one event at a time. A listener that takes ownership of a
     * COMPLETED result must release it.
     */
    public void setOnEvent(Consumer<MixEvent> callback) {
        this.onEvent = callback;
    }

    /**
     * Start a job. Any running job is flagged for cancellation first, even when
     * the new job then fails validation, so a newer request always preempts older ones.
     * Once this returns, the scheduler owns the job and releases it when done;
     * if validation fails the caller keeps ownership.
     *
     * @throws MixValidationException if the job cannot run; nothing is started
     */
    public synchronized MixJobHandle submit(MixJob job) {
        MixJobHandle previous = activeJob;
        if (previous != null && !previous.isDone()) {
            previous.cancel();
            log("Mixing job " + previous.getId() + " superseded, cancel requested");
        }

        job.validate();

        MixJobHandle handle = new MixJobHandle(nextJobId.getAndIncrement());
        activeJob = handle;

        Thread thread = new Thread(() -> runJob(handle, job), "MixJob-" + handle.getId());
        thread.setDaemon(true);
        thread.start();
        return handle;
    }

    /**
     * Request cancellation of a job. Never blocks.
     */
    public void cancel(MixJobHandle handle) {
        if (handle != null && !handle.isDone()) {
            handle.cancel();
            log("Cancel requested for mixing job " + handle.getId());
        }
    }

    /**
     * Request cancellation of the active job, if any.
     *
     * @return true if a running job was flagged
     */
    public boolean cancelActive() {
        MixJobHandle handle = activeJob;
        if (handle == null || handle.isDone()) {
            return false;
        }
        cancel(handle);
        return true;
    }

    public boolean isRunning() {
        MixJobHandle handle = activeJob;
        return handle != null && !handle.isDone();
    }

    /**
     * Most recently submitted job, or null.
     */
    public MixJobHandle getActiveJob() {
        return activeJob;
    }

    public MixEngine getEngine() {
        return engine;
    }

    // ===== Job thread =====

    private void runJob(MixJobHandle handle, MixJob job) {
        long id = handle.getId();
        log("Mixing job " + id + " started");
        try {
            reportProgress(handle, 0);

            Mat result = engine.mix(job, progress -> {
                if (handle.isCancelRequested()) {
                    throw new MixCancelledException(id);
                }
                reportProgress(handle, progress);
            });
            MatTracker.track(result);

            finish(handle, MixEvent.completed(id, result));
        } catch (MixCancelledException e) {
            finish(handle, MixEvent.cancelled(id));
        } catch (RuntimeException e) {
            logError("Error in mixing job " + id + ": " + e);
            finish(handle, MixEvent.failed(id, "Error in mixing thread: " + e.getMessage()));
        } finally {
            job.release();
        }
    }

    private void reportProgress(MixJobHandle handle, int progress) {
        synchronized (deliveryLock) {
            if (isStale(handle) || progress <= handle.getLastProgress()) {
                return;
            }
            handle.setLastProgress(progress);
            emit(MixEvent.progress(handle.getId(), progress));
        }
    }

    private void finish(MixJobHandle handle, MixEvent terminal) {
        synchronized (deliveryLock) {
            MixEvent event = terminal;
            if (event.getType() == MixEvent.Type.COMPLETED && handle.isCancelRequested()) {
                MatTracker.release(event.getResult());
                event = MixEvent.cancelled(handle.getId());
            }
            handle.setState(stateOf(event));

            switch (event.getType()) {
                case COMPLETED:
                    log("Mixing job " + handle.getId() + " completed");
                    break;
                case CANCELLED:
                    log("Mixing job " + handle.getId() + " cancelled");
                    break;
                default:
                    break;
            }

            if (isStale(handle)) {
                MatTracker.release(event.getResult());
                return;
            }

            if (event.getType() == MixEvent.Type.COMPLETED && handle.getLastProgress() < 100) {
                handle.setLastProgress(100);
                emit(MixEvent.progress(handle.getId(), 100));
            }
            handle.markTerminalDelivered();
            newestTerminalJobId = Math.max(newestTerminalJobId, handle.getId());
            emit(event);
        }
    }

    // Called with deliveryLock held
    private boolean isStale(MixJobHandle handle) {
        return handle.isTerminalDelivered() || handle.getId() < newestTerminalJobId;
    }

    // Called with deliveryLock held
    private void emit(MixEvent event) {
        Consumer<MixEvent> callback = onEvent;
        if (callback == null) {
            MatTracker.release(event.getResult());
            return;
        }
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            logError("Mix event listener failed on " + event + ": " + e);
        }
    }

    private static MixJobHandle.State stateOf(MixEvent event) {
        switch (event.getType()) {
            case COMPLETED:
                return MixJobHandle.State.COMPLETED;
            case FAILED:
                return MixJobHandle.State.FAILED;
            case CANCELLED:
            default:
                return MixJobHandle.State.CANCELLED;
        }
    }

    private static String timestamp() {
        return LocalTime.now().format(LOG_TIME_FORMAT);
    }

    private static void log(String message) {
        System.out.println("[" + timestamp() + "] [" + Thread.currentThread().getName() + "] " + message);
    }

    private static void logError(String message) {
        System.err.println("[" + timestamp() + "] [" + Thread.currentThread().getName() + "] " + message);
    }
}
