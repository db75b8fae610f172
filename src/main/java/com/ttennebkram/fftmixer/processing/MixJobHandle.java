package com.ttennebkram.fftmixer.processing;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side handle of one submitted job.
 * Cancelling only flips a flag; the job thread notices it at its next checkpoint.
 */
public class MixJobHandle {

    /**
     * Lifecycle of a job. The scheduler is idle again once a job reaches a terminal state.
     */
    public enum State {
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED;

        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    private final long id;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile State state = State.RUNNING;

    // Guarded by the scheduler's delivery lock
    private int lastProgress = -1;
    private boolean terminalDelivered = false;

    MixJobHandle(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    /**
     * Request cooperative cancellation. Never blocks.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public State getState() {
        return state;
    }

    public boolean isDone() {
        return state.isTerminal();
    }

    void setState(State state) {
        this.state = state;
    }

    int getLastProgress() {
        return lastProgress;
    }

    void setLastProgress(int lastProgress) {
        this.lastProgress = lastProgress;
    }

    boolean isTerminalDelivered() {
        return terminalDelivered;
    }

    void markTerminalDelivered() {
        this.terminalDelivered = true;
    }

    @Override
    public String toString() {
        return "MixJobHandle[" + id + ", " + state + (isCancelRequested() ? ", cancel requested" : "") + "]";
    }
}
