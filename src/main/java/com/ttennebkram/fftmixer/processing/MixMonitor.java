package com.ttennebkram.fftmixer.processing;

/**
 * Checkpoint callback polled by {@link MixEngine} between independent steps.
 * Implementations report progress and throw {@link MixCancelledException}
 * when the running job should stop.
 */
@FunctionalInterface
public interface MixMonitor {

    /** Monitor that never cancels and ignores progress. */
    MixMonitor NONE = progress -> { };

    /**
     * @param progress percentage reached so far, 0-99
     */
    void checkpoint(int progress);
}
