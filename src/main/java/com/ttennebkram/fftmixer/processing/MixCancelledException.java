package com.ttennebkram.fftmixer.processing;

/**
 * Thrown from a cancellation checkpoint to unwind a mix in progress.
 * The scheduler turns it into a Cancelled event; it never reaches the caller.
 */
public class MixCancelledException extends RuntimeException {

    public MixCancelledException(long jobId) {
        super("Mixing job " + jobId + " cancelled");
    }
}
