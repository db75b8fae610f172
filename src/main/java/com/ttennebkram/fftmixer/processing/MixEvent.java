package com.ttennebkram.fftmixer.processing;

import org.opencv.core.Mat;

/**
 * Event pushed from a mixing job to the control side.
 * Every event carries the id of the job that produced it.
 */
public final class MixEvent {

    public enum Type {
        PROGRESS,
        COMPLETED,
        CANCELLED,
        FAILED
    }

    private final Type type;
    private final long jobId;
    private final int progress;
    private final Mat result;
    private final String message;

    private MixEvent(Type type, long jobId, int progress, Mat result, String message) {
        this.type = type;
        this.jobId = jobId;
        this.progress = progress;
        this.result = result;
        this.message = message;
    }

    public static MixEvent progress(long jobId, int progress) {
        return new MixEvent(Type.PROGRESS, jobId, progress, null, null);
    }

    /**
     * The receiver owns the result Mat and must release it.
     */
    public static MixEvent completed(long jobId, Mat result) {
        return new MixEvent(Type.COMPLETED, jobId, 100, result, null);
    }

    public static MixEvent cancelled(long jobId) {
        return new MixEvent(Type.CANCELLED, jobId, 0, null, null);
    }

    public static MixEvent failed(long jobId, String message) {
        return new MixEvent(Type.FAILED, jobId, 0, null, message);
    }

    public Type getType() {
        return type;
    }

    public long getJobId() {
        return jobId;
    }

    public int getProgress() {
        return progress;
    }

    /**
     * Mixed raster for COMPLETED events, null otherwise.
     */
    public Mat getResult() {
        return result;
    }

    /**
     * Failure reason for FAILED events, null otherwise.
     */
    public String getMessage() {
        return message;
    }

    public boolean isTerminal() {
        return type != Type.PROGRESS;
    }

    @Override
    public String toString() {
        switch (type) {
            case PROGRESS:
                return "MixEvent[job " + jobId + " progress " + progress + "]";
            case FAILED:
                return "MixEvent[job " + jobId + " failed: " + message + "]";
            default:
                return "MixEvent[job " + jobId + " " + type + "]";
        }
    }
}
