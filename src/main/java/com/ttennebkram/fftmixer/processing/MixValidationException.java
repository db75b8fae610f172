package com.ttennebkram.fftmixer.processing;

/**
 * Raised synchronously when a mix request cannot start.
 * State is left unchanged and no job is created.
 */
public class MixValidationException extends RuntimeException {

    /**
     * Why the request was rejected.
     */
    public enum Reason {
        NO_IMAGES,
        MISSING_COMPONENT,
        NO_WEIGHTS
    }

    private final Reason reason;
    private final int slotIndex;

    public MixValidationException(Reason reason, String message) {
        this(reason, -1, message);
    }

    public MixValidationException(Reason reason, int slotIndex, String message) {
        super(message);
        this.reason = reason;
        this.slotIndex = slotIndex;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Slot the failure refers to, or -1 when it is not slot specific.
     */
    public int getSlotIndex() {
        return slotIndex;
    }
}
