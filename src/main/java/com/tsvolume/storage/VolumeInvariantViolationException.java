package com.tsvolume.storage;

/**
 * Raised when the volume set detects a broken internal invariant (free space out of
 * bounds, a point that fits nowhere after rotation, out of order appends). Once thrown
 * the volume set halts and refuses further writes.
 */
public class VolumeInvariantViolationException extends IllegalStateException {

    public VolumeInvariantViolationException(String message) {
        super(message);
    }

    public VolumeInvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
