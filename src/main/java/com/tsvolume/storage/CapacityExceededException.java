package com.tsvolume.storage;

/**
 * A point could not be placed even in a freshly rotated volume. Rotation always yields
 * an empty volume, so this only happens if rotation itself is broken.
 */
public class CapacityExceededException extends VolumeInvariantViolationException {

    public CapacityExceededException(String message) {
        super(message);
    }
}
