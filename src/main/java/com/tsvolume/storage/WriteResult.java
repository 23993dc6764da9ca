package com.tsvolume.storage;

/**
 * Outcome of {@link VolumeSet#write}: either the point went into the active volume,
 * or the set rotated first and possibly evicted the volume it rotated into.
 */
public final class WriteResult {

    public static final int NO_EVICTION = -1;

    private final int volumeIndex;
    private final boolean rotated;
    private final int evictedVolumeIndex;

    private WriteResult(int volumeIndex, boolean rotated, int evictedVolumeIndex) {
        this.volumeIndex = volumeIndex;
        this.rotated = rotated;
        this.evictedVolumeIndex = evictedVolumeIndex;
    }

    public static WriteResult accepted(int volumeIndex) {
        return new WriteResult(volumeIndex, false, NO_EVICTION);
    }

    public static WriteResult rotated(int volumeIndex, int evictedVolumeIndex) {
        return new WriteResult(volumeIndex, true, evictedVolumeIndex);
    }

    /**
     * Volume that received the point.
     */
    public int getVolumeIndex() {
        return volumeIndex;
    }

    public boolean isRotated() {
        return rotated;
    }

    public boolean isEvicted() {
        return evictedVolumeIndex != NO_EVICTION;
    }

    public int getEvictedVolumeIndex() {
        return evictedVolumeIndex;
    }

    @Override
    public String toString() {
        if (!rotated) {
            return "Accepted{volume=" + volumeIndex + "}";
        }
        return String.format("Rotated{volume=%d, evicted=%d}", volumeIndex, evictedVolumeIndex);
    }
}
