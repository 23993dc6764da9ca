package com.tsvolume.storage;

import com.tsvolume.model.DataPoint;

/**
 * A fixed-capacity, append-only storage region.
 *
 * Mutations ({@link #tryAppend}, {@link #evict}) are only issued by the owning
 * {@link VolumeSet} while it holds its write lock. Readers use {@link #content()}
 * and {@link #getFreeSpace()} without locking.
 */
public class Volume {

    private final int index;
    private final long capacity;
    private volatile long freeSpace;
    private volatile VolumeContent content;

    public Volume(int index, long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Volume capacity must be positive");
        }
        this.index = index;
        this.capacity = capacity;
        this.freeSpace = capacity;
        this.content = new VolumeContent(index, 0);
    }

    /**
     * Appends the point if {@code cost} fits into the remaining free space.
     *
     * @return false if the volume is too full, leaving it untouched
     */
    boolean tryAppend(DataPoint point, long cost) {
        long free = freeSpace;
        if (cost > free) {
            return false;
        }
        content.append(point.getSeries(), point.getTimestamp(), point.getValue());
        long remaining = free - cost;
        checkBounds(remaining);
        freeSpace = remaining;
        return true;
    }

    /**
     * Discards the current generation's data and restores full capacity.
     */
    void evict() {
        content = new VolumeContent(index, content.getGeneration() + 1);
        freeSpace = capacity;
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    public VolumeContent content() {
        return content;
    }

    public int getIndex() {
        return index;
    }

    public long getCapacity() {
        return capacity;
    }

    public long getFreeSpace() {
        return freeSpace;
    }

    public long getGeneration() {
        return content.getGeneration();
    }

    private void checkBounds(long free) {
        if (free < 0 || free > capacity) {
            throw new VolumeInvariantViolationException(
                    String.format("Free space of volume %d out of bounds: %d (capacity %d)", index, free, capacity));
        }
    }

    @Override
    public String toString() {
        return String.format("Volume{index=%d, capacity=%d, freeSpace=%d, generation=%d}",
                index, capacity, freeSpace, getGeneration());
    }
}
