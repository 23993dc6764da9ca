package com.tsvolume.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable point-in-time view of every volume's accounting. A new snapshot is
 * published after each completed write, so reading one never allocates or locks.
 */
public final class VolumeSetSnapshot {

    private final List<VolumeStats> volumes;
    private final Map<Integer, Long> freeSpace;
    private final int activeIndex;
    private final long rotations;
    private final long evictions;

    VolumeSetSnapshot(List<Volume> source, int activeIndex, long rotations, long evictions) {
        List<VolumeStats> stats = new ArrayList<>(source.size());
        Map<Integer, Long> free = new LinkedHashMap<>();
        for (Volume v : source) {
            stats.add(new VolumeStats(v.getIndex(), v.getCapacity(), v.getFreeSpace(),
                    v.getGeneration(), v.getIndex() == activeIndex));
            free.put(v.getIndex(), v.getFreeSpace());
        }
        this.volumes = Collections.unmodifiableList(stats);
        this.freeSpace = Collections.unmodifiableMap(free);
        this.activeIndex = activeIndex;
        this.rotations = rotations;
        this.evictions = evictions;
    }

    public List<VolumeStats> getVolumes() {
        return volumes;
    }

    /**
     * Volume index to free space.
     */
    public Map<Integer, Long> getFreeSpace() {
        return freeSpace;
    }

    public long getFreeSpace(int volumeIndex) {
        return volumes.get(volumeIndex).getFreeSpace();
    }

    public int getActiveIndex() {
        return activeIndex;
    }

    public long getRotations() {
        return rotations;
    }

    public long getEvictions() {
        return evictions;
    }

    @Override
    public String toString() {
        return String.format("VolumeSetSnapshot{active=%d, freeSpace=%s, rotations=%d, evictions=%d}",
                activeIndex, freeSpace, rotations, evictions);
    }

    /**
     * Accounting of a single volume.
     */
    public static final class VolumeStats {
        private final int index;
        private final long capacity;
        private final long freeSpace;
        private final long generation;
        private final boolean active;

        VolumeStats(int index, long capacity, long freeSpace, long generation, boolean active) {
            this.index = index;
            this.capacity = capacity;
            this.freeSpace = freeSpace;
            this.generation = generation;
            this.active = active;
        }

        @JsonProperty("index")
        public int getIndex() { return index; }

        @JsonProperty("capacity")
        public long getCapacity() { return capacity; }

        @JsonProperty("free_space")
        public long getFreeSpace() { return freeSpace; }

        @JsonProperty("generation")
        public long getGeneration() { return generation; }

        @JsonProperty("active")
        public boolean isActive() { return active; }

        @Override
        public String toString() {
            return String.format("VolumeStats{index=%d, capacity=%d, freeSpace=%d, generation=%d, active=%s}",
                    index, capacity, freeSpace, generation, active);
        }
    }
}
