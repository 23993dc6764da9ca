package com.tsvolume.config;

import com.tsvolume.storage.CapacityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the volume storage engine.
 */
@Component
@ConfigurationProperties(prefix = "storage")
public class StorageConfig {

    /**
     * Number of volumes in the set. Fixed for the lifetime of the database.
     */
    private int volumeCount = 2;

    /**
     * Capacity of each volume, in units of the capacity policy.
     */
    private long volumeCapacity = 1024 * 1024;

    /**
     * How a point is charged against volume capacity.
     */
    private CapacityPolicy capacityPolicy = CapacityPolicy.BYTES;

    /**
     * Whether points are moved from the write cache to a volume by a background flusher or inline.
     */
    private FlushMode flushMode = FlushMode.ASYNC;

    /**
     * Maximum number of points held in the write cache.
     */
    private int cacheMaxPoints = 100000;

    /**
     * How long ingest may wait for room in a full write cache before rejecting the point.
     */
    private long cacheWaitTimeoutMs = 5000;

    /**
     * Interval between checks while waiting on the flusher.
     */
    private long pollIntervalMs = 5;

    public enum FlushMode {
        /**
         * A single background flusher drains the cache in ingestion order.
         */
        ASYNC,

        /**
         * Each ingest writes through to the volume set before returning.
         */
        SYNC
    }

    // Getters and Setters
    public int getVolumeCount() {
        return volumeCount;
    }

    public void setVolumeCount(int volumeCount) {
        this.volumeCount = volumeCount;
    }

    public long getVolumeCapacity() {
        return volumeCapacity;
    }

    public void setVolumeCapacity(long volumeCapacity) {
        this.volumeCapacity = volumeCapacity;
    }

    public CapacityPolicy getCapacityPolicy() {
        return capacityPolicy;
    }

    public void setCapacityPolicy(CapacityPolicy capacityPolicy) {
        this.capacityPolicy = capacityPolicy;
    }

    public FlushMode getFlushMode() {
        return flushMode;
    }

    public void setFlushMode(FlushMode flushMode) {
        this.flushMode = flushMode;
    }

    public int getCacheMaxPoints() {
        return cacheMaxPoints;
    }

    public void setCacheMaxPoints(int cacheMaxPoints) {
        this.cacheMaxPoints = cacheMaxPoints;
    }

    public long getCacheWaitTimeoutMs() {
        return cacheWaitTimeoutMs;
    }

    public void setCacheWaitTimeoutMs(long cacheWaitTimeoutMs) {
        this.cacheWaitTimeoutMs = cacheWaitTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public String toString() {
        return String.format("StorageConfig{volumeCount=%d, volumeCapacity=%d, capacityPolicy=%s, flushMode=%s, " +
                           "cacheMaxPoints=%d, cacheWaitTimeoutMs=%d, pollIntervalMs=%d}",
                volumeCount, volumeCapacity, capacityPolicy, flushMode,
                cacheMaxPoints, cacheWaitTimeoutMs, pollIntervalMs);
    }
}
