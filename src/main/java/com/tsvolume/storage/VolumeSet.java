package com.tsvolume.storage;

import com.tsvolume.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A fixed, ordered set of volumes with exactly one active volume.
 *
 * When the active volume cannot take a point, the set rotates to the next volume
 * (wrapping around) and, if that volume still holds data, evicts it. Rotation is
 * unconditional: old data is sacrificed rather than writes being refused.
 *
 * Writes and rotation decisions are serialized by a single lock. Reads go through
 * {@link #contents()} and {@link #stats()} and never take it.
 */
public class VolumeSet {

    private static final Logger logger = LoggerFactory.getLogger(VolumeSet.class);

    private final List<Volume> volumes;
    private final CapacityPolicy policy;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<VolumeSetSnapshot> snapshot = new AtomicReference<>();

    private volatile int activeIndex;
    private volatile VolumeInvariantViolationException failure;
    private long rotations;
    private long evictions;

    public VolumeSet(int volumeCount, long capacity, CapacityPolicy policy) {
        if (volumeCount <= 0) {
            throw new IllegalArgumentException("Volume count must be positive");
        }
        List<Volume> list = new ArrayList<>(volumeCount);
        for (int i = 0; i < volumeCount; i++) {
            list.add(new Volume(i, capacity));
        }
        this.volumes = Collections.unmodifiableList(list);
        this.policy = policy;
        this.activeIndex = 0;
        publish();
        logger.info("Created volume set: {} volumes of capacity {} ({})", volumeCount, capacity, policy);
    }

    /**
     * Stores the point in the active volume, rotating first if it does not fit.
     *
     * @throws IllegalArgumentException if the point is larger than a whole volume
     * @throws VolumeInvariantViolationException if the set is halted or an invariant breaks;
     *         the set refuses all later writes
     */
    public WriteResult write(DataPoint point) {
        long cost = policy.cost(point);
        if (!fits(point)) {
            throw new IllegalArgumentException(
                    String.format("Point of cost %d can never fit a volume of capacity %d", cost, capacityOf()));
        }
        writeLock.lock();
        try {
            ensureRunning();
            Volume active = volumes.get(activeIndex);
            if (active.tryAppend(point, cost)) {
                publish();
                return WriteResult.accepted(active.getIndex());
            }
            WriteResult result = rotateAndWrite(point, cost);
            publish();
            return result;
        } catch (VolumeInvariantViolationException e) {
            halt(e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private WriteResult rotateAndWrite(DataPoint point, long cost) {
        int previous = activeIndex;
        int next = (previous + 1) % volumes.size();
        Volume target = volumes.get(next);
        int evicted = WriteResult.NO_EVICTION;
        if (!target.isEmpty()) {
            long discarded = target.content().getPointCount();
            target.evict();
            evicted = next;
            evictions++;
            logger.info("Evicted volume {} ({} points discarded), generation now {}",
                    next, discarded, target.getGeneration());
        }
        activeIndex = next;
        rotations++;
        logger.info("Volume {} overflowed, rotated to volume {}", previous, next);

        if (!target.tryAppend(point, cost)) {
            throw new CapacityExceededException(
                    String.format("Point of cost %d does not fit freshly rotated volume %s", cost, target));
        }
        return WriteResult.rotated(next, evicted);
    }

    /**
     * True if the point could be stored in an empty volume.
     */
    public boolean fits(DataPoint point) {
        return policy.cost(point) <= capacityOf();
    }

    /**
     * Current content of every volume, newest (active) first, then backwards in rotation order.
     */
    public List<VolumeContent> contents() {
        int n = volumes.size();
        int active = activeIndex;
        List<VolumeContent> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(volumes.get(Math.floorMod(active - i, n)).content());
        }
        return result;
    }

    /**
     * The most recently published accounting snapshot.
     */
    public VolumeSetSnapshot stats() {
        return snapshot.get();
    }

    public int getVolumeCount() {
        return volumes.size();
    }

    public int getActiveIndex() {
        return activeIndex;
    }

    public CapacityPolicy getPolicy() {
        return policy;
    }

    public boolean isHalted() {
        return failure != null;
    }

    private long capacityOf() {
        return volumes.get(0).getCapacity();
    }

    private void ensureRunning() {
        VolumeInvariantViolationException cause = failure;
        if (cause != null) {
            throw new VolumeInvariantViolationException("Volume set halted: " + cause.getMessage(), cause);
        }
    }

    private void halt(VolumeInvariantViolationException e) {
        if (failure == null) {
            failure = e;
            logger.error("Volume set invariant violated, refusing further writes", e);
        }
    }

    private void publish() {
        snapshot.set(new VolumeSetSnapshot(volumes, activeIndex, rotations, evictions));
    }
}
