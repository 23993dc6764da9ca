package com.tsvolume.ingest;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.config.StorageConfig;
import com.tsvolume.model.DataPoint;
import com.tsvolume.storage.VolumeInvariantViolationException;
import com.tsvolume.storage.VolumeSet;
import com.tsvolume.storage.WriteResult;
import com.tsvolume.util.BoundedPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single entry point for ingestion.
 *
 * A point is validated, appended to the write cache (so queries see it at once),
 * and then handed to the volume set: inline in SYNC mode, or through a FIFO queue
 * drained by one flusher thread in ASYNC mode. Once the volume set has stored it,
 * the point is removed from the cache.
 *
 * Points of one series reach the volumes in ingestion order: the late-write check,
 * the cache insert and the enqueue happen under the series' own monitor.
 */
public class WriteRouter {

    private static final Logger logger = LoggerFactory.getLogger(WriteRouter.class);

    private static final long FLUSH_POLL_MS = 100;

    private final VolumeSet volumeSet;
    private final WriteCache cache;
    private final SeriesRegistry registry;
    private final StorageConfig.FlushMode flushMode;
    private final int cacheMaxPoints;
    private final long cacheWaitTimeoutMs;
    private final BoundedPoller poller;
    private final IngestionStats stats;

    // one permit per cache entry; held from reservation until the point is flushed
    private final Semaphore cacheSlots;

    private final BlockingQueue<DataPoint> flushQueue;
    private final AtomicLong pending;
    private final ExecutorService flusher;
    private volatile boolean running;
    private volatile RuntimeException flushFailure;

    public WriteRouter(VolumeSet volumeSet, WriteCache cache, SeriesRegistry registry, StorageConfig config) {
        this.volumeSet = volumeSet;
        this.cache = cache;
        this.registry = registry;
        this.flushMode = config.getFlushMode();
        this.cacheMaxPoints = config.getCacheMaxPoints();
        this.cacheWaitTimeoutMs = config.getCacheWaitTimeoutMs();
        this.poller = new BoundedPoller(config.getPollIntervalMs());
        this.stats = new IngestionStats();
        this.cacheSlots = new Semaphore(cacheMaxPoints);
        this.flushQueue = new LinkedBlockingQueue<>();
        this.pending = new AtomicLong(0);
        this.flusher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "volume-flusher");
            t.setDaemon(true);
            return t;
        });
        this.running = false;
    }

    @PostConstruct
    public void start() {
        running = true;
        if (flushMode == StorageConfig.FlushMode.ASYNC) {
            flusher.submit(this::flushLoop);
        }
        logger.info("WriteRouter started in {} mode", flushMode);
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down WriteRouter, {} points pending flush", pending.get());
        running = false;

        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flusher.shutdownNow();
        }

        logger.info("WriteRouter shutdown complete");
    }

    /**
     * Ingests one point. Returns without waiting for the volume flush in ASYNC mode.
     *
     * @throws VolumeInvariantViolationException if the volume set or the flusher has failed
     * @throws IllegalStateException if the router is not running
     */
    public IngestResult ingest(DataPoint point) {
        if (point == null) {
            throw new IllegalArgumentException("Point cannot be null");
        }
        ensureAccepting();

        if (!Double.isFinite(point.getValue())) {
            return reject(IngestResult.RejectReason.DECODE_ERROR, "Value must be finite: " + point);
        }
        if (!volumeSet.fits(point)) {
            return reject(IngestResult.RejectReason.TOO_LARGE, "Point larger than a volume: " + point);
        }
        if (!reserveCacheSlot()) {
            return reject(IngestResult.RejectReason.CACHE_OVERFLOW,
                    "Write cache held " + cacheMaxPoints + " points for " + cacheWaitTimeoutMs + "ms");
        }

        SeriesRegistry.SeriesState state = registry.register(point.getSeries());
        synchronized (state) {
            if (state.isLate(point.getTimestamp())) {
                cacheSlots.release();
                return reject(IngestResult.RejectReason.LATE_WRITE, String.format(
                        "Timestamp %d not after %d for series '%s'",
                        point.getTimestamp(), state.getLastTimestamp(), point.getSeries()));
            }
            state.advance(point.getTimestamp());
            cache.add(point);
            pending.incrementAndGet();
            if (flushMode == StorageConfig.FlushMode.SYNC) {
                flush(point);
            } else {
                flushQueue.add(point);
            }
        }
        stats.recordAccepted();
        return IngestResult.accepted();
    }

    public List<IngestResult> ingestAll(List<DataPoint> points) {
        List<IngestResult> results = new ArrayList<>(points.size());
        for (DataPoint point : points) {
            results.add(ingest(point));
        }
        return results;
    }

    /**
     * Counts a message the decoder could not turn into a point.
     */
    public IngestResult recordDecodeError(DecodeException error) {
        return reject(IngestResult.RejectReason.DECODE_ERROR,
                "Message " + error.getMessageIndex() + ": " + error.getMessage());
    }

    /**
     * Waits until every accepted point has been flushed to a volume.
     *
     * @return false if points were still pending when the timeout elapsed
     */
    public boolean awaitFlushed(long timeoutMs) throws InterruptedException {
        return poller.await(() -> pending.get() == 0, timeoutMs);
    }

    public long getPendingCount() {
        return pending.get();
    }

    public IngestionStats.Snapshot getStats() {
        return stats.snapshot();
    }

    public StorageConfig.FlushMode getFlushMode() {
        return flushMode;
    }

    /**
     * True once the volume set or the flusher has failed; no further writes are accepted.
     */
    public boolean isHalted() {
        return flushFailure != null || volumeSet.isHalted();
    }

    /**
     * Takes one cache permit, waiting up to the configured timeout for the flusher to free one.
     */
    private boolean reserveCacheSlot() {
        if (cacheSlots.tryAcquire()) {
            return true;
        }
        boolean reserved;
        try {
            reserved = poller.await(() -> isHalted() || cacheSlots.tryAcquire(), cacheWaitTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        // halted while waiting
        ensureAccepting();
        return reserved;
    }

    private void flushLoop() {
        logger.debug("Flusher started");
        while (running || !flushQueue.isEmpty()) {
            DataPoint point;
            try {
                point = flushQueue.poll(FLUSH_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (point == null) {
                continue;
            }
            try {
                flush(point);
            } catch (RuntimeException e) {
                // points stay in the cache and remain queryable
                flushFailure = e;
                logger.error("Flusher stopped, {} points left unflushed, refusing further writes",
                        flushQueue.size() + 1, e);
                return;
            }
        }
        logger.debug("Flusher stopped");
    }

    private void flush(DataPoint point) {
        WriteResult result = volumeSet.write(point);
        if (!cache.remove(point)) {
            throw new VolumeInvariantViolationException("Flushed point missing from write cache: " + point);
        }
        cacheSlots.release();
        pending.decrementAndGet();
        stats.recordFlushed();
        if (result.isRotated()) {
            logger.debug("Flush of {} caused {}", point, result);
        }
    }

    private void ensureAccepting() {
        if (volumeSet.isHalted()) {
            throw new VolumeInvariantViolationException("Volume set halted, writes are refused");
        }
        RuntimeException failure = flushFailure;
        if (failure != null) {
            throw new VolumeInvariantViolationException("Flusher failed, writes are refused: " + failure.getMessage(),
                    failure);
        }
        if (!running) {
            throw new IllegalStateException("WriteRouter is not running");
        }
    }

    private IngestResult reject(IngestResult.RejectReason reason, String message) {
        stats.recordRejected(reason);
        logger.warn("Rejected point ({}): {}", reason, message);
        return IngestResult.rejected(reason, message);
    }
}
