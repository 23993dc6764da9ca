package com.tsvolume.stats;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.ingest.WriteRouter;
import com.tsvolume.storage.VolumeSet;
import com.tsvolume.storage.VolumeSetSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of volume accounting for external polling.
 *
 * {@link #snapshot()} hands out the snapshot the volume set published after its
 * last completed write; it takes no lock and mutates nothing.
 */
public class StatsReporter {

    private final VolumeSet volumeSet;
    private final WriteCache cache;
    private final WriteRouter router;

    public StatsReporter(VolumeSet volumeSet, WriteCache cache, WriteRouter router) {
        this.volumeSet = volumeSet;
        this.cache = cache;
        this.router = router;
    }

    /**
     * Volume index to free space.
     */
    public Map<Integer, Long> snapshot() {
        return volumeSet.stats().getFreeSpace();
    }

    public boolean isHalted() {
        return router.isHalted();
    }

    public VolumeSetSnapshot volumes() {
        return volumeSet.stats();
    }

    /**
     * The stats document: one "volume_N" entry per volume, followed by engine,
     * cache and ingestion sections.
     */
    public Map<String, Object> report() {
        VolumeSetSnapshot volumes = volumeSet.stats();
        Map<String, Object> document = new LinkedHashMap<>();
        for (VolumeSetSnapshot.VolumeStats stats : volumes.getVolumes()) {
            document.put("volume_" + stats.getIndex(), stats);
        }

        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("active_volume", volumes.getActiveIndex());
        engine.put("rotations", volumes.getRotations());
        engine.put("evictions", volumes.getEvictions());
        engine.put("capacity_policy", volumeSet.getPolicy());
        engine.put("halted", router.isHalted());
        document.put("engine", engine);

        Map<String, Object> cacheStats = new LinkedHashMap<>();
        cacheStats.put("size", cache.size());
        cacheStats.put("pending_flush", router.getPendingCount());
        document.put("cache", cacheStats);

        document.put("ingestion", router.getStats());
        return document;
    }
}
