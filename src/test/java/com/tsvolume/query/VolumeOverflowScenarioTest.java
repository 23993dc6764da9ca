package com.tsvolume.query;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.config.StorageConfig;
import com.tsvolume.ingest.SeriesRegistry;
import com.tsvolume.ingest.WriteRouter;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;
import com.tsvolume.model.TimeRange;
import com.tsvolume.model.Timestamps;
import com.tsvolume.stats.StatsReporter;
import com.tsvolume.storage.CapacityPolicy;
import com.tsvolume.storage.VolumeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two volumes, batches of 1000 equal-valued points with values 0, 1, 2, ...
 * written until the store rotates into the second volume, then read back
 * newest first.
 */
public class VolumeOverflowScenarioTest {

    private static final int BATCH_SIZE = 1000;
    private static final long BASE = Timestamps.parse("20150101T000000");
    private static final long STEP = 1_000_000L;
    private static final SeriesKey SERIES = SeriesKey.parse("temp tag=test");
    private static final TimeRange FULL_BACKWARD = new TimeRange(
            Timestamps.parse("21000101T000000"), Timestamps.parse("19700101T000000"));

    private VolumeSet volumeSet;
    private WriteRouter router;
    private QueryEngine engine;
    private StatsReporter stats;
    private long nextTimestamp;

    @BeforeEach
    void setUp() {
        StorageConfig config = new StorageConfig();
        config.setVolumeCapacity(100_000);
        config.setPollIntervalMs(1);
        volumeSet = new VolumeSet(2, config.getVolumeCapacity(), CapacityPolicy.BYTES);
        WriteCache cache = new WriteCache();
        SeriesRegistry registry = new SeriesRegistry();
        router = new WriteRouter(volumeSet, cache, registry, config);
        router.start();
        engine = new QueryEngine(cache, volumeSet, registry);
        stats = new StatsReporter(volumeSet, cache, router);
        nextTimestamp = BASE;
    }

    @AfterEach
    void tearDown() {
        router.shutdown();
    }

    private void writeBatch(int value) throws InterruptedException {
        for (int i = 0; i < BATCH_SIZE; i++) {
            assertTrue(router.ingest(new DataPoint(SERIES, nextTimestamp, value)).isAccepted());
            nextTimestamp += STEP;
        }
        assertTrue(router.awaitFlushed(10000));
    }

    private List<Double> queryBackward() {
        List<Double> values = new ArrayList<>();
        try (QueryCursor cursor = engine.query("temp", Map.of("tag", "test"), FULL_BACKWARD)) {
            while (cursor.hasNext()) {
                values.add(cursor.next().getValue());
            }
        }
        return values;
    }

    @Test
    public void testBackwardQueryAfterFirstRotation() throws InterruptedException {
        int value = 0;
        long previousFree = stats.snapshot().get(1);
        while (true) {
            writeBatch(value);
            long free = stats.snapshot().get(1);
            if (free < previousFree) {
                break;
            }
            previousFree = free;
            value++;
            assertTrue(value < 100, "volume 0 never overflowed");
        }
        int highest = value;

        List<Double> values = queryBackward();

        assertEquals((highest + 1) * BATCH_SIZE, values.size());
        for (int block = 0; block <= highest; block++) {
            double expected = highest - block;
            for (int i = 0; i < BATCH_SIZE; i++) {
                assertEquals(expected, values.get(block * BATCH_SIZE + i), 0.0);
            }
        }
        assertEquals(values, queryBackward());
    }

    @Test
    public void testBackwardQueryAfterEviction() throws InterruptedException {
        int value = 0;
        while (volumeSet.stats().getEvictions() < 3) {
            writeBatch(value++);
            assertTrue(value < 1000, "volumes never evicted");
        }
        int highest = value - 1;

        List<Double> values = queryBackward();

        assertFalse(values.isEmpty());
        for (int i = 0; i < BATCH_SIZE; i++) {
            assertEquals(highest, values.get(i), 0.0);
        }
        for (int i = 1; i < values.size(); i++) {
            assertTrue(values.get(i) <= values.get(i - 1));
        }
        // the oldest surviving block may be partial, every newer one is complete
        int oldest = values.get(values.size() - 1).intValue();
        for (int v = oldest + 1; v <= highest; v++) {
            final double expected = v;
            assertEquals(BATCH_SIZE, values.stream().filter(x -> x == expected).count());
        }
    }

    @Test
    public void testActiveVolumeFreeSpaceNeverGrows() throws InterruptedException {
        long previous = stats.snapshot().get(0);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < BATCH_SIZE / 10; j++) {
                router.ingest(new DataPoint(SERIES, nextTimestamp, i));
                nextTimestamp += STEP;
                long free = stats.snapshot().get(0);
                assertTrue(free <= previous);
                previous = free;
            }
        }
        assertTrue(router.awaitFlushed(10000));
        assertTrue(stats.snapshot().get(0) < 100_000L);
    }
}
