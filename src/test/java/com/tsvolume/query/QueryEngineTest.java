package com.tsvolume.query;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.config.StorageConfig;
import com.tsvolume.ingest.SeriesRegistry;
import com.tsvolume.ingest.WriteRouter;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.Direction;
import com.tsvolume.model.SeriesKey;
import com.tsvolume.model.TimeRange;
import com.tsvolume.storage.CapacityPolicy;
import com.tsvolume.storage.VolumeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {

    private static final SeriesKey SERIES = SeriesKey.parse("temp tag=test");

    private VolumeSet volumeSet;
    private WriteCache cache;
    private SeriesRegistry registry;
    private WriteRouter router;
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        volumeSet = new VolumeSet(2, 10, CapacityPolicy.POINTS);
        cache = new WriteCache();
        registry = new SeriesRegistry();
        StorageConfig config = new StorageConfig();
        config.setFlushMode(StorageConfig.FlushMode.SYNC);
        router = new WriteRouter(volumeSet, cache, registry, config);
        router.start();
        engine = new QueryEngine(cache, volumeSet, registry);
    }

    @AfterEach
    void tearDown() {
        router.shutdown();
    }

    private static List<DataPoint> drain(QueryCursor cursor) {
        List<DataPoint> result = new ArrayList<>();
        try (QueryCursor c = cursor) {
            while (c.hasNext()) {
                result.add(c.next());
            }
        }
        return result;
    }

    private static List<DataPoint> reversed(List<DataPoint> points) {
        List<DataPoint> result = new ArrayList<>(points);
        Collections.reverse(result);
        return result;
    }

    private static List<Long> timestamps(List<DataPoint> points) {
        List<Long> result = new ArrayList<>();
        for (DataPoint p : points) {
            result.add(p.getTimestamp());
        }
        return result;
    }

    @Test
    public void testForwardAndBackwardAcrossVolumes() {
        for (long ts = 1; ts <= 15; ts++) {
            router.ingest(new DataPoint(SERIES, ts, ts));
        }

        List<DataPoint> forward = drain(engine.query(SERIES, new TimeRange(3, 13)));
        List<DataPoint> backward = drain(engine.query(SERIES, new TimeRange(13, 3)));

        assertEquals(List.of(3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L), timestamps(forward));
        assertEquals(List.of(13L, 12L, 11L, 10L, 9L, 8L, 7L, 6L, 5L, 4L), timestamps(backward));
    }

    @Test
    public void testEvictedDataIsGone() {
        for (long ts = 1; ts <= 25; ts++) {
            router.ingest(new DataPoint(SERIES, ts, ts));
        }

        List<DataPoint> all = drain(engine.query(SERIES, new TimeRange(0, 100)));

        // volume 0 was evicted when point 21 arrived
        assertEquals(15, all.size());
        assertEquals(11L, all.get(0).getTimestamp());
        assertEquals(25L, all.get(14).getTimestamp());
    }

    @Test
    public void testEmptyRangeIsNotAnError() {
        router.ingest(new DataPoint(SERIES, 5, 1.0));

        QueryCursor cursor = engine.query(SERIES, new TimeRange(100, 200));

        assertTrue(cursor.isEmpty());
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
        cursor.close();
        assertTrue(drain(engine.query(SeriesKey.parse("unknown"), new TimeRange(0, 10))).isEmpty());
    }

    @Test
    public void testCachedPointsAreVisible() {
        cache.add(new DataPoint(SERIES, 7, 7.0));
        volumeSet.write(new DataPoint(SERIES, 5, 5.0));

        List<DataPoint> result = drain(engine.query(SERIES, new TimeRange(10, 0)));

        assertEquals(List.of(7L, 5L), timestamps(result));
    }

    @Test
    public void testPointInCacheAndVolumeReturnedOnce() {
        DataPoint point = new DataPoint(SERIES, 5, 5.0);
        volumeSet.write(point);
        cache.add(point);

        List<DataPoint> result = drain(engine.query(SERIES, new TimeRange(0, 10)));

        assertEquals(1, result.size());
        assertEquals(point, result.get(0));
    }

    @Test
    public void testFlushDuringOpenQueryReturnsPointOnce() {
        DataPoint point = new DataPoint(SERIES, 5, 5.0);
        cache.add(point);

        QueryCursor cursor = engine.query(SERIES, new TimeRange(0, 10));
        volumeSet.write(point);
        cache.remove(point);

        assertEquals(1, drain(cursor).size());
        assertEquals(1, drain(engine.query(SERIES, new TimeRange(0, 10))).size());
    }

    @Test
    public void testOpenCursorSurvivesEviction() {
        for (long ts = 1; ts <= 20; ts++) {
            router.ingest(new DataPoint(SERIES, ts, ts));
        }
        QueryCursor cursor = engine.query(SERIES, new TimeRange(100, 0));

        router.ingest(new DataPoint(SERIES, 21, 21));

        List<DataPoint> result = drain(cursor);
        assertEquals(20, result.size());
        assertEquals(20L, result.get(0).getTimestamp());
        assertEquals(1L, result.get(19).getTimestamp());
    }

    @Test
    public void testRepeatedQueryIsIdempotent() {
        for (long ts = 1; ts <= 18; ts++) {
            router.ingest(new DataPoint(SERIES, ts, ts * 2));
        }

        List<DataPoint> first = drain(engine.query(SERIES, new TimeRange(100, 0)));
        List<DataPoint> second = drain(engine.query(SERIES, new TimeRange(100, 0)));

        assertEquals(first, second);
    }

    @Test
    public void testMetricQueryMergesSeriesWithTagFilter() {
        SeriesKey a = SeriesKey.parse("cpu host=a");
        SeriesKey b = SeriesKey.parse("cpu host=b");
        SeriesKey c = SeriesKey.parse("cpu host=c dc=east");
        router.ingest(new DataPoint(a, 1, 1));
        router.ingest(new DataPoint(b, 1, 2));
        router.ingest(new DataPoint(a, 2, 3));
        router.ingest(new DataPoint(c, 2, 4));
        router.ingest(new DataPoint(SeriesKey.parse("mem host=a"), 1, 5));

        List<DataPoint> all = drain(engine.query("cpu", Map.of(), new TimeRange(0, 10)));
        List<DataPoint> east = drain(engine.query("cpu", Map.of("dc", "east"), new TimeRange(0, 10)));
        List<DataPoint> backward = drain(engine.query("cpu", null, new TimeRange(10, 0)));

        assertEquals(4, all.size());
        assertEquals(a, all.get(0).getSeries());
        assertEquals(b, all.get(1).getSeries());
        // "cpu dc=east host=c" sorts ahead of "cpu host=a" at the same timestamp
        assertEquals(c, all.get(2).getSeries());
        assertEquals(a, all.get(3).getSeries());
        assertEquals(1, east.size());
        assertEquals(4.0, east.get(0).getValue());
        assertEquals(Direction.BACKWARD, engine.query("cpu", null, new TimeRange(10, 0)).getDirection());
        assertEquals(reversed(all), backward);
    }

    @Test
    public void testBackwardMetricQueryIsForwardReversed() {
        SeriesKey a = SeriesKey.parse("cpu host=a");
        SeriesKey b = SeriesKey.parse("cpu host=b");
        router.ingest(new DataPoint(a, 5, 1));
        router.ingest(new DataPoint(b, 5, 2));
        // the newer pair is still unflushed
        cache.add(new DataPoint(b, 6, 3));
        cache.add(new DataPoint(a, 6, 4));

        List<DataPoint> forward = drain(engine.query("cpu", null, new TimeRange(0, 10)));
        List<DataPoint> backward = drain(engine.query("cpu", null, new TimeRange(10, 0)));

        assertEquals(4, forward.size());
        assertEquals(a, forward.get(0).getSeries());
        assertEquals(b, forward.get(1).getSeries());
        assertEquals(reversed(forward), backward);
        assertEquals(a, backward.get(1).getSeries());
        assertEquals(6L, backward.get(1).getTimestamp());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> engine.query((SeriesKey) null, new TimeRange(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> engine.query("", null, new TimeRange(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> engine.query("cpu", null, null));
    }

    @Test
    public void testClosedCursorYieldsNothing() {
        router.ingest(new DataPoint(SERIES, 1, 1));
        QueryCursor cursor = engine.query(SERIES, new TimeRange(0, 10));

        cursor.close();
        cursor.close();

        assertFalse(cursor.hasNext());
    }
}
