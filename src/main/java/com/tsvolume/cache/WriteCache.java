package com.tsvolume.cache;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory buffer of points that are ingested but not yet confirmed in a volume.
 *
 * Each series keeps its points in a skip list keyed by timestamp. Inserts and
 * removals are individually atomic; a point is removed at most once.
 */
public class WriteCache {

    private final Map<SeriesKey, ConcurrentSkipListMap<Long, DataPoint>> series = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger();

    /**
     * @return false if a point with the same series and timestamp is already cached
     */
    public boolean add(DataPoint point) {
        ConcurrentSkipListMap<Long, DataPoint> entries =
                series.computeIfAbsent(point.getSeries(), k -> new ConcurrentSkipListMap<>());
        if (entries.putIfAbsent(point.getTimestamp(), point) != null) {
            return false;
        }
        size.incrementAndGet();
        return true;
    }

    /**
     * Removes exactly this point once it has been flushed.
     *
     * @return true if this call removed it
     */
    public boolean remove(DataPoint point) {
        ConcurrentSkipListMap<Long, DataPoint> entries = series.get(point.getSeries());
        if (entries == null) {
            return false;
        }
        if (entries.remove(point.getTimestamp(), point)) {
            size.decrementAndGet();
            return true;
        }
        return false;
    }

    /**
     * Copies the cached points of a series with min &lt;= timestamp &lt;= max, ascending.
     */
    public List<DataPoint> snapshot(SeriesKey key, long min, long max) {
        ConcurrentSkipListMap<Long, DataPoint> entries = series.get(key);
        if (entries == null || min > max) {
            return Collections.emptyList();
        }
        NavigableMap<Long, DataPoint> range = entries.subMap(min, true, max, true);
        return new ArrayList<>(range.values());
    }

    public int size() {
        return size.get();
    }

    public boolean isEmpty() {
        return size.get() == 0;
    }

    @Override
    public String toString() {
        return String.format("WriteCache{series=%d, size=%d}", series.size(), size.get());
    }
}
