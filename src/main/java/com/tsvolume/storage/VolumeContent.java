package com.tsvolume.storage;

import com.tsvolume.model.SeriesKey;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The data a volume holds during one generation. Eviction replaces the whole
 * object, so a reader holding a reference keeps seeing that generation in full.
 */
public final class VolumeContent {

    private final int volumeIndex;
    private final long generation;
    private final Map<SeriesKey, SeriesColumn> columns = new ConcurrentHashMap<>();
    private final AtomicLong pointCount = new AtomicLong();

    VolumeContent(int volumeIndex, long generation) {
        this.volumeIndex = volumeIndex;
        this.generation = generation;
    }

    void append(SeriesKey series, long timestamp, double value) {
        columns.computeIfAbsent(series, k -> new SeriesColumn()).append(timestamp, value);
        pointCount.incrementAndGet();
    }

    /**
     * Entries of the series with min &lt;= timestamp &lt;= max, ascending.
     */
    public ColumnSlice slice(SeriesKey series, long min, long max) {
        SeriesColumn column = columns.get(series);
        if (column == null) {
            return ColumnSlice.EMPTY;
        }
        return column.slice(min, max);
    }

    public int getVolumeIndex() {
        return volumeIndex;
    }

    public long getGeneration() {
        return generation;
    }

    public long getPointCount() {
        return pointCount.get();
    }

    public boolean isEmpty() {
        return pointCount.get() == 0;
    }
}
