package com.tsvolume.query;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.Direction;
import com.tsvolume.model.SeriesKey;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Merges time-ordered sources into one stream using a heap keyed on
 * ((timestamp, series key) in query direction, source rank). A backward read
 * is the forward read reversed.
 *
 * Equal (series, timestamp) pairs from several sources collapse to the first one
 * popped, which is the volume copy because volumes rank ahead of the cache.
 */
final class MergeCursor implements QueryCursor {

    private final Direction direction;
    private final PriorityQueue<PointSource> heap;
    private DataPoint next;
    private SeriesKey lastSeries;
    private long lastTimestamp;
    private boolean closed;

    MergeCursor(List<PointSource> sources, Direction direction) {
        this.direction = direction;
        Comparator<PointSource> byKey = Comparator.comparingLong(PointSource::timestamp)
                .thenComparing(PointSource::series);
        if (direction == Direction.BACKWARD) {
            byKey = byKey.reversed();
        }
        this.heap = new PriorityQueue<>(Math.max(1, sources.size()),
                byKey.thenComparingInt(PointSource::rank));
        for (PointSource source : sources) {
            if (source.advance()) {
                heap.add(source);
            }
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        next = pull();
        return next != null;
    }

    @Override
    public DataPoint next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DataPoint result = next;
        next = null;
        return result;
    }

    @Override
    public Direction getDirection() {
        return direction;
    }

    @Override
    public void close() {
        closed = true;
        next = null;
        heap.clear();
    }

    private DataPoint pull() {
        while (!heap.isEmpty()) {
            PointSource top = heap.poll();
            long timestamp = top.timestamp();
            SeriesKey series = top.series();
            boolean duplicate = lastSeries != null && timestamp == lastTimestamp && series.equals(lastSeries);
            DataPoint point = duplicate ? null : top.current();
            if (top.advance()) {
                heap.add(top);
            }
            if (point != null) {
                lastSeries = series;
                lastTimestamp = timestamp;
                return point;
            }
        }
        return null;
    }
}
