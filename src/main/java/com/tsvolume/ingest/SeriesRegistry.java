package com.tsvolume.ingest;

import com.tsvolume.model.SeriesKey;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Every series that has ever been ingested, with the per-series ordering state
 * the write router needs. Series are never forgotten, even after their data is evicted.
 */
public class SeriesRegistry {

    private final ConcurrentNavigableMap<SeriesKey, SeriesState> series = new ConcurrentSkipListMap<>();

    SeriesState register(SeriesKey key) {
        return series.computeIfAbsent(key, k -> new SeriesState());
    }

    public boolean contains(SeriesKey key) {
        return series.containsKey(key);
    }

    /**
     * Known series of the metric whose tags contain every entry of the filter, in key order.
     */
    public List<SeriesKey> find(String metric, Map<String, String> tagFilter) {
        return series.keySet().stream()
                .filter(k -> k.matches(metric, tagFilter))
                .collect(Collectors.toList());
    }

    public int size() {
        return series.size();
    }

    /**
     * Last accepted timestamp of one series. Guarded by its own monitor.
     */
    static final class SeriesState {
        private boolean hasLast;
        private long lastTimestamp;

        boolean isLate(long timestamp) {
            return hasLast && timestamp <= lastTimestamp;
        }

        void advance(long timestamp) {
            hasLast = true;
            lastTimestamp = timestamp;
        }

        long getLastTimestamp() {
            return lastTimestamp;
        }
    }
}
