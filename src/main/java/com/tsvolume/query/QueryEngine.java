package com.tsvolume.query;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.ingest.SeriesRegistry;
import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;
import com.tsvolume.model.TimeRange;
import com.tsvolume.storage.ColumnSlice;
import com.tsvolume.storage.VolumeContent;
import com.tsvolume.storage.VolumeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Answers range queries over the write cache and every live volume generation.
 *
 * The cache is copied before any volume is looked at. A point removed from the
 * cache after that copy was written to its volume before the removal, so it shows
 * up in the volume snapshot; either way it is returned exactly once.
 *
 * The engine only reads. It never mutates the cache or the volumes.
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final WriteCache cache;
    private final VolumeSet volumeSet;
    private final SeriesRegistry registry;

    public QueryEngine(WriteCache cache, VolumeSet volumeSet, SeriesRegistry registry) {
        this.cache = cache;
        this.volumeSet = volumeSet;
        this.registry = registry;
    }

    /**
     * Points of one series within the range, in the range's direction.
     */
    public QueryCursor query(SeriesKey series, TimeRange range) {
        if (series == null || range == null) {
            throw new IllegalArgumentException("Series and range are required");
        }
        return open(Collections.singletonList(series), range);
    }

    /**
     * Points of every known series of the metric whose tags match the filter,
     * merged by timestamp; ties are broken by series key.
     */
    public QueryCursor query(String metric, Map<String, String> tagFilter, TimeRange range) {
        if (metric == null || metric.isEmpty() || range == null) {
            throw new IllegalArgumentException("Metric and range are required");
        }
        List<SeriesKey> series = registry.find(metric, tagFilter);
        logger.debug("Metric {} with filter {} resolved to {} series", metric, tagFilter, series.size());
        return open(series, range);
    }

    private QueryCursor open(List<SeriesKey> series, TimeRange range) {
        long min = range.getMinInclusive();
        long max = range.getMaxInclusive();
        List<PointSource> sources = new ArrayList<>();

        for (SeriesKey key : series) {
            List<DataPoint> cached = cache.snapshot(key, min, max);
            if (!cached.isEmpty()) {
                sources.add(new CachedSource(key, cached, range.getDirection()));
            }
        }
        for (VolumeContent content : volumeSet.contents()) {
            for (SeriesKey key : series) {
                ColumnSlice slice = content.slice(key, min, max);
                if (!slice.isEmpty()) {
                    sources.add(new SliceSource(key, slice, range.getDirection()));
                }
            }
        }

        logger.debug("Query over {} series, {}: {} sources", series.size(), range, sources.size());
        return new MergeCursor(sources, range.getDirection());
    }
}
