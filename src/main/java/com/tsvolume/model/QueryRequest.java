package com.tsvolume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A query document:
 * <pre>
 * {"select": "temp",
 *  "range": {"from": "21000101T000000", "to": "19700101T000000"},
 *  "where": {"tag": "test"},
 *  "output": {"format": "csv"},
 *  "limit": 0}
 * </pre>
 * "from" later than "to" asks for a backward (descending) read. Bounds are ISO basic
 * timestamps or integer nanoseconds.
 */
public class QueryRequest {

    private final String metric;
    private final TimeRange range;
    private final Map<String, String> tags;
    private final OutputFormat format;
    private final int limit;

    public QueryRequest(String metric, TimeRange range, Map<String, String> tags, OutputFormat format, int limit) {
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        this.range = Objects.requireNonNull(range, "Range cannot be null");
        this.tags = tags != null ? Collections.unmodifiableMap(tags) : Collections.emptyMap();
        this.format = format != null ? format : OutputFormat.CSV;
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        this.limit = limit;
    }

    public QueryRequest(String metric, long begin, long end) {
        this(metric, new TimeRange(begin, end), null, null, 0);
    }

    @JsonCreator
    public static QueryRequest fromJson(
            @JsonProperty("select") String select,
            @JsonProperty("range") Range range,
            @JsonProperty("where") Map<String, String> where,
            @JsonProperty("output") Output output,
            @JsonProperty("limit") Integer limit) {
        if (select == null || select.isEmpty()) {
            throw new IllegalArgumentException("Query must name a metric in 'select'");
        }
        if (range == null || range.from == null || range.to == null) {
            throw new IllegalArgumentException("Query must give 'range.from' and 'range.to'");
        }
        TimeRange timeRange = new TimeRange(Timestamps.parse(range.from), Timestamps.parse(range.to));
        OutputFormat format = output != null ? OutputFormat.parse(output.format) : OutputFormat.CSV;
        return new QueryRequest(select, timeRange, where, format, limit != null ? limit : 0);
    }

    public String getMetric() {
        return metric;
    }

    public TimeRange getRange() {
        return range;
    }

    public Direction getDirection() {
        return range.getDirection();
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public OutputFormat getFormat() {
        return format;
    }

    /**
     * Maximum number of rows to return; 0 means unlimited.
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Checks if this query matches the given point.
     */
    public boolean matches(DataPoint point) {
        return point.getSeries().matches(metric, tags) && range.contains(point.getTimestamp());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        QueryRequest that = (QueryRequest) o;
        return limit == that.limit &&
               Objects.equals(metric, that.metric) &&
               Objects.equals(range, that.range) &&
               Objects.equals(tags, that.tags) &&
               format == that.format;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, range, tags, format, limit);
    }

    @Override
    public String toString() {
        return String.format("QueryRequest{metric='%s', range=%s, tags=%s, format=%s, limit=%d}",
                metric, range, tags, format, limit);
    }

    /**
     * The "range" object of a query document.
     */
    public static class Range {
        private final String from;
        private final String to;

        @JsonCreator
        public Range(@JsonProperty("from") String from, @JsonProperty("to") String to) {
            this.from = from;
            this.to = to;
        }
    }

    /**
     * The "output" object of a query document.
     */
    public static class Output {
        private final String format;

        @JsonCreator
        public Output(@JsonProperty("format") String format) {
            this.format = format;
        }
    }
}
