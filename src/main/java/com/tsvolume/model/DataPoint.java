package com.tsvolume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * A single time-series sample. Timestamps are nanoseconds since the epoch.
 */
public final class DataPoint {

    /**
     * Length prefix + timestamp (long) + value (double); the key bytes come on top.
     */
    private static final int FIXED_ENCODED_SIZE = 4 + 8 + 8;

    private final SeriesKey series;
    private final long timestamp;
    private final double value;

    public DataPoint(SeriesKey series, long timestamp, double value) {
        this.series = Objects.requireNonNull(series, "Series cannot be null");
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * JSON form accepts either "series" as a full series name, or "metric" with an optional "tags" map.
     */
    @JsonCreator
    public static DataPoint fromJson(
            @JsonProperty("series") String series,
            @JsonProperty("metric") String metric,
            @JsonProperty("tags") Map<String, String> tags,
            @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("value") Double value) {
        if (timestamp == null || value == null) {
            throw new IllegalArgumentException("Point must carry both timestamp and value");
        }
        SeriesKey key;
        if (series != null) {
            key = SeriesKey.parse(series);
        } else if (metric != null) {
            key = SeriesKey.validate(new SeriesKey(metric, tags));
        } else {
            throw new IllegalArgumentException("Either series or metric must be given");
        }
        return new DataPoint(key, timestamp, value);
    }

    @JsonProperty("series")
    public SeriesKey getSeries() {
        return series;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    /**
     * Size of this point in a volume's storage layout, in bytes.
     */
    @JsonIgnore
    public int getEncodedSize() {
        return FIXED_ENCODED_SIZE + series.encodedLength();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        DataPoint that = (DataPoint) o;
        return timestamp == that.timestamp &&
               Double.compare(that.value, value) == 0 &&
               series.equals(that.series);
    }

    @Override
    public int hashCode() {
        return Objects.hash(series, timestamp, value);
    }

    @Override
    public String toString() {
        return String.format("DataPoint{series='%s', timestamp=%d, value=%s}", series, timestamp, value);
    }
}
