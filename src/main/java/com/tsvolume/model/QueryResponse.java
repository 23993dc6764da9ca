package com.tsvolume.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Materialized query result, used by the JSON API.
 */
public class QueryResponse {

    private final List<DataPoint> points;
    private final String metric;
    private final Direction direction;
    private final long queryTimeMs;
    private final boolean truncated;

    @JsonCreator
    public QueryResponse(
            @JsonProperty("points") List<DataPoint> points,
            @JsonProperty("metric") String metric,
            @JsonProperty("direction") Direction direction,
            @JsonProperty("queryTimeMs") long queryTimeMs,
            @JsonProperty("truncated") boolean truncated) {
        this.points = Objects.requireNonNull(points, "Points cannot be null");
        this.metric = metric;
        this.direction = direction;
        this.queryTimeMs = queryTimeMs;
        this.truncated = truncated;
    }

    public List<DataPoint> getPoints() {
        return points;
    }

    public String getMetric() {
        return metric;
    }

    public Direction getDirection() {
        return direction;
    }

    public long getQueryTimeMs() {
        return queryTimeMs;
    }

    public int getTotalPoints() {
        return points.size();
    }

    public boolean isTruncated() {
        return truncated;
    }

    /**
     * True when nothing in the requested range survives, as opposed to a failed query.
     */
    public boolean isRangeEmpty() {
        return points.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        QueryResponse that = (QueryResponse) o;
        return queryTimeMs == that.queryTimeMs &&
               truncated == that.truncated &&
               direction == that.direction &&
               Objects.equals(points, that.points) &&
               Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, metric, direction, queryTimeMs, truncated);
    }

    @Override
    public String toString() {
        return String.format("QueryResponse{metric='%s', direction=%s, totalPoints=%d, queryTimeMs=%d, truncated=%s}",
                metric, direction, points.size(), queryTimeMs, truncated);
    }
}
