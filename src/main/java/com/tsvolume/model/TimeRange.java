package com.tsvolume.model;

import java.util.Objects;

/**
 * A query time range. The direction follows from the order of the bounds:
 * begin &lt; end reads forward, begin &gt; end reads backward.
 *
 * The range includes begin and excludes end in both directions, so a forward
 * range is [begin, end) and a backward range is (end, begin].
 */
public final class TimeRange {

    private final long begin;
    private final long end;

    public TimeRange(long begin, long end) {
        if (begin == end) {
            throw new IllegalArgumentException("Range begin and end must differ, got " + begin);
        }
        this.begin = begin;
        this.end = end;
    }

    /**
     * Builds the range covering [lower, upper) read in the given direction.
     * Backward reads of the same bounds cover (lower, upper].
     */
    public static TimeRange of(long lower, long upper, Direction direction) {
        if (lower >= upper) {
            throw new IllegalArgumentException("Lower bound must be below upper bound");
        }
        return direction == Direction.FORWARD ? new TimeRange(lower, upper) : new TimeRange(upper, lower);
    }

    public long getBegin() {
        return begin;
    }

    public long getEnd() {
        return end;
    }

    public Direction getDirection() {
        return begin < end ? Direction.FORWARD : Direction.BACKWARD;
    }

    /**
     * Smallest timestamp inside the range.
     */
    public long getMinInclusive() {
        return begin < end ? begin : end + 1;
    }

    /**
     * Largest timestamp inside the range.
     */
    public long getMaxInclusive() {
        return begin < end ? end - 1 : begin;
    }

    public boolean contains(long timestamp) {
        return timestamp >= getMinInclusive() && timestamp <= getMaxInclusive();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeRange that = (TimeRange) o;
        return begin == that.begin && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(begin, end);
    }

    @Override
    public String toString() {
        return String.format("TimeRange{begin=%d, end=%d, direction=%s}", begin, end, getDirection());
    }
}
