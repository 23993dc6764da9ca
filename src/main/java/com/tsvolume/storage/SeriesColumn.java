package com.tsvolume.storage;

import java.util.Arrays;

/**
 * Append-only timestamp/value columns of one series inside one volume generation.
 *
 * Slots below {@code size} are never rewritten, so a slice taken under the
 * monitor stays valid after later appends grow the arrays.
 */
final class SeriesColumn {

    private static final int INITIAL_CAPACITY = 64;

    private long[] timestamps = new long[INITIAL_CAPACITY];
    private double[] values = new double[INITIAL_CAPACITY];
    private int size;

    synchronized void append(long timestamp, double value) {
        if (size > 0 && timestamp <= timestamps[size - 1]) {
            throw new VolumeInvariantViolationException(
                    "Out of order append: " + timestamp + " after " + timestamps[size - 1]);
        }
        if (size == timestamps.length) {
            int grown = timestamps.length * 2;
            timestamps = Arrays.copyOf(timestamps, grown);
            values = Arrays.copyOf(values, grown);
        }
        timestamps[size] = timestamp;
        values[size] = value;
        size++;
    }

    /**
     * Returns the stored entries with min &lt;= timestamp &lt;= max.
     */
    synchronized ColumnSlice slice(long min, long max) {
        int from = lowerBound(timestamps, size, min);
        int to = max == Long.MAX_VALUE ? size : lowerBound(timestamps, size, max + 1);
        return new ColumnSlice(timestamps, values, from, Math.max(from, to));
    }

    synchronized int size() {
        return size;
    }

    // First index whose timestamp is >= key.
    private static int lowerBound(long[] ts, int len, long key) {
        int lo = 0;
        int hi = len;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ts[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
