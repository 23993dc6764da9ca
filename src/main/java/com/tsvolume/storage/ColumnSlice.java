package com.tsvolume.storage;

/**
 * An immutable view of a contiguous, time-sorted run of one series' entries in a volume.
 */
public final class ColumnSlice {

    public static final ColumnSlice EMPTY = new ColumnSlice(new long[0], new double[0], 0, 0);

    private final long[] timestamps;
    private final double[] values;
    private final int from;
    private final int to;

    ColumnSlice(long[] timestamps, double[] values, int from, int to) {
        this.timestamps = timestamps;
        this.values = values;
        this.from = from;
        this.to = to;
    }

    public int size() {
        return to - from;
    }

    public boolean isEmpty() {
        return to == from;
    }

    /**
     * Timestamp of the i-th entry of the slice, in ascending order.
     */
    public long timestampAt(int i) {
        return timestamps[from + i];
    }

    public double valueAt(int i) {
        return values[from + i];
    }
}
