package com.tsvolume.query;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.Direction;
import com.tsvolume.model.SeriesKey;
import com.tsvolume.storage.ColumnSlice;

/**
 * Walks a volume slice front to back, or back to front for backward queries.
 */
final class SliceSource extends PointSource {

    private final ColumnSlice slice;
    private final boolean backward;
    private int position;

    SliceSource(SeriesKey series, ColumnSlice slice, Direction direction) {
        super(RANK_VOLUME, series);
        this.slice = slice;
        this.backward = direction == Direction.BACKWARD;
        this.position = backward ? slice.size() : -1;
    }

    @Override
    boolean advance() {
        if (backward) {
            if (position <= 0) {
                return false;
            }
            position--;
            return true;
        }
        if (position + 1 >= slice.size()) {
            return false;
        }
        position++;
        return true;
    }

    @Override
    long timestamp() {
        return slice.timestampAt(position);
    }

    @Override
    DataPoint current() {
        return new DataPoint(series(), slice.timestampAt(position), slice.valueAt(position));
    }
}
