package com.tsvolume.query;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.Direction;
import com.tsvolume.model.SeriesKey;

import java.util.List;

/**
 * Walks a copied, ascending list of cached points in the query direction.
 */
final class CachedSource extends PointSource {

    private final List<DataPoint> points;
    private final boolean backward;
    private int position;

    CachedSource(SeriesKey series, List<DataPoint> points, Direction direction) {
        super(RANK_CACHE, series);
        this.points = points;
        this.backward = direction == Direction.BACKWARD;
        this.position = backward ? points.size() : -1;
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
        if (position + 1 >= points.size()) {
            return false;
        }
        position++;
        return true;
    }

    @Override
    long timestamp() {
        return points.get(position).getTimestamp();
    }

    @Override
    DataPoint current() {
        return points.get(position);
    }
}
