package com.tsvolume.query;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;

/**
 * One time-ordered input of a merge: the cached points of a series, or the entries
 * of a series in one volume generation.
 */
abstract class PointSource {

    /**
     * Volume copies outrank cached copies of the same (series, timestamp).
     */
    static final int RANK_VOLUME = 0;
    static final int RANK_CACHE = 1;

    private final int rank;
    private final SeriesKey series;

    PointSource(int rank, SeriesKey series) {
        this.rank = rank;
        this.series = series;
    }

    /**
     * Moves to the next point in the source's direction.
     *
     * @return false once the source is exhausted
     */
    abstract boolean advance();

    /**
     * Timestamp of the current point. Only valid after a successful {@link #advance()}.
     */
    abstract long timestamp();

    abstract DataPoint current();

    int rank() {
        return rank;
    }

    SeriesKey series() {
        return series;
    }
}
