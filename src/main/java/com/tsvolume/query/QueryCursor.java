package com.tsvolume.query;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.Direction;

import java.util.Iterator;

/**
 * Lazy, time-ordered result of a query. Closing releases the snapshots the cursor
 * holds; it is safe to close more than once.
 */
public interface QueryCursor extends Iterator<DataPoint>, AutoCloseable {

    Direction getDirection();

    /**
     * True if nothing in the requested range survives, which is a valid outcome
     * rather than an error. Does not consume any point.
     */
    default boolean isEmpty() {
        return !hasNext();
    }

    @Override
    void close();
}
