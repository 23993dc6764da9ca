package com.tsvolume.storage;

import com.tsvolume.model.DataPoint;

/**
 * Decides how much of a volume's capacity a point consumes.
 */
public enum CapacityPolicy {

    /**
     * Capacity is a byte count; a point costs its encoded size.
     */
    BYTES {
        @Override
        public long cost(DataPoint point) {
            return point.getEncodedSize();
        }
    },

    /**
     * Capacity is a point count; every point costs one unit.
     */
    POINTS {
        @Override
        public long cost(DataPoint point) {
            return 1;
        }
    };

    public abstract long cost(DataPoint point);
}
