package com.tsvolume.model;

/**
 * Time order of a query result.
 */
public enum Direction {
    /**
     * Ascending timestamps.
     */
    FORWARD,

    /**
     * Descending timestamps.
     */
    BACKWARD
}
