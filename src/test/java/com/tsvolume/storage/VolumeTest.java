package com.tsvolume.storage;

import com.tsvolume.model.DataPoint;
import com.tsvolume.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VolumeTest {

    private static final SeriesKey SERIES = SeriesKey.parse("temp tag=test");

    private Volume volume;

    @BeforeEach
    void setUp() {
        volume = new Volume(0, 100);
    }

    @Test
    public void testAppendConsumesFreeSpace() {
        assertTrue(volume.isEmpty());
        assertTrue(volume.tryAppend(new DataPoint(SERIES, 1, 1.0), 40));
        assertTrue(volume.tryAppend(new DataPoint(SERIES, 2, 2.0), 60));

        assertEquals(0, volume.getFreeSpace());
        assertFalse(volume.isEmpty());
        assertEquals(2, volume.content().getPointCount());
    }

    @Test
    public void testAppendThatDoesNotFitLeavesVolumeUntouched() {
        volume.tryAppend(new DataPoint(SERIES, 1, 1.0), 90);

        assertFalse(volume.tryAppend(new DataPoint(SERIES, 2, 2.0), 11));
        assertEquals(10, volume.getFreeSpace());
        assertEquals(1, volume.content().getPointCount());
    }

    @Test
    public void testEvictStartsNewGeneration() {
        volume.tryAppend(new DataPoint(SERIES, 1, 1.0), 50);
        VolumeContent old = volume.content();

        volume.evict();

        assertEquals(1, volume.getGeneration());
        assertEquals(100, volume.getFreeSpace());
        assertTrue(volume.isEmpty());
        // a reader still holding the old generation sees it in full
        assertEquals(1, old.slice(SERIES, Long.MIN_VALUE, Long.MAX_VALUE).size());
        assertEquals(0, old.getGeneration());
    }

    @Test
    public void testOutOfOrderAppendViolatesInvariant() {
        volume.tryAppend(new DataPoint(SERIES, 10, 1.0), 1);
        assertThrows(VolumeInvariantViolationException.class,
                () -> volume.tryAppend(new DataPoint(SERIES, 10, 2.0), 1));
    }

    @Test
    public void testNonPositiveCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Volume(0, 0));
    }

    @Test
    public void testSliceBounds() {
        for (long ts = 10; ts <= 50; ts += 10) {
            volume.tryAppend(new DataPoint(SERIES, ts, ts), 1);
        }
        ColumnSlice slice = volume.content().slice(SERIES, 15, 40);

        assertEquals(3, slice.size());
        assertEquals(20, slice.timestampAt(0));
        assertEquals(40, slice.timestampAt(2));
        assertEquals(40.0, slice.valueAt(2));
        assertTrue(volume.content().slice(SERIES, 51, 60).isEmpty());
        assertTrue(volume.content().slice(SeriesKey.parse("other"), 0, 100).isEmpty());
    }

    @Test
    public void testSliceSurvivesLaterAppends() {
        for (long ts = 1; ts <= 64; ts++) {
            volume.tryAppend(new DataPoint(SERIES, ts, ts), 1);
        }
        ColumnSlice slice = volume.content().slice(SERIES, 1, 64);
        volume.tryAppend(new DataPoint(SERIES, 65, 65), 1);

        assertEquals(64, slice.size());
        assertEquals(64, slice.timestampAt(63));
    }
}
