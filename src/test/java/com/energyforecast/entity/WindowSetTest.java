package com.energyforecast.entity;

import com.energyforecast.TestSeries;
import com.energyforecast.service.WindowingService;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class WindowSetTest {

    private WindowSet windows() {
        return new WindowingService().createWindows(Nd4j.createFromArray(TestSeries.ramp(10)), 3);
    }

    @Test
    void testSliceIsIndependentCopy() {
        WindowSet windows = windows();
        WindowSet slice = windows.slice(2, 5);

        assertEquals(3, slice.size());
        assertArrayEquals(new double[]{2.0, 3.0, 4.0}, slice.input(0), 0.0);
        assertEquals(7.0, slice.target(2), 0.0);

        slice.getLabels().putScalar(0, 0, -1.0);
        assertEquals(5.0, windows.target(2), 0.0);
    }

    @Test
    void testEmptySliceKeepsShape() {
        WindowSet empty = windows().slice(4, 4);

        assertTrue(empty.isEmpty());
        assertEquals(3, empty.getWindowLength());
    }

    @Test
    void testInvalidRangeIsRejected() {
        assertThrows(IndexOutOfBoundsException.class, () -> windows().slice(5, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> windows().slice(0, 8));
    }
}
