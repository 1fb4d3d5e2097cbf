package com.energyforecast.entity;

import com.energyforecast.exception.MalformedSeriesException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RawSeriesTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2018, 1, 1, 0, 0);

    @Test
    void testValuesInOrder() {
        RawSeries series = new RawSeries("AEP", List.of(
                new SeriesPoint(T0, 1.0),
                new SeriesPoint(T0.plusHours(1), 2.0),
                new SeriesPoint(T0.plusHours(2), 3.0)));

        assertEquals(3, series.size());
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, series.values(), 0.0);
        assertEquals("AEP", series.getDatasetName());
    }

    @Test
    void testNonIncreasingTimestampsAreRejected() {
        assertThrows(MalformedSeriesException.class, () -> new RawSeries("AEP", List.of(
                new SeriesPoint(T0, 1.0),
                new SeriesPoint(T0, 2.0))));
        assertThrows(MalformedSeriesException.class, () -> new RawSeries("AEP", List.of(
                new SeriesPoint(T0.plusHours(1), 1.0),
                new SeriesPoint(T0, 2.0))));
    }

    @Test
    void testEmptyAndNonFiniteInputIsRejected() {
        assertThrows(MalformedSeriesException.class, () -> new RawSeries("AEP", List.of()));
        assertThrows(MalformedSeriesException.class, () -> new RawSeries("AEP", List.of(
                new SeriesPoint(T0, Double.NaN))));
    }
}
