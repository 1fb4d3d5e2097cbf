package com.energyforecast;

import com.energyforecast.entity.RawSeries;
import com.energyforecast.entity.SeriesPoint;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的合成小时序列
 */
public final class TestSeries {
    public static final LocalDateTime START = LocalDateTime.of(2018, 1, 1, 0, 0);

    private TestSeries() {
    }

    /**
     * 日周期正弦负荷：base + amplitude * sin(2πt/24)
     */
    public static double[] dailySine(int length, double base, double amplitude) {
        double[] values = new double[length];
        for (int t = 0; t < length; t++) {
            values[t] = base + amplitude * Math.sin(2 * Math.PI * t / 24.0);
        }
        return values;
    }

    public static double[] ramp(int length) {
        double[] values = new double[length];
        for (int t = 0; t < length; t++) {
            values[t] = t;
        }
        return values;
    }

    public static RawSeries hourly(String name, double[] values) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new SeriesPoint(START.plusHours(i), values[i]));
        }
        return new RawSeries(name, points);
    }
}
