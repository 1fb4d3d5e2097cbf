package com.energyforecast.entity;

import java.time.LocalDateTime;

/**
 * 单个小时负荷观测值
 */
public class SeriesPoint {
    private final LocalDateTime timestamp;
    private final double value;

    public SeriesPoint(LocalDateTime timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "SeriesPoint{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                '}';
    }
}
