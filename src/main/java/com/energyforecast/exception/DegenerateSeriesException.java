package com.energyforecast.exception;

/**
 * 序列标准差为0，无法计算z-score
 */
public class DegenerateSeriesException extends ForecastException {
    public DegenerateSeriesException(String message) {
        super("DEGENERATE_SERIES", message);
    }
}
