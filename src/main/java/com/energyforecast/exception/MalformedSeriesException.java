package com.energyforecast.exception;

/**
 * 输入数据缺列、无法解析或时间戳不递增
 */
public class MalformedSeriesException extends ForecastException {
    public MalformedSeriesException(String message) {
        super("MALFORMED_SERIES", message);
    }

    public MalformedSeriesException(String message, Throwable cause) {
        super("MALFORMED_SERIES", message, cause);
    }
}
