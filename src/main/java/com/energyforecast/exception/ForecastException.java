package com.energyforecast.exception;

/**
 * 预测流程异常基类，携带错误码便于在报告中区分失败类型
 */
public abstract class ForecastException extends RuntimeException {
    private final String errorCode;

    protected ForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
