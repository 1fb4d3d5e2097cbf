package com.energyforecast.exception;

public class InsufficientDataException extends ForecastException {
    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
