package com.energyforecast.exception;

public class InvalidWindowLengthException extends ForecastException {
    public InvalidWindowLengthException(int windowLength, int seriesLength) {
        super("INVALID_WINDOW_LENGTH",
                "Window length " + windowLength + " is not valid for a series of length " + seriesLength);
    }
}
