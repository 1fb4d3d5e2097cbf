package com.energyforecast.exception;

public class InvalidHyperparameterException extends ForecastException {
    public InvalidHyperparameterException(String message) {
        super("INVALID_HYPERPARAMETER", message);
    }
}
