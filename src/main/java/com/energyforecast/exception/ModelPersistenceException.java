package com.energyforecast.exception;

public class ModelPersistenceException extends ForecastException {
    public ModelPersistenceException(String message, Throwable cause) {
        super("MODEL_PERSISTENCE", message, cause);
    }
}
