package com.energyforecast.exception;

public class ModelArtifactNotFoundException extends ForecastException {
    public ModelArtifactNotFoundException(String datasetName, String location) {
        super("MODEL_NOT_FOUND", "No model artifact for dataset " + datasetName + " at " + location);
    }
}
