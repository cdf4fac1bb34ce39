package com.pharmaforecast.exception;

import lombok.Getter;

@Getter
public class ModelLoadException extends PharmaForecastException {
    private final String artifactName;

    public ModelLoadException(String artifactName, String reason) {
        super("MODEL_LOAD_ERROR", "Failed to load model " + artifactName + ": " + reason);
        this.artifactName = artifactName;
    }
    public ModelLoadException(String artifactName, String reason, Throwable cause) {
        super("MODEL_LOAD_ERROR", "Failed to load model " + artifactName + ": " + reason, cause);
        this.artifactName = artifactName;
    }
}
