package com.pharmaforecast.exception;

public class ModelNotFoundException extends PharmaForecastException {
    public ModelNotFoundException(long drugId) {
        super("MODEL_NOT_FOUND", "No model found for drug_id " + drugId + ".");
    }
}
