package com.pharmaforecast.exception;

public class TrainerApiException extends PharmaForecastException {
    public TrainerApiException(String message) {
        super("TRAINER_API_ERROR", message);
    }
}
