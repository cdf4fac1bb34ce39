package com.pharmaforecast.exception;

public class TrainerUnavailableException extends PharmaForecastException {
    public TrainerUnavailableException(Throwable cause) {
        super("TRAINER_UNAVAILABLE",
              "The model training service is currently unavailable. Please try again later.",
              cause);
    }
}
