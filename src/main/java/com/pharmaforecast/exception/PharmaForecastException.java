package com.pharmaforecast.exception;

import lombok.Getter;

@Getter
public abstract class PharmaForecastException extends RuntimeException {
    private final String errorCode;
    protected PharmaForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected PharmaForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
