package com.pharmaforecast.exception;

public class StoreUnavailableException extends PharmaForecastException {
    public StoreUnavailableException(String what, Throwable cause) {
        super("STORE_UNAVAILABLE",
              "The inventory store is currently unavailable (" + what + "). Please try again later.",
              cause);
    }
}
