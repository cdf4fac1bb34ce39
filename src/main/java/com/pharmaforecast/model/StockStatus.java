package com.pharmaforecast.model;

public enum StockStatus {
    URGENT,
    CRITICAL,
    WARNING,
    OK
}
