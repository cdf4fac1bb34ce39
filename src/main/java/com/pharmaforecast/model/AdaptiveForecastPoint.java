package com.pharmaforecast.model;

import java.time.LocalDate;

public record AdaptiveForecastPoint(
    LocalDate date,
    double adjustedPrediction,
    double rawPrediction,
    double trendFactor,
    double seasonalFactor
) {

    public double combinedAdjustment() {
        return trendFactor * seasonalFactor;
    }
}
