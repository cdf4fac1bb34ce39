package com.pharmaforecast.model;

/**
 * @param daysOfStock        unclamped coverage used for classification
 * @param displayDaysOfStock value shown to users, capped at 30 for {@link StockStatus#OK}
 */
public record Recommendation(
    StockStatus status,
    String message,
    double totalPredicted,
    double daysOfStock,
    double displayDaysOfStock
) {}
