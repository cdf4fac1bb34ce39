package com.pharmaforecast.service;

import com.pharmaforecast.model.AdaptiveForecastPoint;
import com.pharmaforecast.model.Recommendation;
import com.pharmaforecast.model.StockStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies stock health from the current stock, the reorder level and an
 * adjusted forecast. Being at or below the reorder level always wins, however
 * much cover the forecast suggests.
 */
@Component
public class RecommendationEngine {

    /** Reported when nothing is predicted to be consumed. */
    public static final double AMPLE_DAYS_OF_STOCK = 999.0;

    static final double CRITICAL_DAYS = 3.0;
    static final double WARNING_DAYS = 7.0;
    static final double DISPLAY_CAP_DAYS = 30.0;

    public Recommendation recommend(int currentStock, int reorderLevel, List<AdaptiveForecastPoint> forecast) {
        double total = forecast.stream().mapToDouble(AdaptiveForecastPoint::adjustedPrediction).sum();
        double daysOfStock = total > 0 ? currentStock / (total / 7.0) : AMPLE_DAYS_OF_STOCK;

        if (currentStock <= reorderLevel) {
            return new Recommendation(StockStatus.URGENT,
                "URGENT: Stock at or below reorder level. Order immediately!",
                total, daysOfStock, daysOfStock);
        }
        if (daysOfStock <= CRITICAL_DAYS) {
            return new Recommendation(StockStatus.CRITICAL,
                String.format("Critical: Stock will last only %.0f days. Order now!", daysOfStock),
                total, daysOfStock, daysOfStock);
        }
        if (daysOfStock <= WARNING_DAYS) {
            return new Recommendation(StockStatus.WARNING,
                String.format("Warning: Stock will last %.0f days. Consider ordering soon.", daysOfStock),
                total, daysOfStock, daysOfStock);
        }
        double display = Math.min(daysOfStock, DISPLAY_CAP_DAYS);
        return new Recommendation(StockStatus.OK,
            String.format("Good: Stock sufficient for %.0f days.", display),
            total, daysOfStock, display);
    }
}
