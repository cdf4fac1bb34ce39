package com.pharmaforecast.service;

import com.pharmaforecast.model.UsageObservation;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compares the last seven days of usage with the seven before them. The ratio
 * is clamped to [0.5, 1.5] and then pulled 30% of the way back to neutral.
 */
@Component
public class TrendAdjuster {

    public static final int WINDOW_DAYS = 30;
    public static final double MIN_FACTOR = 0.5;
    public static final double MAX_FACTOR = 1.5;

    static final int MIN_RECORDS = 14;
    static final double SMOOTHING = 0.7;

    /**
     * @param window usage observations, most recent first
     * @return 1.0 when there are fewer than 14 observations or the older week averaged zero
     */
    public double factor(List<UsageObservation> window) {
        if (window.size() < MIN_RECORDS) {
            return 1.0;
        }
        double recentAvg = average(window, 0, 7);
        double olderAvg = average(window, 7, 14);
        if (olderAvg == 0.0) {
            return 1.0;
        }
        double ratio = Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, recentAvg / olderAvg));
        return SMOOTHING * ratio + (1.0 - SMOOTHING) * 1.0;
    }

    private static double average(List<UsageObservation> window, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += window.get(i).quantityUsed();
        }
        return sum / (to - from);
    }
}
