package com.pharmaforecast.service;

import com.pharmaforecast.model.FeatureVector;
import com.pharmaforecast.model.UsageObservation;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Builds the model input for one target date from a frozen usage window.
 *
 * <p>The usage series is always {@value #WINDOW_DAYS} long: an empty window is
 * replaced by a flat {@value #DEFAULT_USAGE} baseline and a short one is padded
 * with the mean of what is there, so lag and rolling features never run past
 * the available history.
 */
@Component
public class FeatureBuilder {

    public static final int WINDOW_DAYS = 14;

    static final double DEFAULT_USAGE = 30.0;
    static final double DEFAULT_STD = 5.0;

    private static final Set<Integer> RAINY_MONTHS = Set.of(4, 5, 6, 7, 9, 10, 11);

    /**
     * @param history usage observations, most recent first; only the first
     *                {@value #WINDOW_DAYS} are used
     */
    public FeatureVector build(LocalDate target, List<UsageObservation> history) {
        List<UsageObservation> window = history.size() > WINDOW_DAYS ? history.subList(0, WINDOW_DAYS) : history;
        double[] series = usageSeries(window);

        DayOfWeek dow = target.getDayOfWeek();
        int day = target.getDayOfMonth();
        return new FeatureVector(
            dow.getValue() - 1,
            day,
            target.getMonthValue(),
            (day - 1) / 7 + 1,
            dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY,
            day > 25,
            RAINY_MONTHS.contains(target.getMonthValue()),
            lag(series, 1),
            lag(series, 3),
            lag(series, 7),
            lag(series, 14),
            series.length >= 7 ? mean(series, 7) : DEFAULT_USAGE,
            series.length >= 7 ? std(series, 7) : DEFAULT_STD,
            series.length >= 14 ? mean(series, 14) : DEFAULT_USAGE,
            series.length >= 14 ? std(series, 14) : DEFAULT_STD,
            stockLevelRatio(window)
        );
    }

    double[] usageSeries(List<UsageObservation> window) {
        double[] series = new double[WINDOW_DAYS];
        if (window.isEmpty()) {
            Arrays.fill(series, DEFAULT_USAGE);
            return series;
        }
        double sum = 0.0;
        for (int i = 0; i < window.size(); i++) {
            series[i] = window.get(i).quantityUsed();
            sum += series[i];
        }
        double pad = sum / window.size();
        for (int i = window.size(); i < WINDOW_DAYS; i++) {
            series[i] = pad;
        }
        return series;
    }

    private static double lag(double[] series, int k) {
        return series.length >= k ? series[k - 1] : DEFAULT_USAGE;
    }

    private static double mean(double[] series, int w) {
        double sum = 0.0;
        for (int i = 0; i < w; i++) {
            sum += series[i];
        }
        return sum / w;
    }

    // Population std (divide by w). Training rows were built with the sample std (w - 1),
    // so served values run slightly below the trained feature for the same window.
    private static double std(double[] series, int w) {
        double m = mean(series, w);
        double sq = 0.0;
        for (int i = 0; i < w; i++) {
            double d = series[i] - m;
            sq += d * d;
        }
        return Math.sqrt(sq / w);
    }

    private static double stockLevelRatio(List<UsageObservation> window) {
        if (window.isEmpty()) {
            return 1.0;
        }
        double meanOpening = window.stream().mapToInt(UsageObservation::openingStock).average().orElse(0.0);
        return window.get(0).openingStock() / (meanOpening + 1.0);
    }
}
