package com.pharmaforecast.service;

import com.pharmaforecast.model.UsageObservation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Supplier;

/**
 * Weekday correction: mean usage on the target weekday over the last three
 * weeks relative to the overall mean, clamped to [0.8, 1.2].
 *
 * <p>Weekday alignment is approximate. The window is assumed to hold one
 * record per consecutive day, so samples for the target weekday are taken at
 * stride 7 starting from the most recent record's offset to that weekday.
 */
@Component
@RequiredArgsConstructor
public class SeasonalAdjuster {

    public static final int WINDOW_DAYS = 21;
    public static final double MIN_FACTOR = 0.8;
    public static final double MAX_FACTOR = 1.2;

    static final int MIN_RECORDS = 14;
    static final int MIN_SAMPLES = 2;

    private final SeasonalFactorCache cache;

    /**
     * @param window supplies the usage window (most recent first); only invoked on a cache miss
     */
    public double factor(long drugId, LocalDate target, Supplier<List<UsageObservation>> window) {
        DayOfWeek dow = target.getDayOfWeek();
        var cached = cache.get(drugId, dow);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<UsageObservation> usage = window.get();
        if (usage.size() > WINDOW_DAYS) {
            usage = usage.subList(0, WINDOW_DAYS);
        }
        if (usage.size() < MIN_RECORDS) {
            return 1.0;
        }

        DayOfWeek newest = usage.get(0).date().getDayOfWeek();
        int offset = Math.floorMod(newest.getValue() - dow.getValue(), 7);

        double dowSum = 0.0;
        int samples = 0;
        for (int i = offset; i < usage.size(); i += 7) {
            dowSum += usage.get(i).quantityUsed();
            samples++;
        }
        if (samples < MIN_SAMPLES) {
            return 1.0;
        }

        double overallAvg = usage.stream().mapToDouble(UsageObservation::quantityUsed).average().orElse(0.0);
        if (overallAvg <= 0.0) {
            return 1.0;
        }

        double factor = Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, (dowSum / samples) / overallAvg));
        cache.put(drugId, dow, factor);
        return factor;
    }
}
