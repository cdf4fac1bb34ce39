package com.pharmaforecast.service;

import com.pharmaforecast.model.AdaptiveForecastPoint;
import com.pharmaforecast.model.DemandModel;
import com.pharmaforecast.model.FeatureVector;
import com.pharmaforecast.model.UsageObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Turns usage history into a horizon of adjusted daily predictions.
 *
 * <p>Both paths share {@link #project}: the same feature window, the same
 * model and the same trend factor give the same raw predictions. The batch
 * path differs only in where the history comes from and, unless
 * {@code forecast.batch.seasonal-adjustment-enabled} is set, in holding the
 * seasonal factor at 1.0.
 *
 * <p>Callers pass the registry {@link ModelRegistry.Snapshot} they read once,
 * so models, catalog and generation in one response all come from the same load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastEngine {

    private final FeatureBuilder featureBuilder;
    private final TrendAdjuster trendAdjuster;
    private final SeasonalAdjuster seasonalAdjuster;
    private final UsageLedger usageLedger;
    private final BatchCoordinator batchCoordinator;

    @Value("${forecast.batch.seasonal-adjustment-enabled:false}")
    private boolean batchSeasonalEnabled;

    /**
     * @throws com.pharmaforecast.exception.ModelNotFoundException     when the drug has no model
     * @throws com.pharmaforecast.exception.StoreUnavailableException when usage cannot be read
     */
    public List<AdaptiveForecastPoint> forecast(ModelRegistry.Snapshot snapshot, long drugId, int horizonDays) {
        requireHorizon(horizonDays);
        DemandModel model = snapshot.requireModel(drugId);
        LocalDate today = usageLedger.today();
        List<UsageObservation> window = usageLedger.recentUsage(drugId, TrendAdjuster.WINDOW_DAYS);
        List<AdaptiveForecastPoint> points = project(drugId, model, window, today, horizonDays, true);
        log.debug("Forecast projected | drugId={} | horizon={} | history={}", drugId, horizonDays, window.size());
        return points;
    }

    public BatchForecast forecastAll(ModelRegistry.Snapshot snapshot, int horizonDays) {
        requireHorizon(horizonDays);
        SortedSet<Long> drugIds = snapshot.drugIds();
        LocalDate today = usageLedger.today();
        BatchSnapshot data = batchCoordinator.prefetch(drugIds, TrendAdjuster.WINDOW_DAYS);

        Map<Long, EntityForecast> forecasts = new LinkedHashMap<>();
        SortedSet<Long> skipped = new TreeSet<>();
        for (Long drugId : drugIds) {
            if (!data.isAvailable(drugId)) {
                skipped.add(drugId);
                continue;
            }
            try {
                List<AdaptiveForecastPoint> points = project(
                    drugId, snapshot.models().get(drugId), data.usageFor(drugId), today, horizonDays, batchSeasonalEnabled);
                forecasts.put(drugId, new EntityForecast(drugId, points, data.stockFor(drugId)));
            } catch (RuntimeException ex) {
                log.warn("Batch forecast failed, drug skipped | drugId={} | cause={}", drugId, ex.toString());
                skipped.add(drugId);
            }
        }
        log.info("Batch forecast | horizon={} | forecasted={} | skipped={} | generation={}",
            horizonDays, forecasts.size(), skipped.size(), snapshot.generation());
        return new BatchForecast(forecasts, skipped, snapshot.generation());
    }

    List<AdaptiveForecastPoint> project(long drugId, DemandModel model, List<UsageObservation> window,
                                        LocalDate today, int horizonDays, boolean seasonal) {
        List<UsageObservation> featureWindow = UsageLedger.trailing(window, today, FeatureBuilder.WINDOW_DAYS);
        double trend = trendAdjuster.factor(UsageLedger.trailing(window, today, TrendAdjuster.WINDOW_DAYS));

        List<AdaptiveForecastPoint> points = new ArrayList<>(horizonDays);
        for (int d = 1; d <= horizonDays; d++) {
            LocalDate date = today.plusDays(d);
            FeatureVector features = featureBuilder.build(date, featureWindow);
            double raw = nonNegative(model.predict(features));
            double seasonalFactor = seasonal
                ? seasonalAdjuster.factor(drugId, date, () -> UsageLedger.trailing(window, today, SeasonalAdjuster.WINDOW_DAYS))
                : 1.0;
            double adjusted = nonNegative(raw * trend * seasonalFactor);
            points.add(new AdaptiveForecastPoint(date, adjusted, raw, trend, seasonalFactor));
        }
        return points;
    }

    // NaN from a degenerate model counts as no demand
    private static double nonNegative(double value) {
        return Double.isNaN(value) || value < 0.0 ? 0.0 : value;
    }

    private static void requireHorizon(int horizonDays) {
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizonDays must be >= 1 but was " + horizonDays);
        }
    }

    public record EntityForecast(long drugId, List<AdaptiveForecastPoint> points, int currentStock) {}

    public record BatchForecast(Map<Long, EntityForecast> forecasts, SortedSet<Long> skipped, long generation) {}
}
