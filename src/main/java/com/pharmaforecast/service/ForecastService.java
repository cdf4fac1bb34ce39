package com.pharmaforecast.service;

import com.pharmaforecast.dto.AccuracyMetricsResponse;
import com.pharmaforecast.dto.AdaptivePredictionPoint;
import com.pharmaforecast.dto.AllForecastsResponse;
import com.pharmaforecast.dto.DetailedForecastResponse;
import com.pharmaforecast.dto.ForecastResponse;
import com.pharmaforecast.dto.HealthResponse;
import com.pharmaforecast.dto.ModelInfoResponse;
import com.pharmaforecast.dto.PredictionPoint;
import com.pharmaforecast.dto.RecommendationResponse;
import com.pharmaforecast.dto.ReloadResponse;
import com.pharmaforecast.entity.PredictionRecord;
import com.pharmaforecast.model.AdaptiveForecastPoint;
import com.pharmaforecast.model.DemandModel;
import com.pharmaforecast.model.DrugInfo;
import com.pharmaforecast.model.Recommendation;
import com.pharmaforecast.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastEngine       engine;
    private final ModelRegistry        modelRegistry;
    private final RecommendationEngine recommendationEngine;
    private final UsageLedger          usageLedger;
    private final PredictionRepository predictionRepository;
    private final SeasonalFactorCache  seasonalFactorCache;
    private final Clock                clock;

    @Value("${forecast.default-reorder-level:50}")
    private int defaultReorderLevel;

    @Value("${forecast.batch.seasonal-adjustment-enabled:false}")
    private boolean batchSeasonalEnabled;

    public ForecastResponse forecast(long drugId, int horizonDays, String requestId) {
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        List<AdaptiveForecastPoint> points = engine.forecast(snapshot, drugId, horizonDays);
        int currentStock = usageLedger.currentStock(drugId);
        UUID predictionId = logPrediction(drugId, points, snapshot.generation(), requestId);

        ForecastResponse response = toResponse(snapshot, drugId, points, currentStock, predictionId, requestId);
        log.info("Forecast generated | drugId={} | horizon={} | total7d={} | status={} | requestId={}",
            drugId, horizonDays, response.getTotalPredicted7Days(), response.getRecommendation().getStatus(), requestId);
        return response;
    }

    public AllForecastsResponse forecastAll(int horizonDays, String requestId) {
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        ForecastEngine.BatchForecast batch = engine.forecastAll(snapshot, horizonDays);
        List<ForecastResponse> forecasts = new ArrayList<>();
        List<PredictionRecord> records = new ArrayList<>();
        for (ForecastEngine.EntityForecast f : batch.forecasts().values()) {
            forecasts.add(toResponse(snapshot, f.drugId(), f.points(), f.currentStock(), null, requestId));
            records.add(predictionRecord(f.drugId(), f.points(), batch.generation(), requestId));
        }
        try {
            predictionRepository.saveAll(records);
        } catch (DataAccessException ex) {
            log.warn("Batch prediction log failed | count={} | requestId={} | cause={}",
                records.size(), requestId, ex.getMessage());
        }
        log.info("Batch forecast served | count={} | skipped={} | requestId={}",
            forecasts.size(), batch.skipped().size(), requestId);
        return AllForecastsResponse.builder()
            .forecasts(forecasts)
            .skippedDrugIds(List.copyOf(batch.skipped()))
            .seasonalAdjustmentApplied(batchSeasonalEnabled)
            .modelGeneration(batch.generation())
            .generatedAt(clock.instant())
            .build();
    }

    public DetailedForecastResponse forecastDetailed(long drugId, int horizonDays) {
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        List<AdaptiveForecastPoint> points = engine.forecast(snapshot, drugId, horizonDays);
        DrugInfo info = drugInfo(snapshot, drugId);
        return DetailedForecastResponse.builder()
            .drugId(drugId)
            .drugName(info.name())
            .unit(info.unit())
            .predictions(points.stream().map(ForecastService::toAdaptivePoint).toList())
            .trendFactor(round(points.get(0).trendFactor(), 2))
            .totalPredicted(round(total(points), 1))
            .modelGeneration(snapshot.generation())
            .generatedAt(clock.instant())
            .build();
    }

    public ReloadResponse reloadModels() {
        int count = modelRegistry.reload();
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        return ReloadResponse.builder()
            .modelsLoaded(count)
            .generation(snapshot.generation())
            .loadedAt(snapshot.loadedAt())
            .build();
    }

    public List<ModelInfoResponse> listModels() {
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        SortedSet<Long> ids = new TreeSet<>(snapshot.models().keySet());
        ids.addAll(snapshot.catalog().keySet());
        return ids.stream()
            .map(id -> {
                DrugInfo info = drugInfo(snapshot, id);
                DemandModel model = snapshot.models().get(id);
                return ModelInfoResponse.builder()
                    .drugId(id)
                    .drugName(info.name())
                    .unit(info.unit())
                    .modelLoaded(model != null)
                    .modelType(model != null ? model.describe() : null)
                    .build();
            })
            .toList();
    }

    public HealthResponse health() {
        ModelRegistry.Snapshot snapshot = modelRegistry.snapshot();
        return HealthResponse.builder()
            .status(snapshot.models().isEmpty() ? "degraded" : "healthy")
            .modelsLoaded(snapshot.models().size())
            .modelGeneration(snapshot.generation())
            .seasonalCacheEntries(seasonalFactorCache.size())
            .timestamp(clock.instant())
            .build();
    }

    /**
     * Fills in actual consumption for logged predictions whose window has
     * fully elapsed, then reports error metrics over every evaluated record
     * matching the filters.
     */
    @Transactional
    public AccuracyMetricsResponse evaluateAccuracy(Long drugId, LocalDate fromDate, LocalDate toDate) {
        LocalDate today = usageLedger.today();
        int evaluated = 0;
        for (PredictionRecord record : predictionRepository.findByActualConsumptionIsNullAndForecastStartBefore(today)) {
            if (!record.forecastEnd().isBefore(today)) {
                continue;
            }
            record.setActualConsumption(
                usageLedger.consumptionBetween(record.getDrugId(), record.getForecastStart(), record.forecastEnd()));
            predictionRepository.save(record);
            evaluated++;
        }
        if (evaluated > 0) {
            log.info("Predictions evaluated | count={}", evaluated);
        }

        List<PredictionRecord> records = predictionRepository.findAccuracyRecords(drugId, fromDate, toDate);
        if (records.isEmpty()) {
            return AccuracyMetricsResponse.builder()
                .sampleCount(0)
                .newlyEvaluated(evaluated)
                .fromDate(fromDate)
                .toDate(toDate)
                .drugId(drugId)
                .build();
        }

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;

        for (PredictionRecord record : records) {
            double actual = record.getActualConsumption();
            double error = record.getPredictedConsumption() - actual;
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (actual != 0.0d) {
                apeSum += Math.abs(error / actual);
                apeCount++;
            }
        }

        double n = records.size();
        Double mape = apeCount > 0 ? (apeSum / apeCount) * 100.0 : null;
        return AccuracyMetricsResponse.builder()
            .sampleCount(records.size())
            .newlyEvaluated(evaluated)
            .mae(absErrorSum / n)
            .rmse(Math.sqrt(squaredErrorSum / n))
            .mape(mape)
            .fromDate(fromDate)
            .toDate(toDate)
            .drugId(drugId)
            .build();
    }

    private UUID logPrediction(long drugId, List<AdaptiveForecastPoint> points, long generation, String requestId) {
        try {
            return predictionRepository.save(predictionRecord(drugId, points, generation, requestId)).getId();
        } catch (DataAccessException ex) {
            log.warn("Prediction log failed | drugId={} | requestId={} | cause={}", drugId, requestId, ex.getMessage());
            return null;
        }
    }

    private PredictionRecord predictionRecord(long drugId, List<AdaptiveForecastPoint> points, long generation, String requestId) {
        return PredictionRecord.builder()
            .drugId(drugId)
            .forecastStart(points.get(0).date())
            .horizonDays(points.size())
            .predictedConsumption(round(total(points), 1))
            .modelGeneration(generation)
            .requestId(requestId)
            .build();
    }

    private ForecastResponse toResponse(ModelRegistry.Snapshot snapshot, long drugId, List<AdaptiveForecastPoint> points,
                                        int currentStock, UUID predictionId, String requestId) {
        DrugInfo info = drugInfo(snapshot, drugId);
        Recommendation recommendation = recommendationEngine.recommend(currentStock, info.reorderLevel(), points);
        double total7 = points.stream().limit(7).mapToDouble(AdaptiveForecastPoint::adjustedPrediction).sum();
        return ForecastResponse.builder()
            .drugId(drugId)
            .drugName(info.name())
            .unit(info.unit())
            .currentStock(currentStock)
            .reorderLevel(info.reorderLevel())
            .rawForecasts(points.stream().map(p -> toPoint(p.date(), p.rawPrediction())).toList())
            .forecasts(points.stream().map(p -> toPoint(p.date(), p.adjustedPrediction())).toList())
            .totalPredicted7Days(round(total7, 1))
            .recommendation(RecommendationResponse.builder()
                .status(recommendation.status())
                .message(recommendation.message())
                .daysOfStock(round(recommendation.displayDaysOfStock(), 1))
                .build())
            .modelGeneration(snapshot.generation())
            .predictionId(predictionId)
            .generatedAt(clock.instant())
            .requestId(requestId)
            .build();
    }

    private DrugInfo drugInfo(ModelRegistry.Snapshot snapshot, long drugId) {
        return snapshot.drugInfo(drugId).orElseGet(() -> DrugInfo.unknown(drugId, defaultReorderLevel));
    }

    private static PredictionPoint toPoint(LocalDate date, double value) {
        return PredictionPoint.builder()
            .date(date)
            .dayOfWeek(dayName(date))
            .predictedDemand(round(value, 1))
            .build();
    }

    private static AdaptivePredictionPoint toAdaptivePoint(AdaptiveForecastPoint p) {
        return AdaptivePredictionPoint.builder()
            .date(p.date())
            .dayOfWeek(dayName(p.date()))
            .predictedDemand(round(p.adjustedPrediction(), 1))
            .basePrediction(round(p.rawPrediction(), 1))
            .trendFactor(round(p.trendFactor(), 2))
            .seasonalFactor(round(p.seasonalFactor(), 2))
            .adjustmentApplied(round(p.combinedAdjustment(), 2))
            .build();
    }

    private static double total(List<AdaptiveForecastPoint> points) {
        return points.stream().mapToDouble(AdaptiveForecastPoint::adjustedPrediction).sum();
    }

    private static String dayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
