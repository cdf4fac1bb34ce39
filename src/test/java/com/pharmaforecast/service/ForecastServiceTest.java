package com.pharmaforecast.service;

import com.pharmaforecast.dto.AccuracyMetricsResponse;
import com.pharmaforecast.dto.AllForecastsResponse;
import com.pharmaforecast.dto.DetailedForecastResponse;
import com.pharmaforecast.dto.ForecastResponse;
import com.pharmaforecast.dto.HealthResponse;
import com.pharmaforecast.dto.ModelInfoResponse;
import com.pharmaforecast.entity.PredictionRecord;
import com.pharmaforecast.exception.ModelNotFoundException;
import com.pharmaforecast.model.AdaptiveForecastPoint;
import com.pharmaforecast.model.DemandModel;
import com.pharmaforecast.model.DrugInfo;
import com.pharmaforecast.model.LinearDemandModel;
import com.pharmaforecast.model.StockStatus;
import com.pharmaforecast.repository.PredictionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    @Mock ForecastEngine       engine;
    @Mock ModelRegistry        modelRegistry;
    @Mock UsageLedger          usageLedger;
    @Mock PredictionRepository predictionRepository;

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T08:00:00Z"), ZoneOffset.UTC);
    private final LocalDate today = LocalDate.of(2025, 6, 15);
    private final DrugInfo paracetamol = new DrugInfo(1L, "Paracetamol", "tablets", 50, 200);

    private ForecastService service;

    @BeforeEach
    void setUp() {
        service = new ForecastService(engine, modelRegistry, new RecommendationEngine(), usageLedger,
            predictionRepository, new SeasonalFactorCache(), clock);
        ReflectionTestUtils.setField(service, "defaultReorderLevel", 50);
    }

    private List<AdaptiveForecastPoint> points(int days, double raw, double trend) {
        List<AdaptiveForecastPoint> points = new ArrayList<>();
        for (int d = 1; d <= days; d++) {
            points.add(new AdaptiveForecastPoint(today.plusDays(d), raw * trend, raw, trend, 1.0));
        }
        return points;
    }

    private ModelRegistry.Snapshot snapshot(long generation, Map<Long, DemandModel> models, Map<Long, DrugInfo> catalog) {
        return new ModelRegistry.Snapshot(generation, clock.instant(), models, catalog);
    }

    @Test
    void forecast_buildsResponseAndLogsPrediction() {
        UUID id = UUID.randomUUID();
        ModelRegistry.Snapshot loaded = snapshot(3, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 1L, 7)).thenReturn(points(7, 8.0, 1.25));
        when(usageLedger.currentStock(1L)).thenReturn(40);
        when(predictionRepository.save(any())).thenAnswer(inv -> {
            PredictionRecord r = inv.getArgument(0);
            r.setId(id);
            return r;
        });

        ForecastResponse resp = service.forecast(1L, 7, "req-1");

        assertThat(resp.getDrugName()).isEqualTo("Paracetamol");
        assertThat(resp.getReorderLevel()).isEqualTo(50);
        assertThat(resp.getCurrentStock()).isEqualTo(40);
        assertThat(resp.getForecasts()).hasSize(7);
        assertThat(resp.getForecasts().get(0).getPredictedDemand()).isEqualTo(10.0);
        assertThat(resp.getForecasts().get(0).getDayOfWeek()).isEqualTo("Monday");
        assertThat(resp.getRawForecasts().get(0).getPredictedDemand()).isEqualTo(8.0);
        assertThat(resp.getTotalPredicted7Days()).isEqualTo(70.0);
        assertThat(resp.getRecommendation().getStatus()).isEqualTo(StockStatus.URGENT);
        assertThat(resp.getModelGeneration()).isEqualTo(3);
        assertThat(resp.getPredictionId()).isEqualTo(id);
        assertThat(resp.getRequestId()).isEqualTo("req-1");

        ArgumentCaptor<PredictionRecord> saved = ArgumentCaptor.forClass(PredictionRecord.class);
        verify(predictionRepository).save(saved.capture());
        assertThat(saved.getValue().getForecastStart()).isEqualTo(today.plusDays(1));
        assertThat(saved.getValue().getHorizonDays()).isEqualTo(7);
        assertThat(saved.getValue().getPredictedConsumption()).isEqualTo(70.0);
        assertThat(saved.getValue().getModelGeneration()).isEqualTo(3);
    }

    @Test
    void forecast_readsGenerationAndCatalogFromOneRegistryLoad() {
        ModelRegistry.Snapshot before = snapshot(3, Map.of(), Map.of(1L, paracetamol));
        ModelRegistry.Snapshot after = snapshot(4, Map.of(),
            Map.of(1L, new DrugInfo(1L, "Paracetamol 500mg", "packs", 10, 20)));
        when(modelRegistry.snapshot()).thenReturn(before, after);
        when(engine.forecast(before, 1L, 7)).thenReturn(points(7, 10.0, 1.0));
        when(usageLedger.currentStock(1L)).thenReturn(60);
        when(predictionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ForecastResponse resp = service.forecast(1L, 7, "req-6");

        assertThat(resp.getModelGeneration()).isEqualTo(3);
        assertThat(resp.getDrugName()).isEqualTo("Paracetamol");
        assertThat(resp.getUnit()).isEqualTo("tablets");
        assertThat(resp.getReorderLevel()).isEqualTo(50);
        verify(modelRegistry, times(1)).snapshot();
    }

    @Test
    void forecast_totalCoversOnlyTheFirstSevenDays() {
        ModelRegistry.Snapshot loaded = snapshot(1, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 1L, 14)).thenReturn(points(14, 10.0, 1.0));
        when(usageLedger.currentStock(1L)).thenReturn(1000);
        when(predictionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ForecastResponse resp = service.forecast(1L, 14, "req-2");

        assertThat(resp.getForecasts()).hasSize(14);
        assertThat(resp.getTotalPredicted7Days()).isEqualTo(70.0);
        assertThat(resp.getRecommendation().getStatus()).isEqualTo(StockStatus.OK);
        assertThat(resp.getRecommendation().getDaysOfStock()).isEqualTo(30.0);
    }

    @Test
    void forecast_unknownCatalogEntry_usesDefaultReorderLevel() {
        ModelRegistry.Snapshot loaded = snapshot(1, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 7L, 7)).thenReturn(points(7, 1.0, 1.0));
        when(usageLedger.currentStock(7L)).thenReturn(45);
        when(predictionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ForecastResponse resp = service.forecast(7L, 7, "req-3");

        assertThat(resp.getDrugName()).isEqualTo("Drug 7");
        assertThat(resp.getUnit()).isEqualTo("units");
        assertThat(resp.getReorderLevel()).isEqualTo(50);
        assertThat(resp.getRecommendation().getStatus()).isEqualTo(StockStatus.URGENT);
    }

    @Test
    void forecast_predictionLogFailure_doesNotFailTheForecast() {
        ModelRegistry.Snapshot loaded = snapshot(1, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 1L, 7)).thenReturn(points(7, 10.0, 1.0));
        when(usageLedger.currentStock(1L)).thenReturn(500);
        when(predictionRepository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

        ForecastResponse resp = service.forecast(1L, 7, "req-4");

        assertThat(resp.getPredictionId()).isNull();
        assertThat(resp.getForecasts()).hasSize(7);
    }

    @Test
    void forecast_modelNotFound_propagatesWithoutLogging() {
        ModelRegistry.Snapshot loaded = snapshot(1, Map.of(), Map.of());
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 9L, 7)).thenThrow(new ModelNotFoundException(9L));

        assertThatThrownBy(() -> service.forecast(9L, 7, "req-5")).isInstanceOf(ModelNotFoundException.class);
        verify(predictionRepository, never()).save(any());
    }

    @Test
    void forecastAll_reportsForecastsAndSkippedDrugs() {
        Map<Long, ForecastEngine.EntityForecast> forecasts = new LinkedHashMap<>();
        forecasts.put(1L, new ForecastEngine.EntityForecast(1L, points(7, 10.0, 1.0), 300));
        ModelRegistry.Snapshot loaded = snapshot(5, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecastAll(loaded, 7)).thenReturn(
            new ForecastEngine.BatchForecast(forecasts, new TreeSet<>(List.of(2L)), 5));

        AllForecastsResponse resp = service.forecastAll(7, "batch-1");

        assertThat(resp.getForecasts()).hasSize(1);
        assertThat(resp.getForecasts().get(0).getRecommendation().getStatus()).isEqualTo(StockStatus.OK);
        assertThat(resp.getSkippedDrugIds()).containsExactly(2L);
        assertThat(resp.getModelGeneration()).isEqualTo(5);
        assertThat(resp.isSeasonalAdjustmentApplied()).isFalse();
        verify(predictionRepository, times(1)).saveAll(anyList());
    }

    @Test
    void forecastDetailed_exposesFactorsPerDay() {
        ModelRegistry.Snapshot loaded = snapshot(2, Map.of(), Map.of(1L, paracetamol));
        when(modelRegistry.snapshot()).thenReturn(loaded);
        when(engine.forecast(loaded, 1L, 3)).thenReturn(points(3, 10.0, 1.35));

        DetailedForecastResponse resp = service.forecastDetailed(1L, 3);

        assertThat(resp.getPredictions()).hasSize(3);
        assertThat(resp.getTrendFactor()).isEqualTo(1.35);
        assertThat(resp.getTotalPredicted()).isCloseTo(40.5, within(1e-9));
        assertThat(resp.getPredictions().get(0).getBasePrediction()).isEqualTo(10.0);
        assertThat(resp.getPredictions().get(0).getPredictedDemand()).isEqualTo(13.5);
        assertThat(resp.getPredictions().get(0).getAdjustmentApplied()).isEqualTo(1.35);
    }

    @Test
    void listModels_coversCatalogAndLoadedModels() {
        DemandModel model = new LinearDemandModel(1.0, new double[16]);
        when(modelRegistry.snapshot()).thenReturn(snapshot(1,
            Map.of(1L, model, 3L, model),
            Map.of(1L, paracetamol, 2L, new DrugInfo(2L, "Amoxicillin", "capsules", 20, 100))));

        List<ModelInfoResponse> models = service.listModels();

        assertThat(models).extracting(ModelInfoResponse::getDrugId).containsExactly(1L, 2L, 3L);
        assertThat(models).extracting(ModelInfoResponse::isModelLoaded).containsExactly(true, false, true);
        assertThat(models.get(2).getDrugName()).isEqualTo("Drug 3");
        assertThat(models.get(0).getModelType()).isEqualTo("linear");
    }

    @Test
    void health_isDegradedWithoutModels() {
        when(modelRegistry.snapshot()).thenReturn(snapshot(0, Map.of(), Map.of()));

        HealthResponse health = service.health();

        assertThat(health.getStatus()).isEqualTo("degraded");
        assertThat(health.getModelsLoaded()).isZero();
        assertThat(health.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void evaluateAccuracy_fillsElapsedWindowsAndComputesMetrics() {
        PredictionRecord elapsed = PredictionRecord.builder().id(UUID.randomUUID()).drugId(1L)
            .forecastStart(today.minusDays(10)).horizonDays(7).predictedConsumption(70.0).build();
        PredictionRecord running = PredictionRecord.builder().id(UUID.randomUUID()).drugId(1L)
            .forecastStart(today.minusDays(2)).horizonDays(7).predictedConsumption(70.0).build();
        PredictionRecord earlier = PredictionRecord.builder().id(UUID.randomUUID()).drugId(1L)
            .forecastStart(today.minusDays(30)).horizonDays(7).predictedConsumption(50.0)
            .actualConsumption(40.0).build();

        when(usageLedger.today()).thenReturn(today);
        when(predictionRepository.findByActualConsumptionIsNullAndForecastStartBefore(today))
            .thenReturn(List.of(elapsed, running));
        when(usageLedger.consumptionBetween(1L, today.minusDays(10), today.minusDays(4))).thenReturn(63.0);
        when(predictionRepository.findAccuracyRecords(1L, null, null)).thenAnswer(inv -> List.of(earlier, elapsed));

        AccuracyMetricsResponse metrics = service.evaluateAccuracy(1L, null, null);

        assertThat(elapsed.getActualConsumption()).isEqualTo(63.0);
        assertThat(running.getActualConsumption()).isNull();
        verify(predictionRepository).save(elapsed);
        assertThat(metrics.getNewlyEvaluated()).isEqualTo(1);
        assertThat(metrics.getSampleCount()).isEqualTo(2);
        // errors: +10 and +7
        assertThat(metrics.getMae()).isCloseTo(8.5, within(1e-9));
        assertThat(metrics.getRmse()).isCloseTo(Math.sqrt((100.0 + 49.0) / 2), within(1e-9));
        assertThat(metrics.getMape()).isCloseTo((10.0 / 40.0 + 7.0 / 63.0) / 2 * 100.0, within(1e-9));
    }

    @Test
    void evaluateAccuracy_withoutSamples_returnsEmptyMetrics() {
        when(usageLedger.today()).thenReturn(today);
        when(predictionRepository.findByActualConsumptionIsNullAndForecastStartBefore(today)).thenReturn(List.of());
        when(predictionRepository.findAccuracyRecords(null, today.minusDays(7), today)).thenReturn(List.of());

        AccuracyMetricsResponse metrics = service.evaluateAccuracy(null, today.minusDays(7), today);

        assertThat(metrics.getSampleCount()).isZero();
        assertThat(metrics.getMae()).isNull();
        assertThat(metrics.getFromDate()).isEqualTo(today.minusDays(7));
    }
}
