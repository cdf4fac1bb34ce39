package com.pharmaforecast.service;

import com.pharmaforecast.model.AdaptiveForecastPoint;
import com.pharmaforecast.model.Recommendation;
import com.pharmaforecast.model.StockStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    private static List<AdaptiveForecastPoint> week(double daily) {
        List<AdaptiveForecastPoint> points = new ArrayList<>();
        LocalDate start = LocalDate.of(2025, 6, 16);
        for (int i = 0; i < 7; i++) {
            points.add(new AdaptiveForecastPoint(start.plusDays(i), daily, daily, 1.0, 1.0));
        }
        return points;
    }

    @Test
    void stockAtOrBelowReorderLevel_isUrgentWhateverTheCover() {
        Recommendation r = engine.recommend(40, 50, week(10));

        assertThat(r.status()).isEqualTo(StockStatus.URGENT);
        assertThat(r.daysOfStock()).isCloseTo(4.0, within(1e-9));
        assertThat(r.message()).startsWith("URGENT");
    }

    @Test
    void stockEqualToReorderLevel_isUrgent() {
        assertThat(engine.recommend(50, 50, week(1)).status()).isEqualTo(StockStatus.URGENT);
    }

    @Test
    void ampleStock_isOk() {
        Recommendation r = engine.recommend(200, 50, week(10));

        assertThat(r.status()).isEqualTo(StockStatus.OK);
        assertThat(r.totalPredicted()).isCloseTo(70.0, within(1e-9));
        assertThat(r.daysOfStock()).isCloseTo(20.0, within(1e-9));
        assertThat(r.displayDaysOfStock()).isCloseTo(20.0, within(1e-9));
        assertThat(r.message()).isEqualTo("Good: Stock sufficient for 20 days.");
    }

    @Test
    void displayedCover_isCappedAtThirtyDays() {
        Recommendation r = engine.recommend(1000, 50, week(10));

        assertThat(r.daysOfStock()).isCloseTo(100.0, within(1e-9));
        assertThat(r.displayDaysOfStock()).isEqualTo(30.0);
        assertThat(r.message()).isEqualTo("Good: Stock sufficient for 30 days.");
    }

    @Test
    void threeDaysOrLess_isCritical() {
        Recommendation r = engine.recommend(20, 10, week(10));

        assertThat(r.status()).isEqualTo(StockStatus.CRITICAL);
        assertThat(r.message()).isEqualTo("Critical: Stock will last only 2 days. Order now!");
    }

    @Test
    void sevenDaysOrLess_isWarning() {
        Recommendation r = engine.recommend(60, 10, week(10));

        assertThat(r.status()).isEqualTo(StockStatus.WARNING);
        assertThat(r.message()).isEqualTo("Warning: Stock will last 6 days. Consider ordering soon.");
    }

    @Test
    void boundaryValues_fallIntoTheStricterBand() {
        assertThat(engine.recommend(30, 10, week(10)).status()).isEqualTo(StockStatus.CRITICAL);
        assertThat(engine.recommend(70, 10, week(10)).status()).isEqualTo(StockStatus.WARNING);
    }

    @Test
    void noPredictedDemand_reportsAmpleCover() {
        Recommendation r = engine.recommend(100, 10, week(0));

        assertThat(r.status()).isEqualTo(StockStatus.OK);
        assertThat(r.daysOfStock()).isEqualTo(RecommendationEngine.AMPLE_DAYS_OF_STOCK);
        assertThat(r.displayDaysOfStock()).isEqualTo(30.0);
    }

    @Test
    void noPredictedDemand_stillUrgentBelowReorderLevel() {
        assertThat(engine.recommend(5, 10, week(0)).status()).isEqualTo(StockStatus.URGENT);
    }
}
