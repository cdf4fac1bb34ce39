package com.pharmaforecast.service;

import com.pharmaforecast.model.UsageObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeasonalAdjusterTest {

    // a Sunday, so the window ends on Saturday 2025-06-14
    private final LocalDate today = LocalDate.of(2025, 6, 15);
    private final LocalDate nextMonday = LocalDate.of(2025, 6, 16);
    private final LocalDate nextTuesday = LocalDate.of(2025, 6, 17);

    private SeasonalFactorCache cache;
    private SeasonalAdjuster adjuster;

    @BeforeEach
    void setUp() {
        cache = new SeasonalFactorCache();
        adjuster = new SeasonalAdjuster(cache);
    }

    @Test
    void busyWeekday_isClampedAtUpperBound() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21,
            d -> d.getDayOfWeek() == DayOfWeek.MONDAY ? 20.0 : 10.0);

        assertThat(adjuster.factor(1L, nextMonday, () -> window)).isEqualTo(1.2);
    }

    @Test
    void quietWeekday_isClampedAtLowerBound() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21,
            d -> d.getDayOfWeek() == DayOfWeek.MONDAY ? 0.0 : 10.0);

        assertThat(adjuster.factor(1L, nextMonday, () -> window)).isEqualTo(0.8);
    }

    @Test
    void samplesAreAlignedToTheTargetWeekday() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21,
            d -> d.getDayOfWeek() == DayOfWeek.TUESDAY ? 11.0 : 10.0);

        double expected = 11.0 / ((3 * 11.0 + 18 * 10.0) / 21.0);
        assertThat(adjuster.factor(1L, nextTuesday, () -> window)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void computedFactor_isCachedPerDrugAndWeekday() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21,
            d -> d.getDayOfWeek() == DayOfWeek.MONDAY ? 20.0 : 10.0);
        AtomicInteger fetches = new AtomicInteger();
        Supplier<List<UsageObservation>> counting = () -> {
            fetches.incrementAndGet();
            return window;
        };

        adjuster.factor(1L, nextMonday, counting);
        double again = adjuster.factor(1L, nextMonday.plusWeeks(1), counting);

        assertThat(again).isEqualTo(1.2);
        assertThat(fetches).hasValue(1);
        assertThat(cache.get(1L, DayOfWeek.MONDAY)).contains(1.2);
        assertThat(cache.get(2L, DayOfWeek.MONDAY)).isEmpty();
    }

    @Test
    void cachedFactor_isServedEvenAfterUsageChanges() {
        adjuster.factor(1L, nextMonday, () -> UsageFixtures.daily(today, 21,
            d -> d.getDayOfWeek() == DayOfWeek.MONDAY ? 20.0 : 10.0));

        double later = adjuster.factor(1L, nextMonday, () -> UsageFixtures.daily(today, 21, d -> 10.0));

        assertThat(later).isEqualTo(1.2);
    }

    @Test
    void fewerThanFourteenRecords_isNeutralAndNotCached() {
        List<UsageObservation> window = UsageFixtures.daily(today, 10, d -> 10.0);

        assertThat(adjuster.factor(1L, nextMonday, () -> window)).isEqualTo(1.0);
        assertThat(cache.size()).isZero();
    }

    @Test
    void zeroUsage_isNeutralAndNotCached() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21, d -> 0.0);

        assertThat(adjuster.factor(1L, nextMonday, () -> window)).isEqualTo(1.0);
        assertThat(cache.size()).isZero();
    }

    @Test
    void flatUsage_isNeutral() {
        List<UsageObservation> window = UsageFixtures.daily(today, 21, d -> 7.0);

        assertThat(adjuster.factor(3L, nextTuesday, () -> window)).isCloseTo(1.0, within(1e-9));
    }

    private List<UsageObservation> weekdayPeak(long drugId) {
        DayOfWeek peak = DayOfWeek.of((int) (drugId % 7) + 1);
        double busy = 10.0 + drugId % 5;
        return UsageFixtures.daily(today, 21, d -> d.getDayOfWeek() == peak ? busy : 10.0);
    }

    @Test
    void sharedCache_servesEveryThreadTheSingleThreadedFactor() throws Exception {
        int drugs = 50;
        Map<String, Double> expected = new HashMap<>();
        SeasonalAdjuster reference = new SeasonalAdjuster(new SeasonalFactorCache());
        for (long drugId = 1; drugId <= drugs; drugId++) {
            for (int day = 0; day < 7; day++) {
                long id = drugId;
                expected.put(id + "/" + day, reference.factor(id, nextMonday.plusDays(day), () -> weekdayPeak(id)));
            }
        }

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Queue<String> mismatches = new ConcurrentLinkedQueue<>();
        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int offset = t;
            workers.add(pool.submit(() -> {
                start.await();
                for (int round = 0; round < 20; round++) {
                    for (long drugId = 1; drugId <= drugs; drugId++) {
                        int day = (int) ((drugId + offset + round) % 7);
                        long id = drugId;
                        double factor = adjuster.factor(id, nextMonday.plusDays(day), () -> weekdayPeak(id));
                        if (factor != expected.get(id + "/" + day)) {
                            mismatches.add(id + "/" + day + "=" + factor);
                        }
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> worker : workers) {
            worker.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(mismatches).isEmpty();
        assertThat(cache.size()).isEqualTo(drugs * 7);
    }
}
