package com.pharmaforecast.service;

import com.pharmaforecast.entity.UsageRecord;
import com.pharmaforecast.exception.StoreUnavailableException;
import com.pharmaforecast.model.UsageObservation;
import com.pharmaforecast.repository.UsageRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the usage ledger. Every method returns detached, immutable
 * observations and converts store failures into {@link StoreUnavailableException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageLedger {

    private final UsageRecordRepository repository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<UsageObservation> recentUsage(long drugId, int days) {
        try {
            LocalDate from = today().minusDays(days);
            return fold(repository.findByDrugIdAndDateGreaterThanEqualOrderByDateDesc(columnId(drugId), from), days);
        } catch (DataAccessException ex) {
            log.error("Usage lookup failed | drugId={} | days={} | cause={}", drugId, days, ex.getMessage());
            throw new StoreUnavailableException("usage for drug " + drugId, ex);
        }
    }

    @Transactional(readOnly = true)
    public int currentStock(long drugId) {
        try {
            return repository.findFirstByDrugIdOrderByDateDesc(columnId(drugId))
                .map(UsageRecord::getClosingStock)
                .orElse(0);
        } catch (DataAccessException ex) {
            log.error("Stock lookup failed | drugId={} | cause={}", drugId, ex.getMessage());
            throw new StoreUnavailableException("stock for drug " + drugId, ex);
        }
    }

    /** One query for every drug's trailing window, partitioned per drug, most recent first. */
    @Transactional(readOnly = true)
    public Map<Long, List<UsageObservation>> recentUsageForAll(int days) {
        List<UsageRecord> rows;
        try {
            rows = repository.findByDateGreaterThanEqualOrderByDrugIdAscDateDesc(today().minusDays(days));
        } catch (DataAccessException ex) {
            log.error("Bulk usage lookup failed | days={} | cause={}", days, ex.getMessage());
            throw new StoreUnavailableException("bulk usage", ex);
        }
        Map<Long, List<UsageRecord>> byDrug = rows.stream()
            .collect(Collectors.groupingBy(UsageLedger::drugKey, LinkedHashMap::new, Collectors.toList()));
        Map<Long, List<UsageObservation>> result = new LinkedHashMap<>();
        byDrug.forEach((drugId, drugRows) -> result.put(drugId, fold(drugRows, days)));
        return result;
    }

    @Transactional(readOnly = true)
    public Map<Long, Integer> currentStockForAll() {
        try {
            return repository.findLatestPerDrug().stream()
                .collect(Collectors.toMap(UsageLedger::drugKey, UsageRecord::getClosingStock, (a, b) -> a));
        } catch (DataAccessException ex) {
            log.error("Bulk stock lookup failed | cause={}", ex.getMessage());
            throw new StoreUnavailableException("bulk stock", ex);
        }
    }

    @Transactional(readOnly = true)
    public double consumptionBetween(long drugId, LocalDate from, LocalDate to) {
        try {
            return repository.sumQuantityUsed(columnId(drugId), from, to);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("consumption for drug " + drugId, ex);
        }
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * The part of a longer most-recent-first window that falls inside the last
     * {@code days} days, capped at {@code days} entries.
     */
    public static List<UsageObservation> trailing(List<UsageObservation> window, LocalDate today, int days) {
        LocalDate from = today.minusDays(days);
        return window.stream()
            .filter(o -> !o.date().isBefore(from))
            .limit(days)
            .toList();
    }

    /** drug_id is an integer column; ids outside its range cannot have rows. */
    private static Integer columnId(long drugId) {
        return drugId > Integer.MAX_VALUE || drugId < Integer.MIN_VALUE ? null : (int) drugId;
    }

    private static Long drugKey(UsageRecord record) {
        return record.getDrugId().longValue();
    }

    private static List<UsageObservation> fold(List<UsageRecord> rows, int limit) {
        return rows.stream()
            .sorted(Comparator.comparing(UsageRecord::getDate).reversed())
            .limit(limit)
            .map(UsageObservation::from)
            .toList();
    }
}
