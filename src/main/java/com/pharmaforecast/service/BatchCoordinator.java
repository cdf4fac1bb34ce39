package com.pharmaforecast.service;

import com.pharmaforecast.exception.StoreUnavailableException;
import com.pharmaforecast.model.UsageObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fetches everything the batch path needs in two bulk queries instead of
 * several per drug. When a bulk query fails it falls back to per-drug queries
 * so one unreadable drug does not take the whole batch down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCoordinator {

    private final UsageLedger usageLedger;

    public BatchSnapshot prefetch(Collection<Long> drugIds, int windowDays) {
        Set<Long> unavailable = new HashSet<>();
        Map<Long, List<UsageObservation>> usage = fetchUsage(drugIds, windowDays, unavailable);
        Map<Long, Integer> stock = fetchStock(drugIds, unavailable);
        log.info("Batch prefetch | drugs={} | withUsage={} | unavailable={}",
            drugIds.size(), usage.size(), unavailable.size());
        return new BatchSnapshot(usage, stock, unavailable);
    }

    private Map<Long, List<UsageObservation>> fetchUsage(Collection<Long> drugIds, int windowDays, Set<Long> unavailable) {
        try {
            return usageLedger.recentUsageForAll(windowDays);
        } catch (StoreUnavailableException ex) {
            log.warn("Bulk usage fetch failed, falling back to per-drug queries | drugs={}", drugIds.size());
        }
        Map<Long, List<UsageObservation>> usage = new HashMap<>();
        for (Long drugId : drugIds) {
            try {
                usage.put(drugId, usageLedger.recentUsage(drugId, windowDays));
            } catch (StoreUnavailableException ex) {
                log.warn("Usage unavailable, drug skipped | drugId={} | cause={}", drugId, ex.getMessage());
                unavailable.add(drugId);
            }
        }
        return usage;
    }

    private Map<Long, Integer> fetchStock(Collection<Long> drugIds, Set<Long> unavailable) {
        try {
            return usageLedger.currentStockForAll();
        } catch (StoreUnavailableException ex) {
            log.warn("Bulk stock fetch failed, falling back to per-drug queries | drugs={}", drugIds.size());
        }
        Map<Long, Integer> stock = new HashMap<>();
        for (Long drugId : drugIds) {
            if (unavailable.contains(drugId)) {
                continue;
            }
            try {
                stock.put(drugId, usageLedger.currentStock(drugId));
            } catch (StoreUnavailableException ex) {
                log.warn("Stock unavailable, drug skipped | drugId={} | cause={}", drugId, ex.getMessage());
                unavailable.add(drugId);
            }
        }
        return stock;
    }
}
