package com.pharmaforecast.service;

import com.pharmaforecast.model.UsageObservation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Usage windows and current stock for every drug in one batch run, fetched
 * up front. Drugs in {@code unavailable} could not be read and are skipped.
 */
public record BatchSnapshot(
    Map<Long, List<UsageObservation>> usage,
    Map<Long, Integer> stock,
    Set<Long> unavailable
) {

    public BatchSnapshot {
        usage = Map.copyOf(usage);
        stock = Map.copyOf(stock);
        unavailable = Set.copyOf(unavailable);
    }

    public List<UsageObservation> usageFor(long drugId) {
        return usage.getOrDefault(drugId, List.of());
    }

    public int stockFor(long drugId) {
        return stock.getOrDefault(drugId, 0);
    }

    public boolean isAvailable(long drugId) {
        return !unavailable.contains(drugId);
    }
}
