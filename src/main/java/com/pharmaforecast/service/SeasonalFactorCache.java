package com.pharmaforecast.service;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Day-of-week factors per drug for the lifetime of the process.
 *
 * <p>Entries are never evicted or invalidated, not even on model reload: a
 * factor computed early in the process keeps being served even after new
 * usage arrives. Concurrent writers for the same key compute the same value,
 * so last write wins.
 */
@Component
public class SeasonalFactorCache {

    record Key(long drugId, DayOfWeek dayOfWeek) {}

    private final ConcurrentHashMap<Key, Double> factors = new ConcurrentHashMap<>();

    public Optional<Double> get(long drugId, DayOfWeek dayOfWeek) {
        return Optional.ofNullable(factors.get(new Key(drugId, dayOfWeek)));
    }

    public void put(long drugId, DayOfWeek dayOfWeek, double factor) {
        factors.put(new Key(drugId, dayOfWeek), factor);
    }

    public int size() {
        return factors.size();
    }
}
