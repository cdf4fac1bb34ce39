package com.pharmaforecast.model;

import com.pharmaforecast.entity.UsageRecord;

import java.time.LocalDate;

/** Detached, immutable view of one ledger row. */
public record UsageObservation(
    LocalDate date,
    double quantityUsed,
    int openingStock,
    int closingStock,
    boolean stockout
) {

    public static UsageObservation from(UsageRecord record) {
        return new UsageObservation(
            record.getDate(), record.getQuantityUsed(),
            record.getOpeningStock(), record.getClosingStock(), record.isStockoutFlag());
    }
}
