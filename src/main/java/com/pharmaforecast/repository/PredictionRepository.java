package com.pharmaforecast.repository;

import com.pharmaforecast.entity.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface PredictionRepository extends JpaRepository<PredictionRecord, UUID> {

    List<PredictionRecord> findByActualConsumptionIsNullAndForecastStartBefore(LocalDate before);

    @Query("""
        SELECT p FROM PredictionRecord p
        WHERE p.actualConsumption IS NOT NULL
          AND (:drugId IS NULL OR p.drugId = :drugId)
          AND (:fromDate IS NULL OR p.forecastStart >= :fromDate)
          AND (:toDate IS NULL OR p.forecastStart <= :toDate)
        ORDER BY p.forecastStart ASC
    """)
    List<PredictionRecord> findAccuracyRecords(
        @Param("drugId") Long drugId,
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate);
}
