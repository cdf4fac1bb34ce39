package com.pharmaforecast.repository;

import com.pharmaforecast.entity.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface UsageRecordRepository extends JpaRepository<UsageRecord, Integer> {

    List<UsageRecord> findByDrugIdAndDateGreaterThanEqualOrderByDateDesc(Integer drugId, LocalDate from);

    Optional<UsageRecord> findFirstByDrugIdOrderByDateDesc(Integer drugId);

    List<UsageRecord> findByDateGreaterThanEqualOrderByDrugIdAscDateDesc(LocalDate from);

    @Query("""
        SELECT u FROM UsageRecord u
        WHERE u.date = (
            SELECT MAX(u2.date) FROM UsageRecord u2 WHERE u2.drugId = u.drugId
        )
    """)
    List<UsageRecord> findLatestPerDrug();

    @Query("""
        SELECT COALESCE(SUM(u.quantityUsed), 0L) FROM UsageRecord u
        WHERE u.drugId = :drugId
          AND u.date BETWEEN :from AND :to
    """)
    long sumQuantityUsed(
        @Param("drugId") Integer drugId,
        @Param("from") LocalDate from,
        @Param("to") LocalDate to);
}
