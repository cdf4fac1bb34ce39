package com.pharmaforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(
    name = "prediction_records",
    indexes = {
        @Index(name = "idx_pred_drug",    columnList = "drug_id"),
        @Index(name = "idx_pred_start",   columnList = "forecast_start"),
        @Index(name = "idx_pred_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "drug_id", nullable = false)
    private Long drugId;

    @Column(name = "forecast_start", nullable = false)
    private LocalDate forecastStart;

    @Column(name = "horizon_days", nullable = false)
    private int horizonDays;

    @Column(name = "predicted_consumption", nullable = false)
    private double predictedConsumption;

    @Column(name = "actual_consumption")
    private Double actualConsumption;

    @Column(name = "model_generation")
    private long modelGeneration;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;

    public LocalDate forecastEnd() {
        return forecastStart.plusDays(horizonDays - 1L);
    }
}
