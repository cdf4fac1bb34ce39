package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AdaptivePredictionPoint {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    String dayOfWeek;
    double predictedDemand;
    double basePrediction;
    double trendFactor;
    double seasonalFactor;
    double adjustmentApplied;
}
