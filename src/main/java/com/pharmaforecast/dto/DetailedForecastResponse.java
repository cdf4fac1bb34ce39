package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DetailedForecastResponse {
    long   drugId;
    String drugName;
    String unit;
    List<AdaptivePredictionPoint> predictions;
    double trendFactor;
    double totalPredicted;
    long   modelGeneration;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}
