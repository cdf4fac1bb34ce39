package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    long   drugId;
    String drugName;
    String unit;
    int    currentStock;
    int    reorderLevel;
    List<PredictionPoint> rawForecasts;
    List<PredictionPoint> forecasts;
    double totalPredicted7Days;
    RecommendationResponse recommendation;
    long   modelGeneration;
    UUID   predictionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    String requestId;
}
