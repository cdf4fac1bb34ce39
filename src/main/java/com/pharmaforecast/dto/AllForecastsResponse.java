package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AllForecastsResponse {
    List<ForecastResponse> forecasts;
    List<Long> skippedDrugIds;
    boolean seasonalAdjustmentApplied;
    long modelGeneration;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}
