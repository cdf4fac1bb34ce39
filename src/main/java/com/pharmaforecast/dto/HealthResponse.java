package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthResponse {
    String status;
    int    modelsLoaded;
    long   modelGeneration;
    int    seasonalCacheEntries;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}
