package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReloadResponse {
    int  modelsLoaded;
    long generation;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;
}
