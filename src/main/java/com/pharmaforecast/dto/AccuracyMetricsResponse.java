package com.pharmaforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AccuracyMetricsResponse {
    long sampleCount;
    int  newlyEvaluated;
    Double mae;
    Double rmse;
    Double mape;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate fromDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate toDate;
    Long drugId;
}
