package com.pharmaforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelInfoResponse {
    long    drugId;
    String  drugName;
    String  unit;
    boolean modelLoaded;
    String  modelType;
}
