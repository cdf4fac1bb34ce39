package com.pharmaforecast.dto;

import com.pharmaforecast.model.StockStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendationResponse {
    StockStatus status;
    String message;
    double daysOfStock;
}
