package com.pharmaforecast.controller;

import com.pharmaforecast.config.RequestGuardFilter;
import com.pharmaforecast.dto.AccuracyMetricsResponse;
import com.pharmaforecast.dto.AllForecastsResponse;
import com.pharmaforecast.dto.AsyncJobResponse;
import com.pharmaforecast.dto.DetailedForecastResponse;
import com.pharmaforecast.dto.ForecastResponse;
import com.pharmaforecast.dto.HealthResponse;
import com.pharmaforecast.service.AsyncJobService;
import com.pharmaforecast.service.ForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService forecastService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/forecasts/all")
    public ResponseEntity<AllForecastsResponse> forecastAll(
            @RequestParam(defaultValue = "7") @Min(1) @Max(30) int days,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts/all | days={} | requestId={}", days, requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(forecastService.forecastAll(days, requestId));
    }

    @PostMapping("/forecasts/{drugId}")
    public ResponseEntity<ForecastResponse> forecast(
            @PathVariable long drugId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(30) int days,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts/{} | days={} | requestId={}", drugId, days, requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(forecastService.forecast(drugId, days, requestId));
    }

    @GetMapping("/forecasts/{drugId}/adaptive")
    public ResponseEntity<DetailedForecastResponse> adaptiveForecast(
            @PathVariable long drugId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(30) int days) {
        return ResponseEntity.ok(forecastService.forecastDetailed(drugId, days));
    }

    @GetMapping("/forecasts/accuracy")
    public ResponseEntity<AccuracyMetricsResponse> accuracy(
            @RequestParam(required = false) Long drugId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate) {
        return ResponseEntity.ok(forecastService.evaluateAccuracy(drugId, fromDate, toDate));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(forecastService.health());
    }

    private String resolveRequestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        if (assigned != null) {
            return assigned.toString();
        }
        String id = request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
