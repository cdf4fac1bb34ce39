package com.pharmaforecast.controller;

import com.pharmaforecast.config.RequestGuardFilter;
import com.pharmaforecast.dto.AsyncJobResponse;
import com.pharmaforecast.dto.ModelInfoResponse;
import com.pharmaforecast.dto.ReloadResponse;
import com.pharmaforecast.service.AsyncJobService;
import com.pharmaforecast.service.ForecastService;
import com.pharmaforecast.service.ModelLifecycleService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelController {

    private final ForecastService       forecastService;
    private final ModelLifecycleService lifecycleService;
    private final AsyncJobService       asyncJobService;

    @GetMapping
    public ResponseEntity<List<ModelInfoResponse>> listModels() {
        return ResponseEntity.ok(forecastService.listModels());
    }

    @PostMapping("/reload")
    public ResponseEntity<ReloadResponse> reload(HttpServletRequest httpRequest) {
        log.info("POST /models/reload | requestId={}",
            httpRequest.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE));
        return ResponseEntity.ok(forecastService.reloadModels());
    }

    @PostMapping("/retrain")
    public ResponseEntity<AsyncJobResponse> retrain(HttpServletRequest httpRequest) {
        Object assigned = httpRequest.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        String requestId = assigned != null ? assigned.toString() : UUID.randomUUID().toString();
        UUID jobId = lifecycleService.retrain(requestId);
        log.info("POST /models/retrain | jobId={} | requestId={}", jobId, requestId);
        return ResponseEntity.accepted()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }
}
