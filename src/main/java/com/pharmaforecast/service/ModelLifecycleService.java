package com.pharmaforecast.service;

import com.pharmaforecast.client.TrainerClient;
import com.pharmaforecast.dto.ReloadResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelLifecycleService {

    public static final String RETRAIN_JOB = "MODEL_RETRAIN";

    private final TrainerClient   trainerClient;
    private final ForecastService forecastService;
    private final AsyncJobService asyncJobService;

    /**
     * Queues a train-then-reload job. The registry only swaps in new models
     * once training has returned successfully.
     */
    public UUID retrain(String requestId) {
        return asyncJobService.submit(RETRAIN_JOB, requestId, () -> trainAndReload(requestId));
    }

    RetrainResult trainAndReload(String requestId) {
        log.info("Retraining started | requestId={}", requestId);
        TrainerClient.TrainingResult training = trainerClient.triggerTraining(requestId).block();
        ReloadResponse reload = forecastService.reloadModels();
        log.info("Retraining finished | trained={} | failed={} | modelsLoaded={} | generation={} | requestId={}",
            training != null ? training.successfulModels() : 0,
            training != null ? training.failedModels() : 0,
            reload.getModelsLoaded(), reload.getGeneration(), requestId);
        return new RetrainResult(training, reload);
    }

    public record RetrainResult(TrainerClient.TrainingResult training, ReloadResponse reload) {
    }
}
