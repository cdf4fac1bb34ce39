package com.pharmaforecast.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.pharmaforecast.exception.TrainerApiException;
import com.pharmaforecast.exception.TrainerUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Talks to the offline training service. Training writes fresh artifacts to
 * the shared model location; this client only triggers it and reports the
 * outcome.
 */
@Slf4j
@Component
public class TrainerClient {

    @Value("${trainer.api.base-url:http://localhost:8000}")
    private String baseUrl;

    @Value("${trainer.api.key:}")
    private String apiKey;

    @Value("${trainer.api.timeout-seconds:300}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        WebClient.Builder builder = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json");
        if (!apiKey.isBlank()) {
            builder.defaultHeader("X-API-Key", apiKey);
        }
        this.webClient = builder.build();
        log.info("TrainerClient initialised → {}", baseUrl);
    }

    public Mono<TrainingResult> triggerTraining(String requestId) {
        return webClient.post().uri("/train")
            .header("X-Request-ID", requestId)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new TrainerApiException("Trainer rejected request (" + resp.statusCode().value() + "): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new TrainerUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toTrainingResult)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((retry, sig) -> new TrainerUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, TrainerUnavailableException::new);
    }

    private TrainingResult toTrainingResult(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new TrainerApiException("Trainer returned an unexpected body: " + json);
        }
        if ("error".equals(json.path("status").asText())) {
            throw new TrainerApiException("Trainer reported failure: " + json.path("error").asText("unknown"));
        }
        List<DrugOutcome> outcomes = new ArrayList<>();
        for (JsonNode r : json.path("results")) {
            outcomes.add(new DrugOutcome(
                r.path("drug_id").asLong(),
                r.path("drug_name").asText(null),
                r.path("status").asText("unknown"),
                r.hasNonNull("mae") ? r.get("mae").asDouble() : null,
                r.hasNonNull("mape") ? r.get("mape").asDouble() : null,
                r.path("reason").asText(null)));
        }
        return new TrainingResult(
            json.path("total_drugs").asInt(outcomes.size()),
            json.path("successful_models").asInt(),
            json.path("failed_models").asInt(),
            outcomes);
    }

    public record TrainingResult(int totalDrugs, int successfulModels, int failedModels,
                                 List<DrugOutcome> results) {
    }

    public record DrugOutcome(long drugId, String drugName, String status, Double mae, Double mape, String reason) {
    }
}
