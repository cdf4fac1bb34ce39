package com.pharmaforecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmaforecast.model.ModelArtifactReader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ForecastConfig {

    /**
     * Source of "today" for every forecast. Tests swap in a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ModelArtifactReader modelArtifactReader(ObjectMapper objectMapper) {
        return new ModelArtifactReader(objectMapper);
    }
}
