package com.regimeplatform.regime.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RegimeServiceConfig {

    @Value("${regime.hmm.max-iterations:100}")
    private int maxIterations;

    @Value("${regime.hmm.convergence-tolerance:1e-6}")
    private double convergenceTolerance;

    @Value("${regime.hmm.seed:42}")
    private long seed;

    @Value("${regime.hmm.training-timeout:30s}")
    private Duration trainingTimeout;

    @Bean
    public TrainingDefaults trainingDefaults() {
        return new TrainingDefaults(maxIterations, convergenceTolerance, seed, trainingTimeout);
    }
}
