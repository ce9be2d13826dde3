package com.regimeplatform.regime.config;

import java.time.Duration;

/**
 * Service-wide training defaults, applied where a request leaves an option out.
 * {@code trainingTimeout} bounds the wall-clock time of a single EM run.
 */
public record TrainingDefaults(
    int maxIterations,
    double convergenceTolerance,
    long seed,
    Duration trainingTimeout
) {}
