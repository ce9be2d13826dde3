package com.regimeplatform.hmm.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.validation.ModelValidator;

/**
 * Per-state Gaussian emission: one independent mean / variance pair per feature
 * (diagonal covariance, no cross-feature terms).
 */
public record EmissionParams(
    @JsonProperty("means")     double[] means,
    @JsonProperty("variances") double[] variances
) {
    /** Smallest variance a fitted state may carry. */
    public static final double VARIANCE_FLOOR = 1e-6;

    public EmissionParams {
        ModelValidator.validateEmission(means, variances);
        means = means.clone();
        variances = variances.clone();
    }

    /**
     * Builds parameters with every variance raised to at least {@link #VARIANCE_FLOOR}.
     */
    public static EmissionParams floored(double[] means, double[] variances) {
        double[] safe = new double[variances.length];
        for (int d = 0; d < variances.length; d++) {
            safe[d] = Double.isNaN(variances[d]) ? VARIANCE_FLOOR : Math.max(variances[d], VARIANCE_FLOOR);
        }
        return new EmissionParams(means, safe);
    }

    @Override
    public double[] means() {
        return means.clone();
    }

    @Override
    public double[] variances() {
        return variances.clone();
    }

    public double mean(int feature) {
        return means[feature];
    }

    public double variance(int feature) {
        return variances[feature];
    }

    public int numFeatures() {
        return means.length;
    }
}
