package com.regimeplatform.hmm.training;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.model.HMMModel;

/**
 * Configuration of one Baum-Welch run.
 *
 * @param numStates            number of hidden states (required, &gt; 0)
 * @param maxIterations        EM iteration budget (&gt; 0, default 100)
 * @param convergenceTolerance minimum log-likelihood gain that keeps the run going (&gt; 0, default 1e-6)
 * @param initialModel         optional starting model; when present the initializer is skipped
 * @param seed                 seed of the initializer's random source (default 42)
 */
public record TrainingOptions(
    @JsonProperty("numStates")            int numStates,
    @JsonProperty("maxIterations")        int maxIterations,
    @JsonProperty("convergenceTolerance") double convergenceTolerance,
    @JsonProperty("initialModel")         HMMModel initialModel,
    @JsonProperty("seed")                 long seed
) {
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_CONVERGENCE_TOLERANCE = 1e-6;
    public static final long DEFAULT_SEED = 42L;

    public TrainingOptions {
        if (numStates <= 0) {
            throw HmmException.invalidParameter("numStates must be positive, got " + numStates);
        }
        if (maxIterations <= 0) {
            throw HmmException.invalidParameter("maxIterations must be positive, got " + maxIterations);
        }
        if (!(convergenceTolerance > 0.0) || !Double.isFinite(convergenceTolerance)) {
            throw HmmException.invalidParameter(
                "convergenceTolerance must be a positive finite number, got " + convergenceTolerance);
        }
        if (initialModel != null && initialModel.numStates() != numStates) {
            throw HmmException.dimensionMismatch(String.format(
                "initial model has %d states, options request %d", initialModel.numStates(), numStates));
        }
    }

    public static TrainingOptions of(int numStates) {
        return new TrainingOptions(numStates, DEFAULT_MAX_ITERATIONS, DEFAULT_CONVERGENCE_TOLERANCE,
            null, DEFAULT_SEED);
    }

    public static TrainingOptions from(HMMModel initialModel) {
        return of(initialModel.numStates()).withInitialModel(initialModel);
    }

    public TrainingOptions withMaxIterations(int value) {
        return new TrainingOptions(numStates, value, convergenceTolerance, initialModel, seed);
    }

    public TrainingOptions withConvergenceTolerance(double value) {
        return new TrainingOptions(numStates, maxIterations, value, initialModel, seed);
    }

    public TrainingOptions withInitialModel(HMMModel model) {
        return new TrainingOptions(numStates, maxIterations, convergenceTolerance, model, seed);
    }

    public TrainingOptions withSeed(long value) {
        return new TrainingOptions(numStates, maxIterations, convergenceTolerance, initialModel, value);
    }
}
