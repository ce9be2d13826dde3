package com.regimeplatform.hmm.regime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.training.TrainingOptions;

import java.util.List;

/**
 * Options of {@link RegimeDetector}. {@code stateLabels} is optional; when present it must
 * name every state, ordered from the lowest to the highest mean of the first feature.
 */
public record RegimeDetectionOptions(
    @JsonProperty("numStates")            int numStates,
    @JsonProperty("features")             List<FeatureType> features,
    @JsonProperty("featureWindow")        int featureWindow,
    @JsonProperty("maxIterations")        int maxIterations,
    @JsonProperty("convergenceTolerance") double convergenceTolerance,
    @JsonProperty("stateLabels")          List<String> stateLabels,
    @JsonProperty("seed")                 long seed
) {
    public static final int DEFAULT_NUM_STATES = 3;
    public static final int DEFAULT_FEATURE_WINDOW = 20;
    public static final List<FeatureType> DEFAULT_FEATURES = List.of(FeatureType.RETURNS, FeatureType.VOLATILITY);

    public RegimeDetectionOptions {
        features = features == null || features.isEmpty() ? DEFAULT_FEATURES : List.copyOf(features);
        stateLabels = stateLabels == null ? null : List.copyOf(stateLabels);
        if (numStates <= 0) {
            throw HmmException.invalidParameter("numStates must be positive, got " + numStates);
        }
        if (featureWindow <= 0) {
            throw HmmException.invalidParameter("featureWindow must be positive, got " + featureWindow);
        }
        if (stateLabels != null && stateLabels.size() != numStates) {
            throw HmmException.invalidParameter(String.format(
                "stateLabels length (%d) must match numStates (%d)", stateLabels.size(), numStates));
        }
        trainingOptions(numStates, maxIterations, convergenceTolerance, seed);
    }

    public static RegimeDetectionOptions defaults() {
        return new RegimeDetectionOptions(DEFAULT_NUM_STATES, DEFAULT_FEATURES, DEFAULT_FEATURE_WINDOW,
            TrainingOptions.DEFAULT_MAX_ITERATIONS, TrainingOptions.DEFAULT_CONVERGENCE_TOLERANCE,
            null, TrainingOptions.DEFAULT_SEED);
    }

    public TrainingOptions trainingOptions() {
        return trainingOptions(numStates, maxIterations, convergenceTolerance, seed);
    }

    public RegimeDetectionOptions withNumStates(int value) {
        return new RegimeDetectionOptions(value, features, featureWindow, maxIterations,
            convergenceTolerance, null, seed);
    }

    public RegimeDetectionOptions withFeatures(List<FeatureType> value) {
        return new RegimeDetectionOptions(numStates, value, featureWindow, maxIterations,
            convergenceTolerance, stateLabels, seed);
    }

    public RegimeDetectionOptions withFeatureWindow(int value) {
        return new RegimeDetectionOptions(numStates, features, value, maxIterations,
            convergenceTolerance, stateLabels, seed);
    }

    public RegimeDetectionOptions withMaxIterations(int value) {
        return new RegimeDetectionOptions(numStates, features, featureWindow, value,
            convergenceTolerance, stateLabels, seed);
    }

    public RegimeDetectionOptions withConvergenceTolerance(double value) {
        return new RegimeDetectionOptions(numStates, features, featureWindow, maxIterations,
            value, stateLabels, seed);
    }

    public RegimeDetectionOptions withStateLabels(List<String> value) {
        return new RegimeDetectionOptions(numStates, features, featureWindow, maxIterations,
            convergenceTolerance, value, seed);
    }

    public RegimeDetectionOptions withSeed(long value) {
        return new RegimeDetectionOptions(numStates, features, featureWindow, maxIterations,
            convergenceTolerance, stateLabels, value);
    }

    private static TrainingOptions trainingOptions(int numStates, int maxIterations,
                                                   double convergenceTolerance, long seed) {
        return new TrainingOptions(numStates, maxIterations, convergenceTolerance, null, seed);
    }
}
