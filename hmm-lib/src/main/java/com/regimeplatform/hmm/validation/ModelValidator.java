package com.regimeplatform.hmm.validation;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.model.EmissionParams;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;

import java.util.List;

/**
 * Single home for every shape and invariant check of the HMM core.
 *
 * <p>{@link HMMModel}, {@link EmissionParams} and {@link ObservationSequence} call into
 * this class from their constructors, so any instance that exists is valid and the
 * engines never re-check lengths inline.
 */
public final class ModelValidator {

    /** Allowed deviation of a probability row sum from 1. */
    public static final double PROBABILITY_SUM_TOLERANCE = 1e-6;

    private ModelValidator() {}

    /**
     * Non-empty, rectangular, at least one feature, all values finite.
     */
    public static void validateObservations(double[][] values) {
        if (values == null || values.length == 0) {
            throw HmmException.invalidParameter("observations must not be empty");
        }
        if (values[0] == null || values[0].length == 0) {
            throw HmmException.invalidParameter("each observation must have at least one feature");
        }
        int numFeatures = values[0].length;
        for (int t = 0; t < values.length; t++) {
            double[] row = values[t];
            if (row == null || row.length != numFeatures) {
                throw HmmException.invalidParameter(String.format(
                    "ragged observations: expected %d features, got %s at t=%d",
                    numFeatures, row == null ? "null" : String.valueOf(row.length), t));
            }
            for (int d = 0; d < numFeatures; d++) {
                if (!Double.isFinite(row[d])) {
                    throw HmmException.invalidParameter(String.format(
                        "observation value at t=%d d=%d is not finite: %s", t, d, row[d]));
                }
            }
        }
    }

    public static void validateNumStates(int numStates) {
        if (numStates <= 0) {
            throw HmmException.invalidParameter("numStates must be positive, got " + numStates);
        }
    }

    /**
     * Seeding every state needs at least one observation per state.
     */
    public static void requireEnoughObservations(ObservationSequence observations, int numStates) {
        if (observations.length() < numStates) {
            throw HmmException.insufficientData(String.format(
                "%d observations cannot seed %d states", observations.length(), numStates));
        }
    }

    public static void requireSameFeatureCount(ObservationSequence observations, HMMModel model) {
        if (observations.dimension() != model.numFeatures()) {
            throw HmmException.dimensionMismatch(String.format(
                "observations have %d features but model expects %d",
                observations.dimension(), model.numFeatures()));
        }
    }

    public static void requireLength(double[] values, int expected, String name) {
        if (values == null || values.length != expected) {
            throw HmmException.dimensionMismatch(String.format(
                "%s must have length %d, got %s", name, expected,
                values == null ? "null" : String.valueOf(values.length)));
        }
    }

    public static void validateEmission(double[] means, double[] variances) {
        if (means == null || variances == null) {
            throw HmmException.invalidParameter("means and variances are required");
        }
        if (means.length != variances.length) {
            throw HmmException.dimensionMismatch(String.format(
                "means (%d) and variances (%d) differ in length", means.length, variances.length));
        }
        if (means.length == 0) {
            throw HmmException.invalidParameter("emission parameters need at least one feature");
        }
        for (int d = 0; d < means.length; d++) {
            if (!Double.isFinite(means[d])) {
                throw HmmException.invalidParameter("mean[" + d + "] is not finite: " + means[d]);
            }
            if (!(variances[d] > 0.0) || !Double.isFinite(variances[d])) {
                throw HmmException.invalidParameter(
                    "variance[" + d + "] must be positive and finite, got " + variances[d]);
            }
        }
    }

    /**
     * Checks counts, shapes, row-stochasticity and per-state feature counts of a model.
     */
    public static void validateModel(int numStates, int numFeatures, double[][] transitionMatrix,
                                     List<EmissionParams> emissionParams, double[] initialProbs) {
        validateNumStates(numStates);
        if (numFeatures <= 0) {
            throw HmmException.invalidParameter("numFeatures must be positive, got " + numFeatures);
        }
        if (transitionMatrix == null || transitionMatrix.length != numStates) {
            throw HmmException.dimensionMismatch("transition matrix must have " + numStates + " rows");
        }
        for (int i = 0; i < numStates; i++) {
            requireLength(transitionMatrix[i], numStates, "transition matrix row " + i);
            requireDistribution(transitionMatrix[i], "transition matrix row " + i);
        }
        if (emissionParams == null || emissionParams.size() != numStates) {
            throw HmmException.dimensionMismatch("expected " + numStates + " emission parameter sets, got "
                + (emissionParams == null ? "null" : String.valueOf(emissionParams.size())));
        }
        for (int i = 0; i < numStates; i++) {
            EmissionParams params = emissionParams.get(i);
            if (params == null) {
                throw HmmException.invalidParameter("emission parameters of state " + i + " are missing");
            }
            if (params.numFeatures() != numFeatures) {
                throw HmmException.dimensionMismatch(String.format(
                    "state %d emits %d features, model declares %d", i, params.numFeatures(), numFeatures));
            }
        }
        requireLength(initialProbs, numStates, "initialProbs");
        requireDistribution(initialProbs, "initialProbs");
    }

    private static void requireDistribution(double[] probs, String name) {
        double sum = 0.0;
        for (double p : probs) {
            if (!(p >= 0.0 && p <= 1.0)) {
                throw HmmException.invalidParameter(name + " entries must lie in [0, 1], got " + p);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > PROBABILITY_SUM_TOLERANCE) {
            throw HmmException.invalidParameter(name + " must sum to 1, sum=" + sum);
        }
    }
}
