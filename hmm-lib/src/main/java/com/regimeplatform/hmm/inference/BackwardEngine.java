package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.validation.ModelValidator;

import java.util.Arrays;

/**
 * Scaled backward recursion driven by the forward pass's scaling factors.
 *
 * <pre>
 *   beta[T-1][i] = 1 / c_{T-1}
 *   beta[t][i]   = Σ_j A[i][j] · e'(t+1, j) · beta[t+1][j] / c_t      (division skipped when c_t == 0)
 * </pre>
 *
 * <p>{@code e'} are the shifted densities of {@link EmissionProbabilities}. The factors must come
 * from a {@link ForwardEngine} run on the same observations and model.
 * Rescaling beta independently would break the proportionality between
 * {@code alpha[t][i]·beta[t][i]} and the state posterior. With shared factors
 * {@code c_t · Σ_i alpha[t][i]·beta[t][i] = 1} at every t.
 */
public final class BackwardEngine {

    private BackwardEngine() {}

    public static BackwardResult backward(ObservationSequence observations, HMMModel model,
                                          double[] scalingFactors) {
        return backward(EmissionProbabilities.evaluate(observations, model), model, scalingFactors);
    }

    /**
     * @throws com.regimeplatform.hmm.exception.HmmException DIMENSION_MISMATCH when the
     *         scaling factors do not cover every time step
     */
    public static BackwardResult backward(EmissionProbabilities emissions, HMMModel model,
                                          double[] scalingFactors) {
        int length = emissions.length();
        int numStates = model.numStates();
        ModelValidator.requireLength(scalingFactors, length, "scalingFactors");

        double[][] beta = new double[length][numStates];
        Arrays.fill(beta[length - 1], 1.0);
        unscale(beta[length - 1], scalingFactors[length - 1]);

        for (int t = length - 2; t >= 0; t--) {
            double[] next = beta[t + 1];
            for (int i = 0; i < numStates; i++) {
                double sum = 0.0;
                for (int j = 0; j < numStates; j++) {
                    sum += model.transitionProbability(i, j) * emissions.get(t + 1, j) * next[j];
                }
                beta[t][i] = sum;
            }
            unscale(beta[t], scalingFactors[t]);
        }

        return new BackwardResult(beta);
    }

    private static void unscale(double[] row, double scalingFactor) {
        if (scalingFactor > 0.0) {
            for (int i = 0; i < row.length; i++) {
                row[i] /= scalingFactor;
            }
        }
    }
}
