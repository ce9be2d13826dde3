package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;

/**
 * Scaled forward recursion over per-step shifted emissions (see {@link EmissionProbabilities}).
 *
 * <pre>
 *   alpha[0][i] = π_i · e'(0, i)
 *   alpha[t][j] = Σ_i alpha[t-1][i] · A[i][j] · e'(t, j)
 *   c_t         = Σ_j alpha[t][j];  alpha[t][·] /= c_t   (skipped when c_t == 0)
 *   logL        = Σ_t (log c_t + offset(t))
 * </pre>
 *
 * <p>{@code c_t} is relative to the shifted emissions {@code e'}; the offsets restore the
 * absolute likelihood. A step with {@code c_t == 0} means the predicted state mass sits only on
 * states that cannot emit the observation at double precision. The division is skipped so the
 * recursion stays defined, the step is counted in {@link ForwardResult#degenerateSteps()}, and
 * the log-likelihood becomes −∞: once a row is all zeros every later row is too.
 *
 * <p>O(T·N²) after the O(T·N·D) emission table. Pure, stateless.
 */
public final class ForwardEngine {

    private ForwardEngine() {}

    public static ForwardResult forward(ObservationSequence observations, HMMModel model) {
        return forward(EmissionProbabilities.evaluate(observations, model), model);
    }

    public static ForwardResult forward(EmissionProbabilities emissions, HMMModel model) {
        int length = emissions.length();
        int numStates = model.numStates();

        double[][] alpha = new double[length][numStates];
        double[] scalingFactors = new double[length];

        for (int i = 0; i < numStates; i++) {
            alpha[0][i] = model.initialProbability(i) * emissions.get(0, i);
        }
        scalingFactors[0] = scale(alpha[0]);

        for (int t = 1; t < length; t++) {
            double[] previous = alpha[t - 1];
            for (int j = 0; j < numStates; j++) {
                double sum = 0.0;
                for (int i = 0; i < numStates; i++) {
                    sum += previous[i] * model.transitionProbability(i, j);
                }
                alpha[t][j] = sum * emissions.get(t, j);
            }
            scalingFactors[t] = scale(alpha[t]);
        }

        int degenerateSteps = 0;
        double logLikelihood = 0.0;
        for (int t = 0; t < length; t++) {
            double c = scalingFactors[t];
            if (c > 0.0) {
                logLikelihood += Math.log(c) + emissions.logOffset(t);
            } else {
                degenerateSteps++;
            }
        }
        if (degenerateSteps > 0) {
            logLikelihood = Double.NEGATIVE_INFINITY;
        }

        return new ForwardResult(alpha, scalingFactors, logLikelihood, degenerateSteps);
    }

    /** Normalizes the row in place and returns its pre-normalization sum. */
    private static double scale(double[] row) {
        double sum = 0.0;
        for (double v : row) sum += v;
        if (sum > 0.0) {
            for (int i = 0; i < row.length; i++) {
                row[i] /= sum;
            }
        }
        return sum;
    }
}
