package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;

/**
 * Most likely state path, computed entirely in log space.
 *
 * <p>Zero probabilities are floored at {@value #MIN_PROBABILITY} before taking the log so that
 * forbidden transitions stay comparable instead of producing −∞ − −∞. Ties go to the lowest
 * state index.
 */
public final class ViterbiDecoder {

    static final double MIN_PROBABILITY = 1e-300;

    private ViterbiDecoder() {}

    public static ViterbiResult decode(ObservationSequence observations, HMMModel model) {
        EmissionProbabilities emissions = EmissionProbabilities.evaluate(observations, model);
        int length = observations.length();
        int numStates = model.numStates();

        double[] logInitial = new double[numStates];
        double[][] logTransition = new double[numStates][numStates];
        for (int i = 0; i < numStates; i++) {
            logInitial[i] = safeLog(model.initialProbability(i));
            for (int j = 0; j < numStates; j++) {
                logTransition[i][j] = safeLog(model.transitionProbability(i, j));
            }
        }

        double[][] delta = new double[length][numStates];
        int[][] backPointer = new int[length][numStates];

        for (int i = 0; i < numStates; i++) {
            delta[0][i] = logInitial[i] + emissions.logDensity(0, i);
        }

        for (int t = 1; t < length; t++) {
            for (int j = 0; j < numStates; j++) {
                double best = Double.NEGATIVE_INFINITY;
                int bestState = 0;
                for (int i = 0; i < numStates; i++) {
                    double candidate = delta[t - 1][i] + logTransition[i][j];
                    if (candidate > best) {
                        best = candidate;
                        bestState = i;
                    }
                }
                delta[t][j] = best + emissions.logDensity(t, j);
                backPointer[t][j] = bestState;
            }
        }

        int last = 0;
        for (int i = 1; i < numStates; i++) {
            if (delta[length - 1][i] > delta[length - 1][last]) last = i;
        }

        int[] path = new int[length];
        path[length - 1] = last;
        for (int t = length - 2; t >= 0; t--) {
            path[t] = backPointer[t + 1][path[t + 1]];
        }

        return new ViterbiResult(path, delta[length - 1][last]);
    }

    private static double safeLog(double p) {
        return Math.log(Math.max(p, MIN_PROBABILITY));
    }
}
