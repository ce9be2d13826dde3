package com.regimeplatform.hmm.inference;

/**
 * State-occupancy posteriors γ from a matched forward / backward pair.
 */
public final class StatePosteriors {

    private StatePosteriors() {}

    /**
     * γ[t][i] = alpha[t][i]·beta[t][i], normalized over i. A row whose product sums to 0
     * (degenerate step) stays all zeros.
     */
    public static double[][] gamma(ForwardResult forward, BackwardResult backward) {
        int length = forward.length();
        double[][] gamma = new double[length][];
        for (int t = 0; t < length; t++) {
            gamma[t] = gammaAt(forward, backward, t);
        }
        return gamma;
    }

    public static double[] gammaAt(ForwardResult forward, BackwardResult backward, int t) {
        int numStates = forward.numStates();
        double[] row = new double[numStates];
        double sum = 0.0;
        for (int i = 0; i < numStates; i++) {
            row[i] = forward.alpha(t, i) * backward.beta(t, i);
            sum += row[i];
        }
        if (sum > 0.0) {
            for (int i = 0; i < numStates; i++) {
                row[i] /= sum;
            }
        }
        return row;
    }
}
