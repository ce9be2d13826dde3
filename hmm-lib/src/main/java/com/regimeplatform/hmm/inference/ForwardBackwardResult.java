package com.regimeplatform.hmm.inference;

/**
 * A forward pass and the backward pass built from its scaling factors.
 */
public record ForwardBackwardResult(ForwardResult forward, BackwardResult backward) {

    /** γ for every step, T×N. */
    public double[][] stateProbabilities() {
        return StatePosteriors.gamma(forward, backward);
    }

    /** γ at the last step: the posterior over the current regime. */
    public double[] currentStateProbabilities() {
        return StatePosteriors.gammaAt(forward, backward, forward.length() - 1);
    }

    /** Arg-max of {@link #currentStateProbabilities()}, lowest index on ties. */
    public int mostLikelyCurrentState() {
        double[] current = currentStateProbabilities();
        int best = 0;
        for (int i = 1; i < current.length; i++) {
            if (current[i] > current[best]) best = i;
        }
        return best;
    }

    public double logLikelihood() {
        return forward.logLikelihood();
    }
}
