package com.regimeplatform.hmm.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.math.Matrices;

/**
 * Output of {@link BackwardEngine}. Only meaningful together with the {@link ForwardResult}
 * whose scaling factors produced it.
 */
public record BackwardResult(
    @JsonProperty("beta") double[][] beta
) {
    public BackwardResult {
        beta = Matrices.copy(beta);
    }

    @Override
    public double[][] beta() {
        return Matrices.copy(beta);
    }

    public double beta(int t, int state) {
        return beta[t][state];
    }
}
