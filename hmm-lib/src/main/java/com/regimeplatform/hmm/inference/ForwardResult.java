package com.regimeplatform.hmm.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.math.Matrices;

/**
 * Output of {@link ForwardEngine}.
 *
 * @param alpha           T×N scaled forward probabilities; every row sums to 1 except degenerate rows (all 0)
 * @param scalingFactors  per-step normalizers c_t of the shifted emissions; 0 marks a degenerate step whose
 *                        division was skipped
 * @param logLikelihood   Σ (log c_t + emission offset), or {@link Double#NEGATIVE_INFINITY} when any step was degenerate
 * @param degenerateSteps number of steps whose total forward mass was exactly 0 relative to the step's
 *                        most likely emission
 */
public record ForwardResult(
    @JsonProperty("alpha")           double[][] alpha,
    @JsonProperty("scalingFactors")  double[] scalingFactors,
    @JsonProperty("logLikelihood")   double logLikelihood,
    @JsonProperty("degenerateSteps") int degenerateSteps
) {
    public ForwardResult {
        alpha = Matrices.copy(alpha);
        scalingFactors = scalingFactors.clone();
    }

    @Override
    public double[][] alpha() {
        return Matrices.copy(alpha);
    }

    @Override
    public double[] scalingFactors() {
        return scalingFactors.clone();
    }

    public double alpha(int t, int state) {
        return alpha[t][state];
    }

    public double scalingFactor(int t) {
        return scalingFactors[t];
    }

    public int length() {
        return alpha.length;
    }

    public int numStates() {
        return alpha.length == 0 ? 0 : alpha[0].length;
    }

    public boolean hasDegenerateSteps() {
        return degenerateSteps > 0;
    }
}
