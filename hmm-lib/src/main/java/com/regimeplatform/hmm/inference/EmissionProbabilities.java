package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.math.GaussianMath;
import com.regimeplatform.hmm.model.EmissionParams;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.validation.ModelValidator;

/**
 * T×N table of emission log densities {@code log e(t, i)} and their per-step shifted densities.
 *
 * <pre>
 *   offset(t)     = max_i log e(t, i)
 *   density(t, i) = exp(log e(t, i) - offset(t))      in [0, 1], max 1 per step
 * </pre>
 *
 * <p>Shifting keeps {@code exp} finite however many features a state has: a summed log density
 * above ~709 would otherwise overflow to infinity. Forward and backward passes work on the shifted
 * densities; the forward pass adds the offsets back into the log-likelihood.
 *
 * <p>Evaluated once per E-step and shared by the forward pass, the backward pass and the
 * transition posteriors, so all three see bit-identical densities.
 */
public final class EmissionProbabilities {

    private final double[][] logDensities;
    private final double[][] densities;
    private final double[] offsets;

    private EmissionProbabilities(double[][] logDensities, double[][] densities, double[] offsets) {
        this.logDensities = logDensities;
        this.densities = densities;
        this.offsets = offsets;
    }

    /**
     * @throws com.regimeplatform.hmm.exception.HmmException DIMENSION_MISMATCH when the
     *         observation feature count differs from the model's
     */
    public static EmissionProbabilities evaluate(ObservationSequence observations, HMMModel model) {
        ModelValidator.requireSameFeatureCount(observations, model);
        int length = observations.length();
        int numStates = model.numStates();

        double[][] means = new double[numStates][];
        double[][] variances = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            EmissionParams params = model.emission(i);
            means[i] = params.means();
            variances[i] = params.variances();
        }

        double[][] logDensities = new double[length][numStates];
        double[][] densities = new double[length][numStates];
        double[] offsets = new double[length];
        for (int t = 0; t < length; t++) {
            double[] x = observations.row(t);
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < numStates; i++) {
                logDensities[t][i] = GaussianMath.logMultivariateGaussianPDF(x, means[i], variances[i]);
                max = Math.max(max, logDensities[t][i]);
            }
            offsets[t] = max;
            for (int i = 0; i < numStates; i++) {
                densities[t][i] = Math.exp(logDensities[t][i] - max);
            }
        }
        return new EmissionProbabilities(logDensities, densities, offsets);
    }

    /** Shifted density {@code exp(log e(t, i) - offset(t))}. */
    public double get(int t, int state) {
        return densities[t][state];
    }

    /** Unshifted log density. */
    public double logDensity(int t, int state) {
        return logDensities[t][state];
    }

    public double logOffset(int t) {
        return offsets[t];
    }

    public int length() {
        return densities.length;
    }

    public int numStates() {
        return densities.length == 0 ? 0 : densities[0].length;
    }
}
