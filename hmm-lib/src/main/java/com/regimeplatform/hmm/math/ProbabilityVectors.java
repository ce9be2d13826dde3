package com.regimeplatform.hmm.math;

import java.util.Arrays;
import java.util.Random;

/**
 * Normalization and tie-breaking noise for probability vectors and stochastic matrices.
 * Every method returns a fresh array; inputs are never modified.
 */
public final class ProbabilityVectors {

    /** Lower clamp after perturbation, keeps entries non-negative and rows free of structural zeros. */
    public static final double MIN_PROBABILITY = 1e-10;

    private ProbabilityVectors() {}

    /**
     * Scales the vector to sum to 1. A zero or non-finite sum yields the uniform distribution.
     */
    public static double[] normalize(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        double[] result = new double[values.length];
        if (sum == 0.0 || !Double.isFinite(sum)) {
            Arrays.fill(result, 1.0 / values.length);
            return result;
        }
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] / sum;
        }
        return result;
    }

    public static double[][] normalizeRows(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = normalize(matrix[i]);
        }
        return result;
    }

    /**
     * Adds symmetric noise in {@code [-noiseLevel/2, noiseLevel/2)} to every entry, clamped at
     * {@link #MIN_PROBABILITY}. The result is not normalized.
     */
    public static double[] perturb(double[] values, double noiseLevel, Random random) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double noisy = values[i] + (random.nextDouble() - 0.5) * noiseLevel;
            result[i] = Math.max(noisy, MIN_PROBABILITY);
        }
        return result;
    }

    public static double[][] perturbRows(double[][] matrix, double noiseLevel, Random random) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = perturb(matrix[i], noiseLevel, random);
        }
        return result;
    }

    public static double sum(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum;
    }
}
