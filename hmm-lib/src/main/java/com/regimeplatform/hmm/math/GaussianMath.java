package com.regimeplatform.hmm.math;

import com.regimeplatform.hmm.exception.HmmException;

/**
 * Univariate and diagonal-covariance multivariate Gaussian densities.
 *
 * <p>The log-space variants are the ones the inference engines use: a product of
 * per-feature densities underflows quickly once a few features sit several standard
 * deviations from their mean, while the sum of log densities stays finite.
 *
 * <p>Pure static utility. No state, no logging.
 */
public final class GaussianMath {

    private static final double LOG_TWO_PI = Math.log(2.0 * Math.PI);

    private GaussianMath() {}

    /**
     * @return N(x | mean, variance)
     * @throws HmmException INVALID_PARAMETER when {@code variance <= 0}
     */
    public static double gaussianPDF(double x, double mean, double variance) {
        requirePositiveVariance(variance);
        double diff = x - mean;
        return Math.exp(-diff * diff / (2.0 * variance)) / Math.sqrt(2.0 * Math.PI * variance);
    }

    /**
     * @return {@code -0.5·log(2π·variance) - (x-mean)²/(2·variance)}
     * @throws HmmException INVALID_PARAMETER when {@code variance <= 0}
     */
    public static double logGaussianPDF(double x, double mean, double variance) {
        requirePositiveVariance(variance);
        double diff = x - mean;
        return -0.5 * (LOG_TWO_PI + Math.log(variance)) - diff * diff / (2.0 * variance);
    }

    /**
     * Product of independent per-feature densities.
     *
     * @throws HmmException DIMENSION_MISMATCH when the three vectors differ in length
     */
    public static double multivariateGaussianPDF(double[] x, double[] means, double[] variances) {
        requireSameLength(x, means, variances);
        double product = 1.0;
        for (int d = 0; d < x.length; d++) {
            product *= gaussianPDF(x[d], means[d], variances[d]);
        }
        return product;
    }

    /**
     * Sum of per-feature log densities.
     *
     * @throws HmmException DIMENSION_MISMATCH when the three vectors differ in length
     */
    public static double logMultivariateGaussianPDF(double[] x, double[] means, double[] variances) {
        requireSameLength(x, means, variances);
        double sum = 0.0;
        for (int d = 0; d < x.length; d++) {
            sum += logGaussianPDF(x[d], means[d], variances[d]);
        }
        return sum;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static void requirePositiveVariance(double variance) {
        if (!(variance > 0.0)) {
            throw HmmException.invalidParameter("variance must be positive, got " + variance);
        }
    }

    private static void requireSameLength(double[] x, double[] means, double[] variances) {
        if (x.length != means.length || x.length != variances.length) {
            throw HmmException.dimensionMismatch(String.format(
                "multivariate Gaussian needs equal lengths: x=%d means=%d variances=%d",
                x.length, means.length, variances.length));
        }
    }
}
