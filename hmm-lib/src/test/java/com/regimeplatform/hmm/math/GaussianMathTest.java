package com.regimeplatform.hmm.math;

import com.regimeplatform.hmm.exception.HmmErrorKind;
import com.regimeplatform.hmm.exception.HmmException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GaussianMathTest {

    @Nested
    @DisplayName("univariate")
    class Univariate {

        @Test
        @DisplayName("standard normal density at the mean")
        void standardNormalAtMean() {
            assertEquals(0.3989423, GaussianMath.gaussianPDF(0.0, 0.0, 1.0), 1e-7);
        }

        @Test
        @DisplayName("log density at the mean is -0.5·log(2π)")
        void logDensityAtMean() {
            assertEquals(-0.9189385, GaussianMath.logGaussianPDF(0.0, 0.0, 1.0), 1e-7);
        }

        @Test
        @DisplayName("log density agrees with log of the density away from the mean")
        void logMatchesDensity() {
            double x = 1.7, mean = -0.4, variance = 2.5;
            assertEquals(Math.log(GaussianMath.gaussianPDF(x, mean, variance)),
                GaussianMath.logGaussianPDF(x, mean, variance), 1e-12);
        }

        @Test
        @DisplayName("non-positive variance → INVALID_PARAMETER")
        void nonPositiveVariance() {
            HmmException zero = assertThrows(HmmException.class, () -> GaussianMath.gaussianPDF(0.0, 0.0, 0.0));
            assertEquals(HmmErrorKind.INVALID_PARAMETER, zero.getKind());
            HmmException negative = assertThrows(HmmException.class, () -> GaussianMath.logGaussianPDF(0.0, 0.0, -1.0));
            assertEquals(HmmErrorKind.INVALID_PARAMETER, negative.getKind());
        }
    }

    @Nested
    @DisplayName("diagonal multivariate")
    class Multivariate {

        @Test
        @DisplayName("2-D standard normal density at the origin is 1/(2π)")
        void twoDimensionalAtOrigin() {
            assertEquals(0.15915494,
                GaussianMath.multivariateGaussianPDF(new double[] {0, 0}, new double[] {0, 0}, new double[] {1, 1}),
                1e-8);
        }

        @Test
        @DisplayName("log density is the sum of per-feature log densities")
        void logIsSumOfFeatures() {
            double[] x = {0.3, -1.2, 2.0};
            double[] means = {0.0, -1.0, 1.5};
            double[] variances = {1.0, 0.5, 4.0};
            double expected = 0.0;
            for (int d = 0; d < x.length; d++) {
                expected += GaussianMath.logGaussianPDF(x[d], means[d], variances[d]);
            }
            assertEquals(expected, GaussianMath.logMultivariateGaussianPDF(x, means, variances), 1e-12);
        }

        @Test
        @DisplayName("far-away point underflows to 0 density but keeps a finite log density")
        void underflow() {
            double[] x = {1000.0};
            assertEquals(0.0, GaussianMath.multivariateGaussianPDF(x, new double[] {0}, new double[] {1}));
            assertTrue(Double.isFinite(GaussianMath.logMultivariateGaussianPDF(x, new double[] {0}, new double[] {1})));
        }

        @Test
        @DisplayName("mismatched lengths → DIMENSION_MISMATCH")
        void mismatchedLengths() {
            HmmException e = assertThrows(HmmException.class, () ->
                GaussianMath.multivariateGaussianPDF(new double[] {0, 0}, new double[] {0}, new double[] {1, 1}));
            assertEquals(HmmErrorKind.DIMENSION_MISMATCH, e.getKind());
            assertTrue(e.getMessage().startsWith("[DIMENSION_MISMATCH]"));
        }
    }
}
