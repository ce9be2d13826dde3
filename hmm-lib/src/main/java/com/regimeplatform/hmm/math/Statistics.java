package com.regimeplatform.hmm.math;

import com.regimeplatform.hmm.exception.HmmException;

/**
 * Descriptive statistics used by initialization and feature extraction.
 */
public final class Statistics {

    private Statistics() {}

    /**
     * @throws HmmException INVALID_PARAMETER on empty input
     */
    public static double calculateMean(double[] values) {
        requireNonEmpty(values, "mean");
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Population variance (divides by n).
     *
     * @throws HmmException INVALID_PARAMETER on empty input
     */
    public static double calculateVariance(double[] values) {
        requireNonEmpty(values, "variance");
        return calculateVariance(values, calculateMean(values));
    }

    /**
     * Population variance around a mean the caller already has.
     *
     * @throws HmmException INVALID_PARAMETER on empty input
     */
    public static double calculateVariance(double[] values, double precomputedMean) {
        requireNonEmpty(values, "variance");
        double sum = 0.0;
        for (double v : values) {
            double diff = v - precomputedMean;
            sum += diff * diff;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (divides by n-1); NaN for fewer than two values.
     */
    public static double sampleStandardDeviation(double[] values) {
        int n = values.length;
        if (n < 2) return Double.NaN;
        double mean = calculateMean(values);
        double sum = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sum += diff * diff;
        }
        return Math.sqrt(sum / (n - 1));
    }

    /**
     * Z-scores the input. Returns all zeros for empty or constant input instead of
     * dividing by a zero standard deviation.
     */
    public static double[] standardize(double[] values) {
        double[] result = new double[values.length];
        if (values.length == 0) {
            return result;
        }
        double mean = calculateMean(values);
        double variance = calculateVariance(values, mean);
        if (variance == 0.0) {
            return result;
        }
        double stdDev = Math.sqrt(variance);
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - mean) / stdDev;
        }
        return result;
    }

    /**
     * Standardizes every column of a T×D matrix independently.
     */
    public static double[][] standardizeColumns(double[][] matrix) {
        int rows = matrix.length;
        if (rows == 0 || matrix[0].length == 0) {
            return new double[rows][0];
        }
        int cols = matrix[0].length;
        double[][] result = new double[rows][cols];
        double[] column = new double[rows];
        for (int d = 0; d < cols; d++) {
            for (int t = 0; t < rows; t++) column[t] = matrix[t][d];
            double[] standardized = standardize(column);
            for (int t = 0; t < rows; t++) result[t][d] = standardized[t];
        }
        return result;
    }

    private static void requireNonEmpty(double[] values, String what) {
        if (values == null || values.length == 0) {
            throw HmmException.invalidParameter("cannot calculate " + what + " of an empty array");
        }
    }
}
