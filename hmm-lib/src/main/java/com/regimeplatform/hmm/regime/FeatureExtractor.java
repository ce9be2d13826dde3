package com.regimeplatform.hmm.regime;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.math.Statistics;
import com.regimeplatform.hmm.model.ObservationSequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns a price series into a standardized T×D observation matrix.
 *
 * <p>Prices are oldest-first. Feature series have different warm-up lengths, so all of them are
 * trimmed from the start to the shortest one before the columns are z-scored.
 */
public final class FeatureExtractor {

    private FeatureExtractor() {}

    /**
     * @param prices   closing prices, oldest-first; at least 2, all finite and positive
     * @param features feature columns in output order (duplicates ignored)
     * @param window   rolling window for {@link FeatureType#VOLATILITY} (≥ 2); unused otherwise
     * @throws HmmException INVALID_PARAMETER on bad prices / options; INSUFFICIENT_DATA when
     *         the window leaves no aligned observations
     */
    public static ObservationSequence extract(double[] prices, List<FeatureType> features, int window) {
        validatePrices(prices);
        if (features == null || features.isEmpty()) {
            throw HmmException.invalidParameter("at least one feature type is required");
        }
        if (features.contains(FeatureType.VOLATILITY) && window < 2) {
            throw HmmException.invalidParameter("feature window must be at least 2, got " + window);
        }

        double[] returns = returns(prices);
        List<double[]> columns = new ArrayList<>();
        for (FeatureType type : new LinkedHashSet<>(features)) {
            columns.add(switch (type) {
                case RETURNS    -> returns;
                case VOLATILITY -> rollingVolatility(returns, window);
            });
        }

        int aligned = Integer.MAX_VALUE;
        for (double[] column : columns) aligned = Math.min(aligned, column.length);
        if (aligned <= 0) {
            throw HmmException.insufficientData(String.format(
                "%d prices leave no observations for a %d-step volatility window", prices.length, window));
        }

        double[][] matrix = new double[aligned][columns.size()];
        for (int d = 0; d < columns.size(); d++) {
            double[] column = columns.get(d);
            int offset = column.length - aligned;
            for (int t = 0; t < aligned; t++) {
                matrix[t][d] = column[offset + t];
            }
        }
        return ObservationSequence.of(Statistics.standardizeColumns(matrix));
    }

    /**
     * Column-standardizes a caller-supplied feature matrix.
     */
    public static ObservationSequence standardize(ObservationSequence customFeatures) {
        return ObservationSequence.of(Statistics.standardizeColumns(customFeatures.values()));
    }

    /** (p[i] - p[i-1]) / p[i-1]; length n-1. */
    static double[] returns(double[] prices) {
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = (prices[i] - prices[i - 1]) / prices[i - 1];
        }
        return returns;
    }

    /** Sample standard deviation of each trailing window of returns; length n-window+1. */
    static double[] rollingVolatility(double[] returns, int window) {
        int count = returns.length - window + 1;
        if (count <= 0) {
            return new double[0];
        }
        double[] volatility = new double[count];
        for (int i = window - 1; i < returns.length; i++) {
            volatility[i - window + 1] =
                Statistics.sampleStandardDeviation(Arrays.copyOfRange(returns, i - window + 1, i + 1));
        }
        return volatility;
    }

    static void validatePrices(double[] prices) {
        if (prices == null || prices.length < 2) {
            throw HmmException.invalidParameter("at least 2 prices are required");
        }
        for (int i = 0; i < prices.length; i++) {
            if (!Double.isFinite(prices[i])) {
                throw HmmException.invalidParameter("price at index " + i + " is not finite");
            }
            if (prices[i] <= 0.0) {
                throw HmmException.invalidParameter("price at index " + i + " must be positive, got " + prices[i]);
            }
        }
    }
}
