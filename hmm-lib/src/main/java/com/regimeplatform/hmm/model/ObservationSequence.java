package com.regimeplatform.hmm.model;

import com.regimeplatform.hmm.math.Matrices;
import com.regimeplatform.hmm.validation.ModelValidator;

/**
 * T×D matrix of already-extracted features: T time steps, D features per step.
 * Validated and copied once on construction; the core only reads it.
 */
public record ObservationSequence(double[][] values) {

    public ObservationSequence {
        ModelValidator.validateObservations(values);
        values = Matrices.copy(values);
    }

    public static ObservationSequence of(double[][] values) {
        return new ObservationSequence(values);
    }

    /** Single-feature sequence. */
    public static ObservationSequence ofSeries(double[] series) {
        double[][] values = new double[series == null ? 0 : series.length][];
        for (int t = 0; t < values.length; t++) {
            values[t] = new double[] { series[t] };
        }
        return new ObservationSequence(values);
    }

    @Override
    public double[][] values() {
        return Matrices.copy(values);
    }

    /** T */
    public int length() {
        return values.length;
    }

    /** D */
    public int dimension() {
        return values[0].length;
    }

    public double value(int t, int feature) {
        return values[t][feature];
    }

    public double[] row(int t) {
        return values[t].clone();
    }

    public double[] column(int feature) {
        double[] column = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            column[t] = values[t][feature];
        }
        return column;
    }
}
