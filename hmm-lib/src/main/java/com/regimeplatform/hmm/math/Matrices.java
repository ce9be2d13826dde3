package com.regimeplatform.hmm.math;

/**
 * Copy helper for the row-major {@code double[][]} tables held by immutable records.
 */
public final class Matrices {

    private Matrices() {}

    /** Deep copy; every row is cloned. */
    public static double[][] copy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
