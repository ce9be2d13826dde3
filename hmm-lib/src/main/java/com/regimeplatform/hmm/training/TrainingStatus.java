package com.regimeplatform.hmm.training;

/**
 * Lifecycle of a {@link BaumWelchTrainer} run.
 *
 * <pre>
 *   INITIALIZING → ITERATING → CONVERGED | EXHAUSTED | CANCELLED | DEGENERATE
 * </pre>
 */
public enum TrainingStatus {
    INITIALIZING,
    ITERATING,
    /** Log-likelihood gain fell below the tolerance. */
    CONVERGED,
    /** Iteration budget used up first; the model is usable but unconverged. */
    EXHAUSTED,
    /** Cancellation signal observed between iterations. */
    CANCELLED,
    /** Forward mass reached zero at some step; the model that produced it is returned unchanged. */
    DEGENERATE;

    public boolean isTerminal() {
        return this != INITIALIZING && this != ITERATING;
    }
}
