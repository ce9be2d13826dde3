package com.regimeplatform.hmm.exception;

/**
 * Tag carried by every {@link HmmException}. All three kinds are caller contract
 * violations; none of them is transient or retried.
 */
public enum HmmErrorKind {
    /** Non-positive state count, iteration budget, tolerance or variance. */
    INVALID_PARAMETER,
    /** Observation and parameter vector lengths disagree. */
    DIMENSION_MISMATCH,
    /** Fewer time steps than states, or too short a sequence to estimate transitions. */
    INSUFFICIENT_DATA
}
