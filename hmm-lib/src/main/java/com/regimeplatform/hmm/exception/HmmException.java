package com.regimeplatform.hmm.exception;

public class HmmException extends RuntimeException {
    private final HmmErrorKind kind;

    public HmmException(HmmErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public HmmErrorKind getKind() {
        return kind;
    }

    public static HmmException invalidParameter(String message) {
        return new HmmException(HmmErrorKind.INVALID_PARAMETER, message);
    }

    public static HmmException dimensionMismatch(String message) {
        return new HmmException(HmmErrorKind.DIMENSION_MISMATCH, message);
    }

    public static HmmException insufficientData(String message) {
        return new HmmException(HmmErrorKind.INSUFFICIENT_DATA, message);
    }
}
