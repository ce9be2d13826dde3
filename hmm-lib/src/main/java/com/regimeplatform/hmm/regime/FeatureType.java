package com.regimeplatform.hmm.regime;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.regimeplatform.hmm.exception.HmmException;

import java.util.Locale;

/**
 * Price-derived features {@link FeatureExtractor} can build. Indicator-based features
 * (RSI, MACD, EMA) are supplied by callers as a custom feature matrix.
 */
public enum FeatureType {
    /** Simple one-step returns. */
    RETURNS,
    /** Rolling sample standard deviation of returns. */
    VOLATILITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FeatureType fromValue(String value) {
        if (value != null) {
            for (FeatureType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw HmmException.invalidParameter("unknown feature type: " + value);
    }
}
