package com.regimeplatform.regime.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Viterbi path plus smoothed posteriors (γ) of an observation matrix under a fixed model.
 */
public record DecodeResponse(
    @JsonProperty("path")               int[] path,
    @JsonProperty("pathLogProbability") double pathLogProbability,
    @JsonProperty("stateProbabilities") double[][] stateProbabilities,
    @JsonProperty("currentState")       int currentState,
    @JsonProperty("logLikelihood")      double logLikelihood
) {}
