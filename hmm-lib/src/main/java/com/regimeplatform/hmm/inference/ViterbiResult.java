package com.regimeplatform.hmm.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param path           most likely hidden state for every time step
 * @param logProbability joint log-probability of the path and the observations
 */
public record ViterbiResult(
    @JsonProperty("path")           int[] path,
    @JsonProperty("logProbability") double logProbability
) {
    public ViterbiResult {
        path = path.clone();
    }

    @Override
    public int[] path() {
        return path.clone();
    }

    public int state(int t) {
        return path[t];
    }

    public int finalState() {
        return path[path.length - 1];
    }
}
