package com.regimeplatform.regime.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.regime.FeatureType;
import com.regimeplatform.hmm.regime.RegimeDetectionOptions;
import com.regimeplatform.regime.config.TrainingDefaults;

import java.util.List;

/**
 * Body of {@code POST /api/v1/regime/detect}. Only {@code prices} is required; {@code symbol}
 * is informational and appears in logs.
 */
public record RegimeDetectionRequest(
    @JsonProperty("symbol")               String symbol,
    @JsonProperty("prices")               double[] prices,
    @JsonProperty("numStates")            Integer numStates,
    @JsonProperty("features")             List<FeatureType> features,
    @JsonProperty("featureWindow")        Integer featureWindow,
    @JsonProperty("stateLabels")          List<String> stateLabels,
    @JsonProperty("maxIterations")        Integer maxIterations,
    @JsonProperty("convergenceTolerance") Double convergenceTolerance,
    @JsonProperty("seed")                 Long seed
) {
    public RegimeDetectionOptions toOptions(TrainingDefaults defaults) {
        return new RegimeDetectionOptions(
            numStates != null ? numStates : RegimeDetectionOptions.DEFAULT_NUM_STATES,
            features,
            featureWindow != null ? featureWindow : RegimeDetectionOptions.DEFAULT_FEATURE_WINDOW,
            maxIterations != null ? maxIterations : defaults.maxIterations(),
            convergenceTolerance != null ? convergenceTolerance : defaults.convergenceTolerance(),
            stateLabels,
            seed != null ? seed : defaults.seed());
    }
}
