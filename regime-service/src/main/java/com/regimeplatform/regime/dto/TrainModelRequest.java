package com.regimeplatform.regime.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.training.TrainingOptions;
import com.regimeplatform.regime.config.TrainingDefaults;

/**
 * Body of {@code POST /api/v1/regime/train}. {@code numStates} may be left out when an
 * {@code initialModel} is supplied.
 */
public record TrainModelRequest(
    @JsonProperty("observations")         double[][] observations,
    @JsonProperty("numStates")            Integer numStates,
    @JsonProperty("maxIterations")        Integer maxIterations,
    @JsonProperty("convergenceTolerance") Double convergenceTolerance,
    @JsonProperty("seed")                 Long seed,
    @JsonProperty("initialModel")         HMMModel initialModel
) {
    public TrainingOptions toOptions(TrainingDefaults defaults) {
        Integer states = numStates != null ? numStates
            : initialModel != null ? Integer.valueOf(initialModel.numStates()) : null;
        if (states == null) {
            throw HmmException.invalidParameter("numStates is required when no initialModel is given");
        }
        return new TrainingOptions(
            states,
            maxIterations != null ? maxIterations : defaults.maxIterations(),
            convergenceTolerance != null ? convergenceTolerance : defaults.convergenceTolerance(),
            initialModel,
            seed != null ? seed : defaults.seed());
    }
}
