package com.regimeplatform.regime.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.model.HMMModel;

public record DecodeRequest(
    @JsonProperty("observations") double[][] observations,
    @JsonProperty("model")        HMMModel model
) {}
