package com.regimeplatform.hmm.regime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.training.TrainingStatus;

import java.util.List;

/**
 * Output of {@link RegimeDetector}.
 *
 * <ul>
 *   <li>{@code regimes} / {@code stateSequence}: Viterbi path, as labels and as state indices</li>
 *   <li>{@code stateProbabilities}: filtered P(state_t | obs_0..t) from the forward pass, T×N</li>
 *   <li>{@code confidence}: mean over t of the largest filtered probability, in [0, 1]</li>
 * </ul>
 */
public record RegimeDetectionResult(
    @JsonProperty("currentRegime")      String currentRegime,
    @JsonProperty("regimes")            List<String> regimes,
    @JsonProperty("stateSequence")      List<Integer> stateSequence,
    @JsonProperty("stateLabels")        List<String> stateLabels,
    @JsonProperty("stateProbabilities") double[][] stateProbabilities,
    @JsonProperty("model")              HMMModel model,
    @JsonProperty("confidence")         double confidence,
    @JsonProperty("trainingStatus")     TrainingStatus trainingStatus,
    @JsonProperty("iterations")         int iterations,
    @JsonProperty("logLikelihood")      double logLikelihood
) {
    public RegimeDetectionResult {
        regimes = List.copyOf(regimes);
        stateSequence = List.copyOf(stateSequence);
        stateLabels = List.copyOf(stateLabels);
    }
}
