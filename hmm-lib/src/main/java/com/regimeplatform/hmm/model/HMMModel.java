package com.regimeplatform.hmm.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.math.Matrices;
import com.regimeplatform.hmm.validation.ModelValidator;

import java.util.List;

/**
 * Parameters of a Gaussian hidden Markov model.
 *
 * <p>Immutable: arrays are copied on the way in and on the way out. Training never
 * edits a model in place; every EM iteration constructs a new instance, so a run
 * stopped between iterations always holds a complete, valid parameter set.
 *
 * <h3>Invariants (checked by {@link ModelValidator#validateModel})</h3>
 * <ul>
 *   <li>every transition row and {@code initialProbs} lie in [0, 1] and sum to 1 ± 1e-6</li>
 *   <li>exactly {@code numStates} emission sets, each with {@code numFeatures} features</li>
 *   <li>every emission variance is strictly positive</li>
 * </ul>
 */
public record HMMModel(
    @JsonProperty("numStates")        int numStates,
    @JsonProperty("numFeatures")      int numFeatures,
    @JsonProperty("transitionMatrix") double[][] transitionMatrix,
    @JsonProperty("emissionParams")   List<EmissionParams> emissionParams,
    @JsonProperty("initialProbs")     double[] initialProbs
) {
    public HMMModel {
        ModelValidator.validateModel(numStates, numFeatures, transitionMatrix, emissionParams, initialProbs);
        transitionMatrix = Matrices.copy(transitionMatrix);
        emissionParams = List.copyOf(emissionParams);
        initialProbs = initialProbs.clone();
    }

    /**
     * Derives {@code numStates} and {@code numFeatures} from the parameter shapes.
     */
    public static HMMModel of(double[][] transitionMatrix, List<EmissionParams> emissionParams,
                              double[] initialProbs) {
        int numFeatures = emissionParams == null || emissionParams.isEmpty() || emissionParams.get(0) == null
            ? 0 : emissionParams.get(0).numFeatures();
        return new HMMModel(initialProbs == null ? 0 : initialProbs.length, numFeatures,
            transitionMatrix, emissionParams, initialProbs);
    }

    @Override
    public double[][] transitionMatrix() {
        return Matrices.copy(transitionMatrix);
    }

    @Override
    public double[] initialProbs() {
        return initialProbs.clone();
    }

    public double transitionProbability(int from, int to) {
        return transitionMatrix[from][to];
    }

    public double initialProbability(int state) {
        return initialProbs[state];
    }

    public EmissionParams emission(int state) {
        return emissionParams.get(state);
    }
}
