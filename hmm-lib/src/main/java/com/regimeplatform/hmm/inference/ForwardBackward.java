package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;

/**
 * Runs the forward pass, then the backward pass on the forward scaling factors, over a
 * single emission table.
 */
public final class ForwardBackward {

    private ForwardBackward() {}

    public static ForwardBackwardResult run(ObservationSequence observations, HMMModel model) {
        return run(EmissionProbabilities.evaluate(observations, model), model);
    }

    public static ForwardBackwardResult run(EmissionProbabilities emissions, HMMModel model) {
        ForwardResult forward = ForwardEngine.forward(emissions, model);
        BackwardResult backward = BackwardEngine.backward(emissions, model, forward.scalingFactors());
        return new ForwardBackwardResult(forward, backward);
    }
}
