package com.regimeplatform.hmm.training;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.hmm.model.HMMModel;

import java.util.List;

/**
 * Terminal output of {@link BaumWelchTrainer}.
 *
 * <p>{@code logLikelihoodTrajectory} holds the E-step log-likelihood of every iteration run,
 * in order; {@code finalLogLikelihood} is its last entry (NaN when the run was cancelled before
 * the first E-step). Each entry scores the model that entered that iteration, so
 * {@code finalLogLikelihood} belongs to the model one M-step before {@code model}, which EM
 * guarantees scores at least as high. Only after DEGENERATE, where no M-step follows the last
 * E-step, does it score {@code model} itself. Callers use {@code status} to decide whether to
 * retry with another seed.
 */
public record TrainingResult(
    @JsonProperty("model")                   HMMModel model,
    @JsonProperty("status")                  TrainingStatus status,
    @JsonProperty("iterations")              int iterations,
    @JsonProperty("logLikelihoodTrajectory") List<Double> logLikelihoodTrajectory,
    @JsonProperty("finalLogLikelihood")      double finalLogLikelihood
) {
    public TrainingResult {
        logLikelihoodTrajectory = List.copyOf(logLikelihoodTrajectory);
    }

    public static TrainingResult of(HMMModel model, TrainingStatus status, List<Double> trajectory) {
        double last = trajectory.isEmpty() ? Double.NaN : trajectory.get(trajectory.size() - 1);
        return new TrainingResult(model, status, trajectory.size(), trajectory, last);
    }

    public boolean converged() {
        return status == TrainingStatus.CONVERGED;
    }
}
