package com.regimeplatform.hmm.training;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.inference.BackwardResult;
import com.regimeplatform.hmm.inference.EmissionProbabilities;
import com.regimeplatform.hmm.inference.ForwardBackward;
import com.regimeplatform.hmm.inference.ForwardBackwardResult;
import com.regimeplatform.hmm.inference.ForwardResult;
import com.regimeplatform.hmm.init.ModelInitializer;
import com.regimeplatform.hmm.math.ProbabilityVectors;
import com.regimeplatform.hmm.model.EmissionParams;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.validation.ModelValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Baum-Welch expectation-maximization for Gaussian HMMs.
 *
 * <h3>One iteration</h3>
 * <ol>
 *   <li><b>Cancellation check</b>: the only point where a run may stop early.</li>
 *   <li><b>E-step</b>: emission table, forward pass, backward pass on the forward scaling factors.</li>
 *   <li><b>Posteriors</b>: γ[t][i] ∝ α·β; ξ[t][i][j] ∝ α[t][i]·A[i][j]·e(t+1,j)·β[t+1][j],
 *       normalized per t and summed into an N×N accumulator as it is produced.</li>
 *   <li><b>M-step</b>: a new {@link HMMModel} is built from the accumulators; the previous one
 *       is never touched.</li>
 *   <li><b>Stopping rule</b>: CONVERGED once the log-likelihood gain drops below the tolerance,
 *       EXHAUSTED when the iteration budget runs out first.</li>
 * </ol>
 *
 * <p>EM never lowers the likelihood. A drop larger than {@value #MONOTONICITY_SLACK} is logged
 * as a warning because it points at a defect, not at the data.
 *
 * <p>Synchronous and single-threaded; concurrent runs share nothing.
 */
public final class BaumWelchTrainer {

    private static final Logger log = LoggerFactory.getLogger(BaumWelchTrainer.class);

    static final double MONOTONICITY_SLACK = 1e-9;

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private BaumWelchTrainer() {}

    public static TrainingResult train(ObservationSequence observations, TrainingOptions options) {
        return train(observations, options, NEVER_CANCELLED);
    }

    /**
     * @param cancellationRequested polled before every E-step; {@code true} ends the run with
     *                              {@link TrainingStatus#CANCELLED}
     * @throws HmmException INSUFFICIENT_DATA when T &lt; 2 or T &lt; N; DIMENSION_MISMATCH when a
     *         supplied initial model's feature count differs from the observations
     */
    public static TrainingResult train(ObservationSequence observations, TrainingOptions options,
                                       BooleanSupplier cancellationRequested) {
        Objects.requireNonNull(observations, "observations");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(cancellationRequested, "cancellationRequested");

        if (observations.length() < 2) {
            throw HmmException.insufficientData(
                "transition estimation needs at least 2 observations, got " + observations.length());
        }
        ModelValidator.requireEnoughObservations(observations, options.numStates());

        TrainingStatus status = TrainingStatus.INITIALIZING;
        HMMModel model = options.initialModel();
        if (model != null) {
            ModelValidator.requireSameFeatureCount(observations, model);
        } else {
            model = ModelInitializer.seeded(options.seed()).initialize(observations, options.numStates());
        }
        log.debug("status={} startingModel={} T={} N={} maxIterations={} tolerance={}",
            status, options.initialModel() != null ? "supplied" : "seed=" + options.seed(),
            observations.length(), options.numStates(), options.maxIterations(),
            options.convergenceTolerance());

        status = TrainingStatus.ITERATING;
        List<Double> trajectory = new ArrayList<>();
        double previous = Double.NEGATIVE_INFINITY;

        while (status == TrainingStatus.ITERATING) {
            if (trajectory.size() >= options.maxIterations()) {
                status = TrainingStatus.EXHAUSTED;
                break;
            }
            if (cancellationRequested.getAsBoolean()) {
                status = TrainingStatus.CANCELLED;
                break;
            }

            EmissionProbabilities emissions = EmissionProbabilities.evaluate(observations, model);
            ForwardBackwardResult posterior = ForwardBackward.run(emissions, model);
            double logLikelihood = posterior.logLikelihood();
            trajectory.add(logLikelihood);

            if (posterior.forward().hasDegenerateSteps()) {
                log.warn("Forward mass vanished at {} step(s) in iteration={}; keeping current model",
                    posterior.forward().degenerateSteps(), trajectory.size());
                status = TrainingStatus.DEGENERATE;
                break;
            }

            model = reestimate(observations, model, emissions, posterior);

            double delta = logLikelihood - previous;
            log.debug("iteration={} logLikelihood={} delta={}", trajectory.size(), logLikelihood, delta);
            if (delta < -MONOTONICITY_SLACK) {
                log.warn("Log-likelihood decreased at iteration={}: {} -> {}",
                    trajectory.size(), previous, logLikelihood);
            }
            if (delta < options.convergenceTolerance()) {
                status = TrainingStatus.CONVERGED;
            }
            previous = logLikelihood;
        }

        TrainingResult result = TrainingResult.of(model, status, trajectory);
        log.info("Baum-Welch finished. status={} iterations={} T={} N={} D={} logLikelihood={}",
            result.status(), result.iterations(), observations.length(), model.numStates(),
            model.numFeatures(), result.finalLogLikelihood());
        return result;
    }

    // ── M-step ─────────────────────────────────────────────────────────────

    /**
     * Builds the next model from one E-step's posteriors.
     */
    static HMMModel reestimate(ObservationSequence observations, HMMModel model,
                               EmissionProbabilities emissions, ForwardBackwardResult posterior) {
        int length = observations.length();
        int numStates = model.numStates();
        int numFeatures = model.numFeatures();

        ForwardResult forward = posterior.forward();
        BackwardResult backward = posterior.backward();
        double[][] gamma = posterior.stateProbabilities();

        // ── transition posteriors, accumulated over t = 0..T-2 ─────────────
        double[][] xiSum = new double[numStates][numStates];
        double[] gammaSumExcludingLast = new double[numStates];
        double[][] xi = new double[numStates][numStates];
        for (int t = 0; t < length - 1; t++) {
            double norm = 0.0;
            for (int i = 0; i < numStates; i++) {
                double a = forward.alpha(t, i);
                for (int j = 0; j < numStates; j++) {
                    xi[i][j] = a * model.transitionProbability(i, j)
                        * emissions.get(t + 1, j) * backward.beta(t + 1, j);
                    norm += xi[i][j];
                }
            }
            if (norm > 0.0) {
                for (int i = 0; i < numStates; i++) {
                    for (int j = 0; j < numStates; j++) {
                        xiSum[i][j] += xi[i][j] / norm;
                    }
                }
            }
            for (int i = 0; i < numStates; i++) {
                gammaSumExcludingLast[i] += gamma[t][i];
            }
        }

        double[][] transitions = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            if (gammaSumExcludingLast[i] > 0.0) {
                double[] row = new double[numStates];
                for (int j = 0; j < numStates; j++) {
                    row[j] = xiSum[i][j] / gammaSumExcludingLast[i];
                }
                transitions[i] = ProbabilityVectors.normalize(row);
            } else {
                transitions[i] = model.transitionMatrix()[i];
            }
        }

        // ── emissions ──────────────────────────────────────────────────────
        List<EmissionParams> emissionParams = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            double weight = 0.0;
            for (int t = 0; t < length; t++) {
                weight += gamma[t][i];
            }
            if (!(weight > 0.0)) {
                emissionParams.add(model.emission(i));
                continue;
            }

            double[] means = new double[numFeatures];
            double[] variances = new double[numFeatures];
            for (int d = 0; d < numFeatures; d++) {
                double sum = 0.0;
                for (int t = 0; t < length; t++) {
                    sum += gamma[t][i] * observations.value(t, d);
                }
                means[d] = sum / weight;
            }
            for (int d = 0; d < numFeatures; d++) {
                double sum = 0.0;
                for (int t = 0; t < length; t++) {
                    double diff = observations.value(t, d) - means[d];
                    sum += gamma[t][i] * diff * diff;
                }
                variances[d] = sum / weight;
            }
            emissionParams.add(EmissionParams.floored(means, variances));
        }

        double[] initialProbs = ProbabilityVectors.normalize(gamma[0]);

        return new HMMModel(numStates, numFeatures, transitions, emissionParams, initialProbs);
    }
}
