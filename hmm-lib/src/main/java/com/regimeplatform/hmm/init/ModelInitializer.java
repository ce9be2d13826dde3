package com.regimeplatform.hmm.init;

import com.regimeplatform.hmm.math.ProbabilityVectors;
import com.regimeplatform.hmm.math.Statistics;
import com.regimeplatform.hmm.model.EmissionParams;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.validation.ModelValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Produces a valid starting {@link HMMModel} from raw observations.
 *
 * <h3>Heuristic</h3>
 * <pre>
 *   state(t)    = min(t / floor(T/N), N-1)       contiguous chronological blocks
 *   emission(i) = per-feature mean / population variance of block i (variance ≥ 1e-6)
 *   A           = row-normalized (transition counts + 1), ± 0.005 noise, re-normalized
 *   π           = normalized (counts of the first min(10, T) assignments + 1), ± 0.005 noise
 * </pre>
 *
 * <p>Time segmentation stands in for k-means: regimes persist, so neighbouring
 * observations tend to share a state. Not a clustering algorithm.
 *
 * <p>All randomness (tie-breaking noise, fallback means of an empty block) comes from the
 * {@link Random} passed in, so a fixed seed reproduces the model exactly.
 */
public final class ModelInitializer {

    static final double NOISE_LEVEL = 0.01;
    static final double FALLBACK_MEAN_SPREAD = 0.1;
    static final int INITIAL_WINDOW = 10;

    private final Random random;

    public ModelInitializer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public static ModelInitializer seeded(long seed) {
        return new ModelInitializer(new Random(seed));
    }

    /**
     * @throws com.regimeplatform.hmm.exception.HmmException INVALID_PARAMETER when
     *         {@code numStates <= 0}; INSUFFICIENT_DATA when T &lt; N
     */
    public HMMModel initialize(ObservationSequence observations, int numStates) {
        ModelValidator.validateNumStates(numStates);
        ModelValidator.requireEnoughObservations(observations, numStates);

        int[] assignments = segmentAssignments(observations.length(), numStates);

        List<EmissionParams> emissionParams = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            emissionParams.add(estimateEmission(observations, assignments, i));
        }

        return new HMMModel(numStates, observations.dimension(),
            initialTransitions(assignments, numStates),
            emissionParams,
            initialDistribution(assignments, numStates));
    }

    /**
     * State index for every time step: N contiguous blocks of {@code floor(T/N)},
     * the last block absorbing the remainder.
     */
    static int[] segmentAssignments(int length, int numStates) {
        int segmentSize = Math.max(1, length / numStates);
        int[] assignments = new int[length];
        for (int t = 0; t < length; t++) {
            assignments[t] = Math.min(t / segmentSize, numStates - 1);
        }
        return assignments;
    }

    // ── emission ───────────────────────────────────────────────────────────

    EmissionParams estimateEmission(ObservationSequence observations, int[] assignments, int state) {
        int numFeatures = observations.dimension();
        int count = 0;
        for (int a : assignments) {
            if (a == state) count++;
        }

        if (count == 0) {
            double[] means = new double[numFeatures];
            double[] variances = new double[numFeatures];
            for (int d = 0; d < numFeatures; d++) {
                means[d] = (random.nextDouble() - 0.5) * FALLBACK_MEAN_SPREAD;
                variances[d] = 1.0;
            }
            return new EmissionParams(means, variances);
        }

        double[] means = new double[numFeatures];
        double[] variances = new double[numFeatures];
        double[] featureValues = new double[count];
        for (int d = 0; d < numFeatures; d++) {
            int k = 0;
            for (int t = 0; t < assignments.length; t++) {
                if (assignments[t] == state) {
                    featureValues[k++] = observations.value(t, d);
                }
            }
            means[d] = Statistics.calculateMean(featureValues);
            variances[d] = Statistics.calculateVariance(featureValues, means[d]);
        }
        return EmissionParams.floored(means, variances);
    }

    // ── transitions / initial distribution ─────────────────────────────────

    private double[][] initialTransitions(int[] assignments, int numStates) {
        double[][] counts = new double[numStates][numStates];
        for (double[] row : counts) {
            Arrays.fill(row, 1.0); // Laplace
        }
        for (int t = 0; t < assignments.length - 1; t++) {
            counts[assignments[t]][assignments[t + 1]]++;
        }
        double[][] transitions = ProbabilityVectors.normalizeRows(counts);
        transitions = ProbabilityVectors.perturbRows(transitions, NOISE_LEVEL, random);
        return ProbabilityVectors.normalizeRows(transitions);
    }

    private double[] initialDistribution(int[] assignments, int numStates) {
        double[] counts = new double[numStates];
        Arrays.fill(counts, 1.0); // Laplace
        int window = Math.min(INITIAL_WINDOW, assignments.length);
        for (int t = 0; t < window; t++) {
            counts[assignments[t]]++;
        }
        double[] initial = ProbabilityVectors.normalize(counts);
        initial = ProbabilityVectors.perturb(initial, NOISE_LEVEL, random);
        return ProbabilityVectors.normalize(initial);
    }
}
