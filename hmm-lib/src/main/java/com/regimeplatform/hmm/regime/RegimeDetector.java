package com.regimeplatform.hmm.regime;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.inference.ForwardEngine;
import com.regimeplatform.hmm.inference.ForwardResult;
import com.regimeplatform.hmm.inference.ViterbiDecoder;
import com.regimeplatform.hmm.inference.ViterbiResult;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.training.BaumWelchTrainer;
import com.regimeplatform.hmm.training.TrainingResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * High-level market regime detection over a price series.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   prices → FeatureExtractor → Baum-Welch → Viterbi path
 *          → states ranked by mean of feature 0 → labels (bearish … bullish)
 *          → filtered state probabilities + confidence
 * </pre>
 *
 * <p>Ranking on the first feature assumes it is a return-like series, which holds for the
 * default feature set. Custom matrices should put their return-like column first.
 */
public final class RegimeDetector {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private RegimeDetector() {}

    public static RegimeDetectionResult detect(double[] prices) {
        return detect(prices, RegimeDetectionOptions.defaults());
    }

    public static RegimeDetectionResult detect(double[] prices, RegimeDetectionOptions options) {
        return detect(prices, options, NEVER_CANCELLED);
    }

    public static RegimeDetectionResult detect(double[] prices, RegimeDetectionOptions options,
                                               BooleanSupplier cancellationRequested) {
        ObservationSequence features =
            FeatureExtractor.extract(prices, options.features(), options.featureWindow());
        return detectOn(features, options, cancellationRequested);
    }

    /**
     * Detection over a caller-built feature matrix; columns are standardized first and
     * {@code options.features()} / {@code featureWindow()} are ignored.
     */
    public static RegimeDetectionResult detect(ObservationSequence customFeatures, RegimeDetectionOptions options) {
        return detect(customFeatures, options, NEVER_CANCELLED);
    }

    public static RegimeDetectionResult detect(ObservationSequence customFeatures, RegimeDetectionOptions options,
                                               BooleanSupplier cancellationRequested) {
        return detectOn(FeatureExtractor.standardize(customFeatures), options, cancellationRequested);
    }

    private static RegimeDetectionResult detectOn(ObservationSequence features, RegimeDetectionOptions options,
                                                  BooleanSupplier cancellationRequested) {
        int numStates = options.numStates();
        if (features.length() < numStates * 2) {
            throw HmmException.insufficientData(String.format(
                "not enough observations (%d) for %d states; need at least %d",
                features.length(), numStates, numStates * 2));
        }

        List<String> labels = options.stateLabels() != null
            ? options.stateLabels() : defaultLabels(numStates);

        TrainingResult training = BaumWelchTrainer.train(features, options.trainingOptions(), cancellationRequested);
        HMMModel model = training.model();

        ViterbiResult viterbi = ViterbiDecoder.decode(features, model);
        String[] stateToLabel = labelStates(model, labels);

        List<String> regimes = new ArrayList<>(features.length());
        List<Integer> stateSequence = new ArrayList<>(features.length());
        for (int state : viterbi.path()) {
            stateSequence.add(state);
            regimes.add(stateToLabel[state]);
        }

        ForwardResult forward = ForwardEngine.forward(features, model);
        double[][] stateProbabilities = filteredProbabilities(forward);

        return new RegimeDetectionResult(
            regimes.get(regimes.size() - 1),
            regimes,
            stateSequence,
            Arrays.asList(stateToLabel),
            stateProbabilities,
            model,
            confidence(stateProbabilities),
            training.status(),
            training.iterations(),
            forward.logLikelihood());
    }

    // ── labelling ──────────────────────────────────────────────────────────

    static List<String> defaultLabels(int numStates) {
        return switch (numStates) {
            case 2 -> List.of("bearish", "bullish");
            case 3 -> List.of("bearish", "neutral", "bullish");
            case 4 -> List.of("strong_bearish", "weak_bearish", "weak_bullish", "strong_bullish");
            default -> {
                List<String> generic = new ArrayList<>(numStates);
                for (int i = 0; i < numStates; i++) generic.add("state_" + i);
                yield generic;
            }
        };
    }

    /**
     * Label for every state index: the state with the lowest first-feature mean gets
     * {@code labels[0]}, the highest gets the last label. Ties keep index order.
     */
    static String[] labelStates(HMMModel model, List<String> labels) {
        int numStates = model.numStates();
        List<Integer> order = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) order.add(i);
        order.sort(Comparator.comparingDouble(i -> model.emission(i).mean(0)));

        String[] stateToLabel = new String[numStates];
        for (int rank = 0; rank < numStates; rank++) {
            stateToLabel[order.get(rank)] = labels.get(rank);
        }
        return stateToLabel;
    }

    // ── probabilities ──────────────────────────────────────────────────────

    /** Normalized alpha rows; a degenerate all-zero row becomes uniform. */
    static double[][] filteredProbabilities(ForwardResult forward) {
        int length = forward.length();
        int numStates = forward.numStates();
        double[][] probabilities = new double[length][numStates];
        for (int t = 0; t < length; t++) {
            double sum = 0.0;
            for (int i = 0; i < numStates; i++) sum += forward.alpha(t, i);
            for (int i = 0; i < numStates; i++) {
                probabilities[t][i] = sum > 0.0 ? forward.alpha(t, i) / sum : 1.0 / numStates;
            }
        }
        return probabilities;
    }

    static double confidence(double[][] stateProbabilities) {
        if (stateProbabilities.length == 0) {
            return 0.0;
        }
        double total = 0.0;
        for (double[] row : stateProbabilities) {
            double max = 0.0;
            for (double p : row) max = Math.max(max, p);
            total += max;
        }
        return Math.min(1.0, total / stateProbabilities.length);
    }
}
