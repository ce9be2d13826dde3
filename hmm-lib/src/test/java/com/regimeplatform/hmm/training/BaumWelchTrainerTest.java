package com.regimeplatform.hmm.training;

import com.regimeplatform.hmm.HmmFixtures;
import com.regimeplatform.hmm.exception.HmmErrorKind;
import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.inference.EmissionProbabilities;
import com.regimeplatform.hmm.inference.ForwardBackward;
import com.regimeplatform.hmm.inference.ForwardEngine;
import com.regimeplatform.hmm.model.EmissionParams;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static com.regimeplatform.hmm.HmmFixtures.assertDistribution;
import static com.regimeplatform.hmm.HmmFixtures.assertRowStochastic;
import static org.junit.jupiter.api.Assertions.*;

class BaumWelchTrainerTest {

    // ── convergence ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("two well-separated regimes")
    class TwoRegimes {

        private final ObservationSequence observations = HmmFixtures.alternatingBlocks();
        private final TrainingOptions options = TrainingOptions.of(2)
            .withMaxIterations(50)
            .withConvergenceTolerance(1e-6);

        @Test
        @DisplayName("converges to means near ±5 with sticky transitions")
        void convergesToRegimes() {
            TrainingResult result = BaumWelchTrainer.train(observations, options);

            assertEquals(TrainingStatus.CONVERGED, result.status());
            assertTrue(result.converged());
            assertTrue(result.iterations() < 50);

            HMMModel model = result.model();
            double low = Math.min(model.emission(0).mean(0), model.emission(1).mean(0));
            double high = Math.max(model.emission(0).mean(0), model.emission(1).mean(0));
            assertEquals(-5.0, low, 0.5);
            assertEquals(5.0, high, 0.5);
            assertTrue(model.transitionProbability(0, 0) > 0.8);
            assertTrue(model.transitionProbability(1, 1) > 0.8);
        }

        @Test
        @DisplayName("trained model stays row-stochastic")
        void rowStochastic() {
            HMMModel model = BaumWelchTrainer.train(observations, options).model();
            assertRowStochastic(model.transitionMatrix(), 1e-9);
            assertDistribution(model.initialProbs(), 1e-9);
        }

        @Test
        @DisplayName("log-likelihood never decreases across iterations")
        void monotoneLikelihood() {
            List<Double> trajectory = BaumWelchTrainer.train(observations, options).logLikelihoodTrajectory();
            assertFalse(trajectory.isEmpty());
            for (int k = 1; k < trajectory.size(); k++) {
                assertTrue(trajectory.get(k) >= trajectory.get(k - 1) - 1e-9,
                    "iteration " + k + ": " + trajectory.get(k - 1) + " -> " + trajectory.get(k));
            }
        }

        @Test
        @DisplayName("same seed → same result")
        void reproducible() {
            TrainingResult first = BaumWelchTrainer.train(observations, options.withSeed(7));
            TrainingResult second = BaumWelchTrainer.train(observations, options.withSeed(7));
            assertEquals(first.logLikelihoodTrajectory(), second.logLikelihoodTrajectory());
            assertEquals(first.finalLogLikelihood(), second.finalLogLikelihood());
        }

        @Test
        @DisplayName("supplied initial model is used instead of the initializer")
        void suppliedInitialModel() {
            TrainingResult result = BaumWelchTrainer.train(observations, TrainingOptions.from(HmmFixtures.twoStateModel()));
            assertEquals(TrainingStatus.CONVERGED, result.status());
            // state order of the supplied model is kept
            assertTrue(result.model().emission(0).mean(0) < 0.0);
            assertTrue(result.model().emission(1).mean(0) > 0.0);
        }
    }

    @Test
    @DisplayName("two-feature data: likelihood is monotone and every variance is floored")
    void multiFeatureMonotone() {
        Random random = new Random(2024);
        double[][] values = new double[120][2];
        for (int t = 0; t < values.length; t++) {
            boolean calm = (t / 20) % 2 == 0;
            values[t][0] = (calm ? 0.5 : -0.5) + random.nextGaussian() * 0.3;
            values[t][1] = (calm ? 0.2 : 2.0) + random.nextGaussian() * 0.2;
        }
        TrainingResult result = BaumWelchTrainer.train(ObservationSequence.of(values), TrainingOptions.of(3));

        List<Double> trajectory = result.logLikelihoodTrajectory();
        for (int k = 1; k < trajectory.size(); k++) {
            assertTrue(trajectory.get(k) >= trajectory.get(k - 1) - 1e-9);
        }
        for (int i = 0; i < 3; i++) {
            for (int d = 0; d < 2; d++) {
                assertTrue(result.model().emission(i).variance(d) >= EmissionParams.VARIANCE_FLOOR);
            }
        }
        assertTrue(result.status() == TrainingStatus.CONVERGED || result.status() == TrainingStatus.EXHAUSTED);
    }

    // ── terminal states ────────────────────────────────────────────────────

    @Nested
    @DisplayName("stopping")
    class Stopping {

        @Test
        @DisplayName("iteration budget of 1 → EXHAUSTED after one E-step")
        void exhausted() {
            TrainingResult result = BaumWelchTrainer.train(HmmFixtures.alternatingBlocks(),
                TrainingOptions.of(2).withMaxIterations(1));
            assertEquals(TrainingStatus.EXHAUSTED, result.status());
            assertEquals(1, result.iterations());
            assertEquals(result.logLikelihoodTrajectory().get(0), result.finalLogLikelihood());
        }

        @Test
        @DisplayName("final log-likelihood scores the model that entered the last iteration")
        void finalLogLikelihoodPrecedesLastUpdate() {
            HMMModel start = HmmFixtures.twoStateModel();
            ObservationSequence obs = HmmFixtures.alternatingBlocks();
            TrainingResult result = BaumWelchTrainer.train(obs, TrainingOptions.from(start).withMaxIterations(1));

            assertNotSame(start, result.model());
            assertEquals(ForwardEngine.forward(obs, start).logLikelihood(), result.finalLogLikelihood(), 1e-9);
            assertTrue(ForwardEngine.forward(obs, result.model()).logLikelihood() >= result.finalLogLikelihood() - 1e-9);
        }

        @Test
        @DisplayName("cancellation before the first E-step → CANCELLED with the starting model")
        void cancelledImmediately() {
            HMMModel start = HmmFixtures.twoStateModel();
            TrainingResult result = BaumWelchTrainer.train(HmmFixtures.alternatingBlocks(),
                TrainingOptions.from(start), () -> true);
            assertEquals(TrainingStatus.CANCELLED, result.status());
            assertEquals(0, result.iterations());
            assertTrue(Double.isNaN(result.finalLogLikelihood()));
            assertSame(start, result.model());
        }

        @Test
        @DisplayName("cancellation is polled once per iteration")
        void cancelledAfterTwoIterations() {
            AtomicInteger polls = new AtomicInteger();
            TrainingResult result = BaumWelchTrainer.train(HmmFixtures.alternatingBlocks(),
                TrainingOptions.of(2).withConvergenceTolerance(1e-300), () -> polls.incrementAndGet() > 2);
            assertEquals(TrainingStatus.CANCELLED, result.status());
            assertEquals(2, result.iterations());
            assertEquals(3, polls.get());
        }

        @Test
        @DisplayName("vanished forward mass → DEGENERATE, model left unchanged")
        void degenerate() {
            HMMModel start = HmmFixtures.absorbingModel();
            ObservationSequence obs = ObservationSequence.ofSeries(new double[] {1000.0, 5.0, 5.0});
            TrainingResult result = BaumWelchTrainer.train(obs, TrainingOptions.from(start));
            assertEquals(TrainingStatus.DEGENERATE, result.status());
            assertEquals(1, result.iterations());
            assertEquals(Double.NEGATIVE_INFINITY, result.finalLogLikelihood());
            assertSame(start, result.model());
        }

        @Test
        @DisplayName("many features at the variance floor train without a false DEGENERATE")
        void highDimensionalNotDegenerate() {
            int numFeatures = 150;
            HMMModel start = HmmFixtures.sharpHighDimensionalModel(numFeatures);
            ObservationSequence obs = ObservationSequence.of(new double[4][numFeatures]);
            TrainingResult result = BaumWelchTrainer.train(obs, TrainingOptions.from(start));

            assertEquals(TrainingStatus.CONVERGED, result.status());
            assertTrue(Double.isFinite(result.finalLogLikelihood()));
            assertTrue(result.finalLogLikelihood() > 709.0);
            assertRowStochastic(result.model().transitionMatrix(), 1e-9);
        }
    }

    // ── input errors ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("invalid input")
    class InvalidInput {

        @Test
        @DisplayName("single observation → INSUFFICIENT_DATA")
        void singleObservation() {
            HmmException e = assertThrows(HmmException.class, () ->
                BaumWelchTrainer.train(ObservationSequence.ofSeries(new double[] {1.0}), TrainingOptions.of(1)));
            assertEquals(HmmErrorKind.INSUFFICIENT_DATA, e.getKind());
        }

        @Test
        @DisplayName("more states than observations → INSUFFICIENT_DATA")
        void moreStatesThanObservations() {
            HmmException e = assertThrows(HmmException.class, () ->
                BaumWelchTrainer.train(ObservationSequence.ofSeries(new double[] {1, 2, 3}), TrainingOptions.of(4)));
            assertEquals(HmmErrorKind.INSUFFICIENT_DATA, e.getKind());
        }

        @Test
        @DisplayName("initial model with another feature count → DIMENSION_MISMATCH")
        void initialModelFeatureMismatch() {
            ObservationSequence twoFeatures = ObservationSequence.of(new double[][] {{0, 0}, {1, 1}, {2, 2}});
            HmmException e = assertThrows(HmmException.class, () ->
                BaumWelchTrainer.train(twoFeatures, TrainingOptions.from(HmmFixtures.twoStateModel())));
            assertEquals(HmmErrorKind.DIMENSION_MISMATCH, e.getKind());
        }

        @Test
        @DisplayName("initial model with another state count → DIMENSION_MISMATCH")
        void initialModelStateMismatch() {
            HmmException e = assertThrows(HmmException.class, () ->
                TrainingOptions.of(3).withInitialModel(HmmFixtures.twoStateModel()));
            assertEquals(HmmErrorKind.DIMENSION_MISMATCH, e.getKind());
        }

        @Test
        @DisplayName("non-positive budget or tolerance → INVALID_PARAMETER")
        void invalidOptions() {
            assertEquals(HmmErrorKind.INVALID_PARAMETER,
                assertThrows(HmmException.class, () -> TrainingOptions.of(2).withMaxIterations(0)).getKind());
            assertEquals(HmmErrorKind.INVALID_PARAMETER,
                assertThrows(HmmException.class, () -> TrainingOptions.of(2).withConvergenceTolerance(0.0)).getKind());
            assertEquals(HmmErrorKind.INVALID_PARAMETER,
                assertThrows(HmmException.class, () -> TrainingOptions.of(0)).getKind());
        }
    }

    @Test
    @DisplayName("one M-step from the true model keeps the means near ±5")
    void singleReestimation() {
        ObservationSequence obs = HmmFixtures.alternatingBlocks();
        HMMModel model = HmmFixtures.twoStateModel();
        EmissionProbabilities emissions = EmissionProbabilities.evaluate(obs, model);
        HMMModel next = BaumWelchTrainer.reestimate(obs, model, emissions, ForwardBackward.run(emissions, model));

        assertEquals(-5.0, next.emission(0).mean(0), 0.1);
        assertEquals(5.0, next.emission(1).mean(0), 0.1);
        assertRowStochastic(next.transitionMatrix(), 1e-9);
        // 9 switches out of 99 transitions
        assertEquals(0.9, next.transitionProbability(0, 0), 0.05);
    }
}
