package com.regimeplatform.hmm.inference;

import com.regimeplatform.hmm.HmmFixtures;
import com.regimeplatform.hmm.exception.HmmErrorKind;
import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.regimeplatform.hmm.HmmFixtures.assertDistribution;
import static org.junit.jupiter.api.Assertions.*;

class BackwardEngineTest {

    private final ObservationSequence observations = HmmFixtures.alternatingBlocks();
    private final HMMModel model = HmmFixtures.twoStateModel();

    @Nested
    @DisplayName("backward()")
    class Backward {

        @Test
        @DisplayName("last row is 1/c_{T-1}")
        void lastRow() {
            ForwardResult forward = ForwardEngine.forward(observations, model);
            BackwardResult backward = BackwardEngine.backward(observations, model, forward.scalingFactors());
            double expected = 1.0 / forward.scalingFactor(99);
            assertEquals(expected, backward.beta(99, 0), 1e-12 * expected);
            assertEquals(expected, backward.beta(99, 1), 1e-12 * expected);
        }

        @Test
        @DisplayName("with shared scaling c_t·Σ alpha·beta = 1 at every step")
        void forwardBackwardConsistency() {
            ForwardResult forward = ForwardEngine.forward(observations, model);
            BackwardResult backward = BackwardEngine.backward(observations, model, forward.scalingFactors());
            for (int t = 0; t < observations.length(); t++) {
                double sum = 0.0;
                for (int i = 0; i < model.numStates(); i++) {
                    sum += forward.alpha(t, i) * backward.beta(t, i);
                }
                assertEquals(1.0, forward.scalingFactor(t) * sum, 1e-9, "t=" + t);
            }
        }

        @Test
        @DisplayName("scaling factors of the wrong length → DIMENSION_MISMATCH")
        void scalingLengthMismatch() {
            HmmException e = assertThrows(HmmException.class,
                () -> BackwardEngine.backward(observations, model, new double[10]));
            assertEquals(HmmErrorKind.DIMENSION_MISMATCH, e.getKind());
        }
    }

    @Nested
    @DisplayName("ForwardBackward.run()")
    class Posteriors {

        @Test
        @DisplayName("γ rows are distributions that follow the block structure")
        void gammaFollowsBlocks() {
            ForwardBackwardResult result = ForwardBackward.run(observations, model);
            double[][] gamma = result.stateProbabilities();
            assertEquals(100, gamma.length);
            for (int t = 0; t < gamma.length; t++) {
                assertDistribution(gamma[t], 1e-9);
                int expectedState = (t / 10) % 2;
                assertTrue(gamma[t][expectedState] > 0.99, "t=" + t);
            }
        }

        @Test
        @DisplayName("current state is the last block's state")
        void currentState() {
            ForwardBackwardResult result = ForwardBackward.run(observations, model);
            assertEquals(1, result.mostLikelyCurrentState());
            assertDistribution(result.currentStateProbabilities(), 1e-9);
            assertEquals(ForwardEngine.forward(observations, model).logLikelihood(), result.logLikelihood(), 1e-12);
        }
    }
}
