package com.regimeplatform.regime.service;

import com.regimeplatform.hmm.exception.HmmException;
import com.regimeplatform.hmm.inference.ForwardBackward;
import com.regimeplatform.hmm.inference.ForwardBackwardResult;
import com.regimeplatform.hmm.inference.ViterbiDecoder;
import com.regimeplatform.hmm.inference.ViterbiResult;
import com.regimeplatform.hmm.model.HMMModel;
import com.regimeplatform.hmm.model.ObservationSequence;
import com.regimeplatform.hmm.regime.RegimeDetectionOptions;
import com.regimeplatform.hmm.regime.RegimeDetectionResult;
import com.regimeplatform.hmm.regime.RegimeDetector;
import com.regimeplatform.hmm.training.BaumWelchTrainer;
import com.regimeplatform.hmm.training.TrainingOptions;
import com.regimeplatform.hmm.training.TrainingResult;
import com.regimeplatform.hmm.validation.ModelValidator;
import com.regimeplatform.regime.config.TrainingDefaults;
import com.regimeplatform.regime.dto.DecodeRequest;
import com.regimeplatform.regime.dto.DecodeResponse;
import com.regimeplatform.regime.dto.RegimeDetectionRequest;
import com.regimeplatform.regime.dto.TrainModelRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.BooleanSupplier;

/**
 * Runs HMM work off the event loop. Every request gets its own EM run on
 * {@code boundedElastic}; runs past the configured timeout are cancelled between iterations
 * and come back with status CANCELLED.
 */
@Service
public class RegimeService {

    private static final Logger log = LoggerFactory.getLogger(RegimeService.class);

    private final TrainingDefaults defaults;

    public RegimeService(TrainingDefaults defaults) {
        this.defaults = defaults;
    }

    public Mono<RegimeDetectionResult> detect(RegimeDetectionRequest request) {
        return Mono.fromCallable(() -> {
                RegimeDetectionOptions options = request.toOptions(defaults);
                log.info("Regime detection requested symbol={} prices={} states={}",
                    request.symbol(), request.prices() == null ? 0 : request.prices().length, options.numStates());
                return RegimeDetector.detect(request.prices(), options, deadline());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(result -> log.info("Regime detection complete symbol={} regime={} status={} iterations={} confidence={}",
                request.symbol(), result.currentRegime(), result.trainingStatus(), result.iterations(), result.confidence()))
            .doOnError(e -> log.error("Regime detection failed symbol={}", request.symbol(), e));
    }

    public Mono<TrainingResult> train(TrainModelRequest request) {
        return Mono.fromCallable(() -> {
                TrainingOptions options = request.toOptions(defaults);
                ObservationSequence observations = ObservationSequence.of(request.observations());
                log.info("Training requested T={} D={} N={} maxIterations={}",
                    observations.length(), observations.dimension(), options.numStates(), options.maxIterations());
                return BaumWelchTrainer.train(observations, options, deadline());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(result -> log.info("Training complete status={} iterations={} logLikelihood={}",
                result.status(), result.iterations(), result.finalLogLikelihood()))
            .doOnError(e -> log.error("Training failed", e));
    }

    public Mono<DecodeResponse> decode(DecodeRequest request) {
        return Mono.fromCallable(() -> {
                HMMModel model = request.model();
                if (model == null) {
                    throw HmmException.invalidParameter("model is required");
                }
                ObservationSequence observations = ObservationSequence.of(request.observations());
                ModelValidator.requireSameFeatureCount(observations, model);

                ViterbiResult viterbi = ViterbiDecoder.decode(observations, model);
                ForwardBackwardResult posteriors = ForwardBackward.run(observations, model);
                return new DecodeResponse(
                    viterbi.path(),
                    viterbi.logProbability(),
                    posteriors.stateProbabilities(),
                    posteriors.mostLikelyCurrentState(),
                    posteriors.logLikelihood());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(response -> log.info("Decode complete T={} currentState={}",
                response.path().length, response.currentState()))
            .doOnError(e -> log.error("Decode failed", e));
    }

    private BooleanSupplier deadline() {
        long deadlineNanos = System.nanoTime() + defaults.trainingTimeout().toNanos();
        return () -> System.nanoTime() - deadlineNanos >= 0;
    }
}
