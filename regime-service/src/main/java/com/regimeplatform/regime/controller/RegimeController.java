package com.regimeplatform.regime.controller;

import com.regimeplatform.hmm.regime.RegimeDetectionResult;
import com.regimeplatform.hmm.training.TrainingResult;
import com.regimeplatform.regime.dto.DecodeRequest;
import com.regimeplatform.regime.dto.DecodeResponse;
import com.regimeplatform.regime.dto.RegimeDetectionRequest;
import com.regimeplatform.regime.dto.TrainModelRequest;
import com.regimeplatform.regime.service.RegimeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/regime")
public class RegimeController {

    private final RegimeService regimeService;

    public RegimeController(RegimeService regimeService) {
        this.regimeService = regimeService;
    }

    @PostMapping("/detect")
    public Mono<ResponseEntity<RegimeDetectionResult>> detect(@RequestBody RegimeDetectionRequest request) {
        return regimeService.detect(request).map(ResponseEntity::ok);
    }

    @PostMapping("/train")
    public Mono<ResponseEntity<TrainingResult>> train(@RequestBody TrainModelRequest request) {
        return regimeService.train(request).map(ResponseEntity::ok);
    }

    @PostMapping("/decode")
    public Mono<ResponseEntity<DecodeResponse>> decode(@RequestBody DecodeRequest request) {
        return regimeService.decode(request).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
