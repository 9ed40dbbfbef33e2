package com.signalfusion.orchestrator.controller;

import com.signalfusion.orchestrator.service.FusionOrchestrator;
import com.signalfusion.orchestrator.service.FusionReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/fusion")
public class OrchestratorController {

    private final FusionOrchestrator fusionOrchestrator;

    public OrchestratorController(FusionOrchestrator fusionOrchestrator) {
        this.fusionOrchestrator = fusionOrchestrator;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<List<FusionReport>>> run(@RequestBody RunRequest request) {
        return Mono.fromCallable(request::toTask)
            .flatMap(fusionOrchestrator::run)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
