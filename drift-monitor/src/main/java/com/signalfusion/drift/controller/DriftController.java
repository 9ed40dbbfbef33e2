package com.signalfusion.drift.controller;

import com.signalfusion.drift.model.CycleReport;
import com.signalfusion.drift.model.DriftStatus;
import com.signalfusion.drift.monitor.DriftMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/drift")
public class DriftController {

    private static final Logger log = LoggerFactory.getLogger(DriftController.class);

    private final DriftMonitor driftMonitor;
    private final Clock clock;

    public DriftController(DriftMonitor driftMonitor, Clock clock) {
        this.driftMonitor = driftMonitor;
        this.clock = clock;
    }

    @PostMapping("/watch")
    public Mono<ResponseEntity<DriftStatus>> watch(@RequestBody WatchRequest request) {
        return Mono.fromCallable(() -> request.toAnalysis(clock))
            .map(driftMonitor::watch)
            .map(status -> ResponseEntity.status(HttpStatus.CREATED).body(status));
    }

    @GetMapping("/{analysisId}")
    public Mono<ResponseEntity<DriftStatus>> status(@PathVariable String analysisId) {
        return Mono.justOrEmpty(driftMonitor.status(analysisId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{analysisId}")
    public ResponseEntity<Void> unwatch(@PathVariable String analysisId) {
        return driftMonitor.unwatch(analysisId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    /** Runs one cycle immediately, independent of the background loop. */
    @PostMapping("/check")
    public Mono<ResponseEntity<CycleReport>> check() {
        return driftMonitor.runCheckCycle().map(ResponseEntity::ok);
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean changed = driftMonitor.start();
        return ResponseEntity.ok(loopState(changed));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean changed = driftMonitor.stop();
        return ResponseEntity.ok(loopState(changed));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("WATCH_REJECTED reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", e.getMessage()));
    }

    private Map<String, Object> loopState(boolean changed) {
        return Map.of("running", driftMonitor.isRunning(),
                      "changed", changed,
                      "active", driftMonitor.activeCount());
    }
}
