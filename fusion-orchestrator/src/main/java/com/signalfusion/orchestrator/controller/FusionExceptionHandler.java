package com.signalfusion.orchestrator.controller;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.common.exception.InsufficientQuorumException;
import com.signalfusion.common.exception.PriceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline failures to HTTP: quorum 422, other fusion failures 502, bad input 400.
 */
@RestControllerAdvice
public class FusionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FusionExceptionHandler.class);

    @ExceptionHandler(InsufficientQuorumException.class)
    public ResponseEntity<Map<String, Object>> quorum(InsufficientQuorumException e) {
        log.warn("REQUEST_FAILED status=422 symbol={} responded={}", e.getSymbol(), e.getResponded());
        Map<String, Object> body = body("insufficient_quorum", e.getMessage(), e.getSymbol());
        body.put("responded", e.getResponded());
        body.put("minimumRequired", e.getMinimumRequired());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(FusionException.class)
    public ResponseEntity<Map<String, Object>> fusion(FusionException e) {
        String error = e instanceof PriceUnavailableException ? "price_unavailable" : "fusion_failed";
        log.warn("REQUEST_FAILED status=502 symbol={} reason={}", e.getSymbol(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body(error, e.getMessage(), e.getSymbol()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("bad_request", e.getMessage(), null));
    }

    private static Map<String, Object> body(String error, String message, String symbol) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (symbol != null) body.put("symbol", symbol);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
