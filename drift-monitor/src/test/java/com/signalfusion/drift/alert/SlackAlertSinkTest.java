package com.signalfusion.drift.alert;

import com.signalfusion.drift.model.DriftAlert;
import com.signalfusion.drift.model.DriftMetrics;
import com.signalfusion.drift.model.DriftSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SlackAlertSinkTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private final WebClient webClient = WebClient.builder()
        .exchangeFunction(req -> {
            requests.add(req);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        })
        .build();

    private static final DriftAlert ALERT = new DriftAlert(
        "alert-1", "a-1", "AAPL", DriftSeverity.HIGH, Instant.parse("2026-03-02T15:05:00Z"),
        "price 121.00 left the stop/target band [95.00, 120.00]", DriftSeverity.HIGH.recommendation(),
        new DriftMetrics(0.21, 0.0, 0.0, 0.0, 0.084));

    @Test
    @DisplayName("enabled sink posts to the webhook URL")
    void posts() {
        SlackAlertSink sink = new SlackAlertSink(webClient, "https://hooks.slack.test/T/B/X", true);

        sink.emit(ALERT);

        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("hooks.slack.test", requests.get(0).url().getHost());
    }

    @Test
    @DisplayName("disabled or URL-less sink only logs")
    void logsOnly() {
        new SlackAlertSink(webClient, "https://hooks.slack.test/T/B/X", false).emit(ALERT);
        new SlackAlertSink(webClient, "", true).emit(ALERT);
        new SlackAlertSink(webClient, null, true).emit(ALERT);

        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("message carries severity, symbol, reason, metrics and guidance")
    void message() {
        String text = new SlackAlertSink(webClient, "", false).buildMessage(ALERT);

        assertTrue(text.contains("Drift HIGH: AAPL"));
        assertTrue(text.contains("analysisId: a-1"));
        assertTrue(text.contains("left the stop/target band"));
        assertTrue(text.contains("price 21.0%"));
        assertTrue(text.contains(DriftSeverity.HIGH.recommendation()));
    }
}
