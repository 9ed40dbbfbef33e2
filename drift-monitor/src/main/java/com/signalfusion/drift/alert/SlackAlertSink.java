package com.signalfusion.drift.alert;

import com.signalfusion.drift.model.DriftAlert;
import com.signalfusion.drift.model.DriftMetrics;
import com.signalfusion.drift.model.DriftSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Posts drift alerts to a Slack incoming webhook. When Slack is disabled or no webhook URL is
 * configured the alert is written as a structured log line instead.
 */
public class SlackAlertSink implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertSink.class);

    private final WebClient webClient;
    private final String webhookUrl;
    private final boolean enabled;

    public SlackAlertSink(WebClient webClient, String webhookUrl, boolean enabled) {
        this.webClient  = webClient;
        this.webhookUrl = webhookUrl != null ? webhookUrl : "";
        this.enabled    = enabled;
    }

    public boolean isActive() {
        return enabled && !webhookUrl.isBlank();
    }

    @Override
    public void emit(DriftAlert alert) {
        log.info("DRIFT_ALERT analysisId={} symbol={} severity={} composite={} reason={}",
                 alert.analysisId(), alert.symbol(), alert.severity(),
                 String.format("%.3f", alert.metrics().composite()), alert.reason());
        if (!isActive()) {
            return;
        }

        webClient.post()
            .uri(webhookUrl)
            .bodyValue(Map.of("text", buildMessage(alert)))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("DRIFT_ALERT_SENT alertId={} status={}", alert.alertId(), r.getStatusCode()),
                err -> log.error("DRIFT_ALERT_SEND_FAILED alertId={}", alert.alertId(), err)
            );
    }

    String buildMessage(DriftAlert alert) {
        DriftMetrics m = alert.metrics();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*%s Drift %s: %s* | `analysisId: %s`%n",
                                severityEmoji(alert.severity()), alert.severity(), alert.symbol(),
                                alert.analysisId()));
        sb.append("---\n");
        sb.append(String.format("_%s_%n", alert.reason()));
        sb.append(String.format("price %.1f%% | volume %.1f%% | volatility %.1f%% | sentiment %.1f%% | composite %.3f%n",
                                m.price() * 100, m.volume() * 100, m.volatility() * 100,
                                m.sentiment() * 100, m.composite()));
        sb.append(String.format("*%s*", alert.recommendation()));
        return sb.toString();
    }

    private static String severityEmoji(DriftSeverity severity) {
        return switch (severity) {
            case HIGH   -> "🔴";
            case MEDIUM -> "🟡";
            case LOW    -> "⚪";
        };
    }
}
