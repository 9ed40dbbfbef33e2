package com.signalfusion.orchestrator.publisher;

import com.signalfusion.orchestrator.service.FusionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts each report to the document store (fire-and-forget). A failed write is logged and
 * dropped.
 */
public class RestRecommendationPublisher implements RecommendationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestRecommendationPublisher.class);

    private final WebClient documentStoreClient;

    public RestRecommendationPublisher(WebClient documentStoreClient) {
        this.documentStoreClient = documentStoreClient;
    }

    @Override
    public void publish(FusionReport report) {
        documentStoreClient.post()
            .uri("/api/v1/analyses")
            .header("X-Trace-Id", report.traceId())
            .bodyValue(report)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("REPORT_PUBLISHED traceId={} symbol={} action={} status={}",
                                report.traceId(), report.symbol(),
                                report.recommendation().action(), r.getStatusCode()),
                err -> log.warn("REPORT_PUBLISH_FAILED traceId={} symbol={} (non-critical)",
                                report.traceId(), report.symbol(), err)
            );
    }
}
