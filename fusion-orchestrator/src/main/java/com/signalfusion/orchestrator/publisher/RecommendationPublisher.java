package com.signalfusion.orchestrator.publisher;

import com.signalfusion.orchestrator.service.FusionReport;

/**
 * Hands finalized reports to the document store.
 *
 * <p>Implementations must not block and must not signal failure back to the pipeline;
 * the orchestrator never reads its own writes.
 */
public interface RecommendationPublisher {

    void publish(FusionReport report);
}
