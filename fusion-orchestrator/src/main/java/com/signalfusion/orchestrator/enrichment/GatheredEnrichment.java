package com.signalfusion.orchestrator.enrichment;

import com.signalfusion.common.consensus.EnrichmentContext;

/**
 * Enrichment context for one symbol plus how it was obtained.
 *
 * @param searches  provider searches that returned a response
 * @param cacheHits how many of those were served from the response cache
 */
public record GatheredEnrichment(EnrichmentContext context, int searches, int cacheHits) {

    public static GatheredEnrichment none() {
        return new GatheredEnrichment(EnrichmentContext.empty(), 0, 0);
    }

    public boolean fullyCached() {
        return searches > 0 && cacheHits == searches;
    }
}
