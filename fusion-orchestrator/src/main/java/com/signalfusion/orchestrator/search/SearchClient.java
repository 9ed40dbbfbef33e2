package com.signalfusion.orchestrator.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalfusion.orchestrator.cache.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Search/news provider client with read-through caching.
 *
 * <p>The cache fails open: an exception from the cache is counted, logged as
 * {@code DEGRADED_MODE}, and the call goes to the provider uncached. A provider failure
 * completes empty.
 */
public class SearchClient {

    private static final Logger log = LoggerFactory.getLogger(SearchClient.class);

    private final WebClient searchWebClient;
    private final ResponseCache cache;

    public SearchClient(WebClient searchWebClient, ResponseCache cache) {
        this.searchWebClient = searchWebClient;
        this.cache = cache;
    }

    /**
     * @param queryType  cache scope and routing label: {@code news}, {@code social} or {@code macro}
     * @param depth      provider search depth, {@code basic} or {@code advanced}
     */
    public Mono<SearchResponse> search(String queryType, String symbol, String query, String depth, int maxResults) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("search_depth", depth);
        params.put("max_results", maxResults);
        String key = ResponseCache.key(queryType, symbol, params);

        Optional<JsonNode> cached = readCache(key);
        if (cached.isPresent()) {
            log.info("SEARCH_CACHE_HIT queryType={} symbol={}", queryType, symbol);
            return Mono.just(new SearchResponse(cached.get(), true));
        }

        return searchWebClient.post()
            .uri("/search")
            .bodyValue(params)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnNext(body -> writeCache(key, body, symbol, queryType))
            .map(body -> new SearchResponse(body, false))
            .onErrorResume(e -> {
                log.warn("SEARCH_FAILED queryType={} symbol={} reason={}", queryType, symbol, e.getMessage());
                return Mono.empty();
            });
    }

    private Optional<JsonNode> readCache(String key) {
        try {
            return cache.get(key)
                .filter(JsonNode.class::isInstance)
                .map(JsonNode.class::cast);
        } catch (RuntimeException e) {
            cache.recordError();
            log.warn("DEGRADED_MODE component=cache op=get key={} reason={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, JsonNode body, String symbol, String queryType) {
        try {
            cache.set(key, body, symbol, queryType);
        } catch (RuntimeException e) {
            cache.recordError();
            log.warn("DEGRADED_MODE component=cache op=set key={} reason={}", key, e.getMessage());
        }
    }
}
