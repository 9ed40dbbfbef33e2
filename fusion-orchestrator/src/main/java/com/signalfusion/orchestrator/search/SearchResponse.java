package com.signalfusion.orchestrator.search;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Search provider response plus whether it was served from the response cache.
 *
 * <p>Expected body shape: {@code {"results": [{"title", "url", "content", "score"}], "sentiment_score"?}}.
 */
public record SearchResponse(JsonNode body, boolean cacheHit) {

    public JsonNode results() {
        return body.path("results");
    }

    /** Distinct result URLs in rank order. */
    public List<String> citations() {
        List<String> urls = new ArrayList<>();
        for (JsonNode r : results()) {
            String url = r.path("url").asText("");
            if (!url.isBlank() && !urls.contains(url)) urls.add(url);
        }
        return urls;
    }

    /** Title and content of every result, joined for keyword scoring. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (JsonNode r : results()) {
            sb.append(r.path("title").asText("")).append(' ')
              .append(r.path("content").asText("")).append('\n');
        }
        return sb.toString();
    }
}
