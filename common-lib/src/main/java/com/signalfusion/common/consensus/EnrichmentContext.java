package com.signalfusion.common.consensus;

import java.util.List;

/**
 * Supplementary context for the second-pass blend. Each part is optional (null when missing).
 *
 * <ul>
 *   <li>news: {@code newsSentiment} in [-1, 1] scaled by {@code newsEnrichmentScore} in [0, 1]</li>
 *   <li>retail: social {@code retailSentiment} in [-1, 1]; {@code retailDivergence} in [0, 1]
 *                measures how far retail chatter diverges from institutional views</li>
 *   <li>macro: {@code macroContextScore} in [-1, 1]</li>
 * </ul>
 */
public record EnrichmentContext(
    Double newsSentiment,
    Double newsEnrichmentScore,
    Double newsConfidence,
    Double retailSentiment,
    Double retailDivergence,
    Double retailConfidence,
    Double macroContextScore,
    Double macroConfidence,
    List<String> citations
) {
    public EnrichmentContext {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static EnrichmentContext empty() {
        return new EnrichmentContext(null, null, null, null, null, null, null, null, List.of());
    }

    public boolean hasNews()   { return newsSentiment != null; }
    public boolean hasRetail() { return retailSentiment != null; }
    public boolean hasMacro()  { return macroContextScore != null; }

    public boolean isEmpty() {
        return !hasNews() && !hasRetail() && !hasMacro();
    }
}
