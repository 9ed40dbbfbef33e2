package com.signalfusion.orchestrator.ai;

import java.util.List;
import java.util.Locale;

/**
 * Reasoning depth a task needs, inferred from keywords in its type and hint.
 * COMPLEX keywords win over MODERATE, MODERATE over SIMPLE; unmatched tasks are MODERATE.
 */
public enum TaskComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    private static final List<String> SIMPLE_KEYWORDS = List.of(
        "summary", "extract", "format", "parse", "news", "headline", "event", "list", "fetch");

    private static final List<String> MODERATE_KEYWORDS = List.of(
        "sentiment", "classify", "categorize", "compare", "social", "retail", "pulse", "trending", "pattern");

    private static final List<String> COMPLEX_KEYWORDS = List.of(
        "analysis", "strategy", "reasoning", "synthesis", "fundamental", "technical", "risk",
        "recommendation", "decision", "forecast", "valuation", "portfolio", "enrichment", "blend");

    public static TaskComplexity infer(String taskType, String hint) {
        String text = ((taskType == null ? "" : taskType) + " " + (hint == null ? "" : hint))
            .toLowerCase(Locale.ROOT);
        if (containsAny(text, COMPLEX_KEYWORDS))  return COMPLEX;
        if (containsAny(text, MODERATE_KEYWORDS)) return MODERATE;
        if (containsAny(text, SIMPLE_KEYWORDS))   return SIMPLE;
        return MODERATE;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
