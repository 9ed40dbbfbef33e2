package com.signalfusion.common.lineage;

import java.util.List;
import java.util.Map;

/** Aggregate view over one request's lineage records. */
public record LineageSummary(
    int totalFields,
    Map<DataSource, Long> bySource,
    Map<DataFreshness, Long> byFreshness,
    Map<DataReliability, Long> byReliability,
    double cacheHitRate,
    double averageConfidence,
    double qualityScore,
    List<String> citations
) {}
