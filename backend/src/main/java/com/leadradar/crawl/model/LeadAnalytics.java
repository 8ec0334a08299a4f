package com.leadradar.crawl.model;

import java.util.Map;

public record LeadAnalytics(
    long total,
    Map<String, Long> byStatus,
    double averageScore,
    long highValueCount,
    Map<String, Long> byPain,
    Map<String, Long> bySource
) {
}
