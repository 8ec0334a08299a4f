package com.leadradar.crawl.model;

public record LeadQuery(
    int limit,
    String pain,
    LeadStatus status,
    Double minScore,
    LeadSortOrder sortOrder
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 5000;

    public LeadQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        pain = pain == null || pain.isBlank() ? null : pain.trim();
        sortOrder = sortOrder == null ? LeadSortOrder.SCORE : sortOrder;
    }

    public static LeadQuery all() {
        return new LeadQuery(DEFAULT_LIMIT, null, null, null, LeadSortOrder.SCORE);
    }
}
