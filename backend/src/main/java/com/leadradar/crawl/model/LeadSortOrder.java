package com.leadradar.crawl.model;

import java.util.Locale;

public enum LeadSortOrder {
    SCORE("lead_score", "lead_score DESC"),
    RATING("rating", "rating ASC NULLS LAST"),
    RECENT("scraped_at", "scraped_at DESC"),
    COMPANY("company_name", "company_name ASC");

    private final String key;
    private final String orderBy;

    LeadSortOrder(String key, String orderBy) {
        this.key = key;
        this.orderBy = orderBy;
    }

    public String key() {
        return key;
    }

    public String orderBy() {
        return orderBy;
    }

    public static LeadSortOrder fromKey(String key) {
        if (key == null || key.isBlank()) {
            return SCORE;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (LeadSortOrder order : values()) {
            if (order.key.equals(normalized) || order.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return order;
            }
        }
        return SCORE;
    }
}
