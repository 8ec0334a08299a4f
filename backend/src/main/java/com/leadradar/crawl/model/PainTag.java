package com.leadradar.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in complaint categories. Declaration order is the keyword-table order, which is also the order
 * tags are reported in.
 */
public enum PainTag {
    COMPLEXITY(List.of("complex", "complicated", "confusing", "hard to use", "difficult")),
    BUGS(List.of("buggy", "crash", "error", "issue", "downtime", "glitch")),
    SUPPORT(List.of("support", "service", "helpdesk", "customer service", "response time")),
    INTEGRATION(List.of("integration", "integrate", "api", "sync", "doesn't connect")),
    COST(List.of("expensive", "too costly", "price", "pricing", "overpriced")),
    PERFORMANCE(List.of("slow", "laggy", "performance", "takes forever"));

    private final List<String> keywords;

    PainTag(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean matches(String lowerText) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<PainTag> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PainTag tag : values()) {
            if (tag.key().equals(normalized)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
