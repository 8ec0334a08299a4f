package com.leadradar.crawl.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Signals that a company already runs a particular staffing platform.
 */
public record TargetIndicator(
    String name,
    @JsonAlias("subdomain_pattern") String subdomainPattern,
    List<String> keywords,
    @JsonAlias("link_patterns") List<String> linkPatterns
) {
    public TargetIndicator {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        linkPatterns = linkPatterns == null ? List.of() : List.copyOf(linkPatterns);
    }

    /**
     * Host suffix the subdomain pattern points at, e.g. {@code myavionte.com} for {@code *.myavionte.com}.
     */
    public String subdomainBase() {
        if (subdomainPattern == null) {
            return null;
        }
        String base = subdomainPattern.replace("*.", "").replace("*", "").trim();
        return base.isEmpty() ? null : base;
    }
}
