package com.leadradar.crawl.model;

/**
 * Result of resolving one page URL to HTML. Exactly one of {@code html} or {@code errorKind} is set.
 */
public record FetchOutcome(
    String url,
    String html,
    FetchMethod method,
    FetchErrorKind errorKind,
    int statusCode,
    String message
) {
    public static FetchOutcome ok(String url, String html, FetchMethod method, int statusCode) {
        return new FetchOutcome(url, html, method, null, statusCode, null);
    }

    public static FetchOutcome failed(String url, FetchMethod method, FetchErrorKind kind, int statusCode, String message) {
        return new FetchOutcome(url, null, method, kind, statusCode, message);
    }

    public boolean isSuccessful() {
        return errorKind == null && html != null;
    }
}
