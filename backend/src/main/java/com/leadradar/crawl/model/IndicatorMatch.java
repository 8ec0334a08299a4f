package com.leadradar.crawl.model;

public record IndicatorMatch(
    String indicator,
    String check,
    boolean found,
    String evidence
) {
    public static IndicatorMatch notFound(String indicator, String check) {
        return new IndicatorMatch(indicator, check, false, null);
    }
}
