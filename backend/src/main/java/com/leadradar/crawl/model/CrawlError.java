package com.leadradar.crawl.model;

public record CrawlError(
    String url,
    String pageUrl,
    String reasonCode,
    String message
) {
    public String describe() {
        return "Error scraping " + url + ": " + message;
    }
}
