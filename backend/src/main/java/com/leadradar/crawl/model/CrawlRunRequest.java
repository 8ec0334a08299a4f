package com.leadradar.crawl.model;

import java.util.List;

public record CrawlRunRequest(
    List<String> urls,
    int maxPages,
    boolean save,
    boolean forceScripted
) {
}
