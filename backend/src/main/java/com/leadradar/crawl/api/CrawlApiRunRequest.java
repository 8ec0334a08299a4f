package com.leadradar.crawl.api;

import java.util.List;

public record CrawlApiRunRequest(
    List<String> urls,
    Integer maxPages,
    Boolean save,
    Boolean forceScripted
) {
}
