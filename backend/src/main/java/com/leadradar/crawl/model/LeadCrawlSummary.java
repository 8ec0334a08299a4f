package com.leadradar.crawl.model;

import java.util.List;

public record LeadCrawlSummary(
    List<LeadReview> leads,
    List<CrawlError> errors,
    int pagesFetched,
    int saved,
    int duplicates,
    int failed
) {
}
