package com.leadradar.crawl.model;

import java.util.List;

public record CrawlResult(
    List<LeadReview> leads,
    List<CrawlError> errors,
    int pagesFetched
) {
}
