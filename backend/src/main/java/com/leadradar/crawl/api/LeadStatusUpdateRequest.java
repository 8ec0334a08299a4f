package com.leadradar.crawl.api;

public record LeadStatusUpdateRequest(
    String status,
    String notes
) {
}
