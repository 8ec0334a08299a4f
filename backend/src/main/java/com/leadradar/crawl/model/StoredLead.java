package com.leadradar.crawl.model;

import java.time.Instant;
import java.util.List;

public record StoredLead(
    long id,
    String companyName,
    String reviewerName,
    String reviewTitle,
    String reviewText,
    Double rating,
    List<PainTag> painTags,
    String sourceUrl,
    Instant scrapedAt,
    double leadScore,
    LeadStatus status,
    String notes,
    Instant contactedAt,
    Instant convertedAt
) {
}
