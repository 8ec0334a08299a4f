package com.leadradar.crawl.model;

/**
 * Fields pulled from one review card before classification.
 */
public record ReviewCandidate(
    String companyName,
    String reviewerName,
    String reviewTitle,
    String reviewText,
    Double rating,
    String sourceUrl
) {
}
