package com.leadradar.crawl.model;

import com.leadradar.crawl.util.Hashing;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record LeadReview(
    String companyName,
    String reviewerName,
    String reviewTitle,
    String reviewText,
    Double rating,
    List<PainTag> painTags,
    String sourceUrl,
    Instant scrapedAt,
    double leadScore
) {
    public static final String UNKNOWN = "Unknown";
    public static final int MAX_TITLE_LENGTH = 100;
    public static final int MAX_BODY_LENGTH = 500;

    public LeadReview {
        companyName = companyName == null || companyName.isBlank() ? UNKNOWN : companyName;
        reviewerName = reviewerName == null || reviewerName.isBlank() ? UNKNOWN : reviewerName;
        reviewTitle = reviewTitle == null ? "" : reviewTitle;
        reviewText = reviewText == null ? "" : reviewText;
        painTags = painTags == null ? List.of() : List.copyOf(painTags);
    }

    public String identityHash() {
        return Hashing.identityHash(reviewerName, companyName, reviewText, sourceUrl);
    }

    public String painTagsJoined() {
        return painTags.stream().map(PainTag::key).collect(Collectors.joining(","));
    }
}
