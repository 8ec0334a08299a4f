package com.leadradar.crawl.scoring;

import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.ReviewCandidate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pain classification, the negativity gate and the additive lead score. All methods are pure.
 */
public final class LeadScoring {
    public static final double MIN_BAD_RATING = 3.0;
    public static final double MAX_SCORE = 100.0;
    public static final double HIGH_VALUE_SCORE = 70.0;

    private static final Set<PainTag> HIGH_VALUE_TAGS = EnumSet.of(PainTag.COMPLEXITY, PainTag.BUGS, PainTag.PERFORMANCE);
    private static final Set<String> UNKNOWN_NAMES = Set.of("unknown", "n/a", "");

    private LeadScoring() {
    }

    public static List<PainTag> classifyPains(String text) {
        List<PainTag> tags = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tags;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (PainTag tag : PainTag.values()) {
            if (tag.matches(lower)) {
                tags.add(tag);
            }
        }
        return tags;
    }

    public static boolean isNegative(String text, Double rating) {
        if (rating != null && rating <= MIN_BAD_RATING) {
            return true;
        }
        return !classifyPains(text).isEmpty();
    }

    public static double score(LeadReview review) {
        return score(review.rating(), review.painTags(), review.reviewText(), review.companyName(), review.reviewerName());
    }

    public static double score(Double rating, List<PainTag> tags, String body, String company, String reviewer) {
        double total = 0;
        if (rating != null) {
            total += ratingPoints(rating);
        }
        int tagCount = tags == null ? 0 : tags.size();
        if (tagCount >= 3) {
            total += 40;
        } else if (tagCount == 2) {
            total += 30;
        } else if (tagCount == 1) {
            total += 20;
        }
        if (tags != null) {
            for (PainTag tag : tags) {
                if (HIGH_VALUE_TAGS.contains(tag)) {
                    total += 7;
                }
            }
        }
        int length = body == null ? 0 : body.length();
        if (length > 300) {
            total += 10;
        } else if (length > 150) {
            total += 5;
        }
        if (isKnownName(company)) {
            total += 5;
        }
        if (isKnownName(reviewer)) {
            total += 5;
        }
        return Math.min(total, MAX_SCORE);
    }

    /**
     * Applies the negativity gate to the full card text and, when it passes, builds the scored lead with the
     * body cut to {@link LeadReview#MAX_BODY_LENGTH}.
     */
    public static Optional<LeadReview> toLead(ReviewCandidate candidate, Instant scrapedAt) {
        String text = candidate.reviewText() == null ? "" : candidate.reviewText();
        if (!isNegative(text, candidate.rating())) {
            return Optional.empty();
        }
        List<PainTag> tags = classifyPains(text);
        String body = text.length() > LeadReview.MAX_BODY_LENGTH ? text.substring(0, LeadReview.MAX_BODY_LENGTH) : text;
        LeadReview unscored = new LeadReview(
            candidate.companyName(),
            candidate.reviewerName(),
            candidate.reviewTitle(),
            body,
            candidate.rating(),
            tags,
            candidate.sourceUrl(),
            scrapedAt,
            0
        );
        return Optional.of(withScore(unscored, score(unscored)));
    }

    private static LeadReview withScore(LeadReview review, double score) {
        return new LeadReview(
            review.companyName(),
            review.reviewerName(),
            review.reviewTitle(),
            review.reviewText(),
            review.rating(),
            review.painTags(),
            review.sourceUrl(),
            review.scrapedAt(),
            score
        );
    }

    public static boolean isKnownName(String name) {
        return name != null && !UNKNOWN_NAMES.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    private static double ratingPoints(double rating) {
        if (rating <= 1.0) {
            return 30;
        }
        if (rating <= 2.0) {
            return 25;
        }
        if (rating <= 2.5) {
            return 20;
        }
        if (rating <= 3.0) {
            return 15;
        }
        return 5;
    }
}
