package com.leadradar.crawl.parse;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.ReviewCandidate;
import com.leadradar.crawl.scoring.LeadScoring;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class ReviewPageParser {
    private static final Logger log = LoggerFactory.getLogger(ReviewPageParser.class);

    public static final int TITLE_FALLBACK_LENGTH = 50;

    private final CrawlerProperties properties;

    public ReviewPageParser(CrawlerProperties properties) {
        this.properties = properties;
    }

    /**
     * Negative reviews found on the page, scored and in card order. An unrecognised layout yields an empty list.
     */
    public List<LeadReview> parse(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        SiteProfile profile = SiteProfiles.forUrl(sourceUrl);
        Document document = Jsoup.parse(html, sourceUrl == null ? "" : sourceUrl);
        List<Element> cards = selectCards(document, profile);
        if (cards.isEmpty()) {
            log.info("No review cards found for {} ({} layout); page may be rendered by JavaScript", sourceUrl, profile.site());
            return List.of();
        }

        Instant scrapedAt = Instant.now();
        Map<String, LeadReview> leads = new LinkedHashMap<>();
        for (ReviewCandidate candidate : extractCandidates(cards, profile, sourceUrl)) {
            Optional<LeadReview> lead = LeadScoring.toLead(candidate, scrapedAt);
            lead.ifPresent(review -> leads.putIfAbsent(review.identityHash(), review));
        }
        log.debug("{} cards on {} produced {} negative reviews", cards.size(), sourceUrl, leads.size());
        return new ArrayList<>(leads.values());
    }

    List<Element> selectCards(Document document, SiteProfile profile) {
        List<Element> cards = List.of();
        for (String selector : profile.cardSelectors()) {
            Elements found = document.select(selector);
            if (!found.isEmpty()) {
                log.debug("{}: selector '{}' found {} elements", profile.site(), selector, found.size());
                cards = found;
                break;
            }
        }
        if (cards.isEmpty() && !profile.fallbackDivClassKeywords().isEmpty()) {
            String[] keywords = profile.fallbackDivClassKeywords().toArray(new String[0]);
            cards = document.getAllElements().stream()
                .filter(CardElements.tagIn(Set.of("div")).and(CardElements.classHasAny(keywords)))
                .toList();
        }
        int cap = properties.getMaxCardsPerPage();
        return cards.size() > cap ? cards.subList(0, cap) : cards;
    }

    private List<ReviewCandidate> extractCandidates(List<Element> cards, SiteProfile profile, String sourceUrl) {
        List<ReviewCandidate> candidates = new ArrayList<>();
        for (Element card : cards) {
            Optional<String> text = profile.text().extract(card)
                .filter(value -> value.length() >= CardFieldExtractors.MIN_TEXT_LENGTH);
            if (text.isEmpty()) {
                continue;
            }
            String body = text.get();
            String title = profile.title().extract(card).orElse("");
            if (title.isEmpty() && profile.titleFallsBackToBody()) {
                title = CardElements.truncate(body, TITLE_FALLBACK_LENGTH);
            }
            candidates.add(new ReviewCandidate(
                profile.company().extract(card).orElse(LeadReview.UNKNOWN),
                profile.reviewer().extract(card).orElse(LeadReview.UNKNOWN),
                CardElements.truncate(title, LeadReview.MAX_TITLE_LENGTH),
                body,
                profile.rating().extract(card).orElse(null),
                sourceUrl
            ));
        }
        return candidates;
    }
}
