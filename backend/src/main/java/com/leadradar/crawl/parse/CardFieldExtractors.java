package com.leadradar.crawl.parse;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.leadradar.crawl.parse.CardElements.classHasAll;
import static com.leadradar.crawl.parse.CardElements.classHasAny;
import static com.leadradar.crawl.parse.CardElements.first;
import static com.leadradar.crawl.parse.CardElements.tagIn;

/**
 * Reusable extraction strategies shared by the site profiles.
 */
public final class CardFieldExtractors {
    public static final int MIN_TEXT_LENGTH = 20;

    static final Pattern RATING_LINE = Pattern.compile("^\\d+\\.?\\d*\\s*\\(?\\d*\\)?");
    static final Pattern LABELLED_SCORE_LINE = Pattern.compile("^[A-Z][a-z]+\\s+\\d+\\.?\\d*");
    static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+\\.?\\d*)");
    static final Pattern PROFILE_HREF = Pattern.compile("(user|profile|reviewer|author)", Pattern.CASE_INSENSITIVE);
    static final Pattern BY_PREFIX = Pattern.compile("^(reviewed|written|posted)\\s+by\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    static final List<Pattern> REVIEWER_TEXT_PATTERNS = List.of(
        Pattern.compile("(?:reviewed|written|posted)\\s+by\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bby\\s*:?\\s*([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("([A-Z][a-z]+\\s+[A-Z][a-z]+)\\s+reviewed", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> FUNCTION_WORDS = List.of(
        "the", "and", "is", "was", "are", "have", "has", "this", "that", "with", "for", "from"
    );
    private static final Set<String> LINK_STOP_WORDS = Set.of("view", "more", "read", "see", "profile", "review", "author");
    private static final Set<String> PLACEHOLDER_NAMES = Set.of("unknown", "anonymous", "n/a");
    private static final Set<String> TEXT_TAGS = Set.of("p", "div", "span");

    private CardFieldExtractors() {
    }

    /**
     * Text of the first descendant with one of {@code tags} whose class mentions any keyword.
     */
    public static FieldExtractor<String> classKeywordText(Set<String> tags, String... keywords) {
        return card -> first(card, tagIn(tags).and(classHasAny(keywords))).flatMap(CardElements::text);
    }

    public static FieldExtractor<String> itemPropText(String itemProp) {
        return card -> first(card, CardElements.attrEquals("itemprop", itemProp)).flatMap(CardElements::text);
    }

    public static FieldExtractor<String> selectedText(String cssQuery) {
        return card -> CardElements.firstSelected(card, cssQuery).flatMap(CardElements::text);
    }

    /**
     * Longest line of the card's text that is over 30 characters and does not look like a rating or score line.
     */
    public static FieldExtractor<String> longestParagraph() {
        return card -> {
            String best = null;
            for (String line : card.wholeText().split("\n")) {
                String paragraph = line.trim().replaceAll("\\s+", " ");
                if (paragraph.length() <= 30 || looksLikeRatingLine(paragraph)) {
                    continue;
                }
                if (best == null || paragraph.length() > best.length()) {
                    best = paragraph;
                }
            }
            return Optional.ofNullable(best);
        };
    }

    /**
     * First p/div/span of plausible review length that reads like prose.
     */
    public static FieldExtractor<String> naturalLanguageChild() {
        return card -> {
            for (Element element : card.getAllElements()) {
                if (element == card || !TEXT_TAGS.contains(element.normalName())) {
                    continue;
                }
                String text = element.text().trim();
                if (looksLikeRatingLine(text) || text.length() <= 50 || text.length() >= 2000) {
                    continue;
                }
                String lower = text.toLowerCase(Locale.ROOT);
                for (String word : FUNCTION_WORDS) {
                    if (lower.contains(word)) {
                        return Optional.of(text);
                    }
                }
            }
            return Optional.empty();
        };
    }

    public static FieldExtractor<String> longEnough(FieldExtractor<String> strategy) {
        return strategy.filter(text -> text.length() >= MIN_TEXT_LENGTH);
    }

    static boolean looksLikeRatingLine(String text) {
        return RATING_LINE.matcher(text).lookingAt() || LABELLED_SCORE_LINE.matcher(text).lookingAt();
    }

    /**
     * First number found in the first element matching {@code match}. The value is read from the
     * {@code content} or {@code data-rating} attribute before the element text.
     */
    public static FieldExtractor<Double> ratingFrom(Predicate<Element> match) {
        return card -> first(card, match).flatMap(element -> parseRating(ratingSource(element)));
    }

    public static FieldExtractor<Double> ratingSelected(String cssQuery) {
        return card -> CardElements.firstSelected(card, cssQuery).flatMap(element -> parseRating(ratingSource(element)));
    }

    public static Predicate<Element> ratingClass() {
        return tagIn(Set.of("span", "div")).and(classHasAny("rating", "star"));
    }

    public static Optional<Double> parseRating(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = FIRST_NUMBER.matcher(value);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String ratingSource(Element element) {
        if (!element.attr("content").isBlank()) {
            return element.attr("content");
        }
        if (!element.attr("data-rating").isBlank()) {
            return element.attr("data-rating");
        }
        return element.text();
    }

    public static FieldExtractor<String> elementText(Predicate<Element> match) {
        return card -> first(card, match).flatMap(CardElements::text);
    }

    /**
     * Text of the first element carrying one of the attributes, else the attribute value itself.
     */
    public static FieldExtractor<String> dataAttribute(String... attributes) {
        return card -> {
            for (String attribute : attributes) {
                Optional<Element> element = first(card, CardElements.hasAttr(attribute));
                if (element.isPresent()) {
                    Optional<String> text = CardElements.text(element.get());
                    if (text.isPresent()) {
                        return text;
                    }
                    String value = element.get().attr(attribute).trim();
                    return value.isEmpty() ? Optional.empty() : Optional.of(value);
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Value of the first of {@code attributes} found on any descendant, ahead of its text.
     */
    public static FieldExtractor<String> attributeValue(String... attributes) {
        return card -> {
            for (String attribute : attributes) {
                Optional<Element> element = first(card, CardElements.hasAttr(attribute));
                if (element.isPresent()) {
                    String value = element.get().attr(attribute).trim();
                    if (!value.isEmpty()) {
                        return Optional.of(value);
                    }
                    return CardElements.text(element.get());
                }
            }
            return Optional.empty();
        };
    }

    public static FieldExtractor<String> profileLinkName() {
        return card -> {
            for (Element link : card.select("a[href]")) {
                if (link == card || !PROFILE_HREF.matcher(link.attr("href")).find()) {
                    continue;
                }
                String text = link.text().trim();
                if (text.length() < 2 || text.length() > 50) {
                    continue;
                }
                if (!text.matches(".*[a-zA-Z].*") || text.matches("\\d+")) {
                    continue;
                }
                if (!LINK_STOP_WORDS.contains(text.toLowerCase(Locale.ROOT))) {
                    return Optional.of(text);
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Name-like classes tried in order; "Reviewed by" style prefixes are stripped and placeholders rejected.
     */
    public static FieldExtractor<String> nameClasses() {
        Predicate<Element> tags = tagIn(Set.of("span", "div", "a", "strong", "b", "p"));
        List<Predicate<Element>> classes = List.of(
            classHasAll("reviewer", "name"),
            classHasAll("user", "name"),
            classHasAll("author", "name"),
            classHasAll("profile", "name"),
            classHasAll("writer"),
            classHasAll("posted", "by")
        );
        return card -> {
            for (Predicate<Element> match : classes) {
                Optional<Element> element = first(card, tags.and(match));
                if (element.isEmpty()) {
                    continue;
                }
                String name = BY_PREFIX.matcher(element.get().text().trim()).replaceFirst("");
                if (name.length() >= 2 && name.length() <= 100 && !PLACEHOLDER_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
                    return Optional.of(name);
                }
            }
            return Optional.empty();
        };
    }

    public static FieldExtractor<String> reviewerTextPatterns() {
        return card -> {
            String text = card.text();
            for (Pattern pattern : REVIEWER_TEXT_PATTERNS) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    String name = matcher.group(1).trim();
                    if (name.length() >= 2 && name.length() <= 100) {
                        return Optional.of(name);
                    }
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Class-keyword candidates tried in order; the first whose text is between 3 and 199 characters wins.
     */
    public static FieldExtractor<String> companyClasses(Set<String> tags) {
        List<Predicate<Element>> classes = List.of(
            classHasAll("company", "name"),
            classHasAll("organization"),
            classHasAll("business", "name"),
            classHasAll("firm")
        );
        return card -> {
            for (Predicate<Element> match : classes) {
                Optional<String> text = first(card, tagIn(tags).and(match)).flatMap(CardElements::text);
                if (text.isPresent() && text.get().length() > 2 && text.get().length() < 200) {
                    return text;
                }
            }
            return Optional.empty();
        };
    }
}
