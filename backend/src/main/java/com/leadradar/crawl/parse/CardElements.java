package com.leadradar.crawl.parse;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Element lookups inside a card. Only descendants are searched, never the card element itself.
 */
final class CardElements {

    private CardElements() {
    }

    static Optional<Element> first(Element card, Predicate<Element> match) {
        for (Element element : card.getAllElements()) {
            if (element != card && match.test(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    static Optional<Element> firstSelected(Element card, String cssQuery) {
        for (Element element : card.select(cssQuery)) {
            if (element != card) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    static Predicate<Element> tagIn(Set<String> tags) {
        return element -> tags.contains(element.normalName());
    }

    /**
     * Class attribute contains every keyword, case-insensitively.
     */
    static Predicate<Element> classHasAll(String... keywords) {
        return element -> {
            String classes = element.className().toLowerCase(Locale.ROOT);
            if (classes.isEmpty()) {
                return false;
            }
            for (String keyword : keywords) {
                if (!classes.contains(keyword)) {
                    return false;
                }
            }
            return true;
        };
    }

    static Predicate<Element> classHasAny(String... keywords) {
        return element -> {
            String classes = element.className().toLowerCase(Locale.ROOT);
            if (classes.isEmpty()) {
                return false;
            }
            for (String keyword : keywords) {
                if (classes.contains(keyword)) {
                    return true;
                }
            }
            return false;
        };
    }

    static Predicate<Element> attrEquals(String name, String value) {
        return element -> value.equals(element.attr(name));
    }

    static Predicate<Element> hasAttr(String name) {
        return element -> element.hasAttr(name);
    }

    static Optional<String> text(Element element) {
        String text = element.text().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
