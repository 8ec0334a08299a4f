package com.leadradar.crawl.parse;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One strategy for pulling a value out of a review card. Strategies compose with {@link #firstSome}.
 */
@FunctionalInterface
public interface FieldExtractor<T> {

    Optional<T> extract(Element card);

    default FieldExtractor<T> filter(Predicate<? super T> accept) {
        return card -> extract(card).filter(accept);
    }

    /**
     * Tries each strategy in order and returns the first present value. Later strategies are not consulted.
     */
    @SafeVarargs
    static <T> FieldExtractor<T> firstSome(FieldExtractor<T>... strategies) {
        List<FieldExtractor<T>> ordered = List.of(strategies);
        return card -> {
            for (FieldExtractor<T> strategy : ordered) {
                Optional<T> value = strategy.extract(card);
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        };
    }
}
