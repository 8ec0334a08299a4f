package com.leadradar.crawl.parse;

import com.leadradar.crawl.model.ReviewSite;

import java.util.List;

/**
 * Selector lists and field strategies for one review site.
 *
 * @param cardSelectors tried in order; the first selector matching anything supplies the cards
 * @param fallbackDivClassKeywords when no selector matches, divs whose class mentions any of these are used
 * @param titleFallsBackToBody use the first 50 characters of the body when no title element is found
 */
public record SiteProfile(
    ReviewSite site,
    List<String> cardSelectors,
    List<String> fallbackDivClassKeywords,
    FieldExtractor<String> text,
    FieldExtractor<Double> rating,
    FieldExtractor<String> reviewer,
    FieldExtractor<String> company,
    FieldExtractor<String> title,
    boolean titleFallsBackToBody
) {
}
