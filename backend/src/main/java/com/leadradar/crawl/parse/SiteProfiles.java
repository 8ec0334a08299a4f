package com.leadradar.crawl.parse;

import com.leadradar.crawl.model.ReviewSite;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.leadradar.crawl.parse.CardElements.attrEquals;
import static com.leadradar.crawl.parse.CardElements.classHasAny;
import static com.leadradar.crawl.parse.CardElements.tagIn;
import static com.leadradar.crawl.parse.CardFieldExtractors.attributeValue;
import static com.leadradar.crawl.parse.CardFieldExtractors.classKeywordText;
import static com.leadradar.crawl.parse.CardFieldExtractors.companyClasses;
import static com.leadradar.crawl.parse.CardFieldExtractors.dataAttribute;
import static com.leadradar.crawl.parse.CardFieldExtractors.elementText;
import static com.leadradar.crawl.parse.CardFieldExtractors.itemPropText;
import static com.leadradar.crawl.parse.CardFieldExtractors.longEnough;
import static com.leadradar.crawl.parse.CardFieldExtractors.longestParagraph;
import static com.leadradar.crawl.parse.CardFieldExtractors.nameClasses;
import static com.leadradar.crawl.parse.CardFieldExtractors.naturalLanguageChild;
import static com.leadradar.crawl.parse.CardFieldExtractors.profileLinkName;
import static com.leadradar.crawl.parse.CardFieldExtractors.ratingClass;
import static com.leadradar.crawl.parse.CardFieldExtractors.ratingFrom;
import static com.leadradar.crawl.parse.CardFieldExtractors.ratingSelected;
import static com.leadradar.crawl.parse.CardFieldExtractors.reviewerTextPatterns;
import static com.leadradar.crawl.parse.CardFieldExtractors.selectedText;
import static com.leadradar.crawl.parse.FieldExtractor.firstSome;

public final class SiteProfiles {
    private static final Set<String> NAME_TAGS = Set.of("span", "div", "a");
    private static final Set<String> COMPANY_TAGS = Set.of("span", "div");

    private static final Map<ReviewSite, SiteProfile> PROFILES = new EnumMap<>(ReviewSite.class);

    static {
        PROFILES.put(ReviewSite.GETAPP, getApp());
        PROFILES.put(ReviewSite.G2, g2());
        PROFILES.put(ReviewSite.TRUSTRADIUS, trustRadius());
        PROFILES.put(ReviewSite.SOFTWARE_ADVICE, softwareAdvice());
        PROFILES.put(ReviewSite.GENERIC, generic());
    }

    private SiteProfiles() {
    }

    public static SiteProfile forUrl(String url) {
        return forSite(ReviewSite.fromUrl(url));
    }

    public static SiteProfile forSite(ReviewSite site) {
        return PROFILES.get(site);
    }

    /**
     * The site's own text strategy, then the longest prose-like paragraph, then the first prose child element.
     */
    private static FieldExtractor<String> reviewText(FieldExtractor<String> siteSpecific) {
        return firstSome(siteSpecific, longEnough(longestParagraph()), naturalLanguageChild());
    }

    private static FieldExtractor<String> reviewerName(FieldExtractor<String> siteSpecific) {
        return firstSome(siteSpecific, reviewerTextPatterns());
    }

    private static SiteProfile getApp() {
        return new SiteProfile(
            ReviewSite.GETAPP,
            List.of(
                "div[data-testid*='review']",
                ".review-item",
                ".review-card",
                "[class*='ReviewCard']",
                "[class*='review-card']",
                "div[class*='review']"
            ),
            List.of("review", "rating", "comment"),
            reviewText(
                longEnough(classKeywordText(Set.of("p", "div", "span"), "text", "content", "body", "description", "review"))
            ),
            ratingFrom(ratingClass()),
            firstSome(
                elementText(tagIn(Set.of("span", "div", "a", "p")).and(attrEquals("itemprop", "author"))),
                elementText(tagIn(NAME_TAGS).and(classHasAny("author"))),
                profileLinkName(),
                nameClasses(),
                reviewerTextPatterns(),
                attributeValue("data-reviewer", "data-author", "data-user")
            ),
            firstSome(
                companyClasses(Set.of("span", "div", "a")),
                elementText(tagIn(Set.of("span", "div", "a")).and(classHasAny("company")))
            ),
            elementText(tagIn(Set.of("h3", "h4", "h5", "div")).and(classHasAny("title"))),
            true
        );
    }

    private static SiteProfile g2() {
        return new SiteProfile(
            ReviewSite.G2,
            List.of(
                "div[data-testid*='review']",
                ".review-card",
                "[class*='ReviewCard']",
                "article[class*='review']"
            ),
            List.of(),
            reviewText(longEnough(classKeywordText(Set.of("p", "div"), "text", "content"))),
            ratingFrom(ratingClass()),
            reviewerName(firstSome(
                elementText(tagIn(NAME_TAGS).and(classHasAny("reviewer", "author"))),
                itemPropText("author"),
                dataAttribute("data-reviewer")
            )),
            elementText(tagIn(COMPANY_TAGS).and(classHasAny("company"))),
            elementText(tagIn(Set.of("h3", "h4")).and(classHasAny("title"))),
            true
        );
    }

    private static SiteProfile trustRadius() {
        return new SiteProfile(
            ReviewSite.TRUSTRADIUS,
            List.of(
                ".review-card",
                ".review-item",
                "article[class*='review']",
                "div[class*='ReviewCard']",
                "[data-review-id]"
            ),
            List.of(),
            reviewText(firstSome(
                longEnough(classKeywordText(Set.of("p", "div"), "text", "content", "body", "review")),
                longEnough(itemPropText("reviewBody"))
            )),
            firstSome(
                ratingFrom(attrEquals("itemprop", "ratingValue")),
                ratingFrom(ratingClass())
            ),
            reviewerName(firstSome(
                itemPropText("author"),
                elementText(tagIn(NAME_TAGS).and(classHasAny("reviewer", "author")))
            )),
            elementText(tagIn(COMPANY_TAGS).and(classHasAny("company"))),
            elementText(tagIn(Set.of("h3", "h4", "h5")).and(classHasAny("title"))),
            true
        );
    }

    private static SiteProfile softwareAdvice() {
        return new SiteProfile(
            ReviewSite.SOFTWARE_ADVICE,
            List.of(
                ".review-card",
                ".review-item",
                "article.review",
                "div[class*='review']",
                "[data-review]"
            ),
            List.of("review", "rating"),
            reviewText(longEnough(classKeywordText(Set.of("p", "div"), "text", "content", "body"))),
            ratingFrom(ratingClass()),
            reviewerName(elementText(tagIn(NAME_TAGS).and(classHasAny("reviewer", "author", "user")))),
            elementText(tagIn(COMPANY_TAGS).and(classHasAny("company"))),
            elementText(tagIn(Set.of("h3", "h4", "h5")).and(classHasAny("title"))),
            true
        );
    }

    private static SiteProfile generic() {
        return new SiteProfile(
            ReviewSite.GENERIC,
            List.of(
                ".review-card, .review-item, article.review, [data-review]",
                "[class*='review']",
                "[id*='review']",
                "article",
                ".review"
            ),
            List.of(),
            reviewText(longEnough(selectedText(
                ".review-body, .review-text, [itemprop='reviewBody'], p, [class*='text'], [class*='body']"
            ))),
            ratingSelected("[itemprop='ratingValue'], .star-rating, .rating, [class*='rating'], [class*='star']"),
            reviewerName(firstSome(
                itemPropText("author"),
                dataAttribute("data-reviewer", "data-author"),
                selectedText(".reviewer-name, .author-name, .user-name, [class*='reviewer-name'], [class*='author-name']")
            )),
            firstSome(
                selectedText(".reviewer-company, .company-name, [class*='company-name'], [class*='reviewer-company']"),
                selectedText("[class*='company'], [class*='organization']")
            ),
            selectedText(".review-title, h3, h4, .title, [class*='title']"),
            false
        );
    }
}
