package com.leadradar.crawl.browser;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.FetchMethod;
import com.leadradar.crawl.model.FetchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptedPageFetcherTest {
    private CrawlerProperties properties;
    private ScriptedPageFetcher fetcher;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getBrowser().setPacingScale(0);
        fetcher = new ScriptedPageFetcher(properties);
    }

    private static FetchSession sessionWith(FakeBrowserPage page) {
        FakeBrowserSession browser = new FakeBrowserSession(page);
        return new FetchSession(() -> browser, "test-worker");
    }

    @Test
    void rendersGenericPageWithProportionalScroll() {
        FakeBrowserPage page = new FakeBrowserPage(FakeBrowserPage.renderedPage());

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://reviews.example.com/acme");

        assertTrue(outcome.isSuccessful());
        assertEquals(FetchMethod.SCRIPTED, outcome.method());
        assertThat(page.navigations).containsExactly(NavigationWait.DOM_CONTENT_LOADED);
        assertThat(page.scripts).hasSize(8);
        assertThat(page.scripts.get(4)).isEqualTo("window.scrollTo(0, document.body.scrollHeight * 4 / 4)");
        assertThat(page.scripts.subList(5, 8))
            .containsExactly(ScrollProfile.SCROLL_BOTTOM, ScrollProfile.SCROLL_TOP, ScrollProfile.SCROLL_BOTTOM);
        assertThat(page.waitedSelectors).isEmpty();
        assertTrue(page.closed);
    }

    @Test
    void getAppWaitsForReviewsAndTriesLoadMore() {
        FakeBrowserPage page = new FakeBrowserPage(FakeBrowserPage.renderedPage());

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://www.getapp.com/hr/a/acme/reviews/");

        assertTrue(outcome.isSuccessful());
        assertThat(page.waitedSelectors).containsExactly(ScriptedPageFetcher.GETAPP_REVIEW_SELECTOR);
        assertThat(page.clicked).hasSize(5);
        assertThat(page.scripts).hasSize(8);
    }

    @Test
    void fallsBackThroughNavigationWaits() {
        FakeBrowserPage page = new FakeBrowserPage(FakeBrowserPage.renderedPage());
        page.timingOut.add(NavigationWait.DOM_CONTENT_LOADED);
        page.timingOut.add(NavigationWait.LOAD);

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://www.g2.com/products/acme/reviews");

        assertTrue(outcome.isSuccessful());
        assertThat(page.navigations)
            .containsExactly(NavigationWait.DOM_CONTENT_LOADED, NavigationWait.LOAD, NavigationWait.COMMIT);
    }

    @Test
    void navigationTimeoutOnEveryWaitIsTimeoutOutcome() {
        FakeBrowserPage page = new FakeBrowserPage(FakeBrowserPage.renderedPage());
        page.timingOut.add(NavigationWait.DOM_CONTENT_LOADED);
        page.timingOut.add(NavigationWait.LOAD);
        page.timingOut.add(NavigationWait.COMMIT);

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://www.g2.com/products/acme/reviews");

        assertEquals(FetchErrorKind.TIMEOUT, outcome.errorKind());
        assertTrue(page.closed);
    }

    @Test
    void waitsForChallengeToClear() {
        String challenge = "<html><div id=\"cf-browser-verification\">Just a moment...</div></html>";
        FakeBrowserPage page = new FakeBrowserPage(challenge, challenge, FakeBrowserPage.renderedPage());

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://reviews.example.com/acme");

        assertTrue(outcome.isSuccessful());
        assertThat(outcome.html()).doesNotContain("cf-browser-verification");
        assertThat(page.contentCalls).isEqualTo(4);
    }

    @Test
    void challengeThatNeverClearsStillReturnsContent() {
        properties.getBrowser().setChallengeMaxWaitMs(6000);
        String challenge = "<html>Just a moment...</html>";
        FakeBrowserPage page = new FakeBrowserPage(challenge);

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://reviews.example.com/acme");

        assertTrue(outcome.isSuccessful());
        assertEquals(challenge, outcome.html());
        assertThat(page.contentCalls).isEqualTo(1 + 3 + 1);
    }

    @Test
    void detectsChallengePages() {
        assertTrue(ScriptedPageFetcher.looksLikeChallenge("tiny", 10000));
        assertTrue(ScriptedPageFetcher.looksLikeChallenge(null, 10000));
        assertTrue(ScriptedPageFetcher.looksLikeChallenge("x".repeat(20000) + "challenge-platform", 10000));
        assertThat(ScriptedPageFetcher.looksLikeChallenge("x".repeat(20000), 10000)).isFalse();
    }

    @Test
    void failingLoadMoreClickStillReturnsRenderedPage() {
        FakeBrowserPage page = new FakeBrowserPage(FakeBrowserPage.renderedPage());
        page.clickFailure = new IllegalStateException("Timeout 5000ms exceeded: element is not visible");

        FetchOutcome outcome = fetcher.fetch(sessionWith(page), "https://www.getapp.com/hr/a/acme/reviews/");

        assertTrue(outcome.isSuccessful());
        assertThat(page.clicked).hasSize(5);
        assertThat(page.scripts).hasSize(8);
        assertTrue(page.closed);
    }

    @Test
    void pageThatCannotOpenIsIoErrorOutcome() {
        FakeBrowserSession browser = new FakeBrowserSession();
        browser.newPageFailure = new IllegalStateException("Target page, context or browser has been closed");
        FetchSession session = new FetchSession(() -> browser, "test-worker");

        FetchOutcome outcome = fetcher.fetch(session, "https://www.g2.com/products/acme/reviews");

        assertThat(outcome.isSuccessful()).isFalse();
        assertEquals(FetchErrorKind.IO_ERROR, outcome.errorKind());
        assertThat(outcome.message()).contains("browser has been closed");
    }

    @Test
    void unavailableBrowserIsStillReportedToCaller() {
        FetchSession session = new FetchSession(() -> {
            throw new ScriptedFetchUnavailableException("Playwright browsers not installed");
        }, "test-worker");

        assertThatThrownBy(() -> fetcher.fetch(session, "https://www.g2.com/products/acme/reviews"))
            .isInstanceOf(ScriptedFetchUnavailableException.class)
            .hasMessageContaining("not installed");
    }
}
