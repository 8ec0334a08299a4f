package com.leadradar.crawl.browser;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.FetchMethod;
import com.leadradar.crawl.model.FetchOutcome;
import com.leadradar.crawl.model.ReviewSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a page in the worker's browser: tolerant navigation, bot-challenge wait, lazy-load scrolling.
 * The page is always closed on exit; the browser stays with the session.
 */
@Component
public class ScriptedPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(ScriptedPageFetcher.class);

    static final List<String> CHALLENGE_MARKERS = List.of("cf-browser-verification", "challenge-platform", "Just a moment");
    static final String CLEARED_MARKER = "cf-browser-verification";
    static final String GETAPP_REVIEW_SELECTOR = "div[class*=\"review\"], article[class*=\"review\"]";
    private static final int SETTLE_MS = 3000;
    private static final int REVIEW_SELECTOR_TIMEOUT_MS = 10000;

    private final CrawlerProperties.Browser settings;

    public ScriptedPageFetcher(CrawlerProperties properties) {
        this.settings = properties.getBrowser();
    }

    /**
     * @throws ScriptedFetchUnavailableException when the session cannot provide a browser
     */
    public FetchOutcome fetch(FetchSession session, String url) {
        BrowserPage page = null;
        try {
            page = session.openPage();
            navigate(page, url);
            awaitChallenge(page, url);
            pause(SETTLE_MS);

            ReviewSite site = ReviewSite.fromUrl(url);
            if (site == ReviewSite.GETAPP && !page.waitForSelector(GETAPP_REVIEW_SELECTOR, REVIEW_SELECTOR_TIMEOUT_MS)) {
                log.debug("No review elements appeared on {} before scrolling", url);
            }
            ScrollProfile.forSite(site).apply(page, this::pause);
            String html = page.content();
            log.debug("Scripted fetch of {} returned {} chars", url, html == null ? 0 : html.length());
            return FetchOutcome.ok(url, html, FetchMethod.SCRIPTED, 200);
        } catch (BrowserTimeoutException e) {
            return FetchOutcome.failed(url, FetchMethod.SCRIPTED, FetchErrorKind.TIMEOUT, 0, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.failed(url, FetchMethod.SCRIPTED, FetchErrorKind.INTERRUPTED, 0, "Interrupted while rendering");
        } catch (ScriptedFetchUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Scripted fetch of {} failed: {}", url, e.getMessage());
            return FetchOutcome.failed(url, FetchMethod.SCRIPTED, FetchErrorKind.IO_ERROR, 0, e.getMessage());
        } finally {
            closePage(page, url);
        }
    }

    public static boolean looksLikeChallenge(String content, int minBytes) {
        if (content == null || content.length() < minBytes) {
            return true;
        }
        for (String marker : CHALLENGE_MARKERS) {
            if (content.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private void navigate(BrowserPage page, String url) {
        int timeoutMs = settings.getNavigationTimeoutMs();
        try {
            page.navigate(url, NavigationWait.DOM_CONTENT_LOADED, timeoutMs);
            return;
        } catch (BrowserTimeoutException e) {
            log.debug("domcontentloaded timed out for {}, retrying with load", url);
        }
        try {
            page.navigate(url, NavigationWait.LOAD, timeoutMs);
            return;
        } catch (BrowserTimeoutException e) {
            log.debug("load timed out for {}, navigating without a wait condition", url);
        }
        page.navigate(url, NavigationWait.COMMIT, timeoutMs);
    }

    // Best effort: a challenge that never clears still yields whatever the page holds.
    private void awaitChallenge(BrowserPage page, String url) throws InterruptedException {
        if (!looksLikeChallenge(page.content(), settings.getChallengeMinBytes())) {
            return;
        }
        int polls = Math.max(0, settings.getChallengeMaxWaitMs() / settings.getChallengePollMs());
        log.info("Bot challenge suspected on {}, waiting up to {} ms", url, settings.getChallengeMaxWaitMs());
        for (int i = 1; i <= polls; i++) {
            pause(settings.getChallengePollMs());
            String current = page.content();
            if (current != null
                && current.length() > settings.getChallengeClearBytes()
                && !current.contains(CLEARED_MARKER)) {
                log.info("Challenge on {} cleared after {} polls", url, i);
                break;
            }
        }
        pause(SETTLE_MS);
    }

    private void pause(long millis) throws InterruptedException {
        long scaled = Math.round(millis * settings.getPacingScale());
        if (scaled > 0) {
            Thread.sleep(scaled);
        }
    }

    private void closePage(BrowserPage page, String url) {
        if (page == null) {
            return;
        }
        try {
            page.close();
        } catch (RuntimeException e) {
            log.debug("Closing page for {} failed: {}", url, e.getMessage());
        }
    }
}
