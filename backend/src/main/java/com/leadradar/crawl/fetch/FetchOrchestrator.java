package com.leadradar.crawl.fetch;

import com.leadradar.crawl.browser.FetchSession;
import com.leadradar.crawl.browser.ScriptedFetchUnavailableException;
import com.leadradar.crawl.browser.ScriptedPageFetcher;
import com.leadradar.crawl.http.ReviewHttpClient;
import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.FetchMethod;
import com.leadradar.crawl.model.FetchOutcome;
import com.leadradar.crawl.model.HttpFetchResult;
import com.leadradar.crawl.util.ReasonCodeClassifier;
import com.leadradar.crawl.util.SitePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chooses between plain HTTP and the worker's scripted browser for one page.
 * <ul>
 *   <li>Scripted-first for forced requests and hosts that need JavaScript; plain HTTP when scripting is unavailable.</li>
 *   <li>A 403 escalates to scripted once, or fails as {@code BLOCKED}.</li>
 *   <li>Any other HTTP or network failure escalates to scripted once as a last resort.</li>
 * </ul>
 */
@Service
public class FetchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final ReviewHttpClient httpClient;
    private final ScriptedPageFetcher scriptedPageFetcher;
    private final SitePolicy sitePolicy;

    public FetchOrchestrator(ReviewHttpClient httpClient, ScriptedPageFetcher scriptedPageFetcher, SitePolicy sitePolicy) {
        this.httpClient = httpClient;
        this.scriptedPageFetcher = scriptedPageFetcher;
        this.sitePolicy = sitePolicy;
    }

    public FetchOutcome fetch(String url, boolean forceScripted, FetchSession session) {
        boolean scriptedTried = false;
        if (forceScripted || sitePolicy.requiresScripting(url)) {
            if (session.isScriptingAvailable()) {
                try {
                    return scriptedPageFetcher.fetch(session, url);
                } catch (ScriptedFetchUnavailableException e) {
                    log.debug("Scripted fetch unavailable for {}, using plain HTTP: {}", url, e.getMessage());
                }
                scriptedTried = true;
            } else {
                log.debug("Scripted fetch unavailable for {}, using plain HTTP", url);
            }
        }

        HttpFetchResult result = httpClient.get(url);
        if (result.isSuccessful()) {
            return FetchOutcome.ok(url, result.body(), FetchMethod.HTTP, result.statusCode());
        }

        if (result.isForbidden()) {
            log.info("403 Forbidden for {}, escalating to scripted fetch", url);
            FetchOutcome escalated = scriptedTried ? null : tryScripted(url, session);
            if (escalated != null) {
                return escalated;
            }
            return FetchOutcome.failed(
                url,
                FetchMethod.HTTP,
                FetchErrorKind.BLOCKED,
                403,
                "403 Forbidden - site blocking access and scripted fetch not available"
            );
        }

        FetchOutcome failure = FetchOutcome.failed(
            url,
            FetchMethod.HTTP,
            ReasonCodeClassifier.toErrorKind(result),
            result.statusCode(),
            describeFailure(result)
        );
        if (failure.errorKind() == FetchErrorKind.INTERRUPTED || failure.errorKind() == FetchErrorKind.INVALID_URL) {
            return failure;
        }
        if (!scriptedTried) {
            log.debug("Plain fetch of {} failed ({}), trying scripted fetch", url, failure.message());
            FetchOutcome escalated = tryScripted(url, session);
            if (escalated != null) {
                return escalated;
            }
        }
        return failure;
    }

    private FetchOutcome tryScripted(String url, FetchSession session) {
        if (!session.isScriptingAvailable()) {
            return null;
        }
        try {
            return scriptedPageFetcher.fetch(session, url);
        } catch (ScriptedFetchUnavailableException e) {
            log.debug("Scripted escalation unavailable for {}: {}", url, e.getMessage());
            return null;
        }
    }

    private static String describeFailure(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return result.errorCode() + (result.errorMessage() == null ? "" : ": " + result.errorMessage());
        }
        return "HTTP " + result.statusCode();
    }
}
