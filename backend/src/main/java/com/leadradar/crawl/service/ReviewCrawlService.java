package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.browser.FetchSession;
import com.leadradar.crawl.fetch.FetchOrchestrator;
import com.leadradar.crawl.model.CancellationToken;
import com.leadradar.crawl.model.CrawlError;
import com.leadradar.crawl.model.CrawlResult;
import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.FetchOutcome;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.ReviewSite;
import com.leadradar.crawl.parse.ReviewPageParser;
import com.leadradar.crawl.util.ReasonCodeClassifier;
import com.leadradar.crawl.util.SitePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks each input URL and its pagination pages in order, collecting leads and per-URL errors.
 * Runs on one worker with that worker's fetch session.
 */
@Service
public class ReviewCrawlService {
    private static final Logger log = LoggerFactory.getLogger(ReviewCrawlService.class);

    private final FetchOrchestrator fetchOrchestrator;
    private final ReviewPageParser parser;
    private final SitePolicy sitePolicy;
    private final CrawlerProperties properties;

    public ReviewCrawlService(
        FetchOrchestrator fetchOrchestrator,
        ReviewPageParser parser,
        SitePolicy sitePolicy,
        CrawlerProperties properties
    ) {
        this.fetchOrchestrator = fetchOrchestrator;
        this.parser = parser;
        this.sitePolicy = sitePolicy;
        this.properties = properties;
    }

    public CrawlResult crawl(
        List<String> urls,
        int maxPages,
        boolean forceScripted,
        FetchSession session,
        CancellationToken token
    ) {
        CrawlProgress progress = new CrawlProgress();
        int pageCap = Math.max(1, maxPages);

        for (String rawUrl : urls) {
            if (token.isCancelled()) {
                log.info("Crawl cancelled before {}", rawUrl);
                break;
            }
            String url = rawUrl == null ? "" : rawUrl.trim();
            if (url.isEmpty()) {
                continue;
            }
            if (sitePolicy.isDenied(url)) {
                String host = ReviewSite.hostOf(url);
                progress.errors.add(new CrawlError(
                    url,
                    url,
                    ReasonCodeClassifier.DENYLISTED,
                    (host == null ? url : host) + " explicitly forbids automated scraping"
                ));
                log.info("Skipping {}: terms of service forbid automated scraping", url);
                continue;
            }
            if (sitePolicy.isAuthGated(url)) {
                log.info("Skipping {}: site requires authentication", url);
                continue;
            }

            boolean finished;
            try {
                finished = crawlPages(url, pageCap, forceScripted, session, token, progress);
            } catch (RuntimeException e) {
                log.warn("Crawl of {} aborted by unexpected failure", url, e);
                progress.errors.add(new CrawlError(url, url, ReasonCodeClassifier.UNKNOWN, String.valueOf(e.getMessage())));
                continue;
            }
            if (!finished) {
                break;
            }
        }
        return new CrawlResult(progress.leads, progress.errors, progress.pagesFetched);
    }

    /**
     * @return false when the crawl was cancelled while paginating
     */
    private boolean crawlPages(
        String url,
        int pageCap,
        boolean forceScripted,
        FetchSession session,
        CancellationToken token,
        CrawlProgress progress
    ) {
        List<String> pages = sitePolicy.pageSequence(url, pageCap);
        for (int index = 0; index < pages.size(); index++) {
            String pageUrl = pages.get(index);
            boolean firstPage = index == 0;
            if (!firstPage) {
                if (token.isCancelled() || !pauseBetweenPages()) {
                    log.info("Crawl cancelled before {}", pageUrl);
                    return false;
                }
            }

            FetchOutcome outcome = fetchOrchestrator.fetch(pageUrl, forceScripted, session);
            if (!outcome.isSuccessful()) {
                if (firstPage) {
                    progress.errors.add(toError(url, outcome));
                    log.warn("Failed to fetch {}: {}", url, outcome.message());
                } else {
                    log.warn("Stopping pagination of {} at {}: {}", url, pageUrl, outcome.message());
                }
                return true;
            }
            progress.pagesFetched++;
            log.info("Fetched {} via {} ({} chars)", pageUrl, outcome.method(), outcome.html().length());

            List<LeadReview> pageLeads;
            try {
                pageLeads = parser.parse(outcome.html(), pageUrl);
            } catch (RuntimeException e) {
                if (firstPage) {
                    progress.errors.add(new CrawlError(url, pageUrl, ReasonCodeClassifier.PARSING_FAILED, e.getMessage()));
                }
                log.warn("Failed to parse {}: {}", pageUrl, e.getMessage());
                return true;
            }
            log.info("Parsed {} negative reviews from {}", pageLeads.size(), pageUrl);
            progress.leads.addAll(pageLeads);
            if (pageLeads.isEmpty() && !firstPage) {
                log.info("No reviews on {}, stopping pagination", pageUrl);
                return true;
            }
        }
        return true;
    }

    private CrawlError toError(String url, FetchOutcome outcome) {
        String message = outcome.message();
        if (outcome.errorKind() == FetchErrorKind.BLOCKED) {
            message = url + " is blocking automated requests (403 Forbidden); scripted fetch did not get through";
        }
        return new CrawlError(
            url,
            outcome.url(),
            ReasonCodeClassifier.fromErrorKind(outcome.errorKind(), outcome.statusCode()),
            message
        );
    }

    private boolean pauseBetweenPages() {
        int delayMs = properties.getPageDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class CrawlProgress {
        private final List<LeadReview> leads = new ArrayList<>();
        private final List<CrawlError> errors = new ArrayList<>();
        private int pagesFetched;
    }
}
