package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.CancellationToken;
import com.leadradar.crawl.model.CrawlResult;
import com.leadradar.crawl.model.CrawlRunRequest;
import com.leadradar.crawl.model.LeadCrawlSummary;
import com.leadradar.crawl.model.SaveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for UI and CLI callers: runs one crawl on a pooled worker and optionally stores the leads.
 */
@Service
public class LeadDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(LeadDiscoveryService.class);

    private final CrawlWorkerPool workerPool;
    private final ReviewCrawlService crawlService;
    private final LeadStoreService storeService;
    private final CrawlerProperties properties;

    public LeadDiscoveryService(
        CrawlWorkerPool workerPool,
        ReviewCrawlService crawlService,
        LeadStoreService storeService,
        CrawlerProperties properties
    ) {
        this.workerPool = workerPool;
        this.crawlService = crawlService;
        this.storeService = storeService;
        this.properties = properties;
    }

    public LeadCrawlSummary run(CrawlRunRequest request) {
        return run(request, CancellationToken.none());
    }

    public LeadCrawlSummary run(CrawlRunRequest request, CancellationToken token) {
        List<String> urls = request.urls() == null
            ? List.of()
            : request.urls().stream().map(String::trim).filter(url -> !url.isEmpty()).toList();
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("At least one URL is required");
        }
        if (urls.size() > properties.getMaxCrawlUrls()) {
            throw new IllegalArgumentException(
                "Too many URLs: " + urls.size() + " (max " + properties.getMaxCrawlUrls() + ")"
            );
        }
        int maxPages = request.maxPages() > 0 ? request.maxPages() : properties.getDefaultMaxPages();

        log.info("Crawl starting: {} urls, maxPages={}, forceScripted={}", urls.size(), maxPages, request.forceScripted());
        CrawlResult result = workerPool.execute(
            session -> crawlService.crawl(urls, maxPages, request.forceScripted(), session, token)
        );
        SaveResult saved = request.save() ? storeService.save(result.leads()) : SaveResult.empty();
        log.info(
            "Crawl finished: pages={}, leads={}, errors={}, saved={}, duplicates={}",
            result.pagesFetched(),
            result.leads().size(),
            result.errors().size(),
            saved.saved(),
            saved.duplicates()
        );
        return new LeadCrawlSummary(
            result.leads(),
            result.errors(),
            result.pagesFetched(),
            saved.saved(),
            saved.duplicates(),
            saved.failed()
        );
    }
}
