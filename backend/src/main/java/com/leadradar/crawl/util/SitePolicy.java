package com.leadradar.crawl.util;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.ReviewSite;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Host tables that decide how a review URL is treated: refused, skipped, fetched with a browser, paginated.
 */
@Component
public class SitePolicy {
    private final CrawlerProperties.Sites sites;

    public SitePolicy(CrawlerProperties properties) {
        this.sites = properties.getSites();
    }

    public boolean isDenied(String url) {
        return matchesAny(url, sites.getDeniedHosts());
    }

    public boolean isAuthGated(String url) {
        return matchesAny(url, sites.getAuthGatedHosts());
    }

    public boolean requiresScripting(String url) {
        return matchesAny(url, sites.getScriptedHosts());
    }

    public boolean supportsPagination(String url) {
        return matchesAny(url, sites.getPaginatedHosts());
    }

    /**
     * The URL itself followed by {@code ?page=N} variants of its query-less form for paginated hosts.
     */
    public List<String> pageSequence(String url, int maxPages) {
        List<String> pages = new ArrayList<>();
        pages.add(url);
        if (!supportsPagination(url)) {
            return pages;
        }
        String base = stripQuery(url);
        for (int page = 2; page <= maxPages; page++) {
            pages.add(base + "?page=" + page);
        }
        return pages;
    }

    public static String stripQuery(String url) {
        int idx = url.indexOf('?');
        String base = idx >= 0 ? url.substring(0, idx) : url;
        int fragment = base.indexOf('#');
        return fragment >= 0 ? base.substring(0, fragment) : base;
    }

    private static boolean matchesAny(String url, List<String> domains) {
        String host = ReviewSite.hostOf(url);
        if (host == null || domains == null) {
            return false;
        }
        for (String domain : domains) {
            if (domain != null && ReviewSite.hostMatches(host, domain.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
