package com.leadradar.crawl.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public enum ReviewSite {
    GETAPP("getapp.com", "GetApp"),
    G2("g2.com", "G2"),
    TRUSTRADIUS("trustradius.com", "TrustRadius"),
    SOFTWARE_ADVICE("softwareadvice.com", "Software Advice"),
    GENERIC(null, "Other");

    private final String host;
    private final String displayName;

    ReviewSite(String host, String displayName) {
        this.host = host;
        this.displayName = displayName;
    }

    public String host() {
        return host;
    }

    public String displayName() {
        return displayName;
    }

    public static ReviewSite fromUrl(String url) {
        String host = hostOf(url);
        if (host == null) {
            return GENERIC;
        }
        for (ReviewSite site : values()) {
            if (site.host != null && hostMatches(host, site.host)) {
                return site;
            }
        }
        return GENERIC;
    }

    /**
     * Analytics bucket for a stored source URL, matched as a substring of the URL in the order G2, GetApp,
     * TrustRadius, Software Advice.
     */
    public static ReviewSite bucketFor(String url) {
        if (url == null) {
            return GENERIC;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (ReviewSite site : new ReviewSite[] {G2, GETAPP, TRUSTRADIUS, SOFTWARE_ADVICE}) {
            if (lower.contains(site.host)) {
                return site;
            }
        }
        return GENERIC;
    }

    public static boolean hostMatches(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }

    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
