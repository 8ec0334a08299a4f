package com.leadradar.crawl.indicator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.http.ReviewHttpClient;
import com.leadradar.crawl.model.HttpFetchResult;
import com.leadradar.crawl.model.IndicatorMatch;
import com.leadradar.crawl.model.TargetIndicator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Looks for evidence that a company already uses one of the configured staffing platforms.
 * Independent of pain classification; used to qualify leads by existing tooling.
 */
@Service
public class TargetIndicatorService {
    private static final Logger log = LoggerFactory.getLogger(TargetIndicatorService.class);

    public static final String CHECK_KEYWORDS = "keywords";
    public static final String CHECK_LINKS = "links";
    public static final String CHECK_SUBDOMAIN = "subdomain";

    static final int KEYWORD_CONTEXT_CHARS = 50;
    static final int LINK_TEXT_CHARS = 50;

    static final List<TargetIndicator> DEFAULT_INDICATORS = List.of(
        new TargetIndicator(
            "Avionté",
            "*.myavionte.com",
            List.of("avionte", "avionté", "myavionte"),
            List.of("avionte.com", "myavionte.com", "avionté.com")
        ),
        new TargetIndicator("Mindscope", "*.mindscope.com", List.of("mindscope"), List.of("mindscope.com")),
        new TargetIndicator("Bullhorn", "*.bullhorn.com", List.of("bullhorn"), List.of("bullhorn.com"))
    );

    private final ReviewHttpClient httpClient;
    private final CrawlerProperties properties;
    private final List<TargetIndicator> indicators;

    public TargetIndicatorService(ReviewHttpClient httpClient, ObjectMapper objectMapper, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.indicators = loadIndicators(objectMapper, properties.getIndicators().getFile());
    }

    public List<TargetIndicator> indicators() {
        return indicators;
    }

    /**
     * One result per indicator from the first check that finds it: subdomain, then links on the website, then
     * (when {@code includeKeywords}) keywords in the website's visible text.
     */
    public List<IndicatorMatch> checkWebsite(String websiteUrl, boolean includeKeywords) {
        if (websiteUrl == null || websiteUrl.isBlank()) {
            throw new IllegalArgumentException("Website URL is required");
        }
        String url = withScheme(websiteUrl.trim());
        String page = fetchPage(url);
        String pageText = page == null || !includeKeywords ? null : Jsoup.parse(page).text();
        List<IndicatorMatch> matches = new ArrayList<>();
        for (TargetIndicator indicator : indicators) {
            matches.add(firstMatch(url, page, pageText, indicator));
        }
        return matches;
    }

    private IndicatorMatch firstMatch(String url, String page, String pageText, TargetIndicator indicator) {
        IndicatorMatch subdomain = checkSubdomain(url, indicator);
        if (subdomain.found()) {
            return subdomain;
        }
        if (page != null) {
            IndicatorMatch links = checkLinks(page, indicator);
            if (links.found()) {
                return links;
            }
        }
        if (pageText != null) {
            IndicatorMatch keywords = checkKeywords(pageText, indicator);
            if (keywords.found()) {
                return keywords;
            }
        }
        return IndicatorMatch.notFound(indicator.name(), null);
    }

    /**
     * First keyword hit in {@code text}, with surrounding context as evidence.
     */
    public static IndicatorMatch checkKeywords(String text, TargetIndicator indicator) {
        if (text == null || indicator.keywords().isEmpty()) {
            return IndicatorMatch.notFound(indicator.name(), CHECK_KEYWORDS);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : indicator.keywords()) {
            String needle = keyword.toLowerCase(Locale.ROOT);
            int index = lower.indexOf(needle);
            if (index < 0) {
                continue;
            }
            int start = Math.max(0, index - KEYWORD_CONTEXT_CHARS);
            int end = Math.min(text.length(), index + needle.length() + KEYWORD_CONTEXT_CHARS);
            return new IndicatorMatch(indicator.name(), CHECK_KEYWORDS, true, text.substring(start, end).trim());
        }
        return IndicatorMatch.notFound(indicator.name(), CHECK_KEYWORDS);
    }

    /**
     * Links pointing at the platform win over a bare mention in the page source.
     */
    public static IndicatorMatch checkLinks(String html, TargetIndicator indicator) {
        if (html == null || indicator.linkPatterns().isEmpty()) {
            return IndicatorMatch.notFound(indicator.name(), CHECK_LINKS);
        }
        Document document = Jsoup.parse(html);
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href").toLowerCase(Locale.ROOT);
            for (String pattern : indicator.linkPatterns()) {
                if (href.contains(pattern.toLowerCase(Locale.ROOT))) {
                    String linkText = link.text().trim();
                    if (linkText.length() > LINK_TEXT_CHARS) {
                        linkText = linkText.substring(0, LINK_TEXT_CHARS);
                    }
                    return new IndicatorMatch(indicator.name(), CHECK_LINKS, true, "Link found: " + href + " (" + linkText + ")");
                }
            }
        }
        String source = html.toLowerCase(Locale.ROOT);
        for (String pattern : indicator.linkPatterns()) {
            if (source.contains(pattern.toLowerCase(Locale.ROOT))) {
                return new IndicatorMatch(indicator.name(), CHECK_LINKS, true, "Reference found in page source: " + pattern);
            }
        }
        return IndicatorMatch.notFound(indicator.name(), CHECK_LINKS);
    }

    public IndicatorMatch checkSubdomain(String companyUrl, TargetIndicator indicator) {
        for (String candidate : subdomainCandidates(companyUrl, indicator)) {
            HttpFetchResult result = httpClient.get(candidate, properties.getIndicators().getCheckTimeoutSeconds());
            if (result.statusCode() == 200 && result.errorCode() == null) {
                return new IndicatorMatch(indicator.name(), CHECK_SUBDOMAIN, true, candidate);
            }
        }
        return IndicatorMatch.notFound(indicator.name(), CHECK_SUBDOMAIN);
    }

    /**
     * Candidate URLs built from the first label of the company's domain, e.g. {@code https://acme.myavionte.com}.
     */
    static List<String> subdomainCandidates(String companyUrl, TargetIndicator indicator) {
        String base = indicator.subdomainBase();
        if (base == null || companyUrl == null || companyUrl.isBlank()) {
            return List.of();
        }
        String domain = companyUrl.trim()
            .replace("https://", "")
            .replace("http://", "")
            .replace("www.", "");
        int slash = domain.indexOf('/');
        if (slash >= 0) {
            domain = domain.substring(0, slash);
        }
        String companyName = domain.split("\\.")[0];
        if (companyName.isBlank()) {
            return List.of();
        }
        String lower = companyName.toLowerCase(Locale.ROOT);
        Set<String> labels = new LinkedHashSet<>();
        labels.add(companyName);
        labels.add(lower);
        labels.add(lower.replace("-", ""));
        labels.add(lower.replace("_", ""));
        List<String> candidates = new ArrayList<>();
        for (String label : labels) {
            if (!label.isEmpty()) {
                candidates.add("https://" + label + "." + base);
            }
        }
        return candidates;
    }

    private String fetchPage(String url) {
        HttpFetchResult result = httpClient.get(url, properties.getIndicators().getCheckTimeoutSeconds());
        if (result.statusCode() != 200 || result.errorCode() != null) {
            log.info("Indicator check could not load {} ({})", url, result.errorCode() == null ? result.statusCode() : result.errorCode());
            return null;
        }
        return result.body();
    }

    private static String withScheme(String url) {
        return url.startsWith("http://") || url.startsWith("https://") ? url : "https://" + url;
    }

    static List<TargetIndicator> loadIndicators(ObjectMapper objectMapper, String file) {
        if (file == null || file.isBlank()) {
            return DEFAULT_INDICATORS;
        }
        Path path = Path.of(file);
        if (!Files.isRegularFile(path)) {
            log.info("Indicator file {} not found, using built-in indicators", path);
            return DEFAULT_INDICATORS;
        }
        try {
            List<TargetIndicator> loaded = objectMapper.readValue(path.toFile(), new TypeReference<List<TargetIndicator>>() {
            });
            if (loaded == null || loaded.isEmpty()) {
                log.warn("Indicator file {} is empty, using built-in indicators", path);
                return DEFAULT_INDICATORS;
            }
            log.info("Loaded {} target indicators from {}", loaded.size(), path);
            return List.copyOf(loaded);
        } catch (IOException e) {
            log.warn("Failed to read indicator file {}, using built-in indicators: {}", path, e.getMessage());
            return DEFAULT_INDICATORS;
        }
    }
}
