package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.export.LeadCsvExporter;
import com.leadradar.crawl.model.CrawlError;
import com.leadradar.crawl.model.CrawlRunRequest;
import com.leadradar.crawl.model.LeadCrawlSummary;
import com.leadradar.crawl.model.LeadReview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);
    private static final int TOP_LEADS = 5;

    private final CrawlerProperties properties;
    private final LeadDiscoveryService discoveryService;
    private final LeadCsvExporter csvExporter;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        LeadDiscoveryService discoveryService,
        LeadCsvExporter csvExporter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.csvExporter = csvExporter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        CrawlerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> urls = collectUrls(cli.getUrls(), cli.getFile());
        LeadCrawlSummary summary = discoveryService.run(new CrawlRunRequest(urls, cli.getMaxPages(), cli.isSave(), false));
        logSummary(summary);

        if (cli.getExportPath() != null && !cli.getExportPath().isBlank() && !summary.leads().isEmpty()) {
            Path target = Path.of(cli.getExportPath());
            try {
                csvExporter.exportCrawled(summary.leads(), target);
                log.info("Exported {} leads to {}", summary.leads().size(), target.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to export leads to " + target, e);
            }
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    /**
     * Comma-separated URLs followed by the non-blank lines of the URL file, in order and without repeats.
     */
    static List<String> collectUrls(String commaSeparated, String file) {
        Set<String> urls = new LinkedHashSet<>();
        if (commaSeparated != null) {
            Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .forEach(urls::add);
        }
        if (file != null && !file.isBlank()) {
            try {
                Files.readAllLines(Path.of(file), StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(s -> !s.isBlank() && !s.startsWith("#"))
                    .forEach(urls::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read URL file " + file, e);
            }
        }
        return new ArrayList<>(urls);
    }

    private void logSummary(LeadCrawlSummary summary) {
        List<LeadReview> leads = summary.leads();
        double average = leads.stream().mapToDouble(LeadReview::leadScore).average().orElse(0.0);
        log.info(
            "Found {} leads over {} pages (average score {}), saved={}, duplicates={}, failed={}",
            leads.size(),
            summary.pagesFetched(),
            String.format(Locale.ROOT, "%.1f", average),
            summary.saved(),
            summary.duplicates(),
            summary.failed()
        );
        leads.stream()
            .sorted(Comparator.comparingDouble(LeadReview::leadScore).reversed())
            .limit(TOP_LEADS)
            .forEach(lead -> log.info(
                "Top lead: score={} company={} reviewer={} pains={}",
                lead.leadScore(),
                lead.companyName(),
                lead.reviewerName(),
                lead.painTagsJoined()
            ));
        for (CrawlError error : summary.errors()) {
            log.warn("Crawl error: {}", error.describe());
        }
    }
}
