package com.leadradar.crawl.export;

import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.LeadStatus;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.StoredLead;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes leads as CSV, one row per review, for hand-off to outreach tooling.
 */
@Component
public class LeadCsvExporter {
    public static final String[] HEADERS = {
        "company_name",
        "reviewer_name",
        "review_title",
        "review_text",
        "rating",
        "pain_tags",
        "source_url",
        "scraped_at",
        "lead_score",
        "status"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADERS)
        .build();

    /**
     * Freshly crawled leads; they have not been worked yet so the status column is always {@code new}.
     */
    public void writeCrawled(List<LeadReview> leads, Writer writer) throws IOException {
        try (CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            for (LeadReview lead : leads) {
                printer.printRecord(
                    lead.companyName(),
                    lead.reviewerName(),
                    lead.reviewTitle(),
                    lead.reviewText(),
                    formatRating(lead.rating()),
                    joinTags(lead.painTags()),
                    lead.sourceUrl(),
                    formatInstant(lead.scrapedAt()),
                    lead.leadScore(),
                    LeadStatus.NEW.wireValue()
                );
            }
        }
    }

    public void writeStored(List<StoredLead> leads, Writer writer) throws IOException {
        try (CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            for (StoredLead lead : leads) {
                printer.printRecord(
                    lead.companyName(),
                    lead.reviewerName(),
                    lead.reviewTitle(),
                    lead.reviewText(),
                    formatRating(lead.rating()),
                    joinTags(lead.painTags()),
                    lead.sourceUrl(),
                    formatInstant(lead.scrapedAt()),
                    lead.leadScore(),
                    lead.status() == null ? LeadStatus.NEW.wireValue() : lead.status().wireValue()
                );
            }
        }
    }

    public void exportCrawled(List<LeadReview> leads, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeCrawled(leads, writer);
        }
    }

    private static String joinTags(List<PainTag> tags) {
        if (tags == null) {
            return "";
        }
        return tags.stream().map(PainTag::key).collect(Collectors.joining(","));
    }

    private static String formatRating(Double rating) {
        return rating == null ? "" : rating.toString();
    }

    private static String formatInstant(Instant instant) {
        return instant == null ? "" : instant.toString();
    }
}
