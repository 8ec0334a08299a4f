package com.leadradar.crawl.export;

import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.LeadStatus;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.StoredLead;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LeadCsvExporterTest {
    private static final Instant SCRAPED_AT = Instant.parse("2024-03-01T10:15:30Z");

    private final LeadCsvExporter exporter = new LeadCsvExporter();

    private static LeadReview crawledLead() {
        return new LeadReview(
            "Acme Staffing",
            "Jane Doe",
            "Hard to use",
            "The interface is confusing, and \"support\" never answers.",
            2.0,
            List.of(PainTag.COMPLEXITY, PainTag.SUPPORT),
            "https://www.g2.com/products/x/reviews",
            SCRAPED_AT,
            62.0
        );
    }

    private static List<CSVRecord> parse(String csv) throws Exception {
        try (CSVParser parser = CSVParser.parse(
            new StringReader(csv),
            CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
        )) {
            return parser.getRecords();
        }
    }

    @Test
    void crawledLeadsAreWrittenWithHeaderAndNewStatus() throws Exception {
        StringWriter out = new StringWriter();

        exporter.writeCrawled(List.of(crawledLead()), out);

        String csv = out.toString();
        assertThat(csv).startsWith(String.join(",", LeadCsvExporter.HEADERS));
        List<CSVRecord> records = parse(csv);
        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.get("company_name")).isEqualTo("Acme Staffing");
            assertThat(record.get("review_text")).isEqualTo("The interface is confusing, and \"support\" never answers.");
            assertThat(record.get("rating")).isEqualTo("2.0");
            assertThat(record.get("pain_tags")).isEqualTo("complexity,support");
            assertThat(record.get("scraped_at")).isEqualTo("2024-03-01T10:15:30Z");
            assertThat(record.get("lead_score")).isEqualTo("62.0");
            assertThat(record.get("status")).isEqualTo("new");
        });
    }

    @Test
    void storedLeadsKeepTheirStatusAndBlankRating() throws Exception {
        StoredLead lead = new StoredLead(
            7L,
            "Beta Corp",
            "Unknown",
            "",
            "Reports are slow and the export keeps crashing.",
            null,
            List.of(PainTag.BUGS),
            "https://example.com/reviews",
            SCRAPED_AT,
            45.0,
            LeadStatus.CONTACTED,
            "left voicemail",
            SCRAPED_AT,
            null
        );
        StringWriter out = new StringWriter();

        exporter.writeStored(List.of(lead), out);

        assertThat(parse(out.toString())).singleElement().satisfies(record -> {
            assertThat(record.get("rating")).isEmpty();
            assertThat(record.get("pain_tags")).isEqualTo("bugs");
            assertThat(record.get("status")).isEqualTo("contacted");
        });
    }

    @Test
    void exportCreatesParentDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("exports/nested/leads.csv");

        exporter.exportCrawled(List.of(crawledLead(), crawledLead()), target);

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("company_name,reviewer_name");
    }
}
