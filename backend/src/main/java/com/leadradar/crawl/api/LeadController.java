package com.leadradar.crawl.api;

import com.leadradar.crawl.export.LeadCsvExporter;
import com.leadradar.crawl.indicator.TargetIndicatorService;
import com.leadradar.crawl.model.CrawlRunRequest;
import com.leadradar.crawl.model.IndicatorMatch;
import com.leadradar.crawl.model.LeadAnalytics;
import com.leadradar.crawl.model.LeadCrawlSummary;
import com.leadradar.crawl.model.LeadQuery;
import com.leadradar.crawl.model.LeadSortOrder;
import com.leadradar.crawl.model.LeadStatus;
import com.leadradar.crawl.model.StoredLead;
import com.leadradar.crawl.model.TargetIndicator;
import com.leadradar.crawl.service.LeadDiscoveryService;
import com.leadradar.crawl.service.LeadStoreService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@RestController
@RequestMapping("/api")
public class LeadController {
    private static final DateTimeFormatter EXPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");

    private final LeadDiscoveryService discoveryService;
    private final LeadStoreService storeService;
    private final LeadCsvExporter csvExporter;
    private final TargetIndicatorService indicatorService;

    public LeadController(
        LeadDiscoveryService discoveryService,
        LeadStoreService storeService,
        LeadCsvExporter csvExporter,
        TargetIndicatorService indicatorService
    ) {
        this.discoveryService = discoveryService;
        this.storeService = storeService;
        this.csvExporter = csvExporter;
        this.indicatorService = indicatorService;
    }

    @PostMapping("/crawl/run")
    public LeadCrawlSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body with urls is required");
        }
        CrawlRunRequest runRequest = new CrawlRunRequest(
            request.urls(),
            request.maxPages() == null ? 0 : request.maxPages(),
            request.save() == null || request.save(),
            request.forceScripted() != null && request.forceScripted()
        );
        return discoveryService.run(runRequest);
    }

    @GetMapping("/leads")
    public List<StoredLead> leads(
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "pain", required = false) String pain,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "minScore", required = false) Double minScore,
        @RequestParam(name = "sortBy", required = false) String sortBy
    ) {
        return storeService.query(toQuery(limit, pain, status, minScore, sortBy));
    }

    @GetMapping("/leads/analytics")
    public LeadAnalytics analytics() {
        return storeService.analytics();
    }

    @GetMapping("/leads/export")
    public ResponseEntity<String> export(
        @RequestParam(name = "pain", required = false) String pain,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "minScore", required = false) Double minScore,
        @RequestParam(name = "sortBy", required = false) String sortBy
    ) {
        List<StoredLead> leads = storeService.query(toQuery(LeadQuery.MAX_LIMIT, pain, status, minScore, sortBy));
        StringWriter body = new StringWriter();
        try {
            csvExporter.writeStored(leads, body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String filename = "leads_" + EXPORT_STAMP.format(ZonedDateTime.now(ZoneOffset.UTC)) + ".csv";
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .contentType(new MediaType("text", "csv"))
            .body(body.toString());
    }

    @GetMapping("/leads/{id}")
    public StoredLead lead(@PathVariable("id") long id) {
        return storeService.get(id);
    }

    @PostMapping("/leads/{id}/status")
    public StoredLead updateStatus(@PathVariable("id") long id, @RequestBody LeadStatusUpdateRequest request) {
        return storeService.updateStatus(id, LeadStatus.fromWire(request.status()), request.notes());
    }

    @GetMapping("/indicators")
    public List<TargetIndicator> indicators() {
        return indicatorService.indicators();
    }

    @PostMapping("/indicators/check")
    public List<IndicatorMatch> checkIndicators(
        @RequestParam(name = "url") String url,
        @RequestParam(name = "keywords", defaultValue = "false") boolean keywords
    ) {
        return indicatorService.checkWebsite(url, keywords);
    }

    private static LeadQuery toQuery(Integer limit, String pain, String status, Double minScore, String sortBy) {
        return new LeadQuery(
            limit == null ? LeadQuery.DEFAULT_LIMIT : limit,
            pain,
            status == null || status.isBlank() ? null : LeadStatus.fromWire(status),
            minScore,
            LeadSortOrder.fromKey(sortBy)
        );
    }
}
