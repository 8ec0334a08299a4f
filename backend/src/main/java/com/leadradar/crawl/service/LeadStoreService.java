package com.leadradar.crawl.service;

import com.leadradar.crawl.model.LeadAnalytics;
import com.leadradar.crawl.model.LeadQuery;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.LeadStatus;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.ReviewSite;
import com.leadradar.crawl.model.SaveResult;
import com.leadradar.crawl.model.StoredLead;
import com.leadradar.crawl.persistence.LeadJdbcRepository;
import com.leadradar.crawl.scoring.LeadScoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

@Service
public class LeadStoreService {
    private static final Logger log = LoggerFactory.getLogger(LeadStoreService.class);
    private static final int TOP_PAINS = 10;

    private final LeadJdbcRepository repository;

    public LeadStoreService(LeadJdbcRepository repository) {
        this.repository = repository;
    }

    /**
     * Inserts each lead independently. Duplicates are counted; other persistence failures are logged, counted
     * and skipped.
     */
    public SaveResult save(List<LeadReview> leads) {
        if (leads == null || leads.isEmpty()) {
            return SaveResult.empty();
        }
        int saved = 0;
        int duplicates = 0;
        int failed = 0;
        for (LeadReview lead : leads) {
            try {
                OptionalLong id = repository.insertLead(lead);
                if (id.isPresent()) {
                    saved++;
                } else {
                    duplicates++;
                }
            } catch (DataAccessException e) {
                failed++;
                log.warn("Failed to persist lead from {} ({}): {}", lead.sourceUrl(), lead.companyName(), e.getMessage());
            }
        }
        log.info("Saved {} new leads, skipped {} duplicates, {} failed", saved, duplicates, failed);
        return new SaveResult(saved, duplicates, failed);
    }

    public List<StoredLead> query(LeadQuery query) {
        return repository.findLeads(query == null ? LeadQuery.all() : query);
    }

    public StoredLead get(long id) {
        return repository.findById(id).orElseThrow(() -> new LeadNotFoundException(id));
    }

    public StoredLead updateStatus(long id, LeadStatus status, String notes) {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        int updated = repository.updateStatus(id, status, notes, Instant.now());
        if (updated == 0) {
            throw new LeadNotFoundException(id);
        }
        log.info("Lead {} moved to {}", id, status.wireValue());
        return get(id);
    }

    public LeadAnalytics analytics() {
        Double average = repository.averageScore();
        return new LeadAnalytics(
            repository.countLeads(),
            repository.countByStatus(),
            average == null ? 0.0 : Math.round(average * 10.0) / 10.0,
            repository.countLeadsWithMinScore(LeadScoring.HIGH_VALUE_SCORE),
            countByPain(),
            countBySource()
        );
    }

    private Map<String, Long> countByPain() {
        Map<PainTag, Long> counts = new EnumMap<>(PainTag.class);
        for (String joined : repository.findAllPainTags()) {
            for (PainTag tag : LeadJdbcRepository.parsePainTags(joined)) {
                counts.merge(tag, 1L, Long::sum);
            }
        }
        Map<String, Long> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<PainTag, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_PAINS)
            .forEach(entry -> ranked.put(entry.getKey().key(), entry.getValue()));
        return ranked;
    }

    private Map<String, Long> countBySource() {
        Map<String, Long> counts = new LinkedHashMap<>();
        repository.countBySourceUrl().forEach((url, total) ->
            counts.merge(ReviewSite.bucketFor(url).displayName(), total, Long::sum)
        );
        Map<String, Long> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()).thenComparing(Map.Entry.comparingByKey()))
            .forEach(entry -> ranked.put(entry.getKey(), entry.getValue()));
        return ranked;
    }
}
