package com.leadradar.crawl.persistence;

import com.leadradar.crawl.model.LeadQuery;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.LeadStatus;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.StoredLead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

@Repository
public class LeadJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(LeadJdbcRepository.class);
    private static final int MAX_NAME_LENGTH = 255;

    private static final String SELECT_LEAD =
        """
            SELECT id, company_name, reviewer_name, review_title, review_text, rating, pain_tags,
                   source_url, scraped_at, lead_score, status, notes, contacted_at, converted_at
            FROM leads
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public LeadJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts the lead unless its identity hash is already stored.
     *
     * @return the new id, or empty when the lead is a duplicate
     */
    public OptionalLong insertLead(LeadReview lead) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyName", clip(lead.companyName(), MAX_NAME_LENGTH))
            .addValue("reviewerName", clip(lead.reviewerName(), MAX_NAME_LENGTH))
            .addValue("reviewTitle", clip(lead.reviewTitle(), MAX_NAME_LENGTH))
            .addValue("reviewText", lead.reviewText())
            .addValue("rating", lead.rating())
            .addValue("painTags", lead.painTagsJoined())
            .addValue("sourceUrl", lead.sourceUrl())
            .addValue("scrapedAt", toTimestamp(lead.scrapedAt() == null ? Instant.now() : lead.scrapedAt()))
            .addValue("identityHash", lead.identityHash())
            .addValue("leadScore", lead.leadScore());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO leads (
                        company_name, reviewer_name, review_title, review_text, rating, pain_tags,
                        source_url, scraped_at, identity_hash, lead_score
                    )
                    VALUES (
                        :companyName, :reviewerName, :reviewTitle, :reviewText, :rating, :painTags,
                        :sourceUrl, :scrapedAt, :identityHash, :leadScore
                    )
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } catch (DuplicateKeyException ignored) {
            log.debug("Lead {} already stored", lead.identityHash());
            return OptionalLong.empty();
        }
        Number key = keyHolder.getKey();
        return key == null ? OptionalLong.empty() : OptionalLong.of(key.longValue());
    }

    public List<StoredLead> findLeads(LeadQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", query.limit());
        StringBuilder sql = new StringBuilder(SELECT_LEAD).append("WHERE 1 = 1\n");
        if (query.pain() != null) {
            sql.append("  AND pain_tags LIKE :pain\n");
            params.addValue("pain", "%" + query.pain() + "%");
        }
        if (query.status() != null) {
            sql.append("  AND status = :status\n");
            params.addValue("status", query.status().wireValue());
        }
        if (query.minScore() != null) {
            sql.append("  AND lead_score >= :minScore\n");
            params.addValue("minScore", query.minScore());
        }
        sql.append("ORDER BY ").append(query.sortOrder().orderBy()).append(", id ASC\n");
        sql.append("LIMIT :limit");
        return jdbc.query(sql.toString(), params, leadRowMapper());
    }

    public Optional<StoredLead> findById(long id) {
        List<StoredLead> rows = jdbc.query(
            SELECT_LEAD + "WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            leadRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean existsByIdentityHash(String identityHash) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM leads WHERE identity_hash = :identityHash",
            new MapSqlParameterSource().addValue("identityHash", identityHash),
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * Sets the status, replaces notes only when given, and stamps contacted/converted times on entry to those
     * statuses. Existing stamps are never cleared.
     *
     * @return number of rows updated
     */
    public int updateStatus(long id, LeadStatus status, String notes, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", status.wireValue())
            .addValue("now", toTimestamp(now));
        StringBuilder sql = new StringBuilder("UPDATE leads SET status = :status");
        if (notes != null && !notes.isEmpty()) {
            sql.append(", notes = :notes");
            params.addValue("notes", notes);
        }
        if (status == LeadStatus.CONTACTED) {
            sql.append(", contacted_at = :now");
        } else if (status == LeadStatus.CONVERTED) {
            sql.append(", converted_at = :now");
        }
        sql.append(" WHERE id = :id");
        return jdbc.update(sql.toString(), params);
    }

    public long countLeads() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM leads", new MapSqlParameterSource(), Long.class);
        return count == null ? 0L : count;
    }

    public long countLeadsWithMinScore(double minScore) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM leads WHERE lead_score >= :minScore",
            new MapSqlParameterSource().addValue("minScore", minScore),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Double averageScore() {
        return jdbc.queryForObject("SELECT AVG(lead_score) FROM leads", new MapSqlParameterSource(), Double.class);
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM leads
                GROUP BY status
                ORDER BY total DESC, status
                """,
            new MapSqlParameterSource(),
            rs -> {
                String status = rs.getString("status");
                if (status != null) {
                    counts.put(status, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    public Map<String, Long> countBySourceUrl() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT source_url, COUNT(*) AS total
                FROM leads
                GROUP BY source_url
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("source_url"), rs.getLong("total"));
            }
        );
        return counts;
    }

    public List<String> findAllPainTags() {
        return jdbc.queryForList(
            "SELECT pain_tags FROM leads WHERE pain_tags IS NOT NULL AND pain_tags <> ''",
            new MapSqlParameterSource(),
            String.class
        );
    }

    private RowMapper<StoredLead> leadRowMapper() {
        return (rs, rowNum) -> new StoredLead(
            rs.getLong("id"),
            rs.getString("company_name"),
            rs.getString("reviewer_name"),
            rs.getString("review_title"),
            rs.getString("review_text"),
            nullableDouble(rs, "rating"),
            parsePainTags(rs.getString("pain_tags")),
            rs.getString("source_url"),
            toInstant(rs.getTimestamp("scraped_at")),
            rs.getDouble("lead_score"),
            LeadStatus.fromWire(rs.getString("status")),
            rs.getString("notes"),
            toInstant(rs.getTimestamp("contacted_at")),
            toInstant(rs.getTimestamp("converted_at"))
        );
    }

    public static List<PainTag> parsePainTags(String joined) {
        List<PainTag> tags = new ArrayList<>();
        if (joined == null || joined.isBlank()) {
            return tags;
        }
        for (String part : joined.split(",")) {
            PainTag.fromKey(part).ifPresent(tags::add);
        }
        return tags;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String clip(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
