package com.statejobs.harvester.crawl.persistence;

import com.statejobs.harvester.crawl.model.ListingSummary;
import com.statejobs.harvester.crawl.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class ListingStateRepository {
    private static final Logger log = LoggerFactory.getLogger(ListingStateRepository.class);
    private static final String SELECT_COLUMNS = """
        SELECT listing_id,
               source_url,
               first_seen_at,
               last_seen_at,
               observed_updated_at,
               updated_at,
               detail_fingerprint,
               last_detail_at
        FROM listing_state
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final RowMapper<StateRecord> stateRecordMapper = (rs, rowNum) -> new StateRecord(
        rs.getString("listing_id"),
        rs.getString("source_url"),
        toInstant(rs.getTimestamp("first_seen_at")),
        toInstant(rs.getTimestamp("last_seen_at")),
        toInstant(rs.getTimestamp("observed_updated_at")),
        toInstant(rs.getTimestamp("updated_at")),
        rs.getString("detail_fingerprint"),
        toInstant(rs.getTimestamp("last_detail_at"))
    );

    public ListingStateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> stateCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("listings", countWhere("1 = 1"));
        counts.put("detail_fetched", countWhere("detail_fingerprint IS NOT NULL"));
        counts.put("never_fetched", countWhere("detail_fingerprint IS NULL"));
        counts.put("stale", countWhere(
            "detail_fingerprint IS NOT NULL AND observed_updated_at IS NOT NULL "
                + "AND (updated_at IS NULL OR observed_updated_at <> updated_at)"
        ));
        return counts;
    }

    public long countListings() {
        return countWhere("1 = 1");
    }

    public StateRecord findById(String listingId) {
        if (listingId == null || listingId.isBlank()) {
            return null;
        }
        List<StateRecord> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE listing_id = :listingId",
            new MapSqlParameterSource("listingId", listingId),
            stateRecordMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<StateRecord> findAll() {
        return jdbc.query(SELECT_COLUMNS + " ORDER BY first_seen_at, listing_id", new MapSqlParameterSource(), stateRecordMapper);
    }

    /**
     * Rows that were never fetched in detail, or whose last observed update time
     * differs from the one recorded at the last detail fetch.
     */
    public List<StateRecord> findIncrementalCandidates() {
        return jdbc.query(
            SELECT_COLUMNS + """
                WHERE detail_fingerprint IS NULL
                   OR (observed_updated_at IS NOT NULL
                       AND (updated_at IS NULL OR observed_updated_at <> updated_at))
                ORDER BY first_seen_at, listing_id
                """,
            new MapSqlParameterSource(),
            stateRecordMapper
        );
    }

    public void upsertSummary(ListingSummary summary, Instant seenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("listingId", summary.listingId())
            .addValue("sourceUrl", summary.sourceUrl())
            .addValue("seenAt", toTimestamp(seenAt), Types.TIMESTAMP)
            .addValue("observedUpdatedAt", toTimestamp(summary.updatedAt()), Types.TIMESTAMP);
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO listing_state (
                        listing_id,
                        source_url,
                        first_seen_at,
                        last_seen_at,
                        observed_updated_at
                    )
                    VALUES (
                        :listingId,
                        :sourceUrl,
                        :seenAt,
                        :seenAt,
                        :observedUpdatedAt
                    )
                    ON CONFLICT (listing_id)
                    DO UPDATE SET
                        last_seen_at = EXCLUDED.last_seen_at,
                        source_url = COALESCE(EXCLUDED.source_url, listing_state.source_url),
                        observed_updated_at = COALESCE(EXCLUDED.observed_updated_at, listing_state.observed_updated_at)
                    """,
                params
            );
            return;
        }

        int updated = updateSummary(params);
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO listing_state (
                        listing_id,
                        source_url,
                        first_seen_at,
                        last_seen_at,
                        observed_updated_at
                    )
                    VALUES (
                        :listingId,
                        :sourceUrl,
                        :seenAt,
                        :seenAt,
                        :observedUpdatedAt
                    )
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for listing_id={}, retrying as update", summary.listingId());
            updateSummary(params);
        }
    }

    public void recordDetailResult(
        String listingId,
        String sourceUrl,
        String fingerprint,
        Instant updatedAt,
        Instant fetchedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("listingId", listingId)
            .addValue("sourceUrl", sourceUrl)
            .addValue("fingerprint", fingerprint)
            .addValue("updatedAt", toTimestamp(updatedAt), Types.TIMESTAMP)
            .addValue("fetchedAt", toTimestamp(fetchedAt), Types.TIMESTAMP);
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO listing_state (
                        listing_id,
                        source_url,
                        first_seen_at,
                        last_seen_at,
                        observed_updated_at,
                        updated_at,
                        detail_fingerprint,
                        last_detail_at
                    )
                    VALUES (
                        :listingId,
                        :sourceUrl,
                        :fetchedAt,
                        :fetchedAt,
                        :updatedAt,
                        :updatedAt,
                        :fingerprint,
                        :fetchedAt
                    )
                    ON CONFLICT (listing_id)
                    DO UPDATE SET
                        detail_fingerprint = EXCLUDED.detail_fingerprint,
                        updated_at = COALESCE(EXCLUDED.updated_at, listing_state.observed_updated_at, listing_state.updated_at),
                        last_detail_at = EXCLUDED.last_detail_at
                    """,
                params
            );
            return;
        }

        int updated = updateDetail(params);
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO listing_state (
                        listing_id,
                        source_url,
                        first_seen_at,
                        last_seen_at,
                        observed_updated_at,
                        updated_at,
                        detail_fingerprint,
                        last_detail_at
                    )
                    VALUES (
                        :listingId,
                        :sourceUrl,
                        :fetchedAt,
                        :fetchedAt,
                        :updatedAt,
                        :updatedAt,
                        :fingerprint,
                        :fetchedAt
                    )
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for listing_id={}, retrying as update", listingId);
            updateDetail(params);
        }
    }

    private int updateSummary(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE listing_state
                SET last_seen_at = :seenAt,
                    source_url = COALESCE(:sourceUrl, source_url),
                    observed_updated_at = COALESCE(:observedUpdatedAt, observed_updated_at)
                WHERE listing_id = :listingId
                """,
            params
        );
    }

    private int updateDetail(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE listing_state
                SET detail_fingerprint = :fingerprint,
                    updated_at = COALESCE(:updatedAt, observed_updated_at, updated_at),
                    last_detail_at = :fetchedAt
                WHERE listing_id = :listingId
                """,
            params
        );
    }

    private long countWhere(String predicate) {
        Long count = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM listing_state WHERE " + predicate,
            Long.class
        );
        return count == null ? 0L : count;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upserts", e);
            return false;
        }
    }
}
