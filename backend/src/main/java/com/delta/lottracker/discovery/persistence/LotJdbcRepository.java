package com.delta.lottracker.discovery.persistence;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotQuery;
import com.delta.lottracker.discovery.model.SourceTag;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class LotJdbcRepository {
    private static final String LOT_COLUMNS = """
        id, title, category, brand, item_condition, auction_id, location,
        retail_price, current_bid, bid_count, unique_bidders, is_open, closes_at,
        bid_source, bid_observed_at, summary_seen_at, search_seen_at, rendered_seen_at,
        quality_score, opportunity_score
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public LotJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Lot> findById(String id) {
        List<Lot> rows = jdbc.query(
            "SELECT " + LOT_COLUMNS + " FROM lots WHERE id = :id",
            new MapSqlParameterSource("id", id),
            lotRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int update(Lot lot, Instant now) {
        return jdbc.update(
            """
                UPDATE lots
                SET title = :title,
                    category = :category,
                    brand = :brand,
                    item_condition = :condition,
                    auction_id = :auctionId,
                    location = :location,
                    retail_price = :retailPrice,
                    current_bid = :currentBid,
                    bid_count = :bidCount,
                    unique_bidders = :uniqueBidders,
                    is_open = :open,
                    closes_at = :closesAt,
                    bid_source = :bidSource,
                    bid_observed_at = :bidObservedAt,
                    summary_seen_at = :summarySeenAt,
                    search_seen_at = :searchSeenAt,
                    rendered_seen_at = :renderedSeenAt,
                    quality_score = :qualityScore,
                    opportunity_score = :opportunityScore,
                    updated_at = :now
                WHERE id = :id
                """,
            lotParams(lot, now)
        );
    }

    public void insert(Lot lot, Instant now) {
        jdbc.update(
            """
                INSERT INTO lots (
                    id, title, category, brand, item_condition, auction_id, location,
                    retail_price, current_bid, bid_count, unique_bidders, is_open, closes_at,
                    bid_source, bid_observed_at, summary_seen_at, search_seen_at, rendered_seen_at,
                    quality_score, opportunity_score, created_at, updated_at
                )
                VALUES (
                    :id, :title, :category, :brand, :condition, :auctionId, :location,
                    :retailPrice, :currentBid, :bidCount, :uniqueBidders, :open, :closesAt,
                    :bidSource, :bidObservedAt, :summarySeenAt, :searchSeenAt, :renderedSeenAt,
                    :qualityScore, :opportunityScore, :now, :now
                )
                """,
            lotParams(lot, now)
        );
    }

    public List<Lot> query(LotQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(LOT_COLUMNS).append(" FROM lots WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (query.open() != null) {
            sql.append(" AND is_open = :open");
            params.addValue("open", query.open());
        }
        if (!query.locations().isEmpty()) {
            List<String> names = new ArrayList<>();
            for (Location location : query.locations()) {
                names.add(location.name());
            }
            sql.append(" AND location IN (:locations)");
            params.addValue("locations", names);
        }
        if (query.closesAfter() != null) {
            sql.append(" AND closes_at >= :closesAfter");
            params.addValue("closesAfter", toTimestamp(query.closesAfter()));
        }
        if (query.closesBefore() != null) {
            sql.append(" AND closes_at < :closesBefore");
            params.addValue("closesBefore", toTimestamp(query.closesBefore()));
        }
        if (query.minOpportunityScore() != null) {
            sql.append(" AND opportunity_score >= :minOpportunityScore");
            params.addValue("minOpportunityScore", query.minOpportunityScore());
        }
        if (query.minRetailPrice() != null) {
            sql.append(" AND retail_price >= :minRetailPrice");
            params.addValue("minRetailPrice", query.minRetailPrice());
        }
        if (query.maxCurrentBid() != null) {
            sql.append(" AND current_bid <= :maxCurrentBid");
            params.addValue("maxCurrentBid", query.maxCurrentBid());
        }
        sql.append(" ORDER BY opportunity_score DESC, closes_at ASC NULLS LAST, id ASC LIMIT :limit");
        params.addValue("limit", query.effectiveLimit());
        return jdbc.query(sql.toString(), params, lotRowMapper());
    }

    /**
     * Open lots whose rendered bid data is missing or older than {@code staleBefore}, soonest
     * closing first. Lots closing inside the optional exclusion window are left out, and a
     * non-empty {@code locations} set restricts the result to those warehouses.
     */
    public List<Lot> findAugmentationCandidates(
        Instant now,
        Instant staleBefore,
        Instant excludeFrom,
        Instant excludeUntil,
        Set<Location> locations,
        int limit
    ) {
        StringBuilder sql = new StringBuilder("SELECT ").append(LOT_COLUMNS).append(
            """
                 FROM lots
                WHERE is_open = TRUE
                  AND (closes_at IS NULL OR closes_at > :now)
                  AND (rendered_seen_at IS NULL OR rendered_seen_at < :staleBefore)
                """
        );
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("staleBefore", toTimestamp(staleBefore))
            .addValue("limit", Math.max(1, limit));
        if (excludeFrom != null && excludeUntil != null) {
            sql.append(" AND (closes_at IS NULL OR closes_at < :excludeFrom OR closes_at >= :excludeUntil)");
            params.addValue("excludeFrom", toTimestamp(excludeFrom));
            params.addValue("excludeUntil", toTimestamp(excludeUntil));
        }
        if (locations != null && !locations.isEmpty()) {
            sql.append(" AND location IN (:locations)");
            params.addValue("locations", locations.stream().map(Location::name).toList());
        }
        sql.append(" ORDER BY closes_at ASC NULLS LAST, id ASC LIMIT :limit");
        return jdbc.query(sql.toString(), params, lotRowMapper());
    }

    public List<String> findOpenIdsClosedBefore(Instant cutoff) {
        return jdbc.queryForList(
            """
                SELECT id
                FROM lots
                WHERE is_open = TRUE
                  AND closes_at < :cutoff
                ORDER BY id
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff)),
            String.class
        );
    }

    /**
     * Keyset page over open lots ordered by id.
     */
    public List<Lot> findOpenLotsAfter(String afterId, int limit) {
        return jdbc.query(
            "SELECT " + LOT_COLUMNS + """
                 FROM lots
                WHERE is_open = TRUE
                  AND id > :afterId
                ORDER BY id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("afterId", afterId == null ? "" : afterId)
                .addValue("limit", Math.max(1, limit)),
            lotRowMapper()
        );
    }

    public long countLots() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM lots", Long.class);
        return count == null ? 0L : count;
    }

    private MapSqlParameterSource lotParams(Lot lot, Instant now) {
        return new MapSqlParameterSource()
            .addValue("id", lot.id())
            .addValue("title", truncate(lot.title(), 1000))
            .addValue("category", truncate(lot.category(), 255))
            .addValue("brand", truncate(lot.brand(), 255))
            .addValue("condition", truncate(lot.condition(), 255))
            .addValue("auctionId", truncate(lot.auctionId(), 64))
            .addValue("location", lot.location().name())
            .addValue("retailPrice", lot.retailPrice())
            .addValue("currentBid", lot.currentBid())
            .addValue("bidCount", lot.bidCount())
            .addValue("uniqueBidders", lot.uniqueBidders())
            .addValue("open", lot.open())
            .addValue("closesAt", toTimestamp(lot.closesAt()))
            .addValue("bidSource", lot.bidSource() == null ? null : lot.bidSource().name())
            .addValue("bidObservedAt", toTimestamp(lot.bidObservedAt()))
            .addValue("summarySeenAt", toTimestamp(lot.lastSeen(SourceTag.SUMMARY)))
            .addValue("searchSeenAt", toTimestamp(lot.lastSeen(SourceTag.SEARCH)))
            .addValue("renderedSeenAt", toTimestamp(lot.lastSeen(SourceTag.RENDERED)))
            .addValue("qualityScore", lot.qualityScore())
            .addValue("opportunityScore", lot.opportunityScore())
            .addValue("now", toTimestamp(now));
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private RowMapper<Lot> lotRowMapper() {
        return (rs, rowNum) -> {
            Map<SourceTag, Instant> seen = new EnumMap<>(SourceTag.class);
            putSeen(seen, SourceTag.SUMMARY, rs, "summary_seen_at");
            putSeen(seen, SourceTag.SEARCH, rs, "search_seen_at");
            putSeen(seen, SourceTag.RENDERED, rs, "rendered_seen_at");
            return new Lot(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("category"),
                rs.getString("brand"),
                rs.getString("item_condition"),
                rs.getString("auction_id"),
                parseLocation(rs.getString("location")),
                rs.getBigDecimal("retail_price"),
                rs.getBigDecimal("current_bid"),
                rs.getInt("bid_count"),
                rs.getInt("unique_bidders"),
                rs.getBoolean("is_open"),
                toInstant(rs.getTimestamp("closes_at")),
                SourceTag.fromKey(rs.getString("bid_source")),
                toInstant(rs.getTimestamp("bid_observed_at")),
                seen,
                rs.getDouble("quality_score"),
                rs.getDouble("opportunity_score")
            );
        };
    }

    private void putSeen(Map<SourceTag, Instant> seen, SourceTag source, ResultSet rs, String column) throws SQLException {
        Instant value = toInstant(rs.getTimestamp(column));
        if (value != null) {
            seen.put(source, value);
        }
    }

    private Location parseLocation(String raw) {
        if (raw == null || raw.isBlank()) {
            return Location.UNKNOWN;
        }
        try {
            return Location.valueOf(raw);
        } catch (IllegalArgumentException e) {
            return Location.fromLabel(raw);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
