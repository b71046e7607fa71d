package com.delta.lottracker.discovery.persistence;

import com.delta.lottracker.discovery.model.DiscoveryRunCounters;
import com.delta.lottracker.discovery.model.DiscoveryRunStatus;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.RunPhase;
import com.delta.lottracker.discovery.model.SourceStreamResult;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class DiscoveryRunRepository {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    static final String STATUS_RUNNING = "RUNNING";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public DiscoveryRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertRun(Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", STATUS_RUNNING)
            .addValue("phase", RunPhase.IDLE.name());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO discovery_runs (started_at, status, phase)
                VALUES (:startedAt, :status, :phase)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    /**
     * @return the id of a run still marked running that started after {@code startedAfter}
     */
    public Optional<Long> findActiveRunId(Instant startedAfter) {
        List<Long> ids = jdbc.queryForList(
            """
                SELECT id
                FROM discovery_runs
                WHERE status = :status
                  AND started_at > :startedAfter
                ORDER BY started_at DESC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("status", STATUS_RUNNING)
                .addValue("startedAfter", toTimestamp(startedAfter)),
            Long.class
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    public void updateProgress(long runId, RunPhase phase, DiscoveryRunCounters counters) {
        MapSqlParameterSource params = counterParams(counters)
            .addValue("runId", runId)
            .addValue("phase", phase.name());
        jdbc.update(
            """
                UPDATE discovery_runs
                SET phase = :phase,
                    records_fetched = :recordsFetched,
                    lots_discovered = :lotsDiscovered,
                    lots_created = :lotsCreated,
                    unmappable = :unmappable,
                    out_of_scope = :outOfScope,
                    records_rejected = :recordsRejected,
                    lots_expired = :lotsExpired,
                    lots_augmented = :lotsAugmented,
                    augment_unchanged = :augmentUnchanged,
                    lots_degraded = :lotsDegraded,
                    augment_failures = :augmentFailures,
                    lots_scored = :lotsScored
                WHERE id = :runId
                """,
            params
        );
    }

    public void finishRun(
        long runId,
        RunPhase phase,
        Instant finishedAt,
        DiscoveryRunCounters counters,
        boolean sessionExpired,
        List<SourceTag> failedSources,
        String notes
    ) {
        MapSqlParameterSource params = counterParams(counters)
            .addValue("runId", runId)
            .addValue("status", phase.name())
            .addValue("phase", phase.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("sessionExpired", sessionExpired)
            .addValue("failedSources", toJson(failedSources))
            .addValue("notes", truncate(notes, 2000));
        jdbc.update(
            """
                UPDATE discovery_runs
                SET status = :status,
                    phase = :phase,
                    finished_at = :finishedAt,
                    records_fetched = :recordsFetched,
                    lots_discovered = :lotsDiscovered,
                    lots_created = :lotsCreated,
                    unmappable = :unmappable,
                    out_of_scope = :outOfScope,
                    records_rejected = :recordsRejected,
                    lots_expired = :lotsExpired,
                    lots_augmented = :lotsAugmented,
                    augment_unchanged = :augmentUnchanged,
                    lots_degraded = :lotsDegraded,
                    augment_failures = :augmentFailures,
                    lots_scored = :lotsScored,
                    session_expired = :sessionExpired,
                    failed_sources = :failedSources,
                    notes = :notes
                WHERE id = :runId
                """,
            params
        );
    }

    public int failRunsStartedBefore(Instant cutoff, Instant finishedAt, String notes) {
        return jdbc.update(
            """
                UPDATE discovery_runs
                SET status = :failed,
                    phase = :failed,
                    finished_at = :finishedAt,
                    notes = :notes
                WHERE status = :running
                  AND started_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("failed", RunPhase.FAILED.name())
                .addValue("running", STATUS_RUNNING)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("notes", notes)
                .addValue("cutoff", toTimestamp(cutoff))
        );
    }

    public void insertStream(long runId, SourceStreamResult stream) {
        jdbc.update(
            """
                INSERT INTO discovery_run_streams (
                    run_id, source, stream_key, pages_fetched, records_fetched, status, failure_class, error_message
                )
                VALUES (
                    :runId, :source, :streamKey, :pagesFetched, :recordsFetched, :status, :failureClass, :errorMessage
                )
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("source", stream.source().name())
                .addValue("streamKey", truncate(stream.streamKey(), 512))
                .addValue("pagesFetched", stream.pagesFetched())
                .addValue("recordsFetched", stream.recordsFetched())
                .addValue("status", stream.status())
                .addValue("failureClass", stream.failureClass() == null ? null : stream.failureClass().name())
                .addValue("errorMessage", truncate(stream.errorMessage(), 2000))
        );
    }

    public Optional<DiscoveryRunStatus> findRun(long runId) {
        List<DiscoveryRunStatus> rows = jdbc.query(
            """
                SELECT id, started_at, finished_at, phase, records_fetched, lots_discovered, lots_created,
                       unmappable, out_of_scope, records_rejected, lots_expired, lots_augmented, augment_unchanged,
                       lots_degraded, augment_failures, lots_scored, session_expired, failed_sources, notes
                FROM discovery_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> new DiscoveryRunStatus(
                rs.getLong("id"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")),
                parsePhase(rs.getString("phase")),
                new DiscoveryRunCounters(
                    rs.getInt("records_fetched"),
                    rs.getInt("lots_discovered"),
                    rs.getInt("lots_created"),
                    rs.getInt("unmappable"),
                    rs.getInt("out_of_scope"),
                    rs.getInt("records_rejected"),
                    rs.getInt("lots_expired"),
                    rs.getInt("lots_augmented"),
                    rs.getInt("augment_unchanged"),
                    rs.getInt("lots_degraded"),
                    rs.getInt("augment_failures"),
                    rs.getInt("lots_scored")
                ),
                rs.getBoolean("session_expired"),
                parseSources(rs.getString("failed_sources")),
                rs.getString("notes"),
                List.of()
            )
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        DiscoveryRunStatus run = rows.get(0);
        return Optional.of(new DiscoveryRunStatus(
            run.runId(),
            run.startedAt(),
            run.finishedAt(),
            run.phase(),
            run.counters(),
            run.sessionExpired(),
            run.failedSources(),
            run.notes(),
            findStreams(runId)
        ));
    }

    public List<SourceStreamResult> findStreams(long runId) {
        return jdbc.query(
            """
                SELECT source, stream_key, pages_fetched, records_fetched, status, failure_class, error_message
                FROM discovery_run_streams
                WHERE run_id = :runId
                ORDER BY id
                """,
            new MapSqlParameterSource("runId", runId),
            streamRowMapper()
        );
    }

    private RowMapper<SourceStreamResult> streamRowMapper() {
        return (rs, rowNum) -> {
            String failureClass = rs.getString("failure_class");
            return new SourceStreamResult(
                SourceTag.fromKey(rs.getString("source")),
                rs.getString("stream_key"),
                rs.getInt("pages_fetched"),
                rs.getInt("records_fetched"),
                rs.getString("status"),
                failureClass == null ? null : FailureClass.valueOf(failureClass),
                rs.getString("error_message")
            );
        };
    }

    private MapSqlParameterSource counterParams(DiscoveryRunCounters counters) {
        DiscoveryRunCounters safe = counters == null ? DiscoveryRunCounters.empty() : counters;
        return new MapSqlParameterSource()
            .addValue("recordsFetched", safe.recordsFetched())
            .addValue("lotsDiscovered", safe.lotsDiscovered())
            .addValue("lotsCreated", safe.lotsCreated())
            .addValue("unmappable", safe.unmappable())
            .addValue("outOfScope", safe.outOfScope())
            .addValue("recordsRejected", safe.recordsRejected())
            .addValue("lotsExpired", safe.lotsExpired())
            .addValue("lotsAugmented", safe.lotsAugmented())
            .addValue("augmentUnchanged", safe.augmentUnchanged())
            .addValue("lotsDegraded", safe.lotsDegraded())
            .addValue("augmentFailures", safe.augmentFailures())
            .addValue("lotsScored", safe.lotsScored());
    }

    private String toJson(List<SourceTag> sources) {
        List<String> keys = new ArrayList<>();
        if (sources != null) {
            for (SourceTag source : sources) {
                keys.add(source.key());
            }
        }
        try {
            return objectMapper.writeValueAsString(keys);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not serialize failed sources", e);
        }
    }

    private List<SourceTag> parseSources(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<SourceTag> sources = new ArrayList<>();
        try {
            for (String key : objectMapper.readValue(json, STRING_LIST)) {
                SourceTag source = SourceTag.fromKey(key);
                if (source != null) {
                    sources.add(source);
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable failed_sources value {}", json);
        }
        return sources;
    }

    private RunPhase parsePhase(String raw) {
        try {
            return raw == null ? RunPhase.IDLE : RunPhase.valueOf(raw);
        } catch (IllegalArgumentException e) {
            return RunPhase.IDLE;
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
