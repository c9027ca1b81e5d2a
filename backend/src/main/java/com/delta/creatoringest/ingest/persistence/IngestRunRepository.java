package com.delta.creatoringest.ingest.persistence;

import com.delta.creatoringest.ingest.model.IngestRunStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One row per ingest run in {@code ingest_runs}.
 */
@Repository
public class IngestRunRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public IngestRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertRun(Instant startedAt, String status, int resumedFrom, int totalTasks, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("resumedFrom", resumedFrom)
            .addValue("totalTasks", totalTasks)
            .addValue("notes", notes)
            .addValue("lastHeartbeatAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO ingest_runs (
                    started_at,
                    status,
                    resumed_from,
                    checkpoint_index,
                    total_tasks,
                    tasks_completed,
                    tasks_failed,
                    records_persisted,
                    notes,
                    last_heartbeat_at
                )
                VALUES (
                    :startedAt,
                    :status,
                    :resumedFrom,
                    :resumedFrom,
                    :totalTasks,
                    0,
                    0,
                    0,
                    :notes,
                    :lastHeartbeatAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM ingest_runs
                    WHERE started_at = :startedAt
                      AND status = :status
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert ingest run");
            }
        }
        return id;
    }

    public void updateRunProgress(long runId, int checkpoint, int tasksCompleted, int tasksFailed, int recordsPersisted) {
        jdbc.update(
            """
                UPDATE ingest_runs
                SET checkpoint_index = :checkpoint,
                    tasks_completed = :tasksCompleted,
                    tasks_failed = :tasksFailed,
                    records_persisted = :recordsPersisted,
                    last_heartbeat_at = :now
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("checkpoint", checkpoint)
                .addValue("tasksCompleted", tasksCompleted)
                .addValue("tasksFailed", tasksFailed)
                .addValue("recordsPersisted", recordsPersisted)
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    public void completeRun(long runId, Instant finishedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", notes);
        jdbc.update(
            """
                UPDATE ingest_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    last_heartbeat_at = :finishedAt
                WHERE id = :runId
                """,
            params
        );
    }

    public Optional<IngestRunStatus> findLatestRun() {
        List<IngestRunStatus> rows = jdbc.query(
            """
                SELECT id, started_at, finished_at, status, resumed_from, checkpoint_index,
                       tasks_completed, records_persisted, tasks_failed, notes
                FROM ingest_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            runStatusRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<IngestRunStatus> findRun(long runId) {
        List<IngestRunStatus> rows = jdbc.query(
            """
                SELECT id, started_at, finished_at, status, resumed_from, checkpoint_index,
                       tasks_completed, records_persisted, tasks_failed, notes
                FROM ingest_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            runStatusRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private RowMapper<IngestRunStatus> runStatusRowMapper() {
        return (rs, rowNum) -> new IngestRunStatus(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("status"),
            rs.getInt("resumed_from"),
            rs.getInt("checkpoint_index"),
            rs.getInt("tasks_completed"),
            rs.getInt("records_persisted"),
            rs.getInt("tasks_failed"),
            rs.getString("notes")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
