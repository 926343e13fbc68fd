package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.RunStatus;
import com.delta.research.pipeline.util.ErrorText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

@Repository
public class ResearchRunRepository {
    private static final String SELECT_RUN = """
        SELECT id, tenant_id, name, status, config_json, started_at, finished_at,
               last_error, created_at, updated_at
        FROM research_runs
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<ResearchRun> runMapper;

    public ResearchRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.runMapper = (rs, rowNum) -> new ResearchRun(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            rs.getString("name"),
            RunStatus.fromValue(rs.getString("status")),
            readConfig(rs.getString("config_json")),
            instant(rs, "started_at"),
            instant(rs, "finished_at"),
            rs.getString("last_error"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    public ResearchRun insertRun(String tenantId, String name, RunConfig config) {
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("tenantId", tenantId)
            .addValue("name", name)
            .addValue("status", RunStatus.QUEUED.value())
            .addValue("configJson", writeConfig(config))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                INSERT INTO research_runs (id, tenant_id, name, status, config_json, created_at, updated_at)
                VALUES (:id, :tenantId, :name, :status, :configJson, :now, :now)
                """,
            params
        );
        return findRun(tenantId, id);
    }

    public ResearchRun findRun(String tenantId, UUID runId) {
        List<ResearchRun> rows = jdbc.query(
            SELECT_RUN + " WHERE tenant_id = :tenantId AND id = :runId",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ResearchRun> listRuns(String tenantId, int limit) {
        return jdbc.query(
            SELECT_RUN + " WHERE tenant_id = :tenantId ORDER BY created_at DESC, id LIMIT :limit",
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("limit", Math.max(1, Math.min(limit, 500))),
            runMapper
        );
    }

    /**
     * Moves a queued or running run to running. Never overwrites a cancel request or a terminal state.
     */
    public boolean markRunning(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_runs
                SET status = 'running',
                    started_at = COALESCE(started_at, :now),
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND id = :runId
                  AND status IN ('queued', 'running')
                """,
            runParams(tenantId, runId, now)
        ) > 0;
    }

    public boolean markSucceeded(String tenantId, UUID runId) {
        return finish(tenantId, runId, RunStatus.SUCCEEDED, null, "('queued', 'running')");
    }

    public boolean markFailed(String tenantId, UUID runId, String error) {
        return finish(tenantId, runId, RunStatus.FAILED, error, "('queued', 'running')");
    }

    public boolean markCancelled(String tenantId, UUID runId) {
        return finish(tenantId, runId, RunStatus.CANCELLED, null, "('queued', 'running', 'cancel_requested')");
    }

    public boolean requestCancel(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_runs
                SET status = 'cancel_requested',
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND id = :runId
                  AND status IN ('queued', 'running')
                """,
            runParams(tenantId, runId, now)
        ) > 0;
    }

    public boolean resetForRetry(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_runs
                SET status = 'queued',
                    finished_at = NULL,
                    last_error = NULL,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND id = :runId
                  AND status = 'failed'
                """,
            runParams(tenantId, runId, now)
        ) > 0;
    }

    public boolean isCancelRequested(String tenantId, UUID runId) {
        List<String> statuses = jdbc.queryForList(
            "SELECT status FROM research_runs WHERE tenant_id = :tenantId AND id = :runId",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            String.class
        );
        if (statuses.isEmpty()) {
            return false;
        }
        RunStatus status = RunStatus.fromValue(statuses.get(0));
        return status == RunStatus.CANCEL_REQUESTED || status == RunStatus.CANCELLED;
    }

    private boolean finish(String tenantId, UUID runId, RunStatus status, String error, String allowedFrom) {
        Instant now = Instant.now();
        MapSqlParameterSource params = runParams(tenantId, runId, now)
            .addValue("status", status.value())
            .addValue("lastError", ErrorText.truncate(error));
        return jdbc.update(
            """
                UPDATE research_runs
                SET status = :status,
                    finished_at = :now,
                    last_error = :lastError,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND id = :runId
                  AND status IN
                """ + " " + allowedFrom,
            params
        ) > 0;
    }

    private MapSqlParameterSource runParams(String tenantId, UUID runId, Instant now) {
        return new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("now", toTimestamp(now));
    }

    private String writeConfig(RunConfig config) {
        try {
            return objectMapper.writeValueAsString(config == null ? RunConfig.empty() : config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize run config", e);
        }
    }

    private RunConfig readConfig(String json) {
        if (json == null || json.isBlank()) {
            return RunConfig.empty();
        }
        try {
            return objectMapper.readValue(json, RunConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable run config", e);
        }
    }
}
