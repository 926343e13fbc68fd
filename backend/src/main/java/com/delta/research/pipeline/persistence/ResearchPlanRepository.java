package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.ResearchPlan;
import com.delta.research.pipeline.model.ResearchStep;
import com.delta.research.pipeline.model.StepStatus;
import com.delta.research.pipeline.util.ErrorText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

@Repository
public class ResearchPlanRepository {
    private static final TypeReference<List<String>> STEP_KEYS = new TypeReference<>() {};
    private static final String STEP_COLUMNS = """
        id, tenant_id, run_id, plan_id, step_key, step_order, status, attempt_count, max_attempts,
        next_retry_at, input_json, output_json, last_error, started_at, finished_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;
    private final RowMapper<ResearchPlan> planMapper;
    private final RowMapper<ResearchStep> stepMapper;

    public ResearchPlanRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
        this.planMapper = (rs, rowNum) -> new ResearchPlan(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            uuid(rs, "run_id"),
            rs.getInt("version"),
            readStepKeys(rs.getString("plan_json")),
            instant(rs, "locked_at"),
            instant(rs, "created_at")
        );
        this.stepMapper = (rs, rowNum) -> new ResearchStep(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            uuid(rs, "run_id"),
            uuid(rs, "plan_id"),
            rs.getString("step_key"),
            rs.getInt("step_order"),
            StepStatus.fromValue(rs.getString("status")),
            rs.getInt("attempt_count"),
            rs.getInt("max_attempts"),
            instant(rs, "next_retry_at"),
            readJson(rs.getString("input_json")),
            readJson(rs.getString("output_json")),
            rs.getString("last_error"),
            instant(rs, "started_at"),
            instant(rs, "finished_at")
        );
    }

    public ResearchPlan ensurePlan(String tenantId, UUID runId, int version, List<String> stepKeys) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("version", version)
            .addValue("planJson", writeJson(Map.of("version", version, "steps", stepKeys)))
            .addValue("now", toTimestamp(Instant.now()));
        JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO research_plans (id, tenant_id, run_id, version, plan_json, created_at)
                VALUES (:id, :tenantId, :runId, :version, :planJson, :now)""",
            params
        );
        return findPlan(tenantId, runId);
    }

    public ResearchPlan findPlan(String tenantId, UUID runId) {
        List<ResearchPlan> rows = jdbc.query(
            """
                SELECT id, tenant_id, run_id, version, plan_json, locked_at, created_at
                FROM research_plans
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            planMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Reads the plan row and holds its row lock until the surrounding transaction ends, so
     * {@link #lockPlan} cannot slip in between a check and the write that depends on it.
     */
    public ResearchPlan findPlanForUpdate(String tenantId, UUID runId) {
        List<ResearchPlan> rows = jdbc.query(
            """
                SELECT id, tenant_id, run_id, version, plan_json, locked_at, created_at
                FROM research_plans
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                FOR UPDATE
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            planMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Sets {@code locked_at} the first time only. Returns true when this call locked the plan.
     */
    public boolean lockPlan(UUID planId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_plans
                SET locked_at = :now
                WHERE id = :id
                  AND locked_at IS NULL
                """,
            new MapSqlParameterSource().addValue("id", planId).addValue("now", toTimestamp(now))
        ) > 0;
    }

    public boolean insertStepIfAbsent(
        String tenantId,
        UUID runId,
        UUID planId,
        String stepKey,
        int stepOrder,
        int maxAttempts,
        Object input
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("planId", planId)
            .addValue("stepKey", stepKey)
            .addValue("stepOrder", stepOrder)
            .addValue("maxAttempts", Math.max(1, maxAttempts))
            .addValue("inputJson", writeJson(input))
            .addValue("now", toTimestamp(now));
        return JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO research_steps (
                    id, tenant_id, run_id, plan_id, step_key, step_order, status, attempt_count,
                    max_attempts, input_json, created_at, updated_at
                )
                VALUES (
                    :id, :tenantId, :runId, :planId, :stepKey, :stepOrder, 'pending', 0,
                    :maxAttempts, :inputJson, :now, :now
                )""",
            params
        );
    }

    public List<ResearchStep> listSteps(String tenantId, UUID runId) {
        return jdbc.query(
            "SELECT " + STEP_COLUMNS + """
                FROM research_steps
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                ORDER BY step_order, step_key
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            stepMapper
        );
    }

    public ResearchStep findStep(UUID stepId) {
        List<ResearchStep> rows = jdbc.query(
            "SELECT " + STEP_COLUMNS + " FROM research_steps WHERE id = :id",
            new MapSqlParameterSource().addValue("id", stepId),
            stepMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Conditional claim: moves a pending or retryable failed step to running and counts the attempt.
     */
    public boolean claimStep(UUID stepId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_steps
                SET status = 'running',
                    attempt_count = attempt_count + 1,
                    next_retry_at = NULL,
                    started_at = :now,
                    finished_at = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('pending', 'failed')
                  AND attempt_count < max_attempts
                """,
            new MapSqlParameterSource().addValue("id", stepId).addValue("now", toTimestamp(now))
        ) == 1;
    }

    public void markStepSucceeded(UUID stepId, Object output) {
        finishStep(stepId, StepStatus.SUCCEEDED, output);
    }

    public void markStepSkipped(UUID stepId, Object output) {
        finishStep(stepId, StepStatus.SKIPPED, output);
    }

    public void markStepCancelled(UUID stepId) {
        finishStep(stepId, StepStatus.CANCELLED, null);
    }

    public void markStepFailed(UUID stepId, String error, Instant nextRetryAt, Object output) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE research_steps
                SET status = 'failed',
                    next_retry_at = :nextRetryAt,
                    last_error = :lastError,
                    output_json = COALESCE(:outputJson, output_json),
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", stepId)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt))
                .addValue("lastError", ErrorText.truncate(error))
                .addValue("outputJson", writeJson(output))
                .addValue("now", toTimestamp(now))
        );
    }

    public int cancelOpenSteps(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_steps
                SET status = 'cancelled',
                    next_retry_at = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND status IN ('pending', 'running', 'failed')
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("now", toTimestamp(now))
        );
    }

    public int resetStepsForRetry(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_steps
                SET status = 'pending',
                    attempt_count = 0,
                    next_retry_at = NULL,
                    last_error = NULL,
                    started_at = NULL,
                    finished_at = NULL,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND status IN ('failed', 'cancelled')
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("now", toTimestamp(now))
        );
    }

    public int resetRunningSteps(String tenantId, UUID runId, Instant nextRetryAt, String error) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_steps
                SET status = 'failed',
                    next_retry_at = :nextRetryAt,
                    last_error = :lastError,
                    finished_at = :now,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND status = 'running'
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt))
                .addValue("lastError", ErrorText.truncate(error))
                .addValue("now", toTimestamp(now))
        );
    }

    private void finishStep(UUID stepId, StepStatus status, Object output) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE research_steps
                SET status = :status,
                    next_retry_at = NULL,
                    last_error = NULL,
                    output_json = COALESCE(:outputJson, output_json),
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", stepId)
                .addValue("status", status.value())
                .addValue("outputJson", writeJson(output))
                .addValue("now", toTimestamp(now))
        );
    }

    private List<String> readStepKeys(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode steps = objectMapper.readTree(json).path("steps");
            if (!steps.isArray()) {
                return List.of();
            }
            return List.copyOf(objectMapper.convertValue(steps, STEP_KEYS));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable plan json", e);
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize step payload", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable step payload", e);
        }
    }
}
