package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.JobStatus;
import com.delta.research.pipeline.model.ResearchJob;
import com.delta.research.pipeline.util.ErrorText;
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

/**
 * Durable job queue. At most one queued/running job exists per (tenant, run, job type): the
 * {@code active_key} column carries the job type only while the job is active and is covered by a
 * unique constraint.
 */
@Repository
public class ResearchJobRepository {
    private static final String JOB_COLUMNS = """
        id, tenant_id, run_id, job_type, status, attempt_count, max_attempts, next_retry_at,
        locked_at, locked_by, cancel_requested, last_error, created_at, updated_at
        """;
    private static final int H2_CLAIM_CANDIDATES = 5;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final RowMapper<ResearchJob> jobMapper = (rs, rowNum) -> new ResearchJob(
        uuid(rs, "id"),
        rs.getString("tenant_id"),
        uuid(rs, "run_id"),
        rs.getString("job_type"),
        JobStatus.fromValue(rs.getString("status")),
        rs.getInt("attempt_count"),
        rs.getInt("max_attempts"),
        instant(rs, "next_retry_at"),
        instant(rs, "locked_at"),
        rs.getString("locked_by"),
        rs.getBoolean("cancel_requested"),
        rs.getString("last_error"),
        instant(rs, "created_at"),
        instant(rs, "updated_at")
    );

    public ResearchJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    /**
     * Enqueues a job unless one is already active for the run, and returns the active job either way.
     */
    public ResearchJob enqueue(String tenantId, UUID runId, String jobType, int maxAttempts) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("jobType", jobType)
            .addValue("maxAttempts", Math.max(1, maxAttempts))
            .addValue("now", toTimestamp(now));
        JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO research_jobs (
                    id, tenant_id, run_id, job_type, status, active_key, attempt_count, max_attempts,
                    cancel_requested, created_at, updated_at
                )
                VALUES (
                    :id, :tenantId, :runId, :jobType, 'queued', :jobType, 0, :maxAttempts,
                    FALSE, :now, :now
                )""",
            params
        );
        return findActiveJob(tenantId, runId, jobType);
    }

    public ResearchJob claimNextJob(String workerId) {
        String safeWorker = (workerId == null || workerId.isBlank()) ? "unknown" : workerId.trim();
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("workerId", safeWorker);
        if (postgres) {
            List<ResearchJob> claimed = jdbc.query(
                """
                    WITH candidate AS (
                        SELECT id
                        FROM research_jobs
                        WHERE status = 'queued'
                          AND attempt_count < max_attempts
                          AND (next_retry_at IS NULL OR next_retry_at <= :now)
                        ORDER BY created_at ASC, id ASC
                        FOR UPDATE SKIP LOCKED
                        LIMIT 1
                    )
                    UPDATE research_jobs j
                    SET status = 'running',
                        locked_at = :now,
                        locked_by = :workerId,
                        updated_at = :now
                    FROM candidate
                    WHERE j.id = candidate.id
                    RETURNING j.id, j.tenant_id, j.run_id, j.job_type, j.status, j.attempt_count,
                              j.max_attempts, j.next_retry_at, j.locked_at, j.locked_by,
                              j.cancel_requested, j.last_error, j.created_at, j.updated_at
                    """,
                params,
                jobMapper
            );
            return claimed.isEmpty() ? null : claimed.get(0);
        }

        List<UUID> candidates = jdbc.queryForList(
            """
                SELECT id
                FROM research_jobs
                WHERE status = 'queued'
                  AND attempt_count < max_attempts
                  AND (next_retry_at IS NULL OR next_retry_at <= :now)
                ORDER BY created_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource(params.getValues()).addValue("limit", H2_CLAIM_CANDIDATES),
            UUID.class
        );
        for (UUID candidate : candidates) {
            int updated = jdbc.update(
                """
                    UPDATE research_jobs
                    SET status = 'running',
                        locked_at = :now,
                        locked_by = :workerId,
                        updated_at = :now
                    WHERE id = :id
                      AND status = 'queued'
                    """,
                new MapSqlParameterSource(params.getValues()).addValue("id", candidate)
            );
            if (updated == 1) {
                return findJob(candidate);
            }
        }
        return null;
    }

    public ResearchJob findJob(UUID jobId) {
        List<ResearchJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM research_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", jobId),
            jobMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public ResearchJob findActiveJob(String tenantId, UUID runId, String jobType) {
        List<ResearchJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM research_jobs
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND active_key = :jobType
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("jobType", jobType),
            jobMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ResearchJob> listJobs(String tenantId, UUID runId) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM research_jobs
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            jobMapper
        );
    }

    public void markSucceeded(UUID jobId) {
        finish(jobId, JobStatus.SUCCEEDED, null);
    }

    public void markCancelled(UUID jobId) {
        finish(jobId, JobStatus.CANCELLED, null);
    }

    /**
     * Cancels a job nobody has claimed yet. Returns false when a worker got there first.
     */
    public boolean cancelQueuedJob(UUID jobId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_jobs
                SET status = 'cancelled',
                    active_key = NULL,
                    cancel_requested = TRUE,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'queued'
                """,
            new MapSqlParameterSource().addValue("id", jobId).addValue("now", toTimestamp(now))
        ) == 1;
    }

    /**
     * Consumes one attempt in a single statement. Returns the resulting status: {@code queued} while
     * attempts remain, {@code failed} once they are exhausted or when {@code terminal} is set. Jobs that
     * already reached a final state are left alone and their status is returned as is.
     */
    public JobStatus markFailed(UUID jobId, String error, int backoffSeconds, boolean terminal) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("terminal", terminal)
            .addValue("nextRetryAt", toTimestamp(now.plusSeconds(Math.max(0, backoffSeconds))))
            .addValue("lastError", ErrorText.truncate(error))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE research_jobs
                SET status = CASE WHEN :terminal OR attempt_count + 1 >= max_attempts
                                  THEN 'failed' ELSE 'queued' END,
                    active_key = CASE WHEN :terminal OR attempt_count + 1 >= max_attempts
                                      THEN NULL ELSE job_type END,
                    next_retry_at = CASE WHEN :terminal OR attempt_count + 1 >= max_attempts
                                         THEN NULL ELSE :nextRetryAt END,
                    attempt_count = attempt_count + 1,
                    locked_at = NULL,
                    locked_by = NULL,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('queued', 'running')
                """,
            params
        );
        ResearchJob job = findJob(jobId);
        return job == null ? JobStatus.FAILED : job.status();
    }

    /**
     * Releases the lock without consuming an attempt; used when every remaining step waits on backoff.
     */
    public void requeue(UUID jobId, Instant nextRetryAt) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE research_jobs
                SET status = 'queued',
                    next_retry_at = :nextRetryAt,
                    locked_at = NULL,
                    locked_by = NULL,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt))
                .addValue("now", toTimestamp(now))
        );
    }

    public int requestCancel(String tenantId, UUID runId) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE research_jobs
                SET cancel_requested = TRUE,
                    updated_at = :now
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND status IN ('queued', 'running')
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("now", toTimestamp(now))
        );
    }

    public boolean isCancelRequested(UUID jobId) {
        List<Boolean> rows = jdbc.queryForList(
            "SELECT cancel_requested FROM research_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", jobId),
            Boolean.class
        );
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0));
    }

    public List<ResearchJob> findStaleRunningJobs(Instant lockedBefore) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM research_jobs
                WHERE status = 'running'
                  AND locked_at < :lockedBefore
                ORDER BY locked_at, id
                """,
            new MapSqlParameterSource().addValue("lockedBefore", toTimestamp(lockedBefore)),
            jobMapper
        );
    }

    public long countByStatus(JobStatus status) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM research_jobs WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.value()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private void finish(UUID jobId, JobStatus status, String error) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE research_jobs
                SET status = :status,
                    active_key = NULL,
                    next_retry_at = NULL,
                    locked_at = NULL,
                    locked_by = NULL,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("status", status.value())
                .addValue("lastError", ErrorText.truncate(error))
                .addValue("now", toTimestamp(now))
        );
    }
}
