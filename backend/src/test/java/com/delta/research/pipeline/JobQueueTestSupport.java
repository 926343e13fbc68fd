package com.delta.research.pipeline;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * The job queue is shared by every test using the in-memory database; tests that claim jobs park
 * whatever other tests left open so they only ever see their own work.
 */
public final class JobQueueTestSupport {

    private JobQueueTestSupport() {
    }

    public static void parkOpenJobs(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.update(
            "UPDATE research_jobs SET status = 'cancelled', active_key = NULL WHERE status IN ('queued', 'running')"
        );
    }
}
