package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceMeta;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.util.ErrorText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.integerOrNull;
import static com.delta.research.pipeline.persistence.JdbcSupport.toInstant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

@Repository
public class SourceDocumentRepository {
    private static final String SELECT_SOURCE = """
        SELECT id, tenant_id, run_id, source_type, status, title, url, url_normalized, content_text,
               content_bytes, mime_type, content_hash, attempt_count, max_attempts, next_retry_at,
               last_error, http_status_code, http_final_url, canonical_source_id, meta_json,
               fetched_at, created_at, updated_at
        FROM source_documents
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<SourceDocument> sourceMapper;

    public SourceDocumentRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.sourceMapper = (rs, rowNum) -> new SourceDocument(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            uuid(rs, "run_id"),
            SourceType.fromValue(rs.getString("source_type")),
            SourceStatus.fromValue(rs.getString("status")),
            rs.getString("title"),
            rs.getString("url"),
            rs.getString("url_normalized"),
            rs.getString("content_text"),
            rs.getBytes("content_bytes"),
            rs.getString("mime_type"),
            rs.getString("content_hash"),
            rs.getInt("attempt_count"),
            rs.getInt("max_attempts"),
            instant(rs, "next_retry_at"),
            rs.getString("last_error"),
            integerOrNull(rs, "http_status_code"),
            rs.getString("http_final_url"),
            uuid(rs, "canonical_source_id"),
            readMeta(rs.getString("meta_json")),
            instant(rs, "fetched_at"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    public SourceDocument insertSource(
        String tenantId,
        UUID runId,
        SourceType sourceType,
        SourceStatus status,
        String title,
        String url,
        String urlNormalized,
        String contentText,
        byte[] contentBytes,
        String mimeType,
        int maxAttempts
    ) {
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("sourceType", sourceType.value())
            .addValue("status", status.value())
            .addValue("title", title)
            .addValue("url", url)
            .addValue("urlNormalized", urlNormalized)
            .addValue("contentText", contentText)
            .addValue("contentBytes", contentBytes, Types.BINARY)
            .addValue("mimeType", mimeType)
            .addValue("maxAttempts", Math.max(1, maxAttempts))
            .addValue("metaJson", writeMeta(SourceMeta.empty()))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                INSERT INTO source_documents (
                    id, tenant_id, run_id, source_type, status, title, url, url_normalized,
                    content_text, content_bytes, mime_type, attempt_count, max_attempts, meta_json,
                    created_at, updated_at
                )
                VALUES (
                    :id, :tenantId, :runId, :sourceType, :status, :title, :url, :urlNormalized,
                    :contentText, :contentBytes, :mimeType, 0, :maxAttempts, :metaJson,
                    :now, :now
                )
                """,
            params
        );
        return findSource(tenantId, id);
    }

    public SourceDocument findSource(String tenantId, UUID sourceId) {
        List<SourceDocument> rows = jdbc.query(
            SELECT_SOURCE + " WHERE tenant_id = :tenantId AND id = :id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", sourceId),
            sourceMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<SourceDocument> listSources(String tenantId, UUID runId) {
        return jdbc.query(
            SELECT_SOURCE + " WHERE tenant_id = :tenantId AND run_id = :runId ORDER BY created_at, id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            sourceMapper
        );
    }

    public List<SourceDocument> listSources(String tenantId, UUID runId, SourceType sourceType) {
        return jdbc.query(
            SELECT_SOURCE + """
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND source_type = :sourceType
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("sourceType", sourceType.value()),
            sourceMapper
        );
    }

    public boolean hasSources(String tenantId, UUID runId, SourceType sourceType) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM source_documents
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND source_type = :sourceType
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("sourceType", sourceType.value()),
            Long.class
        );
        return count != null && count > 0;
    }

    /**
     * URL sources that may be fetched now: not yet fetched, attempts left and backoff elapsed.
     */
    public List<SourceDocument> listFetchableUrlSources(String tenantId, UUID runId, Instant now) {
        return jdbc.query(
            SELECT_SOURCE + """
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND source_type = 'url'
                  AND status IN ('queued', 'failed', 'fetch_failed')
                  AND attempt_count < max_attempts
                  AND (next_retry_at IS NULL OR next_retry_at <= :now)
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("now", toTimestamp(now)),
            sourceMapper
        );
    }

    /**
     * Earliest retry time among URL sources still waiting on backoff, or null when none wait.
     */
    public Instant nextUrlRetryAt(String tenantId, UUID runId) {
        Timestamp next = jdbc.queryForObject(
            """
                SELECT MIN(next_retry_at)
                FROM source_documents
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND source_type = 'url'
                  AND status IN ('queued', 'failed', 'fetch_failed')
                  AND attempt_count < max_attempts
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            Timestamp.class
        );
        return toInstant(next);
    }

    public int countRetryableUrlSources(String tenantId, UUID runId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM source_documents
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND source_type = 'url'
                  AND status IN ('queued', 'failed', 'fetch_failed')
                  AND attempt_count < max_attempts
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void markFetching(UUID sourceId) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE source_documents
                SET status = 'fetching',
                    attempt_count = attempt_count + 1,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", sourceId).addValue("now", toTimestamp(now))
        );
    }

    /**
     * Stores acquired content and moves the source to {@code fetched}.
     */
    public void recordContent(
        UUID sourceId,
        String urlNormalized,
        String title,
        String contentText,
        byte[] contentBytes,
        String mimeType,
        String contentHash,
        Integer httpStatusCode,
        String httpFinalUrl,
        SourceMeta meta
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", sourceId)
            .addValue("urlNormalized", urlNormalized)
            .addValue("title", title)
            .addValue("contentText", contentText)
            .addValue("contentBytes", contentBytes, Types.BINARY)
            .addValue("mimeType", mimeType)
            .addValue("contentHash", contentHash)
            .addValue("httpStatusCode", httpStatusCode, Types.INTEGER)
            .addValue("httpFinalUrl", httpFinalUrl)
            .addValue("metaJson", writeMeta(meta))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE source_documents
                SET status = 'fetched',
                    url_normalized = COALESCE(:urlNormalized, url_normalized),
                    title = COALESCE(title, :title),
                    content_text = :contentText,
                    content_bytes = COALESCE(:contentBytes, content_bytes),
                    mime_type = COALESCE(:mimeType, mime_type),
                    content_hash = :contentHash,
                    http_status_code = :httpStatusCode,
                    http_final_url = :httpFinalUrl,
                    next_retry_at = NULL,
                    last_error = NULL,
                    meta_json = :metaJson,
                    fetched_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Records a failed acquisition. A null {@code nextRetryAt} marks the failure terminal: the
     * source's attempts are used up so it never returns to a fetch batch.
     */
    public void recordFailure(
        UUID sourceId,
        SourceStatus status,
        String error,
        Instant nextRetryAt,
        Integer httpStatusCode,
        String httpFinalUrl,
        SourceMeta meta
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", sourceId)
            .addValue("status", status.value())
            .addValue("lastError", ErrorText.truncate(error))
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("terminal", nextRetryAt == null)
            .addValue("httpStatusCode", httpStatusCode, Types.INTEGER)
            .addValue("httpFinalUrl", httpFinalUrl)
            .addValue("metaJson", writeMeta(meta))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE source_documents
                SET status = :status,
                    last_error = :lastError,
                    next_retry_at = :nextRetryAt,
                    attempt_count = CASE WHEN :terminal THEN max_attempts ELSE attempt_count END,
                    http_status_code = :httpStatusCode,
                    http_final_url = :httpFinalUrl,
                    meta_json = :metaJson,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void markProcessed(UUID sourceId, SourceMeta meta) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE source_documents
                SET status = 'processed',
                    last_error = NULL,
                    meta_json = :metaJson,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("metaJson", writeMeta(meta))
                .addValue("now", toTimestamp(now))
        );
    }

    public void recordProcessingError(UUID sourceId, String error, SourceMeta meta) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE source_documents
                SET last_error = :lastError,
                    meta_json = :metaJson,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("lastError", ErrorText.truncate(error))
                .addValue("metaJson", writeMeta(meta))
                .addValue("now", toTimestamp(now))
        );
    }

    public void updateMeta(UUID sourceId, SourceMeta meta) {
        Instant now = Instant.now();
        jdbc.update(
            "UPDATE source_documents SET meta_json = :metaJson, updated_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("metaJson", writeMeta(meta))
                .addValue("now", toTimestamp(now))
        );
    }

    /**
     * First other non-duplicate source of the run, in creation order, already holding the content hash.
     */
    public SourceDocument findFirstWithContentHash(String tenantId, UUID runId, String contentHash, UUID excludeId) {
        List<SourceDocument> rows = jdbc.query(
            SELECT_SOURCE + """
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND content_hash = :contentHash
                  AND id <> :excludeId
                  AND canonical_source_id IS NULL
                ORDER BY created_at, id
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("contentHash", contentHash)
                .addValue("excludeId", excludeId),
            sourceMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void linkContentDuplicate(UUID sourceId, UUID canonicalSourceId, SourceMeta meta) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE source_documents
                SET status = 'processed',
                    canonical_source_id = :canonicalSourceId,
                    meta_json = :metaJson,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("canonicalSourceId", canonicalSourceId)
                .addValue("metaJson", writeMeta(meta))
                .addValue("now", toTimestamp(now))
        );
    }

    private String writeMeta(SourceMeta meta) {
        try {
            return objectMapper.writeValueAsString(meta == null ? SourceMeta.empty() : meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize source meta", e);
        }
    }

    private SourceMeta readMeta(String json) {
        if (json == null || json.isBlank()) {
            return SourceMeta.empty();
        }
        try {
            return objectMapper.readValue(json, SourceMeta.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable source meta", e);
        }
    }
}
