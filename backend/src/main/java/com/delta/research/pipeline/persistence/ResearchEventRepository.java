package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.ResearchEvent;
import com.delta.research.pipeline.util.ErrorText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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

/**
 * Append-only run ledger. The identity id defines event order.
 */
@Repository
public class ResearchEventRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<ResearchEvent> eventMapper;

    public ResearchEventRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.eventMapper = (rs, rowNum) -> new ResearchEvent(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            uuid(rs, "run_id"),
            rs.getString("event_type"),
            rs.getString("status"),
            readJson(rs.getString("input_json")),
            readJson(rs.getString("output_json")),
            rs.getString("error_message"),
            instant(rs, "created_at")
        );
    }

    public void append(
        String tenantId,
        UUID runId,
        String eventType,
        String status,
        Object input,
        Object output,
        String errorMessage
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("eventType", eventType)
            .addValue("status", status)
            .addValue("inputJson", writeJson(input))
            .addValue("outputJson", writeJson(output))
            .addValue("errorMessage", ErrorText.truncate(errorMessage))
            .addValue("now", toTimestamp(Instant.now()));
        jdbc.update(
            """
                INSERT INTO research_events (
                    tenant_id, run_id, event_type, status, input_json, output_json, error_message, created_at
                )
                VALUES (:tenantId, :runId, :eventType, :status, :inputJson, :outputJson, :errorMessage, :now)
                """,
            params
        );
    }

    public List<ResearchEvent> listEvents(String tenantId, UUID runId) {
        return jdbc.query(
            """
                SELECT id, tenant_id, run_id, event_type, status, input_json, output_json, error_message, created_at
                FROM research_events
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            eventMapper
        );
    }

    public long countEvents(String tenantId, UUID runId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM research_events WHERE tenant_id = :tenantId AND run_id = :runId",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event payload", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable event payload", e);
        }
    }
}
