package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.EnrichmentAssignmentCreate;
import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.util.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

@Repository
public class EnrichmentAssignmentRepository {
    private static final String SELECT_ASSIGNMENT = """
        SELECT id, tenant_id, target_entity_type, target_canonical_id, field_key, value_json,
               value_normalized, confidence, derived_by, source_document_id, input_scope_hash,
               content_hash, created_at, updated_at
        FROM enrichment_assignments
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;
    private final RowMapper<EnrichmentAssignmentRead> assignmentMapper;

    public EnrichmentAssignmentRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
        this.assignmentMapper = (rs, rowNum) -> new EnrichmentAssignmentRead(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            rs.getString("target_entity_type"),
            uuid(rs, "target_canonical_id"),
            rs.getString("field_key"),
            readValue(rs.getString("value_json")),
            rs.getString("value_normalized"),
            rs.getDouble("confidence"),
            rs.getString("derived_by"),
            uuid(rs, "source_document_id"),
            rs.getString("input_scope_hash"),
            rs.getString("content_hash"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    /**
     * Idempotent write keyed by (tenant, target type, target, field, content hash, source document).
     * The row id is derived from that key, so both dialects converge on one row per key.
     */
    public EnrichmentAssignmentRead upsert(EnrichmentAssignmentCreate payload, String contentHash) {
        UUID id = assignmentId(payload, contentHash);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("tenantId", payload.tenantId())
            .addValue("targetEntityType", payload.targetEntityType())
            .addValue("targetCanonicalId", payload.targetCanonicalId())
            .addValue("fieldKey", payload.fieldKey())
            .addValue("valueJson", CanonicalJson.write(payload.value()))
            .addValue("valueNormalized", payload.valueNormalized())
            .addValue("confidence", payload.confidence())
            .addValue("derivedBy", payload.derivedBy())
            .addValue("sourceDocumentId", payload.sourceDocumentId())
            .addValue("inputScopeHash", payload.inputScopeHash())
            .addValue("contentHash", contentHash)
            .addValue("now", toTimestamp(Instant.now()));

        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO enrichment_assignments (
                        id, tenant_id, target_entity_type, target_canonical_id, field_key, value_json,
                        value_normalized, confidence, derived_by, source_document_id, input_scope_hash,
                        content_hash, created_at, updated_at
                    )
                    VALUES (
                        :id, :tenantId, :targetEntityType, :targetCanonicalId, :fieldKey, :valueJson,
                        :valueNormalized, :confidence, :derivedBy, :sourceDocumentId, :inputScopeHash,
                        :contentHash, :now, :now
                    )
                    ON CONFLICT (tenant_id, target_entity_type, target_canonical_id, field_key, content_hash, source_document_id)
                    DO UPDATE SET
                        value_json = EXCLUDED.value_json,
                        value_normalized = EXCLUDED.value_normalized,
                        confidence = EXCLUDED.confidence,
                        derived_by = EXCLUDED.derived_by,
                        input_scope_hash = EXCLUDED.input_scope_hash,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
        } else {
            jdbc.update(
                """
                    MERGE INTO enrichment_assignments (
                        id, tenant_id, target_entity_type, target_canonical_id, field_key, value_json,
                        value_normalized, confidence, derived_by, source_document_id, input_scope_hash,
                        content_hash, updated_at
                    )
                    KEY(tenant_id, target_entity_type, target_canonical_id, field_key, content_hash, source_document_id)
                    VALUES (
                        :id, :tenantId, :targetEntityType, :targetCanonicalId, :fieldKey, :valueJson,
                        :valueNormalized, :confidence, :derivedBy, :sourceDocumentId, :inputScopeHash,
                        :contentHash, :now
                    )
                    """,
                params
            );
        }
        return findByKey(payload, contentHash);
    }

    public List<EnrichmentAssignmentRead> listForTarget(String tenantId, String targetEntityType, UUID targetId) {
        return jdbc.query(
            SELECT_ASSIGNMENT + """
                WHERE tenant_id = :tenantId
                  AND target_entity_type = :targetEntityType
                  AND target_canonical_id = :targetId
                ORDER BY field_key, source_document_id, content_hash
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("targetEntityType", targetEntityType)
                .addValue("targetId", targetId),
            assignmentMapper
        );
    }

    public List<EnrichmentAssignmentRead> listForTargets(
        String tenantId,
        String targetEntityType,
        Collection<UUID> targetIds
    ) {
        if (targetIds == null || targetIds.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            SELECT_ASSIGNMENT + """
                WHERE tenant_id = :tenantId
                  AND target_entity_type = :targetEntityType
                  AND target_canonical_id IN (:targetIds)
                ORDER BY target_canonical_id, field_key, source_document_id, content_hash
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("targetEntityType", targetEntityType)
                .addValue("targetIds", targetIds),
            assignmentMapper
        );
    }

    public long countForTenant(String tenantId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM enrichment_assignments WHERE tenant_id = :tenantId",
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private EnrichmentAssignmentRead findByKey(EnrichmentAssignmentCreate payload, String contentHash) {
        List<EnrichmentAssignmentRead> rows = jdbc.query(
            SELECT_ASSIGNMENT + """
                WHERE tenant_id = :tenantId
                  AND target_entity_type = :targetEntityType
                  AND target_canonical_id = :targetCanonicalId
                  AND field_key = :fieldKey
                  AND content_hash = :contentHash
                  AND source_document_id = :sourceDocumentId
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", payload.tenantId())
                .addValue("targetEntityType", payload.targetEntityType())
                .addValue("targetCanonicalId", payload.targetCanonicalId())
                .addValue("fieldKey", payload.fieldKey())
                .addValue("contentHash", contentHash)
                .addValue("sourceDocumentId", payload.sourceDocumentId()),
            assignmentMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private UUID assignmentId(EnrichmentAssignmentCreate payload, String contentHash) {
        String key = String.join(
            "|",
            payload.tenantId(),
            payload.targetEntityType(),
            String.valueOf(payload.targetCanonicalId()),
            payload.fieldKey(),
            contentHash,
            String.valueOf(payload.sourceDocumentId())
        );
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode readValue(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable assignment value", e);
        }
    }
}
