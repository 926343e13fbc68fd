package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.ExecutiveProspect;
import com.delta.research.pipeline.model.ProspectEvidence;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

/**
 * Run-scoped raw entities (company prospects and executives) with their evidence rows.
 */
@Repository
public class ProspectRepository {
    private static final String SELECT_PROSPECT = """
        SELECT id, tenant_id, run_id, name_raw, name_normalized, website_url, hq_country,
               relevance_score, evidence_score, status, created_at
        FROM company_prospects
        """;
    private static final String SELECT_EXECUTIVE = """
        SELECT id, tenant_id, run_id, company_prospect_id, name_raw, name_normalized, title, email,
               linkedin_url, source_document_id, created_at
        FROM executive_prospects
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final RowMapper<CompanyProspect> prospectMapper = (rs, rowNum) -> new CompanyProspect(
        uuid(rs, "id"),
        rs.getString("tenant_id"),
        uuid(rs, "run_id"),
        rs.getString("name_raw"),
        rs.getString("name_normalized"),
        rs.getString("website_url"),
        rs.getString("hq_country"),
        rs.getDouble("relevance_score"),
        rs.getDouble("evidence_score"),
        rs.getString("status"),
        instant(rs, "created_at")
    );
    private final RowMapper<ExecutiveProspect> executiveMapper = (rs, rowNum) -> new ExecutiveProspect(
        uuid(rs, "id"),
        rs.getString("tenant_id"),
        uuid(rs, "run_id"),
        uuid(rs, "company_prospect_id"),
        rs.getString("name_raw"),
        rs.getString("name_normalized"),
        rs.getString("title"),
        rs.getString("email"),
        rs.getString("linkedin_url"),
        uuid(rs, "source_document_id"),
        instant(rs, "created_at")
    );

    public ProspectRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    /**
     * Returns the run's prospect for the normalized name, creating it when absent.
     */
    public CompanyProspect findOrCreateProspect(
        String tenantId,
        UUID runId,
        String nameRaw,
        String nameNormalized,
        double relevanceScore,
        double evidenceScore
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("nameRaw", nameRaw)
            .addValue("nameNormalized", nameNormalized)
            .addValue("relevanceScore", relevanceScore)
            .addValue("evidenceScore", evidenceScore)
            .addValue("now", toTimestamp(now));
        JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO company_prospects (
                    id, tenant_id, run_id, name_raw, name_normalized, relevance_score, evidence_score,
                    status, created_at, updated_at
                )
                VALUES (
                    :id, :tenantId, :runId, :nameRaw, :nameNormalized, :relevanceScore, :evidenceScore,
                    'new', :now, :now
                )""",
            params
        );
        return findProspectByName(tenantId, runId, nameNormalized);
    }

    public CompanyProspect findProspectByName(String tenantId, UUID runId, String nameNormalized) {
        List<CompanyProspect> rows = jdbc.query(
            SELECT_PROSPECT + """
                WHERE tenant_id = :tenantId
                  AND run_id = :runId
                  AND name_normalized = :nameNormalized
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("runId", runId)
                .addValue("nameNormalized", nameNormalized),
            prospectMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CompanyProspect findProspect(String tenantId, UUID prospectId) {
        List<CompanyProspect> rows = jdbc.query(
            SELECT_PROSPECT + " WHERE tenant_id = :tenantId AND id = :id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", prospectId),
            prospectMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CompanyProspect> listProspects(String tenantId, UUID runId) {
        return jdbc.query(
            SELECT_PROSPECT + " WHERE tenant_id = :tenantId AND run_id = :runId ORDER BY created_at, id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            prospectMapper
        );
    }

    /**
     * Fills website and country only where they are still empty; earlier evidence wins.
     */
    public void fillProspectDetails(UUID prospectId, String websiteUrl, String hqCountry) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE company_prospects
                SET website_url = COALESCE(website_url, :websiteUrl),
                    hq_country = COALESCE(hq_country, :hqCountry),
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", prospectId)
                .addValue("websiteUrl", websiteUrl)
                .addValue("hqCountry", hqCountry)
                .addValue("now", toTimestamp(now))
        );
    }

    public boolean addProspectEvidence(
        String tenantId,
        UUID prospectId,
        UUID sourceDocumentId,
        String sourceType,
        String sourceName,
        String sourceUrl,
        String snippet,
        double weight
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("prospectId", prospectId)
            .addValue("sourceDocumentId", sourceDocumentId)
            .addValue("sourceType", sourceType)
            .addValue("sourceName", truncate(sourceName, 500))
            .addValue("sourceUrl", sourceUrl)
            .addValue("snippet", truncate(snippet, 500))
            .addValue("weight", weight)
            .addValue("now", toTimestamp(Instant.now()));
        return JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO company_prospect_evidence (
                    id, tenant_id, company_prospect_id, source_document_id, source_type, source_name,
                    source_url, evidence_snippet, evidence_weight, created_at
                )
                VALUES (
                    :id, :tenantId, :prospectId, :sourceDocumentId, :sourceType, :sourceName,
                    :sourceUrl, :snippet, :weight, :now
                )""",
            params
        );
    }

    public List<ProspectEvidence> listProspectEvidence(String tenantId, UUID runId) {
        return jdbc.query(
            """
                SELECT e.id, e.company_prospect_id, e.source_document_id, e.source_type, e.source_name,
                       e.source_url, e.evidence_snippet, e.evidence_weight
                FROM company_prospect_evidence e
                JOIN company_prospects p ON p.id = e.company_prospect_id
                WHERE e.tenant_id = :tenantId
                  AND p.run_id = :runId
                ORDER BY e.company_prospect_id, e.source_document_id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            (rs, rowNum) -> new ProspectEvidence(
                uuid(rs, "id"),
                uuid(rs, "company_prospect_id"),
                uuid(rs, "source_document_id"),
                rs.getString("source_type"),
                rs.getString("source_name"),
                rs.getString("source_url"),
                rs.getString("evidence_snippet"),
                rs.getDouble("evidence_weight")
            )
        );
    }

    /**
     * Evidence source ids per prospect of the run, each set in lexical order.
     */
    public Map<UUID, TreeSet<String>> evidenceSourceIdsByProspect(String tenantId, UUID runId) {
        Map<UUID, TreeSet<String>> out = new LinkedHashMap<>();
        for (ProspectEvidence evidence : listProspectEvidence(tenantId, runId)) {
            out.computeIfAbsent(evidence.companyProspectId(), ignored -> new TreeSet<>())
                .add(evidence.sourceDocumentId().toString());
        }
        return out;
    }

    public ExecutiveProspect findOrCreateExecutive(
        String tenantId,
        UUID runId,
        UUID companyProspectId,
        String nameRaw,
        String nameNormalized,
        String title,
        String email,
        String linkedinUrl,
        UUID sourceDocumentId
    ) {
        String dedupeKey = nameNormalized + "|" + (email == null ? "" : email);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("runId", runId)
            .addValue("prospectId", companyProspectId)
            .addValue("nameRaw", nameRaw)
            .addValue("nameNormalized", nameNormalized)
            .addValue("dedupeKey", dedupeKey)
            .addValue("title", title)
            .addValue("email", email)
            .addValue("linkedinUrl", linkedinUrl)
            .addValue("sourceDocumentId", sourceDocumentId)
            .addValue("now", toTimestamp(Instant.now()));
        JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO executive_prospects (
                    id, tenant_id, run_id, company_prospect_id, name_raw, name_normalized, dedupe_key,
                    title, email, linkedin_url, source_document_id, created_at
                )
                VALUES (
                    :id, :tenantId, :runId, :prospectId, :nameRaw, :nameNormalized, :dedupeKey,
                    :title, :email, :linkedinUrl, :sourceDocumentId, :now
                )""",
            params
        );
        List<ExecutiveProspect> rows = jdbc.query(
            SELECT_EXECUTIVE + """
                WHERE tenant_id = :tenantId
                  AND company_prospect_id = :prospectId
                  AND dedupe_key = :dedupeKey
                """,
            params,
            executiveMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean addExecutiveEvidence(String tenantId, UUID executiveId, UUID sourceDocumentId, String snippet) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("executiveId", executiveId)
            .addValue("sourceDocumentId", sourceDocumentId)
            .addValue("snippet", truncate(snippet, 500))
            .addValue("now", toTimestamp(Instant.now()));
        return JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO executive_prospect_evidence (
                    id, tenant_id, executive_prospect_id, source_document_id, evidence_snippet, created_at
                )
                VALUES (:id, :tenantId, :executiveId, :sourceDocumentId, :snippet, :now)""",
            params
        );
    }

    public List<ExecutiveProspect> listExecutives(String tenantId, UUID runId) {
        return jdbc.query(
            SELECT_EXECUTIVE + " WHERE tenant_id = :tenantId AND run_id = :runId ORDER BY created_at, id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            executiveMapper
        );
    }

    /**
     * Executives across all runs of the tenant; entity resolution matches peers tenant-wide.
     */
    public List<ExecutiveProspect> listTenantExecutives(String tenantId) {
        return jdbc.query(
            SELECT_EXECUTIVE + " WHERE tenant_id = :tenantId ORDER BY created_at, id",
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            executiveMapper
        );
    }

    public List<CompanyProspect> listTenantProspects(String tenantId) {
        return jdbc.query(
            SELECT_PROSPECT + " WHERE tenant_id = :tenantId ORDER BY created_at, id",
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            prospectMapper
        );
    }

    public List<UUID> listExecutiveEvidenceSourceIds(String tenantId, UUID executiveId) {
        return jdbc.queryForList(
            """
                SELECT source_document_id
                FROM executive_prospect_evidence
                WHERE tenant_id = :tenantId
                  AND executive_prospect_id = :executiveId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("executiveId", executiveId),
            UUID.class
        );
    }

    public List<UUID> listProspectEvidenceSourceIds(String tenantId, UUID prospectId) {
        return jdbc.queryForList(
            """
                SELECT source_document_id
                FROM company_prospect_evidence
                WHERE tenant_id = :tenantId
                  AND company_prospect_id = :prospectId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("prospectId", prospectId),
            UUID.class
        );
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
