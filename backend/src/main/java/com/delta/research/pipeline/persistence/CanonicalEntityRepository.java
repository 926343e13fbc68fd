package com.delta.research.pipeline.persistence;

import com.delta.research.pipeline.model.CanonicalCompany;
import com.delta.research.pipeline.model.CanonicalLink;
import com.delta.research.pipeline.model.CanonicalPerson;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.delta.research.pipeline.persistence.JdbcSupport.instant;
import static com.delta.research.pipeline.persistence.JdbcSupport.toTimestamp;
import static com.delta.research.pipeline.persistence.JdbcSupport.uuid;

/**
 * Tenant-wide canonical companies and people, plus the insert-if-absent links from run entities.
 */
@Repository
public class CanonicalEntityRepository {
    private static final String SELECT_COMPANY = """
        SELECT id, tenant_id, canonical_name, primary_domain, country_code, created_at
        FROM canonical_companies
        """;
    private static final String SELECT_PERSON = """
        SELECT id, tenant_id, canonical_full_name, primary_email, primary_linkedin_url, created_at
        FROM canonical_people
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final RowMapper<CanonicalCompany> companyMapper = (rs, rowNum) -> new CanonicalCompany(
        uuid(rs, "id"),
        rs.getString("tenant_id"),
        rs.getString("canonical_name"),
        rs.getString("primary_domain"),
        rs.getString("country_code"),
        instant(rs, "created_at")
    );
    private final RowMapper<CanonicalPerson> personMapper = (rs, rowNum) -> new CanonicalPerson(
        uuid(rs, "id"),
        rs.getString("tenant_id"),
        rs.getString("canonical_full_name"),
        rs.getString("primary_email"),
        rs.getString("primary_linkedin_url"),
        instant(rs, "created_at")
    );

    public CanonicalEntityRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public CanonicalCompany findCompany(String tenantId, UUID companyId) {
        List<CanonicalCompany> rows = jdbc.query(
            SELECT_COMPANY + " WHERE tenant_id = :tenantId AND id = :id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", companyId),
            companyMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CanonicalCompany findCompanyByDomain(String tenantId, String domain) {
        List<CanonicalCompany> rows = jdbc.query(
            SELECT_COMPANY + """
                WHERE tenant_id = :tenantId
                  AND primary_domain = :domain
                ORDER BY created_at, id
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("domain", domain),
            companyMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CanonicalCompany> findCompaniesByNameAndCountry(String tenantId, String name, String country) {
        return jdbc.query(
            SELECT_COMPANY + """
                WHERE tenant_id = :tenantId
                  AND canonical_name = :name
                  AND country_code = :country
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("name", name)
                .addValue("country", country),
            companyMapper
        );
    }

    public List<CanonicalCompany> findCompaniesByNameOnly(String tenantId, String name) {
        return jdbc.query(
            SELECT_COMPANY + """
                WHERE tenant_id = :tenantId
                  AND canonical_name = :name
                  AND primary_domain IS NULL
                  AND country_code IS NULL
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("name", name),
            companyMapper
        );
    }

    public CanonicalCompany insertCompany(String tenantId, String name, String domain, String country) {
        UUID id = UUID.randomUUID();
        jdbc.update(
            """
                INSERT INTO canonical_companies (id, tenant_id, canonical_name, primary_domain, country_code, created_at)
                VALUES (:id, :tenantId, :name, :domain, :country, :now)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tenantId", tenantId)
                .addValue("name", name)
                .addValue("domain", domain)
                .addValue("country", country)
                .addValue("now", toTimestamp(Instant.now()))
        );
        return findCompany(tenantId, id);
    }

    public CanonicalLink findCompanyLink(String tenantId, UUID prospectId) {
        List<CanonicalLink> rows = jdbc.query(
            """
                SELECT id, tenant_id, canonical_company_id AS canonical_id, company_entity_id AS entity_id,
                       match_rule, evidence_source_document_id, evidence_run_id, created_at
                FROM canonical_company_links
                WHERE tenant_id = :tenantId
                  AND company_entity_id = :entityId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("entityId", prospectId),
            this::mapLink
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean insertCompanyLinkIfAbsent(
        String tenantId,
        UUID canonicalCompanyId,
        UUID prospectId,
        String matchRule,
        UUID evidenceSourceDocumentId,
        UUID runId
    ) {
        return JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO canonical_company_links (
                    id, tenant_id, canonical_company_id, company_entity_id, match_rule,
                    evidence_source_document_id, evidence_run_id, created_at
                )
                VALUES (:id, :tenantId, :canonicalId, :entityId, :matchRule, :evidenceId, :runId, :now)""",
            linkParams(tenantId, canonicalCompanyId, prospectId, matchRule, evidenceSourceDocumentId, runId)
        );
    }

    /**
     * Canonical company per prospect of the run, for prospects that have been linked.
     */
    public Map<UUID, UUID> companyLinksForRun(String tenantId, UUID runId) {
        Map<UUID, UUID> out = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT l.company_entity_id, l.canonical_company_id
                FROM canonical_company_links l
                JOIN company_prospects p ON p.id = l.company_entity_id
                WHERE l.tenant_id = :tenantId
                  AND p.run_id = :runId
                ORDER BY p.created_at, p.id
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("runId", runId),
            rs -> {
                out.put(uuid(rs, "company_entity_id"), uuid(rs, "canonical_company_id"));
            }
        );
        return out;
    }

    public CanonicalPerson findPerson(String tenantId, UUID personId) {
        List<CanonicalPerson> rows = jdbc.query(
            SELECT_PERSON + " WHERE tenant_id = :tenantId AND id = :id",
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("id", personId),
            personMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CanonicalPerson findPersonByEmail(String tenantId, String email) {
        List<CanonicalPerson> rows = jdbc.query(
            SELECT_PERSON + """
                WHERE tenant_id = :tenantId
                  AND primary_email = :email
                ORDER BY created_at, id
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("email", email),
            personMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CanonicalPerson findPersonByLinkedin(String tenantId, String linkedinUrl) {
        List<CanonicalPerson> rows = jdbc.query(
            SELECT_PERSON + """
                WHERE tenant_id = :tenantId
                  AND primary_linkedin_url = :linkedinUrl
                ORDER BY created_at, id
                LIMIT 1
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("linkedinUrl", linkedinUrl),
            personMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CanonicalPerson insertPerson(String tenantId, String fullName, String email, String linkedinUrl) {
        UUID id = UUID.randomUUID();
        jdbc.update(
            """
                INSERT INTO canonical_people (id, tenant_id, canonical_full_name, primary_email, primary_linkedin_url, created_at)
                VALUES (:id, :tenantId, :fullName, :email, :linkedinUrl, :now)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tenantId", tenantId)
                .addValue("fullName", fullName)
                .addValue("email", email)
                .addValue("linkedinUrl", linkedinUrl)
                .addValue("now", toTimestamp(Instant.now()))
        );
        return findPerson(tenantId, id);
    }

    public CanonicalLink findPersonLink(String tenantId, UUID executiveId) {
        List<CanonicalLink> rows = jdbc.query(
            """
                SELECT id, tenant_id, canonical_person_id AS canonical_id, person_entity_id AS entity_id,
                       match_rule, evidence_source_document_id, evidence_run_id, created_at
                FROM canonical_person_links
                WHERE tenant_id = :tenantId
                  AND person_entity_id = :entityId
                """,
            new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("entityId", executiveId),
            this::mapLink
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean insertPersonLinkIfAbsent(
        String tenantId,
        UUID canonicalPersonId,
        UUID executiveId,
        String matchRule,
        UUID evidenceSourceDocumentId,
        UUID runId
    ) {
        return JdbcSupport.insertIfAbsent(
            jdbc,
            postgres,
            """
                INSERT INTO canonical_person_links (
                    id, tenant_id, canonical_person_id, person_entity_id, match_rule,
                    evidence_source_document_id, evidence_run_id, created_at
                )
                VALUES (:id, :tenantId, :canonicalId, :entityId, :matchRule, :evidenceId, :runId, :now)""",
            linkParams(tenantId, canonicalPersonId, executiveId, matchRule, evidenceSourceDocumentId, runId)
        );
    }

    /**
     * Executives of one company prospect that already carry a person link, with the canonical id.
     */
    public List<LinkedExecutive> listLinkedExecutives(String tenantId, UUID companyProspectId) {
        return jdbc.query(
            """
                SELECT l.canonical_person_id, e.name_raw, e.name_normalized
                FROM canonical_person_links l
                JOIN executive_prospects e ON e.id = l.person_entity_id
                WHERE l.tenant_id = :tenantId
                  AND e.company_prospect_id = :companyProspectId
                ORDER BY e.created_at, e.id
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("companyProspectId", companyProspectId),
            (rs, rowNum) -> new LinkedExecutive(
                uuid(rs, "canonical_person_id"),
                rs.getString("name_raw"),
                rs.getString("name_normalized")
            )
        );
    }

    public long countCompanies(String tenantId) {
        return count("SELECT COUNT(*) FROM canonical_companies WHERE tenant_id = :tenantId", tenantId);
    }

    public long countPeople(String tenantId) {
        return count("SELECT COUNT(*) FROM canonical_people WHERE tenant_id = :tenantId", tenantId);
    }

    public long countCompanyLinks(String tenantId) {
        return count("SELECT COUNT(*) FROM canonical_company_links WHERE tenant_id = :tenantId", tenantId);
    }

    public long countPersonLinks(String tenantId) {
        return count("SELECT COUNT(*) FROM canonical_person_links WHERE tenant_id = :tenantId", tenantId);
    }

    private long count(String sql, String tenantId) {
        Long value = jdbc.queryForObject(sql, new MapSqlParameterSource().addValue("tenantId", tenantId), Long.class);
        return value == null ? 0L : value;
    }

    private MapSqlParameterSource linkParams(
        String tenantId,
        UUID canonicalId,
        UUID entityId,
        String matchRule,
        UUID evidenceSourceDocumentId,
        UUID runId
    ) {
        return new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("tenantId", tenantId)
            .addValue("canonicalId", canonicalId)
            .addValue("entityId", entityId)
            .addValue("matchRule", matchRule)
            .addValue("evidenceId", evidenceSourceDocumentId)
            .addValue("runId", runId)
            .addValue("now", toTimestamp(Instant.now()));
    }

    private CanonicalLink mapLink(ResultSet rs, int rowNum) throws SQLException {
        return new CanonicalLink(
            uuid(rs, "id"),
            rs.getString("tenant_id"),
            uuid(rs, "canonical_id"),
            uuid(rs, "entity_id"),
            rs.getString("match_rule"),
            uuid(rs, "evidence_source_document_id"),
            uuid(rs, "evidence_run_id"),
            instant(rs, "created_at")
        );
    }

    public record LinkedExecutive(UUID canonicalPersonId, String nameRaw, String nameNormalized) {
    }
}
