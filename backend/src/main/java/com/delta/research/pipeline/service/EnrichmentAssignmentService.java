package com.delta.research.pipeline.service;

import com.delta.research.pipeline.model.EnrichmentAssignmentCreate;
import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.persistence.EnrichmentAssignmentRepository;
import com.delta.research.pipeline.util.CanonicalJson;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Evidence-backed, idempotent writes of derived field values. Re-recording the same fact for the
 * same source lands on the same row.
 */
@Service
public class EnrichmentAssignmentService {
    public static final String TARGET_COMPANY = "company";
    public static final String TARGET_PERSON = "person";

    private final EnrichmentAssignmentRepository repository;

    public EnrichmentAssignmentService(EnrichmentAssignmentRepository repository) {
        this.repository = repository;
    }

    public EnrichmentAssignmentRead recordAssignment(EnrichmentAssignmentCreate payload) {
        if (payload.sourceDocumentId() == null) {
            throw new EvidenceRequiredException(
                "source_document_required for " + payload.targetEntityType() + "/" + payload.fieldKey()
            );
        }
        if (payload.confidence() < 0.0 || payload.confidence() > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + payload.confidence());
        }
        return repository.upsert(payload, contentHash(payload));
    }

    public List<EnrichmentAssignmentRead> recordAssignments(List<EnrichmentAssignmentCreate> payloads) {
        List<EnrichmentAssignmentRead> results = new ArrayList<>();
        for (EnrichmentAssignmentCreate payload : payloads) {
            results.add(recordAssignment(payload));
        }
        return results;
    }

    public List<EnrichmentAssignmentRead> listForCanonicalCompany(String tenantId, UUID canonicalCompanyId) {
        return repository.listForTarget(tenantId, TARGET_COMPANY, canonicalCompanyId);
    }

    public List<EnrichmentAssignmentRead> listForCanonicalPerson(String tenantId, UUID canonicalPersonId) {
        return repository.listForTarget(tenantId, TARGET_PERSON, canonicalPersonId);
    }

    /**
     * sha256 over the sorted, compact JSON of everything that identifies the fact except confidence.
     */
    static String contentHash(EnrichmentAssignmentCreate payload) {
        ObjectNode base = CanonicalJson.newObject();
        base.put("target_entity_type", payload.targetEntityType());
        base.put("target_canonical_id", String.valueOf(payload.targetCanonicalId()));
        base.put("field_key", payload.fieldKey());
        base.set("value", payload.value() == null ? NullNode.getInstance() : payload.value());
        base.put("value_normalized", payload.valueNormalized());
        base.put("derived_by", payload.derivedBy());
        base.put("source_document_id", String.valueOf(payload.sourceDocumentId()));
        base.put("input_scope_hash", payload.inputScopeHash());
        return CanonicalJson.sha256(base);
    }
}
