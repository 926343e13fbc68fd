package com.delta.research.pipeline.resolution;

import com.delta.research.pipeline.model.CanonicalPerson;
import com.delta.research.pipeline.model.ExecutiveProspect;
import com.delta.research.pipeline.model.ResolutionSummary;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository.LinkedExecutive;
import com.delta.research.pipeline.persistence.ProspectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Links the executives of a run to tenant-wide canonical people. The first applicable rule wins:
 * email, then LinkedIn URL, then name within the same company prospect.
 */
@Service
public class CanonicalPeopleResolver {
    private static final Logger log = LoggerFactory.getLogger(CanonicalPeopleResolver.class);

    static final String RULE_EMAIL = "email";
    static final String RULE_LINKEDIN = "linkedin";
    static final String RULE_NAME_COMPANY = "name_company";

    private final ProspectRepository prospectRepository;
    private final CanonicalEntityRepository canonicalRepository;

    public CanonicalPeopleResolver(ProspectRepository prospectRepository, CanonicalEntityRepository canonicalRepository) {
        this.prospectRepository = prospectRepository;
        this.canonicalRepository = canonicalRepository;
    }

    public ResolutionSummary resolveRun(String tenantId, UUID runId) {
        List<ExecutiveProspect> executives = prospectRepository.listExecutives(tenantId, runId);
        List<ExecutiveProspect> tenantExecutives = null;
        ResolutionTally tally = new ResolutionTally();
        Set<String> handledEmails = new HashSet<>();
        Set<String> handledLinkedin = new HashSet<>();

        for (ExecutiveProspect executive : executives) {
            String email = EntityNormalizer.email(executive.email());
            String linkedin = EntityNormalizer.linkedin(executive.linkedinUrl());

            if (email != null) {
                if (!handledEmails.add(email)) {
                    continue;
                }
                if (tenantExecutives == null) {
                    tenantExecutives = prospectRepository.listTenantExecutives(tenantId);
                }
                CanonicalPerson canonical = canonicalRepository.findPersonByEmail(tenantId, email);
                if (canonical != null) {
                    tally.matched++;
                } else {
                    canonical = canonicalRepository.insertPerson(tenantId, canonicalName(executive), email, linkedin);
                    tally.created++;
                }
                for (ExecutiveProspect peer : tenantExecutives) {
                    if (email.equals(EntityNormalizer.email(peer.email()))) {
                        link(tenantId, canonical.id(), peer, RULE_EMAIL, tally);
                    }
                }
                continue;
            }

            if (linkedin != null) {
                if (!handledLinkedin.add(linkedin)) {
                    continue;
                }
                if (tenantExecutives == null) {
                    tenantExecutives = prospectRepository.listTenantExecutives(tenantId);
                }
                CanonicalPerson canonical = canonicalRepository.findPersonByLinkedin(tenantId, linkedin);
                if (canonical != null) {
                    tally.matched++;
                } else {
                    canonical = canonicalRepository.insertPerson(tenantId, canonicalName(executive), null, linkedin);
                    tally.created++;
                }
                for (ExecutiveProspect peer : tenantExecutives) {
                    if (EntityNormalizer.email(peer.email()) == null
                        && linkedin.equals(EntityNormalizer.linkedin(peer.linkedinUrl()))) {
                        link(tenantId, canonical.id(), peer, RULE_LINKEDIN, tally);
                    }
                }
                continue;
            }

            resolveByNameAndCompany(tenantId, executive, tally);
        }

        ResolutionSummary summary = tally.toSummary();
        log.info("People resolution for run {}: {}", runId, summary);
        return summary;
    }

    private void resolveByNameAndCompany(String tenantId, ExecutiveProspect executive, ResolutionTally tally) {
        UUID evidenceId = tally.chooseEvidence(evidenceIds(tenantId, executive));
        if (evidenceId == null) {
            return;
        }
        String name = canonicalName(executive);
        if (name == null || executive.companyProspectId() == null) {
            tally.conflictsSkipped++;
            return;
        }

        Set<UUID> candidates = new LinkedHashSet<>();
        for (LinkedExecutive linked : canonicalRepository.listLinkedExecutives(tenantId, executive.companyProspectId())) {
            String linkedName = EntityNormalizer.personName(
                linked.nameNormalized() != null ? linked.nameNormalized() : linked.nameRaw()
            );
            if (name.equals(linkedName)) {
                candidates.add(linked.canonicalPersonId());
            }
        }
        if (candidates.size() > 1) {
            log.debug("Executive {} matches {} canonical people; skipped", executive.id(), candidates.size());
            tally.conflictsSkipped++;
            return;
        }

        UUID canonicalId;
        if (candidates.size() == 1) {
            canonicalId = candidates.iterator().next();
            tally.matched++;
        } else {
            canonicalId = canonicalRepository.insertPerson(tenantId, name, null, null).id();
            tally.created++;
        }
        boolean inserted = canonicalRepository.insertPersonLinkIfAbsent(
            tenantId,
            canonicalId,
            executive.id(),
            RULE_NAME_COMPANY,
            evidenceId,
            executive.runId()
        );
        tally.recordLink(inserted);
    }

    private void link(String tenantId, UUID canonicalId, ExecutiveProspect executive, String rule, ResolutionTally tally) {
        UUID evidenceId = tally.chooseEvidence(evidenceIds(tenantId, executive));
        if (evidenceId == null) {
            return;
        }
        boolean inserted = canonicalRepository.insertPersonLinkIfAbsent(
            tenantId,
            canonicalId,
            executive.id(),
            rule,
            evidenceId,
            executive.runId()
        );
        tally.recordLink(inserted);
    }

    private List<UUID> evidenceIds(String tenantId, ExecutiveProspect executive) {
        List<UUID> ids = new ArrayList<>();
        if (executive.sourceDocumentId() != null) {
            ids.add(executive.sourceDocumentId());
        }
        ids.addAll(prospectRepository.listExecutiveEvidenceSourceIds(tenantId, executive.id()));
        return ids;
    }

    private static String canonicalName(ExecutiveProspect executive) {
        String name = executive.nameNormalized();
        return EntityNormalizer.personName(name != null && !name.isBlank() ? name : executive.nameRaw());
    }
}
