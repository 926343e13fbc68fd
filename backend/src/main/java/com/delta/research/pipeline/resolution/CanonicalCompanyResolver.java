package com.delta.research.pipeline.resolution;

import com.delta.research.pipeline.model.CanonicalCompany;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.ResolutionSummary;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.persistence.ProspectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Links the company prospects of a run to tenant-wide canonical companies. Rules in precedence
 * order: website domain, then name plus country, then name alone.
 */
@Service
public class CanonicalCompanyResolver {
    private static final Logger log = LoggerFactory.getLogger(CanonicalCompanyResolver.class);

    static final String RULE_DOMAIN = "domain";
    static final String RULE_NAME_COUNTRY = "name_country";
    static final String RULE_NAME = "name";

    private final ProspectRepository prospectRepository;
    private final CanonicalEntityRepository canonicalRepository;

    public CanonicalCompanyResolver(ProspectRepository prospectRepository, CanonicalEntityRepository canonicalRepository) {
        this.prospectRepository = prospectRepository;
        this.canonicalRepository = canonicalRepository;
    }

    public ResolutionSummary resolveRun(String tenantId, UUID runId) {
        List<CompanyProspect> runProspects = prospectRepository.listProspects(tenantId, runId);
        List<CompanyProspect> tenantProspects = prospectRepository.listTenantProspects(tenantId);
        ResolutionTally tally = new ResolutionTally();
        Set<String> handled = new HashSet<>();

        for (CompanyProspect prospect : runProspects) {
            String domain = EntityNormalizer.domain(prospect.websiteUrl());
            String name = EntityNormalizer.companyName(firstNonBlank(prospect.nameNormalized(), prospect.nameRaw()));
            String country = EntityNormalizer.countryCode(prospect.hqCountry());

            if (domain != null) {
                if (!handled.add("domain|" + domain)) {
                    continue;
                }
                CanonicalCompany canonical = canonicalRepository.findCompanyByDomain(tenantId, domain);
                if (canonical != null) {
                    tally.matched++;
                } else {
                    canonical = canonicalRepository.insertCompany(tenantId, name, domain, country);
                    tally.created++;
                }
                for (CompanyProspect peer : tenantProspects) {
                    if (domain.equals(EntityNormalizer.domain(peer.websiteUrl()))) {
                        link(tenantId, canonical.id(), peer, RULE_DOMAIN, tally);
                    }
                }
                continue;
            }
            if (name == null) {
                tally.conflictsSkipped++;
                continue;
            }

            if (country != null) {
                if (!handled.add("name_country|" + name + "|" + country)) {
                    continue;
                }
                CanonicalCompany canonical = pick(
                    canonicalRepository.findCompaniesByNameAndCountry(tenantId, name, country),
                    tenantId, name, country, tally
                );
                if (canonical == null) {
                    continue;
                }
                for (CompanyProspect peer : tenantProspects) {
                    if (isNameOnlyPeer(peer, name) && country.equals(EntityNormalizer.countryCode(peer.hqCountry()))) {
                        link(tenantId, canonical.id(), peer, RULE_NAME_COUNTRY, tally);
                    }
                }
                continue;
            }

            if (!handled.add("name|" + name)) {
                continue;
            }
            CanonicalCompany canonical = pick(
                canonicalRepository.findCompaniesByNameOnly(tenantId, name),
                tenantId, name, null, tally
            );
            if (canonical == null) {
                continue;
            }
            for (CompanyProspect peer : tenantProspects) {
                if (isNameOnlyPeer(peer, name) && EntityNormalizer.countryCode(peer.hqCountry()) == null) {
                    link(tenantId, canonical.id(), peer, RULE_NAME, tally);
                }
            }
        }

        ResolutionSummary summary = tally.toSummary();
        log.info("Company resolution for run {}: {}", runId, summary);
        return summary;
    }

    private CanonicalCompany pick(
        List<CanonicalCompany> existing,
        String tenantId,
        String name,
        String country,
        ResolutionTally tally
    ) {
        if (existing.size() > 1) {
            tally.conflictsSkipped++;
            return null;
        }
        if (existing.size() == 1) {
            tally.matched++;
            return existing.get(0);
        }
        tally.created++;
        return canonicalRepository.insertCompany(tenantId, name, null, country);
    }

    private boolean isNameOnlyPeer(CompanyProspect peer, String name) {
        return EntityNormalizer.domain(peer.websiteUrl()) == null
            && Objects.equals(name, EntityNormalizer.companyName(firstNonBlank(peer.nameNormalized(), peer.nameRaw())));
    }

    private void link(String tenantId, UUID canonicalId, CompanyProspect prospect, String rule, ResolutionTally tally) {
        UUID evidenceId = tally.chooseEvidence(prospectRepository.listProspectEvidenceSourceIds(tenantId, prospect.id()));
        if (evidenceId == null) {
            log.debug("Prospect {} has no evidence; not linked", prospect.id());
            return;
        }
        boolean inserted = canonicalRepository.insertCompanyLinkIfAbsent(
            tenantId,
            canonicalId,
            prospect.id(),
            rule,
            evidenceId,
            prospect.runId()
        );
        tally.recordLink(inserted);
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
