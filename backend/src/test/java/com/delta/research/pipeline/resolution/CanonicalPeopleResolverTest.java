package com.delta.research.pipeline.resolution;

import com.delta.research.pipeline.model.CanonicalLink;
import com.delta.research.pipeline.model.CanonicalPerson;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.ExecutiveProspect;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.ResolutionSummary;
import com.delta.research.pipeline.model.RunConfig;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.persistence.ProspectRepository;
import com.delta.research.pipeline.persistence.ResearchRunRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CanonicalPeopleResolverTest {

    @Autowired
    private CanonicalPeopleResolver resolver;

    @Autowired
    private CanonicalEntityRepository canonicalRepository;

    @Autowired
    private ProspectRepository prospectRepository;

    @Autowired
    private ResearchRunRepository runRepository;

    @Autowired
    private SourceDocumentRepository sourceRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String tenantId;
    private ResearchRun run;
    private SourceDocument source;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        run = runRepository.insertRun(tenantId, "people", RunConfig.empty());
        source = sourceRepository.insertSource(
            tenantId, run.id(), SourceType.PROPOSAL, SourceStatus.NEW, "proposal", null, null, "{}", null, null, 3
        );
    }

    @Test
    void emailWinsOverLinkedinAndLinkedinOverName() {
        CompanyProspect acme = company("Acme Solar Holdings");
        CompanyProspect ridge = company("Blue Ridge Power Company");
        ExecutiveProspect withEmail = executive(acme, "Layla Haddad", "layla@acme.example", "https://www.linkedin.com/in/layla/");
        ExecutiveProspect withLinkedin = executive(ridge, "L. Haddad", null, "www.linkedin.com/in/layla");
        jdbcTemplate.update(
            "UPDATE executive_prospects SET created_at = created_at + INTERVAL '1' SECOND WHERE id = ?",
            withLinkedin.id()
        );

        ResolutionSummary summary = resolver.resolveRun(tenantId, run.id());

        CanonicalLink emailLink = canonicalRepository.findPersonLink(tenantId, withEmail.id());
        CanonicalLink linkedinLink = canonicalRepository.findPersonLink(tenantId, withLinkedin.id());
        assertThat(emailLink.matchRule()).isEqualTo(CanonicalPeopleResolver.RULE_EMAIL);
        assertThat(linkedinLink.matchRule()).isEqualTo(CanonicalPeopleResolver.RULE_LINKEDIN);
        assertThat(linkedinLink.canonicalId()).isEqualTo(emailLink.canonicalId());
        assertThat(summary.created()).isEqualTo(1);
        assertThat(summary.matched()).isEqualTo(1);
        assertThat(summary.linksCreated()).isEqualTo(2);
        CanonicalPerson person = canonicalRepository.findPerson(tenantId, emailLink.canonicalId());
        assertThat(person.primaryEmail()).isEqualTo("layla@acme.example");
    }

    @Test
    void sameEmailInALaterRunReusesTheCanonicalPerson() {
        ExecutiveProspect first = executive(company("Gulf Hydrogen Partners"), "Omar Saleh", "omar@gulfhydrogen.example", null);
        resolver.resolveRun(tenantId, run.id());

        ResearchRun later = runRepository.insertRun(tenantId, "people again", RunConfig.empty());
        CompanyProspect laterCompany = prospectRepository.findOrCreateProspect(
            tenantId, later.id(), "Gulf Hydrogen Partners", "gulf hydrogen partners", 0.5, 0.5
        );
        ExecutiveProspect second = prospectRepository.findOrCreateExecutive(
            tenantId, later.id(), laterCompany.id(), "Omar Saleh", "omar saleh", null,
            "omar@gulfhydrogen.example", null, source.id()
        );
        ResolutionSummary summary = resolver.resolveRun(tenantId, later.id());

        assertThat(summary.created()).isZero();
        assertThat(summary.matched()).isEqualTo(1);
        assertThat(canonicalRepository.countPeople(tenantId)).isEqualTo(1);
        assertThat(canonicalRepository.findPersonLink(tenantId, second.id()).canonicalId())
            .isEqualTo(canonicalRepository.findPersonLink(tenantId, first.id()).canonicalId());
    }

    @Test
    void nameWithinACompanyMatchingTwoPeopleIsSkipped() {
        CompanyProspect acme = company("Acme Solar Holdings");
        ExecutiveProspect firstNamesake = executive(acme, "Omar Saleh", "omar.one@acme.example", null);
        ExecutiveProspect secondNamesake = executive(acme, "Omar Saleh", "omar.two@acme.example", null);
        CanonicalPerson one = canonicalRepository.insertPerson(tenantId, "omar saleh", "omar.one@acme.example", null);
        CanonicalPerson two = canonicalRepository.insertPerson(tenantId, "omar saleh", "omar.two@acme.example", null);
        canonicalRepository.insertPersonLinkIfAbsent(tenantId, one.id(), firstNamesake.id(), "email", source.id(), run.id());
        canonicalRepository.insertPersonLinkIfAbsent(tenantId, two.id(), secondNamesake.id(), "email", source.id(), run.id());
        ExecutiveProspect nameOnly = executive(acme, "Omar  Saleh", null, null);

        ResolutionSummary summary = resolver.resolveRun(tenantId, run.id());

        assertThat(summary.conflictsSkipped()).isEqualTo(1);
        assertThat(canonicalRepository.findPersonLink(tenantId, nameOnly.id())).isNull();
        assertThat(canonicalRepository.countPeople(tenantId)).isEqualTo(2);
    }

    @Test
    void nameWithinACompanyResolvesOnceAndThenOnlyMatches() {
        ExecutiveProspect executive = executive(company("Blue Ridge Power Company"), "Sara Nasser", null, null);

        ResolutionSummary first = resolver.resolveRun(tenantId, run.id());
        ResolutionSummary second = resolver.resolveRun(tenantId, run.id());

        assertThat(first.created()).isEqualTo(1);
        assertThat(canonicalRepository.findPersonLink(tenantId, executive.id()).matchRule())
            .isEqualTo(CanonicalPeopleResolver.RULE_NAME_COMPANY);
        assertThat(second.created()).isZero();
        assertThat(second.matched()).isEqualTo(1);
        assertThat(second.linksCreated()).isZero();
        assertThat(second.linksExisting()).isEqualTo(1);
        assertThat(canonicalRepository.countPeople(tenantId)).isEqualTo(1);
    }

    private CompanyProspect company(String name) {
        return prospectRepository.findOrCreateProspect(
            tenantId, run.id(), name, EntityNormalizer.personName(name), 0.5, 0.5
        );
    }

    private ExecutiveProspect executive(CompanyProspect company, String name, String email, String linkedin) {
        return prospectRepository.findOrCreateExecutive(
            tenantId,
            run.id(),
            company.id(),
            name,
            EntityNormalizer.personName(name),
            null,
            email,
            linkedin,
            source.id()
        );
    }
}
