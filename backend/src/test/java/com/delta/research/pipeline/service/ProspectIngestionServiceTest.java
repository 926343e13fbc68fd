package com.delta.research.pipeline.service;

import com.delta.research.pipeline.model.AttachSourceRequest;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.CreateRunRequest;
import com.delta.research.pipeline.model.ExecutiveProspect;
import com.delta.research.pipeline.model.ResearchRun;
import com.delta.research.pipeline.model.SourceDocument;
import com.delta.research.pipeline.model.SourceStatus;
import com.delta.research.pipeline.persistence.ProspectRepository;
import com.delta.research.pipeline.persistence.SourceDocumentRepository;
import com.delta.research.pipeline.service.ProspectIngestionService.IngestionSummary;
import com.delta.research.pipeline.step.StepContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ProspectIngestionServiceTest {

    @Autowired
    private ProspectIngestionService ingestionService;

    @Autowired
    private ResearchRunService runService;

    @Autowired
    private ProspectRepository prospectRepository;

    @Autowired
    private SourceDocumentRepository sourceRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private String tenantId;
    private ResearchRun run;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        run = runService.createRun(tenantId, new CreateRunRequest("ingestion", List.of("OM")));
    }

    @Test
    void pastedListBecomesProspectsOnce() {
        SourceDocument list = attach("list", "Acme Solar Holdings\n\nBlue Ridge Power Company\n");

        IngestionSummary first = inStep(ingestionService::ingestLists);
        IngestionSummary second = inStep(ingestionService::ingestLists);

        assertThat(first.processed()).isEqualTo(1);
        assertThat(first.prospectsCreated()).isEqualTo(2);
        assertThat(prospectRepository.listProspects(tenantId, run.id()))
            .extracting(CompanyProspect::nameRaw)
            .containsExactlyInAnyOrder("Acme Solar Holdings", "Blue Ridge Power Company");
        assertThat(sourceRepository.findSource(tenantId, list.id()).status()).isEqualTo(SourceStatus.PROCESSED);
        assertThat(second.processed()).isZero();
        assertThat(second.prospectsCreated()).isZero();
    }

    @Test
    void proposalCarriesCompanyDetailsAndExecutives() {
        attach("proposal", """
            {"companies": [{
              "name": "Gulf Hydrogen Partners",
              "website_url": "https://gulfhydrogen.example",
              "hq_country": "OM",
              "executives": [
                {"name": "Layla Haddad", "title": "Chief Executive Officer", "email": "Layla.Haddad@GulfHydrogen.example"},
                {"name": "   "}
              ]
            }]}
            """);

        IngestionSummary summary = inStep(ingestionService::ingestProposals);

        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.companies()).isEqualTo(1);
        assertThat(summary.executives()).isEqualTo(1);
        CompanyProspect company = prospectRepository.listProspects(tenantId, run.id()).get(0);
        assertThat(company.websiteUrl()).isEqualTo("https://gulfhydrogen.example");
        assertThat(company.hqCountry()).isEqualTo("OM");
        List<ExecutiveProspect> executives = prospectRepository.listExecutives(tenantId, run.id());
        assertThat(executives).singleElement().satisfies(executive -> {
            assertThat(executive.companyProspectId()).isEqualTo(company.id());
            assertThat(executive.title()).isEqualTo("Chief Executive Officer");
            assertThat(executive.email()).isEqualTo("layla.haddad@gulfhydrogen.example");
        });
    }

    @Test
    void failingProposalRollsBackAloneWhileSiblingsAreIngested() {
        SourceDocument broken = attach("proposal", """
            {"companies": [{
              "name": "Broken Energy Corporation",
              "executives": [{"name": "Omar Saleh", "title": "%s"}]
            }]}
            """.formatted("Director ".repeat(40)));
        SourceDocument healthy = attach("proposal", """
            {"companies": [{"name": "Blue Ridge Power Company"}]}
            """);

        IngestionSummary summary = inStep(ingestionService::ingestProposals);

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(prospectRepository.listProspects(tenantId, run.id()))
            .extracting(CompanyProspect::nameRaw)
            .containsExactly("Blue Ridge Power Company");
        SourceDocument failed = sourceRepository.findSource(tenantId, broken.id());
        assertThat(failed.lastError()).isNotBlank();
        assertThat(failed.meta().processing().error()).isNotBlank();
        assertThat(sourceRepository.findSource(tenantId, healthy.id()).status()).isEqualTo(SourceStatus.PROCESSED);
    }

    @Test
    void proposalThatIsNotJsonFailsTheSource() {
        SourceDocument source = attach("proposal", "companies: Acme");

        IngestionSummary summary = inStep(ingestionService::ingestProposals);

        assertThat(summary.failed()).isEqualTo(1);
        SourceDocument failed = sourceRepository.findSource(tenantId, source.id());
        assertThat(failed.status()).isEqualTo(SourceStatus.FAILED);
        assertThat(failed.lastError()).startsWith("invalid_proposal_json");
        assertThat(prospectRepository.listProspects(tenantId, run.id())).isEmpty();
    }

    private SourceDocument attach(String type, String content) {
        return runService.attachSource(tenantId, run.id(), new AttachSourceRequest(type, null, null, content, null));
    }

    private IngestionSummary inStep(Function<StepContext, IngestionSummary> step) {
        StepContext context = new StepContext(run, null, null, () -> false);
        return transactionTemplate.execute(status -> step.apply(context));
    }
}
