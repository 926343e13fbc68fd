package com.delta.research.pipeline.ranking;

import com.delta.research.pipeline.extract.EnrichmentRuleExtractor;
import com.delta.research.pipeline.model.CompanyProspect;
import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.model.EvidencePointer;
import com.delta.research.pipeline.model.RankedProspect;
import com.delta.research.pipeline.model.RunConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProspectRankingServiceTest {
    private static final UUID FIRST_ID = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID SECOND_ID = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final UUID ENRICHED_ID = UUID.fromString("00000000-0000-0000-0000-00000000000c");
    private static final UUID COMPANY_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");
    private static final UUID SOURCE_ID = UUID.fromString("20000000-0000-0000-0000-000000000001");

    @Test
    void enrichedProspectOutranksBareOnes() {
        Map<UUID, Map<String, EnrichmentAssignmentRead>> best = new LinkedHashMap<>();
        Map<String, EnrichmentAssignmentRead> fields = new LinkedHashMap<>();
        fields.put(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, assignment(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, TextNode.valueOf("Oman"), 0.9));
        fields.put(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL, assignment(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL, TextNode.valueOf("private_company"), 0.8));
        JsonNode keywords = JsonNodeFactory.instance.arrayNode().add("solar").add("grid").add("hydrogen");
        fields.put(EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS, assignment(EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS, keywords, 0.7));
        best.put(COMPANY_ID, fields);

        TreeSet<String> evidence = new TreeSet<>(List.of(SOURCE_ID.toString()));
        List<RankedProspect> ranked = ProspectRankingService.rank(
            List.of(prospect(SECOND_ID, "Blue Ridge Power"), prospect(ENRICHED_ID, "Gulf Hydrogen"), prospect(FIRST_ID, "Acme Solar")),
            Map.of(ENRICHED_ID, COMPANY_ID),
            best,
            Map.of(ENRICHED_ID, evidence),
            RunConfig.of(List.of("oman"))
        );

        assertThat(ranked).extracting(RankedProspect::companyName)
            .containsExactly("Gulf Hydrogen", "Acme Solar", "Blue Ridge Power");
        assertThat(ranked).extracting(RankedProspect::rank).containsExactly(1, 2, 3);

        RankedProspect top = ranked.get(0);
        assertThat(top.computedScore()).isCloseTo(0.607, within(1e-9));
        assertThat(top.scoreComponents())
            .containsEntry(ProspectRankingService.COMPONENT_RELEVANCE, 0.2)
            .containsEntry(ProspectRankingService.COMPONENT_EVIDENCE, 0.15)
            .containsEntry(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, 0.135)
            .containsEntry(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL, 0.08)
            .containsEntry(EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS, 0.042);
        assertThat(top.hqCountry()).isEqualTo("Oman");
        assertThat(top.ownershipSignal()).isEqualTo("private_company");
        assertThat(top.industryKeywords()).containsExactly("solar", "grid", "hydrogen");
        assertThat(top.whyIncluded()).extracting(EvidencePointer::fieldKey)
            .containsExactly("hq_country", "ownership_signal", "industry_keywords");
        assertThat(top.evidenceSourceDocumentIds()).containsExactly(SOURCE_ID);

        assertThat(ranked.get(1).computedScore()).isCloseTo(0.35, within(1e-9));
        assertThat(ranked.get(1).canonicalCompanyId()).isNull();
        assertThat(ranked.get(1).whyIncluded()).isEmpty();
    }

    @Test
    void countryOutsideTheTargetsEarnsPresenceOnly() {
        Map<String, EnrichmentAssignmentRead> fields = Map.of(
            EnrichmentRuleExtractor.FIELD_HQ_COUNTRY,
            assignment(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, TextNode.valueOf("Romania"), 1.0)
        );

        List<RankedProspect> ranked = ProspectRankingService.rank(
            List.of(prospect(FIRST_ID, "Acme Solar")),
            Map.of(FIRST_ID, COMPANY_ID),
            Map.of(COMPANY_ID, fields),
            Map.of(),
            RunConfig.of(List.of("Oman"))
        );

        assertThat(ranked.get(0).scoreComponents()).containsEntry(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY, 0.05);
        assertThat(ranked.get(0).computedScore()).isCloseTo(0.4, within(1e-9));
    }

    private static CompanyProspect prospect(UUID id, String name) {
        return new CompanyProspect(id, "tenant", UUID.randomUUID(), name, name.toLowerCase(), null, null, 0.5, 0.5, "new", Instant.EPOCH);
    }

    private static EnrichmentAssignmentRead assignment(String fieldKey, JsonNode value, double confidence) {
        return new EnrichmentAssignmentRead(
            UUID.randomUUID(),
            "tenant",
            "company",
            COMPANY_ID,
            fieldKey,
            value,
            value.isTextual() ? value.asText() : value.toString(),
            confidence,
            "rules",
            SOURCE_ID,
            "scope",
            "hash-" + fieldKey,
            Instant.EPOCH,
            Instant.EPOCH
        );
    }
}
