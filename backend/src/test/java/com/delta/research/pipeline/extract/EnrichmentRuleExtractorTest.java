package com.delta.research.pipeline.extract;

import com.delta.research.pipeline.model.ExtractedFact;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentRuleExtractorTest {

    @Test
    void extractsHqOwnershipAndIndustry() {
        String text = """
            Headquarters: Muscat, Oman
            The company is privately held.
            It builds solar farms, solar storage and hydrogen pilots for the grid.
            """;

        Map<String, ExtractedFact> facts = byField(EnrichmentRuleExtractor.extract(text));

        ExtractedFact hq = facts.get(EnrichmentRuleExtractor.FIELD_HQ_COUNTRY);
        assertThat(hq.valueNormalized()).isEqualTo("Oman");
        assertThat(hq.confidence()).isEqualTo(0.90);
        assertThat(hq.matchedRule()).isEqualTo("headquarters");

        ExtractedFact ownership = facts.get(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL);
        assertThat(ownership.valueNormalized()).isEqualTo("private_company");
        assertThat(ownership.confidence()).isEqualTo(0.80);

        ExtractedFact industry = facts.get(EnrichmentRuleExtractor.FIELD_INDUSTRY_KEYWORDS);
        assertThat(industry.valueNormalized()).isEqualTo("solar, grid, hydrogen");
        assertThat(industry.confidence()).isEqualTo(0.70);
        assertThat(industry.value().isArray()).isTrue();
    }

    @Test
    void basedInIsWeakerThanHeadquarters() {
        List<ExtractedFact> facts = EnrichmentRuleExtractor.extract("A utility based in Romania.");

        assertThat(facts).hasSize(1);
        assertThat(facts.get(0).valueNormalized()).isEqualTo("Romania");
        assertThat(facts.get(0).confidence()).isEqualTo(0.70);
    }

    @Test
    void ownershipTiesBreakByPriority() {
        String text = "A state-owned operator that is also listed on the exchange.";

        ExtractedFact ownership = byField(EnrichmentRuleExtractor.extract(text))
            .get(EnrichmentRuleExtractor.FIELD_OWNERSHIP_SIGNAL);

        assertThat(ownership.valueNormalized()).isEqualTo("state_owned");
    }

    @Test
    void sameTextAlwaysYieldsSameFacts() {
        String text = "Based in Qatar. A subsidiary of Gulf Holdings working on lng and shipping.";

        assertThat(EnrichmentRuleExtractor.extract(text)).isEqualTo(EnrichmentRuleExtractor.extract(text));
        assertThat(EnrichmentRuleExtractor.extract("")).isEmpty();
        assertThat(EnrichmentRuleExtractor.extract(null)).isEmpty();
    }

    private static Map<String, ExtractedFact> byField(List<ExtractedFact> facts) {
        return facts.stream().collect(Collectors.toMap(ExtractedFact::fieldKey, Function.identity()));
    }
}
