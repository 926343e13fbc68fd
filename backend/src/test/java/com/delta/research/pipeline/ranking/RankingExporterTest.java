package com.delta.research.pipeline.ranking;

import com.delta.research.pipeline.model.EvidencePointer;
import com.delta.research.pipeline.model.RankedProspect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RankingExporterTest {
    private static final UUID SOURCE_ID = UUID.fromString("20000000-0000-0000-0000-000000000001");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RankingExporter exporter = new RankingExporter(objectMapper);

    @Test
    void csvQuotesNamesAndJoinsListsWithSemicolons() {
        String csv = exporter.toCsv(List.of(row()));

        String[] lines = csv.split("\n");
        assertThat(lines[0]).isEqualTo(
            "rank,company_name,score_total,hq_country,ownership_signal,industry_keywords,why_included,evidence_source_document_ids"
        );
        assertThat(lines[1]).isEqualTo(
            "1,\"Acme Solar, Inc.\",0.485000,Oman,,solar;grid,hq_country:" + SOURCE_ID + "," + SOURCE_ID
        );
    }

    @Test
    void emptyRankingStillHasHeader() {
        assertThat(exporter.toCsv(List.of())).startsWith("rank,company_name");
        assertThat(exporter.toJson(List.of())).isEqualTo("[]");
    }

    @Test
    void jsonKeepsComponentsAndEvidence() throws Exception {
        JsonNode json = objectMapper.readTree(exporter.toJson(List.of(row())));

        assertThat(json.get(0).path("rank").asInt()).isEqualTo(1);
        assertThat(json.get(0).path("scoreComponents").path("relevance").asDouble()).isEqualTo(0.2);
        assertThat(json.get(0).path("whyIncluded").get(0).path("fieldKey").asText()).isEqualTo("hq_country");
        assertThat(exporter.toJson(List.of(row()))).isEqualTo(exporter.toJson(List.of(row())));
    }

    private static RankedProspect row() {
        Map<String, Double> components = new LinkedHashMap<>();
        components.put("relevance", 0.2);
        components.put("evidence", 0.15);
        components.put("hq_country", 0.135);
        return new RankedProspect(
            1,
            UUID.fromString("00000000-0000-0000-0000-00000000000a"),
            "Acme Solar, Inc.",
            null,
            0.485,
            components,
            List.of(new EvidencePointer("hq_country", SOURCE_ID)),
            List.of(SOURCE_ID),
            "Oman",
            null,
            List.of("solar", "grid")
        );
    }
}
