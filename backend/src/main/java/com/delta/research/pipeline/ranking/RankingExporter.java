package com.delta.research.pipeline.ranking;

import com.delta.research.pipeline.model.EvidencePointer;
import com.delta.research.pipeline.model.RankedProspect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JSON and CSV renderings of a ranking. Both are pure functions of the ranked list, so the same
 * ranking always exports to the same bytes.
 */
@Component
public class RankingExporter {
    static final String[] CSV_HEADER = {
        "rank",
        "company_name",
        "score_total",
        "hq_country",
        "ownership_signal",
        "industry_keywords",
        "why_included",
        "evidence_source_document_ids"
    };
    private static final String LIST_SEPARATOR = ";";

    private final ObjectMapper objectMapper;

    public RankingExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(List<RankedProspect> ranking) {
        try {
            return objectMapper.writeValueAsString(ranking);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize ranking", e);
        }
    }

    public String toCsv(List<RankedProspect> ranking) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .setRecordSeparator("\n")
            .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (RankedProspect row : ranking) {
                printer.printRecord(
                    row.rank(),
                    row.companyName(),
                    formatScore(row.computedScore()),
                    nullToEmpty(row.hqCountry()),
                    nullToEmpty(row.ownershipSignal()),
                    String.join(LIST_SEPARATOR, row.industryKeywords()),
                    row.whyIncluded().stream().map(EvidencePointer::asCsvToken).collect(Collectors.joining(LIST_SEPARATOR)),
                    row.evidenceSourceDocumentIds().stream().map(UUID::toString).collect(Collectors.joining(LIST_SEPARATOR))
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write ranking csv", e);
        }
        return out.toString();
    }

    static String formatScore(double score) {
        return BigDecimal.valueOf(score).setScale(ProspectRankingService.SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
