package com.delta.research.pipeline.extract;

import com.delta.research.pipeline.extract.CompanyNameExtractor.CompanyMention;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyNameExtractorTest {

    @Test
    void cleansBulletsNumberingAndHeaders() {
        String text = """
            Here are the companies we discussed
            1. Acme Solar Holdings Ltd
            - Blue Ridge Power Company
            • Gulf Hydrogen Partners LLC
            $ 4,500
            acme solar holdings
            """;

        List<CompanyMention> mentions = CompanyNameExtractor.extract(text);

        assertThat(mentions).extracting(CompanyMention::name)
            .containsExactly("Acme Solar Holdings Ltd", "Blue Ridge Power Company", "Gulf Hydrogen Partners LLC");
        assertThat(mentions).extracting(CompanyMention::normalizedName)
            .containsExactly("acme solar", "blue ridge power company", "gulf hydrogen partners");
        assertThat(mentions.get(0).snippet()).isEqualTo("Acme Solar Holdings Ltd | - Blue Ridge Power Company");
    }

    @Test
    void sentencesAreNotCompanyNames() {
        List<CompanyMention> mentions = CompanyNameExtractor.extract(
            "The regional market grew quickly over the last decade.\nNorthwind Traders Group"
        );

        assertThat(mentions).extracting(CompanyMention::name).containsExactly("Northwind Traders Group");
    }

    @Test
    void mostlySingleShortWordsAreTreatedAsNoise() {
        assertThat(CompanyNameExtractor.extract("Home\nAbout\nContact\nCareers\nAcme Solar Holdings")).isEmpty();
        assertThat(CompanyNameExtractor.extract("  ")).isEmpty();
    }
}
