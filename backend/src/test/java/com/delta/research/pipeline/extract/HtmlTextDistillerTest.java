package com.delta.research.pipeline.extract;

import com.delta.research.pipeline.extract.HtmlTextDistiller.Distilled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlTextDistillerTest {

    @Test
    void listPageYieldsOneLinePerEntry() {
        String html = """
            <html><head><title>Leading Gulf Energy Firms</title></head>
            <body>
              <nav><ul><li>Home</li><li>About us</li></ul></nav>
              <ul class="social-links"><li>Twitter page</li></ul>
              <ul>
                <li>Acme Solar Holdings</li>
                <li>Blue Ridge Power Company</li>
                <li>Read more</li>
                <li>$ 1,200</li>
              </ul>
              <table><tr><th>Gulf Hydrogen Partners</th><td>Oman</td></tr></table>
            </body></html>
            """;

        Distilled result = HtmlTextDistiller.distill(html);

        assertThat(result.title()).isEqualTo("Leading Gulf Energy Firms");
        assertThat(result.text().split("\n"))
            .containsExactly("Gulf Hydrogen Partners", "Acme Solar Holdings", "Blue Ridge Power Company");
    }

    @Test
    void articleFallsBackToVisibleText() {
        String html = """
            <html><head>
              <meta property="og:title" content="Grid expansion announced">
              <script>var tracking = 1;</script>
            </head>
            <body>
              <h1>Grid expansion</h1>
              <p>The utility is headquartered in Muscat.</p>
              <div class="sidebar-widget">Popular stories</div>
              <footer>Footer text</footer>
            </body></html>
            """;

        Distilled result = HtmlTextDistiller.distill(html);

        assertThat(result.title()).isEqualTo("Grid expansion announced");
        assertThat(result.text()).isEqualTo("Grid expansion\nThe utility is headquartered in Muscat.");
    }

    @Test
    void bodyIsDecodedWithTheCharsetOfItsContentType() throws Exception {
        byte[] body = "<html><head><title>Énergie</title></head><body><ul><li>Société Générale Énergie</li></ul></body></html>"
            .getBytes(StandardCharsets.ISO_8859_1);

        Distilled result = HtmlTextDistiller.distill(body, "text/html; charset=ISO-8859-1", "https://example.com/list");

        assertThat(result.title()).isEqualTo("Énergie");
        assertThat(result.text()).contains("Société Générale Énergie");
    }

    @Test
    void metaCharsetIsHonouredWhenTheHeaderHasNone() throws Exception {
        byte[] body = """
            <html><head><meta charset="windows-1252"><title>Liste</title></head>
            <body><p>Compañía Eléctrica del Norte</p></body></html>
            """.getBytes(StandardCharsets.ISO_8859_1);

        Distilled result = HtmlTextDistiller.distill(body, "text/html", null);

        assertThat(result.text()).contains("Compañía Eléctrica del Norte");
    }

    @Test
    void unknownCharsetsAreIgnored() {
        assertThat(HtmlTextDistiller.charsetOf("text/html; charset=\"utf-8\"")).isEqualTo("utf-8");
        assertThat(HtmlTextDistiller.charsetOf("text/html; charset=no-such-charset")).isNull();
        assertThat(HtmlTextDistiller.charsetOf("text/html")).isNull();
        assertThat(HtmlTextDistiller.charsetOf(null)).isNull();
    }

    @Test
    void navigationPhrasesAreNotEntries() {
        assertThat(HtmlTextDistiller.isListEntry("Acme Solar Holdings")).isTrue();
        assertThat(HtmlTextDistiller.isListEntry("Subscribe to our newsletter")).isFalse();
        assertThat(HtmlTextDistiller.isListEntry("Energy Times")).isFalse();
        assertThat(HtmlTextDistiller.isListEntry("Prices | Charts")).isFalse();
        assertThat(HtmlTextDistiller.isListEntry("12%")).isFalse();
    }
}
