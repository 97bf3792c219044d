package com.statejobs.harvester.crawl.salary;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobCodeExtractorTest {
    private final JobCodeExtractor extractor = new JobCodeExtractor(ParsingRules.defaults());

    @Test
    void extractsDistinctCodesInOrder() {
        String text = "Stillingskode 1234 – Tittel; Kode 5678 – Tittel; Kode 1234";

        assertThat(extractor.extractCodes(text)).containsExactly("1234", "5678");
    }

    @Test
    void supportsKeywordVariantsAndListSeparators() {
        assertThat(extractor.extractCodes("stillingskodene 1434/1364")).containsExactly("1434", "1364");
        assertThat(extractor.extractCodes("SKO 1065, 1085 og 1434")).containsExactly("1065", "1085", "1434");
        assertThat(extractor.extractCodes("st.kode 1408")).containsExactly("1408");
        assertThat(extractor.extractCodes("Stillingskode nr. 1363")).containsExactly("1363");
        assertThat(extractor.extractCodes("Stillingskode: 1065 Konsulent")).containsExactly("1065");
    }

    @Test
    void ignoresNumbersWithoutMarkerAndAmounts() {
        assertThat(extractor.extractCodes("Lønn kr 650 000, søknadsfrist 2024")).isEmpty();
        assertThat(extractor.extractCodes("kode 650 000")).isEmpty();
        assertThat(extractor.extractCodes("Postkode 0150 Oslo")).isEmpty();
        assertThat(extractor.extractCodes("Skole 1234")).isEmpty();
        assertThat(extractor.extractCodes(null)).isEmpty();
    }

    @Test
    void percentageAfterCodeIsNotPartOfTheCode() {
        assertThat(extractor.extractCodes("Stillingskode 1364 100 % fast stilling")).containsExactly("1364");
        assertThat(extractor.extractCodes("Stillingskode 1364, 100 % fast stilling")).containsExactly("1364");
        assertThat(extractor.extractCodes("Stillingskode 1364 og 50 % vikariat")).containsExactly("1364");
    }

    @Test
    void listedNumberOfAnotherWidthEndsTheSpan() {
        String line = "Stillingskode 1364, 100 % fast stilling";
        CodeSpan span = extractor.findSpans(line).get(0);

        assertThat(line.substring(span.start(), span.end())).isEqualTo("Stillingskode 1364");
        assertThat(extractor.extractCodes("kode 1363 og kode 13637")).containsExactly("1363", "13637");
    }

    @Test
    void titleFollowsSingleCodeSeparator() {
        String line = "Stillingskode 1408 – Førstekonsulent";
        List<CodeSpan> spans = extractor.findSpans(line);

        assertThat(spans).hasSize(1);
        assertThat(extractor.titleAfter(line, spans.get(0))).isEqualTo("Førstekonsulent");
    }

    @Test
    void titleStopsAtSalaryKeywordOrAmount() {
        String line = "kode 1111 – Konsulent – Lønn: kr 500 000 – 600 000";
        CodeSpan span = extractor.findSpans(line).get(0);

        assertThat(extractor.titleAfter(line, span)).isEqualTo("Konsulent");

        String amountLine = "kode 1363 - Seniorkonsulent 600 000";
        assertThat(extractor.titleAfter(amountLine, extractor.findSpans(amountLine).get(0)))
            .isEqualTo("Seniorkonsulent");
    }

    @Test
    void noTitleWithoutSeparatorOrForCodeLists() {
        String bare = "Stillingskode 1434 rådgiver";
        assertThat(extractor.titleAfter(bare, extractor.findSpans(bare).get(0))).isNull();

        String list = "Stillingskode 1434/1364 – Rådgiver";
        CodeSpan span = extractor.findSpans(list).get(0);
        assertThat(span.codes()).containsExactly("1434", "1364");
        assertThat(extractor.titleAfter(list, span)).isNull();
    }

    @Test
    void stripCodesRemovesMarkersAndNumbers() {
        assertThat(extractor.stripCodes("Stillingskode 1434 lønn").trim()).isEqualTo("lønn");
    }

    @Test
    void customKeywordsAreHonoured() {
        JobCodeExtractor custom = new JobCodeExtractor(ParsingRules.of(List.of("SKO"), List.of("lønn")));

        assertThat(custom.extractCodes("sko 1065 og stillingskode 1434")).containsExactly("1065");
    }

    @Test
    void emptyCodeKeywordsAreInvalidConfiguration() {
        assertThatThrownBy(() -> ParsingRules.of(List.of(" "), List.of("lønn")))
            .isInstanceOf(IllegalStateException.class);
    }
}
