package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.crawl.model.SalaryParse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SalaryTextParserTest {
    private final ParsingRules rules = ParsingRules.defaults();
    private final SalaryTextParser parser = new SalaryTextParser(new JobCodeExtractor(rules), rules);

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "500 - 650 000|500000|650000",
        "kr. 725 600 til kr. 783 800|725600|783800",
        "850.000-950.000|850000|950000",
        "kr. 516 867- 573 256|516867|573256",
        "kr. 896 156 - 1 085 801.|896156|1085801",
        "Lønn: kr 600 000 – 750 000 per år|600000|750000",
        "fra 540 000 til 600 000 kroner|540000|600000",
        "Lønnstrinn 45-52 (kr 544 400 - 626 100)|544400|626100"
    })
    void parsesRanges(String phrase, long min, long max) {
        SalaryParse parsed = parser.parse(phrase);

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.RANGE);
        assertThat(parsed.min()).isEqualTo(min);
        assertThat(parsed.max()).isEqualTo(max);
        assertThat(parsed.text()).isEqualTo(phrase);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Lønn: kr 650.000|650000",
        "Lønn 500 000|500000",
        "NOK 500 000|500000",
        "500 000,-|500000"
    })
    void singleAmountIsPointSalary(String phrase, long amount) {
        SalaryParse parsed = parser.parse(phrase);

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.POINT);
        assertThat(parsed.min()).isEqualTo(amount);
        assertThat(parsed.max()).isEqualTo(amount);
    }

    @Test
    void qualitativePhraseHasNoBounds() {
        SalaryParse parsed = parser.parse("Lønn etter avtale");

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.QUALITATIVE);
        assertThat(parsed.hasBounds()).isFalse();
        assertThat(parsed.text()).isEqualTo("Lønn etter avtale");
    }

    @Test
    void smallNumbersAreAmbiguousNotSalaries() {
        SalaryParse fiveDigits = parser.parse("Lønn 12345");
        SalaryParse grades = parser.parse("45-52");

        assertThat(fiveDigits.kind()).isEqualTo(SalaryParse.Kind.AMBIGUOUS);
        assertThat(fiveDigits.hasBounds()).isFalse();
        assertThat(grades.kind()).isEqualTo(SalaryParse.Kind.AMBIGUOUS);
        assertThat(grades.hasBounds()).isFalse();
        assertThat(grades.text()).isEqualTo("45-52");
    }

    @Test
    void severalUnrelatedAmountsAreAmbiguous() {
        SalaryParse parsed = parser.parse("kr 500 000 eller kr 600 000");

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.AMBIGUOUS);
        assertThat(parsed.min()).isNull();
        assertThat(parsed.max()).isNull();
    }

    @Test
    void codeNumbersAreNotReadAsAmounts() {
        SalaryParse parsed = parser.parse("Stillingskode 1434 rådgiver, lønn kr 650 000");

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.POINT);
        assertThat(parsed.min()).isEqualTo(650000L);
    }

    @Test
    void blankPhraseIsNull() {
        assertThat(parser.parse("  ")).isNull();
        assertThat(parser.parse(null)).isNull();
    }

    @Test
    void salaryContentNeedsKeywordOrLargeAmount() {
        assertThat(parser.hasSalaryContent("Lønn etter avtale")).isTrue();
        assertThat(parser.hasSalaryContent("Årslønn 650 000")).isTrue();
        assertThat(parser.hasSalaryContent("Stillingskode 1434 – Rådgiver")).isFalse();
        assertThat(parser.hasSalaryContent("Søknadsfrist 15.06.2024")).isFalse();
    }

    @Test
    void registryAndPhoneNumbersAreNotSalaries() {
        assertThat(parser.hasSalaryContent("Org.nr. 974 760 673")).isFalse();
        assertThat(parser.hasSalaryContent("Organisasjonsnummer: 974760673")).isFalse();
        assertThat(parser.hasSalaryContent("Tlf: +47 22 24 90 90")).isFalse();
        assertThat(parser.hasSalaryContent("Saksnummer 2024123456")).isFalse();
        assertThat(parser.hasSalaryContent("Stillingskode 1364, 100 % fast stilling")).isFalse();
        assertThat(parser.hasSalaryContent("kr 650 000")).isTrue();
        assertThat(parser.hasSalaryContent("600 000 - 700 000")).isTrue();
    }

    @Test
    void identifiersNextToSalaryAreIgnored() {
        SalaryParse parsed = parser.parse("Lønn: kr 650 000. Org.nr. 974 760 673");

        assertThat(parsed.kind()).isEqualTo(SalaryParse.Kind.POINT);
        assertThat(parsed.min()).isEqualTo(650000L);
    }

    @Test
    void parsingIsDeterministic() {
        String phrase = "kr. 516 867- 573 256";
        assertThat(parser.parse(phrase)).isEqualTo(parser.parse(phrase));
    }
}
