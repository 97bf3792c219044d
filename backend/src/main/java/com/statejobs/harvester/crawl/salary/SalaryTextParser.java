package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.crawl.model.SalaryParse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses one salary phrase into annual bounds. Currency tokens are dropped and
 * space, dot and comma are read as thousands separators. Rules run in order:
 * range, single amount, then a bounds-free fallback that keeps the text.
 */
@Component
public class SalaryTextParser {
    private static final Pattern ODD_SPACES = Pattern.compile("[\\u00a0\\u2007\\u2009\\u202f]");
    private static final Pattern IDENTIFIER = Pattern.compile(
        "(?<![\\p{L}])(?:org\\.?\\s*nr|organisasjonsnummer|tlf|telefon|mobil)\\.?\\s*:?\\s*(?:\\+\\d{2}\\s*)?\\d[\\d .]*\\d",
        ParsingRules.FLAGS
    );
    private static final Pattern CURRENCY = Pattern.compile("(?<![\\p{L}])(?:kroner|kr|nok)(?![\\p{L}])\\.?|[,.]-", ParsingRules.FLAGS);

    private final JobCodeExtractor jobCodeExtractor;
    private final ParsingRules rules;
    private final List<SalaryRule> salaryRules;

    public SalaryTextParser(JobCodeExtractor jobCodeExtractor, ParsingRules rules) {
        this.jobCodeExtractor = jobCodeExtractor;
        this.rules = rules;
        this.salaryRules = SalaryRules.ORDERED;
    }

    public SalaryParse parse(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return null;
        }
        String original = phrase.trim();
        String cleaned = clean(original);
        for (SalaryRule rule : salaryRules) {
            SalaryParse parsed = rule.apply(cleaned, original);
            if (parsed != null) {
                return parsed;
            }
        }
        return SalaryParse.qualitative(original);
    }

    /**
     * True when the text mentions a salary keyword, once code numbers and
     * organisation or phone numbers are removed, or an amount. Next to a currency
     * token any 6+ digit amount counts; without one the amount must be 6 or 7 digits.
     */
    public boolean hasSalaryContent(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String withoutIds = stripIdentifiers(text);
        if (rules.salaryKeywordPattern().matcher(withoutIds).find()) {
            return true;
        }
        if (CURRENCY.matcher(withoutIds).find()) {
            return SalaryRules.containsSalaryAmount(CURRENCY.matcher(withoutIds).replaceAll(" "));
        }
        return SalaryRules.containsPlainAmount(withoutIds);
    }

    String clean(String text) {
        return CURRENCY.matcher(stripIdentifiers(text)).replaceAll(" ");
    }

    private String stripIdentifiers(String text) {
        String value = ODD_SPACES.matcher(text).replaceAll(" ");
        value = IDENTIFIER.matcher(value).replaceAll(" ");
        return jobCodeExtractor.stripCodes(value);
    }
}
