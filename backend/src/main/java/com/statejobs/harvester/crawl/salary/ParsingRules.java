package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.config.HarvesterProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiled keyword patterns shared by the code extractor and the salary parser.
 */
public record ParsingRules(
    List<String> codeKeywords,
    List<String> salaryKeywords,
    Pattern codeSpanPattern,
    Pattern salaryKeywordPattern
) {
    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
    // A code never runs into a following digit group ("650 000"), unless that group is a percentage.
    static final String CODE = "\\d{3,5}(?!\\d)(?![ .,\\u00a0\\u202f]\\d{3}(?!\\d)(?!\\s*%))";
    private static final String SEPARATOR = "\\s*(?:[/,&+]|\\b(?:og|eller|and|or)\\b)\\s*";
    private static final Pattern BARE_SEPARATOR = Pattern.compile(SEPARATOR, FLAGS);

    public static ParsingRules of(List<String> codeKeywords, List<String> salaryKeywords) {
        List<String> codes = sanitize(codeKeywords);
        List<String> salaries = sanitize(salaryKeywords);
        if (codes.isEmpty()) {
            throw new IllegalStateException("harvester.parsing.code-keywords must not be empty");
        }
        String marker = "(?<![\\p{L}\\p{N}])(?:" + alternation(codes) + ")(?:ene|en|ne|er|r|n)?\\.?\\s*:?\\s*(?:nr\\.?\\s*)?";
        Pattern codeSpan = Pattern.compile(
            marker + CODE + "(?:" + SEPARATOR + "(?:" + marker + ")?" + CODE + ")*",
            FLAGS
        );
        Pattern salaryKeyword = salaries.isEmpty()
            ? Pattern.compile("(?!)")
            : Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation(salaries) + ")(?![\\p{L}])", FLAGS);
        return new ParsingRules(codes, salaries, codeSpan, salaryKeyword);
    }

    /**
     * True when the text between two numbers of a span is only a list separator,
     * with no code keyword of its own.
     */
    static boolean isBareSeparator(String between) {
        return BARE_SEPARATOR.matcher(between).matches();
    }

    public static ParsingRules from(HarvesterProperties.Parsing parsing) {
        return of(parsing.getCodeKeywords(), parsing.getSalaryKeywords());
    }

    public static ParsingRules defaults() {
        return from(new HarvesterProperties.Parsing());
    }

    private static List<String> sanitize(List<String> keywords) {
        List<String> out = new ArrayList<>();
        if (keywords == null) {
            return out;
        }
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && !out.contains(keyword.trim())) {
                out.add(keyword.trim());
            }
        }
        return List.copyOf(out);
    }

    // Longest first so "stillingskode" is preferred over "kode" at the same position.
    private static String alternation(List<String> keywords) {
        return keywords.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    }
}
