package com.statejobs.harvester.crawl.salary;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class JobCodeExtractor {
    private static final Pattern CODE_NUMBER = Pattern.compile("(?<!\\d)\\d{3,5}(?!\\d)", ParsingRules.FLAGS);
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("^\\s*[-–—:]\\s*", ParsingRules.FLAGS);
    private static final Pattern AMOUNT = Pattern.compile("\\d{1,3}(?:[ .\\u00a0\\u202f]\\d{3})+(?!\\d)|\\d{6,}", ParsingRules.FLAGS);
    private static final Pattern TITLE_TRAILER = Pattern.compile("[\\s\\-–—:,.;/(]+$", ParsingRules.FLAGS);

    private final ParsingRules rules;

    public JobCodeExtractor(ParsingRules rules) {
        this.rules = rules;
    }

    public List<CodeSpan> findSpans(String text) {
        List<CodeSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }
        Matcher matcher = rules.codeSpanPattern().matcher(text);
        while (matcher.find()) {
            String group = matcher.group();
            List<String> codes = new ArrayList<>();
            int end = 0;
            Matcher number = CODE_NUMBER.matcher(group);
            while (number.find()) {
                String code = number.group();
                // "1364, 100 %": a listed number of another width is not a code
                if (!codes.isEmpty()
                    && code.length() != codes.get(0).length()
                    && ParsingRules.isBareSeparator(group.substring(end, number.start()))) {
                    break;
                }
                codes.add(code);
                end = number.end();
            }
            if (!codes.isEmpty()) {
                spans.add(new CodeSpan(matcher.start(), matcher.start() + end, codes));
            }
        }
        return spans;
    }

    /**
     * Distinct job codes in order of first appearance.
     */
    public List<String> extractCodes(String text) {
        LinkedHashSet<String> codes = new LinkedHashSet<>();
        for (CodeSpan span : findSpans(text)) {
            codes.addAll(span.codes());
        }
        return new ArrayList<>(codes);
    }

    /**
     * Title introduced by a separator right after a single-code span. The title
     * stops at a salary keyword, a salary amount, a semicolon or a pipe.
     */
    public String titleAfter(String segment, CodeSpan span) {
        if (segment == null || span == null || span.codes().size() != 1 || span.end() >= segment.length()) {
            return null;
        }
        String rest = segment.substring(span.end());
        Matcher separator = TITLE_SEPARATOR.matcher(rest);
        if (!separator.find()) {
            return null;
        }
        String candidate = rest.substring(separator.end());
        int cut = candidate.length();
        cut = Math.min(cut, indexOf(candidate, ';'));
        cut = Math.min(cut, indexOf(candidate, '|'));
        Matcher keyword = rules.salaryKeywordPattern().matcher(candidate);
        if (keyword.find()) {
            cut = Math.min(cut, keyword.start());
        }
        Matcher amount = AMOUNT.matcher(candidate);
        if (amount.find()) {
            cut = Math.min(cut, amount.start());
        }
        Matcher nextSpan = rules.codeSpanPattern().matcher(candidate);
        if (nextSpan.find()) {
            cut = Math.min(cut, nextSpan.start());
        }
        String title = TITLE_TRAILER.matcher(candidate.substring(0, cut)).replaceAll("").trim();
        return title.isEmpty() ? null : title;
    }

    /**
     * Removes code spans so the code numbers are not mistaken for amounts.
     */
    public String stripCodes(String text) {
        if (text == null) {
            return "";
        }
        List<CodeSpan> spans = findSpans(text);
        if (spans.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int position = 0;
        for (CodeSpan span : spans) {
            out.append(text, position, span.start()).append(' ');
            position = span.end();
        }
        return out.append(text, position, text.length()).toString();
    }

    private static int indexOf(String value, char ch) {
        int idx = value.indexOf(ch);
        return idx < 0 ? value.length() : idx;
    }
}
