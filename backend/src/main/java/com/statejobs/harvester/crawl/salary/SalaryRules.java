package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.crawl.model.SalaryParse;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class SalaryRules {
    static final int MIN_SALARY_DIGITS = 6;
    static final int MAX_SALARY_DIGITS = 12;
    static final int MAX_PLAIN_AMOUNT_DIGITS = 7;
    static final String NUM = "(?<!\\d)(?:\\d{1,3}(?:[ .,]\\d{3})+|\\d+)(?!\\d)";

    private static final Pattern NUMBER = Pattern.compile(NUM, ParsingRules.FLAGS);
    private static final Pattern RANGE = Pattern.compile(
        "(?:\\bfra\\s+)?(" + NUM + ")\\s*(?:-|–|—|\\btil\\b)\\s*(" + NUM + ")",
        ParsingRules.FLAGS
    );
    private static final Pattern ANY_DIGIT = Pattern.compile("\\d");

    static final SalaryRule RANGE_RULE = (cleaned, original) -> {
        Matcher matcher = RANGE.matcher(cleaned);
        while (matcher.find()) {
            String first = digits(matcher.group(1));
            String second = digits(matcher.group(2));
            boolean firstIsUpper = first.length() >= second.length();
            String upper = firstIsUpper ? first : second;
            String lower = firstIsUpper ? second : first;
            if (upper.length() < MIN_SALARY_DIGITS) {
                // grades such as "45-52" or year spans
                continue;
            }
            if (upper.length() > MAX_SALARY_DIGITS || lower.length() > MAX_SALARY_DIGITS) {
                return SalaryParse.ambiguous(original);
            }
            long upperValue = Long.parseLong(upper);
            long lowerValue = Long.parseLong(lower);
            if (lower.length() >= MIN_SALARY_DIGITS) {
                return SalaryParse.range(lowerValue, upperValue, original);
            }
            if (lower.length() > 3) {
                return SalaryParse.ambiguous(original);
            }
            long scaled = scaleAbbreviated(lowerValue, upperValue);
            if (String.valueOf(scaled).length() < MIN_SALARY_DIGITS) {
                return SalaryParse.ambiguous(original);
            }
            return SalaryParse.range(scaled, upperValue, original);
        }
        return null;
    };

    static final SalaryRule POINT_RULE = (cleaned, original) -> {
        Set<String> amounts = new LinkedHashSet<>();
        Matcher matcher = NUMBER.matcher(cleaned);
        while (matcher.find()) {
            String value = digits(matcher.group());
            if (value.length() >= MIN_SALARY_DIGITS) {
                amounts.add(value);
            }
        }
        if (amounts.isEmpty()) {
            return null;
        }
        String only = amounts.iterator().next();
        if (amounts.size() > 1 || only.length() > MAX_SALARY_DIGITS) {
            return SalaryParse.ambiguous(original);
        }
        return SalaryParse.point(Long.parseLong(only), original);
    };

    static final SalaryRule FALLBACK_RULE = (cleaned, original) -> ANY_DIGIT.matcher(cleaned).find()
        ? SalaryParse.ambiguous(original)
        : SalaryParse.qualitative(original);

    static final List<SalaryRule> ORDERED = List.of(RANGE_RULE, POINT_RULE, FALLBACK_RULE);

    private SalaryRules() {
    }

    static boolean containsSalaryAmount(String cleaned) {
        return containsAmount(cleaned, MAX_SALARY_DIGITS);
    }

    /**
     * Amount without a currency next to it: only annual-salary sized figures count,
     * so registry and phone numbers are left alone.
     */
    static boolean containsPlainAmount(String cleaned) {
        return containsAmount(cleaned, MAX_PLAIN_AMOUNT_DIGITS);
    }

    private static boolean containsAmount(String cleaned, int maxDigits) {
        Matcher matcher = NUMBER.matcher(cleaned);
        while (matcher.find()) {
            int length = digits(matcher.group()).length();
            if (length >= MIN_SALARY_DIGITS && length <= maxDigits) {
                return true;
            }
        }
        return false;
    }

    /**
     * "500 - 650 000" writes the lower figure in thousands; scale it up while it
     * stays below the upper figure.
     */
    private static long scaleAbbreviated(long lower, long upper) {
        long scaled = lower;
        if (scaled <= 0) {
            return scaled;
        }
        while (scaled * 1000 <= upper) {
            scaled *= 1000;
        }
        return scaled;
    }

    private static String digits(String raw) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (Character.isDigit(ch)) {
                out.append(ch);
            }
        }
        String value = out.toString();
        int firstNonZero = 0;
        while (firstNonZero < value.length() - 1 && value.charAt(firstNonZero) == '0') {
            firstNonZero++;
        }
        return value.substring(firstNonZero);
    }
}
