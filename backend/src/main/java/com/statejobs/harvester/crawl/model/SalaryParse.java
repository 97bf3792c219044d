package com.statejobs.harvester.crawl.model;

/**
 * Result of parsing one salary phrase. Bounds are annual amounts in NOK and are
 * only present for {@link Kind#RANGE} and {@link Kind#POINT}.
 */
public record SalaryParse(Kind kind, Long min, Long max, String text) {
    public enum Kind {
        RANGE,
        POINT,
        AMBIGUOUS,
        QUALITATIVE
    }

    public static SalaryParse range(long first, long second, String text) {
        return new SalaryParse(Kind.RANGE, Math.min(first, second), Math.max(first, second), text);
    }

    public static SalaryParse point(long value, String text) {
        return new SalaryParse(Kind.POINT, value, value, text);
    }

    public static SalaryParse ambiguous(String text) {
        return new SalaryParse(Kind.AMBIGUOUS, null, null, text);
    }

    public static SalaryParse qualitative(String text) {
        return new SalaryParse(Kind.QUALITATIVE, null, null, text);
    }

    public boolean hasBounds() {
        return min != null && max != null;
    }

    public boolean sameBounds(SalaryParse other) {
        return other != null && hasBounds() && other.hasBounds()
            && min.equals(other.min) && max.equals(other.max);
    }
}
