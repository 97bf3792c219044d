package com.statejobs.harvester.crawl.orgmatch;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class OrgNameNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
    private static final Pattern LOOSE_HYPHEN = Pattern.compile("(?<![\\p{L}\\p{N}])-|-(?![\\p{L}\\p{N}])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private OrgNameNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String value = text.toLowerCase(Locale.ROOT)
            .replace("ø", "o")
            .replace("æ", "ae")
            .replace("å", "a");
        value = Normalizer.normalize(value, Normalizer.Form.NFKD);
        value = COMBINING_MARKS.matcher(value).replaceAll("");
        value = NON_WORD.matcher(value).replaceAll(" ");
        value = LOOSE_HYPHEN.matcher(value).replaceAll(" ");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public static String[] tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return new String[0];
        }
        return normalized.split(" ");
    }
}
