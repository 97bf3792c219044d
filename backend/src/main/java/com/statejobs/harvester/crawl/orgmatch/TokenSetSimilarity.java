package com.statejobs.harvester.crawl.orgmatch;

import java.util.Set;
import java.util.TreeSet;

/**
 * Token-set similarity in the range 0..1. Both inputs are split into token
 * sets; the shared tokens are compared against each side's remainder using an
 * indel (LCS based) ratio, and the best of the three comparisons is returned.
 * A string whose tokens are a subset of the other's scores 1.0.
 */
public final class TokenSetSimilarity {
    private TokenSetSimilarity() {
    }

    public static double score(String left, String right) {
        Set<String> a = tokenSet(left);
        Set<String> b = tokenSet(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        TreeSet<String> shared = new TreeSet<>(a);
        shared.retainAll(b);
        TreeSet<String> onlyA = new TreeSet<>(a);
        onlyA.removeAll(b);
        TreeSet<String> onlyB = new TreeSet<>(b);
        onlyB.removeAll(a);

        if (!shared.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 1.0;
        }

        String sect = String.join(" ", shared);
        String diffA = String.join(" ", onlyA);
        String diffB = String.join(" ", onlyB);
        String combinedA = sect.isEmpty() ? diffA : sect + " " + diffA;
        String combinedB = sect.isEmpty() ? diffB : sect + " " + diffB;

        double best = indelRatio(combinedA, combinedB);
        if (!sect.isEmpty()) {
            best = Math.max(best, indelRatio(sect, combinedA));
            best = Math.max(best, indelRatio(sect, combinedB));
        }
        return best;
    }

    static double indelRatio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static Set<String> tokenSet(String value) {
        Set<String> tokens = new TreeSet<>();
        if (value == null) {
            return tokens;
        }
        for (String token : value.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
