package com.statejobs.harvester.crawl.salary;

import java.util.List;

/**
 * A code marker with its code list, e.g. {@code kode 1434/1364}. Offsets are
 * relative to the text the span was found in.
 */
public record CodeSpan(int start, int end, List<String> codes) {
    public CodeSpan {
        codes = List.copyOf(codes);
    }
}
