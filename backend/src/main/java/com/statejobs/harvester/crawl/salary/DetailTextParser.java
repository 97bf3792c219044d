package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.crawl.model.JobCodeEntry;
import com.statejobs.harvester.crawl.model.ParsedDetail;
import com.statejobs.harvester.crawl.model.SalaryParse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the free text of a detail page into job codes with bound salaries.
 *
 * <p>The text is read line by line. A line holding one code marker is that
 * code's block; a line with several markers is cut into one segment per
 * marker. A salary found inside a block binds to the block's codes. A block
 * without a salary stays open for the lines that follow it, until the next
 * marker or a blank line: the first salary line found there binds to it, as
 * long as every earlier block already has a salary of its own. Any other
 * salary line is listing-level and is applied to every code that has no salary
 * of its own, flagged as shared when the listing has more than one distinct code.
 */
@Component
public class DetailTextParser {
    private static final Logger log = LoggerFactory.getLogger(DetailTextParser.class);
    private static final String AMBIGUOUS_JOINER = " | ";

    private final JobCodeExtractor jobCodeExtractor;
    private final SalaryTextParser salaryTextParser;

    public DetailTextParser(JobCodeExtractor jobCodeExtractor, SalaryTextParser salaryTextParser) {
        this.jobCodeExtractor = jobCodeExtractor;
        this.salaryTextParser = salaryTextParser;
    }

    public ParsedDetail parseDetail(String rawDetailText) {
        if (rawDetailText == null || rawDetailText.isBlank()) {
            return new ParsedDetail(List.of(), null);
        }
        List<PendingCode> pending = new ArrayList<>();
        List<SalaryParse> listingPhrases = new ArrayList<>();
        int openBlock = -1;

        for (String rawLine : rawDetailText.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                openBlock = -1;
                continue;
            }
            List<CodeSpan> spans = jobCodeExtractor.findSpans(line);
            if (spans.isEmpty()) {
                if (!salaryTextParser.hasSalaryContent(line)) {
                    continue;
                }
                if (canBindToBlock(pending, openBlock)) {
                    SalaryParse local = salaryTextParser.parse(line);
                    for (int i = openBlock; i < pending.size(); i++) {
                        pending.get(i).localSalary = local;
                    }
                    openBlock = -1;
                } else {
                    addListingPhrase(line, listingPhrases);
                }
                continue;
            }
            if (spans.size() == 1) {
                openBlock = bindBlock(line, spans.get(0), pending);
                continue;
            }
            addListingPhrase(line.substring(0, spans.get(0).start()).trim(), listingPhrases);
            for (int i = 0; i < spans.size(); i++) {
                CodeSpan span = spans.get(i);
                int segmentEnd = i + 1 < spans.size() ? spans.get(i + 1).start() : line.length();
                String segment = line.substring(span.start(), segmentEnd);
                CodeSpan relative = new CodeSpan(0, span.end() - span.start(), span.codes());
                openBlock = bindBlock(segment.trim(), relative, pending);
            }
        }

        SalaryParse listingSalary = resolveListingSalary(listingPhrases);
        Set<String> distinctCodes = new LinkedHashSet<>();
        for (PendingCode code : pending) {
            distinctCodes.add(code.code);
        }
        boolean shared = distinctCodes.size() >= 2;

        List<JobCodeEntry> entries = new ArrayList<>();
        for (PendingCode code : pending) {
            if (code.localSalary != null) {
                SalaryParse local = code.localSalary;
                entries.add(new JobCodeEntry(code.code, code.title, local.min(), local.max(), local.text(), false));
            } else if (listingSalary != null) {
                entries.add(new JobCodeEntry(
                    code.code,
                    code.title,
                    listingSalary.min(),
                    listingSalary.max(),
                    listingSalary.text(),
                    shared
                ));
            } else {
                entries.add(new JobCodeEntry(code.code, code.title, null, null, null, false));
            }
        }
        return new ParsedDetail(entries, listingSalary);
    }

    /**
     * Adds the block's codes and returns the index of its first code when the
     * block is still waiting for a salary, otherwise -1.
     */
    private int bindBlock(String block, CodeSpan span, List<PendingCode> pending) {
        String title = jobCodeExtractor.titleAfter(block, span);
        SalaryParse local = salaryTextParser.hasSalaryContent(block) ? salaryTextParser.parse(block) : null;
        int first = pending.size();
        for (String code : span.codes()) {
            pending.add(new PendingCode(code, title, local));
        }
        return local == null ? first : -1;
    }

    private boolean canBindToBlock(List<PendingCode> pending, int openBlock) {
        if (openBlock < 0 || openBlock >= pending.size()) {
            return false;
        }
        for (int i = 0; i < openBlock; i++) {
            if (pending.get(i).localSalary == null) {
                return false;
            }
        }
        return true;
    }

    private void addListingPhrase(String text, List<SalaryParse> listingPhrases) {
        if (text.isEmpty() || !salaryTextParser.hasSalaryContent(text)) {
            return;
        }
        SalaryParse parsed = salaryTextParser.parse(text);
        if (parsed != null) {
            listingPhrases.add(parsed);
        }
    }

    /**
     * Several listing-level phrases collapse to one when exactly one carries
     * bounds, when all bounded phrases agree, or when none carries bounds.
     */
    SalaryParse resolveListingSalary(List<SalaryParse> phrases) {
        if (phrases.isEmpty()) {
            return null;
        }
        if (phrases.size() == 1) {
            return phrases.get(0);
        }
        List<SalaryParse> bounded = new ArrayList<>();
        for (SalaryParse phrase : phrases) {
            if (phrase.hasBounds()) {
                bounded.add(phrase);
            }
        }
        if (bounded.isEmpty()) {
            return phrases.get(0);
        }
        SalaryParse first = bounded.get(0);
        boolean agree = true;
        for (SalaryParse phrase : bounded) {
            agree &= first.sameBounds(phrase);
        }
        if (agree) {
            return first;
        }
        Set<String> texts = new LinkedHashSet<>();
        for (SalaryParse phrase : bounded) {
            texts.add(phrase.text());
        }
        log.debug("Conflicting listing salary phrases count={}", bounded.size());
        return SalaryParse.ambiguous(String.join(AMBIGUOUS_JOINER, texts));
    }

    private static final class PendingCode {
        private final String code;
        private final String title;
        private SalaryParse localSalary;

        private PendingCode(String code, String title, SalaryParse localSalary) {
            this.code = code;
            this.title = title;
            this.localSalary = localSalary;
        }
    }
}
