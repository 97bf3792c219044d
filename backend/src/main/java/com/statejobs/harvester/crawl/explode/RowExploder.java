package com.statejobs.harvester.crawl.explode;

import com.statejobs.harvester.crawl.model.DetailRecord;
import com.statejobs.harvester.crawl.model.ExplodedRow;
import com.statejobs.harvester.crawl.model.JobCodeEntry;
import com.statejobs.harvester.crawl.model.OrgMatch;
import com.statejobs.harvester.crawl.model.SalaryParse;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits one row per job code of a detail record. A listing without codes still
 * yields a single row with a null code carrying the listing-level salary.
 */
@Component
public class RowExploder {

    public List<ExplodedRow> explode(DetailRecord detail, OrgMatch match, Instant scrapedAt) {
        List<ExplodedRow> rows = new ArrayList<>();
        if (detail == null) {
            return rows;
        }
        if (detail.jobCodes().isEmpty()) {
            SalaryParse salary = detail.listingSalary();
            rows.add(row(
                detail,
                match,
                scrapedAt,
                null,
                fallbackTitle(detail, null),
                salary == null ? null : salary.min(),
                salary == null ? null : salary.max(),
                salary == null ? null : salary.text(),
                false
            ));
            return rows;
        }

        Map<String, JobCodeEntry> merged = new LinkedHashMap<>();
        for (JobCodeEntry entry : detail.jobCodes()) {
            merged.merge(entry.code(), entry, RowExploder::preferBounded);
        }
        for (JobCodeEntry entry : merged.values()) {
            rows.add(row(
                detail,
                match,
                scrapedAt,
                entry.code(),
                fallbackTitle(detail, entry.title()),
                entry.salaryMin(),
                entry.salaryMax(),
                entry.salaryText(),
                entry.sharedSalary()
            ));
        }
        return rows;
    }

    static JobCodeEntry preferBounded(JobCodeEntry existing, JobCodeEntry candidate) {
        if (!existing.hasBounds() && candidate.hasBounds()) {
            return candidate;
        }
        return existing;
    }

    private static String fallbackTitle(DetailRecord detail, String codeTitle) {
        if (codeTitle != null && !codeTitle.isBlank()) {
            return codeTitle;
        }
        if (detail.jobTitle() != null && !detail.jobTitle().isBlank()) {
            return detail.jobTitle();
        }
        return detail.title();
    }

    private static ExplodedRow row(
        DetailRecord detail,
        OrgMatch match,
        Instant scrapedAt,
        String code,
        String title,
        Long salaryMin,
        Long salaryMax,
        String salaryText,
        boolean shared
    ) {
        return new ExplodedRow(
            detail.listingId(),
            code,
            title,
            detail.employerNormalized(),
            salaryMin,
            salaryMax,
            salaryText,
            shared,
            detail.publishedAt(),
            detail.updatedAt(),
            detail.applyDeadline(),
            detail.sourceUrl(),
            scrapedAt,
            match == null ? null : match.tag(),
            match == null ? null : match.confidence(),
            match == null ? null : match.strategy()
        );
    }
}
