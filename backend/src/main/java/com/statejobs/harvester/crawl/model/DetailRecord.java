package com.statejobs.harvester.crawl.model;

import java.time.Instant;
import java.util.List;

public record DetailRecord(
    String listingId,
    String sourceUrl,
    String title,
    String jobTitle,
    String employerRaw,
    String employerNormalized,
    String locations,
    String employmentType,
    String extent,
    Instant publishedAt,
    Instant updatedAt,
    Instant applyDeadline,
    SalaryParse listingSalary,
    List<JobCodeEntry> jobCodes
) {
    public DetailRecord {
        jobCodes = jobCodes == null ? List.of() : List.copyOf(jobCodes);
    }
}
