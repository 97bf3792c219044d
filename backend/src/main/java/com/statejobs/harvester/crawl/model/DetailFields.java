package com.statejobs.harvester.crawl.model;

import java.time.Instant;

/**
 * Raw fields pulled from a detail page. Every field is nullable; a missing
 * selector simply leaves its field empty.
 *
 * @param rawDetailText line-separated text handed to the salary and code parser
 * @param contentText   normalized page text used for the detail fingerprint
 */
public record DetailFields(
    String title,
    String jobTitle,
    String employerRaw,
    String locations,
    String employmentType,
    String extent,
    Instant publishedAt,
    Instant updatedAt,
    Instant applyDeadline,
    String salaryText,
    String rawDetailText,
    String contentText
) {
}
