package com.statejobs.harvester.crawl.output;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.model.ExplodedRow;
import com.statejobs.harvester.crawl.model.ListingAggregate;
import com.statejobs.harvester.crawl.util.DateNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the exploded rows and the listing aggregates as CSV. Nulls are written
 * as empty cells and timestamps as ISO-8601 UTC.
 */
@Component
public class HarvestOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(HarvestOutputWriter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
        .withZone(ZoneOffset.UTC);

    public static final String[] EXPLODED_COLUMNS = {
        "listing_id",
        "job_code",
        "job_title",
        "employer_normalized",
        "salary_min",
        "salary_max",
        "salary_text",
        "is_shared_salary",
        "published_at",
        "updated_at",
        "apply_deadline",
        "source_url",
        "scraped_at",
        "matched_org_tag",
        "match_confidence",
        "match_strategy"
    };

    public static final String[] LISTING_COLUMNS = {
        "listing_id",
        "title",
        "job_title",
        "employer_raw",
        "employer_normalized",
        "matched_org_tag",
        "match_confidence",
        "match_strategy",
        "locations",
        "employment_type",
        "extent",
        "published_at",
        "updated_at",
        "apply_deadline",
        "source_url",
        "job_code_count",
        "scraped_at"
    };

    private final HarvesterProperties properties;

    public HarvestOutputWriter(HarvesterProperties properties) {
        this.properties = properties;
    }

    public OutputFiles write(List<ExplodedRow> rows, List<ListingAggregate> listings, Instant runStartedAt) {
        HarvesterProperties.Output output = properties.getOutput();
        Path dir = Path.of(output.getDir());
        String suffix = output.isTimestampedFiles() ? "-" + FILE_STAMP.format(runStartedAt) : "";
        Path explodedPath = dir.resolve(output.getExplodedFilename() + suffix + ".csv");
        Path listingsPath = dir.resolve(output.getListingsFilename() + suffix + ".csv");
        try {
            Files.createDirectories(dir);
            writeExploded(explodedPath, rows);
            writeListings(listingsPath, listings);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write harvest output to " + dir.toAbsolutePath(), e);
        }
        log.info("Wrote harvest output rows={} listings={} exploded={} listingsFile={}",
            rows.size(), listings.size(), explodedPath, listingsPath);
        return new OutputFiles(explodedPath, listingsPath);
    }

    void writeExploded(Path path, List<ExplodedRow> rows) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = format(EXPLODED_COLUMNS).print(writer)) {
            for (ExplodedRow row : rows) {
                printer.printRecord(
                    row.listingId(),
                    row.jobCode(),
                    row.jobTitle(),
                    row.employerNormalized(),
                    row.salaryMin(),
                    row.salaryMax(),
                    row.salaryText(),
                    row.sharedSalary(),
                    iso(row.publishedAt()),
                    iso(row.updatedAt()),
                    iso(row.applyDeadline()),
                    row.sourceUrl(),
                    iso(row.scrapedAt()),
                    row.matchedOrgTag(),
                    row.matchConfidence(),
                    row.matchStrategy() == null ? null : row.matchStrategy().name()
                );
            }
        }
    }

    void writeListings(Path path, List<ListingAggregate> listings) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = format(LISTING_COLUMNS).print(writer)) {
            for (ListingAggregate listing : listings) {
                printer.printRecord(
                    listing.listingId(),
                    listing.title(),
                    listing.jobTitle(),
                    listing.employerRaw(),
                    listing.employerNormalized(),
                    listing.matchedOrgTag(),
                    listing.matchConfidence(),
                    listing.matchStrategy() == null ? null : listing.matchStrategy().name(),
                    listing.locations(),
                    listing.employmentType(),
                    listing.extent(),
                    iso(listing.publishedAt()),
                    iso(listing.updatedAt()),
                    iso(listing.applyDeadline()),
                    listing.sourceUrl(),
                    listing.jobCodeCount(),
                    iso(listing.scrapedAt())
                );
            }
        }
    }

    private CSVFormat format(String[] header) {
        return CSVFormat.DEFAULT.builder()
            .setHeader(header)
            .setNullString("")
            .setRecordSeparator("\n")
            .build();
    }

    private String iso(Instant value) {
        return DateNormalizer.toIsoString(value);
    }
}
