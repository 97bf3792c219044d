package com.statejobs.harvester.crawl.output;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.model.ExplodedRow;
import com.statejobs.harvester.crawl.model.ListingAggregate;
import com.statejobs.harvester.crawl.model.MatchStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestOutputWriterTest {
    private static final Instant RUN_STARTED = Instant.parse("2024-05-03T10:15:30Z");

    @TempDir
    Path tempDir;

    private HarvesterProperties properties;
    private HarvestOutputWriter writer;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        properties.getOutput().setDir(tempDir.resolve("out").toString());
        writer = new HarvestOutputWriter(properties);
    }

    @Test
    void writesExplodedRowsWithHeaderAndEmptyCellsForNulls() throws Exception {
        ExplodedRow coded = new ExplodedRow(
            "12345",
            "1234",
            "Rådgiver",
            "forsvaret",
            600000L,
            750000L,
            "kr 600 000 – 750 000",
            true,
            Instant.parse("2024-05-01T00:00:00Z"),
            null,
            null,
            "https://example.com/12345",
            RUN_STARTED,
            "forsvar",
            1.0,
            MatchStrategy.PREFIX
        );
        ExplodedRow bare = new ExplodedRow(
            "67890", null, null, "pst", null, null, null, false,
            null, null, null, "https://example.com/67890", RUN_STARTED, "pst", 1.0, MatchStrategy.EXACT
        );

        OutputFiles files = writer.write(List.of(coded, bare), List.of(), RUN_STARTED);

        assertThat(files.explodedCsv().getFileName().toString()).isEqualTo("jobs_exploded-20240503T101530Z.csv");
        List<String> lines = Files.readAllLines(files.explodedCsv(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(String.join(",", HarvestOutputWriter.EXPLODED_COLUMNS));
        assertThat(lines.get(1)).isEqualTo(
            "12345,1234,Rådgiver,forsvaret,600000,750000,kr 600 000 – 750 000,true,"
                + "2024-05-01T00:00:00Z,,,https://example.com/12345,2024-05-03T10:15:30Z,forsvar,1.0,PREFIX"
        );
        assertThat(lines.get(2)).isEqualTo(
            "67890,,,pst,,,,false,,,,https://example.com/67890,2024-05-03T10:15:30Z,pst,1.0,EXACT"
        );
    }

    @Test
    void writesListingsFileAndQuotesSeparators() throws Exception {
        properties.getOutput().setTimestampedFiles(false);
        ListingAggregate listing = new ListingAggregate(
            "12345",
            "Seniorrådgiver, analyse",
            null,
            "Forsvaret",
            "forsvaret",
            "forsvar",
            1.0,
            MatchStrategy.PREFIX,
            "Oslo | Bergen",
            "Fast",
            "100%",
            null,
            null,
            null,
            "https://example.com/12345",
            2,
            RUN_STARTED
        );

        OutputFiles files = writer.write(List.of(), List.of(listing), RUN_STARTED);

        assertThat(files.listingsCsv().getFileName().toString()).isEqualTo("listings.csv");
        assertThat(files.explodedCsv().getFileName().toString()).isEqualTo("jobs_exploded.csv");
        assertThat(Files.readAllLines(files.explodedCsv())).containsExactly(
            String.join(",", HarvestOutputWriter.EXPLODED_COLUMNS)
        );
        List<String> lines = Files.readAllLines(files.listingsCsv(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).startsWith("12345,\"Seniorrådgiver, analyse\",,Forsvaret,forsvaret,forsvar,1.0,PREFIX,");
        assertThat(lines.get(1)).endsWith(",https://example.com/12345,2,2024-05-03T10:15:30Z");
    }
}
