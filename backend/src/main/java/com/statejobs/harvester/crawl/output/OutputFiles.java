package com.statejobs.harvester.crawl.output;

import java.nio.file.Path;

public record OutputFiles(Path explodedCsv, Path listingsCsv) {
}
