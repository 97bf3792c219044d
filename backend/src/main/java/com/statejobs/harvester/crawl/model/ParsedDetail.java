package com.statejobs.harvester.crawl.model;

import java.util.List;

public record ParsedDetail(List<JobCodeEntry> codes, SalaryParse listingSalary) {
    public ParsedDetail {
        codes = codes == null ? List.of() : List.copyOf(codes);
    }
}
