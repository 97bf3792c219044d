package com.statejobs.harvester.crawl.model;

public record JobCodeEntry(
    String code,
    String title,
    Long salaryMin,
    Long salaryMax,
    String salaryText,
    boolean sharedSalary
) {
    public JobCodeEntry {
        if (salaryMin != null && salaryMax != null && salaryMin > salaryMax) {
            Long swap = salaryMin;
            salaryMin = salaryMax;
            salaryMax = swap;
        }
    }

    public boolean hasBounds() {
        return salaryMin != null || salaryMax != null;
    }
}
