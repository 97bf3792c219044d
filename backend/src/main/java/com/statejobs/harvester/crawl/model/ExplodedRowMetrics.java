package com.statejobs.harvester.crawl.model;

import java.util.Collection;

public record ExplodedRowMetrics(
    int totalRows,
    int codesPresent,
    double codesPct,
    int salaryAnyPresent,
    double salaryAnyPct
) {
    public static ExplodedRowMetrics compute(Collection<ExplodedRow> rows) {
        int total = rows == null ? 0 : rows.size();
        if (total == 0) {
            return new ExplodedRowMetrics(0, 0, 0.0, 0, 0.0);
        }
        int codes = 0;
        int salaries = 0;
        for (ExplodedRow row : rows) {
            if (row.jobCode() != null) {
                codes++;
            }
            if (row.hasBounds()) {
                salaries++;
            }
        }
        return new ExplodedRowMetrics(total, codes, (double) codes / total, salaries, (double) salaries / total);
    }
}
