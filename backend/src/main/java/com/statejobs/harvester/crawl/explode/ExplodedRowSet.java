package com.statejobs.harvester.crawl.explode;

import com.statejobs.harvester.crawl.model.ExplodedRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-wide row collection keyed by (listing_id, job_code). A second row for a
 * key replaces the first only when it carries salary bounds and the first
 * does not.
 */
public class ExplodedRowSet {
    private final Map<ExplodedRow.RowKey, ExplodedRow> rows = new LinkedHashMap<>();
    private int mergedDuplicates;

    public void addAll(Collection<ExplodedRow> candidates) {
        for (ExplodedRow candidate : candidates) {
            add(candidate);
        }
    }

    public void add(ExplodedRow candidate) {
        ExplodedRow existing = rows.get(candidate.key());
        if (existing == null) {
            rows.put(candidate.key(), candidate);
            return;
        }
        mergedDuplicates++;
        if (!existing.hasBounds() && candidate.hasBounds()) {
            rows.put(candidate.key(), candidate);
        }
    }

    public List<ExplodedRow> rows() {
        return new ArrayList<>(rows.values());
    }

    public int size() {
        return rows.size();
    }

    public int mergedDuplicates() {
        return mergedDuplicates;
    }
}
