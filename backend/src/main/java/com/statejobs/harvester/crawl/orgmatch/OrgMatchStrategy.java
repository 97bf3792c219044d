package com.statejobs.harvester.crawl.orgmatch;

import com.statejobs.harvester.crawl.model.OrgMatch;

/**
 * One rule of the organization matcher. Inputs are already normalized.
 * Implementations return {@code null} when they do not apply.
 */
public interface OrgMatchStrategy {
    OrgMatch match(OrgMatchInput input, OrgMatchRules rules);
}
