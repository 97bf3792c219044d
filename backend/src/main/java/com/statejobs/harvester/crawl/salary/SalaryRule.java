package com.statejobs.harvester.crawl.salary;

import com.statejobs.harvester.crawl.model.SalaryParse;

/**
 * One step of salary phrase parsing.
 */
public interface SalaryRule {
    /**
     * @param cleaned  phrase with currency tokens, code spans and odd spaces removed
     * @param original phrase as it appeared in the listing
     * @return the parse, or {@code null} to let the next rule try
     */
    SalaryParse apply(String cleaned, String original);
}
