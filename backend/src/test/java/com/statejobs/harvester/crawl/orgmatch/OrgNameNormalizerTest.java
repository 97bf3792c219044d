package com.statejobs.harvester.crawl.orgmatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OrgNameNormalizerTest {

    @Test
    void foldsNorwegianLettersAndDiacritics() {
        assertEquals("sor-trondelag aerlig a cafe", OrgNameNormalizer.normalize("Sør-Trøndelag Ærlig Å Café"));
    }

    @Test
    void punctuationAndLooseHyphensBecomeSpaces() {
        assertEquals("politiets sikkerhetstjeneste pst", OrgNameNormalizer.normalize("Politiets  sikkerhetstjeneste (PST)"));
        assertEquals("personell og verneplikt", OrgNameNormalizer.normalize("personell- og -verneplikt"));
    }

    @Test
    void blankIsEmpty() {
        assertEquals("", OrgNameNormalizer.normalize(null));
        assertEquals("", OrgNameNormalizer.normalize("   "));
    }
}
