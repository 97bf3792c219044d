package com.statejobs.harvester.crawl.api;

import com.statejobs.harvester.crawl.identity.IdProvenance;
import com.statejobs.harvester.crawl.model.ListingSummary;
import com.statejobs.harvester.crawl.service.ListingStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class HarvestControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ListingStateService stateService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/harvest/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void statusReportsDatabaseAndCounts() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.runActive").value(false))
            .andExpect(jsonPath("$.counts.listings").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.counts.never_fetched").exists());
    }

    @Test
    void listingLookupAndCandidates() throws Exception {
        stateService.upsertSummary(new ListingSummary(
            "API-1",
            "https://jobs.example.no/stilling/API-1",
            null,
            Instant.parse("2024-05-01T00:00:00Z"),
            IdProvenance.NATIVE_ATTRIBUTE
        ));

        mockMvc.perform(get("/api/listings/API-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.listingId").value("API-1"))
            .andExpect(jsonPath("$.lifecycle").value("SUMMARY_SEEN"))
            .andExpect(jsonPath("$.observedUpdatedAt").value("2024-05-01T00:00:00Z"));

        mockMvc.perform(get("/api/listings/candidates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].listingId").value(hasItem("API-1")));
    }

    @Test
    void unknownListingIsNotFound() throws Exception {
        mockMvc.perform(get("/api/listings/does-not-exist"))
            .andExpect(status().isNotFound());
    }

    @Test
    void invalidRunParametersAreRejected() throws Exception {
        mockMvc.perform(post("/api/harvest/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"maxPages\": 0}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/harvest/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fuzzyThreshold\": 1.5}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unreachableSearchPageEndsRunWithoutListings() throws Exception {
        mockMvc.perform(post("/api/harvest/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fullRefresh\": false, \"maxPages\": 1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pagesFetched").value(0))
            .andExpect(jsonPath("$.listingsDiscovered").value(0))
            .andExpect(jsonPath("$.cancelled").value(false));
    }
}
