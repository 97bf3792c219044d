package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.crawl.model.ListingStateView;
import com.statejobs.harvester.crawl.model.StateRecord;
import com.statejobs.harvester.crawl.model.StatusResponse;
import com.statejobs.harvester.crawl.persistence.ListingStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class HarvestStatusService {
    private static final Logger log = LoggerFactory.getLogger(HarvestStatusService.class);

    private final ListingStateRepository repository;
    private final HarvestOrchestratorService orchestratorService;

    public HarvestStatusService(ListingStateRepository repository, HarvestOrchestratorService orchestratorService) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        boolean runActive = orchestratorService.isRunActive();
        if (!dbConnected) {
            return new StatusResponse(false, runActive, new LinkedHashMap<>());
        }
        Map<String, Long> counts = repository.stateCounts();
        return new StatusResponse(true, runActive, counts);
    }

    public ListingStateView getListing(String listingId) {
        StateRecord record = repository.findById(listingId);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "listing not found: " + listingId);
        }
        return ListingStateView.of(record);
    }
}
