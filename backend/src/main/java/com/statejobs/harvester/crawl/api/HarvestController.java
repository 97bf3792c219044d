package com.statejobs.harvester.crawl.api;

import com.statejobs.harvester.crawl.model.DetailCandidate;
import com.statejobs.harvester.crawl.model.HarvestRunRequest;
import com.statejobs.harvester.crawl.model.HarvestRunSummary;
import com.statejobs.harvester.crawl.model.ListingStateView;
import com.statejobs.harvester.crawl.model.StatusResponse;
import com.statejobs.harvester.crawl.service.HarvestOrchestratorService;
import com.statejobs.harvester.crawl.service.HarvestStatusService;
import com.statejobs.harvester.crawl.service.ListingStateService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class HarvestController {
    private final HarvestOrchestratorService orchestratorService;
    private final HarvestStatusService statusService;
    private final ListingStateService stateService;

    public HarvestController(
        HarvestOrchestratorService orchestratorService,
        HarvestStatusService statusService,
        ListingStateService stateService
    ) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.stateService = stateService;
    }

    @PostMapping("/harvest/run")
    public HarvestRunSummary runHarvest(@RequestBody(required = false) HarvestApiRunRequest request) {
        if (request == null) {
            return orchestratorService.run(HarvestRunRequest.incremental());
        }
        if (request.maxPages() != null && request.maxPages() < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "maxPages must be >= 1");
        }
        if (request.fuzzyThreshold() != null && (request.fuzzyThreshold() < 0.0 || request.fuzzyThreshold() > 1.0)) {
            throw new ResponseStatusException(BAD_REQUEST, "fuzzyThreshold must be between 0 and 1");
        }
        return orchestratorService.run(new HarvestRunRequest(
            Boolean.TRUE.equals(request.fullRefresh()),
            request.maxPages(),
            request.fuzzyThreshold()
        ));
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return statusService.getStatus();
    }

    @GetMapping("/listings/candidates")
    public List<DetailCandidate> getCandidates(
        @RequestParam(name = "fullRefresh", required = false, defaultValue = "false") boolean fullRefresh
    ) {
        return stateService.selectDetailCandidates(fullRefresh);
    }

    @GetMapping("/listings/{listingId}")
    public ListingStateView getListing(@PathVariable("listingId") String listingId) {
        return statusService.getListing(listingId);
    }
}
