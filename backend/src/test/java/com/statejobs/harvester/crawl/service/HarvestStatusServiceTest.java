package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.crawl.model.StatusResponse;
import com.statejobs.harvester.crawl.persistence.ListingStateRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HarvestStatusServiceTest {
    @Mock
    private ListingStateRepository repository;
    @Mock
    private HarvestOrchestratorService orchestratorService;
    @InjectMocks
    private HarvestStatusService statusService;

    @Test
    void unreachableDatabaseReportsNoCounts() {
        when(repository.isDbReachable()).thenThrow(new DataAccessResourceFailureException("down"));
        when(orchestratorService.isRunActive()).thenReturn(true);

        StatusResponse status = statusService.getStatus();

        assertThat(status.dbConnectivity()).isFalse();
        assertThat(status.runActive()).isTrue();
        assertThat(status.counts()).isEmpty();
        verify(repository, never()).stateCounts();
    }

    @Test
    void reachableDatabaseReportsCounts() {
        when(repository.isDbReachable()).thenReturn(true);
        when(repository.stateCounts()).thenReturn(Map.of("listings", 4L));

        StatusResponse status = statusService.getStatus();

        assertThat(status.dbConnectivity()).isTrue();
        assertThat(status.runActive()).isFalse();
        assertThat(status.counts()).containsEntry("listings", 4L);
    }

    @Test
    void unknownListingIsNotFound() {
        assertThatThrownBy(() -> statusService.getListing("missing"))
            .isInstanceOf(ResponseStatusException.class)
            .hasMessageContaining("listing not found: missing");
    }
}
