package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.model.HarvestRunRequest;
import com.statejobs.harvester.crawl.model.HarvestRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        HarvestRunRequest request = new HarvestRunRequest(
            properties.getCli().isFullRefresh(),
            properties.getCli().getMaxPages(),
            null
        );

        HarvestRunSummary summary = orchestratorService.run(request);
        log.info(
            "Harvest completed rows={} listings={} candidates={} exploded={} listingsFile={}",
            summary.rowsProduced(),
            summary.listingsDiscovered(),
            summary.detailCandidates(),
            summary.explodedOutputPath(),
            summary.listingsOutputPath()
        );
        log.info(
            "Metrics total_rows={} codes_present={} codes_pct={} salary_any_present={} salary_any_pct={} reduction_ratio={}",
            summary.metrics().totalRows(),
            summary.metrics().codesPresent(),
            summary.metrics().codesPct(),
            summary.metrics().salaryAnyPresent(),
            summary.metrics().salaryAnyPct(),
            summary.reductionRatio()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.cancelled() ? 130 : 0);
            System.exit(exitCode);
        }
    }
}
