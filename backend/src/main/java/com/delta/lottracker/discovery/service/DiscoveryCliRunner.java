package com.delta.lottracker.discovery.service;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.DiscoveryRunSummary;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.RunPhase;
import com.delta.lottracker.discovery.model.SourceStreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs discovery once at startup when {@code discovery.cli.run} is set.
 */
@Component
public class DiscoveryCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCliRunner.class);

    private final DiscoveryProperties properties;
    private final DiscoveryOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public DiscoveryCliRunner(
        DiscoveryProperties properties,
        DiscoveryOrchestratorService orchestratorService,
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

        DiscoveryRunSummary summary = orchestratorService.run();
        log.info("Discovery run {} completed with status {}", summary.runId(), summary.status());
        for (SourceStreamResult stream : summary.streams()) {
            log.info(
                "Stream {}/{}: status={}, pages={}, records={}{}",
                stream.source().key(),
                stream.streamKey(),
                stream.status(),
                stream.pagesFetched(),
                stream.recordsFetched(),
                stream.errorMessage() == null ? "" : ", error=" + stream.errorMessage()
            );
        }
        int rank = 1;
        for (Lot lot : summary.rankedLots()) {
            log.info(
                "#{} lot {} score={} bid={} retail={} bidders={} closes={} {}",
                rank++,
                lot.id(),
                String.format("%.3f", lot.opportunityScore()),
                lot.currentBid(),
                lot.retailPrice(),
                lot.uniqueBidders(),
                lot.closesAt(),
                lot.title()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.status() == RunPhase.DONE ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
