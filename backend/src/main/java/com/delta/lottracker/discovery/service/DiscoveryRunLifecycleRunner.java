package com.delta.lottracker.discovery.service;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.persistence.DiscoveryRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closes out runs left marked running by a previous process, so they do not block new runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DiscoveryRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunLifecycleRunner.class);

    private final DiscoveryRunRepository repository;
    private final DiscoveryProperties properties;
    private final Clock clock;

    public DiscoveryRunLifecycleRunner(DiscoveryRunRepository repository, DiscoveryProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getActiveRunMinutes()));
        int aborted = repository.failRunsStartedBefore(cutoff, now, "aborted_on_startup");
        if (aborted > 0) {
            log.info("Marked {} stale discovery runs failed (started before {})", aborted, cutoff);
        }
    }
}
