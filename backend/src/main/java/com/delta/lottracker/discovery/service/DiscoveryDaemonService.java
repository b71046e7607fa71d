package com.delta.lottracker.discovery.service;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.DiscoveryRunSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Repeats discovery runs on a fixed delay when {@code discovery.daemon.enabled} is set.
 */
@Service
public class DiscoveryDaemonService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryDaemonService.class);

    private final DiscoveryOrchestratorService orchestratorService;
    private final DiscoveryProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public DiscoveryDaemonService(DiscoveryOrchestratorService orchestratorService, DiscoveryProperties properties) {
        this.orchestratorService = orchestratorService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            DiscoveryProperties.Daemon daemon = properties.getDaemon();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("discovery-daemon");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            scheduler.scheduleWithFixedDelay(
                this::runOnce,
                daemon.getInitialDelaySeconds(),
                TimeUnit.MINUTES.toSeconds(daemon.getIntervalMinutes()),
                TimeUnit.SECONDS
            );
            log.info("Discovery daemon started (every {} minutes)", daemon.getIntervalMinutes());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduler != null) {
                scheduler.shutdownNow();
                try {
                    scheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
        }
    }

    void runOnce() {
        if (!running.get()) {
            return;
        }
        try {
            DiscoveryRunSummary summary = orchestratorService.run();
            log.info("Daemon discovery run {} finished with status {}", summary.runId(), summary.status());
        } catch (ActiveDiscoveryRunException e) {
            log.info("Daemon tick skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.warn("Daemon discovery run failed", e);
        }
    }
}
