package com.delta.lottracker.discovery.service;

import com.delta.lottracker.discovery.model.AugmentOutcome;
import com.delta.lottracker.discovery.model.DiscoveryRunCounters;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-wide counters shared by the fetch and augmentation workers.
 */
final class RunStats {
    final AtomicInteger recordsFetched = new AtomicInteger();
    final AtomicInteger lotsCreated = new AtomicInteger();
    final AtomicInteger unmappable = new AtomicInteger();
    final AtomicInteger outOfScope = new AtomicInteger();
    final AtomicInteger recordsRejected = new AtomicInteger();
    final AtomicInteger lotsExpired = new AtomicInteger();
    final AtomicInteger lotsAugmented = new AtomicInteger();
    final AtomicInteger augmentUnchanged = new AtomicInteger();
    final AtomicInteger lotsDegraded = new AtomicInteger();
    final AtomicInteger augmentFailures = new AtomicInteger();
    final AtomicInteger lotsScored = new AtomicInteger();
    private final Set<String> discoveredIds = ConcurrentHashMap.newKeySet();

    void discovered(String lotId) {
        discoveredIds.add(lotId);
    }

    void record(AugmentOutcome outcome) {
        AtomicInteger counter = switch (outcome) {
            case UPDATED -> lotsAugmented;
            case UNCHANGED -> augmentUnchanged;
            case DEGRADED -> lotsDegraded;
            case FAILED -> augmentFailures;
            case SKIPPED -> null;
        };
        if (counter != null) {
            counter.incrementAndGet();
        }
    }

    DiscoveryRunCounters snapshot() {
        return new DiscoveryRunCounters(
            recordsFetched.get(),
            discoveredIds.size(),
            lotsCreated.get(),
            unmappable.get(),
            outOfScope.get(),
            recordsRejected.get(),
            lotsExpired.get(),
            lotsAugmented.get(),
            augmentUnchanged.get(),
            lotsDegraded.get(),
            augmentFailures.get(),
            lotsScored.get()
        );
    }
}
