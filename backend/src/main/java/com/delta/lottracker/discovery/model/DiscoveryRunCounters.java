package com.delta.lottracker.discovery.model;

public record DiscoveryRunCounters(
    int recordsFetched,
    int lotsDiscovered,
    int lotsCreated,
    int unmappable,
    int outOfScope,
    int recordsRejected,
    int lotsExpired,
    int lotsAugmented,
    int augmentUnchanged,
    int lotsDegraded,
    int augmentFailures,
    int lotsScored
) {
    public static DiscoveryRunCounters empty() {
        return new DiscoveryRunCounters(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
