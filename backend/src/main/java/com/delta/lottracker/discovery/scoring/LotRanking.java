package com.delta.lottracker.discovery.scoring;

import com.delta.lottracker.discovery.model.Lot;

import java.time.Instant;
import java.util.Comparator;

/**
 * Result order: opportunity score descending, then earliest close, then id for a stable order.
 */
public final class LotRanking {
    public static final Comparator<Lot> ORDER = Comparator
        .comparingDouble(Lot::opportunityScore).reversed()
        .thenComparing(Lot::closesAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(Lot::id);

    private LotRanking() {
    }
}
