package com.delta.lottracker.discovery.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Store query filter. Null fields do not constrain the result.
 */
public record LotQuery(
    Boolean open,
    Set<Location> locations,
    Instant closesAfter,
    Instant closesBefore,
    Double minOpportunityScore,
    BigDecimal minRetailPrice,
    BigDecimal maxCurrentBid,
    Integer limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public LotQuery {
        locations = locations == null ? Set.of() : Set.copyOf(locations);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public static LotQuery openLots(Set<Location> locations, int limit) {
        return new LotQuery(true, locations, null, null, null, null, null, limit);
    }
}
