package com.delta.lottracker.discovery.reconcile;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.SourceTag;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Field-level merge of two sightings of the same lot. Total and idempotent: merging a lot with
 * itself, or re-applying the same incoming record, yields the same lot.
 *
 * <p>Rules:
 * <ul>
 *   <li>descriptive fields: incoming non-blank value, else existing</li>
 *   <li>location: incoming unless it is {@link Location#UNKNOWN}</li>
 *   <li>retail price: never unset; the larger of two positive values</li>
 *   <li>bid fields: never decrease; provenance follows the larger bid, then channel trust
 *       (rendered, summary, search), then observation time</li>
 *   <li>open flag: terminal once false</li>
 *   <li>close time: most recent non-null sighting</li>
 *   <li>source sightings: union, latest time per channel</li>
 * </ul>
 * Scores are left to the scorer.
 */
@Component
public class Reconciler {
    private static final Map<SourceTag, Integer> TRUST = new EnumMap<>(Map.of(
        SourceTag.RENDERED, 3,
        SourceTag.SUMMARY, 2,
        SourceTag.SEARCH, 1
    ));

    public Lot merge(Lot existing, Lot incoming) {
        if (existing == null) {
            return incoming;
        }
        if (incoming == null) {
            return existing;
        }
        if (!existing.id().equals(incoming.id())) {
            throw new IllegalArgumentException("cannot merge lot " + incoming.id() + " into " + existing.id());
        }

        Lot.Builder merged = existing.toBuilder()
            .title(firstNonBlank(incoming.title(), existing.title()))
            .category(firstNonBlank(incoming.category(), existing.category()))
            .brand(firstNonBlank(incoming.brand(), existing.brand()))
            .condition(firstNonBlank(incoming.condition(), existing.condition()))
            .auctionId(firstNonBlank(incoming.auctionId(), existing.auctionId()))
            .location(incoming.location() == Location.UNKNOWN ? existing.location() : incoming.location())
            .retailPrice(mergeRetail(existing.retailPrice(), incoming.retailPrice()))
            .open(existing.open() && incoming.open())
            .closesAt(mergeClosesAt(existing, incoming))
            .sourceSeen(mergeSeen(existing.sourceSeen(), incoming.sourceSeen()));

        merged.currentBid(existing.currentBid().max(incoming.currentBid()))
            .bidCount(Math.max(existing.bidCount(), incoming.bidCount()))
            .uniqueBidders(Math.max(existing.uniqueBidders(), incoming.uniqueBidders()));
        if (adoptBidProvenance(existing, incoming)) {
            merged.bidSource(incoming.bidSource()).bidObservedAt(incoming.bidObservedAt());
        }
        return merged.build();
    }

    public static int trust(SourceTag source) {
        return source == null ? 0 : TRUST.getOrDefault(source, 0);
    }

    private boolean adoptBidProvenance(Lot existing, Lot incoming) {
        if (incoming.bidSource() == null) {
            return false;
        }
        int comparison = incoming.currentBid().compareTo(existing.currentBid());
        if (comparison != 0) {
            return comparison > 0;
        }
        if (existing.bidSource() == null) {
            return true;
        }
        int trustDelta = trust(incoming.bidSource()) - trust(existing.bidSource());
        if (trustDelta != 0) {
            return trustDelta > 0;
        }
        return isAfter(incoming.bidObservedAt(), existing.bidObservedAt());
    }

    private BigDecimal mergeRetail(BigDecimal existing, BigDecimal incoming) {
        if (incoming == null || incoming.signum() == 0) {
            return existing != null ? existing : incoming;
        }
        if (existing == null) {
            return incoming;
        }
        return existing.max(incoming);
    }

    private Instant mergeClosesAt(Lot existing, Lot incoming) {
        if (incoming.closesAt() == null) {
            return existing.closesAt();
        }
        if (existing.closesAt() == null) {
            return incoming.closesAt();
        }
        Instant incomingSeen = incoming.latestSeen();
        Instant existingSeen = existing.latestSeen();
        if (incomingSeen == null || (existingSeen != null && incomingSeen.isBefore(existingSeen))) {
            return existing.closesAt();
        }
        return incoming.closesAt();
    }

    private Map<SourceTag, Instant> mergeSeen(Map<SourceTag, Instant> existing, Map<SourceTag, Instant> incoming) {
        Map<SourceTag, Instant> union = new EnumMap<>(SourceTag.class);
        union.putAll(existing);
        incoming.forEach((source, at) -> union.merge(source, at, (a, b) -> b.isAfter(a) ? b : a));
        return union;
    }

    private static boolean isAfter(Instant candidate, Instant current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback;
    }
}
