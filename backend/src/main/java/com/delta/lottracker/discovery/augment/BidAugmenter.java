package com.delta.lottracker.discovery.augment;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.canonical.Canonicalizer;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.AugmentOutcome;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotUpsertResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.persistence.LotStore;
import com.delta.lottracker.discovery.source.DegradedPayloadException;
import com.delta.lottracker.discovery.source.RenderedPageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Refreshes bid state of one lot from its rendered page. Uses the session it is handed and never
 * authenticates on its own.
 */
@Service
public class BidAugmenter {
    private static final Logger log = LoggerFactory.getLogger(BidAugmenter.class);

    private final RenderedPageClient renderedPageClient;
    private final Canonicalizer canonicalizer;
    private final LotStore lotStore;
    private final DiscoveryProperties properties;
    private final Clock clock;

    public BidAugmenter(
        RenderedPageClient renderedPageClient,
        Canonicalizer canonicalizer,
        LotStore lotStore,
        DiscoveryProperties properties,
        Clock clock
    ) {
        this.renderedPageClient = renderedPageClient;
        this.canonicalizer = canonicalizer;
        this.lotStore = lotStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws SessionExpiredException when the session is invalid or the channel rejects it
     */
    public AugmentOutcome augment(Lot lot, AuthSession session) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (lot == null || !lot.open() || isFresh(lot, now)) {
            return AugmentOutcome.SKIPPED;
        }
        if (session == null || !session.isValid()) {
            throw new SessionExpiredException("auth session is not valid");
        }

        RawRecord raw;
        try {
            raw = renderedPageClient.fetchLot(lot.id(), session);
        } catch (DegradedPayloadException e) {
            log.warn("Lot {} rendered page degraded, keeping existing bid state: {}", lot.id(), e.getMessage());
            return AugmentOutcome.DEGRADED;
        } catch (SourceFetchException e) {
            if (e.isAuthRejected()) {
                throw new SessionExpiredException("rendered channel rejected session for lot " + lot.id(), e);
            }
            log.warn("Lot {} bid refresh failed: {}", lot.id(), e.getMessage());
            return AugmentOutcome.FAILED;
        }

        Optional<Lot> refreshed = canonicalizer.canonicalize(raw, now);
        if (refreshed.isEmpty() || !refreshed.get().id().equals(lot.id())) {
            log.warn("Lot {} rendered payload did not map to the same lot", lot.id());
            return AugmentOutcome.DEGRADED;
        }
        LotUpsertResult result = lotStore.upsert(refreshed.get());
        return result.bidChanged() ? AugmentOutcome.UPDATED : AugmentOutcome.UNCHANGED;
    }

    private boolean isFresh(Lot lot, Instant now) {
        Instant rendered = lot.lastSeen(SourceTag.RENDERED);
        if (rendered == null) {
            return false;
        }
        Duration freshness = properties.getAugment().freshness();
        return Duration.between(rendered, now).compareTo(freshness) < 0;
    }
}
