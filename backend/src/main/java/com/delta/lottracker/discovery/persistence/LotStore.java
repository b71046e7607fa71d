package com.delta.lottracker.discovery.persistence;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotQuery;
import com.delta.lottracker.discovery.model.LotUpsertResult;
import com.delta.lottracker.discovery.reconcile.Reconciler;
import com.delta.lottracker.discovery.scoring.LotScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable lot table. Every write goes read, merge, score, write under the lock stripe of the lot
 * id, so concurrent sightings of one lot serialize while most unrelated lots proceed in parallel.
 */
@Service
public class LotStore {
    private static final Logger log = LoggerFactory.getLogger(LotStore.class);
    private static final int RESCORE_PAGE_SIZE = 500;
    static final int LOCK_STRIPES = 256;

    private final LotJdbcRepository repository;
    private final Reconciler reconciler;
    private final LotScorer scorer;
    private final Clock clock;
    private final Object[] lotLocks = new Object[LOCK_STRIPES];

    public LotStore(LotJdbcRepository repository, Reconciler reconciler, LotScorer scorer, Clock clock) {
        this.repository = repository;
        this.reconciler = reconciler;
        this.scorer = scorer;
        this.clock = clock;
        for (int i = 0; i < lotLocks.length; i++) {
            lotLocks[i] = new Object();
        }
    }

    public LotUpsertResult upsert(Lot incoming) {
        synchronized (lockFor(incoming.id())) {
            Instant now = now();
            Optional<Lot> existing = repository.findById(incoming.id());
            if (existing.isPresent()) {
                return write(existing.get(), incoming, now);
            }
            Lot created = scorer.score(reconciler.merge(null, incoming), now);
            try {
                repository.insert(created, now);
                return new LotUpsertResult(created, true, !created.hasNoBids());
            } catch (DataIntegrityViolationException e) {
                // only a row inserted by another process in the meantime turns this into an update
                Optional<Lot> current = repository.findById(incoming.id());
                if (current.isEmpty()) {
                    throw e;
                }
                return write(current.get(), incoming, now);
            }
        }
    }

    public Optional<Lot> get(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(id.trim());
    }

    public List<Lot> query(LotQuery query) {
        return repository.query(query == null ? new LotQuery(null, null, null, null, null, null, null, null) : query);
    }

    /**
     * Open lots with absent or stale rendered bid data, bounded to {@code batchSize}. With
     * {@code excludeSameDay}, lots closing on the current calendar day in {@code zone} are left out.
     * A non-empty {@code locations} set limits candidates to those warehouses.
     */
    public List<Lot> findAugmentationCandidates(
        Instant now,
        Duration freshness,
        int batchSize,
        boolean excludeSameDay,
        ZoneId zone,
        Set<Location> locations
    ) {
        Instant excludeFrom = null;
        Instant excludeUntil = null;
        if (excludeSameDay) {
            LocalDate today = LocalDate.ofInstant(now, zone);
            excludeFrom = today.atStartOfDay(zone).toInstant();
            excludeUntil = today.plusDays(1).atStartOfDay(zone).toInstant();
        }
        return repository.findAugmentationCandidates(
            now, now.minus(freshness), excludeFrom, excludeUntil, locations, batchSize);
    }

    /**
     * Marks lots closed whose close time is before {@code cutoff}. Lots are never deleted.
     *
     * @return number of lots closed
     */
    public int expireLotsClosedBefore(Instant cutoff) {
        int expired = 0;
        for (String id : repository.findOpenIdsClosedBefore(cutoff)) {
            synchronized (lockFor(id)) {
                Optional<Lot> current = repository.findById(id);
                if (current.isEmpty() || !current.get().open()) {
                    continue;
                }
                Instant now = now();
                Lot closed = scorer.score(current.get().toBuilder().open(false).build(), now);
                repository.update(closed, now);
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Marked {} lots closed (close time before {})", expired, cutoff);
        }
        return expired;
    }

    /**
     * Recomputes scores of every open lot; scores depend on the clock through bid data age.
     *
     * @return number of lots scored
     */
    public int rescoreOpenLots(Instant now) {
        int scored = 0;
        String afterId = null;
        while (true) {
            List<Lot> page = repository.findOpenLotsAfter(afterId, RESCORE_PAGE_SIZE);
            if (page.isEmpty()) {
                return scored;
            }
            for (Lot lot : page) {
                synchronized (lockFor(lot.id())) {
                    Lot current = repository.findById(lot.id()).orElse(lot);
                    Lot rescored = scorer.score(current, now);
                    if (!rescored.equals(current)) {
                        repository.update(rescored, now);
                    }
                    scored++;
                }
            }
            afterId = page.get(page.size() - 1).id();
        }
    }

    Object lockFor(String id) {
        return lotLocks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private LotUpsertResult write(Lot existing, Lot incoming, Instant now) {
        Lot merged = scorer.score(reconciler.merge(existing, incoming), now);
        if (!merged.equals(existing)) {
            repository.update(merged, now);
        }
        return new LotUpsertResult(merged, false, bidChanged(existing, merged));
    }

    private static boolean bidChanged(Lot before, Lot after) {
        return before.currentBid().compareTo(after.currentBid()) != 0
            || before.bidCount() != after.bidCount()
            || before.uniqueBidders() != after.uniqueBidders();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
