package com.delta.lottracker.discovery.service;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.augment.AuthSession;
import com.delta.lottracker.discovery.augment.BidAugmenter;
import com.delta.lottracker.discovery.augment.SessionExpiredException;
import com.delta.lottracker.discovery.canonical.Canonicalizer;
import com.delta.lottracker.discovery.http.DiscoveryRunContext;
import com.delta.lottracker.discovery.http.RunCancellation;
import com.delta.lottracker.discovery.http.RunCancelledException;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.AugmentOutcome;
import com.delta.lottracker.discovery.model.DiscoveryRunStatus;
import com.delta.lottracker.discovery.model.DiscoveryRunSummary;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotQuery;
import com.delta.lottracker.discovery.model.LotUpsertResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.RenderedCursor;
import com.delta.lottracker.discovery.model.RunPhase;
import com.delta.lottracker.discovery.model.SearchQuery;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceStreamResult;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.persistence.DiscoveryRunRepository;
import com.delta.lottracker.discovery.persistence.LotStore;
import com.delta.lottracker.discovery.source.RenderedPageClient;
import com.delta.lottracker.discovery.source.SearchClient;
import com.delta.lottracker.discovery.source.SourceClient;
import com.delta.lottracker.discovery.source.SummaryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one discovery run through its phases:
 * {@code IDLE -> FETCHING -> RECONCILING -> AUGMENTING -> SCORING -> DONE}, or {@code FAILED} when
 * every configured source failed, the run was cancelled, or an unexpected error escaped a phase.
 *
 * <p>Each cursor stream is one task on the fetch pool; a failing stream is recorded and the others
 * carry on. Augmentation runs on its own pool over a bounded batch of stale lots.
 */
@Service
public class DiscoveryOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestratorService.class);

    private final SummaryClient summaryClient;
    private final SearchClient searchClient;
    private final RenderedPageClient renderedPageClient;
    private final Canonicalizer canonicalizer;
    private final LotStore lotStore;
    private final BidAugmenter bidAugmenter;
    private final AuthSession authSession;
    private final DiscoveryRunRepository runRepository;
    private final DiscoveryProperties properties;
    private final ExecutorService fetchExecutor;
    private final ExecutorService augmentExecutor;
    private final ExecutorService discoveryRunExecutor;
    private final Clock clock;
    private final Object startLock = new Object();
    private final Map<Long, RunCancellation> activeRuns = new ConcurrentHashMap<>();

    public DiscoveryOrchestratorService(
        SummaryClient summaryClient,
        SearchClient searchClient,
        RenderedPageClient renderedPageClient,
        Canonicalizer canonicalizer,
        LotStore lotStore,
        BidAugmenter bidAugmenter,
        AuthSession authSession,
        DiscoveryRunRepository runRepository,
        DiscoveryProperties properties,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        @Qualifier("augmentExecutor") ExecutorService augmentExecutor,
        @Qualifier("discoveryRunExecutor") ExecutorService discoveryRunExecutor,
        Clock clock
    ) {
        this.summaryClient = summaryClient;
        this.searchClient = searchClient;
        this.renderedPageClient = renderedPageClient;
        this.canonicalizer = canonicalizer;
        this.lotStore = lotStore;
        this.bidAugmenter = bidAugmenter;
        this.authSession = authSession;
        this.runRepository = runRepository;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.augmentExecutor = augmentExecutor;
        this.discoveryRunExecutor = discoveryRunExecutor;
        this.clock = clock;
    }

    public DiscoveryRunSummary run() {
        Instant startedAt = now();
        long runId = registerRun(startedAt);
        return runWithId(runId, startedAt);
    }

    public long startAsync() {
        Instant startedAt = now();
        long runId = registerRun(startedAt);
        discoveryRunExecutor.submit(() -> runWithId(runId, startedAt));
        return runId;
    }

    /**
     * @return false when no run with that id is active in this process
     */
    public boolean cancel(long runId) {
        RunCancellation cancellation = activeRuns.get(runId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel("stopped_by_request");
        return true;
    }

    public Optional<DiscoveryRunStatus> getRunStatus(long runId) {
        return runRepository.findRun(runId);
    }

    private long registerRun(Instant startedAt) {
        synchronized (startLock) {
            ensureNoActiveRun();
            long runId = runRepository.insertRun(startedAt);
            Instant deadline = properties.getMaxRunSeconds() > 0 ? startedAt.plusSeconds(properties.getMaxRunSeconds()) : null;
            activeRuns.put(runId, new RunCancellation(deadline));
            return runId;
        }
    }

    private void ensureNoActiveRun() {
        if (!activeRuns.isEmpty()) {
            throw new ActiveDiscoveryRunException("Active discovery run in progress (id=" + activeRuns.keySet() + ")");
        }
        Instant cutoff = now().minus(Duration.ofMinutes(properties.getActiveRunMinutes()));
        runRepository.findActiveRunId(cutoff).ifPresent(runId -> {
            throw new ActiveDiscoveryRunException("Active discovery run in progress (id=" + runId + ")");
        });
    }

    private DiscoveryRunSummary runWithId(long runId, Instant startedAt) {
        RunCancellation cancellation = activeRuns.get(runId);
        RunStats stats = new RunStats();
        List<SourceStreamResult> streams = new ArrayList<>();
        List<SourceTag> failedSources = List.of();
        List<Lot> rankedLots = List.of();
        boolean sessionExpired = false;
        RunPhase status = RunPhase.FAILED;
        String notes = "run_failed";
        Set<Location> scope = properties.locationScope();
        log.info("Discovery run {} started (scope={})", runId, scope.isEmpty() ? "all" : scope);

        try (DiscoveryRunContext.Scope ignored = DiscoveryRunContext.activate(cancellation)) {
            advance(runId, RunPhase.FETCHING, stats);
            streams.addAll(fetchAll(runId, cancellation, stats, scope));
            failedSources = failedSources(streams);
            Set<SourceTag> configured = EnumSet.noneOf(SourceTag.class);
            for (SourceStreamResult stream : streams) {
                configured.add(stream.source());
            }
            cancellation.checkActive();
            if (configured.isEmpty() || failedSources.containsAll(configured)) {
                notes = configured.isEmpty() ? "no_sources_configured" : "all_sources_failed";
                log.warn("Discovery run {} failed: {}", runId, notes);
            } else {
                advance(runId, RunPhase.RECONCILING, stats);
                Instant expireCutoff = now().minus(Duration.ofMinutes(properties.getExpireGraceMinutes()));
                stats.lotsExpired.addAndGet(lotStore.expireLotsClosedBefore(expireCutoff));

                cancellation.checkActive();
                advance(runId, RunPhase.AUGMENTING, stats);
                sessionExpired = augment(cancellation, stats, scope);

                cancellation.checkActive();
                advance(runId, RunPhase.SCORING, stats);
                stats.lotsScored.addAndGet(lotStore.rescoreOpenLots(now()));
                rankedLots = lotStore.query(LotQuery.openLots(scope, properties.getResultLimit()));

                status = RunPhase.DONE;
                notes = "streams=" + streams.size()
                    + " failed_sources=" + failedSources.size()
                    + (sessionExpired ? " session_expired" : "");
            }
        } catch (RunCancelledException e) {
            log.info("Discovery run {} cancelled: {}", runId, e.getMessage());
            notes = "cancelled: " + e.getMessage();
        } catch (Exception e) {
            log.warn("Discovery run {} failed", runId, e);
            notes = "exception=" + e.getClass().getSimpleName();
        }

        Instant finishedAt = now();
        try {
            runRepository.finishRun(runId, status, finishedAt, stats.snapshot(), sessionExpired, failedSources, notes);
        } finally {
            activeRuns.remove(runId);
        }
        DiscoveryRunSummary summary = new DiscoveryRunSummary(
            runId,
            startedAt,
            finishedAt,
            status,
            stats.snapshot(),
            sessionExpired,
            failedSources,
            List.copyOf(streams),
            rankedLots
        );
        log.info(
            "Discovery run {} finished with status {}: discovered={}, created={}, augmented={}, degraded={}, failedSources={}",
            runId,
            status,
            summary.counters().lotsDiscovered(),
            summary.counters().lotsCreated(),
            summary.counters().lotsAugmented(),
            summary.counters().lotsDegraded(),
            failedSources
        );
        return summary;
    }

    private void advance(long runId, RunPhase phase, RunStats stats) {
        log.info("Discovery run {} entering {}", runId, phase);
        runRepository.updateProgress(runId, phase, stats.snapshot());
    }

    private List<SourceStreamResult> fetchAll(long runId, RunCancellation cancellation, RunStats stats, Set<Location> scope) {
        List<Callable<SourceStreamResult>> tasks = new ArrayList<>();
        if (isConfigured(properties.getSummary().getBaseUrl())) {
            tasks.add(() -> runStream(summaryClient, "summary", summaryClient.initialCursor(), cancellation, stats, scope));
        }
        if (isConfigured(properties.getSearch().getUrl())) {
            for (SearchQuery query : searchClient.queries()) {
                tasks.add(() -> runStream(searchClient, query.streamKey(), searchClient.initialCursor(query), cancellation, stats, scope));
            }
        }
        List<String> seeds = properties.getRendered().getSeedLotIds();
        if (seeds != null && !seeds.isEmpty()) {
            tasks.add(() -> runStream(renderedPageClient, "seeds", new RenderedCursor(seeds, 0), cancellation, stats, scope));
        }

        List<Future<SourceStreamResult>> futures = new ArrayList<>();
        for (Callable<SourceStreamResult> task : tasks) {
            futures.add(fetchExecutor.submit(() -> {
                try (DiscoveryRunContext.Scope ignored = DiscoveryRunContext.activate(cancellation)) {
                    return task.call();
                }
            }));
        }

        List<SourceStreamResult> results = new ArrayList<>();
        for (Future<SourceStreamResult> future : futures) {
            SourceStreamResult result = await(future);
            results.add(result);
            runRepository.insertStream(runId, result);
        }
        return results;
    }

    private <C> SourceStreamResult runStream(
        SourceClient<C> client,
        String streamKey,
        C initialCursor,
        RunCancellation cancellation,
        RunStats stats,
        Set<Location> scope
    ) {
        int pages = 0;
        int records = 0;
        C cursor = initialCursor;
        try {
            while (true) {
                cancellation.checkActive();
                SourcePage<C> page = client.fetchPage(cursor);
                pages++;
                records += page.records().size();
                ingest(page.records(), stats, scope);
                if (!page.hasMore()) {
                    break;
                }
                cursor = page.nextCursor();
            }
            log.info("{} stream {} completed: pages={}, records={}", client.source().key(), streamKey, pages, records);
            return new SourceStreamResult(client.source(), streamKey, pages, records, SourceStreamResult.COMPLETED, null, null);
        } catch (RunCancelledException e) {
            return new SourceStreamResult(
                client.source(), streamKey, pages, records, SourceStreamResult.CANCELLED, null, e.getMessage()
            );
        } catch (SourceFetchException e) {
            log.warn("{} stream {} failed after {} pages: {}", client.source().key(), streamKey, pages, e.getMessage());
            return new SourceStreamResult(
                client.source(), streamKey, pages, records, SourceStreamResult.FAILED, e.failureClass(), e.getMessage()
            );
        } catch (RuntimeException e) {
            log.warn("{} stream {} failed after {} pages", client.source().key(), streamKey, pages, e);
            return new SourceStreamResult(
                client.source(), streamKey, pages, records, SourceStreamResult.FAILED, FailureClass.PERMANENT, e.toString()
            );
        }
    }

    private void ingest(List<RawRecord> records, RunStats stats, Set<Location> scope) {
        Instant seenAt = now();
        for (RawRecord raw : records) {
            stats.recordsFetched.incrementAndGet();
            try {
                ingestOne(raw, seenAt, stats, scope);
            } catch (DataAccessException e) {
                stats.recordsRejected.incrementAndGet();
                log.warn("{} record could not be stored", raw.source().key(), e);
            }
        }
    }

    private void ingestOne(RawRecord raw, Instant seenAt, RunStats stats, Set<Location> scope) {
        Optional<Lot> canonical = canonicalizer.canonicalize(raw, seenAt);
        if (canonical.isEmpty()) {
            stats.unmappable.incrementAndGet();
            return;
        }
        Lot lot = canonical.get();
        if (!inScope(lot, scope)) {
            stats.outOfScope.incrementAndGet();
            return;
        }
        LotUpsertResult result = lotStore.upsert(lot);
        stats.discovered(lot.id());
        if (result.created()) {
            stats.lotsCreated.incrementAndGet();
        }
    }

    // Channels without a warehouse label only update lots already known to be in scope.
    private boolean inScope(Lot lot, Set<Location> scope) {
        if (scope.isEmpty()) {
            return true;
        }
        if (lot.location() != Location.UNKNOWN) {
            return scope.contains(lot.location());
        }
        return lotStore.get(lot.id()).map(stored -> scope.contains(stored.location())).orElse(false);
    }

    /**
     * @return true when augmentation stopped because the session expired and could not be renewed
     */
    private boolean augment(RunCancellation cancellation, RunStats stats, Set<Location> scope) {
        DiscoveryProperties.Augment config = properties.getAugment();
        List<Lot> candidates = lotStore.findAugmentationCandidates(
            now(),
            config.freshness(),
            config.getBatchSize(),
            properties.isExcludeSameDayClosing(),
            properties.zone(),
            scope
        );
        if (candidates.isEmpty()) {
            return false;
        }
        SessionGuard guard = new SessionGuard(authSession);
        if (!authSession.isValid() && !guard.renewOnce()) {
            log.warn("Skipping bid augmentation of {} lots: no valid auth session", candidates.size());
            return true;
        }
        log.info("Augmenting bid state of {} lots", candidates.size());

        List<Future<?>> futures = new ArrayList<>();
        for (Lot lot : candidates) {
            futures.add(augmentExecutor.submit(() -> {
                try (DiscoveryRunContext.Scope ignored = DiscoveryRunContext.activate(cancellation)) {
                    augmentOne(lot, guard, cancellation, stats);
                }
            }));
        }
        for (Future<?> future : futures) {
            await(future);
        }
        if (guard.expired()) {
            log.warn("Auth session expired during augmentation; remaining lots were skipped");
        }
        return guard.expired();
    }

    private void augmentOne(Lot lot, SessionGuard guard, RunCancellation cancellation, RunStats stats) {
        if (guard.expired() || cancellation.isCancelled()) {
            return;
        }
        try {
            stats.record(bidAugmenter.augment(lot, authSession));
        } catch (SessionExpiredException e) {
            if (!guard.renewOnce()) {
                return;
            }
            try {
                stats.record(bidAugmenter.augment(lot, authSession));
            } catch (SessionExpiredException again) {
                guard.markExpired();
            }
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Bid augmentation of lot {} failed", lot.id(), e);
            stats.record(AugmentOutcome.FAILED);
        }
    }

    private <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RunCancelledException cancelled) {
                throw cancelled;
            }
            throw new IllegalStateException("discovery task failed", cause);
        }
    }

    private static List<SourceTag> failedSources(List<SourceStreamResult> streams) {
        Set<SourceTag> attempted = EnumSet.noneOf(SourceTag.class);
        Set<SourceTag> succeeded = EnumSet.noneOf(SourceTag.class);
        for (SourceStreamResult stream : streams) {
            attempted.add(stream.source());
            if (stream.succeeded()) {
                succeeded.add(stream.source());
            }
        }
        attempted.removeAll(succeeded);
        return List.copyOf(attempted);
    }

    private static boolean isConfigured(String url) {
        return url != null && !url.isBlank();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Allows a single renewal per run. Once renewal fails, or a lot is rejected again after the
     * renewal, the rest of the batch is skipped.
     */
    private static final class SessionGuard {
        private final AuthSession session;
        private final AtomicBoolean expired = new AtomicBoolean(false);
        private boolean renewAttempted;
        private boolean renewed;

        private SessionGuard(AuthSession session) {
            this.session = session;
        }

        synchronized boolean renewOnce() {
            if (expired.get()) {
                return false;
            }
            if (renewAttempted) {
                return renewed;
            }
            renewAttempted = true;
            renewed = session.renew() && session.isValid();
            if (!renewed) {
                expired.set(true);
            }
            return renewed;
        }

        void markExpired() {
            expired.set(true);
        }

        boolean expired() {
            return expired.get();
        }
    }
}
