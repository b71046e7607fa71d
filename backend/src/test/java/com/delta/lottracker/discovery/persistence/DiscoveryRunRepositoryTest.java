package com.delta.lottracker.discovery.persistence;

import com.delta.lottracker.discovery.model.DiscoveryRunCounters;
import com.delta.lottracker.discovery.model.DiscoveryRunStatus;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.RunPhase;
import com.delta.lottracker.discovery.model.SourceStreamResult;
import com.delta.lottracker.discovery.model.SourceTag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DiscoveryRunRepositoryTest {

    @Autowired
    private DiscoveryRunRepository repository;

    @Test
    void recordsRunWithStreamsAndFailedSources() {
        Instant startedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        long runId = repository.insertRun(startedAt);

        assertEquals(runId, repository.findActiveRunId(startedAt.minusSeconds(60)).orElseThrow());

        repository.insertStream(runId, new SourceStreamResult(SourceTag.SUMMARY, "summary", 5, 480, SourceStreamResult.COMPLETED, null, null));
        repository.insertStream(runId, new SourceStreamResult(
            SourceTag.SEARCH, "q=*;sort=retail_price:desc", 1, 0, SourceStreamResult.FAILED, FailureClass.PERMANENT, "401"));
        DiscoveryRunCounters counters = new DiscoveryRunCounters(480, 470, 12, 3, 7, 1, 2, 20, 5, 1, 0, 470);
        repository.updateProgress(runId, RunPhase.AUGMENTING, counters);
        repository.finishRun(runId, RunPhase.DONE, startedAt.plusSeconds(90), counters, true, List.of(SourceTag.SEARCH), "ok");

        DiscoveryRunStatus run = repository.findRun(runId).orElseThrow();
        assertEquals(RunPhase.DONE, run.phase());
        assertEquals(startedAt, run.startedAt());
        assertEquals(startedAt.plusSeconds(90), run.finishedAt());
        assertEquals(counters, run.counters());
        assertTrue(run.sessionExpired());
        assertEquals(List.of(SourceTag.SEARCH), run.failedSources());
        assertEquals(2, run.streams().size());
        assertEquals(SourceTag.SEARCH, run.streams().get(1).source());
        assertEquals(FailureClass.PERMANENT, run.streams().get(1).failureClass());
        assertTrue(repository.findActiveRunId(startedAt.minusSeconds(60)).isEmpty());
    }

    @Test
    void staleRunningRunsAreFailed() {
        Instant startedAt = Instant.now().minusSeconds(7200).truncatedTo(ChronoUnit.MICROS);
        long runId = repository.insertRun(startedAt);

        int failed = repository.failRunsStartedBefore(Instant.now().minusSeconds(3600), Instant.now(), "abandoned");

        assertTrue(failed >= 1);
        DiscoveryRunStatus run = repository.findRun(runId).orElseThrow();
        assertEquals(RunPhase.FAILED, run.phase());
        assertEquals("abandoned", run.notes());
    }

    @Test
    void unknownRunIsEmpty() {
        assertTrue(repository.findRun(-1L).isEmpty());
    }
}
