package com.delta.lottracker.discovery.http;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Single stop signal for one discovery run. Trips on an explicit {@link #cancel(String)} or when
 * the deadline passes; in-flight requests registered here are cancelled with it.
 */
public class RunCancellation {
    private final Instant deadline;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile String reason;

    public RunCancellation(Instant deadline) {
        this.deadline = deadline;
    }

    public static RunCancellation none() {
        return new RunCancellation(null);
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason == null ? "cancelled" : reason;
        }
        stopped.countDown();
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        if (stopped.getCount() == 0) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            cancel("run_deadline_exceeded");
            return true;
        }
        return false;
    }

    public String reason() {
        return reason;
    }

    public void checkActive() {
        if (isCancelled()) {
            throw new RunCancelledException(reason == null ? "cancelled" : reason);
        }
    }

    /**
     * Waits for the given delay unless the run is stopped first.
     *
     * @return true when the full delay elapsed, false when the run was cancelled
     */
    public boolean sleep(Duration delay) {
        if (isCancelled()) {
            return false;
        }
        long waitMs = delay.toMillis();
        if (deadline != null) {
            waitMs = Math.min(waitMs, Math.max(0, Duration.between(Instant.now(), deadline).toMillis()));
        }
        try {
            boolean tripped = stopped.await(Math.max(0, waitMs), TimeUnit.MILLISECONDS);
            return !tripped && !isCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void register(Future<?> future) {
        inFlight.add(future);
        if (stopped.getCount() == 0) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }
}
