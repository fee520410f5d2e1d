// file: core/src/main/java/io/fanlite/core/FanoutMetrics.java
package io.fanlite.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one dispatcher:
 *  - queries / rounds / retries: how often inconsistencies forced another round,
 *  - budgetExhausted: queries that ended while still asking for a retry,
 *  - localCalls / remoteCalls: how targets were reached,
 *  - successes / remoteErrors / timeouts / unavailable: per-target outcomes,
 *  - lateCompletions: answers (remote or local) that arrived after the deadline settled the target.
 */
public final class FanoutMetrics {

    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong rounds = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong budgetExhausted = new AtomicLong();
    private final AtomicLong localCalls = new AtomicLong();
    private final AtomicLong remoteCalls = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong remoteErrors = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong unavailable = new AtomicLong();
    private final AtomicLong lateCompletions = new AtomicLong();

    void recordQuery() {
        queries.incrementAndGet();
    }

    void recordRound() {
        rounds.incrementAndGet();
    }

    void recordRetry() {
        retries.incrementAndGet();
    }

    void recordBudgetExhausted() {
        budgetExhausted.incrementAndGet();
    }

    void recordCall(boolean local) {
        if (local) {
            localCalls.incrementAndGet();
        } else {
            remoteCalls.incrementAndGet();
        }
    }

    void recordOutcome(RpcStatus status) {
        switch (status.code()) {
            case OK -> successes.incrementAndGet();
            case REMOTE_ERROR -> remoteErrors.incrementAndGet();
            case TIMEOUT -> timeouts.incrementAndGet();
            case UNAVAILABLE -> unavailable.incrementAndGet();
        }
    }

    void recordLateCompletion() {
        lateCompletions.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                queries.get(),
                rounds.get(),
                retries.get(),
                budgetExhausted.get(),
                localCalls.get(),
                remoteCalls.get(),
                successes.get(),
                remoteErrors.get(),
                timeouts.get(),
                unavailable.get(),
                lateCompletions.get()
        );
    }

    public void reset() {
        queries.set(0L);
        rounds.set(0L);
        retries.set(0L);
        budgetExhausted.set(0L);
        localCalls.set(0L);
        remoteCalls.set(0L);
        successes.set(0L);
        remoteErrors.set(0L);
        timeouts.set(0L);
        unavailable.set(0L);
        lateCompletions.set(0L);
    }

    public record Snapshot(
            long queries,
            long rounds,
            long retries,
            long budgetExhausted,
            long localCalls,
            long remoteCalls,
            long successes,
            long remoteErrors,
            long timeouts,
            long unavailable,
            long lateCompletions
    ) {
    }
}
