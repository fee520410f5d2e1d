// file: core/src/main/java/io/fanlite/core/FanoutDispatcher.java
package io.fanlite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scatter-gather engine driving a {@link FanoutOperation} to completion.
 * <br>
 * Per round:
 *  1. resolve targets and the per-round deadline from the operation,
 *  2. scatter: local targets are answered on a worker via getLocalResponse,
 *     remote targets go through invokeRemoteRpc with a completion callback,
 *  3. a deadline timer settles every still-outstanding target as TIMEOUT,
 *  4. barrier: wait until every target is settled (success, failure or deadline),
 *  5. ask shouldRetry(); retry with resetForRetry() while the budget allows.
 * Finally generateReply() is called exactly once.
 * <br>
 * Rounds are strictly sequential. Each target is settled exactly once; a
 * transport callback arriving after the deadline is counted and dropped.
 * Target failures never abort a round. Only target resolution failures
 * propagate to the caller.
 *
 * @param <C> transport client type
 */
public final class FanoutDispatcher<C> implements AutoCloseable {

    private static final Logger log = Logger.getLogger(FanoutDispatcher.class.getName());

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final TargetResolver resolver;
    private final ClientPool<C> clients;
    private final int maxRetries;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final boolean ownsExecutors;
    private final FanoutMetrics metrics;

    /**
     * Dispatcher with its own daemon worker pool and deadline timer.
     * Call {@link #close()} to release them.
     */
    public FanoutDispatcher(TargetResolver resolver, ClientPool<C> clients, int maxRetries) {
        this(
                resolver,
                clients,
                maxRetries,
                Executors.newCachedThreadPool(r -> {
                    Thread t = new Thread(r, "fanout-worker");
                    t.setDaemon(true);
                    return t;
                }),
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "fanout-deadline");
                    t.setDaemon(true);
                    return t;
                }),
                new FanoutMetrics(),
                true
        );
    }

    /**
     * Dispatcher on caller-owned executors; {@link #close()} leaves them running.
     */
    public FanoutDispatcher(
            TargetResolver resolver,
            ClientPool<C> clients,
            int maxRetries,
            ExecutorService workers,
            ScheduledExecutorService timer,
            FanoutMetrics metrics
    ) {
        this(resolver, clients, maxRetries, workers, timer, metrics, false);
    }

    private FanoutDispatcher(
            TargetResolver resolver,
            ClientPool<C> clients,
            int maxRetries,
            ExecutorService workers,
            ScheduledExecutorService timer,
            FanoutMetrics metrics,
            boolean ownsExecutors
    ) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.clients = Objects.requireNonNull(clients, "clients");
        this.maxRetries = maxRetries;
        this.workers = Objects.requireNonNull(workers, "workers");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.ownsExecutors = ownsExecutors;
    }

    // ---------- public API ----------

    /**
     * Run the operation's query to completion on the calling thread.
     *
     * @return whatever the operation's generateReply produced for the final round
     * @throws TargetResolutionException if targets could not be enumerated (no retry)
     */
    public <Req, Res, R> R execute(FanoutOperation<C, Req, Res, R> op) throws TargetResolutionException {
        Objects.requireNonNull(op, "op");
        metrics.recordQuery();

        int round = 1;
        while (true) {
            RoundState roundState = runRound(op, round);

            if (!op.shouldRetry()) {
                return op.generateReply(roundState.summary(round, false));
            }

            if (round > maxRetries) {
                metrics.recordBudgetExhausted();
                log.log(Level.WARNING,
                        "fanout retry budget exhausted after {0} rounds; replying with best-effort state",
                        round);
                return op.generateReply(roundState.summary(round, true));
            }

            metrics.recordRetry();
            log.log(Level.INFO, "fanout round {0} saw inconsistent state across targets; retrying", round);
            op.resetForRetry();
            round++;
        }
    }

    /**
     * Same as {@link #execute} but on a worker thread. Resolution failures
     * complete the future exceptionally.
     */
    public <Req, Res, R> CompletableFuture<R> executeAsync(FanoutOperation<C, Req, Res, R> op) {
        CompletableFuture<R> result = new CompletableFuture<>();
        try {
            workers.execute(() -> {
                try {
                    result.complete(execute(op));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    public FanoutMetrics metrics() {
        return metrics;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public void close() {
        if (ownsExecutors) {
            workers.shutdownNow();
            timer.shutdownNow();
        }
    }

    // ---------- one round ----------

    private <Req, Res> RoundState runRound(FanoutOperation<C, Req, Res, ?> op, int round)
            throws TargetResolutionException {
        metrics.recordRound();

        List<NodeInfo> targets = op.getTargets(resolver);
        if (targets == null || targets.isEmpty()) {
            throw new TargetResolutionException("no targets resolved for mode " + op.targetMode());
        }
        long timeoutMs = op.getTimeoutMs();
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }

        RoundState state = new RoundState(targets);
        List<PendingCall<Res>> calls = new ArrayList<>(targets.size());
        for (NodeInfo target : targets) {
            calls.add(new PendingCall<>(op, target, state));
        }

        // Started before the scatter so slow dispatch eats into the same budget.
        ScheduledFuture<?> deadline = timer.schedule(
                () -> expire(calls, timeoutMs),
                timeoutMs,
                TimeUnit.MILLISECONDS
        );
        try {
            for (PendingCall<Res> call : calls) {
                dispatch(op, call, timeoutMs);
            }
            state.await(round);
        } finally {
            deadline.cancel(false);
        }
        return state;
    }

    private <Req, Res> void dispatch(FanoutOperation<C, Req, Res, ?> op, PendingCall<Res> call, long timeoutMs) {
        NodeInfo target = call.target;
        metrics.recordCall(target.local());

        Req request;
        try {
            request = op.generateRequest(target);
        } catch (RuntimeException e) {
            call.settle(RpcStatus.internal("request generation failed: " + e.getMessage()), null);
            return;
        }

        if (target.local()) {
            try {
                workers.execute(() -> answerLocally(op, call, request));
            } catch (RejectedExecutionException e) {
                call.settle(RpcStatus.unavailable("local worker pool rejected the call"), null);
            }
            return;
        }

        C client;
        try {
            client = clients.clientFor(target);
        } catch (RuntimeException e) {
            call.settle(RpcStatus.unavailable("no client for " + target.address() + ": " + e.getMessage()), null);
            return;
        }

        try {
            op.invokeRemoteRpc(client, request, call::onTransportComplete, timeoutMs);
        } catch (RuntimeException e) {
            call.settle(RpcStatus.unavailable("dispatch to " + target.address() + " failed: " + e.getMessage()), null);
        }
    }

    private <Req, Res> void answerLocally(FanoutOperation<C, Req, Res, ?> op, PendingCall<Res> call, Req request) {
        RpcResult<Res> result;
        try {
            result = op.getLocalResponse(request, call.target);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "local fanout call failed on node " + call.target.nodeId(), e);
            result = RpcResult.failed(RpcStatus.internal(String.valueOf(e.getMessage())));
        }
        if (!call.settle(result.status(), result.response())) {
            metrics.recordLateCompletion();
        }
    }

    private <Res> void expire(List<PendingCall<Res>> calls, long timeoutMs) {
        for (PendingCall<Res> call : calls) {
            if (call.isSettled()) {
                continue;
            }
            if (call.settle(RpcStatus.timeout("no answer within " + timeoutMs + "ms"), null)) {
                log.log(Level.FINE, "fanout target {0} timed out", call.target.address());
            }
        }
    }

    // ---------- bookkeeping ----------

    private final class PendingCall<Res> {
        private final FanoutOperation<C, ?, Res, ?> op;
        private final NodeInfo target;
        private final RoundState round;
        private final AtomicBoolean settled = new AtomicBoolean();

        PendingCall(FanoutOperation<C, ?, Res, ?> op, NodeInfo target, RoundState round) {
            this.op = op;
            this.target = target;
            this.round = round;
        }

        void onTransportComplete(RpcStatus status, Res response) {
            boolean accepted;
            if (status == null) {
                accepted = settle(RpcStatus.internal("transport completed without a status"), null);
            } else if (status.isOk() && response == null) {
                accepted = settle(RpcStatus.internal("transport returned OK without a response"), null);
            } else {
                accepted = settle(status, response);
            }
            if (!accepted) {
                metrics.recordLateCompletion();
            }
        }

        boolean isSettled() {
            return settled.get();
        }

        /**
         * Settle this target once. Returns false (and folds nothing) if it was
         * already settled, e.g. a transport callback racing the deadline.
         */
        boolean settle(RpcStatus status, Res response) {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            try {
                if (status.isOk()) {
                    op.onResponse(response, target);
                    round.succeeded.incrementAndGet();
                } else {
                    log.log(Level.FINE, "fanout target {0} failed: {1}", new Object[]{target.address(), status});
                    round.recordFailure(target, status);
                    op.onError(status, target);
                }
                metrics.recordOutcome(status);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "folding the answer of node " + target.nodeId() + " failed", e);
                RpcStatus foldFailure = RpcStatus.internal("fold failed: " + e.getMessage());
                metrics.recordOutcome(foldFailure);
                round.recordFailure(target, foldFailure);
                if (status.isOk()) {
                    try {
                        op.onError(foldFailure, target);
                    } catch (RuntimeException again) {
                        log.log(Level.WARNING, "recording the failure of node " + target.nodeId() + " failed", again);
                    }
                }
            } finally {
                round.barrier.countDown();
            }
            return true;
        }
    }

    private static final class RoundState {
        private final List<NodeInfo> targets;
        private final CountDownLatch barrier;
        private final AtomicInteger succeeded = new AtomicInteger();
        private final List<FanoutSummary.TargetFailure> failures = new ArrayList<>();

        RoundState(List<NodeInfo> targets) {
            this.targets = List.copyOf(targets);
            this.barrier = new CountDownLatch(targets.size());
        }

        synchronized void recordFailure(NodeInfo node, RpcStatus status) {
            failures.add(new FanoutSummary.TargetFailure(node, status));
        }

        void await(int round) {
            try {
                barrier.await();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for fanout round " + round, ie);
            }
        }

        synchronized FanoutSummary summary(int rounds, boolean budgetExhausted) {
            return new FanoutSummary(rounds, targets, succeeded.get(), failures, budgetExhausted);
        }
    }
}
