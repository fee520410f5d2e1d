// file: core/src/main/java/io/fanlite/core/FanoutOperation.java
package io.fanlite.core;

import java.util.List;

/**
 * One logical fanout query: what to ask each target, how to fold one answer
 * into the running aggregate, and when a fresh round is needed.
 * <br>
 * Lifecycle:
 *  - created once per caller invocation,
 *  - driven by {@link FanoutDispatcher#execute(FanoutOperation)} through one or more rounds,
 *  - {@link #generateReply(FanoutSummary)} is called exactly once, then the instance is discarded.
 * <br>
 * Concurrency:
 *  - {@link #onResponse} and {@link #onError} may be called concurrently from
 *    completion threads. Implementations either guard their aggregate with a
 *    single lock or keep every field's fold commutative and associative.
 *  - {@link #shouldRetry}, {@link #resetForRetry} and {@link #generateReply}
 *    run only after the round barrier, never concurrently with folds.
 *
 * @param <C>   transport client type
 * @param <Req> per-target request
 * @param <Res> per-target response
 * @param <R>   caller-visible result
 */
public interface FanoutOperation<C, Req, Res, R> {

    /** Which members this query targets. Fixed for the instance. */
    FanoutTargetMode targetMode();

    /**
     * Targets of the next round. Called at the start of every round, so a
     * topology change between rounds is picked up.
     */
    default List<NodeInfo> getTargets(TargetResolver resolver) throws TargetResolutionException {
        return resolver.resolve(targetMode());
    }

    /** Per-round deadline, applied to every target independently. */
    long getTimeoutMs();

    /**
     * Build the request for one target. Must depend only on the target and the
     * operation's static parameters, never on aggregate state.
     */
    Req generateRequest(NodeInfo target);

    /**
     * Answer a local target in-process. The result must be what a remote call
     * to the same node would return.
     */
    RpcResult<Res> getLocalResponse(Req request, NodeInfo target);

    /**
     * Dispatch one remote call. {@code onComplete} must be invoked once; the
     * dispatcher tolerates a transport that never calls back by timing the
     * target out at the round deadline.
     */
    void invokeRemoteRpc(C client, Req request, RpcCallback<Res> onComplete, long timeoutMs);

    /** Fold one successful response into the aggregate. */
    void onResponse(Res response, NodeInfo target);

    /** Record a failed or timed-out target. Nothing is folded by default. */
    default void onError(RpcStatus status, NodeInfo target) {
    }

    /**
     * Restore the aggregate to its construction-time state, keeping the static
     * query parameters. Called before every retried round, never before the first.
     */
    void resetForRetry();

    /**
     * Evaluated once every target of the round has completed. True when the
     * aggregate shows a cross-node inconsistency a fresh round could resolve.
     */
    boolean shouldRetry();

    /** Render the aggregate of the final round into the caller-visible result. */
    R generateReply(FanoutSummary summary);
}
