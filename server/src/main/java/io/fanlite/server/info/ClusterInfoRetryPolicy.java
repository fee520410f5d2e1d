// file: server/src/main/java/io/fanlite/server/info/ClusterInfoRetryPolicy.java
package io.fanlite.server.info;

/**
 * When a cluster-wide index info query is worth another round.
 *
 * @param maxRetries               resets allowed before the operation stops asking for retries
 * @param retryOnMissingIndex      retry when some responding nodes have the index and others do not
 *                                 (typical while a create or drop is propagating)
 * @param maxBackfillSpreadPercent retry when max - min backfill progress across nodes exceeds this;
 *                                 {@link #NO_SPREAD_LIMIT} disables the check
 */
public record ClusterInfoRetryPolicy(
        int maxRetries,
        boolean retryOnMissingIndex,
        float maxBackfillSpreadPercent
) {
    public static final float NO_SPREAD_LIMIT = 100f;

    public ClusterInfoRetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (maxBackfillSpreadPercent < 0f || maxBackfillSpreadPercent > NO_SPREAD_LIMIT) {
            throw new IllegalArgumentException("maxBackfillSpreadPercent must be in [0, 100]");
        }
    }

    public static ClusterInfoRetryPolicy defaults() {
        return new ClusterInfoRetryPolicy(3, true, NO_SPREAD_LIMIT);
    }

    public ClusterInfoRetryPolicy withMaxRetries(int retries) {
        return new ClusterInfoRetryPolicy(retries, retryOnMissingIndex, maxBackfillSpreadPercent);
    }
}
