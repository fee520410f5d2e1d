// file: server/src/main/java/io/fanlite/server/info/ClusterInfoService.java
package io.fanlite.server.info;

import io.fanlite.core.FanoutDispatcher;
import io.fanlite.core.TargetResolutionException;
import io.fanlite.server.cluster.CoordinatorClient;
import io.fanlite.server.index.IndexInfoProvider;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-facing entry point for cluster-wide index info.
 * <br>
 * Validates the query, builds one ClusterInfoFanoutOperation per call and
 * runs it on the dispatcher. Target failures are folded into the result;
 * only invalid input and topology resolution failures are thrown.
 */
public final class ClusterInfoService {

    private static final Logger log = Logger.getLogger(ClusterInfoService.class.getName());

    public static final int MAX_DB_NUM = 15;
    public static final long MAX_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;

    private final FanoutDispatcher<CoordinatorClient> dispatcher;
    private final IndexInfoProvider localInfo;
    private final ClusterInfoRetryPolicy policy;
    private final long defaultTimeoutMs;

    public ClusterInfoService(
            FanoutDispatcher<CoordinatorClient> dispatcher,
            IndexInfoProvider localInfo,
            ClusterInfoRetryPolicy policy,
            long defaultTimeoutMs
    ) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.localInfo = Objects.requireNonNull(localInfo, "localInfo");
        this.policy = Objects.requireNonNull(policy, "policy");
        validateTimeout(defaultTimeoutMs);
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public ClusterInfoResult info(int dbNum, String indexName) throws TargetResolutionException {
        return info(dbNum, indexName, defaultTimeoutMs);
    }

    /**
     * @throws IllegalArgumentException   on an invalid db number, index name or timeout
     * @throws TargetResolutionException  if the cluster members cannot be enumerated
     */
    public ClusterInfoResult info(int dbNum, String indexName, long timeoutMs) throws TargetResolutionException {
        if (dbNum < 0 || dbNum > MAX_DB_NUM) {
            throw new IllegalArgumentException("db must be in [0, " + MAX_DB_NUM + "]");
        }
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("index name must not be empty");
        }
        validateTimeout(timeoutMs);

        var op = new ClusterInfoFanoutOperation(dbNum, indexName, timeoutMs, policy, localInfo);
        ClusterInfoResult result = dispatcher.execute(op);

        if (result instanceof ClusterInfoResult.Success s && s.reply().incomplete()) {
            log.log(Level.INFO, "info for index {0} is incomplete: failed={1} rounds={2}",
                    new Object[]{indexName, s.reply().failedNodes(), s.reply().rounds()});
        }
        return result;
    }

    public long defaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    private static void validateTimeout(long timeoutMs) {
        if (timeoutMs <= 0 || timeoutMs > MAX_TIMEOUT_MS) {
            throw new IllegalArgumentException("timeoutMs must be in (0, " + MAX_TIMEOUT_MS + "]");
        }
    }
}
