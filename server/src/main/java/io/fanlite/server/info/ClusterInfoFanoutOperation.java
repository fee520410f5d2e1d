// file: server/src/main/java/io/fanlite/server/info/ClusterInfoFanoutOperation.java
package io.fanlite.server.info;

import io.fanlite.core.FanoutOperation;
import io.fanlite.core.FanoutSummary;
import io.fanlite.core.FanoutTargetMode;
import io.fanlite.core.NodeInfo;
import io.fanlite.core.RpcCallback;
import io.fanlite.core.RpcResult;
import io.fanlite.core.RpcStatus;
import io.fanlite.server.cluster.CoordinatorClient;
import io.fanlite.server.coordinator.CoordinatorProto.InfoIndexPartitionRequest;
import io.fanlite.server.coordinator.CoordinatorProto.InfoIndexPartitionResponse;
import io.fanlite.server.index.IndexInfoProvider;
import io.fanlite.server.index.IndexState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Asks every node of the cluster for its partition of one index and merges
 * the answers into a single cluster-wide description.
 * <br>
 * Aggregate fields and their folds (all order independent):
 *  - exists: OR; missingOnSomeNode: OR of "node answered but has no such index",
 *  - fingerprint/version: set of distinct pairs; more than one is a conflict,
 *  - backfill percent: MIN and MAX, in-progress flag: OR,
 *  - numDocs: MAX (replicas hold copies),
 *  - state: most severe,
 *  - responded / failed node ids: sets.
 * Folds run under this instance's monitor.
 */
public final class ClusterInfoFanoutOperation implements
        FanoutOperation<CoordinatorClient, InfoIndexPartitionRequest, InfoIndexPartitionResponse, ClusterInfoResult> {

    private record FingerprintVersion(long fingerprint, int version) {}

    private static final Comparator<FingerprintVersion> VERSION_ORDER =
            Comparator.comparingInt(FingerprintVersion::version)
                    .thenComparingLong(FingerprintVersion::fingerprint);

    // static query parameters
    private final int dbNum;
    private final String indexName;
    private final long timeoutMs;
    private final ClusterInfoRetryPolicy policy;
    private final IndexInfoProvider localInfo;

    // aggregate state, reset between rounds
    private boolean exists;
    private boolean missingOnSomeNode;
    private final SortedSet<FingerprintVersion> versions = new TreeSet<>(VERSION_ORDER);
    private boolean backfillInProgress;
    private float backfillCompletePercentMin;
    private float backfillCompletePercentMax;
    private long numDocs;
    private IndexState state;
    private final SortedSet<String> responded = new TreeSet<>();
    private final SortedSet<String> failed = new TreeSet<>();

    // survives resets
    private int retriesDone;

    public ClusterInfoFanoutOperation(
            int dbNum,
            String indexName,
            long timeoutMs,
            ClusterInfoRetryPolicy policy,
            IndexInfoProvider localInfo
    ) {
        this.dbNum = dbNum;
        this.indexName = Objects.requireNonNull(indexName, "indexName");
        this.timeoutMs = timeoutMs;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.localInfo = Objects.requireNonNull(localInfo, "localInfo");
        clearAggregate();
    }

    @Override
    public FanoutTargetMode targetMode() {
        return FanoutTargetMode.ALL;
    }

    @Override
    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public InfoIndexPartitionRequest generateRequest(NodeInfo target) {
        return InfoIndexPartitionRequest.newBuilder()
                .setDbNum(dbNum)
                .setIndexName(indexName)
                .build();
    }

    @Override
    public RpcResult<InfoIndexPartitionResponse> getLocalResponse(InfoIndexPartitionRequest request, NodeInfo target) {
        return RpcResult.ok(localInfo.describe(request));
    }

    @Override
    public void invokeRemoteRpc(
            CoordinatorClient client,
            InfoIndexPartitionRequest request,
            RpcCallback<InfoIndexPartitionResponse> onComplete,
            long timeoutMs
    ) {
        client.infoIndexPartition(request, timeoutMs, onComplete);
    }

    @Override
    public synchronized void onResponse(InfoIndexPartitionResponse resp, NodeInfo target) {
        // Parse before touching the aggregate so a bad answer folds nothing.
        IndexState nodeState = resp.getExists() ? IndexState.fromWireName(resp.getState()) : null;

        responded.add(target.nodeId());
        if (!resp.getExists()) {
            missingOnSomeNode = true;
            return;
        }

        exists = true;
        if (resp.hasIndexFingerprintVersion()) {
            versions.add(new FingerprintVersion(
                    resp.getIndexFingerprintVersion().getFingerprint(),
                    resp.getIndexFingerprintVersion().getVersion()
            ));
        }
        backfillInProgress |= resp.getBackfillInProgress();
        backfillCompletePercentMin = Math.min(backfillCompletePercentMin, resp.getBackfillCompletePercent());
        backfillCompletePercentMax = Math.max(backfillCompletePercentMax, resp.getBackfillCompletePercent());
        numDocs = Math.max(numDocs, resp.getNumDocs());
        state = state.mostSevere(nodeState);
    }

    @Override
    public synchronized void onError(RpcStatus status, NodeInfo target) {
        failed.add(target.nodeId());
    }

    @Override
    public synchronized void resetForRetry() {
        retriesDone++;
        clearAggregate();
    }

    @Override
    public synchronized boolean shouldRetry() {
        if (retriesDone >= policy.maxRetries()) {
            return false;
        }
        return inconsistent();
    }

    @Override
    public synchronized ClusterInfoResult generateReply(FanoutSummary summary) {
        if (responded.isEmpty()) {
            return new ClusterInfoResult.Failure(
                    ClusterInfoResult.Reason.NO_NODE_ANSWERED,
                    "no node answered for index '%s' (%d of %d targets failed)"
                            .formatted(indexName, failed.size(), summary.targets().size()),
                    false
            );
        }
        if (!exists) {
            return new ClusterInfoResult.Failure(
                    ClusterInfoResult.Reason.INDEX_NOT_FOUND,
                    "Index with name '%s' not found in database %d".formatted(indexName, dbNum),
                    false
            );
        }

        boolean consistent = !inconsistent();
        FingerprintVersion reported = versions.isEmpty() ? new FingerprintVersion(0L, 0) : versions.first();

        return new ClusterInfoResult.Success(new ClusterInfoReply(
                indexName,
                dbNum,
                true,
                state.wireName(),
                numDocs,
                backfillInProgress,
                backfillCompletePercentMin,
                backfillCompletePercentMax,
                reported.fingerprint(),
                reported.version(),
                consistent,
                !failed.isEmpty() || summary.retryBudgetExhausted() || !consistent,
                new ArrayList<>(responded),
                new ArrayList<>(failed),
                summary.rounds()
        ));
    }

    // ---------- helpers ----------

    private boolean inconsistent() {
        if (versions.size() > 1) {
            return true;
        }
        if (policy.retryOnMissingIndex() && exists && missingOnSomeNode) {
            return true;
        }
        return exists && backfillCompletePercentMax - backfillCompletePercentMin > policy.maxBackfillSpreadPercent();
    }

    private void clearAggregate() {
        exists = false;
        missingOnSomeNode = false;
        versions.clear();
        backfillInProgress = false;
        backfillCompletePercentMin = 100f;
        backfillCompletePercentMax = 0f;
        numDocs = 0L;
        state = IndexState.READY;
        responded.clear();
        failed.clear();
    }

    public int dbNum() {
        return dbNum;
    }

    public String indexName() {
        return indexName;
    }
}
