// file: server/src/test/java/io/fanlite/server/info/ClusterInfoFanoutOperationTest.java
package io.fanlite.server.info;

import io.fanlite.core.FanoutSummary;
import io.fanlite.core.NodeInfo;
import io.fanlite.core.NodeRole;
import io.fanlite.core.RpcResult;
import io.fanlite.core.RpcStatus;
import io.fanlite.server.coordinator.CoordinatorProto.IndexFingerprintVersion;
import io.fanlite.server.coordinator.CoordinatorProto.InfoIndexPartitionRequest;
import io.fanlite.server.coordinator.CoordinatorProto.InfoIndexPartitionResponse;
import io.fanlite.server.index.IndexDescriptor;
import io.fanlite.server.index.IndexInfoProvider;
import io.fanlite.server.index.IndexRegistry;
import io.fanlite.server.index.IndexState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fold, retry and reply rules of ClusterInfoFanoutOperation, driven by hand
 * (no dispatcher): responses are fed straight into onResponse / onError.
 */
class ClusterInfoFanoutOperationTest {

    private static final NodeInfo A = node("A", true);
    private static final NodeInfo B = node("B", false);
    private static final NodeInfo C = node("C", false);

    private final IndexRegistry registry = new IndexRegistry();

    private static NodeInfo node(String id, boolean local) {
        return new NodeInfo(id, "10.0.0." + (id.charAt(0) - 'A' + 1), 7000, NodeRole.PRIMARY, "s-" + id, local);
    }

    private ClusterInfoFanoutOperation op(ClusterInfoRetryPolicy policy) {
        return new ClusterInfoFanoutOperation(0, "idx", 1000, policy, new IndexInfoProvider(registry));
    }

    private static InfoIndexPartitionResponse existing(float percent, long fingerprint, int version) {
        return InfoIndexPartitionResponse.newBuilder()
                .setExists(true)
                .setIndexName("idx")
                .setNumDocs(10)
                .setBackfillInProgress(percent < 100f)
                .setBackfillCompletePercent(percent)
                .setState(percent < 100f ? "backfill_in_progress" : "ready")
                .setIndexFingerprintVersion(IndexFingerprintVersion.newBuilder()
                        .setFingerprint(fingerprint)
                        .setVersion(version))
                .build();
    }

    private static InfoIndexPartitionResponse missing() {
        return InfoIndexPartitionResponse.newBuilder().setExists(false).setIndexName("idx").build();
    }

    private static FanoutSummary summary(int rounds, List<NodeInfo> failed, boolean exhausted) {
        List<FanoutSummary.TargetFailure> failures = new ArrayList<>();
        for (NodeInfo n : failed) {
            failures.add(new FanoutSummary.TargetFailure(n, RpcStatus.timeout("deadline")));
        }
        return new FanoutSummary(rounds, List.of(A, B, C), 3 - failed.size(), failures, exhausted);
    }

    private static ClusterInfoReply success(ClusterInfoResult result) {
        assertInstanceOf(ClusterInfoResult.Success.class, result);
        return ((ClusterInfoResult.Success) result).reply();
    }

    @Test
    void two_answers_and_a_timeout_give_min_max_and_incomplete() {
        var op = op(ClusterInfoRetryPolicy.defaults());

        op.onResponse(existing(40f, 7L, 1), A);
        op.onResponse(existing(70f, 7L, 1), B);
        op.onError(RpcStatus.timeout("deadline"), C);

        assertFalse(op.shouldRetry());
        ClusterInfoReply reply = success(op.generateReply(summary(1, List.of(C), false)));

        assertTrue(reply.exists());
        assertEquals(40f, reply.backfillCompletePercentMin());
        assertEquals(70f, reply.backfillCompletePercentMax());
        assertTrue(reply.backfillInProgress());
        assertTrue(reply.incomplete());
        assertTrue(reply.consistent());
        assertEquals(1, reply.rounds());
        assertEquals(List.of("A", "B"), reply.respondedNodes());
        assertEquals(List.of("C"), reply.failedNodes());
    }

    @Test
    void aggregate_does_not_depend_on_completion_order() {
        List<InfoIndexPartitionResponse> answers = List.of(
                existing(10f, 3L, 2),
                existing(100f, 3L, 2),
                existing(55f, 3L, 2)
        );
        List<NodeInfo> nodes = List.of(A, B, C);

        ClusterInfoReply baseline = null;
        Random rnd = new Random(7);
        for (int attempt = 0; attempt < 20; attempt++) {
            List<Integer> order = new ArrayList<>(List.of(0, 1, 2));
            Collections.shuffle(order, rnd);

            var op = op(ClusterInfoRetryPolicy.defaults());
            for (int i : order) {
                op.onResponse(answers.get(i), nodes.get(i));
            }
            ClusterInfoReply reply = success(op.generateReply(summary(1, List.of(), false)));
            if (baseline == null) {
                baseline = reply;
            } else {
                assertEquals(baseline, reply);
            }
        }
        assertEquals(10f, baseline.backfillCompletePercentMin());
        assertEquals(100f, baseline.backfillCompletePercentMax());
        assertEquals("backfill_in_progress", baseline.state());
        assertFalse(baseline.incomplete());
    }

    @Test
    void version_conflict_asks_for_retry_and_reset_clears_the_aggregate() {
        var op = op(ClusterInfoRetryPolicy.defaults());

        op.onResponse(existing(100f, 7L, 1), A);
        op.onResponse(existing(100f, 9L, 2), B);
        op.onError(RpcStatus.unavailable("down"), C);
        assertTrue(op.shouldRetry());

        op.resetForRetry();

        // after a reset nobody has answered yet
        assertInstanceOf(ClusterInfoResult.Failure.class, op.generateReply(summary(2, List.of(A, B, C), false)));

        op.onResponse(existing(100f, 9L, 2), A);
        op.onResponse(existing(100f, 9L, 2), B);
        op.onResponse(existing(100f, 9L, 2), C);
        assertFalse(op.shouldRetry());

        ClusterInfoReply reply = success(op.generateReply(summary(2, List.of(), false)));
        assertEquals(9L, reply.fingerprint());
        assertEquals(2, reply.version());
        assertTrue(reply.consistent());
        assertFalse(reply.incomplete());
        assertEquals(2, reply.rounds());
    }

    @Test
    void retries_stop_after_policy_budget_and_reply_reports_conflict() {
        var op = op(ClusterInfoRetryPolicy.defaults().withMaxRetries(1));

        op.onResponse(existing(100f, 1L, 1), A);
        op.onResponse(existing(100f, 2L, 2), B);
        assertTrue(op.shouldRetry());
        op.resetForRetry();

        op.onResponse(existing(100f, 1L, 1), A);
        op.onResponse(existing(100f, 2L, 2), B);
        assertFalse(op.shouldRetry());

        ClusterInfoReply reply = success(op.generateReply(summary(2, List.of(), false)));
        assertFalse(reply.consistent());
        assertTrue(reply.incomplete());
        assertEquals(1L, reply.fingerprint());
        assertEquals(1, reply.version());
    }

    @Test
    void index_missing_on_one_node_retries_only_when_policy_says_so() {
        var retrying = op(ClusterInfoRetryPolicy.defaults());
        retrying.onResponse(existing(100f, 1L, 1), A);
        retrying.onResponse(missing(), B);
        assertTrue(retrying.shouldRetry());

        var tolerant = op(new ClusterInfoRetryPolicy(3, false, ClusterInfoRetryPolicy.NO_SPREAD_LIMIT));
        tolerant.onResponse(existing(100f, 1L, 1), A);
        tolerant.onResponse(missing(), B);
        assertFalse(tolerant.shouldRetry());

        ClusterInfoReply reply = success(tolerant.generateReply(summary(1, List.of(), false)));
        assertTrue(reply.exists());
        assertEquals(List.of("A", "B"), reply.respondedNodes());
    }

    @Test
    void backfill_spread_above_threshold_triggers_retry() {
        var op = op(new ClusterInfoRetryPolicy(3, true, 25f));
        op.onResponse(existing(40f, 1L, 1), A);
        op.onResponse(existing(70f, 1L, 1), B);
        assertTrue(op.shouldRetry());

        var within = op(new ClusterInfoRetryPolicy(3, true, 50f));
        within.onResponse(existing(40f, 1L, 1), A);
        within.onResponse(existing(70f, 1L, 1), B);
        assertFalse(within.shouldRetry());
    }

    @Test
    void nobody_has_the_index_is_not_found() {
        var op = op(ClusterInfoRetryPolicy.defaults());
        op.onResponse(missing(), A);
        op.onResponse(missing(), B);
        op.onResponse(missing(), C);

        assertFalse(op.shouldRetry());
        var result = op.generateReply(summary(1, List.of(), false));
        var failure = assertInstanceOf(ClusterInfoResult.Failure.class, result);
        assertEquals(ClusterInfoResult.Reason.INDEX_NOT_FOUND, failure.reason());
        assertEquals("Index with name 'idx' not found in database 0", failure.message());
        assertFalse(failure.retryable());
    }

    @Test
    void nobody_answering_is_a_distinct_failure() {
        var op = op(ClusterInfoRetryPolicy.defaults());
        op.onError(RpcStatus.timeout("deadline"), A);
        op.onError(RpcStatus.timeout("deadline"), B);
        op.onError(RpcStatus.unavailable("down"), C);

        var failure = assertInstanceOf(ClusterInfoResult.Failure.class,
                op.generateReply(summary(1, List.of(A, B, C), false)));
        assertEquals(ClusterInfoResult.Reason.NO_NODE_ANSWERED, failure.reason());
    }

    @Test
    void budget_exhaustion_marks_reply_incomplete() {
        var op = op(ClusterInfoRetryPolicy.defaults());
        op.onResponse(existing(100f, 1L, 1), A);
        op.onResponse(existing(100f, 1L, 1), B);
        op.onResponse(existing(100f, 1L, 1), C);

        ClusterInfoReply reply = success(op.generateReply(summary(4, List.of(), true)));
        assertTrue(reply.consistent());
        assertTrue(reply.incomplete());
    }

    @Test
    void local_response_matches_the_registry() {
        registry.upsert(new IndexDescriptor(0, "idx", 77L, 4, 12L, 55f, IndexState.BACKFILL_IN_PROGRESS));
        var op = op(ClusterInfoRetryPolicy.defaults());

        InfoIndexPartitionRequest req = op.generateRequest(A);
        assertEquals(0, req.getDbNum());
        assertEquals("idx", req.getIndexName());

        RpcResult<InfoIndexPartitionResponse> local = op.getLocalResponse(req, A);
        assertTrue(local.status().isOk());
        assertTrue(local.response().getExists());
        assertEquals(77L, local.response().getIndexFingerprintVersion().getFingerprint());
        assertEquals(4, local.response().getIndexFingerprintVersion().getVersion());
        assertEquals(55f, local.response().getBackfillCompletePercent());
    }

    @Test
    void unknown_state_on_the_wire_folds_nothing() {
        var op = op(ClusterInfoRetryPolicy.defaults());
        var bad = existing(10f, 1L, 1).toBuilder().setState("melting").build();

        assertThrows(IllegalArgumentException.class, () -> op.onResponse(bad, A));
        op.onResponse(existing(90f, 1L, 1), B);

        ClusterInfoReply reply = success(op.generateReply(summary(1, List.of(), false)));
        assertEquals(List.of("B"), reply.respondedNodes());
        assertEquals(90f, reply.backfillCompletePercentMin());
    }
}
