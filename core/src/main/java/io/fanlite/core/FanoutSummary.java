// file: core/src/main/java/io/fanlite/core/FanoutSummary.java
package io.fanlite.core;

import java.util.List;

/**
 * What the dispatcher observed in the last round of a query, handed to
 * {@link FanoutOperation#generateReply(FanoutSummary)}.
 *
 * @param rounds                number of rounds executed (1 when no retry happened)
 * @param targets               targets contacted in the last round
 * @param succeeded             targets that answered OK in the last round
 * @param failures              targets that failed or timed out in the last round
 * @param retryBudgetExhausted  true when the operation still asked for a retry
 *                              but the dispatcher had no rounds left
 */
public record FanoutSummary(
        int rounds,
        List<NodeInfo> targets,
        int succeeded,
        List<TargetFailure> failures,
        boolean retryBudgetExhausted
) {
    public FanoutSummary {
        targets = List.copyOf(targets);
        failures = List.copyOf(failures);
    }

    public record TargetFailure(NodeInfo node, RpcStatus status) {}

    public boolean complete() {
        return failures.isEmpty();
    }
}
