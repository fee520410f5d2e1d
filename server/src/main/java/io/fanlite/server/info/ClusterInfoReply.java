// file: server/src/main/java/io/fanlite/server/info/ClusterInfoReply.java
package io.fanlite.server.info;

import java.util.List;

/**
 * Cluster-wide view of one index, aggregated over every node that answered.
 *
 * @param consistent  no version, existence or progress conflict in the final round
 * @param incomplete  some node did not answer, or the retry budget ran out while
 *                    nodes still disagreed; the numbers are best effort
 */
public record ClusterInfoReply(
        String indexName,
        int dbNum,
        boolean exists,
        String state,
        long numDocs,
        boolean backfillInProgress,
        float backfillCompletePercentMin,
        float backfillCompletePercentMax,
        long fingerprint,
        int version,
        boolean consistent,
        boolean incomplete,
        List<String> respondedNodes,
        List<String> failedNodes,
        int rounds
) {
    public ClusterInfoReply {
        respondedNodes = List.copyOf(respondedNodes);
        failedNodes = List.copyOf(failedNodes);
    }
}
