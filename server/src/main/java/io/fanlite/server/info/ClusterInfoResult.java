// file: server/src/main/java/io/fanlite/server/info/ClusterInfoResult.java
package io.fanlite.server.info;

/**
 * Outcome of a cluster info query:
 *  - Success: at least one node has the index; the aggregate may be partial.
 *  - Failure: nobody answered, or nobody has the index. Retrying the same
 *    query is not expected to help.
 */
public sealed interface ClusterInfoResult permits ClusterInfoResult.Success, ClusterInfoResult.Failure {

    record Success(ClusterInfoReply reply) implements ClusterInfoResult {}

    record Failure(Reason reason, String message, boolean retryable) implements ClusterInfoResult {}

    enum Reason {
        INDEX_NOT_FOUND,
        NO_NODE_ANSWERED
    }
}
