// file: core/src/main/java/io/fanlite/core/NodeInfo.java
package io.fanlite.core;

import java.util.Objects;

/**
 * Identity of one cluster member as seen by a fanout round.
 * <br>
 * Owned by the TargetResolver; the dispatcher only references it.
 * {@code local} marks the member that is this process, which the dispatcher
 * answers in-process instead of going through the transport.
 *
 * @param nodeId  stable node identifier (display + client lookup)
 * @param host    host name or IP
 * @param port    node-to-node RPC port
 * @param role    primary or replica within its shard
 * @param shardId shard this node serves
 * @param local   true when this node is the calling process
 */
public record NodeInfo(
        String nodeId,
        String host,
        int port,
        NodeRole role,
        String shardId,
        boolean local
) {
    public NodeInfo {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(shardId, "shardId");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
    }

    /** "host:port", used for channel targets and log lines. */
    public String address() {
        return host + ":" + port;
    }

    public boolean isPrimary() {
        return role == NodeRole.PRIMARY;
    }
}
