// file: core/src/main/java/io/fanlite/core/ClientPool.java
package io.fanlite.core;

/**
 * Hands out the transport client used to reach a remote node.
 *
 * @param <C> transport client type understood by the fanout operations
 */
public interface ClientPool<C> {

    /**
     * @throws IllegalStateException if no client can be created for the node;
     *         the dispatcher records the target as unavailable
     */
    C clientFor(NodeInfo node);
}
