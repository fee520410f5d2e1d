// file: core/src/main/java/io/fanlite/core/NodeRole.java
package io.fanlite.core;

/**
 * Role of a cluster member within its shard.
 */
public enum NodeRole {
    PRIMARY,
    REPLICA
}
