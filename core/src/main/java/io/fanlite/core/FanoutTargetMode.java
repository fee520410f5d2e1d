// file: core/src/main/java/io/fanlite/core/FanoutTargetMode.java
package io.fanlite.core;

/**
 * Selection policy deciding which cluster members a fanout round contacts.
 */
public enum FanoutTargetMode {
    /** Every member of every shard, primaries and replicas. */
    ALL,
    /** The primary of every shard. */
    ALL_PRIMARIES,
    /** Every replica of every shard. */
    ALL_REPLICAS,
    /** One member per shard; the local node wins when it belongs to the shard. */
    ONE_PER_SHARD
}
