// file: core/src/main/java/io/fanlite/core/TargetResolver.java
package io.fanlite.core;

import java.util.List;

/**
 * Supplies the ordered set of nodes to contact for a fanout mode.
 * <br>
 * Implementations must re-read the current topology on each call: the
 * dispatcher resolves targets again at the start of every round.
 */
public interface TargetResolver {

    /**
     * @param mode selection policy
     * @return ordered, non-empty list of targets
     * @throws TargetResolutionException if the topology is unknown or cannot satisfy the mode
     */
    List<NodeInfo> resolve(FanoutTargetMode mode) throws TargetResolutionException;
}
