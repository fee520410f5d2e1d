// file: server/src/main/java/io/fanlite/server/cluster/ClusterTargetResolver.java
package io.fanlite.server.cluster;

import io.fanlite.core.FanoutTargetMode;
import io.fanlite.core.NodeInfo;
import io.fanlite.core.NodeRole;
import io.fanlite.core.TargetResolutionException;
import io.fanlite.core.TargetResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Resolves fanout targets from the node's ClusterView.
 * <br>
 * Order follows the config: shard order for per-shard modes, node order for
 * ALL and ALL_REPLICAS.
 */
public final class ClusterTargetResolver implements TargetResolver {

    private final ClusterView view;
    private final Random random;

    public ClusterTargetResolver(ClusterView view) {
        this(view, null);
    }

    /**
     * @param random source for ONE_PER_SHARD picks; null uses ThreadLocalRandom
     */
    public ClusterTargetResolver(ClusterView view, Random random) {
        this.view = Objects.requireNonNull(view, "view");
        this.random = random;
    }

    @Override
    public List<NodeInfo> resolve(FanoutTargetMode mode) throws TargetResolutionException {
        Objects.requireNonNull(mode, "mode");
        ClusterConfig cluster = view.current();

        List<NodeInfo> targets = new ArrayList<>();
        switch (mode) {
            case ALL -> cluster.nodes().forEach(n -> targets.add(cluster.toNodeInfo(n)));
            case ALL_REPLICAS -> cluster.nodes().stream()
                    .filter(n -> n.role() == NodeRole.REPLICA)
                    .forEach(n -> targets.add(cluster.toNodeInfo(n)));
            case ALL_PRIMARIES -> {
                for (ClusterConfig.Shard shard : cluster.shards()) {
                    Optional<ClusterConfig.Node> primary = cluster.primaryOf(shard.shardId());
                    if (primary.isEmpty()) {
                        throw new TargetResolutionException("shard " + shard.shardId() + " has no primary");
                    }
                    targets.add(cluster.toNodeInfo(primary.get()));
                }
            }
            case ONE_PER_SHARD -> {
                for (ClusterConfig.Shard shard : cluster.shards()) {
                    targets.add(cluster.toNodeInfo(pickOne(cluster, shard)));
                }
            }
        }

        if (targets.isEmpty()) {
            throw new TargetResolutionException("no nodes match fanout mode " + mode);
        }
        return List.copyOf(targets);
    }

    private ClusterConfig.Node pickOne(ClusterConfig cluster, ClusterConfig.Shard shard)
            throws TargetResolutionException {
        List<ClusterConfig.Node> members = cluster.nodesInShard(shard.shardId());
        if (members.isEmpty()) {
            throw new TargetResolutionException("shard " + shard.shardId() + " has no nodes");
        }
        for (ClusterConfig.Node n : members) {
            if (n.nodeId().equals(cluster.localNodeId())) {
                return n;
            }
        }
        int idx = random == null
                ? ThreadLocalRandom.current().nextInt(members.size())
                : random.nextInt(members.size());
        return members.get(idx);
    }
}
