// file: server/src/main/java/io/fanlite/server/cluster/ClusterConfig.java
package io.fanlite.server.cluster;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fanlite.core.NodeInfo;
import io.fanlite.core.NodeRole;
import io.fanlite.server.dto.JsonConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static cluster topology: shards with their slot ranges, and the nodes
 * serving them.
 * <br>
 * Invariants checked at construction:
 *  - node ids and shard ids are unique,
 *  - every node belongs to a declared shard,
 *  - a shard has at most one primary (zero is allowed: failover in progress),
 *  - slot ranges lie in [0, SLOT_COUNT) and do not overlap,
 *  - the local node is part of the topology.
 */
public final class ClusterConfig {

    public static final int SLOT_COUNT = 16384;

    public record Shard(
            String shardId,
            int startSlot,
            int endSlot
    ) {
        public Shard {
            Objects.requireNonNull(shardId, "shardId");
            if (shardId.isBlank()) throw new IllegalArgumentException("shardId must not be blank");
            if (startSlot < 0 || endSlot >= SLOT_COUNT || startSlot > endSlot) {
                throw new IllegalArgumentException(
                        "invalid slot range %d-%d for shard %s".formatted(startSlot, endSlot, shardId));
            }
        }
    }

    public record Node(
            String nodeId,
            String host,
            int port,
            NodeRole role,
            String shardId
    ) {
        public Node {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(role, "role");
            Objects.requireNonNull(shardId, "shardId");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
        }
    }

    private final String localNodeId;
    private final List<Shard> shards;
    private final List<Node> nodes;

    public ClusterConfig(String localNodeId, List<Shard> shards, List<Node> nodes) {
        if (shards == null || shards.isEmpty()) throw new IllegalArgumentException("shards must not be empty");
        if (nodes == null || nodes.isEmpty()) throw new IllegalArgumentException("nodes must not be empty");
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.shards = List.copyOf(shards);
        this.nodes = List.copyOf(nodes);
        validate();
    }

    /**
     * One node serving every slot; used when no cluster config file is given.
     */
    public static ClusterConfig singleNode(String nodeId, String host, int port) {
        String shardId = "shard-0";
        return new ClusterConfig(
                nodeId,
                List.of(new Shard(shardId, 0, SLOT_COUNT - 1)),
                List.of(new Node(nodeId, host, port, NodeRole.PRIMARY, shardId))
        );
    }

    public static ClusterConfig fromJsonFile(Path path) {
        return fromJsonFile(path, null);
    }

    /**
     * Load the topology from JSON; {@code overrideLocalNodeId} (the CLI
     * --node-id) wins over the file's localNodeId when non-blank.
     */
    public static ClusterConfig fromJsonFile(Path path, String overrideLocalNodeId) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            if (cfg.shards == null || cfg.nodes == null) {
                throw new IllegalArgumentException("cluster config needs 'shards' and 'nodes'");
            }

            List<Shard> shardList = cfg.shards.stream()
                    .map(s -> new Shard(s.shardId, s.startSlot, s.endSlot))
                    .toList();
            List<Node> nodeList = cfg.nodes.stream()
                    .map(n -> new Node(n.nodeId, n.host, n.grpcPort, parseRole(n.role), n.shardId))
                    .toList();

            String localId = (overrideLocalNodeId != null && !overrideLocalNodeId.isBlank())
                    ? overrideLocalNodeId
                    : cfg.localNodeId;
            if (localId == null || localId.isBlank()) {
                throw new IllegalArgumentException("cluster config has no localNodeId and none was given with --node-id");
            }

            return new ClusterConfig(localId, shardList, nodeList);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ClusterConfig from " + path, e);
        }
    }

    private static NodeRole parseRole(String role) {
        if (role == null || role.isBlank()) {
            return NodeRole.PRIMARY;
        }
        return switch (role.trim().toLowerCase()) {
            case "primary", "master" -> NodeRole.PRIMARY;
            case "replica", "slave" -> NodeRole.REPLICA;
            default -> throw new IllegalArgumentException("unknown node role: " + role);
        };
    }

    private void validate() {
        Set<String> shardIds = new HashSet<>();
        for (Shard s : shards) {
            if (!shardIds.add(s.shardId())) {
                throw new IllegalArgumentException("duplicate shardId " + s.shardId());
            }
        }

        List<Shard> bySlot = new ArrayList<>(shards);
        bySlot.sort(Comparator.comparingInt(Shard::startSlot));
        for (int i = 1; i < bySlot.size(); i++) {
            Shard prev = bySlot.get(i - 1);
            Shard cur = bySlot.get(i);
            if (cur.startSlot() <= prev.endSlot()) {
                throw new IllegalArgumentException(
                        "slot ranges of %s and %s overlap".formatted(prev.shardId(), cur.shardId()));
            }
        }

        Set<String> nodeIds = new HashSet<>();
        Map<String, String> primaries = new HashMap<>();
        for (Node n : nodes) {
            if (!nodeIds.add(n.nodeId())) {
                throw new IllegalArgumentException("duplicate nodeId " + n.nodeId());
            }
            if (!shardIds.contains(n.shardId())) {
                throw new IllegalArgumentException(
                        "node %s references unknown shard %s".formatted(n.nodeId(), n.shardId()));
            }
            if (n.role() == NodeRole.PRIMARY) {
                String other = primaries.putIfAbsent(n.shardId(), n.nodeId());
                if (other != null) {
                    throw new IllegalArgumentException(
                            "shard %s has two primaries: %s and %s".formatted(n.shardId(), other, n.nodeId()));
                }
            }
        }

        if (!nodeIds.contains(localNodeId)) {
            throw new IllegalArgumentException(
                    "localNodeId %s not present in cluster nodes".formatted(localNodeId));
        }
    }

    public String localNodeId() {
        return localNodeId;
    }

    public List<Shard> shards() {
        return shards;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Node localNode() {
        return nodes.stream()
                .filter(n -> n.nodeId().equals(localNodeId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "localNodeId %s not present in cluster nodes".formatted(localNodeId)
                ));
    }

    /** Members of a shard in config order. */
    public List<Node> nodesInShard(String shardId) {
        return nodes.stream()
                .filter(n -> n.shardId().equals(shardId))
                .toList();
    }

    public Optional<Node> primaryOf(String shardId) {
        return nodes.stream()
                .filter(n -> n.shardId().equals(shardId) && n.role() == NodeRole.PRIMARY)
                .findFirst();
    }

    public NodeInfo toNodeInfo(Node n) {
        return new NodeInfo(n.nodeId(), n.host(), n.port(), n.role(), n.shardId(), n.nodeId().equals(localNodeId));
    }
}
