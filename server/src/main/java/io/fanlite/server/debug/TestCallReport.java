// file: server/src/main/java/io/fanlite/server/debug/TestCallReport.java
package io.fanlite.server.debug;

import io.fanlite.core.NodeRole;
import io.fanlite.server.cluster.ClusterConfig;
import io.fanlite.server.cluster.ClusterView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Diagnostic "test call" command: renders what this node believes the
 * cluster looks like, one line per fact.
 * <br>
 * Supported commands:
 *  - CLUSTER_SLOTS: every slot range with its primary ("Master") and replicas.
 */
public final class TestCallReport {

    private static final Logger log = Logger.getLogger(TestCallReport.class.getName());

    public static final String CLUSTER_SLOTS = "CLUSTER_SLOTS";

    private final ClusterView view;

    public TestCallReport(ClusterView view) {
        this.view = Objects.requireNonNull(view, "view");
    }

    /**
     * @throws IllegalArgumentException if command is blank
     */
    public List<String> run(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Usage: TESTCALL <command> [args...]");
        }
        log.log(Level.FINE, "test call {0}", command);

        List<String> lines = new ArrayList<>();
        lines.add("=== Testing cluster call ===");
        lines.add("Command: " + command);

        if (CLUSTER_SLOTS.equals(command.trim().toUpperCase(Locale.ROOT))) {
            clusterSlots(view.current(), lines);
        } else {
            lines.add("Unknown test. Available: " + CLUSTER_SLOTS);
        }
        return lines;
    }

    private static void clusterSlots(ClusterConfig cluster, List<String> lines) {
        List<ClusterConfig.Shard> shards = new ArrayList<>(cluster.shards());
        shards.sort(Comparator.comparingInt(ClusterConfig.Shard::startSlot));
        lines.add("Number of slot ranges: " + shards.size());

        for (int i = 0; i < shards.size(); i++) {
            ClusterConfig.Shard shard = shards.get(i);
            lines.add("--- Slot Range " + i + " ---");
            lines.add("Slots: " + shard.startSlot() + " to " + shard.endSlot());

            // primary first, then replicas in config order
            cluster.primaryOf(shard.shardId()).ifPresent(p -> lines.add(describe("Master", p)));
            for (ClusterConfig.Node n : cluster.nodesInShard(shard.shardId())) {
                if (n.role() == NodeRole.REPLICA) {
                    lines.add(describe("Replica", n));
                }
            }
        }
    }

    private static String describe(String label, ClusterConfig.Node n) {
        return "%s: %s:%d (ID: %s)".formatted(label, n.host(), n.port(), n.nodeId());
    }
}
