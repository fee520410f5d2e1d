// file: server/src/test/java/io/fanlite/server/cluster/ClusterConfigJsonTest.java
package io.fanlite.server.cluster;

import io.fanlite.core.NodeRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the sharded topology can be loaded from JSON and is validated.
 */
class ClusterConfigJsonTest {

    @TempDir
    Path tmp;

    private static final String TWO_SHARDS = """
            {
              "localNodeId": "node-a",
              "shards": [
                {"shardId": "s0", "startSlot": 0,    "endSlot": 8191},
                {"shardId": "s1", "startSlot": 8192, "endSlot": 16383}
              ],
              "nodes": [
                {"nodeId": "node-a", "host": "localhost", "grpcPort": 50051, "role": "primary", "shardId": "s0"},
                {"nodeId": "node-b", "host": "localhost", "grpcPort": 50052, "role": "replica", "shardId": "s0"},
                {"nodeId": "node-c", "host": "localhost", "grpcPort": 50053, "role": "master",  "shardId": "s1"},
                {"nodeId": "node-d", "host": "localhost", "grpcPort": 50054, "role": "slave",   "shardId": "s1"}
              ],
              "comment": "unknown fields are ignored"
            }
            """;

    private Path write(String json) throws Exception {
        Path cfgPath = tmp.resolve("cluster.json");
        Files.writeString(cfgPath, json);
        return cfgPath;
    }

    @Test
    void loads_two_shard_cluster_from_json() throws Exception {
        ClusterConfig cfg = ClusterConfig.fromJsonFile(write(TWO_SHARDS));

        assertEquals("node-a", cfg.localNodeId());
        assertEquals(2, cfg.shards().size());
        assertEquals(4, cfg.nodes().size());

        assertEquals("node-c", cfg.primaryOf("s1").orElseThrow().nodeId());
        assertEquals(NodeRole.REPLICA, cfg.nodes().get(3).role());
        assertEquals(List.of("node-a", "node-b"),
                cfg.nodesInShard("s0").stream().map(ClusterConfig.Node::nodeId).toList());

        var b = cfg.toNodeInfo(cfg.nodes().get(1));
        assertEquals("localhost:50052", b.address());
        assertFalse(b.local());
        assertTrue(cfg.toNodeInfo(cfg.localNode()).local());
    }

    @Test
    void cli_node_id_overrides_file() throws Exception {
        ClusterConfig cfg = ClusterConfig.fromJsonFile(write(TWO_SHARDS), "node-c");
        assertEquals("node-c", cfg.localNodeId());
        assertEquals(50053, cfg.localNode().port());
    }

    @Test
    void rejects_overlapping_slot_ranges() throws Exception {
        String json = TWO_SHARDS.replace("\"startSlot\": 8192", "\"startSlot\": 8000");
        var ex = assertThrows(IllegalArgumentException.class, () -> ClusterConfig.fromJsonFile(write(json)));
        assertTrue(ex.getMessage().contains("overlap"));
    }

    @Test
    void rejects_two_primaries_in_one_shard() throws Exception {
        String json = TWO_SHARDS.replace("\"role\": \"replica\"", "\"role\": \"primary\"");
        var ex = assertThrows(IllegalArgumentException.class, () -> ClusterConfig.fromJsonFile(write(json)));
        assertTrue(ex.getMessage().contains("two primaries"));
    }

    @Test
    void rejects_unknown_shard_and_missing_local_node() throws Exception {
        String badShard = TWO_SHARDS.replace("\"shardId\": \"s1\"}", "\"shardId\": \"s9\"}");
        assertThrows(IllegalArgumentException.class, () -> ClusterConfig.fromJsonFile(write(badShard)));

        assertThrows(IllegalArgumentException.class,
                () -> ClusterConfig.fromJsonFile(write(TWO_SHARDS), "node-z"));
    }

    @Test
    void rejects_slots_out_of_range() {
        assertThrows(IllegalArgumentException.class,
                () -> new ClusterConfig.Shard("s0", 0, ClusterConfig.SLOT_COUNT));
    }

    @Test
    void single_node_covers_every_slot() {
        ClusterConfig cfg = ClusterConfig.singleNode("solo", "localhost", 50051);
        assertEquals(1, cfg.shards().size());
        assertEquals(0, cfg.shards().get(0).startSlot());
        assertEquals(ClusterConfig.SLOT_COUNT - 1, cfg.shards().get(0).endSlot());
        assertEquals(NodeRole.PRIMARY, cfg.localNode().role());
    }
}
