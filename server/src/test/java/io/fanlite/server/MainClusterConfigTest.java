// file: server/src/test/java/io/fanlite/server/MainClusterConfigTest.java
package io.fanlite.server;

import io.fanlite.server.cluster.ClusterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Which node a server believes it is, depending on the flags and the cluster file.
 */
class MainClusterConfigTest {

    @TempDir
    Path tmp;

    private static final String TWO_NODES = """
            {
              "localNodeId": "n2",
              "shards": [{"shardId": "s0", "startSlot": 0, "endSlot": 16383}],
              "nodes": [
                {"nodeId": "n1", "host": "localhost", "grpcPort": 50061, "role": "primary", "shardId": "s0"},
                {"nodeId": "n2", "host": "localhost", "grpcPort": 50062, "role": "replica", "shardId": "s0"}
              ]
            }
            """;

    private Path write(String json) throws Exception {
        Path p = tmp.resolve("cluster.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void cluster_file_local_node_id_applies_without_node_id_flag() throws Exception {
        Path file = write(TWO_NODES);
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-c", file.toString()});

        ClusterConfig cluster = Main.buildClusterConfig(cfg, file);

        assertEquals("n2", cluster.localNodeId());
        assertEquals(50062, cluster.localNode().port());
    }

    @Test
    void node_id_flag_overrides_the_cluster_file() throws Exception {
        Path file = write(TWO_NODES);
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-c", file.toString(), "-n", "n1"});

        ClusterConfig cluster = Main.buildClusterConfig(cfg, file);

        assertEquals("n1", cluster.localNodeId());
    }

    @Test
    void file_without_local_node_id_needs_the_flag() throws Exception {
        Path file = write(TWO_NODES.replace("\"localNodeId\": \"n2\",", ""));
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-c", file.toString()});

        var ex = assertThrows(IllegalArgumentException.class, () -> Main.buildClusterConfig(cfg, file));
        assertTrue(ex.getMessage().contains("--node-id"));
    }

    @Test
    void single_node_mode_falls_back_to_the_default_id() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-g", "50070"});

        ClusterConfig cluster = Main.buildClusterConfig(cfg, null);

        assertEquals(ServerConfig.DEFAULT_NODE_ID, cluster.localNodeId());
        assertEquals(50070, cluster.localNode().port());
    }
}
