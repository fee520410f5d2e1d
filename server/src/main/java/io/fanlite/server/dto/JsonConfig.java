// file: server/src/main/java/io/fanlite/server/dto/JsonConfig.java
package io.fanlite.server.dto;

import java.util.List;

/**
 * On-disk cluster topology, bound by Jackson.
 */
public class JsonConfig {
    public String localNodeId;
    public List<Shard> shards;
    public List<Node> nodes;

    public static class Shard {
        public String shardId;
        public int startSlot;
        public int endSlot;
    }

    public static class Node {
        public String nodeId;
        public String host;
        public int grpcPort;
        public String role;
        public String shardId;
    }
}
