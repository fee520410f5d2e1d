// file: server/src/main/java/io/fanlite/server/ServerConfig.java
package io.fanlite.server;

import io.fanlite.core.FanoutDispatcher;
import io.fanlite.server.info.ClusterInfoService;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - nodeId:            logical node identity; null when --node-id was not given, in which
 *                       case the cluster config's localNodeId (or node-a in single-node mode) applies
 *  - httpPort:          external HTTP API port
 *  - grpcPort:          internal node-to-node gRPC port (single-node mode only)
 *  - clusterConfigPath: optional JSON cluster config for multi-node setups
 *  - fanoutMaxRetries:  extra rounds a fanout may run when nodes disagree
 *  - fanoutTimeoutMs:   default per-round deadline for cluster info queries
 */
public record ServerConfig(
        String nodeId,
        int httpPort,
        int grpcPort,
        String clusterConfigPath,
        int fanoutMaxRetries,
        long fanoutTimeoutMs
) {

    public static final String DEFAULT_NODE_ID = "node-a";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id,   -n   <id>
     *   --http-port, -p   <port>
     *   --grpc-port, -g   <port>
     *   --cluster-config, -c <path>
     *   --fanout-max-retries <n>
     *   --fanout-timeout-ms  <ms>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        String nodeId = null;
        int httpPort = 8080;
        int grpcPort = 50051;
        String clusterConfigPath = null;
        int fanoutMaxRetries = FanoutDispatcher.DEFAULT_MAX_RETRIES;
        long fanoutTimeoutMs = ClusterInfoService.DEFAULT_TIMEOUT_MS;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt("http-port", args[++i]);
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parseInt("grpc-port", args[++i]);
                }

                case "--cluster-config", "-c" -> {
                    ensureValue(args, i);
                    clusterConfigPath = args[++i];
                }

                case "--fanout-max-retries" -> {
                    ensureValue(args, i);
                    fanoutMaxRetries = parseInt("fanout-max-retries", args[++i]);
                }

                case "--fanout-timeout-ms" -> {
                    ensureValue(args, i);
                    fanoutTimeoutMs = parseInt("fanout-timeout-ms", args[++i]);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                nodeId,
                httpPort,
                grpcPort,
                clusterConfigPath,
                fanoutMaxRetries,
                fanoutTimeoutMs
        );
    }

    public ServerConfig {
        if (nodeId != null && nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        if (fanoutMaxRetries < 0) {
            throw new IllegalArgumentException("fanout-max-retries must be >= 0");
        }
        if (fanoutTimeoutMs <= 0 || fanoutTimeoutMs > ClusterInfoService.MAX_TIMEOUT_MS) {
            throw new IllegalArgumentException(
                    "fanout-timeout-ms must be in (0, " + ClusterInfoService.MAX_TIMEOUT_MS + "]");
        }
    }

    /** Node id for single-node mode, where no cluster config can supply one. */
    public String nodeIdOrDefault() {
        return nodeId == null ? DEFAULT_NODE_ID : nodeId;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --node-id,        -n   Node identifier (default: the cluster config's
                                     localNodeId, or node-a without one)
              --http-port,      -p   HTTP port (default: 8080)
              --grpc-port,      -g   gRPC port without a cluster config (default: 50051)
              --cluster-config, -c   Path to JSON cluster config (optional)
              --fanout-max-retries   Extra fanout rounds on disagreement (default: 3)
              --fanout-timeout-ms    Per-round fanout deadline in ms (default: 5000)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
