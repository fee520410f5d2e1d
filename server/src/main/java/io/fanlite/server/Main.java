// file: server/src/main/java/io/fanlite/server/Main.java
package io.fanlite.server;

import io.fanlite.core.FanoutDispatcher;
import io.fanlite.server.cluster.ClusterConfig;
import io.fanlite.server.cluster.ClusterTargetResolver;
import io.fanlite.server.cluster.ClusterView;
import io.fanlite.server.cluster.CoordinatorClient;
import io.fanlite.server.cluster.CoordinatorClientPool;
import io.fanlite.server.coordinator.GrpcCoordinatorService;
import io.fanlite.server.debug.TestCallReport;
import io.fanlite.server.index.IndexInfoProvider;
import io.fanlite.server.index.IndexRegistry;
import io.fanlite.server.info.ClusterInfoRetryPolicy;
import io.fanlite.server.info.ClusterInfoService;
import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a single fanout-lite node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Build the cluster view, target resolver and coordinator client pool.
 *  - Wire the fanout dispatcher and ClusterInfoService.
 *  - Start the gRPC server answering peers' fanout calls.
 *  - Start the HTTP server for the client API.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Local index catalogue ------
        var registry = new IndexRegistry();
        var localInfo = new IndexInfoProvider(registry);

        // ------ Topology ------
        Path configPath = cfg.clusterConfigPath() == null || cfg.clusterConfigPath().isBlank()
                ? null
                : Path.of(cfg.clusterConfigPath());
        var view = new ClusterView(buildClusterConfig(cfg, configPath));
        var resolver = new ClusterTargetResolver(view);

        // ------ Fanout ------
        var pool = new CoordinatorClientPool();
        view.addListener(next -> pool.retainOnly(
                next.nodes().stream().map(next::toNodeInfo).toList()));

        var dispatcher = new FanoutDispatcher<CoordinatorClient>(resolver, pool, cfg.fanoutMaxRetries());
        var policy = ClusterInfoRetryPolicy.defaults().withMaxRetries(cfg.fanoutMaxRetries());
        var infoService = new ClusterInfoService(dispatcher, localInfo, policy, cfg.fanoutTimeoutMs());

        // ------ gRPC + HTTP ------
        ClusterConfig.Node local = view.current().localNode();
        Server grpcServer = ServerBuilder
                .forPort(local.port())
                .addService(new GrpcCoordinatorService(localInfo))
                .build();

        var web = new WebServer(
                cfg.httpPort(),
                infoService,
                registry,
                new TestCallReport(view),
                dispatcher.metrics(),
                view,
                configPath
        );

        System.out.printf(
                "Node %s listening on http://%s:%d (HTTP) and grpc://%s:%d (fanout), %d nodes in %d shards%n",
                view.current().localNodeId(),
                "localhost", cfg.httpPort(),
                local.host(), local.port(),
                view.current().nodes().size(),
                view.current().shards().size()
        );

        grpcServer.start();
        web.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            grpcServer.shutdown();
            try {
                grpcServer.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcher.close();
            pool.close();
            log.info("node stopped");
        }));
    }

    /**
     * Topology from the cluster config file, or a one-node cluster on the gRPC port.
     * An explicit --node-id wins over the file's localNodeId.
     */
    static ClusterConfig buildClusterConfig(ServerConfig cfg, Path configPath) {
        if (configPath != null) {
            log.log(Level.INFO, "loading cluster config from {0}", configPath);
            return ClusterConfig.fromJsonFile(configPath, cfg.nodeId());
        }
        return ClusterConfig.singleNode(cfg.nodeIdOrDefault(), "localhost", cfg.grpcPort());
    }
}
