// file: server/src/test/java/io/fanlite/server/WebServerValidationTest.java
package io.fanlite.server;

import io.fanlite.server.debug.TestCallReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for WebServer routing and error semantics.
 *
 * Focus:
 *  - /ft/info status mapping (200, 404, 400).
 *  - Invalid JSON -> 400 "invalid JSON", too-large body -> 413.
 *  - Diagnostic, metrics and topology admin endpoints.
 */
class WebServerValidationTest {

    private static final int PORT = 18180; // test-only port

    @TempDir
    Path tmp;

    private InProcessCluster cluster;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startCluster() throws Exception {
        cluster = new InProcessCluster(List.of("node-a", "node-b"), Set.of());
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        cluster.close();
    }

    private void startServer(Path configPath) {
        var service = cluster.service(1, 1000);
        server = new WebServer(
                PORT,
                service,
                cluster.registry("node-a"),
                new TestCallReport(cluster.view()),
                cluster.dispatcher(0).metrics(),
                cluster.view(),
                configPath
        );
        server.start();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create("http://localhost:" + PORT + path));
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = b.method(method, publisher).header("Content-Type", "application/json").build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_is_ok() throws Exception {
        startServer(null);
        var resp = send("GET", "/admin/health", null);
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void created_index_is_reported_cluster_wide() throws Exception {
        startServer(null);
        String body = """
                {"fingerprint": 11, "version": 2, "numDocs": 5, "backfillCompletePercent": 100.0}
                """;
        assertEquals(200, send("PUT", "/admin/index/0/idx", body).statusCode());
        assertEquals(200, send("PUT", "/admin/index/0/idx", body).statusCode()); // upsert is idempotent
        cluster.registry("node-b").upsert(cluster.registry("node-a").find(0, "idx").orElseThrow());

        var resp = send("GET", "/ft/info/0/idx", null);
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("\"exists\":true"));
        assertTrue(resp.body().contains("\"incomplete\":false"));
        assertTrue(resp.body().contains("\"respondedNodes\":[\"node-a\",\"node-b\"]"));
    }

    @Test
    void unknown_index_returns_404_and_drop_of_unknown_returns_404() throws Exception {
        startServer(null);
        var resp = send("GET", "/ft/info/0/missing", null);
        assertEquals(404, resp.statusCode());
        assertTrue(resp.body().contains("not found in database 0"));

        assertEquals(404, send("DELETE", "/admin/index/0/missing", null).statusCode());
    }

    @Test
    void bad_path_and_params_return_400() throws Exception {
        startServer(null);
        assertEquals(400, send("GET", "/ft/info/x/idx", null).statusCode());
        assertEquals(400, send("GET", "/ft/info/0/", null).statusCode());
        assertEquals(400, send("GET", "/ft/info/99/idx", null).statusCode());
        assertEquals(400, send("GET", "/ft/info/0/idx?timeoutMs=soon", null).statusCode());
        assertEquals(400, send("GET", "/ft/info/0/idx?timeoutMs=0", null).statusCode());
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        startServer(null);
        var resp = send("PUT", "/admin/index/0/idx", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void unknown_state_returns_400() throws Exception {
        startServer(null);
        var resp = send("PUT", "/admin/index/0/idx", "{\"state\": \"melting\"}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("unknown index state"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        startServer(null);
        String big = "x".repeat(2 * WebServer.MAX_BODY_BYTES);
        var resp = send("PUT", "/admin/index/0/idx", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void testcall_and_metrics_endpoints() throws Exception {
        startServer(null);
        var slots = send("GET", "/debug/testcall/CLUSTER_SLOTS", null);
        assertEquals(200, slots.statusCode());
        assertTrue(slots.body().contains("Number of slot ranges: 2"));

        var metrics = send("GET", "/admin/fanout/metrics", null);
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("\"queries\""));
        assertTrue(metrics.body().contains("\"lateCompletions\""));
    }

    @Test
    void topology_reload_needs_a_config_file() throws Exception {
        startServer(null);
        assertEquals(501, send("POST", "/admin/topology/reload", null).statusCode());
    }

    @Test
    void topology_reload_swaps_the_view() throws Exception {
        Path cfg = tmp.resolve("cluster.json");
        Files.writeString(cfg, """
                {
                  "localNodeId": "node-a",
                  "shards": [{"shardId": "s0", "startSlot": 0, "endSlot": 16383}],
                  "nodes": [{"nodeId": "node-a", "host": "localhost", "grpcPort": 7001, "role": "primary", "shardId": "s0"}]
                }
                """);
        startServer(cfg);

        var resp = send("POST", "/admin/topology/reload", null);
        assertEquals(200, resp.statusCode());
        assertEquals(1, cluster.view().current().nodes().size());

        var slots = send("GET", "/debug/testcall/cluster_slots", null);
        assertTrue(slots.body().contains("Number of slot ranges: 1"));
    }

    @Test
    void unknown_route_and_method() throws Exception {
        startServer(null);
        assertEquals(404, send("GET", "/nope", null).statusCode());
        assertEquals(405, send("POST", "/admin/index/0/idx", "{}").statusCode());
    }
}
