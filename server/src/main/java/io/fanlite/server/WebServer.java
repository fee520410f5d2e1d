// file: server/src/main/java/io/fanlite/server/WebServer.java
package io.fanlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fanlite.core.FanoutMetrics;
import io.fanlite.core.TargetResolutionException;
import io.fanlite.server.cluster.ClusterConfig;
import io.fanlite.server.cluster.ClusterView;
import io.fanlite.server.debug.TestCallReport;
import io.fanlite.server.dto.ClusterInfoResponse;
import io.fanlite.server.dto.IndexUpsertRequest;
import io.fanlite.server.dto.TestCallResponse;
import io.fanlite.server.index.IndexDescriptor;
import io.fanlite.server.index.IndexRegistry;
import io.fanlite.server.index.IndexState;
import io.fanlite.server.info.ClusterInfoReply;
import io.fanlite.server.info.ClusterInfoResult;
import io.fanlite.server.info.ClusterInfoService;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin HTTP adapter over ClusterInfoService and the local index catalogue.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *
 * Path layout:
 *   - GET    /ft/info/{db}/{index}[?timeoutMs=N]  Cluster-wide index info (fanout)
 *   - PUT    /admin/index/{db}/{index}            Create/replace a local index partition
 *   - DELETE /admin/index/{db}/{index}            Drop a local index partition
 *   - GET    /debug/testcall/{command}            Cluster-slots diagnostic
 *   - GET    /admin/fanout/metrics                Dispatcher counters
 *   - POST   /admin/topology/reload               Re-read the cluster config file
 *   - GET    /admin/health                        Basic health check
 *
 * Status mapping for /ft/info:
 *   200 Success, 404 unknown index, 502 no node answered,
 *   503 cluster members could not be resolved, 400 bad input.
 */
public final class WebServer {
    private static final Logger log = Logger.getLogger(WebServer.class.getName());

    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private static final String INFO_PREFIX = "/ft/info/";
    private static final String INDEX_PREFIX = "/admin/index/";
    private static final String TESTCALL_PREFIX = "/debug/testcall/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ClusterInfoService info;
    private final IndexRegistry registry;
    private final TestCallReport testCall;
    private final FanoutMetrics metrics;
    private final ClusterView view;
    private final Path clusterConfigPath; // null when running from the built-in single-node topology

    public WebServer(int port,
                     ClusterInfoService info,
                     IndexRegistry registry,
                     TestCallReport testCall,
                     FanoutMetrics metrics,
                     ClusterView view,
                     Path clusterConfigPath) {
        this.info = info;
        this.registry = registry;
        this.testCall = testCall;
        this.metrics = metrics;
        this.view = view;
        this.clusterConfigPath = clusterConfigPath;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (path.startsWith(INFO_PREFIX) && "GET".equals(method)) {
            // The fanout blocks until every node answered or timed out.
            if (exchange.isInIoThread()) {
                exchange.dispatch(this::route);
                return;
            }
            handleInfo(exchange, path.substring(INFO_PREFIX.length()));
        } else if (path.startsWith(INDEX_PREFIX)) {
            String rest = path.substring(INDEX_PREFIX.length());
            switch (method) {
                case "PUT" -> handleUpsert(exchange, rest);
                case "DELETE" -> handleDrop(exchange, rest);
                default -> reply(exchange, method, 405, Map.of("error", "method not allowed"));
            }
        } else if (path.startsWith(TESTCALL_PREFIX) && "GET".equals(method)) {
            handleTestCall(exchange, path.substring(TESTCALL_PREFIX.length()));
        } else if ("/admin/fanout/metrics".equals(path) && "GET".equals(method)) {
            reply(exchange, method, 200, metrics.snapshot());
        } else if ("/admin/topology/reload".equals(path) && "POST".equals(method)) {
            handleTopologyReload(exchange);
        } else if ("/admin/health".equals(path)) {
            reply(exchange, method, 200, Map.of("status", "ok"));
        } else {
            reply(exchange, method, 404, Map.of("error", "not found"));
        }
    }

    // ---------- handlers ----------

    /** GET /ft/info/{db}/{index} */
    private void handleInfo(HttpServerExchange ex, String rest) {
        long start = System.nanoTime();
        int status = 200;
        long fanoutMs = -1L;
        int rounds = -1;
        boolean incomplete = false;
        Throwable error = null;
        try {
            DbIndex target = DbIndex.parse(rest);
            String timeoutStr = firstOrNull(ex.getQueryParameters().get("timeoutMs"));
            long timeoutMs = info.defaultTimeoutMs();
            if (timeoutStr != null && !timeoutStr.isBlank()) {
                try {
                    timeoutMs = Long.parseLong(timeoutStr);
                } catch (NumberFormatException nfe) {
                    throw new IllegalArgumentException("timeoutMs must be a long", nfe);
                }
            }

            long fStart = System.nanoTime();
            ClusterInfoResult result = info.info(target.dbNum(), target.index(), timeoutMs);
            fanoutMs = (System.nanoTime() - fStart) / 1_000_000L;

            if (result instanceof ClusterInfoResult.Success s) {
                rounds = s.reply().rounds();
                incomplete = s.reply().incomplete();
                send(ex, status, toResponse(s.reply()));
            } else if (result instanceof ClusterInfoResult.Failure f) {
                status = f.reason() == ClusterInfoResult.Reason.INDEX_NOT_FOUND ? 404 : 502;
                send(ex, status, Map.of("error", f.message(), "retryable", f.retryable()));
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (TargetResolutionException unresolved) {
            status = 503;
            error = unresolved;
            send(ex, status, Map.of("error", String.valueOf(unresolved.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logFanoutRequest("GET", ex.getRequestPath(), status, totalMs, fanoutMs, rounds, incomplete, error);
        }
    }

    /** PUT /admin/index/{db}/{index} */
    private void handleUpsert(HttpServerExchange ex, String rest) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            DbIndex target = DbIndex.parse(rest);
                            var req = data.length == 0
                                    ? new IndexUpsertRequest()
                                    : json.readValue(data, IndexUpsertRequest.class);
                            IndexDescriptor stored = registry.upsert(toDescriptor(target, req));
                            status = 200;
                            send(exchange, status, describe(stored));
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, errorBody(e));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("PUT", exchange.getRequestPath(), exchange.getStatusCode(), totalMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), 400, 0, ioEx);
                }
        );
    }

    /** DELETE /admin/index/{db}/{index} */
    private void handleDrop(HttpServerExchange ex, String rest) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            DbIndex target = DbIndex.parse(rest);
            if (registry.drop(target.dbNum(), target.index())) {
                send(ex, status, Map.of("dropped", true));
            } else {
                status = 404;
                send(ex, status, Map.of("dropped", false, "error", "no such index"));
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("DELETE", ex.getRequestPath(), status, totalMs, error);
        }
    }

    /** GET /debug/testcall/{command} */
    private void handleTestCall(HttpServerExchange ex, String command) {
        int status = 200;
        Throwable error = null;
        try {
            var dto = new TestCallResponse();
            dto.command = command;
            dto.lines = testCall.run(command);
            send(ex, status, dto);
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } finally {
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, 0, error);
        }
    }

    /** POST /admin/topology/reload */
    private void handleTopologyReload(HttpServerExchange ex) {
        int status = 200;
        Throwable error = null;
        try {
            if (clusterConfigPath == null) {
                status = 501;
                send(ex, status, Map.of("error", "no cluster config file configured"));
                return;
            }
            ClusterConfig next = ClusterConfig.fromJsonFile(clusterConfigPath, view.current().localNodeId());
            view.update(next);
            send(ex, status, Map.of("shards", next.shards().size(), "nodes", next.nodes().size()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            RequestLogger.logRequest("POST", ex.getRequestPath(), status, 0, error);
        }
    }

    // ---------- helpers ----------

    /** {db}/{index} path tail; the index name may itself contain '/'. */
    record DbIndex(int dbNum, String index) {
        static DbIndex parse(String rest) {
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                throw new IllegalArgumentException("expected /{db}/{index}");
            }
            int db;
            try {
                db = Integer.parseInt(rest.substring(0, slash));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("db must be an integer", nfe);
            }
            String index = rest.substring(slash + 1);
            if (index.isBlank()) {
                throw new IllegalArgumentException("index name must not be empty");
            }
            return new DbIndex(db, index);
        }
    }

    private static IndexDescriptor toDescriptor(DbIndex target, IndexUpsertRequest req) {
        if (target.dbNum() > ClusterInfoService.MAX_DB_NUM) {
            throw new IllegalArgumentException("db must be in [0, " + ClusterInfoService.MAX_DB_NUM + "]");
        }
        return new IndexDescriptor(
                target.dbNum(),
                target.index(),
                req.fingerprint == null ? 0L : req.fingerprint,
                req.version == null ? 0 : req.version,
                req.numDocs == null ? 0L : req.numDocs,
                req.backfillCompletePercent == null ? 100f : req.backfillCompletePercent,
                IndexState.fromWireName(req.state)
        );
    }

    private static Map<String, Object> describe(IndexDescriptor d) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dbNum", d.dbNum());
        body.put("name", d.name());
        body.put("fingerprint", d.fingerprint());
        body.put("version", d.version());
        body.put("numDocs", d.numDocs());
        body.put("backfillCompletePercent", d.backfillCompletePercent());
        body.put("state", d.state().wireName());
        return body;
    }

    private static ClusterInfoResponse toResponse(ClusterInfoReply r) {
        var dto = new ClusterInfoResponse();
        dto.indexName = r.indexName();
        dto.dbNum = r.dbNum();
        dto.exists = r.exists();
        dto.state = r.state();
        dto.numDocs = r.numDocs();
        dto.backfillInProgress = r.backfillInProgress();
        dto.backfillCompletePercentMin = r.backfillCompletePercentMin();
        dto.backfillCompletePercentMax = r.backfillCompletePercentMax();
        dto.fingerprint = r.fingerprint();
        dto.version = r.version();
        dto.consistent = r.consistent();
        dto.incomplete = r.incomplete();
        dto.respondedNodes = r.respondedNodes();
        dto.failedNodes = r.failedNodes();
        dto.rounds = r.rounds();
        return dto;
    }

    private static Map<String, Object> errorBody(Exception e) {
        return Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()));
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private void reply(HttpServerExchange ex, String method, int code, Object body) {
        send(ex, code, body);
        RequestLogger.logRequest(method, ex.getRequestPath(), code, 0, null);
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "failed to serialize response body", e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
