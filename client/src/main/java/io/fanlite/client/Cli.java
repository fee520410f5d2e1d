// file: client/src/main/java/io/fanlite/client/Cli.java
package io.fanlite.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for interacting with a running fanout-lite node over HTTP.
 *
 * Usage:
 *   fanlite-cli [--base-url http://host:port] info <index> [--db N] [--timeout-ms N]
 *   fanlite-cli [--base-url http://host:port] testcall <command>
 *   fanlite-cli [--base-url http://host:port] create-index <index> [--db N] [--fingerprint F]
 *                                             [--version V] [--percent P] [--state S]
 *   fanlite-cli [--base-url http://host:port] drop-index <index> [--db N]
 *
 * Examples:
 *   fanlite-cli create-index books --version 2 --percent 40 --state backfill_in_progress
 *   fanlite-cli info books
 *   fanlite-cli testcall CLUSTER_SLOTS
 *
 * The node's JSON answer is printed as-is.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    /** One HTTP call derived from the command line. */
    record Invocation(String method, URI uri, String body) {}

    private final HttpClient http;

    private Cli() {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            int status = new Cli().execute(inv);
            System.exit(status >= 400 ? 1 : 0);
        } catch (CliException e) {
            usageAndExit(e.getMessage());
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Translate arguments into the HTTP call to make.
     *
     * @throws CliException on unknown commands, missing values or bad numbers
     */
    static Invocation parse(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        List<String> rest = new ArrayList<>(List.of(args));
        if (!rest.isEmpty() && "--base-url".equals(rest.get(0))) {
            if (rest.size() < 2) {
                throw new CliException("--base-url requires a value");
            }
            baseUrl = rest.get(1);
            rest = rest.subList(2, rest.size());
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (rest.isEmpty()) {
            throw new CliException("missing command");
        }

        String cmd = rest.get(0);
        if (rest.size() < 2 || rest.get(1).startsWith("--")) {
            throw new CliException(cmd + " requires an argument");
        }
        String target = rest.get(1);
        Map<String, String> opts = options(rest.subList(2, rest.size()));

        return switch (cmd) {
            case "info" -> {
                allowOnly(opts, "--db", "--timeout-ms");
                String query = opts.containsKey("--timeout-ms")
                        ? "?timeoutMs=" + number(opts, "--timeout-ms")
                        : "";
                yield new Invocation("GET", uri(baseUrl, "/ft/info/" + db(opts) + "/" + encode(target) + query), null);
            }
            case "testcall" -> {
                allowOnly(opts);
                yield new Invocation("GET", uri(baseUrl, "/debug/testcall/" + encode(target)), null);
            }
            case "create-index" -> {
                allowOnly(opts, "--db", "--fingerprint", "--version", "--percent", "--state");
                yield new Invocation("PUT", uri(baseUrl, "/admin/index/" + db(opts) + "/" + encode(target)), upsertBody(opts));
            }
            case "drop-index" -> {
                allowOnly(opts, "--db");
                yield new Invocation("DELETE", uri(baseUrl, "/admin/index/" + db(opts) + "/" + encode(target)), null);
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    private int execute(Invocation inv) throws Exception {
        HttpRequest.BodyPublisher publisher = inv.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(inv.body());
        HttpRequest req = HttpRequest.newBuilder()
                .uri(inv.uri())
                .header("Content-Type", "application/json")
                .method(inv.method(), publisher)
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 400) {
            System.err.println(inv.method() + " failed (" + resp.statusCode() + "): " + resp.body());
        } else {
            System.out.println(resp.body());
        }
        return resp.statusCode();
    }

    // ---------- helpers ----------

    private static Map<String, String> options(List<String> args) {
        Map<String, String> opts = new LinkedHashMap<>();
        for (int i = 0; i < args.size(); i++) {
            String flag = args.get(i);
            if (!flag.startsWith("--")) {
                throw new CliException("unexpected argument: " + flag);
            }
            if (i + 1 >= args.size()) {
                throw new CliException(flag + " requires a value");
            }
            opts.put(flag, args.get(++i));
        }
        return opts;
    }

    private static void allowOnly(Map<String, String> opts, String... allowed) {
        List<String> ok = List.of(allowed);
        for (String flag : opts.keySet()) {
            if (!ok.contains(flag)) {
                throw new CliException("unknown option: " + flag);
            }
        }
    }

    private static String db(Map<String, String> opts) {
        return opts.containsKey("--db") ? number(opts, "--db") : "0";
    }

    private static String number(Map<String, String> opts, String flag) {
        String v = opts.get(flag);
        try {
            return Long.toString(Long.parseLong(v));
        } catch (NumberFormatException e) {
            throw new CliException(flag + " must be a number: " + v);
        }
    }

    private static String upsertBody(Map<String, String> opts) {
        List<String> fields = new ArrayList<>();
        if (opts.containsKey("--fingerprint")) {
            fields.add("\"fingerprint\":" + number(opts, "--fingerprint"));
        }
        if (opts.containsKey("--version")) {
            fields.add("\"version\":" + number(opts, "--version"));
        }
        if (opts.containsKey("--percent")) {
            String p = opts.get("--percent");
            try {
                fields.add("\"backfillCompletePercent\":" + Float.parseFloat(p));
            } catch (NumberFormatException e) {
                throw new CliException("--percent must be a number: " + p);
            }
        }
        if (opts.containsKey("--state")) {
            String s = opts.get("--state");
            if (!s.matches("[A-Za-z_]+")) {
                throw new CliException("--state must be one of ready, backfill_in_progress, backfill_paused_by_oom");
            }
            fields.add("\"state\":\"" + s + "\"");
        }
        return "{" + String.join(",", fields) + "}";
    }

    private static URI uri(String baseUrl, String path) {
        return URI.create(baseUrl + path);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  fanlite-cli [--base-url http://host:port] info <index> [--db N] [--timeout-ms N]
                  fanlite-cli [--base-url http://host:port] testcall <command>
                  fanlite-cli [--base-url http://host:port] create-index <index> [--db N] [--fingerprint F]
                                                            [--version V] [--percent P] [--state S]
                  fanlite-cli [--base-url http://host:port] drop-index <index> [--db N]
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
