// file: client/src/test/java/io/fanlite/client/CliTest.java
package io.fanlite.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Argument parsing of the CLI: which HTTP call each command turns into.
 */
class CliTest {

    @Test
    void info_uses_default_base_url_and_db_zero() {
        Cli.Invocation inv = Cli.parse(new String[]{"info", "books"});

        assertEquals("GET", inv.method());
        assertEquals("http://localhost:8080/ft/info/0/books", inv.uri().toString());
        assertNull(inv.body());
    }

    @Test
    void info_with_db_timeout_and_custom_base_url() {
        Cli.Invocation inv = Cli.parse(new String[]{
                "--base-url", "http://node-b:9090/", "info", "my books", "--db", "3", "--timeout-ms", "250"
        });

        assertEquals("http://node-b:9090/ft/info/3/my%20books?timeoutMs=250", inv.uri().toString());
    }

    @Test
    void create_index_builds_json_body() {
        Cli.Invocation inv = Cli.parse(new String[]{
                "create-index", "books", "--version", "2", "--percent", "40", "--state", "backfill_in_progress"
        });

        assertEquals("PUT", inv.method());
        assertEquals("http://localhost:8080/admin/index/0/books", inv.uri().toString());
        assertEquals("{\"version\":2,\"backfillCompletePercent\":40.0,\"state\":\"backfill_in_progress\"}", inv.body());
    }

    @Test
    void drop_index_and_testcall() {
        assertEquals("DELETE", Cli.parse(new String[]{"drop-index", "books", "--db", "1"}).method());
        assertEquals("http://localhost:8080/debug/testcall/CLUSTER_SLOTS",
                Cli.parse(new String[]{"testcall", "CLUSTER_SLOTS"}).uri().toString());
    }

    @Test
    void rejects_bad_arguments() {
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[0]));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"info"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"info", "books", "--db"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"info", "books", "--db", "x"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"info", "books", "--state", "ready"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"explode", "books"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--base-url"}));
    }
}
