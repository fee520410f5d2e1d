// file: server/src/main/java/io/fanlite/server/RequestLogger.java
package io.fanlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request. Cluster info requests also carry how long
 * the fanout took and how many rounds it needed.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a request that did not fan out (admin, debug and routing replies).
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        emit(status, "HTTP %s %s -> %d (total=%dms)".formatted(method, path, status, totalMillis), error);
    }

    /**
     * Log a cluster info request.
     *
     * @param fanoutMillis time spent in the dispatcher, or -1 if the request failed before dispatch
     * @param rounds       rounds the fanout ran, or -1 when the reply does not say
     * @param incomplete   whether the reply was marked incomplete
     */
    public static void logFanoutRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long fanoutMillis,
            int rounds,
            boolean incomplete,
            Throwable error
    ) {
        emit(status, describeFanout(method, path, status, totalMillis, fanoutMillis, rounds, incomplete), error);
    }

    static String describeFanout(
            String method,
            String path,
            int status,
            long totalMillis,
            long fanoutMillis,
            int rounds,
            boolean incomplete
    ) {
        StringBuilder sb = new StringBuilder()
                .append("HTTP ").append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" (total=").append(totalMillis).append("ms");
        if (fanoutMillis >= 0) {
            sb.append(", fanout=").append(fanoutMillis).append("ms");
        }
        if (rounds > 0) {
            sb.append(", rounds=").append(rounds);
        }
        if (incomplete) {
            sb.append(", incomplete");
        }
        return sb.append(')').toString();
    }

    private static void emit(int status, String msg, Throwable error) {
        if (status >= 500) {
            if (error != null) {
                log.log(Level.WARNING, msg, error);
            } else {
                log.log(Level.WARNING, msg);
            }
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
