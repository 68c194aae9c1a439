// file: server/src/main/java/io/slotkv/server/RequestLogger.java
package io.slotkv.server;

import io.slotkv.core.resp.Reply;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal hook for request-level logging.
 *
 * Responsibilities:
 *  - Central place to log command name, peer, reply kind and latency.
 *  - Same for the admin HTTP surface (method/path/status).
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed RESP command.
     *
     * @param name   upper-case command name
     * @param peer   remote address of the connection
     * @param reply  reply sent back (its kind is logged, not its payload)
     * @param micros wall-clock latency of dispatch
     * @param error  unexpected exception behind an internal error reply, null if none
     */
    public static void logCommand(String name, String peer, Reply reply, long micros, Throwable error) {
        if (error != null) {
            log.log(Level.WARNING, String.format("RESP %s from %s -> internal error (%dus)", name, peer, micros), error);
            return;
        }
        if (!log.isLoggable(Level.FINE)) return;
        log.fine(String.format("RESP %s from %s -> %s (%dus)", name, peer, kind(reply), micros));
    }

    /**
     * Log a completed admin HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    static String kind(Reply reply) {
        if (reply instanceof Reply.Error e) return "error " + e.code();
        if (reply instanceof Reply.SimpleString) return "simple";
        if (reply instanceof Reply.Integer) return "integer";
        if (reply instanceof Reply.BulkString) return "bulk";
        if (reply instanceof Reply.Array a) return "array[" + a.elements().size() + "]";
        return "null";
    }
}
