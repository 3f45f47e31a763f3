// file: server/src/main/java/io/graphvault/server/RequestLogger.java
package io.graphvault.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log method/path/status and latency of admin requests.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param totalMillis  wall-clock latency for the whole request
     * @param opMillis     latency of the backup operation itself, or -1 if not measured
     * @param error        optional exception for 5xx logging, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long opMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                opMillis >= 0 ? ", op=" + opMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
