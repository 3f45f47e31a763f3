package io.graphvault.server.graph;

/**
 * The graph store is unreachable or the connection was lost mid-operation.
 * Always fatal for the running operation.
 */
public class StoreConnectionException extends RuntimeException {
    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
