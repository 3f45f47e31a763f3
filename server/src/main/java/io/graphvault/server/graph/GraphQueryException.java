package io.graphvault.server.graph;

/** A single statement was rejected by the store (constraint, syntax, type error). */
public class GraphQueryException extends RuntimeException {
    public GraphQueryException(String message) {
        super(message);
    }

    public GraphQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
