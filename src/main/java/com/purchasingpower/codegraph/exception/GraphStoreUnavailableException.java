package com.purchasingpower.codegraph.exception;

/**
 * The graph store cannot be reached. Fatal for the run: nothing is reported as loaded.
 */
public class GraphStoreUnavailableException extends GraphStoreException {

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
