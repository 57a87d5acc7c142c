package com.purchasingpower.codegraph.exception;

/**
 * A graph store write failed. The loader reports the affected items and keeps going.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
