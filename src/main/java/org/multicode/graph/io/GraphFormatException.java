package org.multicode.graph.io;

/**
 * Thrown when a graph document cannot be read or does not describe a valid graph.
 */
public class GraphFormatException extends Exception {

    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
