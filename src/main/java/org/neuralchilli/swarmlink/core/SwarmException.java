package org.neuralchilli.swarmlink.core;

/**
 * Base exception for failures inside the coordination layer.
 */
public class SwarmException extends RuntimeException {

    public SwarmException(String message) {
        super(message);
    }

    public SwarmException(String message, Throwable cause) {
        super(message, cause);
    }
}
