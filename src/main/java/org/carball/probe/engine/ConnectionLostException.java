package org.carball.probe.engine;

/**
 * Thrown when the engine connection drops during an operation.
 */
public class ConnectionLostException extends RuntimeException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
