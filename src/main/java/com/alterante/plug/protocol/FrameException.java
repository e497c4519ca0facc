package com.alterante.plug.protocol;

/**
 * Thrown when a frame or its encrypted payload cannot be decoded.
 */
public class FrameException extends Exception {

    public FrameException(String message) {
        super(message);
    }

    public FrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
