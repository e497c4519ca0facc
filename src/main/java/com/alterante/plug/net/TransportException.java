package com.alterante.plug.net;

/**
 * Socket-level failure: the socket could not be opened, the address did not
 * resolve, a send failed, or the client is already closed.
 */
public class TransportException extends DeviceException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
