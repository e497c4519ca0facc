package com.alterante.plug.net;

/**
 * Base class for failures reported by a device client.
 */
public class DeviceException extends Exception {

    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
