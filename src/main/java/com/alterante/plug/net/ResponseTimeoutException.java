package com.alterante.plug.net;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * No frame (or no frame of the expected type) arrived before the deadline.
 */
public class ResponseTimeoutException extends DeviceException {

    private final int expectedType;
    private final Duration timeout;

    public ResponseTimeoutException(Duration timeout) {
        super("no response within " + timeout.toMillis() + "ms");
        this.expectedType = -1;
        this.timeout = timeout;
    }

    public ResponseTimeoutException(int expectedType, Duration timeout) {
        super(String.format("no response of type 0x%04X within %dms", expectedType, timeout.toMillis()));
        this.expectedType = expectedType;
        this.timeout = timeout;
    }

    /** The awaited response type, empty for an unconditional wait. */
    public OptionalInt expectedType() {
        return expectedType < 0 ? OptionalInt.empty() : OptionalInt.of(expectedType);
    }

    public Duration timeout() {
        return timeout;
    }
}
