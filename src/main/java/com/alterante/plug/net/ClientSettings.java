package com.alterante.plug.net;

import com.alterante.plug.protocol.FrameCodec;

import java.time.Duration;

/**
 * Tunables for one device client.
 *
 * @param port              destination UDP port on the device
 * @param authTimeout       how long the handshake waits for the auth reply
 * @param commandTimeout    how long a command waits for any reply
 * @param queueCapacity     bound of the pending-response queue
 * @param receiveBufferSize size of the listener's datagram buffer
 */
public record ClientSettings(int port, Duration authTimeout, Duration commandTimeout,
                             int queueCapacity, int receiveBufferSize) {

    public static final int DEFAULT_PORT = 80;

    public ClientSettings {
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (receiveBufferSize < FrameCodec.HEADER_SIZE) {
            throw new IllegalArgumentException("receiveBufferSize must hold a frame header: " + receiveBufferSize);
        }
        if (authTimeout.isNegative() || commandTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
    }

    public static ClientSettings defaults() {
        return new ClientSettings(DEFAULT_PORT, Duration.ofSeconds(10), Duration.ofSeconds(1), 1000, 2048);
    }

    public ClientSettings withPort(int port) {
        return new ClientSettings(port, authTimeout, commandTimeout, queueCapacity, receiveBufferSize);
    }

    public ClientSettings withAuthTimeout(Duration authTimeout) {
        return new ClientSettings(port, authTimeout, commandTimeout, queueCapacity, receiveBufferSize);
    }

    public ClientSettings withCommandTimeout(Duration commandTimeout) {
        return new ClientSettings(port, authTimeout, commandTimeout, queueCapacity, receiveBufferSize);
    }
}
