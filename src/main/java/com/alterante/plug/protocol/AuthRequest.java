package com.alterante.plug.protocol;

import java.nio.charset.StandardCharsets;

/**
 * Plaintext payload of the authentication request.
 *
 * <pre>
 * Offset  Field
 * 0x2D    Flag (0x01)
 * 0x30    Host name, truncated / zero-padded to 32 bytes
 * </pre>
 * All other bytes of the 0x50-byte payload are zero.
 */
public final class AuthRequest {

    public static final int SIZE = 0x50;

    private static final int OFF_FLAG = 0x2D;
    private static final int OFF_HOST_NAME = 0x30;
    public static final int HOST_NAME_WIDTH = SIZE - OFF_HOST_NAME;

    private static final byte FLAG = 0x01;

    private AuthRequest() {}

    public static byte[] encode(String hostName) {
        byte[] payload = new byte[SIZE];
        payload[OFF_FLAG] = FLAG;
        byte[] name = hostName.getBytes(StandardCharsets.UTF_8);
        System.arraycopy(name, 0, payload, OFF_HOST_NAME, Math.min(name.length, HOST_NAME_WIDTH));
        return payload;
    }
}
