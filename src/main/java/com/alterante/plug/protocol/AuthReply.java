package com.alterante.plug.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Decrypted payload of the authentication reply: a 4-byte little-endian device ID
 * followed by the 16-byte session key.
 */
public record AuthReply(int deviceId, byte[] sessionKey) {

    private static final int OFF_DEVICE_ID = 0x00;
    private static final int OFF_KEY = 0x04;
    public static final int MIN_SIZE = OFF_KEY + SessionCipher.KEY_SIZE;

    public AuthReply {
        sessionKey = Arrays.copyOf(sessionKey, sessionKey.length);
    }

    @Override
    public byte[] sessionKey() {
        return Arrays.copyOf(sessionKey, sessionKey.length);
    }

    /**
     * @throws FrameException if the payload is too short to hold an ID and a key
     */
    public static AuthReply decode(byte[] decrypted) throws FrameException {
        if (decrypted.length < MIN_SIZE) {
            throw new FrameException("auth reply too short: " + decrypted.length + " < " + MIN_SIZE);
        }
        int deviceId = ByteBuffer.wrap(decrypted).order(ByteOrder.LITTLE_ENDIAN).getInt(OFF_DEVICE_ID);
        return new AuthReply(deviceId, Arrays.copyOfRange(decrypted, OFF_KEY, OFF_KEY + SessionCipher.KEY_SIZE));
    }

    /** Inverse of {@link #decode}, unpadded. */
    public byte[] encode() {
        byte[] out = new byte[MIN_SIZE];
        ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(deviceId)
                .put(sessionKey);
        return out;
    }
}
