package com.alterante.plug.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class AuthMessagesTest {

    @Test
    void requestLayout() {
        byte[] payload = AuthRequest.encode("kitchen-pi");
        assertEquals(0x50, payload.length);
        assertEquals(0x01, payload[0x2D]);
        assertEquals("kitchen-pi", new String(payload, 0x30, 10, StandardCharsets.US_ASCII));
        for (int i = 0x30 + 10; i < payload.length; i++) {
            assertEquals(0, payload[i]);
        }
        for (int i = 0; i < 0x2D; i++) {
            assertEquals(0, payload[i]);
        }
    }

    @Test
    void longHostNameIsTruncatedToField() {
        String longName = "a".repeat(60);
        byte[] payload = AuthRequest.encode(longName);
        assertEquals(0x50, payload.length);
        assertEquals('a', payload[0x4F]);
        assertEquals(32, AuthRequest.HOST_NAME_WIDTH);
    }

    @Test
    void replyDecodesIdAndKey() throws FrameException {
        byte[] decrypted = new byte[32];
        decrypted[0] = 0x78;
        decrypted[1] = 0x56;
        decrypted[2] = 0x34;
        decrypted[3] = 0x12;
        for (int i = 0; i < 16; i++) {
            decrypted[4 + i] = (byte) (0xA0 + i);
        }

        AuthReply reply = AuthReply.decode(decrypted);
        assertEquals(0x12345678, reply.deviceId());
        assertArrayEquals(Arrays.copyOfRange(decrypted, 4, 20), reply.sessionKey());
        assertArrayEquals(Arrays.copyOf(decrypted, 20), reply.encode());
    }

    @Test
    void shortReplyRejected() {
        assertThrows(FrameException.class, () -> AuthReply.decode(new byte[19]));
    }
}
