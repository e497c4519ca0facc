package com.alterante.plug.device;

import com.alterante.plug.net.DeviceErrorException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SingleRelayCommandsTest {

    private final SingleRelayCommands commands = new SingleRelayCommands();

    private static byte[] statusReply(int state) {
        byte[] reply = new byte[16];
        reply[0] = 0x01;
        reply[4] = (byte) state;
        return reply;
    }

    @Test
    void setPayloads() throws Exception {
        RecordingChannel channel = new RecordingChannel();
        assertTrue(commands.setPower(channel, true));
        assertTrue(commands.setPower(channel, false));

        assertEquals(16, channel.payloads.get(0).length);
        assertEquals(0x02, channel.payloads.get(0)[0]);
        assertEquals(0x01, channel.payloads.get(0)[4]);
        assertEquals(0x02, channel.payloads.get(1)[0]);
        assertEquals(0x00, channel.payloads.get(1)[4]);
    }

    @Test
    void queryPayload() throws Exception {
        RecordingChannel channel = new RecordingChannel().replyWith(statusReply(0));
        commands.queryPower(channel);

        byte[] expected = new byte[16];
        expected[0] = 0x01;
        assertArrayEquals(expected, channel.lastPayload());
    }

    @Test
    void acceptedOnCodes() throws Exception {
        for (int code : new int[]{0x01, 0x03, 0xFD}) {
            assertTrue(commands.queryPower(new RecordingChannel().replyWith(statusReply(code))),
                    "code 0x" + Integer.toHexString(code));
        }
        for (int code : new int[]{0x00, 0x02, 0xFF}) {
            assertFalse(commands.queryPower(new RecordingChannel().replyWith(statusReply(code))),
                    "code 0x" + Integer.toHexString(code));
        }
    }

    @Test
    void errorCodeSurfacesBeforeDecrypt() {
        RecordingChannel channel = new RecordingChannel().replyWith(statusReply(1)).replyWithError(0xFFFF);
        DeviceErrorException e = assertThrows(DeviceErrorException.class, () -> commands.queryPower(channel));
        assertEquals(0xFFFF, e.code());
        assertEquals(0, channel.decryptCalls);
    }

    @Test
    void setPowerSurfacesErrorCode() {
        RecordingChannel channel = new RecordingChannel().replyWithError(0x0003);
        assertThrows(DeviceErrorException.class, () -> commands.setPower(channel, true));
    }

    @Test
    void multiRelayOperationsNotSupported() {
        RecordingChannel channel = new RecordingChannel();
        assertThrows(NotSupportedException.class, () -> commands.setPowerMask(channel, 1, true));
        assertThrows(NotSupportedException.class, () -> commands.setPowerByIndex(channel, 1, true));
        assertThrows(NotSupportedException.class, () -> commands.queryPowerRaw(channel));
        assertTrue(channel.payloads.isEmpty());
    }
}
