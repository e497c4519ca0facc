package com.alterante.plug.device;

import com.alterante.plug.net.CommandChannel;
import com.alterante.plug.net.DeviceErrorException;
import com.alterante.plug.net.DeviceException;
import com.alterante.plug.protocol.CommandType;
import com.alterante.plug.protocol.Frame;

/**
 * Multi-relay strips. Outlets are addressed by bitmask.
 *
 * <pre>
 * Set request (16 bytes)                    Query request (16 bytes)
 * 0x00-0x05  0D 00 A5 A5 5A 5A              0x00-0x08  0A 00 A5 A5 5A 5A AE C0 01
 * 0x06       Control byte
 * 0x07-0x0C  C0 02 00 03 00 00              Query reply (decrypted)
 * 0x0D       Outlet mask                    0x0E       Outlet status mask
 * 0x0E       Enabled mask (0 when off)
 * </pre>
 */
final class MultiRelayCommands implements RelayCommandSet {

    static final int PAYLOAD_SIZE = 16;

    private static final byte[] SET_PREFIX = {0x0D, 0x00, (byte) 0xA5, (byte) 0xA5, 0x5A, 0x5A};
    private static final byte[] SET_BODY = {(byte) 0xC0, 0x02, 0x00, 0x03, 0x00, 0x00};
    private static final byte[] QUERY = {
            0x0A, 0x00, (byte) 0xA5, (byte) 0xA5, 0x5A, 0x5A, (byte) 0xAE, (byte) 0xC0, 0x01
    };

    private static final int OFF_CONTROL = 0x06;
    private static final int OFF_BODY = 0x07;
    private static final int OFF_MASK = 0x0D;
    private static final int OFF_ENABLED = 0x0E;
    private static final int OFF_STATUS = 0x0E;

    static final int CONTROL_BIAS = 0xB2;

    @Override
    public DeviceFamily family() {
        return DeviceFamily.MULTI_RELAY;
    }

    @Override
    public boolean setPowerMask(CommandChannel channel, int mask, boolean on) throws DeviceException {
        Frame reply = channel.sendCommand(CommandType.COMMAND.code(), setPayload(mask, on));
        DeviceErrorException.throwIfError(reply);
        return true;
    }

    @Override
    public boolean setPowerByIndex(CommandChannel channel, int index, boolean on) throws DeviceException {
        return setPowerMask(channel, RelayMask.forIndex(index), on);
    }

    @Override
    public int queryPowerRaw(CommandChannel channel) throws DeviceException {
        Frame reply = channel.sendCommand(CommandType.COMMAND.code(), queryPayload());
        DeviceErrorException.throwIfError(reply);
        byte[] decrypted = channel.decryptPayload(reply);
        if (decrypted.length <= OFF_STATUS) {
            throw new DeviceException("relay status reply too short: " + decrypted.length);
        }
        return decrypted[OFF_STATUS] & 0xFF;
    }

    /** Mask shifted left when switching on, then biased; wraps at 8 bits. */
    static int controlByte(int mask, boolean on) {
        return ((on ? mask << 1 : mask) + CONTROL_BIAS) & 0xFF;
    }

    static byte[] setPayload(int mask, boolean on) {
        if (mask < 0 || mask > 0xFF) {
            throw new IllegalArgumentException("mask must fit in one byte: " + mask);
        }
        byte[] payload = new byte[PAYLOAD_SIZE];
        System.arraycopy(SET_PREFIX, 0, payload, 0, SET_PREFIX.length);
        payload[OFF_CONTROL] = (byte) controlByte(mask, on);
        System.arraycopy(SET_BODY, 0, payload, OFF_BODY, SET_BODY.length);
        payload[OFF_MASK] = (byte) mask;
        payload[OFF_ENABLED] = (byte) (on ? mask : 0);
        return payload;
    }

    static byte[] queryPayload() {
        byte[] payload = new byte[PAYLOAD_SIZE];
        System.arraycopy(QUERY, 0, payload, 0, QUERY.length);
        return payload;
    }
}
