package com.alterante.plug.device;

import com.alterante.plug.net.CommandChannel;
import com.alterante.plug.net.DeviceErrorException;
import com.alterante.plug.net.DeviceException;
import com.alterante.plug.protocol.CommandType;
import com.alterante.plug.protocol.Frame;

import java.util.Set;

/**
 * Single-relay plugs.
 *
 * <pre>
 * Request (16 bytes)        Reply (decrypted)
 * 0x00  Sub-command         0x04  State: 0x01, 0x03 or 0xFD mean on
 * 0x04  State (set only)
 * </pre>
 */
final class SingleRelayCommands implements RelayCommandSet {

    static final int PAYLOAD_SIZE = 16;

    private static final int OFF_SUBCOMMAND = 0x00;
    private static final int OFF_STATE = 0x04;

    static final byte SUB_QUERY = 0x01;
    static final byte SUB_SET = 0x02;

    private static final Set<Integer> ON_CODES = Set.of(0x01, 0x03, 0xFD);

    @Override
    public DeviceFamily family() {
        return DeviceFamily.SINGLE_RELAY;
    }

    @Override
    public boolean setPower(CommandChannel channel, boolean on) throws DeviceException {
        Frame reply = channel.sendCommand(CommandType.COMMAND.code(), setPayload(on));
        DeviceErrorException.throwIfError(reply);
        return true;
    }

    @Override
    public boolean queryPower(CommandChannel channel) throws DeviceException {
        Frame reply = channel.sendCommand(CommandType.COMMAND.code(), queryPayload());
        DeviceErrorException.throwIfError(reply);
        return isOn(channel.decryptPayload(reply));
    }

    static byte[] setPayload(boolean on) {
        byte[] payload = new byte[PAYLOAD_SIZE];
        payload[OFF_SUBCOMMAND] = SUB_SET;
        payload[OFF_STATE] = (byte) (on ? 1 : 0);
        return payload;
    }

    static byte[] queryPayload() {
        byte[] payload = new byte[PAYLOAD_SIZE];
        payload[OFF_SUBCOMMAND] = SUB_QUERY;
        return payload;
    }

    static boolean isOn(byte[] decrypted) throws DeviceException {
        if (decrypted.length <= OFF_STATE) {
            throw new DeviceException("power status reply too short: " + decrypted.length);
        }
        return ON_CODES.contains(decrypted[OFF_STATE] & 0xFF);
    }
}
