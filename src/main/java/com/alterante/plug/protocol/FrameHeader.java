package com.alterante.plug.protocol;

import java.util.Arrays;

/**
 * Header fields written by the sender of a frame. The two checksum fields are
 * derived by {@link FrameCodec} and are not part of this value.
 */
public final class FrameHeader {

    private final int modelCode;
    private final int command;
    private final int sequence;
    private final byte[] mac;
    private final int deviceId;

    public FrameHeader(int modelCode, int command, int sequence, byte[] mac, int deviceId) {
        if (mac == null || mac.length != FrameCodec.MAC_LENGTH) {
            throw new IllegalArgumentException("mac must be " + FrameCodec.MAC_LENGTH + " bytes");
        }
        this.modelCode = modelCode & 0xFFFF;
        this.command = command & 0xFFFF;
        this.sequence = sequence & 0xFFFF;
        this.mac = Arrays.copyOf(mac, mac.length);
        this.deviceId = deviceId;
    }

    public int modelCode()  { return modelCode; }
    public int command()    { return command; }
    public int sequence()   { return sequence; }
    public byte[] mac()     { return Arrays.copyOf(mac, mac.length); }
    public int deviceId()   { return deviceId; }

    @Override
    public String toString() {
        return String.format("FrameHeader[model=0x%04X, command=0x%04X, seq=%d, deviceId=0x%08X]",
                modelCode, command, sequence, deviceId);
    }
}
