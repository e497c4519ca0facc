package com.alterante.plug.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Immutable view of one datagram: the 0x38-byte header plus the optional
 * encrypted payload. Accessors read the little-endian header fields in place.
 */
public final class Frame {

    private final byte[] data;

    public Frame(byte[] data) {
        if (data == null || data.length < FrameCodec.HEADER_SIZE) {
            throw new IllegalArgumentException("frame shorter than header: "
                    + (data == null ? 0 : data.length));
        }
        this.data = Arrays.copyOf(data, data.length);
    }

    public int checksum()          { return u16(FrameCodec.OFF_CHECKSUM); }
    public int errorCode()         { return u16(FrameCodec.OFF_ERROR); }
    public int modelCode()         { return u16(FrameCodec.OFF_MODEL); }
    public int commandType()       { return u16(FrameCodec.OFF_COMMAND); }
    public int sequence()          { return u16(FrameCodec.OFF_SEQUENCE); }
    public int deviceId()          { return le().getInt(FrameCodec.OFF_DEVICE_ID); }
    public int payloadChecksum()   { return u16(FrameCodec.OFF_PAYLOAD_CHECKSUM); }

    public byte[] mac() {
        return Arrays.copyOfRange(data, FrameCodec.OFF_MAC, FrameCodec.OFF_MAC + FrameCodec.MAC_LENGTH);
    }

    public boolean hasPayload() {
        return data.length > FrameCodec.HEADER_SIZE;
    }

    /** The bytes following the header, still encrypted. */
    public byte[] encryptedPayload() {
        return Arrays.copyOfRange(data, FrameCodec.HEADER_SIZE, data.length);
    }

    public byte[] bytes()  { return Arrays.copyOf(data, data.length); }
    public int length()    { return data.length; }

    private int u16(int offset) {
        return Short.toUnsignedInt(le().getShort(offset));
    }

    private ByteBuffer le() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public String toString() {
        CommandType type = CommandType.fromCode(commandType());
        String command = type != null ? type.name() : String.format("0x%04X", commandType());
        return String.format("Frame[command=%s, seq=%d, error=0x%04X, deviceId=0x%08X, payload=%d bytes]",
                command, sequence(), errorCode(), deviceId(), data.length - FrameCodec.HEADER_SIZE);
    }
}
