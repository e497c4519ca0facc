package com.alterante.plug.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Builds and checks frames.
 *
 * Wire format (0x38-byte header + payload, multi-byte fields little-endian):
 * <pre>
 * Offset     Field
 * 0x00-0x07  Magic preamble 5A A5 AA 55 5A A5 AA 55
 * 0x20-0x21  Frame checksum (computed with this field zeroed)
 * 0x22-0x23  Error code (replies only)
 * 0x24-0x25  Model code
 * 0x26-0x27  Command / response type
 * 0x28-0x29  Sequence number
 * 0x2A-0x2F  MAC address
 * 0x30-0x33  Device ID
 * 0x34-0x35  Checksum of the padded plaintext payload
 * 0x38+      AES-CBC encrypted payload (only when a payload exists)
 * </pre>
 */
public final class FrameCodec {

    public static final int HEADER_SIZE = 0x38;
    public static final int MAC_LENGTH = 6;

    static final int OFF_CHECKSUM = 0x20;
    static final int OFF_ERROR = 0x22;
    static final int OFF_MODEL = 0x24;
    static final int OFF_COMMAND = 0x26;
    static final int OFF_SEQUENCE = 0x28;
    static final int OFF_MAC = 0x2A;
    static final int OFF_DEVICE_ID = 0x30;
    static final int OFF_PAYLOAD_CHECKSUM = 0x34;

    private static final byte[] MAGIC = {
            0x5A, (byte) 0xA5, (byte) 0xAA, 0x55, 0x5A, (byte) 0xA5, (byte) 0xAA, 0x55
    };

    private FrameCodec() {}

    /**
     * Encode a frame ready for sending as a UDP datagram.
     *
     * A non-empty payload is zero-padded and its checksum is written at 0x34. The
     * padded bytes then go through {@link SessionCipher#encrypt}, which pads once
     * more, so the ciphertext is one block longer than the checksummed plaintext.
     * Devices expect this layout. The frame checksum is computed last, over the
     * whole frame.
     *
     * @param payload plaintext payload, or null / empty for a header-only frame
     */
    public static byte[] encode(FrameHeader header, byte[] payload, byte[] key, byte[] iv) {
        byte[] encrypted = new byte[0];
        int payloadChecksum = 0;
        if (payload != null && payload.length > 0) {
            byte[] padded = Padding.zeroPad(payload, SessionCipher.BLOCK_SIZE);
            payloadChecksum = Checksum.compute(padded);
            encrypted = SessionCipher.encrypt(key, iv, padded);
        }

        byte[] out = new byte[HEADER_SIZE + encrypted.length];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);

        buf.put(0, MAGIC);
        buf.putShort(OFF_MODEL, (short) header.modelCode());
        buf.putShort(OFF_COMMAND, (short) header.command());
        buf.putShort(OFF_SEQUENCE, (short) header.sequence());
        buf.put(OFF_MAC, header.mac());
        buf.putInt(OFF_DEVICE_ID, header.deviceId());
        buf.putShort(OFF_PAYLOAD_CHECKSUM, (short) payloadChecksum);
        buf.put(HEADER_SIZE, encrypted);

        buf.putShort(OFF_CHECKSUM, (short) Checksum.compute(out));
        return out;
    }

    /**
     * Check the frame checksum of {@code length} bytes of {@code data}.
     *
     * The checksum field is zeroed for the computation and restored before
     * returning, so the buffer is left byte-for-byte unchanged.
     */
    public static boolean validate(byte[] data, int length) {
        if (length < OFF_CHECKSUM + 2 || length > data.length) {
            return false;
        }
        byte lo = data[OFF_CHECKSUM];
        byte hi = data[OFF_CHECKSUM + 1];
        int stored = (lo & 0xFF) | ((hi & 0xFF) << 8);
        try {
            data[OFF_CHECKSUM] = 0;
            data[OFF_CHECKSUM + 1] = 0;
            return Checksum.compute(data, 0, length) == stored;
        } finally {
            data[OFF_CHECKSUM] = lo;
            data[OFF_CHECKSUM + 1] = hi;
        }
    }

    public static boolean validate(byte[] data) {
        return validate(data, data.length);
    }

    /**
     * Decode {@code length} bytes of a received datagram into a Frame.
     *
     * @throws FrameException if the datagram is shorter than the header or its checksum is wrong
     */
    public static Frame decode(byte[] data, int length) throws FrameException {
        if (length < HEADER_SIZE) {
            throw new FrameException("datagram too short: " + length + " < " + HEADER_SIZE);
        }
        if (!validate(data, length)) {
            throw new FrameException("frame checksum mismatch");
        }
        return new Frame(Arrays.copyOf(data, length));
    }
}
