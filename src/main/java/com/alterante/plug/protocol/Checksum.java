package com.alterante.plug.protocol;

/**
 * 16-bit additive checksum used for both the frame header and the payload.
 *
 * The sum starts at 0xBEAF and adds every byte as an unsigned value,
 * wrapping at 16 bits.
 */
public final class Checksum {

    public static final int SEED = 0xBEAF;

    private Checksum() {}

    public static int compute(byte[] data) {
        return compute(data, 0, data.length);
    }

    public static int compute(byte[] data, int offset, int length) {
        int sum = SEED;
        for (int i = offset; i < offset + length; i++) {
            sum = (sum + (data[i] & 0xFF)) & 0xFFFF;
        }
        return sum;
    }
}
