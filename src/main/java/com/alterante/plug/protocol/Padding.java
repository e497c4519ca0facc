package com.alterante.plug.protocol;

import java.util.Arrays;

/**
 * Block padding helpers.
 *
 * Outbound payloads are padded with zero bytes. Decrypted replies may instead be
 * trimmed by the value of their last byte. The two conventions do not agree: a
 * zero-padded buffer does not encode a removable length. Which one the devices
 * really use on the wire has not been confirmed, so both are kept.
 */
public final class Padding {

    private Padding() {}

    /**
     * Append zero bytes up to the next multiple of {@code blockSize}. An input that is
     * already aligned (including an empty one) gains a full block.
     */
    public static byte[] zeroPad(byte[] data, int blockSize) {
        int padLen = blockSize - data.length % blockSize;
        return Arrays.copyOf(data, data.length + padLen);
    }

    /**
     * Remove as many trailing bytes as the value of the last byte. A trailing zero
     * removes nothing.
     *
     * @throws FrameException if the buffer is empty or the length byte exceeds its size
     */
    public static byte[] stripByTrailingLength(byte[] data) throws FrameException {
        if (data.length == 0) {
            throw new FrameException("cannot unpad an empty buffer");
        }
        int padLen = data[data.length - 1] & 0xFF;
        if (padLen > data.length) {
            throw new FrameException("pad length " + padLen + " exceeds buffer of " + data.length);
        }
        return Arrays.copyOf(data, data.length - padLen);
    }
}
