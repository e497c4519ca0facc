package com.alterante.plug.net;

import com.alterante.plug.protocol.FrameCodec;
import org.bouncycastle.util.encoders.Hex;

import java.util.regex.Pattern;

/**
 * Parsing and formatting of 6-byte link-layer addresses.
 */
public final class MacAddress {

    private static final Pattern FORMAT =
            Pattern.compile("[0-9A-Fa-f]{2}([:-]?)[0-9A-Fa-f]{2}(\\1[0-9A-Fa-f]{2}){4}");

    private MacAddress() {}

    /**
     * Parse "aa:bb:cc:dd:ee:ff", "aa-bb-cc-dd-ee-ff" or "aabbccddeeff".
     *
     * @throws IllegalArgumentException if the text is not a 6-byte MAC address
     */
    public static byte[] parse(String text) {
        if (text == null || !FORMAT.matcher(text).matches()) {
            throw new IllegalArgumentException("not a MAC address: " + text);
        }
        return Hex.decode(text.replace(":", "").replace("-", ""));
    }

    public static String format(byte[] mac) {
        if (mac.length != FrameCodec.MAC_LENGTH) {
            throw new IllegalArgumentException("mac must be " + FrameCodec.MAC_LENGTH + " bytes");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) sb.append(':');
            sb.append(String.format("%02x", mac[i] & 0xFF));
        }
        return sb.toString();
    }
}
