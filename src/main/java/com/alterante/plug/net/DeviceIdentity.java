package com.alterante.plug.net;

import com.alterante.plug.protocol.FrameCodec;
import com.alterante.plug.protocol.FrameHeader;
import com.alterante.plug.protocol.SessionCipher;

import java.net.InetSocketAddress;
import java.util.Arrays;

/**
 * Addressing and session state of one device.
 *
 * The device ID and key are replaced in place by the authentication handshake.
 * Not thread-safe: one command in flight at a time per instance.
 */
public class DeviceIdentity {

    private final InetSocketAddress address;
    private final byte[] mac;
    private final int modelCode;
    private final byte[] iv;

    private int deviceId;
    private byte[] key;
    private int sequence;
    private boolean authenticated;

    public DeviceIdentity(InetSocketAddress address, byte[] mac, int modelCode) {
        if (mac == null || mac.length != FrameCodec.MAC_LENGTH) {
            throw new IllegalArgumentException("mac must be " + FrameCodec.MAC_LENGTH + " bytes");
        }
        this.address = address;
        this.mac = Arrays.copyOf(mac, mac.length);
        this.modelCode = modelCode & 0xFFFF;
        this.iv = SessionCipher.defaultIv();
        this.key = SessionCipher.defaultKey();
        this.deviceId = 0;
        this.sequence = 0;
    }

    public InetSocketAddress address() { return address; }
    public byte[] mac()                { return Arrays.copyOf(mac, mac.length); }
    public int modelCode()             { return modelCode; }
    public int deviceId()              { return deviceId; }
    public byte[] key()                { return Arrays.copyOf(key, key.length); }
    public byte[] iv()                 { return Arrays.copyOf(iv, iv.length); }
    public int sequence()              { return sequence; }

    public boolean isAuthenticated() {
        return authenticated;
    }

    /** Install the ID and key handed out by the handshake. */
    public void updateSession(int deviceId, byte[] key) {
        if (key == null || key.length != SessionCipher.KEY_SIZE) {
            throw new IllegalArgumentException("key must be " + SessionCipher.KEY_SIZE + " bytes");
        }
        this.deviceId = deviceId;
        this.key = Arrays.copyOf(key, key.length);
        this.authenticated = true;
    }

    /** Advance the 16-bit send counter and build the header for the next frame. */
    public FrameHeader nextHeader(int command) {
        sequence = (sequence + 1) & 0xFFFF;
        return new FrameHeader(modelCode, command, sequence, mac, deviceId);
    }

    @Override
    public String toString() {
        return String.format("DeviceIdentity[%s, mac=%s, model=0x%04X, deviceId=0x%08X]",
                address, MacAddress.format(mac), modelCode, deviceId);
    }
}
