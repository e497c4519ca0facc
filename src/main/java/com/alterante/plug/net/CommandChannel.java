package com.alterante.plug.net;

import com.alterante.plug.protocol.Frame;

/**
 * The request/reply primitive device command sets are written against.
 */
public interface CommandChannel {

    /** Send an encrypted payload and return the next reply frame. */
    Frame sendCommand(int command, byte[] payload) throws DeviceException;

    /** Decrypt a reply payload with the current session key. */
    byte[] decryptPayload(Frame frame) throws DeviceException;
}
