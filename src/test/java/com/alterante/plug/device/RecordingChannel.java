package com.alterante.plug.device;

import com.alterante.plug.net.CommandChannel;
import com.alterante.plug.net.DeviceException;
import com.alterante.plug.net.FakeDevice;
import com.alterante.plug.protocol.CommandType;
import com.alterante.plug.protocol.Frame;
import com.alterante.plug.protocol.FrameException;
import com.alterante.plug.protocol.SessionCipher;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory CommandChannel: records every payload and answers with a canned reply.
 */
class RecordingChannel implements CommandChannel {

    final List<Integer> commands = new ArrayList<>();
    final List<byte[]> payloads = new ArrayList<>();
    int decryptCalls;

    private byte[] replyPayload = new byte[16];
    private int replyError;

    RecordingChannel replyWith(byte[] payload) {
        this.replyPayload = payload;
        return this;
    }

    RecordingChannel replyWithError(int code) {
        this.replyError = code;
        return this;
    }

    byte[] lastPayload() {
        return payloads.get(payloads.size() - 1);
    }

    @Override
    public Frame sendCommand(int command, byte[] payload) {
        commands.add(command);
        payloads.add(payload.clone());
        return new Frame(FakeDevice.buildFrame(CommandType.COMMAND_REPLY.code(), replyError, replyPayload,
                SessionCipher.defaultKey(), 0x4EB5, 1, payloads.size()));
    }

    @Override
    public byte[] decryptPayload(Frame frame) throws DeviceException {
        decryptCalls++;
        try {
            return SessionCipher.decrypt(SessionCipher.defaultKey(), SessionCipher.defaultIv(), frame.encryptedPayload());
        } catch (FrameException e) {
            throw new DeviceException(e.getMessage(), e);
        }
    }
}
