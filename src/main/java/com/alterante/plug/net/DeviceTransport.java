package com.alterante.plug.net;

import com.alterante.plug.protocol.Frame;
import com.alterante.plug.protocol.FrameCodec;
import com.alterante.plug.protocol.FrameException;
import com.alterante.plug.protocol.FrameHeader;
import com.alterante.plug.protocol.SessionCipher;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.SocketException;
import java.time.Duration;

/**
 * Owns the UDP socket for one device: frames and encrypts outgoing payloads and
 * collects replies through the {@link ResponseCorrelator}.
 *
 * Thread model: the listener runs on its own thread; everything else runs on the
 * caller's thread. Only one command may be in flight at a time.
 */
public class DeviceTransport implements CommandChannel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeviceTransport.class);

    private final DeviceIdentity identity;
    private final ClientSettings settings;
    private final DatagramSocket socket;
    private final ResponseCorrelator correlator;
    private final UdpListener listener;

    private volatile boolean closed;

    /**
     * Bind a socket on an ephemeral local port and start the listener.
     *
     * @throws TransportException if the socket cannot be created
     */
    public DeviceTransport(DeviceIdentity identity, ClientSettings settings) throws TransportException {
        this.identity = identity;
        this.settings = settings;
        try {
            this.socket = new DatagramSocket();
        } catch (SocketException e) {
            throw new TransportException("Cannot open UDP socket: " + e.getMessage(), e);
        }
        this.correlator = new ResponseCorrelator(settings.queueCapacity());
        this.listener = new UdpListener(socket, correlator, settings.receiveBufferSize());
        listener.start();
        log.info("Local socket bound to port {} for {}", localPort(), identity.address());
    }

    /**
     * Frame, encrypt and send a payload without waiting for a reply.
     *
     * @param payload plaintext payload, or null for a header-only frame
     */
    public void send(int command, byte[] payload) throws TransportException {
        ensureOpen();
        FrameHeader header = identity.nextHeader(command);
        byte[] frame = FrameCodec.encode(header, payload, identity.key(), identity.iv());

        if (log.isDebugEnabled()) {
            log.debug("Sending {} payload={}", header, payload == null ? "-" : Hex.toHexString(payload));
            log.debug("Frame {}", Hex.toHexString(frame));
        }

        try {
            socket.send(new DatagramPacket(frame, frame.length, identity.address()));
        } catch (IOException e) {
            throw new TransportException("Send to " + identity.address() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Send a payload and return the next frame that arrives within the command timeout.
     */
    @Override
    public Frame sendCommand(int command, byte[] payload) throws DeviceException {
        send(command, payload);
        log.debug("Waiting for reply to command 0x{}", Integer.toHexString(command));
        Frame reply = recv(settings.commandTimeout());
        log.debug("Got {}", reply);
        return reply;
    }

    /** Take the next queued frame whatever its type. */
    public Frame recv(Duration timeout) throws DeviceException {
        ensureOpen();
        try {
            return correlator.recv(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for reply", e);
        }
    }

    /** Take the first queued frame of the given response type. */
    public Frame waitForType(int expectedType, Duration timeout) throws DeviceException {
        ensureOpen();
        try {
            return correlator.waitForType(expectedType, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for reply", e);
        }
    }

    /**
     * Decrypt the payload of a reply with the current session key. No padding is
     * removed.
     */
    @Override
    public byte[] decryptPayload(Frame frame) throws DeviceException {
        try {
            byte[] plain = SessionCipher.decrypt(identity.key(), identity.iv(), frame.encryptedPayload());
            if (log.isDebugEnabled()) {
                log.debug("Decrypted payload {}", Hex.toHexString(plain));
            }
            return plain;
        } catch (FrameException e) {
            throw new DeviceException("Malformed reply payload: " + e.getMessage(), e);
        }
    }

    public DeviceIdentity identity()        { return identity; }
    public ClientSettings settings()        { return settings; }
    public ResponseCorrelator correlator()  { return correlator; }
    public UdpListener listener()           { return listener; }
    public int localPort()                  { return socket.getLocalPort(); }
    public boolean isClosed()               { return closed; }

    /** Release the socket; the listener exits once its blocked receive fails. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        socket.close();
        listener.stop();
        log.info("Closed transport for {}", identity.address());
    }

    private void ensureOpen() throws TransportException {
        if (closed) {
            throw new TransportException("Transport for " + identity.address() + " is closed");
        }
    }
}
