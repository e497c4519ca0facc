package com.alterante.plug.net;

import com.alterante.plug.protocol.AuthReply;
import com.alterante.plug.protocol.AuthRequest;
import com.alterante.plug.protocol.CommandType;
import com.alterante.plug.protocol.Frame;
import com.alterante.plug.protocol.FrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * One-shot authentication handshake.
 *
 * Sends the auth payload under the current (default) key, waits for the auth reply
 * and installs the device ID and session key it carries. On any failure the
 * identity is left untouched.
 */
public class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final DeviceTransport transport;
    private final String hostName;

    public Authenticator(DeviceTransport transport, String hostName) {
        this.transport = transport;
        this.hostName = hostName;
    }

    /**
     * Run the handshake. Blocks up to the configured auth timeout.
     *
     * @return the device ID assigned by the device
     */
    public int authenticate() throws DeviceException {
        DeviceIdentity identity = transport.identity();

        transport.send(CommandType.AUTHENTICATE.code(), AuthRequest.encode(hostName));
        log.info("Sent AUTHENTICATE to {} as '{}'", identity.address(), hostName);

        Frame reply = transport.waitForType(CommandType.AUTH_REPLY.code(), transport.settings().authTimeout());
        DeviceErrorException.throwIfError(reply);

        AuthReply auth;
        try {
            auth = AuthReply.decode(transport.decryptPayload(reply));
        } catch (FrameException e) {
            throw new DeviceException("Malformed auth reply: " + e.getMessage(), e);
        }

        identity.updateSession(auth.deviceId(), auth.sessionKey());
        log.info("Authenticated {}. Device id=0x{}", identity.address(), Integer.toHexString(auth.deviceId()));
        return auth.deviceId();
    }

    /** Host name embedded in the auth payload; "localhost" if it cannot be resolved. */
    public static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve local host name: {}", e.getMessage());
            return "localhost";
        }
    }
}
