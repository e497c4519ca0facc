package com.alterante.plug.device;

import com.alterante.plug.net.Authenticator;
import com.alterante.plug.net.ClientSettings;
import com.alterante.plug.net.DeviceException;
import com.alterante.plug.net.DeviceIdentity;
import com.alterante.plug.net.DeviceTransport;
import com.alterante.plug.net.MacAddress;
import com.alterante.plug.net.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Client for one power plug or relay strip.
 *
 * Operations dispatch to the {@link RelayCommandSet} of the device's family, so an
 * operation the family lacks fails with {@link NotSupportedException}. Callers
 * must not issue commands on the same instance from several threads at once.
 */
public class PowerDevice implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PowerDevice.class);

    private final DeviceFamily family;
    private final RelayCommandSet commands;
    private final DeviceTransport transport;
    private final Authenticator authenticator;

    PowerDevice(DeviceFamily family, DeviceTransport transport, String hostName) {
        this.family = family;
        this.commands = family.commands();
        this.transport = transport;
        this.authenticator = new Authenticator(transport, hostName);
    }

    /**
     * Open a client for the device at {@code host} on the default port.
     *
     * @param mac       "aa:bb:cc:dd:ee:ff"
     * @param modelCode vendor model code, selects the family
     */
    public static PowerDevice open(String host, String mac, int modelCode) throws DeviceException {
        return open(host, mac, modelCode, ClientSettings.defaults());
    }

    public static PowerDevice open(String host, String mac, int modelCode, ClientSettings settings)
            throws DeviceException {
        InetSocketAddress address = new InetSocketAddress(host, settings.port());
        if (address.isUnresolved()) {
            throw new TransportException("Cannot resolve device address: " + host);
        }
        return open(address, MacAddress.parse(mac), modelCode, settings, Authenticator.localHostName());
    }

    public static PowerDevice open(InetSocketAddress address, byte[] mac, int modelCode,
                                   ClientSettings settings, String hostName) throws DeviceException {
        DeviceFamily family = DeviceFamily.forModelCode(modelCode);
        DeviceIdentity identity = new DeviceIdentity(address, mac, modelCode);
        log.info("Opening {} client for {}", family, identity);
        return new PowerDevice(family, new DeviceTransport(identity, settings), hostName);
    }

    /** Run the handshake and switch to the device's session key. */
    public int authenticate() throws DeviceException {
        return authenticator.authenticate();
    }

    public boolean setPower(boolean on) throws DeviceException {
        return commands.setPower(transport, on);
    }

    public boolean queryPower() throws DeviceException {
        return commands.queryPower(transport);
    }

    public boolean setPowerMask(int mask, boolean on) throws DeviceException {
        return commands.setPowerMask(transport, mask, on);
    }

    public boolean setPowerByIndex(int index, boolean on) throws DeviceException {
        return commands.setPowerByIndex(transport, index, on);
    }

    public int queryPowerRaw() throws DeviceException {
        return commands.queryPowerRaw(transport);
    }

    public DeviceFamily family()        { return family; }
    public DeviceIdentity identity()    { return transport.identity(); }
    public DeviceTransport transport()  { return transport; }

    @Override
    public void close() {
        transport.close();
    }
}
