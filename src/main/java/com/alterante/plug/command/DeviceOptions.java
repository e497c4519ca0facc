package com.alterante.plug.command;

import com.alterante.plug.device.PowerDevice;
import com.alterante.plug.net.ClientSettings;
import com.alterante.plug.net.DeviceException;
import picocli.CommandLine;

import java.time.Duration;

/**
 * Connection options shared by every device command.
 */
public class DeviceOptions {

    @CommandLine.Option(names = {"--host", "-H"}, description = "Device IP address or host name", required = true)
    private String host;

    @CommandLine.Option(names = {"--mac", "-m"}, description = "Device MAC address (aa:bb:cc:dd:ee:ff)", required = true)
    private String mac;

    @CommandLine.Option(names = {"--model"}, description = "Vendor model code, e.g. 0x2711", required = true)
    private String model;

    @CommandLine.Option(names = {"--port", "-p"}, description = "Device UDP port (default: 80)", defaultValue = "80")
    private int port;

    @CommandLine.Option(names = {"--timeout"}, description = "Command reply timeout in ms (default: 1000)", defaultValue = "1000")
    private long timeoutMs;

    @CommandLine.Option(names = {"--auth-timeout"}, description = "Authentication timeout in ms (default: 10000)", defaultValue = "10000")
    private long authTimeoutMs;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    boolean json;

    ClientSettings settings() {
        return ClientSettings.defaults()
                .withPort(port)
                .withCommandTimeout(Duration.ofMillis(timeoutMs))
                .withAuthTimeout(Duration.ofMillis(authTimeoutMs));
    }

    int modelCode() {
        try {
            return Integer.decode(model);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Model code must be a number like 0x2711, got: " + model);
        }
    }

    /** Open a client and run the handshake. */
    PowerDevice openAuthenticated() throws DeviceException {
        PowerDevice device = PowerDevice.open(host, mac, modelCode(), settings());
        try {
            int deviceId = device.authenticate();
            if (json) {
                JsonOutput.authenticated(deviceId, device.family());
            } else {
                System.out.printf("Authenticated %s device, id=0x%08X%n", device.family(), deviceId);
            }
            return device;
        } catch (DeviceException | RuntimeException e) {
            device.close();
            throw e;
        }
    }
}
