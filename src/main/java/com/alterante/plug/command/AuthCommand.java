package com.alterante.plug.command;

import com.alterante.plug.device.PowerDevice;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "auth",
        description = "Authenticate with a device and print its assigned id",
        mixinStandardHelpOptions = true
)
public class AuthCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private DeviceOptions device;

    @Override
    public Integer call() throws Exception {
        try (PowerDevice ignored = device.openAuthenticated()) {
            return 0;
        } catch (Exception e) {
            if (device.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }
}
