package com.alterante.plug.command;

import com.alterante.plug.device.PowerDevice;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "power",
        description = "Switch or query a single-relay plug",
        mixinStandardHelpOptions = true
)
public class PowerCommand implements Callable<Integer> {

    enum Action { on, off, status }

    @CommandLine.Mixin
    private DeviceOptions device;

    @CommandLine.Parameters(index = "0", description = "One of: ${COMPLETION-CANDIDATES}")
    private Action action;

    @Override
    public Integer call() throws Exception {
        try (PowerDevice plug = device.openAuthenticated()) {
            boolean on;
            if (action == Action.status) {
                on = plug.queryPower();
            } else {
                on = action == Action.on;
                plug.setPower(on);
            }
            if (device.json) {
                JsonOutput.power(on);
            } else {
                System.out.println("Power: " + (on ? "ON" : "OFF"));
            }
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
