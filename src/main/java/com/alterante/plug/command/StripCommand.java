package com.alterante.plug.command;

import com.alterante.plug.device.PowerDevice;
import com.alterante.plug.device.RelayMask;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "strip",
        description = "Switch or query the outlets of a multi-relay strip",
        mixinStandardHelpOptions = true
)
public class StripCommand implements Callable<Integer> {

    enum Action { on, off, status }

    private static final int STRIP_OUTLETS = 4;

    @CommandLine.Mixin
    private DeviceOptions device;

    @CommandLine.Parameters(index = "0", description = "One of: ${COMPLETION-CANDIDATES}")
    private Action action;

    @CommandLine.Option(names = {"--outlet", "-o"}, description = "Outlet number, 1-based")
    private Integer outlet;

    @CommandLine.Option(names = {"--mask"}, description = "Outlet bitmask, e.g. 0x05")
    private String mask;

    @Override
    public Integer call() throws Exception {
        if (action != Action.status && (outlet == null) == (mask == null)) {
            String msg = "exactly one of --outlet or --mask is required";
            if (device.json) { JsonOutput.error(msg); return 1; }
            System.err.println("Error: " + msg);
            return 1;
        }

        try (PowerDevice strip = device.openAuthenticated()) {
            if (action != Action.status) {
                boolean on = action == Action.on;
                if (outlet != null) {
                    strip.setPowerByIndex(outlet, on);
                } else {
                    strip.setPowerMask(Integer.decode(mask), on);
                }
            }
            printOutlets(strip.queryPowerRaw());
            return 0;
        } catch (Exception e) {
            if (device.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private void printOutlets(int status) {
        if (device.json) {
            JsonOutput.outlets(status);
            return;
        }
        for (int i = 1; i <= STRIP_OUTLETS; i++) {
            System.out.printf("  Outlet %d: %s%n", i, RelayMask.isOn(status, i) ? "ON" : "OFF");
        }
    }
}
