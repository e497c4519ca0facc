package com.alterante.plug;

import com.alterante.plug.command.AuthCommand;
import com.alterante.plug.command.PowerCommand;
import com.alterante.plug.command.StripCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-plug",
        description = "Control networked power plugs and relay strips",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                AuthCommand.class,
                PowerCommand.class,
                StripCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
