package com.alterante.plug.device;

/**
 * Command set of unrecognized devices: nothing is supported.
 */
final class UnsupportedCommands implements RelayCommandSet {

    @Override
    public DeviceFamily family() {
        return DeviceFamily.BASE;
    }
}
