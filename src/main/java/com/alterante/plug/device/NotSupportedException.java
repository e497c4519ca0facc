package com.alterante.plug.device;

import com.alterante.plug.net.DeviceException;

/**
 * The device family does not implement the requested operation.
 */
public class NotSupportedException extends DeviceException {

    private final DeviceFamily family;

    public NotSupportedException(DeviceFamily family, String operation) {
        super(operation + " is not supported by " + family + " devices");
        this.family = family;
    }

    public DeviceFamily family() {
        return family;
    }
}
