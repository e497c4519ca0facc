package com.alterante.plug.net;

import com.alterante.plug.protocol.Frame;

/**
 * The device answered with a nonzero error code in the reply header.
 */
public class DeviceErrorException extends DeviceException {

    private final int code;

    public DeviceErrorException(int code) {
        super(String.format("device returned error 0x%04X", code));
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Throw if the reply header carries a nonzero error code at 0x22. */
    public static void throwIfError(Frame reply) throws DeviceErrorException {
        if (reply.errorCode() != 0) {
            throw new DeviceErrorException(reply.errorCode());
        }
    }
}
