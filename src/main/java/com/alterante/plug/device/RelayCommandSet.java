package com.alterante.plug.device;

import com.alterante.plug.net.CommandChannel;
import com.alterante.plug.net.DeviceException;

/**
 * Family-specific relay commands. Every operation defaults to a capability error;
 * each family overrides the ones its hardware understands.
 */
public interface RelayCommandSet {

    DeviceFamily family();

    /** Switch a single-relay device on or off. */
    default boolean setPower(CommandChannel channel, boolean on) throws DeviceException {
        throw new NotSupportedException(family(), "setPower");
    }

    /** Read the on/off state of a single-relay device. */
    default boolean queryPower(CommandChannel channel) throws DeviceException {
        throw new NotSupportedException(family(), "queryPower");
    }

    /** Switch every outlet in {@code mask} on or off. */
    default boolean setPowerMask(CommandChannel channel, int mask, boolean on) throws DeviceException {
        throw new NotSupportedException(family(), "setPowerMask");
    }

    /** Switch the outlet with the given 1-based index on or off. */
    default boolean setPowerByIndex(CommandChannel channel, int index, boolean on) throws DeviceException {
        throw new NotSupportedException(family(), "setPowerByIndex");
    }

    /** Read the raw outlet status byte of a multi-relay device. */
    default int queryPowerRaw(CommandChannel channel) throws DeviceException {
        throw new NotSupportedException(family(), "queryPowerRaw");
    }
}
