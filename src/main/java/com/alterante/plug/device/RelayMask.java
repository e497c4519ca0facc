package com.alterante.plug.device;

/**
 * Outlet bitmask helpers for multi-relay strips. Outlet 1 is bit 0.
 */
public final class RelayMask {

    public static final int MAX_OUTLETS = 8;

    private RelayMask() {}

    /**
     * @throws IllegalArgumentException if the index is outside 1..8
     */
    public static int forIndex(int index) {
        if (index < 1 || index > MAX_OUTLETS) {
            throw new IllegalArgumentException("outlet index must be 1.." + MAX_OUTLETS + ": " + index);
        }
        return 1 << (index - 1);
    }

    public static boolean isOn(int mask, int index) {
        return (mask & forIndex(index)) != 0;
    }
}
