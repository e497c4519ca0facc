package com.alterante.plug.device;

import java.util.HashMap;
import java.util.Map;

/**
 * Behavioural category of a device, selected by its vendor model code.
 */
public enum DeviceFamily {

    BASE,
    SINGLE_RELAY(
            0x2711,                                 // SP2
            0x2719, 0x7919, 0x271A, 0x791A,         // Honeywell SP2
            0x2720,                                 // SPMini
            0x753E,                                 // SP3
            0x7D00,                                 // OEM branded SP3
            0x947A, 0x9479,                         // SP3S
            0x2728,                                 // SPMini2
            0x2733, 0x273E,                         // OEM branded SPMini
            0x7530, 0x7546, 0x7918,                 // OEM branded SPMini2
            0x7D0D,                                 // TMall OEM SPMini3
            0x2736),                                // SPMiniPlus
    MULTI_RELAY(
            0x4EB5, 0x4EF7);                        // MP1

    private final int[] modelCodes;

    DeviceFamily(int... modelCodes) {
        this.modelCodes = modelCodes;
    }

    private static final Map<Integer, DeviceFamily> LOOKUP = new HashMap<>();

    static {
        for (DeviceFamily family : values()) {
            for (int code : family.modelCodes) {
                LOOKUP.put(code, family);
            }
        }
    }

    /** The family of a model code; {@link #BASE} when the code is not recognized. */
    public static DeviceFamily forModelCode(int modelCode) {
        return LOOKUP.getOrDefault(modelCode & 0xFFFF, BASE);
    }

    /** The command set implementing this family. */
    public RelayCommandSet commands() {
        return switch (this) {
            case SINGLE_RELAY -> new SingleRelayCommands();
            case MULTI_RELAY -> new MultiRelayCommands();
            default -> new UnsupportedCommands();
        };
    }
}
