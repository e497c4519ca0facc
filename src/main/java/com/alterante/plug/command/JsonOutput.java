package com.alterante.plug.command;

import com.alterante.plug.device.DeviceFamily;
import com.alterante.plug.device.RelayMask;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by the device commands when --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void authenticated(int deviceId, DeviceFamily family) {
        emit("{\"event\":\"authenticated\",\"device_id\":%d,\"family\":\"%s\"}",
                Integer.toUnsignedLong(deviceId), family.name().toLowerCase());
    }

    static void power(boolean on) {
        emit("{\"event\":\"power\",\"on\":%s}", on);
    }

    static void outlets(int mask) {
        StringBuilder states = new StringBuilder();
        for (int i = 1; i <= RelayMask.MAX_OUTLETS; i++) {
            if (i > 1) states.append(',');
            states.append(RelayMask.isOn(mask, i));
        }
        emit("{\"event\":\"outlets\",\"mask\":%d,\"on\":[%s]}", mask, states);
    }

    static void error(String message) {
        emit("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private static void emit(String format, Object... args) {
        System.out.println(String.format(format, args));
        System.out.flush();
    }

    private static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
