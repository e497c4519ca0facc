package com.alterante.plug.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Command and response-type tags carried at offset 0x26 of the frame header.
 */
public enum CommandType {

    // Requests
    AUTHENTICATE   (0x0065),
    COMMAND        (0x006A),

    // Replies
    AUTH_REPLY     (0x03E9),
    COMMAND_REPLY  (0x03EE);

    private final int code;

    CommandType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    private static final Map<Integer, CommandType> LOOKUP = new HashMap<>();

    static {
        for (CommandType t : values()) {
            LOOKUP.put(t.code, t);
        }
    }

    /**
     * Look up a CommandType by its wire code.
     * @return the CommandType, or null if unknown
     */
    public static CommandType fromCode(int code) {
        return LOOKUP.get(code);
    }
}
