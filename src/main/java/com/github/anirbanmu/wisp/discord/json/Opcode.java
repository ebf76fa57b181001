package com.github.anirbanmu.wisp.discord.json;

// gateway opcodes. the ones marked send-only never arrive from discord
public enum Opcode {
    DISPATCH(0),
    HEARTBEAT(1),
    IDENTIFY(2), // send-only
    PRESENCE_UPDATE(3), // send-only
    RESUME(6), // send-only
    RECONNECT(7),
    INVALID_SESSION(9),
    HELLO(10),
    HEARTBEAT_ACK(11);

    private static final Opcode[] BY_CODE = new Opcode[12];

    static {
        for (Opcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;

    Opcode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    // null for codes this client does not know
    public static Opcode of(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }
}
