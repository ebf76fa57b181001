package com.github.anirbanmu.wisp.discord.json;

import java.util.Locale;

public enum ActivityType {
    GAME(0),
    STREAMING(1),
    LISTENING(2),
    WATCHING(3),
    CUSTOM(4), // not available to bots
    COMPETING(5);

    private final int code;

    ActivityType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ActivityType fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown activity type: " + value);
        }
    }
}
