package com.github.anirbanmu.wisp.discord.json;

import java.util.Locale;

public enum StatusType {
    ONLINE("online"),
    OFFLINE("offline"),
    IDLE("idle"),
    DND("dnd"),
    INVISIBLE("invisible");

    private final String value;

    StatusType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static StatusType fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StatusType status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
