package com.github.anirbanmu.wisp.discord.json;

import java.util.Map;

// sealed type for every inbound opcode we act on
public sealed interface GatewayEvent {

    record Hello(int heartbeatInterval) implements GatewayEvent {
    }

    // op 0. data is the raw "d" object, handed to handlers untouched
    record Dispatch(String type, int sequence, Map<String, Object> data) implements GatewayEvent {
        public static final String READY = "READY";
        public static final String RESUMED = "RESUMED";

        public String stringField(String name) {
            Object value = data.get(name);
            return value instanceof String ? (String) value : null;
        }
    }

    record HeartbeatRequest() implements GatewayEvent {
    }

    record HeartbeatAck() implements GatewayEvent {
    }

    record Reconnect() implements GatewayEvent {
    }

    record InvalidSession(boolean resumable) implements GatewayEvent {
    }
}
