package com.github.anirbanmu.wisp.discord.json;

import com.github.anirbanmu.wisp.util.Json;
import java.io.IOException;

// outbound frame builder: {"op":<op>,"d":<data>}
public final class GatewayPayload {

    private GatewayPayload() {
    }

    public static String identify(Identify identify) throws IOException {
        return encode(Opcode.IDENTIFY, identify);
    }

    public static String resume(Resume resume) throws IOException {
        return encode(Opcode.RESUME, resume);
    }

    public static String presenceUpdate(Presence presence) throws IOException {
        return encode(Opcode.PRESENCE_UPDATE, presence);
    }

    public static String heartbeat(Integer sequence) {
        return "{\"op\":" + Opcode.HEARTBEAT.code() + ",\"d\":" + (sequence == null ? "null" : sequence.toString()) + "}";
    }

    static String encode(Opcode op, Object data) throws IOException {
        return "{\"op\":" + op.code() + ",\"d\":" + Json.write(data) + "}";
    }
}
