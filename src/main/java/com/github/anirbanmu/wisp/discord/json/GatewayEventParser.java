package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.wisp.util.Json;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

// parses raw gateway json into typed GatewayEvent
public final class GatewayEventParser {

    public GatewayEventParser() {
    }

    // event is null for opcodes and payloads we ignore
    public record ParseResult(int op, GatewayEvent event, Integer sequence) {
    }

    public ParseResult parse(String raw) throws IOException {
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        ByteArrayInputStream bais = new ByteArrayInputStream(bytes);

        // first pass: get op, s, t
        Envelope envelope = Json.DSL.deserialize(Envelope.class, bais);
        if (envelope == null) {
            throw new IOException("empty gateway payload");
        }

        Opcode op = Opcode.of(envelope.op());
        if (op == null) {
            return new ParseResult(envelope.op(), null, envelope.s());
        }

        // second pass: typed deserialization per opcode
        bais.reset();
        GatewayEvent event = switch (op) {
            case HELLO -> {
                HelloMsg msg = Json.DSL.deserialize(HelloMsg.class, bais);
                yield new GatewayEvent.Hello(msg.d().heartbeatInterval());
            }
            case DISPATCH -> parseDispatch(envelope, bais);
            case HEARTBEAT -> new GatewayEvent.HeartbeatRequest();
            case HEARTBEAT_ACK -> new GatewayEvent.HeartbeatAck();
            case RECONNECT -> new GatewayEvent.Reconnect();
            case INVALID_SESSION -> {
                InvalidSessionMsg msg = Json.DSL.deserialize(InvalidSessionMsg.class, bais);
                yield new GatewayEvent.InvalidSession(msg.d());
            }
            case IDENTIFY, PRESENCE_UPDATE, RESUME -> null;
        };

        return new ParseResult(envelope.op(), event, envelope.s());
    }

    private GatewayEvent parseDispatch(Envelope envelope, ByteArrayInputStream bais) throws IOException {
        if (envelope.t() == null || envelope.s() == null) {
            throw new IOException("dispatch without event type or sequence");
        }
        Map<String, Object> message = Json.asObject(Json.DSL.deserialize(Object.class, bais));
        Map<String, Object> data = message == null ? null : Json.asObject(message.get("d"));
        return new GatewayEvent.Dispatch(envelope.t(), envelope.s(), data == null ? Map.of() : data);
    }

    // wire format records - private implementation details

    @CompiledJson
    record Envelope(int op, @JsonAttribute(nullable = true) Integer s, @JsonAttribute(nullable = true) String t) {
    }

    @CompiledJson
    record HelloMsg(int op, HelloData d) {
    }

    @CompiledJson
    record HelloData(@JsonAttribute(name = "heartbeat_interval") int heartbeatInterval) {
    }

    @CompiledJson
    record InvalidSessionMsg(int op, @JsonAttribute(name = "d") boolean d) {
    }
}
