package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 6 resume payload - replays missed dispatches after seq
@CompiledJson
public record Resume(String token, @JsonAttribute(name = "session_id") String sessionId, @JsonAttribute(nullable = true) Integer seq) {
}
