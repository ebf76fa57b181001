package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// GET gateway/bot response: base wss url, recommended shard count, identify budget
@CompiledJson
public record GatewayBotInfo(String url, int shards, @JsonAttribute(name = "session_start_limit", nullable = true) SessionStartLimit sessionStartLimit) {

    @CompiledJson
    public record SessionStartLimit(int total, int remaining, @JsonAttribute(name = "reset_after") long resetAfter, @JsonAttribute(name = "max_concurrency") int maxConcurrency) {
    }
}
