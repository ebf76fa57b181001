package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// bots may only set name, type and (for streaming) url
@CompiledJson
public record Activity(String name, int type, @JsonAttribute(nullable = true) String url) {

    public static Activity of(ActivityType type, String name) {
        return new Activity(name, type.code(), null);
    }

    public static Activity streaming(String name, String url) {
        return new Activity(name, ActivityType.STREAMING.code(), url);
    }
}
