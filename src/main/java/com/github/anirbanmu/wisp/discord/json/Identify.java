package com.github.anirbanmu.wisp.discord.json;

import com.dslplatform.json.CompiledJson;

// opcode 2 identify payload - sent after receiving hello when there is no session to resume
@CompiledJson
public record Identify(String token, int intents, Properties properties, boolean compress, int[] shard, Presence presence) {

    public static Identify create(String token, int intents, int shardId, int shardCount, Presence presence, boolean mobile) {
        return new Identify(token, intents, mobile ? Properties.MOBILE : Properties.DEFAULT, true,
            new int[]{shardId, shardCount}, presence);
    }

    // connection properties for identify. discord shows the mobile badge for the ios browser name
    @CompiledJson
    public record Properties(String os, String browser, String device) {
        public static final Properties DEFAULT = new Properties(System.getProperty("os.name", "linux").toLowerCase(), "wisp", "wisp");
        public static final Properties MOBILE = new Properties(DEFAULT.os(), "Discord iOS", "wisp");
    }
}
