package com.github.anirbanmu.wisp.config;

import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.Intent;
import com.github.anirbanmu.wisp.discord.json.Activity;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import java.util.List;

// activity, status and shardCount are null when not configured
public record ClientConfig(String token, int apiVersion, int intents, boolean mobile, int maxRetries, Activity activity,
    StatusType status, Integer shardCount, List<Integer> shardIds) {

    public static ClientConfig of(String token) {
        return new ClientConfig(token, DiscordHttpClient.DEFAULT_API_VERSION, Intent.defaults(), false,
            DiscordHttpClient.DEFAULT_MAX_RETRIES, null, null, null, List.of());
    }

    public ClientConfig withPresence(Activity activity, StatusType status) {
        return new ClientConfig(token, apiVersion, intents, mobile, maxRetries, activity, status, shardCount, shardIds);
    }

    @Override
    public String toString() {
        // keep the token out of logs
        return "ClientConfig[apiVersion=" + apiVersion + ", intents=" + intents + ", mobile=" + mobile
            + ", maxRetries=" + maxRetries + ", activity=" + activity + ", status=" + status
            + ", shardCount=" + shardCount + ", shardIds=" + shardIds + "]";
    }
}
