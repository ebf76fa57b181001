package com.github.anirbanmu.wisp.config;

import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.Intent;
import com.github.anirbanmu.wisp.discord.json.Activity;
import com.github.anirbanmu.wisp.discord.json.ActivityType;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    static final String TOKEN_ENV = "DISCORD_TOKEN";

    public static ClientConfig load(Path path) throws IOException {
        return parse(Toml.parse(path), System.getenv());
    }

    public static ClientConfig load(InputStream stream) throws IOException {
        return parse(Toml.parse(stream), System.getenv());
    }

    public static ClientConfig load(String content) {
        return load(content, System.getenv());
    }

    static ClientConfig load(String content, Map<String, String> env) {
        return parse(Toml.parse(content), env);
    }

    private static ClientConfig parse(TomlParseResult result, Map<String, String> env) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        String token = result.getString("token");
        if (token == null || token.isBlank()) {
            token = env.get(TOKEN_ENV);
        }
        if (token == null || token.isBlank()) {
            throw new ConfigException("Missing bot token: set 'token' or the " + TOKEN_ENV + " environment variable.");
        }

        int apiVersion = positiveInt(result, "api_version", DiscordHttpClient.DEFAULT_API_VERSION);
        int maxRetries = positiveInt(result, "max_retries", DiscordHttpClient.DEFAULT_MAX_RETRIES);
        boolean mobile = result.getBoolean("mobile") != null && result.getBoolean("mobile");

        int intents = Intent.defaults();
        if (result.isArray("intents")) {
            intents = parseIntents(result.getArray("intents"));
        } else if (result.contains("intents")) {
            throw new ConfigException("'intents' must be an array of intent names.");
        }

        Activity activity = null;
        StatusType status = null;
        if (result.isTable("presence")) {
            TomlTable presence = result.getTable("presence");
            status = parseStatus(presence.getString("status"));
            activity = parseActivity(presence);
        }

        Integer shardCount = null;
        List<Integer> shardIds = List.of();
        if (result.isTable("sharding")) {
            TomlTable sharding = result.getTable("sharding");
            Long count = sharding.getLong("count");
            if (count != null) {
                if (count < 1) {
                    throw new ConfigException("'sharding.count' must be at least 1, got " + count);
                }
                shardCount = count.intValue();
            }
            shardIds = parseShardIds(sharding, shardCount);
        }

        return new ClientConfig(token, apiVersion, intents, mobile, maxRetries, activity, status, shardCount, shardIds);
    }

    private static int positiveInt(TomlTable table, String key, int defaultValue) {
        if (!table.contains(key)) {
            return defaultValue;
        }
        if (!table.isLong(key)) {
            throw new ConfigException("'" + key + "' must be an integer.");
        }
        long value = table.getLong(key);
        if (value < 1 || value > Integer.MAX_VALUE) {
            throw new ConfigException("'" + key + "' must be a positive integer, got " + value);
        }
        return (int) value;
    }

    private static int parseIntents(TomlArray array) {
        List<Intent> intents = new ArrayList<>();
        for (Object name : array.toList()) {
            try {
                intents.add(Intent.fromString(name.toString()));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid 'intents': " + e.getMessage());
            }
        }
        return Intent.mask(intents);
    }

    private static StatusType parseStatus(String value) {
        if (value == null) {
            return null;
        }
        try {
            return StatusType.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid 'presence.status': " + e.getMessage());
        }
    }

    private static Activity parseActivity(TomlTable presence) {
        String name = presence.getString("activity");
        if (name == null || name.isBlank()) {
            return null;
        }

        ActivityType type = ActivityType.GAME;
        String typeStr = presence.getString("activity_type");
        if (typeStr != null) {
            try {
                type = ActivityType.fromString(typeStr);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid 'presence.activity_type': " + e.getMessage());
            }
        }

        String url = presence.getString("activity_url");
        if (type == ActivityType.STREAMING) {
            if (url == null || url.isBlank()) {
                throw new ConfigException("Streaming activity '" + name + "' requires 'presence.activity_url'.");
            }
            return Activity.streaming(name, url);
        }
        return Activity.of(type, name);
    }

    private static List<Integer> parseShardIds(TomlTable sharding, Integer shardCount) {
        if (!sharding.isArray("ids")) {
            return List.of();
        }
        if (shardCount == null) {
            throw new ConfigException("'sharding.ids' requires 'sharding.count'.");
        }

        List<Integer> ids = new ArrayList<>();
        for (Object id : sharding.getArray("ids").toList()) {
            if (!(id instanceof Long value) || value < 0 || value >= shardCount) {
                throw new ConfigException("Invalid shard id " + id + " for shard count " + shardCount);
            }
            ids.add(value.intValue());
        }
        return List.copyOf(ids);
    }
}
