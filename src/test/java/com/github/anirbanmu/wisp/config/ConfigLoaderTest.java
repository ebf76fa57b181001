package com.github.anirbanmu.wisp.config;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.Intent;
import com.github.anirbanmu.wisp.discord.json.ActivityType;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

    @Test
    void testLoadConfig() {
        String toml = """
            token = "abc.def.ghi"
            api_version = 10
            intents = ["guilds", "GUILD_MESSAGES"]
            mobile = true
            max_retries = 3

            [presence]
            status = "dnd"
            activity = "the gateway"
            activity_type = "watching"

            [sharding]
            count = 4
            ids = [1, 3]
            """;

        ClientConfig config = ConfigLoader.load(toml, Map.of());

        assertEquals("abc.def.ghi", config.token());
        assertEquals(10, config.apiVersion());
        assertEquals(513, config.intents());
        assertTrue(config.mobile());
        assertEquals(3, config.maxRetries());
        assertEquals(StatusType.DND, config.status());
        assertEquals("the gateway", config.activity().name());
        assertEquals(ActivityType.WATCHING.code(), config.activity().type());
        assertEquals(4, config.shardCount());
        assertEquals(List.of(1, 3), config.shardIds());
    }

    @Test
    void testDefaults() {
        ClientConfig config = ConfigLoader.load("token = \"t\"", Map.of());

        assertEquals(DiscordHttpClient.DEFAULT_API_VERSION, config.apiVersion());
        assertEquals(DiscordHttpClient.DEFAULT_MAX_RETRIES, config.maxRetries());
        assertEquals(Intent.defaults(), config.intents());
        assertFalse(config.mobile());
        assertNull(config.activity());
        assertNull(config.status()); // online when sent
        assertNull(config.shardCount());
        assertTrue(config.shardIds().isEmpty());
    }

    @Test
    void testTokenFromEnvironment() {
        ClientConfig config = ConfigLoader.load("intents = [\"guilds\"]", Map.of("DISCORD_TOKEN", "from-env"));

        assertEquals("from-env", config.token());
        assertEquals(1, config.intents());
    }

    @Test
    void testMissingToken() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("mobile = false", Map.of()));
        assertTrue(e.getMessage().startsWith("Missing bot token"));
    }

    @Test
    void testTokenNeverPrinted() {
        ClientConfig config = ConfigLoader.load("token = \"super-secret\"", Map.of());
        assertFalse(config.toString().contains("super-secret"));
    }

    @Test
    void testStreamingActivity() {
        String toml = """
            token = "t"
            [presence]
            activity = "speedrun"
            activity_type = "streaming"
            activity_url = "https://twitch.tv/wisp"
            """;

        ClientConfig config = ConfigLoader.load(toml, Map.of());

        assertEquals(ActivityType.STREAMING.code(), config.activity().type());
        assertEquals("https://twitch.tv/wisp", config.activity().url());
    }

    @Test
    void testStreamingWithoutUrl() {
        String toml = """
            token = "t"
            [presence]
            activity = "speedrun"
            activity_type = "streaming"
            """;

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load(toml, Map.of()));
        assertEquals("Streaming activity 'speedrun' requires 'presence.activity_url'.", e.getMessage());
    }

    @Test
    void testInvalidValues() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\nintents = [\"guild_pizza\"]", Map.of()));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\nintents = \"guilds\"", Map.of()));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\nmax_retries = 0", Map.of()));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\napi_version = \"ten\"", Map.of()));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\n[presence]\nstatus = \"busy\"", Map.of()));
        assertThrows(ConfigException.class,
            () -> ConfigLoader.load("token = \"t\"\n[presence]\nactivity = \"x\"\nactivity_type = \"dancing\"", Map.of()));
    }

    @Test
    void testShardValidation() {
        ConfigException outOfRange = assertThrows(ConfigException.class,
            () -> ConfigLoader.load("token = \"t\"\n[sharding]\ncount = 2\nids = [0, 2]", Map.of()));
        assertTrue(outOfRange.getMessage().contains("Invalid shard id 2"));

        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\n[sharding]\nids = [0]", Map.of()));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("token = \"t\"\n[sharding]\ncount = 0", Map.of()));
    }

    @Test
    void testSyntaxError() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.load("token = ", Map.of()));
        assertTrue(e.getMessage().startsWith("Failed to parse TOML configuration"));
    }

    @Test
    void testLoadFromResource() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/wisp.toml")) {
            assertNotNull(in);
            ClientConfig config = ConfigLoader.load(in);

            assertEquals("resource-token", config.token());
            assertEquals(StatusType.IDLE, config.status());
            assertEquals(ActivityType.LISTENING.code(), config.activity().type());
        }
    }
}
