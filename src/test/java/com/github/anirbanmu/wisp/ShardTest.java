package com.github.anirbanmu.wisp;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.wisp.config.ClientConfig;
import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.FakeGatewayConnector;
import com.github.anirbanmu.wisp.discord.Gateway;
import com.github.anirbanmu.wisp.discord.RateLimiter;
import com.github.anirbanmu.wisp.discord.json.Activity;
import com.github.anirbanmu.wisp.discord.json.ActivityType;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import com.github.anirbanmu.wisp.util.Http;
import com.github.anirbanmu.wisp.util.Json;
import com.github.anirbanmu.wisp.util.ManualScheduler;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShardTest {
    private HttpServer server;
    private FakeGatewayConnector connector;
    private ManualScheduler scheduler;
    private WispClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/gateway/bot", exchange -> {
            byte[] body = "{\"url\": \"wss://gateway.test\", \"shards\": 1}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();

        connector = new FakeGatewayConnector();
        scheduler = new ManualScheduler();
        ClientConfig config = ClientConfig.of("test-token");
        DiscordHttpClient http = new DiscordHttpClient("test-token", "http://127.0.0.1:" + server.getAddress().getPort(),
            1, Http.CLIENT, new RateLimiter(), d -> {
            });
        client = new WispClient(config, http, connector, scheduler, Runnable::run, Map.of(), (source, e) -> {
        });
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(String payload) throws Exception {
        return (Map<String, Object>) Json.readObject(payload).get("d");
    }

    @Test
    void unlaunchedShard() {
        Shard shard = new Shard(client, 0, 1);

        assertTrue(shard.isDisconnected());
        assertNull(shard.gateway());
        assertEquals(Double.POSITIVE_INFINITY, shard.latency());
        assertThrows(IllegalStateException.class, () -> shard.updatePresence(null, StatusType.DND));
    }

    @Test
    void launchRegistersAndConnects() throws Exception {
        Shard shard = new Shard(client, 0, 1).launch(null, null, true);

        assertSame(shard, client.shards().get(0));
        assertFalse(shard.isDisconnected());
        assertEquals(1, connector.connectionCount());

        connector.receive(WispClientTest.HELLO);
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) data(connector.lastConnection().lastSent()).get("properties");
        assertEquals("Discord iOS", properties.get("browser"));
    }

    @Test
    void updatePresenceSendsOpcodeThree() throws Exception {
        Shard shard = new Shard(client, 0, 1).launch(null, null, false);
        connector.receive(WispClientTest.HELLO);

        shard.updatePresence(Activity.of(ActivityType.COMPETING, "races"), StatusType.DND);

        String sent = connector.lastConnection().lastSent();
        assertEquals(3, ((Number) Json.readObject(sent).get("op")).intValue());
        assertEquals("dnd", data(sent).get("status"));
    }

    @Test
    void reconnectRelaunchesAfterWait() throws Exception {
        Shard shard = new Shard(client, 0, 1).launch(Activity.of(ActivityType.GAME, "chess"), StatusType.IDLE, false);
        Gateway first = shard.gateway();

        CompletableFuture<Shard> relaunched = shard.reconnect(Duration.ofSeconds(3));

        assertTrue(first.isClosed());
        assertTrue(shard.isDisconnected());
        assertFalse(relaunched.isDone());

        scheduler.advance(2999);
        assertFalse(relaunched.isDone());
        scheduler.advance(1);

        assertSame(shard, relaunched.join());
        assertNotSame(first, shard.gateway());
        assertFalse(shard.isDisconnected());
        assertEquals(2, connector.connectionCount());

        // the new session identifies with the remembered presence
        connector.receive(WispClientTest.HELLO);
        @SuppressWarnings("unchecked")
        Map<String, Object> presence = (Map<String, Object>) data(connector.lastConnection().lastSent()).get("presence");
        assertEquals("idle", presence.get("status"));
    }

    @Test
    void closeMarksDisconnected() throws Exception {
        Shard shard = new Shard(client, 0, 1).launch(null, null, false);

        shard.close();

        assertTrue(shard.isDisconnected());
        assertTrue(shard.gateway().isClosed());
    }
}
