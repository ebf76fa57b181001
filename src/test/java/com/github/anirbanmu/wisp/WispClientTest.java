package com.github.anirbanmu.wisp;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.wisp.config.ClientConfig;
import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.ErrorKind;
import com.github.anirbanmu.wisp.discord.FakeGatewayConnector;
import com.github.anirbanmu.wisp.discord.Gateway;
import com.github.anirbanmu.wisp.discord.GatewayCloseException;
import com.github.anirbanmu.wisp.discord.HttpException;
import com.github.anirbanmu.wisp.discord.RateLimiter;
import com.github.anirbanmu.wisp.discord.json.Activity;
import com.github.anirbanmu.wisp.discord.json.ActivityType;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import com.github.anirbanmu.wisp.event.EventHandler;
import com.github.anirbanmu.wisp.util.Http;
import com.github.anirbanmu.wisp.util.Json;
import com.github.anirbanmu.wisp.util.ManualScheduler;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WispClientTest {
    static final String HELLO = "{\"op\": 10, \"d\": {\"heartbeat_interval\": 41250}}";

    private final AtomicInteger gatewayBotCalls = new AtomicInteger();
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final List<String> handled = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private FakeGatewayConnector connector;
    private ManualScheduler scheduler;
    private WispClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v10/gateway/bot", exchange -> {
            gatewayBotCalls.incrementAndGet();
            byte[] body = """
                {"url": "wss://gateway.test", "shards": 2,
                 "session_start_limit": {"total": 1000, "remaining": 1000, "reset_after": 0, "max_concurrency": 1}}
                """.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();

        connector = new FakeGatewayConnector();
        scheduler = new ManualScheduler();
        client = newClient(ClientConfig.of("test-token").withPresence(Activity.of(ActivityType.GAME, "chess"), StatusType.IDLE));
    }

    private WispClient newClient(ClientConfig config) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/api/v10";
        DiscordHttpClient http = new DiscordHttpClient(config.token(), baseUrl, 2, Http.CLIENT, new RateLimiter(), d -> {
        });
        Map<String, EventHandler> handlers = Map.of("MESSAGE_CREATE",
            (c, gw, data) -> handled.add(gw.shardId() + ":" + data.get("content")));
        return new WispClient(config, http, connector, scheduler, Runnable::run, handlers,
            (source, e) -> errors.add(source + ":" + e.getClass().getSimpleName()));
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

    private static List<Integer> shard(Map<String, Object> identify) {
        List<Integer> ids = new ArrayList<>();
        for (Object id : (List<?>) identify.get("shard")) {
            ids.add(((Number) id).intValue());
        }
        return ids;
    }

    @Test
    void runStartsSingleShard() throws Exception {
        client.run();

        assertEquals(Set.of(0), client.shards().keySet());
        assertEquals("gateway.test", connector.uris().get(0).getHost());
        assertEquals("v=10&encoding=json&compress=zlib-stream", connector.uris().get(0).getQuery());

        connector.receive(HELLO);
        Map<String, Object> identify = data(connector.lastConnection().lastSent());
        assertEquals(List.of(0, 1), shard(identify));

        @SuppressWarnings("unchecked")
        Map<String, Object> presence = (Map<String, Object>) identify.get("presence");
        assertEquals("idle", presence.get("status"));
    }

    @Test
    void runFollowsConfiguredSharding() throws Exception {
        ClientConfig sharded = new ClientConfig("test-token", 10, 513, false, 2, null, null, 4, List.of(1, 3));
        try (WispClient shardedClient = newClient(sharded)) {
            shardedClient.run();

            assertEquals(Set.of(1, 3), shardedClient.shards().keySet());
            connector.listener(1).onText(HELLO);
            assertEquals(List.of(3, 4), shard(data(connector.connection(1).lastSent())));
        }
    }

    @Test
    void runWithCountOnlyLaunchesEveryShard() throws Exception {
        ClientConfig sharded = new ClientConfig("test-token", 10, 513, false, 2, null, null, 3, List.of());
        try (WispClient shardedClient = newClient(sharded)) {
            shardedClient.run();

            assertEquals(Set.of(0, 1, 2), shardedClient.shards().keySet());
        }
    }

    @Test
    void runShardsLaunchesRequestedIds() throws Exception {
        client.runShards(3, List.of(0, 2));

        assertEquals(Set.of(0, 2), client.shards().keySet());
        assertEquals(2, connector.connectionCount());

        connector.listener(1).onText(HELLO);
        Map<String, Object> identify = data(connector.connection(1).lastSent());
        assertEquals(List.of(2, 3), shard(identify));
    }

    @Test
    void runShardsRejectsBadIds() {
        assertThrows(IllegalArgumentException.class, () -> client.runShards(2, List.of(2)));
        assertThrows(IllegalArgumentException.class, () -> client.runShards(0, List.of()));
        assertEquals(0, connector.connectionCount());
    }

    @Test
    void autoshardingUsesRecommendedCount() throws Exception {
        client.runAutosharded();

        assertEquals(Set.of(0, 1), client.shards().keySet());
        assertEquals(1, gatewayBotCalls.get());
    }

    @Test
    void gatewayInfoIsFetchedOnce() throws Exception {
        client.gatewayInfo();
        client.runShards(2, List.of());

        assertEquals(1, gatewayBotCalls.get());
        assertEquals(2, client.gatewayInfo().shards());
    }

    @Test
    void dispatchesReachHandlers() throws Exception {
        client.run();
        connector.receive(HELLO);
        connector.receive("{\"op\":0,\"t\":\"MESSAGE_CREATE\",\"s\":1,\"d\":{\"content\":\"ping\"}}");

        assertEquals(List.of("0:ping"), handled);
    }

    @Test
    void waitForSeesDispatches() throws Exception {
        client.run();
        CompletableFuture<Map<String, Object>> ready = client.waitFor("READY", null, Duration.ofSeconds(5));

        connector.receive(HELLO);
        connector.receive("{\"op\":0,\"t\":\"READY\",\"s\":1,\"d\":{\"session_id\":\"s1\"}}");

        assertEquals("s1", ready.get(1, TimeUnit.SECONDS).get("session_id"));
        assertEquals("s1", client.shards().get(0).gateway().sessionId());
    }

    @Test
    void fatalCloseIsReported() throws Exception {
        client.run();

        connector.lastListener().onClose(4004, "Authentication failed.");

        assertEquals(List.of("shard-0:" + GatewayCloseException.class.getSimpleName()), errors);
        assertTrue(client.shards().get(0).isDisconnected());
    }

    @Test
    void closeStopsShardsAndUnblocksAwait() throws Exception {
        client.run();
        Gateway gateway = client.shards().get(0).gateway();

        client.close();
        client.awaitShutdown();

        assertTrue(gateway.isClosed());
        assertEquals(1000, connector.lastConnection().closeCode());
        assertTrue(client.shards().get(0).isDisconnected());
    }

    @Test
    void restClientErrorsPropagate() {
        server.createContext("/api/v10/denied", exchange -> {
            exchange.sendResponseHeaders(401, -1);
            exchange.close();
        });

        HttpException e = assertThrows(HttpException.class, () -> client.http().get("denied"));
        assertEquals(ErrorKind.UNAUTHORIZED, e.kind());
    }
}
