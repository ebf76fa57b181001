package com.github.anirbanmu.wisp;

import com.github.anirbanmu.wisp.config.ClientConfig;
import com.github.anirbanmu.wisp.discord.DiscordHttpClient;
import com.github.anirbanmu.wisp.discord.Gateway;
import com.github.anirbanmu.wisp.discord.GatewayConnector;
import com.github.anirbanmu.wisp.discord.JdkGatewayConnector;
import com.github.anirbanmu.wisp.discord.json.GatewayBotInfo;
import com.github.anirbanmu.wisp.discord.json.Presence;
import com.github.anirbanmu.wisp.event.ErrorSink;
import com.github.anirbanmu.wisp.event.EventHandler;
import com.github.anirbanmu.wisp.event.EventRouter;
import com.github.anirbanmu.wisp.log.Log;
import com.github.anirbanmu.wisp.util.Scheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

// bot entry point: owns the rest transport, the event router and one Shard per gateway connection
public class WispClient implements AutoCloseable {
    private final ClientConfig config;
    private final DiscordHttpClient http;
    private final GatewayConnector connector;
    private final Scheduler scheduler;
    private final Executor handlerExecutor;
    private final ErrorSink errorSink;
    private final EventRouter router;
    private final Map<Integer, Shard> shards = new ConcurrentHashMap<>();
    private final CountDownLatch shutdown = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile GatewayBotInfo gatewayInfo;

    public WispClient(ClientConfig config, Map<String, EventHandler> handlers) {
        this(config, handlers, ErrorSink.logging());
    }

    public WispClient(ClientConfig config, Map<String, EventHandler> handlers, ErrorSink errorSink) {
        this(config,
            new DiscordHttpClient(config.token(), config.apiVersion(), config.maxRetries()),
            new JdkGatewayConnector(),
            Scheduler.create("wisp-gateway", 2),
            newHandlerExecutor(),
            handlers,
            errorSink);
    }

    WispClient(ClientConfig config, DiscordHttpClient http, GatewayConnector connector, Scheduler scheduler,
        Executor handlerExecutor, Map<String, EventHandler> handlers, ErrorSink errorSink) {
        this.config = config;
        this.http = http;
        this.connector = connector;
        this.scheduler = scheduler;
        this.handlerExecutor = handlerExecutor;
        this.errorSink = errorSink;
        this.router = new EventRouter(handlers, handlerExecutor, errorSink);
    }

    // fetched once, before the first shard connects
    public synchronized GatewayBotInfo gatewayInfo() throws InterruptedException {
        if (gatewayInfo == null) {
            GatewayBotInfo info = http.getGatewayBot();
            if (info == null || info.url() == null) {
                throw new IllegalStateException("gateway/bot returned no gateway url");
            }
            Log.info("client.gateway_info", "url", info.url(), "recommended_shards", info.shards());
            gatewayInfo = info;
        }
        return gatewayInfo;
    }

    // shards from the [sharding] config, or shard 0 of 1 when none is configured
    public void run() throws InterruptedException {
        Integer count = config.shardCount();
        List<Integer> ids = config.shardIds() == null ? List.of() : config.shardIds();
        runShards(count == null ? 1 : count, ids);
    }

    // empty ids launches every shard in [0, shardCount)
    public void runShards(int shardCount, List<Integer> shardIds) throws InterruptedException {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be at least 1, got " + shardCount);
        }
        List<Integer> ids = new ArrayList<>(shardIds);
        if (ids.isEmpty()) {
            for (int i = 0; i < shardCount; i++) {
                ids.add(i);
            }
        }
        for (int id : ids) {
            if (id < 0 || id >= shardCount) {
                throw new IllegalArgumentException("shard id " + id + " out of range for " + shardCount + " shards");
            }
        }

        gatewayInfo();
        for (int id : ids) {
            new Shard(this, id, shardCount).launch(config.activity(), config.status(), config.mobile());
        }
    }

    // as many shards as discord recommends
    public void runAutosharded() throws InterruptedException {
        runShards(gatewayInfo().shards(), List.of());
    }

    public Map<Integer, Shard> shards() {
        return Collections.unmodifiableMap(shards);
    }

    public DiscordHttpClient http() {
        return http;
    }

    public EventRouter events() {
        return router;
    }

    public ClientConfig config() {
        return config;
    }

    public CompletableFuture<Map<String, Object>> waitFor(String eventName, Predicate<Map<String, Object>> check, Duration timeout) {
        return router.waitFor(eventName, check, timeout);
    }

    // blocks until close()
    public void awaitShutdown() throws InterruptedException {
        shutdown.await();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Shard shard : shards.values()) {
            shard.close();
        }
        if (handlerExecutor instanceof ExecutorService executor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    Log.warn("client.handler_timeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (scheduler instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                Log.warn("client.scheduler_close_failed", e);
            }
        }
        Log.info("client.closed");
        shutdown.countDown();
    }

    Scheduler scheduler() {
        return scheduler;
    }

    void register(Shard shard) {
        shards.put(shard.id(), shard);
    }

    Gateway newGateway(int shardId, int shardCount, Presence presence, boolean mobile) throws InterruptedException {
        Gateway.Identity identity = new Gateway.Identity(config.token(), config.intents(), shardId, shardCount, mobile);
        Gateway gateway = new Gateway(identity, gatewayInfo().url(), presence, connector, scheduler,
            (gw, dispatch) -> router.route(this, gw, dispatch));
        gateway.terminated().whenComplete((v, ex) -> {
            if (ex != null) {
                errorSink.accept("shard-" + shardId, ex);
            }
        });
        return gateway;
    }

    private static ExecutorService newHandlerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "wisp-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
