package com.github.anirbanmu.wisp;

import com.github.anirbanmu.wisp.discord.Gateway;
import com.github.anirbanmu.wisp.discord.json.Activity;
import com.github.anirbanmu.wisp.discord.json.Presence;
import com.github.anirbanmu.wisp.discord.json.StatusType;
import com.github.anirbanmu.wisp.log.Log;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

// lifecycle of one gateway connection. the gateway recovers from network trouble on its own;
// reconnect() here throws the session away and launches a fresh one.
public class Shard {
    public static final Duration DEFAULT_RECONNECT_WAIT = Duration.ofSeconds(3);

    private final WispClient client;
    private final int shardId;
    private final int shardCount;

    private volatile Gateway gateway;
    private volatile boolean disconnected = true;
    private volatile Activity activity;
    private volatile StatusType status;
    private volatile boolean mobile;

    public Shard(WispClient client, int shardId, int shardCount) {
        this.client = client;
        this.shardId = shardId;
        this.shardCount = shardCount;
    }

    // returns before the connection is up. activity and status may be null
    public Shard launch(Activity activity, StatusType status, boolean mobile) throws InterruptedException {
        this.activity = activity;
        this.status = status;
        this.mobile = mobile;

        Gateway gw = client.newGateway(shardId, shardCount, Presence.of(activity, status), mobile);
        gateway = gw;
        client.register(this);
        disconnected = false;
        gw.terminated().whenComplete((v, ex) -> {
            if (gateway == gw) {
                disconnected = true;
            }
        });

        Log.info("shard.launching", "shard", shardId, "count", shardCount);
        gw.connect();
        return this;
    }

    public Shard updatePresence(Activity activity, StatusType status) {
        Gateway gw = gateway;
        if (gw == null) {
            throw new IllegalStateException("shard " + shardId + " has not been launched");
        }
        this.activity = activity;
        this.status = status;
        gw.updatePresence(Presence.of(activity, status));
        return this;
    }

    public void close() {
        Gateway gw = gateway;
        if (gw != null) {
            gw.close();
        }
        disconnected = true;
    }

    // close now, launch a fresh session with the last presence after wait
    public CompletableFuture<Shard> reconnect(Duration wait) {
        close();
        Log.info("shard.reconnecting", "shard", shardId, "wait_ms", wait.toMillis());

        CompletableFuture<Shard> relaunched = new CompletableFuture<>();
        client.scheduler().schedule(() -> {
            try {
                relaunched.complete(launch(activity, status, mobile));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                relaunched.completeExceptionally(e);
            } catch (RuntimeException e) {
                Log.error("shard.relaunch_failed", e, "shard", shardId);
                relaunched.completeExceptionally(e);
            }
        }, wait.toMillis());
        return relaunched;
    }

    public CompletableFuture<Shard> reconnect() {
        return reconnect(DEFAULT_RECONNECT_WAIT);
    }

    public int id() {
        return shardId;
    }

    public int count() {
        return shardCount;
    }

    public Gateway gateway() {
        return gateway;
    }

    public boolean isDisconnected() {
        return disconnected;
    }

    // seconds; infinite before the first heartbeat ack
    public double latency() {
        Gateway gw = gateway;
        return gw == null ? Double.POSITIVE_INFINITY : gw.latency();
    }
}
