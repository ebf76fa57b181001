package com.github.anirbanmu.wisp.discord;

import com.github.anirbanmu.wisp.discord.json.GatewayEvent;
import com.github.anirbanmu.wisp.discord.json.GatewayEventParser;
import com.github.anirbanmu.wisp.discord.json.GatewayEventParser.ParseResult;
import com.github.anirbanmu.wisp.discord.json.GatewayPayload;
import com.github.anirbanmu.wisp.discord.json.Identify;
import com.github.anirbanmu.wisp.discord.json.Presence;
import com.github.anirbanmu.wisp.discord.json.Resume;
import com.github.anirbanmu.wisp.log.Log;
import com.github.anirbanmu.wisp.util.Scheduler;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

// one shard's gateway session. reconnects and resumes on its own until closed or a fatal close code.
//
// every connection attempt gets a new generation number; callbacks and timers from an older
// attempt see a different generation and do nothing.
public class Gateway {
    static final String QUERY = "?v=10&encoding=json&compress=zlib-stream";
    static final long FIRST_HEARTBEAT_OFFSET_MS = 2000;
    private static final long BASE_RECONNECT_DELAY_MS = 200;
    private static final long MAX_RECONNECT_DELAY_MS = 30_000;

    public enum State {
        DISCONNECTED,
        CONNECTING,
        HANDSHAKING,
        RESUMING,
        ACTIVE
    }

    // who we are to discord; fixed for the life of the session
    public record Identity(String token, int intents, int shardId, int shardCount, boolean mobile) {
    }

    // must return quickly; runs on the socket's receive path
    @FunctionalInterface
    public interface DispatchListener {
        void onDispatch(Gateway gateway, GatewayEvent.Dispatch dispatch);
    }

    private final Identity identity;
    private final String gatewayUrl;
    private final GatewayConnector connector;
    private final Scheduler scheduler;
    private final DispatchListener dispatchListener;
    private final LongSupplier nanoClock;
    private final GatewayEventParser parser = new GatewayEventParser();
    private final FrameDecompressor decompressor = new FrameDecompressor();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    // receive path
    private volatile Integer sequence;
    private volatile String sessionId;
    private volatile String resumeGatewayUrl;
    private volatile double latency = Double.POSITIVE_INFINITY;

    // heartbeat path
    private volatile long heartbeatInterval;
    private volatile long lastHeartbeatSentAt;
    private volatile long ackPendingSince;
    private volatile boolean ackPending;

    private volatile Presence presence;
    private volatile State state = State.DISCONNECTED;
    private volatile boolean connected;
    private volatile GatewayConnection connection;
    private volatile int generation;

    // guarded by this
    private final List<Scheduler.Task> timers = new ArrayList<>();
    private int reconnectAttempts;

    public Gateway(Identity identity, String gatewayUrl, Presence presence, GatewayConnector connector,
        Scheduler scheduler, DispatchListener dispatchListener) {
        this(identity, gatewayUrl, presence, connector, scheduler, dispatchListener, System::nanoTime);
    }

    public Gateway(Identity identity, String gatewayUrl, Presence presence, GatewayConnector connector,
        Scheduler scheduler, DispatchListener dispatchListener, LongSupplier nanoClock) {
        this.identity = identity;
        this.gatewayUrl = gatewayUrl;
        this.presence = presence;
        this.connector = connector;
        this.scheduler = scheduler;
        this.dispatchListener = dispatchListener;
        this.nanoClock = nanoClock;
    }

    // starts a new connection attempt and returns without waiting for it
    public synchronized void connect() {
        if (closed.get()) {
            return;
        }

        int gen = ++generation;
        cancelTimers();
        GatewayConnection previous = connection;
        connection = null;
        connected = false;
        if (previous != null) {
            previous.abort();
        }
        synchronized (decompressor) {
            decompressor.reset();
        }
        ackPending = false;
        state = State.CONNECTING;

        boolean resuming = sessionId != null;
        String base = resuming && resumeGatewayUrl != null ? resumeGatewayUrl : gatewayUrl;
        Log.info("gateway.connecting", "shard", identity.shardId(), "url", base, "resume", resuming);

        connector.open(gatewayUri(base), new Listener(gen)).whenComplete((conn, ex) -> {
            if (ex != null) {
                onConnectFailed(gen, ex);
            }
        });
    }

    // idempotent. the session cannot be reconnected afterwards
    public void close(int code) {
        GatewayConnection conn;
        synchronized (this) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            generation++;
            cancelTimers();
            conn = connection;
            connection = null;
            connected = false;
            state = State.DISCONNECTED;
            synchronized (decompressor) {
                decompressor.reset();
            }
        }

        if (conn != null) {
            conn.close(code, "closing");
        }
        Log.info("gateway.closed_by_client", "shard", identity.shardId(), "code", code);
        terminated.complete(null);
    }

    public void close() {
        close(GatewayCloseCode.NORMAL);
    }

    public void updatePresence(Presence presence) {
        this.presence = presence;
        GatewayConnection conn = connection;
        if (conn == null || !connected) {
            Log.warn("gateway.presence_not_sent", "shard", identity.shardId(), "state", state);
            return;
        }
        try {
            send(conn, GatewayPayload.presenceUpdate(presence), "presence_update");
        } catch (IOException e) {
            Log.error("gateway.presence_encode_failed", e, "shard", identity.shardId());
        }
    }

    // completes normally on close(), exceptionally with GatewayCloseException on a fatal close code
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public int shardId() {
        return identity.shardId();
    }

    public int shardCount() {
        return identity.shardCount();
    }

    public int intents() {
        return identity.intents();
    }

    public Integer sequence() {
        return sequence;
    }

    public String sessionId() {
        return sessionId;
    }

    // seconds between the last heartbeat and its ack; infinite until the first ack
    public double latency() {
        return latency;
    }

    public long heartbeatInterval() {
        return heartbeatInterval;
    }

    public State state() {
        return state;
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long droppedFrames() {
        return decompressor.droppedMessages();
    }

    private boolean isCurrent(int gen) {
        return gen == generation && !closed.get();
    }

    private synchronized void onOpen(int gen, GatewayConnection conn) {
        if (!isCurrent(gen)) {
            conn.abort();
            return;
        }
        connection = conn;
        connected = true;
        Log.info("gateway.connected", "shard", identity.shardId());
    }

    private synchronized void onConnectFailed(int gen, Throwable error) {
        if (!isCurrent(gen)) {
            return;
        }
        Log.error("gateway.connect_failed", error, "shard", identity.shardId());
        connection = null;
        connected = false;
        state = State.DISCONNECTED;
        scheduleReconnect("connect_failed");
    }

    private void onBinary(int gen, byte[] data) {
        String text;
        synchronized (decompressor) {
            if (!isCurrent(gen)) {
                return;
            }
            text = decompressor.feedBinary(data);
        }
        if (text != null) {
            handleMessage(gen, text);
        }
    }

    private void onText(int gen, String text) {
        String message;
        synchronized (decompressor) {
            if (!isCurrent(gen)) {
                return;
            }
            message = decompressor.feedText(text);
        }
        handleMessage(gen, message);
    }

    private void handleMessage(int gen, String raw) {
        ParseResult result;
        try {
            result = parser.parse(raw);
        } catch (IOException | RuntimeException ex) {
            Log.error("gateway.message_error", ex, "shard", identity.shardId());
            restart(gen, "unreadable_message");
            return;
        }

        if (Log.isDebugEnabled()) {
            Log.debug("gateway.received", "shard", identity.shardId(), "op", result.op(), "s", result.sequence());
        }

        GatewayEvent event = result.event();
        if (event == null) {
            return;
        }

        if (event instanceof GatewayEvent.Dispatch dispatch) {
            onDispatch(dispatch);
        } else if (event instanceof GatewayEvent.Hello hello) {
            onHello(gen, hello);
        } else if (event instanceof GatewayEvent.HeartbeatAck) {
            onHeartbeatAck();
        } else if (event instanceof GatewayEvent.HeartbeatRequest) {
            sendHeartbeat(gen);
        } else if (event instanceof GatewayEvent.Reconnect) {
            Log.info("gateway.reconnect_requested", "shard", identity.shardId());
            restart(gen, "reconnect_requested");
        } else if (event instanceof GatewayEvent.InvalidSession invalid) {
            Log.info("gateway.invalid_session", "shard", identity.shardId(), "resumable", invalid.resumable());
            invalidate(gen);
        }
    }

    private void onDispatch(GatewayEvent.Dispatch dispatch) {
        Integer current = sequence;
        if (current == null || dispatch.sequence() > current) {
            sequence = dispatch.sequence();
        }

        if (GatewayEvent.Dispatch.READY.equals(dispatch.type())) {
            sessionId = dispatch.stringField("session_id");
            resumeGatewayUrl = dispatch.stringField("resume_gateway_url");
            markActive();
            Log.info("gateway.ready", "shard", identity.shardId(), "session", redact(sessionId));
        } else if (GatewayEvent.Dispatch.RESUMED.equals(dispatch.type())) {
            markActive();
            Log.info("gateway.resumed", "shard", identity.shardId(), "seq", sequence);
        }

        try {
            dispatchListener.onDispatch(this, dispatch);
        } catch (RuntimeException ex) {
            Log.error("gateway.dispatch_listener_failed", ex, "shard", identity.shardId(), "event", dispatch.type());
        }
    }

    private synchronized void markActive() {
        state = State.ACTIVE;
        reconnectAttempts = 0;
    }

    private void onHello(int gen, GatewayEvent.Hello hello) {
        heartbeatInterval = hello.heartbeatInterval();
        Log.info("gateway.hello", "shard", identity.shardId(), "interval_ms", hello.heartbeatInterval());
        startHeartbeat(gen, hello.heartbeatInterval());
        sendHandshake(gen);
    }

    private void onHeartbeatAck() {
        latency = (nanoClock.getAsLong() - lastHeartbeatSentAt) / 1_000_000_000.0;
        ackPending = false;
        Log.debug("gateway.heartbeat_ack", "shard", identity.shardId(), "latency_s", latency);
    }

    // first beat lands just before the interval elapses, then one per interval.
    // the watchdog checks twice per interval and gives an ack one full interval to arrive.
    private synchronized void startHeartbeat(int gen, long intervalMs) {
        if (!isCurrent(gen)) {
            return;
        }
        cancelTimers();
        long firstDelay = Math.max(0, intervalMs - FIRST_HEARTBEAT_OFFSET_MS);
        timers.add(scheduler.scheduleAtFixedRate(() -> sendHeartbeat(gen), firstDelay, intervalMs));

        long checkEvery = Math.max(1, intervalMs / 2);
        timers.add(scheduler.scheduleAtFixedRate(() -> checkLiveness(gen), checkEvery, checkEvery));
    }

    private void sendHeartbeat(int gen) {
        GatewayConnection conn = connection;
        if (conn == null || !isCurrent(gen)) {
            return;
        }
        long now = nanoClock.getAsLong();
        lastHeartbeatSentAt = now;
        if (!ackPending) {
            ackPendingSince = now;
            ackPending = true;
        }
        send(conn, GatewayPayload.heartbeat(sequence), "heartbeat");
    }

    private void checkLiveness(int gen) {
        if (!isCurrent(gen) || !ackPending) {
            return;
        }
        long waitedNanos = nanoClock.getAsLong() - ackPendingSince;
        if (waitedNanos <= TimeUnit.MILLISECONDS.toNanos(heartbeatInterval)) {
            return;
        }

        Log.warn("gateway.heartbeat_timeout", "shard", identity.shardId(), "waited_ms", waitedNanos / 1_000_000);
        synchronized (this) {
            if (!isCurrent(gen)) {
                return;
            }
            GatewayConnection conn = connection;
            if (conn != null) {
                conn.close(GatewayCloseCode.LOCAL_RESTART, "stale connection");
            }
            handleClose(gen, GatewayCloseCode.LOCAL_RESTART);
        }
    }

    private void sendHandshake(int gen) {
        GatewayConnection conn = connection;
        if (conn == null || !isCurrent(gen)) {
            return;
        }

        String sid = sessionId;
        try {
            if (sid != null) {
                state = State.RESUMING;
                send(conn, GatewayPayload.resume(new Resume(identity.token(), sid, sequence)), "resume");
                Log.info("gateway.resume_sent", "shard", identity.shardId(), "seq", sequence);
            } else {
                sequence = null;
                state = State.HANDSHAKING;
                Identify identify = Identify.create(identity.token(), identity.intents(),
                    identity.shardId(), identity.shardCount(), presence, identity.mobile());
                send(conn, GatewayPayload.identify(identify), "identify");
                Log.info("gateway.identify_sent", "shard", identity.shardId());
            }
        } catch (IOException e) {
            Log.error("gateway.handshake_encode_failed", e, "shard", identity.shardId());
            restart(gen, "handshake_failed");
        }
    }

    private void send(GatewayConnection conn, String payload, String what) {
        conn.sendText(payload).whenComplete((v, ex) -> {
            if (ex != null) {
                Log.error("gateway.send_failed", ex, "shard", identity.shardId(), "payload", what);
            }
        });
    }

    // drop the socket but keep session state, so the next handshake is a resume
    private synchronized void restart(int gen, String reason) {
        if (!isCurrent(gen)) {
            return;
        }
        Log.info("gateway.restarting", "shard", identity.shardId(), "reason", reason);
        GatewayConnection conn = connection;
        connection = null;
        if (conn != null) {
            conn.close(GatewayCloseCode.LOCAL_RESTART, reason);
        }
        connect();
    }

    // server dropped the session: forget it and identify from scratch
    private synchronized void invalidate(int gen) {
        if (!isCurrent(gen)) {
            return;
        }
        forgetSession();
        GatewayConnection conn = connection;
        connection = null;
        if (conn != null) {
            conn.close(GatewayCloseCode.NORMAL, "invalid session");
        }
        connect();
    }

    // next handshake is an identify
    private void forgetSession() {
        sessionId = null;
        resumeGatewayUrl = null;
        sequence = null;
    }

    private synchronized void handleClose(int gen, int code) {
        if (!isCurrent(gen)) {
            return;
        }
        cancelTimers();
        connection = null;
        connected = false;
        state = State.DISCONNECTED;

        CloseKind kind = GatewayCloseCode.classify(code);
        switch (kind) {
            case RESUMABLE -> {
                Log.info("gateway.resuming_after_close", "shard", identity.shardId(), "code", code);
                connect();
            }
            case SESSION_INVALID -> {
                forgetSession();
                scheduleReconnect("closed_" + code);
            }
            case FATAL_CREDENTIAL, FATAL_CONFIG -> fail(GatewayCloseCode.toException(code, identity.shardId()));
            case TRANSIENT -> scheduleReconnect("closed_" + code);
        }
    }

    // caller holds the lock
    private void scheduleReconnect(String reason) {
        int gen = ++generation;
        reconnectAttempts++;
        long delay = Math.min(BASE_RECONNECT_DELAY_MS * (1L << Math.min(reconnectAttempts - 1, 8)), MAX_RECONNECT_DELAY_MS);
        Log.info("gateway.reconnect_scheduled", "shard", identity.shardId(), "attempt", reconnectAttempts,
            "delay_ms", delay, "reason", reason);
        timers.add(scheduler.schedule(() -> reconnectIfCurrent(gen), delay));
    }

    private synchronized void reconnectIfCurrent(int gen) {
        if (isCurrent(gen)) {
            connect();
        }
    }

    // caller holds the lock
    private void fail(GatewayCloseException error) {
        closed.set(true);
        generation++;
        cancelTimers();
        synchronized (decompressor) {
            decompressor.reset();
        }
        Log.error("gateway.fatal_close", error, "shard", identity.shardId(), "code", error.code(), "kind", error.kind());
        terminated.completeExceptionally(error);
    }

    // caller holds the lock
    private void cancelTimers() {
        for (Scheduler.Task task : timers) {
            task.cancel();
        }
        timers.clear();
    }

    static URI gatewayUri(String base) {
        String trimmed = base;
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            trimmed = trimmed.substring(0, query);
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return URI.create(trimmed + "/" + QUERY);
    }

    private static String redact(String value) {
        if (value == null) {
            return "null";
        }
        return value.length() > 4 ? "..." + value.substring(value.length() - 4) : "REDACTED";
    }

    private final class Listener implements GatewayConnector.Listener {
        private final int gen;

        Listener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(GatewayConnection conn) {
            Gateway.this.onOpen(gen, conn);
        }

        @Override
        public void onText(String text) {
            Gateway.this.onText(gen, text);
        }

        @Override
        public void onBinary(byte[] data) {
            Gateway.this.onBinary(gen, data);
        }

        @Override
        public void onClose(int code, String reason) {
            if (isCurrent(gen)) {
                Log.info("gateway.closed", "shard", identity.shardId(), "code", code, "reason", reason);
            }
            handleClose(gen, code);
        }

        @Override
        public void onError(Throwable error) {
            if (isCurrent(gen)) {
                Log.error("gateway.error", error, "shard", identity.shardId());
            }
            handleClose(gen, GatewayCloseCode.LOCAL_RESTART);
        }
    }
}
