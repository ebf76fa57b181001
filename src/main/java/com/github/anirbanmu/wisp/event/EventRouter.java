package com.github.anirbanmu.wisp.event;

import com.github.anirbanmu.wisp.WispClient;
import com.github.anirbanmu.wisp.discord.Gateway;
import com.github.anirbanmu.wisp.discord.json.GatewayEvent;
import com.github.anirbanmu.wisp.log.Log;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

// routes dispatches to the handler for their event type. the table is fixed at construction.
// handlers run on the executor, so consecutive events may be handled concurrently.
public class EventRouter {
    private final Map<String, EventHandler> handlers;
    private final Executor executor;
    private final ErrorSink errorSink;
    private final List<Waiter> waiters = new CopyOnWriteArrayList<>();

    private record Waiter(String eventName, Predicate<Map<String, Object>> check, CompletableFuture<Map<String, Object>> future) {
    }

    // handler keys are event names as discord sends them (MESSAGE_CREATE), any case
    public EventRouter(Map<String, EventHandler> handlers, Executor executor, ErrorSink errorSink) {
        Map<String, EventHandler> normalized = new HashMap<>();
        handlers.forEach((name, handler) -> normalized.put(normalize(name), handler));
        this.handlers = Map.copyOf(normalized);
        this.executor = executor;
        this.errorSink = errorSink;
    }

    public void route(WispClient client, Gateway gateway, GatewayEvent.Dispatch dispatch) {
        String name = normalize(dispatch.type());
        EventHandler handler = handlers.get(name);
        if (handler == null && waiters.isEmpty()) {
            return;
        }

        try {
            executor.execute(() -> {
                completeWaiters(name, dispatch.data());
                if (handler == null) {
                    return;
                }
                try {
                    handler.handle(client, gateway, dispatch.data());
                } catch (Exception e) {
                    errorSink.accept(name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            Log.warn("events.rejected", "event", name, "shard", gateway.shardId());
        }
    }

    // next matching dispatch, or TimeoutException. null check accepts anything, null timeout waits forever
    public CompletableFuture<Map<String, Object>> waitFor(String eventName, Predicate<Map<String, Object>> check, Duration timeout) {
        CompletableFuture<Map<String, Object>> future = new CompletableFuture<>();
        Waiter waiter = new Waiter(normalize(eventName), check == null ? data -> true : check, future);
        waiters.add(waiter);
        future.whenComplete((data, ex) -> waiters.remove(waiter));
        if (timeout != null) {
            future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future;
    }

    public boolean hasHandler(String eventName) {
        return handlers.containsKey(normalize(eventName));
    }

    private void completeWaiters(String name, Map<String, Object> data) {
        for (Waiter waiter : waiters) {
            if (!waiter.eventName().equals(name) || waiter.future().isDone()) {
                continue;
            }
            try {
                if (waiter.check().test(data)) {
                    waiter.future().complete(data);
                }
            } catch (RuntimeException e) {
                waiter.future().completeExceptionally(e);
            }
        }
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
