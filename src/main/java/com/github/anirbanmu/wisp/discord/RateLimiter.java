package com.github.anirbanmu.wisp.discord;

import com.github.anirbanmu.wisp.log.Log;
import com.github.anirbanmu.wisp.util.Sleeper;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

// per-bucket bookkeeping for discord rate limits. routes are mapped to buckets as responses reveal them,
// so the first request on an unseen route always goes out.
public class RateLimiter {
    static final String BUCKET = "X-RateLimit-Bucket";
    static final String LIMIT = "X-RateLimit-Limit";
    static final String REMAINING = "X-RateLimit-Remaining";
    static final String RESET = "X-RateLimit-Reset";
    static final String RESET_AFTER = "X-RateLimit-Reset-After";

    private final Map<RouteKey, String> bucketIds = new ConcurrentHashMap<>();
    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
    private final LongSupplier clock;
    private final Sleeper sleeper;

    record RouteKey(String route, String method) {
    }

    public RateLimiter() {
        this(System::currentTimeMillis, Sleeper.SYSTEM);
    }

    public RateLimiter(LongSupplier clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void record(String route, String method, Map<String, List<String>> headers) {
        String bucketId = header(headers, BUCKET);
        if (bucketId == null) {
            return;
        }

        String limit = header(headers, LIMIT);
        String remaining = header(headers, REMAINING);
        String reset = header(headers, RESET);
        String resetAfter = header(headers, RESET_AFTER);
        if (limit == null || remaining == null || reset == null || resetAfter == null) {
            Log.warn("ratelimit.partial_headers", "bucket", bucketId, "route", route);
            return;
        }

        RateLimitBucket bucket;
        try {
            bucket = new RateLimitBucket(
                Integer.parseInt(limit),
                Integer.parseInt(remaining),
                Double.parseDouble(reset),
                Double.parseDouble(resetAfter),
                clock.getAsLong());
        } catch (NumberFormatException e) {
            Log.warn("ratelimit.bad_headers", e, "bucket", bucketId, "route", route);
            return;
        }

        bucketIds.put(new RouteKey(route, method), bucketId);
        buckets.put(bucketId, bucket);
        Log.debug("ratelimit.bucket", "bucket", bucketId, "remaining", bucket.remaining(), "reset_after", bucket.resetAfter());
    }

    // blocks the caller while the route's bucket is exhausted
    public void awaitAvailability(String route, String method) throws InterruptedException {
        Optional<RateLimitBucket> found = bucketFor(route, method);
        if (found.isEmpty() || !found.get().isExhausted()) {
            return;
        }

        long waitMs = found.get().windowEndsAtMs() - clock.getAsLong();
        if (waitMs <= 0) {
            return;
        }

        Log.info("ratelimit.waiting", "route", route, "method", method, "wait_ms", waitMs);
        sleeper.sleep(Duration.ofMillis(waitMs));
    }

    public Optional<RateLimitBucket> bucketFor(String route, String method) {
        String bucketId = bucketIds.get(new RouteKey(route, method));
        if (bucketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(buckets.get(bucketId));
    }

    // java.net.http lower-cases header names, tests and other sources may not
    private static String header(Map<String, List<String>> headers, String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
