package com.github.anirbanmu.wisp.discord;

// snapshot of one X-RateLimit-Bucket as last reported by discord.
// resetAt is discord's epoch seconds; waits use recordedAt + resetAfter on the local clock to avoid skew.
public record RateLimitBucket(int limit, int remaining, double resetAt, double resetAfter, long recordedAtMs) {

    public long windowEndsAtMs() {
        return recordedAtMs + (long) Math.ceil(resetAfter * 1000);
    }

    public boolean isExhausted() {
        return remaining <= 0;
    }
}
