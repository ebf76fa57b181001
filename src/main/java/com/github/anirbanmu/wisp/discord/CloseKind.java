package com.github.anirbanmu.wisp.discord;

public enum CloseKind {
    // bad token, stop for good
    FATAL_CREDENTIAL,
    // shard, version or intents rejected, stop for good
    FATAL_CONFIG,
    // reconnect and resume the session
    RESUMABLE,
    // stored session is unusable, reconnect after backoff and identify
    SESSION_INVALID,
    // reconnect after backoff
    TRANSIENT;

    public boolean isFatal() {
        return this == FATAL_CREDENTIAL || this == FATAL_CONFIG;
    }
}
