package com.github.anirbanmu.wisp.event;

import com.github.anirbanmu.wisp.log.Log;

// where handler failures and fatal gateway closes are reported. source is an event name or "shard-<id>"
@FunctionalInterface
public interface ErrorSink {
    void accept(String source, Throwable error);

    static ErrorSink logging() {
        return (source, error) -> Log.error("events.handler_failed", error, "source", source);
    }
}
