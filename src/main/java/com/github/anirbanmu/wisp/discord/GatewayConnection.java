package com.github.anirbanmu.wisp.discord;

import java.util.concurrent.CompletableFuture;

// one open gateway socket
public interface GatewayConnection {

    // sends are queued, never interleaved
    CompletableFuture<Void> sendText(String text);

    void close(int code, String reason);

    // drop the tcp connection without a close frame
    void abort();
}
