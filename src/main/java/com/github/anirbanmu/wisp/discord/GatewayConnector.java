package com.github.anirbanmu.wisp.discord;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

public interface GatewayConnector {

    // listener.onOpen fires before any message callback
    CompletableFuture<GatewayConnection> open(URI uri, Listener listener);

    // callbacks for one socket arrive one at a time
    interface Listener {
        void onOpen(GatewayConnection connection);

        // a complete text message
        void onText(String text);

        // one binary frame or fragment, possibly part of a larger compressed message
        void onBinary(byte[] data);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }
}
