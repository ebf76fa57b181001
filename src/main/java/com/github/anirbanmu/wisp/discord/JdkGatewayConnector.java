package com.github.anirbanmu.wisp.discord;

import com.github.anirbanmu.wisp.util.Http;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

// gateway sockets on top of java.net.http.WebSocket
public class JdkGatewayConnector implements GatewayConnector {
    private final HttpClient client;

    public JdkGatewayConnector() {
        this(Http.CLIENT);
    }

    public JdkGatewayConnector(HttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<GatewayConnection> open(URI uri, Listener listener) {
        Adapter adapter = new Adapter(listener);
        return client.newWebSocketBuilder()
            .buildAsync(uri, adapter)
            .thenApply(ws -> adapter.connection);
    }

    private static final class Adapter implements WebSocket.Listener {
        private final Listener listener;
        private final StringBuilder textBuffer = new StringBuilder();
        private volatile Connection connection;

        Adapter(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            connection = new Connection(webSocket);
            listener.onOpen(connection);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            listener.onBinary(bytes);
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    private static final class Connection implements GatewayConnection {
        private final WebSocket socket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        Connection(WebSocket socket) {
            this.socket = socket;
        }

        // java.net.http rejects a send while another is still pending, so chain them
        @Override
        public synchronized CompletableFuture<Void> sendText(String text) {
            CompletableFuture<Void> next = tail
                .handle((v, ex) -> (Void) null)
                .thenCompose(v -> socket.sendText(text, true))
                .thenApply(ws -> (Void) null);
            tail = next;
            return next;
        }

        @Override
        public synchronized void close(int code, String reason) {
            tail = tail
                .handle((v, ex) -> (Void) null)
                .thenCompose(v -> socket.sendClose(code, reason))
                .handle((ws, ex) -> {
                    if (ex != null) {
                        socket.abort();
                    }
                    return null;
                });
        }

        @Override
        public void abort() {
            socket.abort();
        }
    }
}
