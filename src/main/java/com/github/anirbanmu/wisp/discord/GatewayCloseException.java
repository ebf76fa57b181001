package com.github.anirbanmu.wisp.discord;

// the gateway closed in a way that reconnecting cannot fix
public class GatewayCloseException extends RuntimeException {
    private final int code;
    private final CloseKind kind;
    private final int shardId;

    public GatewayCloseException(int code, CloseKind kind, int shardId, String message) {
        super(message);
        this.code = code;
        this.kind = kind;
        this.shardId = shardId;
    }

    public int code() {
        return code;
    }

    public CloseKind kind() {
        return kind;
    }

    public int shardId() {
        return shardId;
    }
}
