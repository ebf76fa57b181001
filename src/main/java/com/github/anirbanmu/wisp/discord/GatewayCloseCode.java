package com.github.anirbanmu.wisp.discord;

// close codes that get special treatment. anything not listed here is transient.
public enum GatewayCloseCode {
    SESSION_TIMED_OUT(4009, CloseKind.RESUMABLE, "Session timed out"),
    INVALID_SEQUENCE(4007, CloseKind.SESSION_INVALID, "Invalid sequence sent when resuming"),
    AUTHENTICATION_FAILED(4004, CloseKind.FATAL_CREDENTIAL, "Token is not valid"),
    INVALID_SHARD(4010, CloseKind.FATAL_CONFIG, "Invalid shard"),
    SHARDING_REQUIRED(4011, CloseKind.FATAL_CONFIG, "Sharding required"),
    INVALID_API_VERSION(4012, CloseKind.FATAL_CONFIG, "Invalid API version"),
    INVALID_INTENTS(4013, CloseKind.FATAL_CONFIG, "Invalid intents"),
    DISALLOWED_INTENTS(4014, CloseKind.FATAL_CONFIG,
        "Requested privileged intents that are not enabled in the developer portal");

    // local codes, sent by us
    public static final int LOCAL_RESTART = 4000;
    public static final int NORMAL = 1000;

    private final int code;
    private final CloseKind kind;
    private final String description;

    GatewayCloseCode(int code, CloseKind kind, String description) {
        this.code = code;
        this.kind = kind;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public CloseKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public static GatewayCloseCode of(int code) {
        for (GatewayCloseCode known : values()) {
            if (known.code == code) {
                return known;
            }
        }
        return null;
    }

    public static CloseKind classify(int code) {
        GatewayCloseCode known = of(code);
        return known == null ? CloseKind.TRANSIENT : known.kind;
    }

    // new instance every call, never shared between failures
    public static GatewayCloseException toException(int code, int shardId) {
        GatewayCloseCode known = of(code);
        String description = known == null ? "Gateway closed" : known.description;
        return new GatewayCloseException(code, classify(code), shardId,
            "Shard " + shardId + " closed with code " + code + ": " + description);
    }
}
