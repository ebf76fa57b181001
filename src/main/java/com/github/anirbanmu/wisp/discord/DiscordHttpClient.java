package com.github.anirbanmu.wisp.discord;

import com.github.anirbanmu.wisp.discord.json.GatewayBotInfo;
import com.github.anirbanmu.wisp.log.Log;
import com.github.anirbanmu.wisp.util.Http;
import com.github.anirbanmu.wisp.util.Json;
import com.github.anirbanmu.wisp.util.Sleeper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

// rest transport: bucket-aware pacing, 429 handling, bounded retry on everything else
public class DiscordHttpClient {
    public static final int DEFAULT_API_VERSION = 10;
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final String AUDIT_LOG_REASON = "X-Audit-Log-Reason";

    private static final String USER_AGENT = "DiscordBot (https://github.com/anirbanmu/wisp, 1.0.0)";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final double DEFAULT_RETRY_AFTER_SECONDS = 40;

    private final String token;
    private final String baseUrl;
    private final int maxRetries;
    private final HttpClient http;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;

    public DiscordHttpClient(String token) {
        this(token, DEFAULT_API_VERSION, DEFAULT_MAX_RETRIES);
    }

    public DiscordHttpClient(String token, int apiVersion, int maxRetries) {
        this(token, "https://discord.com/api/v" + apiVersion, maxRetries, Http.CLIENT, new RateLimiter(), Sleeper.SYSTEM);
    }

    public DiscordHttpClient(String token, String baseUrl, int maxRetries, HttpClient http, RateLimiter rateLimiter, Sleeper sleeper) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        this.token = token;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.maxRetries = maxRetries;
        this.http = http;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    public GatewayBotInfo getGatewayBot() throws InterruptedException {
        return request("GET", "gateway/bot", null, Map.of(), GatewayBotInfo.class);
    }

    public Object get(String route) throws InterruptedException {
        return request("GET", route, null, Map.of(), Object.class);
    }

    public Object post(String route, Object body) throws InterruptedException {
        return post(route, body, null);
    }

    public Object post(String route, Object body, String reason) throws InterruptedException {
        return request("POST", route, body, reasonHeader(reason), Object.class);
    }

    public Object put(String route, Object body, String reason) throws InterruptedException {
        return request("PUT", route, body, reasonHeader(reason), Object.class);
    }

    public Object patch(String route, Object body, String reason) throws InterruptedException {
        return request("PATCH", route, body, reasonHeader(reason), Object.class);
    }

    public Object delete(String route) throws InterruptedException {
        return delete(route, null);
    }

    public Object delete(String route, String reason) throws InterruptedException {
        return request("DELETE", route, null, reasonHeader(reason), Object.class);
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    // returns null for 204 or an empty body
    public <T> T request(String method, String route, Object body, Map<String, String> headers, Class<T> responseType)
        throws InterruptedException {
        HttpRequest httpRequest = buildRequest(method, route, body, headers);
        int failures = 0;

        while (true) {
            rateLimiter.awaitAvailability(route, method);

            HttpException failure;
            try {
                HttpResponse<byte[]> response = http.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
                rateLimiter.record(route, method, response.headers().map());

                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return decode(response, responseType, route);
                }

                ErrorKind kind = ErrorKind.of(status);
                if (kind == ErrorKind.RATE_LIMITED) {
                    double retryAfter = retryAfterSeconds(response.body());
                    Log.warn("http.rate_limited", "method", method, "route", route, "retry_after", retryAfter);
                    sleeper.sleep(Duration.ofMillis((long) Math.ceil(retryAfter * 1000)));
                    continue;
                }

                failure = HttpException.forStatus(status, method, route, new String(response.body(), StandardCharsets.UTF_8));
                if (kind.isClientError()) {
                    Log.error("http.request_failed", "method", method, "route", route, "status", status);
                    throw failure;
                }
            } catch (IOException e) {
                failure = new HttpException(ErrorKind.SERVER_ERROR, -1, route, method + " " + route + " failed: " + e.getMessage(), e);
            }

            failures++;
            if (failures >= maxRetries) {
                Log.error("http.retries_exhausted", "method", method, "route", route, "attempts", failures);
                throw HttpException.retriesExhausted(route, failure);
            }

            long delaySeconds = 1 + (failures - 1) * 2L;
            Log.warn("http.retry", "method", method, "route", route, "status", failure.status(),
                "attempt", failures, "delay_s", delaySeconds);
            sleeper.sleep(Duration.ofSeconds(delaySeconds));
        }
    }

    private HttpRequest buildRequest(String method, String route, Object body, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/" + route))
            .timeout(REQUEST_TIMEOUT)
            .header("Authorization", "Bot " + token)
            .header("Content-Type", "application/json")
            .header("User-Agent", USER_AGENT)
            .method(method, bodyPublisher(body));

        for (Map.Entry<String, String> header : headers.entrySet()) {
            String value = header.getValue();
            if (AUDIT_LOG_REASON.equalsIgnoreCase(header.getKey())) {
                value = encodeReason(value);
            }
            builder.header(header.getKey(), value);
        }
        return builder.build();
    }

    private HttpRequest.BodyPublisher bodyPublisher(Object data) {
        if (data == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            return HttpRequest.BodyPublishers.ofString(Json.write(data));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize request body", e);
        }
    }

    private static <T> T decode(HttpResponse<byte[]> response, Class<T> type, String route) {
        byte[] bytes = response.body();
        if (response.statusCode() == 204 || bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            if (type == Object.class) {
                return type.cast(Json.read(bytes));
            }
            return Json.DSL.deserialize(type, bytes, bytes.length);
        } catch (IOException e) {
            throw new HttpException(ErrorKind.SERVER_ERROR, response.statusCode(), route, "Undecodable response body", e);
        }
    }

    static double retryAfterSeconds(byte[] body) {
        try {
            Object decoded = Json.read(body);
            if (decoded instanceof Map<?, ?> map && map.get("retry_after") instanceof Number n) {
                return n.doubleValue();
            }
        } catch (IOException e) {
            Log.warn("http.bad_rate_limit_body", e);
        }
        return DEFAULT_RETRY_AFTER_SECONDS;
    }

    static String encodeReason(String reason) {
        return URLEncoder.encode(reason, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static Map<String, String> reasonHeader(String reason) {
        if (reason == null) {
            return Map.of();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUDIT_LOG_REASON, reason);
        return headers;
    }
}
