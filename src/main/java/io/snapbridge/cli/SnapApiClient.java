package io.snapbridge.cli;

import io.snapbridge.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Minimal HTTP client for a running broker's operator routes.
 */
final class SnapApiClient {
    // Broker-side wait budgets are capped; leave room for them plus transfer.
    private static final Duration REQUEST_SLACK = Duration.ofSeconds(10);

    private final String baseUrl;
    private final HttpClient http;

    SnapApiClient(String baseUrl) {
        String normalized = baseUrl == null || baseUrl.isBlank() ? "http://127.0.0.1:5178/__snap" : baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        this.baseUrl = normalized;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    Response get(String path, Map<String, String> query, long waitMs) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path + encodeQuery(query)))
                .timeout(Duration.ofMillis(Math.max(0L, waitMs)).plus(REQUEST_SLACK))
                .GET()
                .build();
        return send(request);
    }

    Response postJson(String path, Object body, long waitMs) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofMillis(Math.max(0L, waitMs)).plus(REQUEST_SLACK))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8))
                .build();
        return send(request);
    }

    private Response send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<byte[]> response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        return new Response(response.statusCode(), contentType, response.body());
    }

    static String encodeQuery(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> e : query.entrySet()) {
            if (e.getValue() == null) {
                continue;
            }
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        String out = joiner.toString();
        return "?".equals(out) ? "" : out;
    }

    record Response(int status, String contentType, byte[] body) {
        boolean ok() {
            return status >= 200 && status < 300;
        }

        String text() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
