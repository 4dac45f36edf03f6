package io.snapbridge.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.snapbridge.channel.ChannelEventRouter;
import io.snapbridge.channel.SseAgentChannel;
import io.snapbridge.dispatch.DispatchException;
import io.snapbridge.model.AgentReply;
import io.snapbridge.model.DataKind;
import io.snapbridge.model.NetworkSnapshot;
import io.snapbridge.model.PingOutcome;
import io.snapbridge.model.Screenshot;
import io.snapbridge.model.SessionKey;
import io.snapbridge.observability.PrometheusFormatter;
import io.snapbridge.runtime.SnapBridgeRuntime;
import io.snapbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP surface of the broker.
 *
 * <p>Operator routes ({@code sessions}, {@code dump}, {@code html}, {@code console},
 * {@code network}, {@code screenshot}, {@code ping}) pass straight through to the runtime.
 * Agents hold a {@code channel} event stream open for commands and post their events to
 * {@code events}. Every handler blocks at most for its wait budget, so exchanges run on
 * an unbounded pool.
 */
public final class SnapApiServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SnapApiServer.class);

    private final SnapBridgeRuntime runtime;
    private final HttpServer server;
    private final ExecutorService executor;
    private final String basePath;

    public SnapApiServer(SnapBridgeRuntime runtime, InetSocketAddress address) throws IOException {
        this.runtime = runtime;
        this.basePath = runtime.config().basePath();
        this.server = HttpServer.create(address, 0);
        this.executor = Executors.newCachedThreadPool(namedThreads("snapbridge-http-"));
        registerRoutes();
        server.setExecutor(executor);
    }

    public SnapApiServer start() {
        runtime.start();
        server.start();
        log.info("Snap API listening on {}", baseUrl());
        return this;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String baseUrl() {
        String host = server.getAddress().getAddress().isAnyLocalAddress()
                ? "127.0.0.1"
                : server.getAddress().getHostString();
        return "http://" + host + ":" + port() + basePath;
    }

    public void stop() {
        runtime.stop();
        server.stop(0);
        executor.shutdownNow();
        log.info("Snap API stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void registerRoutes() {
        route("/sessions", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            Map<String, String> q = parseQuery(exchange.getRequestURI());
            String activeMsRaw = q.get("activeMs");
            boolean activeOnly = isTruthy(q.get("active")) || activeMsRaw != null;
            Long activeMs = activeMsRaw == null ? null : Math.max(0L, parseLong(activeMsRaw, "activeMs"));
            writeJson(exchange, Map.of("sessions", runtime.sessions(activeOnly, activeMs)), 200);
        });
        route("/dump", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            JsonNode body = Jsons.readTree(readBody(exchange));
            String sid = requireSid(Jsons.text(body, "sid"));
            Set<DataKind> kinds = parseKinds(body.get("types"));
            JsonNode waitNode = body.get("waitMs");
            Long waitMs = waitNode == null || waitNode.isNull() ? null : waitNode.asLong();
            AgentReply reply = runtime.dump(sid, kinds, waitMs);
            writeJson(exchange, reply, 200);
        });
        route("/html", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            String sid = requireSid(parseQuery(exchange.getRequestURI()).get("sid"));
            writeBytes(exchange, "text/html; charset=utf-8", runtime.html(sid).getBytes(StandardCharsets.UTF_8), 200);
        });
        route("/console", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            String sid = requireSid(parseQuery(exchange.getRequestURI()).get("sid"));
            writeJson(exchange, runtime.console(sid), 200);
        });
        route("/network", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            String sid = requireSid(parseQuery(exchange.getRequestURI()).get("sid"));
            NetworkSnapshot snapshot = runtime.network(sid);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("logs", snapshot.logs());
            out.put("perf", snapshot.perf());
            writeJson(exchange, out, 200);
        });
        route("/screenshot", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            String sid = requireSid(parseQuery(exchange.getRequestURI()).get("sid"));
            Optional<Screenshot> screenshot;
            try {
                screenshot = runtime.screenshot(sid);
            } catch (IllegalStateException e) {
                writeBytes(exchange, "text/plain; charset=utf-8", e.getMessage().getBytes(StandardCharsets.UTF_8), 500);
                return;
            }
            if (screenshot.isEmpty()) {
                writeBytes(exchange, "text/plain; charset=utf-8", "no screenshot".getBytes(StandardCharsets.UTF_8), 404);
                return;
            }
            writeBytes(exchange, screenshot.get().mimeType(), screenshot.get().bytes(), 200);
        });
        route("/ping", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            Map<String, String> q = parseQuery(exchange.getRequestURI());
            String sid = requireSid(q.get("sid"));
            String waitRaw = q.get("waitMs");
            PingOutcome outcome = runtime.ping(sid, waitRaw == null ? null : parseLong(waitRaw, "waitMs"));
            writeJson(exchange, outcome, 200);
        });
        route("/events", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            JsonNode body = Jsons.readTree(readBody(exchange));
            String type = Jsons.text(body, "type");
            JsonNode data = body.has("data") ? body.get("data") : body;
            ChannelEventRouter.Outcome outcome;
            try {
                outcome = runtime.onEvent(type, data);
            } catch (IllegalStateException e) {
                writeError(exchange, 409, "conflict", e.getMessage());
                return;
            }
            writeJson(exchange, Map.of("ok", true, "outcome", outcome.name().toLowerCase(Locale.ROOT)), 200);
        });
        route("/metrics", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            byte[] body = PrometheusFormatter.format(runtime.stats()).getBytes(StandardCharsets.UTF_8);
            writeBytes(exchange, "text/plain; version=0.0.4; charset=utf-8", body, 200);
        });
        route("/health", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            SnapBridgeRuntime.StatsOutcome stats = runtime.stats();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", runtime.isRunning() ? "ok" : "stopped");
            out.put("sessions", stats.sessionsTotal());
            out.put("pending", stats.pendingRequests());
            writeJson(exchange, out, 200);
        });
        server.createContext(basePath + "/channel", this::serveChannel);
    }

    /**
     * Holds an agent's event stream open until the agent goes away or the broker stops.
     * The agent announces itself with a hello once it has seen {@code snap:ready}.
     */
    private void serveChannel(HttpExchange exchange) throws IOException {
        if (!allowMethods(exchange, "GET")) return;
        Map<String, String> q = parseQuery(exchange.getRequestURI());
        SessionKey key;
        try {
            key = new SessionKey(q.get("browserId"), q.get("pageId"));
        } catch (IllegalArgumentException e) {
            writeError(exchange, 400, "bad_request", e.getMessage());
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody()) {
            SseAgentChannel channel = new SseAgentChannel("ch_" + UUID.randomUUID(), os);
            runtime.channelOpened(key, channel);
            try {
                channel.send("ready", Map.of("sid", key.sid()));
                channel.awaitClosed();
            } catch (IOException e) {
                log.debug("Channel {} for {} failed on open: {}", channel.id(), key.sid(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                runtime.channelClosed(key, channel);
            }
        } catch (IOException e) {
            log.debug("Channel stream for {} ended: {}", key.sid(), e.getMessage());
        }
    }

    private void route(String path, ExchangeHandler handler) {
        String fullPath = basePath + path;
        server.createContext(fullPath, exchange -> {
            try {
                if (!fullPath.equals(exchange.getRequestURI().getPath())) {
                    writeError(exchange, 404, "not_found", "no route for " + exchange.getRequestURI().getPath());
                    return;
                }
                handler.handle(exchange);
            } catch (DispatchException e) {
                writeError(exchange, statusFor(e.kind()), e.kind().name().toLowerCase(Locale.ROOT), e.getMessage());
            } catch (IllegalArgumentException e) {
                writeError(exchange, 400, "bad_request", e.getMessage());
            } catch (Exception e) {
                log.warn("Request {} {} failed", exchange.getRequestMethod(), fullPath, e);
                writeError(exchange, 500, "internal", e.getMessage() == null ? e.toString() : e.getMessage());
            } finally {
                exchange.close();
            }
        });
    }

    static int statusFor(DispatchException.Kind kind) {
        return switch (kind) {
            case UNKNOWN_SESSION -> 404;
            case TIMEOUT -> 504;
            case AGENT_FAILURE -> 502;
            case CHANNEL_CLOSED, STOPPED -> 503;
        };
    }

    static Set<DataKind> parseKinds(JsonNode types) {
        if (types == null || types.isNull()) {
            return DataKind.all();
        }
        if (types.isTextual()) {
            return DataKind.parseCsv(types.asText());
        }
        if (!types.isArray()) {
            throw new IllegalArgumentException("types must be an array of data kinds");
        }
        List<String> names = new ArrayList<>();
        types.forEach(node -> names.add(node.asText()));
        return DataKind.parseAll(names);
    }

    private static String requireSid(String sid) {
        if (sid == null || sid.isBlank()) {
            throw new IllegalArgumentException("sid is required");
        }
        return sid.trim();
    }

    private static boolean isTruthy(String raw) {
        return raw != null && ("1".equals(raw.trim()) || "true".equalsIgnoreCase(raw.trim()));
    }

    private static long parseLong(String raw, String name) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + raw);
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.putIfAbsent(
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return out;
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeError(exchange, 405, "method_not_allowed", "method not allowed: " + method);
        return false;
    }

    private static void writeError(HttpExchange exchange, int status, String kind, String message) throws IOException {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("error", message);
        body.put("kind", kind);
        writeJson(exchange, body, status);
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        writeBytes(exchange, "application/json; charset=utf-8", Jsons.toJson(body).getBytes(StandardCharsets.UTF_8), status);
    }

    private static void writeBytes(HttpExchange exchange, String contentType, byte[] bytes, int status) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws Exception;
    }
}
