package io.snapbridge.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.snapbridge.config.SnapBridgeConfig;
import io.snapbridge.dispatch.DispatchException;
import io.snapbridge.runtime.SnapBridgeRuntime;
import io.snapbridge.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class SnapApiServerTest {
    private final HttpClient http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private SnapApiServer server;

    @BeforeEach
    void startServer() throws Exception {
        SnapBridgeConfig config = new SnapBridgeConfig(
                "127.0.0.1",
                0,
                "/__snap",
                45_000L,
                15_000L,
                60_000L,
                300_000L,
                2_000L,
                2_000L,
                10_000L,
                60_000L
        );
        server = new SnapApiServer(new SnapBridgeRuntime(config), new InetSocketAddress("127.0.0.1", 0)).start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    @Test
    void connectedAgentIsListedAndAnswersDump() throws Exception {
        FakeAgent agent = FakeAgent.connect(this, "b1", "p1");

        JsonNode sessions = Jsons.readTree(get("/sessions?active=1").body());
        Assertions.assertEquals(1, sessions.path("sessions").size());
        JsonNode view = sessions.path("sessions").get(0);
        Assertions.assertEquals("b1:p1", view.path("sid").asText());
        Assertions.assertEquals("http://localhost:5173/", view.path("url").asText());
        Assertions.assertEquals("FakeAgent/1.0", view.path("ua").asText());

        HttpResponse<String> dump = post("/dump", "{\"sid\":\"b1:p1\",\"types\":[\"html\",\"console\"],\"waitMs\":2000}");
        Assertions.assertEquals(200, dump.statusCode());
        JsonNode reply = Jsons.readTree(dump.body());
        Assertions.assertTrue(reply.path("ok").asBoolean());
        Assertions.assertEquals("<html><body>fake</body></html>", reply.path("payload").path("html").asText());
        Assertions.assertEquals("[\"html\",\"console\"]", reply.path("payload").path("requested").toString());
        Assertions.assertTrue(agent.acked.await(2, TimeUnit.SECONDS));
    }

    @Test
    void convenienceRoutesShapeAgentPayloads() throws Exception {
        FakeAgent.connect(this, "b1", "p1");

        HttpResponse<String> html = get("/html?sid=b1%3Ap1");
        Assertions.assertEquals(200, html.statusCode());
        Assertions.assertTrue(html.headers().firstValue("Content-Type").orElse("").startsWith("text/html"));
        Assertions.assertEquals("<html><body>fake</body></html>", html.body());

        JsonNode console = Jsons.readTree(get("/console?sid=b1:p1").body());
        Assertions.assertEquals("log", console.get(0).path("level").asText());

        JsonNode network = Jsons.readTree(get("/network?sid=b1:p1").body());
        Assertions.assertEquals(0, network.path("logs").size());
        Assertions.assertEquals(1, network.path("perf").size());

        HttpResponse<byte[]> screenshot = http.send(
                request("/screenshot?sid=b1:p1").GET().build(),
                HttpResponse.BodyHandlers.ofByteArray()
        );
        Assertions.assertEquals(200, screenshot.statusCode());
        Assertions.assertEquals("image/png", screenshot.headers().firstValue("Content-Type").orElse(""));
        Assertions.assertEquals("png-bytes", new String(screenshot.body(), StandardCharsets.UTF_8));

        JsonNode ping = Jsons.readTree(get("/ping?sid=b1:p1").body());
        Assertions.assertTrue(ping.path("ok").asBoolean());
        Assertions.assertTrue(ping.path("rttMs").asLong() < 1_000L);
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        HttpResponse<String> response = post("/dump", "{\"sid\":\"nobody:home\"}");

        Assertions.assertEquals(404, response.statusCode());
        Assertions.assertEquals("unknown_session", Jsons.readTree(response.body()).path("kind").asText());
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        Assertions.assertEquals(400, post("/dump", "{\"sid\":\"b1:p1\",\"types\":[\"cookies\"]}").statusCode());
        Assertions.assertEquals(400, post("/dump", "{not json").statusCode());
        Assertions.assertEquals(400, get("/html").statusCode());
        Assertions.assertEquals(405, get("/dump").statusCode());
        Assertions.assertEquals(400, post("/events", "{\"type\":\"teleport\",\"data\":{}}").statusCode());
        Assertions.assertEquals(404, get("/sessions/extra").statusCode());
    }

    @Test
    void helloWithoutChannelConflicts() throws Exception {
        HttpResponse<String> response = post("/events", "{\"type\":\"hello\",\"data\":{\"browserId\":\"b9\",\"pageId\":\"p9\"}}");

        Assertions.assertEquals(409, response.statusCode());
        Assertions.assertEquals(0, Jsons.readTree(get("/sessions").body()).path("sessions").size());
    }

    @Test
    void metricsExposeCounters() throws Exception {
        FakeAgent.connect(this, "b1", "p1");
        post("/dump", "{\"sid\":\"b1:p1\",\"types\":\"html\"}");
        post("/dump", "{\"sid\":\"ghost:tab\"}");

        HttpResponse<String> metrics = get("/metrics");

        Assertions.assertEquals(200, metrics.statusCode());
        Assertions.assertTrue(metrics.body().contains("snapbridge_sessions{state=\"all\"} 1"));
        Assertions.assertTrue(metrics.body().contains("snapbridge_channels_open 1"));
        Assertions.assertTrue(metrics.body().contains("snapbridge_request_outcomes_total{outcome=\"resolved\"} 1"));
        Assertions.assertTrue(metrics.body().contains("snapbridge_unknown_session_total 1"));
        Assertions.assertEquals("ok", Jsons.readTree(get("/health").body()).path("status").asText());
    }

    @Test
    void statusCodesFollowFailureKind() {
        Assertions.assertEquals(404, SnapApiServer.statusFor(DispatchException.Kind.UNKNOWN_SESSION));
        Assertions.assertEquals(504, SnapApiServer.statusFor(DispatchException.Kind.TIMEOUT));
        Assertions.assertEquals(502, SnapApiServer.statusFor(DispatchException.Kind.AGENT_FAILURE));
        Assertions.assertEquals(503, SnapApiServer.statusFor(DispatchException.Kind.CHANNEL_CLOSED));
        Assertions.assertEquals(503, SnapApiServer.statusFor(DispatchException.Kind.STOPPED));
    }

    HttpResponse<String> get(String path) throws Exception {
        return http.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    HttpResponse<String> post(String path, String json) throws Exception {
        return http.send(
                request(path).header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                        .build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(server.baseUrl() + path)).timeout(Duration.ofSeconds(10));
    }

    /**
     * Browser stand-in: reads the command stream and posts replies back to the events route.
     */
    private static final class FakeAgent {
        private final SnapApiServerTest test;
        private final String browserId;
        private final String pageId;
        private final CountDownLatch acked = new CountDownLatch(1);

        private FakeAgent(SnapApiServerTest test, String browserId, String pageId) {
            this.test = test;
            this.browserId = browserId;
            this.pageId = pageId;
        }

        static FakeAgent connect(SnapApiServerTest test, String browserId, String pageId) throws Exception {
            FakeAgent agent = new FakeAgent(test, browserId, pageId);
            HttpResponse<Stream<String>> stream = test.http.send(
                    HttpRequest.newBuilder(URI.create(test.server.baseUrl() + "/channel?browserId=" + browserId + "&pageId=" + pageId))
                            .header("Accept", "text/event-stream")
                            .GET()
                            .build(),
                    HttpResponse.BodyHandlers.ofLines()
            );
            Assertions.assertEquals(200, stream.statusCode());
            Thread reader = new Thread(() -> agent.read(stream.body()), "fake-agent-" + browserId + "-" + pageId);
            reader.setDaemon(true);
            reader.start();
            Assertions.assertTrue(agent.acked.await(5, TimeUnit.SECONDS), "agent was not acknowledged");
            return agent;
        }

        private void read(Stream<String> lines) {
            String[] event = new String[1];
            try {
                lines.forEach(line -> {
                    if (line.startsWith("event: ")) {
                        event[0] = line.substring("event: ".length());
                    } else if (line.startsWith("data: ") && event[0] != null) {
                        handle(event[0], Jsons.readTree(line.substring("data: ".length())));
                        event[0] = null;
                    }
                });
            } catch (RuntimeException ignored) {
                // stream torn down with the server
            }
        }

        private void handle(String event, JsonNode data) {
            try {
                switch (event) {
                    case "snap:ready" -> post("hello", Jsons.mapper().createObjectNode()
                            .put("browserId", browserId)
                            .put("pageId", pageId)
                            .put("href", "http://localhost:5173/")
                            .put("title", "Fake")
                            .put("userAgent", "FakeAgent/1.0"));
                    case "snap:ack" -> acked.countDown();
                    case "snap:dump" -> post("dumpResult", reply(data, dumpPayload(data.path("types"))));
                    case "snap:ping" -> post("pingResult", reply(data, Jsons.mapper().createObjectNode().put("visible", true)));
                    default -> {
                    }
                }
            } catch (Exception e) {
                throw new IllegalStateException("fake agent failed on " + event, e);
            }
        }

        private void post(String type, ObjectNode data) throws Exception {
            ObjectNode body = Jsons.mapper().createObjectNode().put("type", type);
            body.set("data", data);
            HttpResponse<String> response = test.post("/events", Jsons.toJson(body));
            Assertions.assertEquals(200, response.statusCode(), response.body());
        }

        private static ObjectNode reply(JsonNode request, ObjectNode payload) {
            ObjectNode reply = Jsons.mapper().createObjectNode()
                    .put("reqId", request.path("reqId").asText())
                    .put("ok", true);
            reply.set("payload", payload);
            return reply;
        }

        private static ObjectNode dumpPayload(JsonNode types) {
            ObjectNode payload = Jsons.mapper().createObjectNode();
            payload.set("requested", types);
            for (JsonNode type : types) {
                switch (type.asText()) {
                    case "html" -> payload.put("html", "<html><body>fake</body></html>");
                    case "console" -> payload.putArray("console").addObject().put("level", "log").put("text", "hello");
                    case "perf" -> payload.putArray("perf").addObject().put("name", "first-paint");
                    case "screenshotDom" -> payload.put("screenshotDom", "data:image/png;base64,"
                            + Base64.getEncoder().encodeToString("png-bytes".getBytes(StandardCharsets.UTF_8)));
                    default -> {
                    }
                }
            }
            return payload;
        }
    }
}
