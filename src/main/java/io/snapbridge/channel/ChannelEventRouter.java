package io.snapbridge.channel;

import com.fasterxml.jackson.databind.JsonNode;
import io.snapbridge.dispatch.CorrelationTable;
import io.snapbridge.dispatch.DispatchException;
import io.snapbridge.model.AgentMetadata;
import io.snapbridge.model.AgentReply;
import io.snapbridge.model.SessionKey;
import io.snapbridge.session.SessionRegistry;
import io.snapbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies inbound agent events to the session registry and the correlation table.
 *
 * <p>Events that reference unknown sessions or request ids are accepted and ignored;
 * only an unrecognized event type or a hello without identity is a caller error.
 */
public final class ChannelEventRouter {
    private static final Logger log = LoggerFactory.getLogger(ChannelEventRouter.class);

    public enum Outcome {
        APPLIED,
        IGNORED
    }

    private final SessionRegistry registry;
    private final CorrelationTable table;
    private final ChannelHub hub;
    private final long heartbeatIntervalMs;
    private final AtomicLong byeTotal = new AtomicLong(0L);
    private final AtomicLong agentFailureTotal = new AtomicLong(0L);

    public ChannelEventRouter(SessionRegistry registry, CorrelationTable table, ChannelHub hub, long heartbeatIntervalMs) {
        this.registry = registry;
        this.table = table;
        this.hub = hub;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public Outcome handle(String type, JsonNode data) {
        String event = normalizeType(type);
        JsonNode body = data == null ? Jsons.mapper().createObjectNode() : data;
        return switch (event) {
            case "hello" -> hello(body);
            case "pong" -> pong(body);
            case "dumpresult", "pingresult" -> result(body);
            case "bye" -> bye(body);
            default -> throw new IllegalArgumentException("unknown event type: " + type);
        };
    }

    private Outcome hello(JsonNode body) {
        SessionKey key = new SessionKey(Jsons.text(body, "browserId"), Jsons.text(body, "pageId"));
        AgentChannel channel = hub.find(key.sid())
                .orElseThrow(() -> new IllegalStateException("no open channel for session " + key.sid()));
        String ua = Jsons.text(body, "userAgent");
        AgentMetadata metadata = new AgentMetadata(
                Jsons.text(body, "href"),
                Jsons.text(body, "title"),
                ua == null ? Jsons.text(body, "ua") : ua
        );
        registry.upsertOnHello(key, metadata, channel);
        log.info("Session {} connected ({})", key.sid(), metadata.href());
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("sid", key.sid());
        ack.put("heartbeatMs", heartbeatIntervalMs);
        try {
            channel.send("ack", ack);
        } catch (IOException e) {
            log.warn("Failed to acknowledge hello for {}: {}", key.sid(), e.getMessage());
        }
        return Outcome.APPLIED;
    }

    private Outcome pong(JsonNode body) {
        String sid = Jsons.text(body, "sid");
        if (registry.touch(sid)) {
            return Outcome.APPLIED;
        }
        log.debug("Ignoring pong for unknown session {}", sid);
        return Outcome.IGNORED;
    }

    private Outcome result(JsonNode body) {
        AgentReply reply = AgentReply.fromEvent(body);
        if (reply.reqId() == null || reply.reqId().isBlank()) {
            return Outcome.IGNORED;
        }
        boolean delivered;
        if (reply.ok()) {
            delivered = table.resolve(reply.reqId(), reply);
        } else {
            delivered = table.reject(reply.reqId(), DispatchException.agentFailure(reply.error()));
            if (delivered) {
                agentFailureTotal.incrementAndGet();
            }
        }
        return delivered ? Outcome.APPLIED : Outcome.IGNORED;
    }

    private Outcome bye(JsonNode body) {
        String sid = Jsons.text(body, "sid");
        if (!registry.remove(sid)) {
            return Outcome.IGNORED;
        }
        byeTotal.incrementAndGet();
        log.info("Session {} said bye", sid);
        return Outcome.APPLIED;
    }

    static String normalizeType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("event type cannot be empty");
        }
        String value = type.trim();
        if (value.regionMatches(true, 0, SseAgentChannel.EVENT_PREFIX, 0, SseAgentChannel.EVENT_PREFIX.length())) {
            value = value.substring(SseAgentChannel.EVENT_PREFIX.length());
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public long byeTotal() {
        return byeTotal.get();
    }

    public long agentFailureTotal() {
        return agentFailureTotal.get();
    }
}
