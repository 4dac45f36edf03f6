package io.snapbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Reply envelope sent back by an agent for a dump or ping, matched by {@code reqId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentReply(
        String reqId,
        boolean ok,
        JsonNode payload,
        String error
) {
    public static AgentReply fromEvent(JsonNode data) {
        String reqId = data.path("reqId").asText(null);
        JsonNode okNode = data.get("ok");
        boolean ok = okNode == null || okNode.isNull() || okNode.asBoolean(true);
        JsonNode payload = data.get("payload");
        JsonNode errorNode = data.get("error");
        String error = errorNode == null || errorNode.isNull()
                ? null
                : errorNode.isValueNode() ? errorNode.asText() : errorNode.toString();
        return new AgentReply(reqId, ok, payload, error);
    }

    /**
     * Sub-payload by field name, or a missing node when absent.
     */
    public JsonNode part(String field) {
        if (payload == null || !payload.isObject()) {
            return MissingNode.getInstance();
        }
        return payload.path(field);
    }
}
