package io.snapbridge.model;

import com.fasterxml.jackson.databind.JsonNode;

public record PingOutcome(boolean ok, long rttMs, JsonNode payload) {
}
