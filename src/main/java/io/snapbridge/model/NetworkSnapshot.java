package io.snapbridge.model;

import com.fasterxml.jackson.databind.JsonNode;

public record NetworkSnapshot(JsonNode logs, JsonNode perf) {
}
