package io.snapbridge.model;

public record SessionView(
        String sid,
        String browserId,
        String pageId,
        String url,
        String title,
        String ua,
        long lastSeen
) {
}
