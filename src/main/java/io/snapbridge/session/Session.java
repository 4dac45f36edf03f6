package io.snapbridge.session;

import io.snapbridge.channel.AgentChannel;
import io.snapbridge.model.AgentMetadata;
import io.snapbridge.model.SessionKey;
import io.snapbridge.model.SessionView;

public record Session(
        SessionKey key,
        AgentMetadata metadata,
        AgentChannel channel,
        long lastSeenMs
) {
    public String sid() {
        return key.sid();
    }

    Session withLastSeen(long nowMs) {
        return new Session(key, metadata, channel, nowMs);
    }

    boolean seenWithin(long nowMs, long windowMs) {
        return nowMs - lastSeenMs <= windowMs;
    }

    public SessionView toView() {
        return new SessionView(
                sid(),
                key.browserId(),
                key.pageId(),
                metadata.href(),
                metadata.title(),
                metadata.userAgent(),
                lastSeenMs
        );
    }
}
