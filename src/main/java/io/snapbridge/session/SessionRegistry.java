package io.snapbridge.session;

import io.snapbridge.channel.AgentChannel;
import io.snapbridge.model.AgentMetadata;
import io.snapbridge.model.SessionKey;
import io.snapbridge.model.SessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known agents keyed by {@code browserId:pageId}.
 *
 * <p>All mutation happens under one monitor: channel events from many agents and the
 * liveness sweeper race on the same map. None of the operations block or throw for
 * unknown sessions; heartbeats and disconnects for sessions that are already gone are
 * ignored.
 */
public final class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    public SessionRegistry() {
        this(Clock.systemUTC());
    }

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Inserts or replaces the session for {@code key}; last-seen is set to now.
     */
    public Session upsertOnHello(SessionKey key, AgentMetadata metadata, AgentChannel channel) {
        Session session = new Session(key, metadata == null ? new AgentMetadata(null, null, null) : metadata, channel, nowMs());
        Session previous;
        synchronized (lock) {
            previous = sessions.put(key.sid(), session);
        }
        if (previous != null && previous.channel() != channel) {
            log.debug("Session {} re-bound to channel {}", key.sid(), channel == null ? "-" : channel.id());
        }
        return session;
    }

    /**
     * Refreshes last-seen.
     *
     * @return whether the session existed
     */
    public boolean touch(String sid) {
        if (sid == null) {
            return false;
        }
        long now = nowMs();
        synchronized (lock) {
            Session current = sessions.get(sid);
            if (current == null) {
                return false;
            }
            sessions.put(sid, current.withLastSeen(now));
            return true;
        }
    }

    public boolean remove(String sid) {
        if (sid == null) {
            return false;
        }
        synchronized (lock) {
            return sessions.remove(sid) != null;
        }
    }

    /**
     * Removes the session only while it is still bound to {@code channel}. A page that
     * already re-announced itself on a newer channel keeps its entry.
     */
    public boolean removeIfBoundTo(String sid, AgentChannel channel) {
        if (sid == null || channel == null) {
            return false;
        }
        synchronized (lock) {
            Session current = sessions.get(sid);
            if (current == null || current.channel() != channel) {
                return false;
            }
            sessions.remove(sid);
            return true;
        }
    }

    public Optional<Session> get(String sid) {
        if (sid == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sid));
        }
    }

    /**
     * Session summaries in insertion order. With {@code activeOnly}, keeps sessions seen
     * within {@code windowMs} (inclusive).
     */
    public List<SessionView> list(boolean activeOnly, long windowMs) {
        long now = nowMs();
        long window = Math.max(0L, windowMs);
        List<SessionView> out = new ArrayList<>();
        synchronized (lock) {
            for (Session session : sessions.values()) {
                if (!activeOnly || session.seenWithin(now, window)) {
                    out.add(session.toView());
                }
            }
        }
        return out;
    }

    public int size() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    public int countActive(long windowMs) {
        return list(true, windowMs).size();
    }

    /**
     * Drops every session whose last heartbeat is older than {@code staleAfterMs}.
     *
     * @return the evicted session ids
     */
    public List<String> evictOlderThan(long staleAfterMs) {
        long now = nowMs();
        List<String> evicted = new ArrayList<>();
        synchronized (lock) {
            Iterator<Map.Entry<String, Session>> it = sessions.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Session> entry = it.next();
                if (now - entry.getValue().lastSeenMs() > staleAfterMs) {
                    it.remove();
                    evicted.add(entry.getKey());
                }
            }
        }
        return evicted;
    }

    public List<Session> clear() {
        synchronized (lock) {
            List<Session> out = new ArrayList<>(sessions.values());
            sessions.clear();
            return out;
        }
    }

    long nowMs() {
        return clock.millis();
    }
}
