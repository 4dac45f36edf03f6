package io.snapbridge.channel;

import io.snapbridge.model.SessionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Open agent channels by session id. A channel is opened before the agent's hello and
 * the hello binds it to a registry entry.
 */
public final class ChannelHub {
    private static final Logger log = LoggerFactory.getLogger(ChannelHub.class);

    private final Object lock = new Object();
    private final Map<String, AgentChannel> channels = new LinkedHashMap<>();
    private ScheduledFuture<?> keepAliveTask;

    /**
     * Registers {@code channel} for the key, closing any channel it replaces.
     */
    public void open(SessionKey key, AgentChannel channel) {
        AgentChannel previous;
        synchronized (lock) {
            previous = channels.put(key.sid(), channel);
        }
        if (previous != null && previous != channel) {
            previous.close();
        }
        log.debug("Channel {} opened for {}", channel.id(), key.sid());
    }

    public Optional<AgentChannel> find(String sid) {
        if (sid == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            AgentChannel channel = channels.get(sid);
            return channel != null && channel.isOpen() ? Optional.of(channel) : Optional.empty();
        }
    }

    /**
     * Forgets {@code channel} if it is still the one registered for {@code sid}.
     */
    public boolean release(String sid, AgentChannel channel) {
        synchronized (lock) {
            if (channels.get(sid) != channel) {
                return false;
            }
            channels.remove(sid);
            return true;
        }
    }

    public int openCount() {
        synchronized (lock) {
            return channels.size();
        }
    }

    public synchronized void startKeepAlive(ScheduledExecutorService scheduler, long intervalMs) {
        if (keepAliveTask != null) {
            return;
        }
        long interval = Math.max(1L, intervalMs);
        keepAliveTask = scheduler.scheduleWithFixedDelay(this::keepAliveOnce, interval, interval, TimeUnit.MILLISECONDS);
    }

    public synchronized void stopKeepAlive() {
        if (keepAliveTask != null) {
            keepAliveTask.cancel(false);
            keepAliveTask = null;
        }
    }

    /**
     * Writes a keep-alive on every open channel; channels whose write fails close themselves.
     */
    public int keepAliveOnce() {
        int failed = 0;
        for (AgentChannel channel : snapshot()) {
            try {
                channel.keepAlive();
            } catch (IOException e) {
                failed++;
                log.debug("Keep-alive failed on channel {}: {}", channel.id(), e.getMessage());
            }
        }
        return failed;
    }

    public void closeAll() {
        List<AgentChannel> open;
        synchronized (lock) {
            open = new ArrayList<>(channels.values());
            channels.clear();
        }
        for (AgentChannel channel : open) {
            channel.close();
        }
    }

    private List<AgentChannel> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(channels.values());
        }
    }
}
