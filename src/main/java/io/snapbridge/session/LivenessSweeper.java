package io.snapbridge.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic backstop that evicts sessions with no heartbeat for {@code staleAfterMs}.
 * Pending requests addressed to an evicted session are left alone and time out on
 * their own deadline.
 */
public final class LivenessSweeper {
    private static final Logger log = LoggerFactory.getLogger(LivenessSweeper.class);

    private final SessionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final long staleAfterMs;
    private final AtomicLong evictedTotal = new AtomicLong(0L);
    private ScheduledFuture<?> task;

    public LivenessSweeper(SessionRegistry registry, ScheduledExecutorService scheduler, long intervalMs, long staleAfterMs) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.intervalMs = Math.max(1L, intervalMs);
        this.staleAfterMs = Math.max(0L, staleAfterMs);
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::sweepOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    /**
     * Runs one eviction pass. Never throws: a failing pass is logged and the next one
     * runs on schedule.
     *
     * @return number of sessions evicted
     */
    public int sweepOnce() {
        try {
            List<String> evicted = registry.evictOlderThan(staleAfterMs);
            if (!evicted.isEmpty()) {
                evictedTotal.addAndGet(evicted.size());
                log.info("Evicted {} stale session(s): {}", evicted.size(), evicted);
            }
            return evicted.size();
        } catch (RuntimeException e) {
            log.warn("Session sweep failed", e);
            return 0;
        }
    }

    public long evictedTotal() {
        return evictedTotal.get();
    }
}
