package io.snapbridge.dispatch;

import io.snapbridge.model.AgentReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Outstanding requests keyed by request id, each with a deadline.
 *
 * <p>Removal from the map under {@code lock} decides the single outcome of a request:
 * whichever of reply, explicit failure or deadline removes the entry first delivers its
 * outcome; the others find nothing and do nothing. Waiters are independent of session
 * lifetime.
 */
public final class CorrelationTable {
    private static final Logger log = LoggerFactory.getLogger(CorrelationTable.class);

    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();
    private final Map<String, Waiter> waiters = new HashMap<>();
    private final AtomicLong resolvedTotal = new AtomicLong(0L);
    private final AtomicLong rejectedTotal = new AtomicLong(0L);
    private final AtomicLong timeoutTotal = new AtomicLong(0L);
    private final AtomicLong droppedTotal = new AtomicLong(0L);

    public CorrelationTable(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Stores a waiter and arms its deadline. On expiry {@code onReject} receives a
     * {@link DispatchException.Kind#TIMEOUT} failure.
     *
     * @throws IllegalStateException if {@code reqId} is already pending
     */
    public void register(
            String reqId,
            Consumer<AgentReply> onResolve,
            Consumer<DispatchException> onReject,
            long timeoutMs
    ) {
        if (reqId == null || reqId.isBlank()) {
            throw new IllegalArgumentException("reqId cannot be empty");
        }
        long deadlineMs = Math.max(1L, timeoutMs);
        Waiter waiter = new Waiter(reqId, onResolve, onReject);
        synchronized (lock) {
            if (waiters.containsKey(reqId)) {
                throw new IllegalStateException("duplicate request id: " + reqId);
            }
            waiters.put(reqId, waiter);
        }
        try {
            waiter.deadline = scheduler.schedule(() -> expire(reqId, deadlineMs), deadlineMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reject(reqId, new DispatchException(DispatchException.Kind.STOPPED, "broker stopped", e));
        }
    }

    /**
     * Registers a waiter completing the returned future.
     */
    public CompletableFuture<AgentReply> await(String reqId, long timeoutMs) {
        CompletableFuture<AgentReply> future = new CompletableFuture<>();
        register(reqId, future::complete, future::completeExceptionally, timeoutMs);
        return future;
    }

    /**
     * Delivers a reply. Unknown or already settled ids are dropped silently.
     *
     * @return whether a pending waiter received the reply
     */
    public boolean resolve(String reqId, AgentReply reply) {
        Waiter waiter = take(reqId);
        if (waiter == null) {
            droppedTotal.incrementAndGet();
            log.debug("Dropping reply for unknown or settled request {}", reqId);
            return false;
        }
        resolvedTotal.incrementAndGet();
        waiter.cancelDeadline();
        try {
            waiter.onResolve.accept(reply);
        } catch (RuntimeException e) {
            log.warn("Resolve callback failed for request {}", reqId, e);
        }
        return true;
    }

    /**
     * Fails a pending request explicitly. Same no-op rules as {@link #resolve}.
     */
    public boolean reject(String reqId, DispatchException error) {
        Waiter waiter = take(reqId);
        if (waiter == null) {
            droppedTotal.incrementAndGet();
            return false;
        }
        rejectedTotal.incrementAndGet();
        waiter.cancelDeadline();
        fail(waiter, error);
        return true;
    }

    /**
     * Fails every pending request, used on shutdown.
     */
    public int rejectAll(DispatchException error) {
        List<Waiter> drained;
        synchronized (lock) {
            drained = new ArrayList<>(waiters.values());
            waiters.clear();
        }
        for (Waiter waiter : drained) {
            rejectedTotal.incrementAndGet();
            waiter.cancelDeadline();
            fail(waiter, error);
        }
        return drained.size();
    }

    public boolean isPending(String reqId) {
        synchronized (lock) {
            return waiters.containsKey(reqId);
        }
    }

    public int pending() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public long resolvedTotal() {
        return resolvedTotal.get();
    }

    public long rejectedTotal() {
        return rejectedTotal.get();
    }

    public long timeoutTotal() {
        return timeoutTotal.get();
    }

    public long droppedTotal() {
        return droppedTotal.get();
    }

    private void expire(String reqId, long timeoutMs) {
        Waiter waiter = take(reqId);
        if (waiter == null) {
            return;
        }
        timeoutTotal.incrementAndGet();
        log.debug("Request {} timed out after {}ms", reqId, timeoutMs);
        fail(waiter, DispatchException.timeout(reqId, timeoutMs));
    }

    private Waiter take(String reqId) {
        if (reqId == null) {
            return null;
        }
        synchronized (lock) {
            return waiters.remove(reqId);
        }
    }

    private static void fail(Waiter waiter, DispatchException error) {
        try {
            waiter.onReject.accept(error);
        } catch (RuntimeException e) {
            log.warn("Reject callback failed for request {}", waiter.reqId, e);
        }
    }

    private static final class Waiter {
        private final String reqId;
        private final Consumer<AgentReply> onResolve;
        private final Consumer<DispatchException> onReject;
        private volatile ScheduledFuture<?> deadline;

        private Waiter(String reqId, Consumer<AgentReply> onResolve, Consumer<DispatchException> onReject) {
            this.reqId = reqId;
            this.onResolve = onResolve;
            this.onReject = onReject;
        }

        private void cancelDeadline() {
            ScheduledFuture<?> current = deadline;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
