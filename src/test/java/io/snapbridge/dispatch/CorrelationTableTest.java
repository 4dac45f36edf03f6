package io.snapbridge.dispatch;

import io.snapbridge.model.AgentReply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class CorrelationTableTest {
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    private final CorrelationTable table = new CorrelationTable(scheduler);

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @Test
    void resolveDeliversReplyAndRemovesWaiter() throws Exception {
        CompletableFuture<AgentReply> future = table.await("req-1", 5_000L);
        AgentReply reply = new AgentReply("req-1", true, null, null);

        Assertions.assertTrue(table.resolve("req-1", reply));
        Assertions.assertSame(reply, future.get(1, TimeUnit.SECONDS));
        Assertions.assertEquals(0, table.pending());
        Assertions.assertFalse(table.resolve("req-1", reply), "second reply is dropped");
        Assertions.assertEquals(1L, table.droppedTotal());
    }

    @Test
    void deadlineRejectsWithTimeout() {
        CompletableFuture<AgentReply> future = table.await("req-1", 50L);

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        DispatchException cause = Assertions.assertInstanceOf(DispatchException.class, e.getCause());
        Assertions.assertEquals(DispatchException.Kind.TIMEOUT, cause.kind());
        Assertions.assertEquals(0, table.pending());
        Assertions.assertEquals(1L, table.timeoutTotal());
    }

    @Test
    void replyAfterTimeoutHasNoEffect() throws Exception {
        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        CountDownLatch timedOut = new CountDownLatch(1);
        table.register("req-1", reply -> resolved.incrementAndGet(), error -> {
            rejected.incrementAndGet();
            timedOut.countDown();
        }, 30L);

        Assertions.assertTrue(timedOut.await(2, TimeUnit.SECONDS));
        Assertions.assertFalse(table.resolve("req-1", new AgentReply("req-1", true, null, null)));
        Assertions.assertFalse(table.reject("req-1", DispatchException.agentFailure("late")));
        Assertions.assertEquals(0, resolved.get());
        Assertions.assertEquals(1, rejected.get());
    }

    @Test
    void explicitRejectCancelsDeadline() throws Exception {
        AtomicInteger rejected = new AtomicInteger();
        List<DispatchException> errors = new ArrayList<>();
        table.register("req-1", reply -> Assertions.fail("unexpected resolve"), error -> {
            rejected.incrementAndGet();
            errors.add(error);
        }, 100L);

        Assertions.assertTrue(table.reject("req-1", DispatchException.agentFailure("TypeError: x is undefined")));
        Thread.sleep(250L);

        Assertions.assertEquals(1, rejected.get());
        Assertions.assertEquals(DispatchException.Kind.AGENT_FAILURE, errors.get(0).kind());
        Assertions.assertEquals("TypeError: x is undefined", errors.get(0).getMessage());
        Assertions.assertEquals(0L, table.timeoutTotal());
        Assertions.assertEquals(1L, table.rejectedTotal());
    }

    @Test
    void duplicateRequestIdIsRefused() {
        table.await("req-1", 5_000L);
        Assertions.assertThrows(IllegalStateException.class, () -> table.await("req-1", 5_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> table.await(" ", 5_000L));
    }

    @Test
    void unknownIdsAreSilentlyIgnored() {
        Assertions.assertFalse(table.resolve("forged", new AgentReply("forged", true, null, null)));
        Assertions.assertFalse(table.resolve(null, new AgentReply(null, true, null, null)));
        Assertions.assertFalse(table.reject("forged", DispatchException.agentFailure("x")));
    }

    @Test
    void rejectAllFailsEveryPendingRequest() {
        CompletableFuture<AgentReply> a = table.await("a", 5_000L);
        CompletableFuture<AgentReply> b = table.await("b", 5_000L);

        int failed = table.rejectAll(new DispatchException(DispatchException.Kind.STOPPED, "broker stopped"));

        Assertions.assertEquals(2, failed);
        Assertions.assertEquals(0, table.pending());
        for (CompletableFuture<AgentReply> f : List.of(a, b)) {
            ExecutionException e = Assertions.assertThrows(ExecutionException.class, f::get);
            Assertions.assertEquals(DispatchException.Kind.STOPPED, ((DispatchException) e.getCause()).kind());
        }
    }

    @Test
    void throwingCallbackDoesNotBreakTable() throws Exception {
        table.register("boom", reply -> {
            throw new IllegalStateException("callback failure");
        }, error -> {
        }, 5_000L);

        Assertions.assertTrue(table.resolve("boom", new AgentReply("boom", true, null, null)));
        CompletableFuture<AgentReply> next = table.await("next", 5_000L);
        Assertions.assertTrue(table.resolve("next", new AgentReply("next", true, null, null)));
        Assertions.assertTrue(next.get(1, TimeUnit.SECONDS).ok());
    }

    @Test
    void racingOutcomesSettleEachRequestExactlyOnce() throws Exception {
        int requests = 300;
        AtomicInteger[] outcomes = new AtomicInteger[requests];
        for (int i = 0; i < requests; i++) {
            AtomicInteger counter = new AtomicInteger();
            outcomes[i] = counter;
            table.register("req-" + i, reply -> counter.incrementAndGet(), error -> counter.incrementAndGet(), 1L + (i % 5));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<CompletableFuture<Void>> racers = new ArrayList<>();
            for (int i = 0; i < requests; i++) {
                String reqId = "req-" + i;
                racers.add(CompletableFuture.runAsync(() -> {
                    await(start);
                    table.resolve(reqId, new AgentReply(reqId, true, null, null));
                }, pool));
                racers.add(CompletableFuture.runAsync(() -> {
                    await(start);
                    table.reject(reqId, DispatchException.agentFailure("racer"));
                }, pool));
            }
            start.countDown();
            CompletableFuture.allOf(racers.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
            Thread.sleep(100L);
        } finally {
            pool.shutdownNow();
        }
        for (int i = 0; i < requests; i++) {
            Assertions.assertEquals(1, outcomes[i].get(), "request req-" + i);
        }
        Assertions.assertEquals(0, table.pending());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
