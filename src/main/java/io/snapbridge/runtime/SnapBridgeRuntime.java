package io.snapbridge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.snapbridge.channel.AgentChannel;
import io.snapbridge.channel.ChannelEventRouter;
import io.snapbridge.channel.ChannelHub;
import io.snapbridge.config.SnapBridgeConfig;
import io.snapbridge.dispatch.CommandDispatcher;
import io.snapbridge.dispatch.CorrelationTable;
import io.snapbridge.dispatch.DispatchException;
import io.snapbridge.model.AgentReply;
import io.snapbridge.model.CommandName;
import io.snapbridge.model.DataKind;
import io.snapbridge.model.NetworkSnapshot;
import io.snapbridge.model.PingOutcome;
import io.snapbridge.model.Screenshot;
import io.snapbridge.model.SessionKey;
import io.snapbridge.model.SessionView;
import io.snapbridge.session.LivenessSweeper;
import io.snapbridge.session.SessionRegistry;
import io.snapbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class SnapBridgeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SnapBridgeRuntime.class);
    private static final String NO_HTML = "<!-- no html -->";

    private final SnapBridgeConfig config;
    private final ScheduledThreadPoolExecutor scheduler;
    private final SessionRegistry registry;
    private final CorrelationTable correlationTable;
    private final CommandDispatcher dispatcher;
    private final ChannelHub channelHub;
    private final ChannelEventRouter events;
    private final LivenessSweeper sweeper;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong channelDropTotal = new AtomicLong(0L);

    public SnapBridgeRuntime(SnapBridgeConfig config) {
        this(config, Clock.systemUTC());
    }

    public SnapBridgeRuntime(SnapBridgeConfig config, Clock clock) {
        this.config = config;
        this.scheduler = new ScheduledThreadPoolExecutor(2, daemonThreads("snapbridge-timer-"));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.registry = new SessionRegistry(clock);
        this.correlationTable = new CorrelationTable(scheduler);
        this.dispatcher = new CommandDispatcher(registry, correlationTable);
        this.channelHub = new ChannelHub();
        this.events = new ChannelEventRouter(registry, correlationTable, channelHub, config.heartbeatIntervalMs());
        this.sweeper = new LivenessSweeper(registry, scheduler, config.sweepIntervalMs(), config.staleAfterMs());
    }

    public SnapBridgeRuntime start() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime already stopped");
        }
        if (started.compareAndSet(false, true)) {
            sweeper.start();
            channelHub.startKeepAlive(scheduler, config.channelKeepAliveMs());
            log.debug("Runtime started (sweepInterval={}ms, staleAfter={}ms)", config.sweepIntervalMs(), config.staleAfterMs());
        }
        return this;
    }

    /**
     * Stops background tasks, fails every pending request with {@link DispatchException.Kind#STOPPED}
     * and closes open agent channels. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        sweeper.stop();
        channelHub.stopKeepAlive();
        int failed = correlationTable.rejectAll(new DispatchException(DispatchException.Kind.STOPPED, "broker stopped"));
        channelHub.closeAll();
        registry.clear();
        scheduler.shutdownNow();
        log.debug("Runtime stopped ({} pending request(s) failed)", failed);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public void channelOpened(SessionKey key, AgentChannel channel) {
        channelHub.open(key, channel);
    }

    /**
     * Called when an agent's stream ends. The session goes only if it is still bound to
     * this channel; pending requests are not touched.
     */
    public void channelClosed(SessionKey key, AgentChannel channel) {
        channel.close();
        channelHub.release(key.sid(), channel);
        if (registry.removeIfBoundTo(key.sid(), channel)) {
            channelDropTotal.incrementAndGet();
            log.info("Session {} disconnected", key.sid());
        }
    }

    public ChannelEventRouter.Outcome onEvent(String type, JsonNode data) {
        return events.handle(type, data);
    }

    public List<SessionView> sessions(boolean activeOnly, Long windowMs) {
        long window = windowMs == null ? config.activeWindowMs() : Math.max(0L, windowMs);
        return registry.list(activeOnly, window);
    }

    public CompletableFuture<AgentReply> dumpAsync(String sid, Set<DataKind> kinds, Long waitMs) {
        return send(sid, CommandName.DUMP, kinds, config.clampWaitMs(waitMs, config.dumpWaitMs()));
    }

    public AgentReply dump(String sid, Set<DataKind> kinds, Long waitMs) {
        return await(dumpAsync(sid, kinds, waitMs));
    }

    public String html(String sid) {
        JsonNode html = dump(sid, EnumSet.of(DataKind.HTML), null).part("html");
        return html.isTextual() && !html.asText().isEmpty() ? html.asText() : NO_HTML;
    }

    public JsonNode console(String sid) {
        JsonNode console = dump(sid, EnumSet.of(DataKind.CONSOLE), null).part("console");
        return console.isMissingNode() || console.isNull() ? Jsons.mapper().createArrayNode() : console;
    }

    public NetworkSnapshot network(String sid) {
        AgentReply reply = dump(sid, EnumSet.of(DataKind.NETWORK, DataKind.PERF), null);
        return new NetworkSnapshot(arrayOrEmpty(reply.part("network")), arrayOrEmpty(reply.part("perf")));
    }

    /**
     * DOM screenshot of the page, empty when the agent sent none.
     *
     * @throws IllegalStateException if the agent sent something other than a base64 data URL
     */
    public Optional<Screenshot> screenshot(String sid) {
        JsonNode dataUrl = dump(sid, EnumSet.of(DataKind.SCREENSHOT_DOM), null).part(DataKind.SCREENSHOT_DOM.wireName());
        if (!dataUrl.isTextual() || dataUrl.asText().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Screenshot.fromDataUrl(dataUrl.asText()));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("bad dataurl", e);
        }
    }

    public PingOutcome ping(String sid, Long waitMs) {
        long startedAt = System.nanoTime();
        AgentReply reply = await(send(sid, CommandName.PING, Set.of(), config.clampWaitMs(waitMs, config.pingWaitMs())));
        long rttMs = (System.nanoTime() - startedAt) / 1_000_000L;
        JsonNode payload = reply.payload() == null ? Jsons.mapper().createObjectNode() : reply.payload();
        return new PingOutcome(reply.ok(), rttMs, payload);
    }

    public StatsOutcome stats() {
        return new StatsOutcome(
                registry.size(),
                registry.countActive(config.activeWindowMs()),
                channelHub.openCount(),
                correlationTable.pending(),
                dispatcher.dispatchedTotal(),
                correlationTable.resolvedTotal(),
                events.agentFailureTotal(),
                correlationTable.timeoutTotal(),
                dispatcher.channelClosedTotal(),
                dispatcher.unknownSessionTotal(),
                correlationTable.droppedTotal(),
                sweeper.evictedTotal(),
                events.byeTotal(),
                channelDropTotal.get()
        );
    }

    public SnapBridgeConfig config() {
        return config;
    }

    public SessionRegistry registry() {
        return registry;
    }

    private CompletableFuture<AgentReply> send(String sid, CommandName command, Set<DataKind> kinds, long waitMs) {
        if (stopped.get()) {
            return CompletableFuture.failedFuture(new DispatchException(DispatchException.Kind.STOPPED, "broker stopped"));
        }
        return dispatcher.dispatch(sid, command, kinds, waitMs);
    }

    /**
     * Waits for a dispatched command. The correlation table guarantees the future settles
     * within its wait budget.
     */
    static AgentReply await(CompletableFuture<AgentReply> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof DispatchException) {
                throw (DispatchException) e.getCause();
            }
            throw e;
        }
    }

    private static JsonNode arrayOrEmpty(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? Jsons.mapper().createArrayNode() : node;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record StatsOutcome(
            int sessionsTotal,
            int sessionsActive,
            int channelsOpen,
            int pendingRequests,
            long dispatchedTotal,
            long resolvedTotal,
            long agentFailureTotal,
            long timeoutTotal,
            long channelClosedTotal,
            long unknownSessionTotal,
            long droppedReplyTotal,
            long evictedTotal,
            long byeTotal,
            long channelDropTotal
    ) {
    }
}
