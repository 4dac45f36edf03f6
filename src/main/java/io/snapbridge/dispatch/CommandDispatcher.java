package io.snapbridge.dispatch;

import io.snapbridge.channel.AgentChannel;
import io.snapbridge.model.AgentReply;
import io.snapbridge.model.CommandName;
import io.snapbridge.model.DataKind;
import io.snapbridge.session.Session;
import io.snapbridge.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends a command to one agent and hands back a future settled by the agent's reply,
 * an explicit failure or the wait budget running out.
 */
public final class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final SessionRegistry registry;
    private final CorrelationTable table;
    private final AtomicLong dispatchedTotal = new AtomicLong(0L);
    private final AtomicLong unknownSessionTotal = new AtomicLong(0L);
    private final AtomicLong channelClosedTotal = new AtomicLong(0L);

    public CommandDispatcher(SessionRegistry registry, CorrelationTable table) {
        this.registry = registry;
        this.table = table;
    }

    public CompletableFuture<AgentReply> dispatch(String sid, CommandName command, Set<DataKind> kinds, long waitMs) {
        Optional<Session> target = registry.get(sid);
        if (target.isEmpty()) {
            unknownSessionTotal.incrementAndGet();
            return CompletableFuture.failedFuture(DispatchException.unknownSession(sid));
        }
        String reqId = newRequestId();
        CompletableFuture<AgentReply> reply = table.await(reqId, waitMs);
        dispatchedTotal.incrementAndGet();

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("reqId", reqId);
        if (command == CommandName.DUMP) {
            message.put("types", DataKind.wireNames(kinds == null || kinds.isEmpty() ? DataKind.all() : kinds));
        }
        AgentChannel channel = target.get().channel();
        try {
            if (channel == null) {
                throw new IOException("session has no channel");
            }
            channel.send(command.requestEvent(), message);
            log.debug("Dispatched {} {} to {} (wait={}ms)", command.requestEvent(), reqId, sid, waitMs);
        } catch (IOException e) {
            channelClosedTotal.incrementAndGet();
            table.reject(reqId, new DispatchException(
                    DispatchException.Kind.CHANNEL_CLOSED,
                    "channel closed for session " + sid,
                    e
            ));
        }
        return reply;
    }

    /**
     * Request ids come from {@link UUID#randomUUID()}, which draws on {@code SecureRandom};
     * ids cannot be guessed to forge replies.
     */
    static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    public long dispatchedTotal() {
        return dispatchedTotal.get();
    }

    public long unknownSessionTotal() {
        return unknownSessionTotal.get();
    }

    public long channelClosedTotal() {
        return channelClosedTotal.get();
    }
}
