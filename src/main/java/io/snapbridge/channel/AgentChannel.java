package io.snapbridge.channel;

import java.io.IOException;

/**
 * Handle used to push events to one connected agent.
 * A handle is usable only while the underlying transport is open.
 */
public interface AgentChannel {
    String id();

    boolean isOpen();

    /**
     * Sends one named event. Implementations must be safe to call from multiple threads.
     *
     * @throws IOException if the channel is closed or the write fails; the channel is closed afterwards
     */
    void send(String event, Object data) throws IOException;

    /**
     * Writes a transport-level no-op so a dead peer is noticed even when no command is sent.
     */
    default void keepAlive() throws IOException {
    }

    void close();
}
