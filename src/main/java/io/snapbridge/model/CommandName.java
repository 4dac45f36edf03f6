package io.snapbridge.model;

/**
 * Commands the core can send to an agent. Agents answer {@code dump} with
 * {@code dumpResult} and {@code ping} with {@code pingResult}.
 */
public enum CommandName {
    DUMP("dump"),
    PING("ping");

    private final String requestEvent;

    CommandName(String requestEvent) {
        this.requestEvent = requestEvent;
    }

    public String requestEvent() {
        return requestEvent;
    }
}
