package io.snapbridge.dispatch;

/**
 * Failure of a command sent to an agent. The {@link Kind} tells callers how to react;
 * none of these are retried by the broker.
 */
public final class DispatchException extends RuntimeException {
    public enum Kind {
        /** Target session is not in the registry; raised before any waiter exists. */
        UNKNOWN_SESSION,
        /** No reply inside the wait budget. Routine, not a defect. */
        TIMEOUT,
        /** The agent replied with {@code ok: false}. */
        AGENT_FAILURE,
        /** The agent's channel was closed when the command was written. */
        CHANNEL_CLOSED,
        /** The broker shut down while the request was pending. */
        STOPPED
    }

    private final Kind kind;

    public DispatchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DispatchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DispatchException unknownSession(String sid) {
        return new DispatchException(Kind.UNKNOWN_SESSION, "no such session: " + sid);
    }

    public static DispatchException timeout(String reqId, long waitMs) {
        return new DispatchException(Kind.TIMEOUT, "timeout after " + waitMs + "ms (reqId=" + reqId + ")");
    }

    public static DispatchException agentFailure(String detail) {
        return new DispatchException(Kind.AGENT_FAILURE, detail == null || detail.isBlank() ? "agent reported failure" : detail);
    }

    public Kind kind() {
        return kind;
    }
}
