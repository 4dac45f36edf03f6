package io.snapbridge.observability;

import io.snapbridge.runtime.SnapBridgeRuntime;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(SnapBridgeRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "snapbridge_sessions", "Registered agent sessions by liveness", "state", "all", stats.sessionsTotal());
        appendGauge(sb, "snapbridge_sessions", "Registered agent sessions by liveness", "state", "active", stats.sessionsActive());
        appendGauge(sb, "snapbridge_channels_open", "Open agent event streams", null, null, stats.channelsOpen());
        appendGauge(sb, "snapbridge_pending_requests", "Requests waiting for an agent reply", null, null, stats.pendingRequests());

        appendCounter(sb, "snapbridge_dispatched_total", "Commands written to agent channels", null, null, stats.dispatchedTotal());
        appendCounter(sb, "snapbridge_request_outcomes_total", "Settled requests by outcome", "outcome", "resolved", stats.resolvedTotal());
        appendCounter(sb, "snapbridge_request_outcomes_total", "Settled requests by outcome", "outcome", "agent_failure", stats.agentFailureTotal());
        appendCounter(sb, "snapbridge_request_outcomes_total", "Settled requests by outcome", "outcome", "timeout", stats.timeoutTotal());
        appendCounter(sb, "snapbridge_request_outcomes_total", "Settled requests by outcome", "outcome", "channel_closed", stats.channelClosedTotal());
        appendCounter(sb, "snapbridge_unknown_session_total", "Commands refused because the target session was unknown", null, null, stats.unknownSessionTotal());
        appendCounter(sb, "snapbridge_dropped_replies_total", "Replies for unknown or already settled requests", null, null, stats.droppedReplyTotal());
        appendCounter(sb, "snapbridge_sessions_removed_total", "Sessions removed by cause", "cause", "stale", stats.evictedTotal());
        appendCounter(sb, "snapbridge_sessions_removed_total", "Sessions removed by cause", "cause", "bye", stats.byeTotal());
        appendCounter(sb, "snapbridge_sessions_removed_total", "Sessions removed by cause", "cause", "channel_closed", stats.channelDropTotal());
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        append(sb, metric, "gauge", help, label, labelValue, value);
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        append(sb, metric, "counter", help, label, labelValue, value);
    }

    private static void append(StringBuilder sb, String metric, String type, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
