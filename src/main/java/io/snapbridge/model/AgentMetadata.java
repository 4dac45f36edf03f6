package io.snapbridge.model;

/**
 * Page facts an agent reports in its hello.
 */
public record AgentMetadata(String href, String title, String userAgent) {
    public AgentMetadata {
        href = href == null ? "" : href;
        title = title == null ? "" : title;
        userAgent = userAgent == null ? "" : userAgent;
    }
}
