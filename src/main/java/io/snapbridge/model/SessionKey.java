package io.snapbridge.model;

/**
 * Composite identity of one agent: the durable per-browser id plus the per-page-load id.
 * Two tabs of the same browser share {@code browserId} but are distinct sessions.
 */
public record SessionKey(String browserId, String pageId) {
    public SessionKey {
        if (browserId == null || browserId.isBlank()) {
            throw new IllegalArgumentException("browserId cannot be empty");
        }
        if (pageId == null || pageId.isBlank()) {
            throw new IllegalArgumentException("pageId cannot be empty");
        }
        browserId = browserId.trim();
        pageId = pageId.trim();
    }

    public String sid() {
        return browserId + ":" + pageId;
    }

    @Override
    public String toString() {
        return sid();
    }
}
