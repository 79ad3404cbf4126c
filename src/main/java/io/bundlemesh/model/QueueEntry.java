package io.bundlemesh.model;

/**
 * Transport state of one bundle towards one neighbor.
 */
public record QueueEntry(
        Bundle bundle,
        String neighborId,
        int attempts,
        long lastAttemptMs,
        long nextAttemptMs,
        boolean delivered
) {
    public static QueueEntry fresh(Bundle bundle, String neighborId) {
        return new QueueEntry(bundle, neighborId, 0, 0L, 0L, false);
    }

    public String bundleId() {
        return bundle.id();
    }

    public boolean dueAt(long nowMs) {
        return !delivered && nextAttemptMs <= nowMs;
    }
}
