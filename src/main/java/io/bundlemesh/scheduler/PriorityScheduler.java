package io.bundlemesh.scheduler;

import io.bundlemesh.model.QueueEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Transmission order for one exchange: emergency first, then earliest expiry,
 * then fewest hops remaining, then bundle id. Total and deterministic.
 */
public final class PriorityScheduler {
    public static final Comparator<QueueEntry> ORDER = Comparator
            .comparingInt((QueueEntry e) -> e.bundle().priority().rank())
            .thenComparingLong(e -> e.bundle().expiresAtMs())
            .thenComparingInt(e -> e.bundle().hopsRemaining())
            .thenComparing(QueueEntry::bundleId);

    private PriorityScheduler() {
    }

    public static List<QueueEntry> order(Collection<QueueEntry> entries) {
        List<QueueEntry> out = new ArrayList<>(entries);
        out.sort(ORDER);
        return out;
    }
}
