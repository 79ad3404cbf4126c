package io.bundlemesh.scheduler;

import io.bundlemesh.TestBundles;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.Priority;
import io.bundlemesh.model.QueueEntry;
import io.bundlemesh.security.NodeIdentity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

final class PrioritySchedulerTest {
    private static final long T0 = 1_800_000_000_000L;

    private final NodeIdentity identity = NodeIdentity.ephemeral(NodeIdentity.newCommunitySecret());

    @Test
    void emergencyGoesFirstRegardlessOfInsertionOrder() {
        QueueEntry bulk = entry(Priority.BULK, T0, TestBundles.HOUR_MS, 30, "b");
        QueueEntry normal = entry(Priority.NORMAL, T0, TestBundles.HOUR_MS, 30, "n");
        QueueEntry emergency = entry(Priority.EMERGENCY, T0, TestBundles.HOUR_MS * 5, 30, "e");
        QueueEntry expedited = entry(Priority.EXPEDITED, T0, TestBundles.HOUR_MS, 30, "x");

        List<QueueEntry> ordered = PriorityScheduler.order(List.of(bulk, normal, emergency, expedited));

        Assertions.assertEquals(List.of(emergency, expedited, normal, bulk), ordered);
    }

    @Test
    void withinPriorityEarlierExpiryThenFewerHopsRemaining() {
        QueueEntry late = entry(Priority.NORMAL, T0, 5_000L, 30, "late");
        QueueEntry soon = entry(Priority.NORMAL, T0, 1_000L, 30, "soon");
        QueueEntry manyHops = entry(Priority.NORMAL, T0, 3_000L, 30, "many");
        QueueEntry fewHops = entry(Priority.NORMAL, T0, 3_000L, 2, "few");

        List<QueueEntry> ordered = PriorityScheduler.order(List.of(late, manyHops, soon, fewHops));

        Assertions.assertEquals(List.of(soon, fewHops, manyHops, late), ordered);
    }

    @Test
    void orderIsTotalAndIndependentOfInput() {
        List<QueueEntry> entries = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            // Same priority, expiry and hops: only the id separates them.
            entries.add(entry(Priority.BULK, T0, 10_000L, 30, "payload-" + i));
        }
        List<QueueEntry> expected = PriorityScheduler.order(entries);
        for (int i = 1; i < expected.size(); i++) {
            Assertions.assertTrue(expected.get(i - 1).bundleId().compareTo(expected.get(i).bundleId()) < 0);
        }
        Random random = new Random(7L);
        for (int round = 0; round < 5; round++) {
            List<QueueEntry> shuffled = new ArrayList<>(entries);
            Collections.shuffle(shuffled, random);
            Assertions.assertEquals(expected, PriorityScheduler.order(shuffled));
        }
    }

    private QueueEntry entry(Priority priority, long created, long ttl, int hopLimit, String text) {
        Bundle bundle = TestBundles.signed(identity, Destination.multicast("alerts"), "alerts", priority,
                Audience.PUBLIC, created, ttl, hopLimit, false, text.getBytes(StandardCharsets.UTF_8));
        return QueueEntry.fresh(bundle, "neighbor-1");
    }
}
