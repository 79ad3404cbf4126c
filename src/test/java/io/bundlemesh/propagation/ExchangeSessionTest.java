package io.bundlemesh.propagation;

import io.bundlemesh.TestBundles;
import io.bundlemesh.codec.BundleCodec;
import io.bundlemesh.codec.DecodeException;
import io.bundlemesh.config.BundleMeshConfig;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.LinkState;
import io.bundlemesh.model.Priority;
import io.bundlemesh.model.QueueEntry;
import io.bundlemesh.observability.BundleMetrics;
import io.bundlemesh.security.NodeIdentity;
import io.bundlemesh.storage.BundleStore;
import io.bundlemesh.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class ExchangeSessionTest {
    private static final long T0 = 1_800_000_000_000L;
    private static final BackoffPolicy BACKOFF = new BackoffPolicy(1_000L, 60_000L, false);

    private final byte[] community = NodeIdentity.newCommunitySecret();

    @Test
    void exchangeCopiesEachSidesBundlesToTheOther() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            Peer b = new Peer(root.resolve("b"), "alerts");
            Bundle fromA = a.create(Priority.NORMAL, 30, "from a");
            Bundle fromB = b.create(Priority.EMERGENCY, 30, "from b");

            List<SessionOutcome> outcomes = exchange(a, b);

            Assertions.assertTrue(outcomes.get(0).completed(), outcomes.get(0).toString());
            Assertions.assertTrue(outcomes.get(1).completed(), outcomes.get(1).toString());
            Assertions.assertEquals(LinkState.IDLE, outcomes.get(0).finalState());
            Assertions.assertEquals(1, outcomes.get(0).bundlesSent());
            Assertions.assertEquals(1, outcomes.get(0).bundlesReceived());

            Assertions.assertEquals(1, b.store.get(fromA.id()).orElseThrow().hopCount());
            Assertions.assertEquals(1, a.store.get(fromB.id()).orElseThrow().hopCount());
            Assertions.assertTrue(a.store.queueEntry(fromA.id(), b.address()).orElseThrow().delivered());
            Assertions.assertEquals(List.of(fromB.id()), a.node.deliveredIds());
            Assertions.assertEquals(List.of(fromA.id()), b.node.deliveredIds());
            Assertions.assertEquals("completed", a.store.neighbor(b.address()).orElseThrow().lastOutcome());

            // Nothing left to offer: a second contact moves no bundles.
            List<SessionOutcome> again = exchange(a, b);
            Assertions.assertEquals(0, again.get(0).bundlesSent());
            Assertions.assertEquals(0, again.get(1).bundlesSent());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void bundleAtHopLimitIsKeptOnlyByRecipientsAndNeverForwarded() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-hops-");
        try {
            Peer source = new Peer(root.resolve("src"), "alerts");
            Peer subscriber = new Peer(root.resolve("sub"), "alerts");
            Peer bystander = new Peer(root.resolve("by"));
            Bundle oneHop = source.create(Priority.EMERGENCY, 1, "one hop");

            exchange(source, subscriber);
            Bundle stored = subscriber.store.get(oneHop.id()).orElseThrow();
            Assertions.assertEquals(1, stored.hopCount());
            Assertions.assertEquals(List.of(oneHop.id()), subscriber.node.deliveredIds());

            exchange(source, bystander);
            Assertions.assertFalse(bystander.store.contains(oneHop.id()));
            Assertions.assertTrue(source.store.queueEntry(oneHop.id(), bystander.address()).orElseThrow().delivered());

            List<SessionOutcome> relay = exchange(subscriber, bystander);
            Assertions.assertEquals(0, relay.get(0).bundlesSent());
            Assertions.assertFalse(bystander.store.contains(oneHop.id()));
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void protocolVersionMismatchEndsIdleWithoutTransfer() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-version-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            Peer b = new Peer(root.resolve("b"), "alerts");
            Bundle bundle = a.create(Priority.NORMAL, 30, "stay home");
            InMemoryLink.Pair pair = InMemoryLink.pair("a", "b");

            CompletableFuture<SessionOutcome> left = CompletableFuture.supplyAsync(() -> new ExchangeSession(
                    pair.left(), a.store, a.node, BACKOFF, 2_000L, () -> T0, 1).run());
            CompletableFuture<SessionOutcome> right = CompletableFuture.supplyAsync(() -> new ExchangeSession(
                    pair.right(), b.store, b.node, BACKOFF, 2_000L, () -> T0, 2).run());

            SessionOutcome outcome = left.get(10, TimeUnit.SECONDS);
            Assertions.assertEquals("incompatible", outcome.outcome());
            Assertions.assertEquals(LinkState.IDLE, outcome.finalState());
            Assertions.assertEquals("incompatible", right.get(10, TimeUnit.SECONDS).outcome());
            Assertions.assertFalse(b.store.contains(bundle.id()));
            Assertions.assertEquals("incompatible", a.store.neighbor(b.address()).orElseThrow().lastOutcome());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void disconnectBeforeAckLeavesBundleQueuedWithBackoff() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-drop-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            Peer b = new Peer(root.resolve("b"), "alerts");
            Bundle bundle = a.create(Priority.EXPEDITED, 30, "partial");
            InMemoryLink.Pair pair = InMemoryLink.pair("a", "b");
            // HELLO, MANIFEST, REQUEST and BUNDLE go out; END breaks the link.
            pair.left().failAfterSends(4);

            CompletableFuture<SessionOutcome> left = CompletableFuture.supplyAsync(
                    () -> new ExchangeSession(pair.left(), a.store, a.node, BACKOFF, 2_000L, () -> T0).run());
            CompletableFuture<SessionOutcome> right = CompletableFuture.supplyAsync(
                    () -> new ExchangeSession(pair.right(), b.store, b.node, BACKOFF, 2_000L, () -> T0).run());

            SessionOutcome outcome = left.get(10, TimeUnit.SECONDS);
            Assertions.assertEquals("disconnected", outcome.outcome());
            Assertions.assertEquals(LinkState.DISCONNECTED, outcome.finalState());
            Assertions.assertEquals(List.of(bundle.id()), outcome.unackedIds());
            Assertions.assertFalse(right.get(10, TimeUnit.SECONDS).completed());

            QueueEntry entry = a.store.queueEntry(bundle.id(), b.address()).orElseThrow();
            Assertions.assertFalse(entry.delivered());
            Assertions.assertEquals(1, entry.attempts());
            Assertions.assertEquals(T0 + 1_000L, entry.nextAttemptMs());
            Assertions.assertTrue(a.store.forwardableFor(b.address(), T0).isEmpty());
            Assertions.assertEquals(1, a.store.forwardableFor(b.address(), T0 + 1_000L).size());
            Assertions.assertEquals(1, a.store.consecutiveFailures(b.address()));
            Assertions.assertTrue(a.store.neighbor(b.address()).orElseThrow().inBackoff(T0));
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void silentPeerTimesOut() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-timeout-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            InMemoryLink.Pair pair = InMemoryLink.pair("a", "b");

            ExchangeSession session = new ExchangeSession(pair.left(), a.store, a.node, BACKOFF, 50L, () -> T0);
            SessionOutcome outcome = session.run();

            Assertions.assertEquals("timeout", outcome.outcome());
            Assertions.assertEquals(LinkState.DISCONNECTED, session.state());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void tamperedBundleIsRefusedAndNeighborMarkedSuspect() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-tamper-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            Bundle offered = a.create(Priority.BULK, 30, "not wanted");
            NodeIdentity forger = NodeIdentity.ephemeral(community);
            Bundle genuine = TestBundles.signed(forger, Destination.multicast("alerts"), Priority.NORMAL, T0, "genuine");
            Bundle tampered = new Bundle(genuine.id(), genuine.source(), genuine.sourceBoxKey(), genuine.destination(),
                    genuine.topic(), genuine.priority(), genuine.audience(), genuine.createdAtMs(), genuine.expiresAtMs(),
                    genuine.hopLimit(), genuine.hopCount(), genuine.custodyRequested(), genuine.signature(),
                    "forged".getBytes(StandardCharsets.UTF_8));

            InMemoryLink.Pair pair = InMemoryLink.pair("a", "forger");
            InMemoryLink script = pair.right();
            script.send(ExchangeFrame.hello(ExchangeFrame.PROTOCOL_VERSION, forger.address(), List.of(), false).toBytes());
            script.send(ExchangeFrame.manifest(List.of(genuine.id())).toBytes());
            script.send(ExchangeFrame.request(List.of()).toBytes());
            script.send("{not json".getBytes(StandardCharsets.UTF_8));
            script.send(ExchangeFrame.bundle(genuine.id(), BundleCodec.encode(tampered)).toBytes());
            script.send(ExchangeFrame.end().toBytes());

            SessionOutcome outcome = new ExchangeSession(pair.left(), a.store, a.node, BACKOFF, 2_000L, () -> T0).run();

            Assertions.assertTrue(outcome.completed(), outcome.toString());
            Assertions.assertFalse(a.store.contains(genuine.id()));
            Assertions.assertEquals(1, a.store.neighbor(forger.address()).orElseThrow().suspectCount());
            Assertions.assertTrue(a.store.queueEntry(offered.id(), forger.address()).orElseThrow().delivered());
            Assertions.assertTrue(a.node.deliveredIds().isEmpty());

            List<ExchangeFrame> replies = drain(script);
            ExchangeFrame ack = replies.stream()
                    .filter(f -> f.type() == ExchangeFrame.Type.ACK)
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(Boolean.FALSE, ack.accepted());
            Assertions.assertEquals("ID_MISMATCH", ack.reason());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void bundleAlreadyHeldIsStillDeliveredAndAckedAsHeld() throws Exception {
        Path root = Files.createTempDirectory("bundlemesh-test-exchange-held-");
        try {
            Peer a = new Peer(root.resolve("a"), "alerts");
            Bundle offered = a.create(Priority.NORMAL, 30, "from a");
            NodeIdentity other = NodeIdentity.ephemeral(community);
            Bundle held = TestBundles.signed(other, Destination.multicast("alerts"), Priority.NORMAL, T0, "relayed earlier");
            Assertions.assertTrue(a.store.put(held, "relay", T0).isInserted());

            InMemoryLink.Pair pair = InMemoryLink.pair("a", "other");
            InMemoryLink script = pair.right();
            script.send(ExchangeFrame.hello(ExchangeFrame.PROTOCOL_VERSION, other.address(), List.of("alerts"), false).toBytes());
            script.send(ExchangeFrame.manifest(List.of(held.id())).toBytes());
            script.send(ExchangeFrame.request(List.of(offered.id())).toBytes());
            script.send(ExchangeFrame.bundle(held.id(), BundleCodec.encode(held)).toBytes());
            script.send(ExchangeFrame.ack(offered.id(), true, false, ExchangeFrame.ALREADY_HELD).toBytes());
            script.send(ExchangeFrame.end().toBytes());

            SessionOutcome outcome = new ExchangeSession(pair.left(), a.store, a.node, BACKOFF, 2_000L, () -> T0).run();

            Assertions.assertTrue(outcome.completed(), outcome.toString());
            Assertions.assertEquals(List.of(held.id()), a.node.deliveredIds());
            Assertions.assertEquals(0, a.store.get(held.id()).orElseThrow().hopCount());
            Assertions.assertTrue(a.store.queueEntry(offered.id(), other.address()).orElseThrow().delivered());
            long forwarded = a.store.metricCounters().stream()
                    .filter(c -> c.metric().equals(BundleMetrics.FORWARDED))
                    .mapToLong(BundleMetrics.Counter::value)
                    .sum();
            Assertions.assertEquals(0L, forwarded);

            ExchangeFrame ack = drain(script).stream()
                    .filter(f -> f.type() == ExchangeFrame.Type.ACK)
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(held.id(), ack.bundleId());
            Assertions.assertEquals(Boolean.TRUE, ack.accepted());
            Assertions.assertEquals(ExchangeFrame.ALREADY_HELD, ack.reason());
        } finally {
            TestBundles.deleteRecursively(root);
        }
    }

    @Test
    void frameParsingRejectsGarbage() {
        ExchangeFrame hello = ExchangeFrame.hello(1, "ab", List.of("alerts"), true);
        ExchangeFrame parsed = ExchangeFrame.fromBytes(hello.toBytes());
        Assertions.assertEquals(ExchangeFrame.Type.HELLO, parsed.type());
        Assertions.assertEquals(List.of("alerts"), parsed.topicsOrEmpty());
        Assertions.assertTrue(parsed.idsOrEmpty().isEmpty());

        Assertions.assertThrows(DecodeException.class,
                () -> ExchangeFrame.fromBytes("{}".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(DecodeException.class,
                () -> ExchangeFrame.fromBytes("[1,2".getBytes(StandardCharsets.UTF_8)));
    }

    private List<SessionOutcome> exchange(Peer left, Peer right) throws Exception {
        InMemoryLink.Pair pair = InMemoryLink.pair("left", "right");
        CompletableFuture<SessionOutcome> a = CompletableFuture.supplyAsync(
                () -> new ExchangeSession(pair.left(), left.store, left.node, BACKOFF, 5_000L, () -> T0).run());
        CompletableFuture<SessionOutcome> b = CompletableFuture.supplyAsync(
                () -> new ExchangeSession(pair.right(), right.store, right.node, BACKOFF, 5_000L, () -> T0).run());
        return List.of(a.get(20, TimeUnit.SECONDS), b.get(20, TimeUnit.SECONDS));
    }

    private static List<ExchangeFrame> drain(InMemoryLink link) throws InterruptedException {
        List<ExchangeFrame> frames = new ArrayList<>();
        try {
            while (true) {
                var raw = link.receive(100L);
                if (raw.isEmpty()) {
                    return frames;
                }
                frames.add(ExchangeFrame.fromBytes(raw.get()));
            }
        } catch (NeighborDisconnectedException e) {
            return frames;
        }
    }

    private final class Peer {
        private final NodeIdentity identity = NodeIdentity.ephemeral(community);
        private final BundleStore store;
        private final TestNode node;

        private Peer(Path dir, String... topics) {
            Database db = new Database(BundleMeshConfig.fromRoot(dir.toString()));
            db.init();
            this.store = new BundleStore(db, null, 1 << 20, 16, () -> T0);
            this.node = new TestNode(identity.address(), List.of(topics));
        }

        private String address() {
            return identity.address();
        }

        private Bundle create(Priority priority, int hopLimit, String text) {
            Bundle bundle = TestBundles.signed(identity, Destination.multicast("alerts"), "alerts", priority,
                    Audience.PUBLIC, T0, TestBundles.HOUR_MS, hopLimit, false, text.getBytes(StandardCharsets.UTF_8));
            Assertions.assertTrue(store.put(bundle, null, T0).isInserted());
            return bundle;
        }
    }

    private static final class TestNode implements LocalNode {
        private final String address;
        private final List<String> topics;
        private final List<String> delivered = Collections.synchronizedList(new ArrayList<>());

        private TestNode(String address, List<String> topics) {
            this.address = address;
            this.topics = topics;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public List<String> subscribedTopics() {
            return topics;
        }

        @Override
        public boolean trustedMember() {
            return false;
        }

        @Override
        public boolean trustsNeighbor(String neighborId) {
            return false;
        }

        @Override
        public boolean isLocalRecipient(Bundle bundle) {
            Destination destination = bundle.destination();
            if (destination.kind() == Destination.Kind.UNICAST) {
                return address.equals(destination.nodeAddress());
            }
            return destination.kind() == Destination.Kind.MULTICAST && topics.contains(bundle.topic());
        }

        @Override
        public void deliverLocally(Bundle bundle) {
            delivered.add(bundle.id());
        }

        private List<String> deliveredIds() {
            return new ArrayList<>(delivered);
        }
    }
}
