package io.bundlemesh.runtime;

import io.bundlemesh.TestBundles;
import io.bundlemesh.config.BundleMeshConfig;
import io.bundlemesh.config.NodeSettings;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.CustodyState;
import io.bundlemesh.model.DeliveredPayload;
import io.bundlemesh.model.Priority;
import io.bundlemesh.model.RejectReason;
import io.bundlemesh.propagation.InMemoryLink;
import io.bundlemesh.propagation.SessionOutcome;
import io.bundlemesh.security.AuthenticationException;
import io.bundlemesh.security.NodeIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

final class BundleNodeTest {
    private static final long HOUR_MS = TestBundles.HOUR_MS;

    private final byte[] community = NodeIdentity.newCommunitySecret();
    private final List<BundleNode> nodes = new ArrayList<>();
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("bundlemesh-test-node-");
    }

    @AfterEach
    void tearDown() throws Exception {
        for (BundleNode node : nodes) {
            node.close();
        }
        TestBundles.deleteRecursively(root);
    }

    @Test
    void multicastIsDeliveredDecryptedOnSubscribers() throws Exception {
        BundleNode a = node("a", "alerts");
        BundleNode b = node("b", "alerts");

        String id = a.submit("dtn://*/alerts", "alerts", "flood warning", Priority.EMERGENCY, Audience.PUBLIC, HOUR_MS);
        sync(a, b);

        List<DeliveredPayload> atB = list(b.deliveries("alerts", 0L));
        Assertions.assertEquals(1, atB.size());
        Assertions.assertEquals(id, atB.get(0).bundleId());
        Assertions.assertEquals("flood warning", atB.get(0).plaintextUtf8());
        Assertions.assertEquals(Priority.EMERGENCY, atB.get(0).priority());
        // The creator is subscribed too and sees its own bundle once.
        Assertions.assertEquals(1, list(a.deliveries("alerts", 0L)).size());
        Assertions.assertTrue(list(b.deliveries("alerts", atB.get(0).sequence())).isEmpty());
    }

    @Test
    void emergencyAlertRelaysAcrossThreeNodes() throws Exception {
        BundleNode a = node("a");
        BundleNode b = node("b");
        BundleNode c = node("c", "alerts");

        String id = a.submit("dtn://*/alerts", "alerts", "evacuate", Priority.EMERGENCY, Audience.PUBLIC, HOUR_MS);
        sync(a, b);
        Assertions.assertTrue(list(b.deliveries(null, 0L)).isEmpty());
        sync(b, c);

        Assertions.assertEquals(1, b.store().get(id).orElseThrow().hopCount());
        Assertions.assertEquals(2, c.store().get(id).orElseThrow().hopCount());
        List<DeliveredPayload> atC = list(c.deliveries("alerts", 0L));
        Assertions.assertEquals(1, atC.size());
        Assertions.assertEquals("evacuate", atC.get(0).plaintextUtf8());
    }

    @Test
    void unicastIsReadableOnlyAtItsDestination() throws Exception {
        BundleNode a = node("a");
        BundleNode relay = node("relay", "direct");
        BundleNode b = node("b");

        String id = a.submit("dtn://" + b.address() + "/direct", "direct", "for b only",
                Priority.NORMAL, Audience.PUBLIC, HOUR_MS);
        sync(a, relay);
        sync(relay, b);

        Assertions.assertTrue(relay.store().contains(id));
        Assertions.assertTrue(list(relay.deliveries(null, 0L)).isEmpty());
        List<DeliveredPayload> atB = list(b.deliveries("direct", 0L));
        Assertions.assertEquals(1, atB.size());
        Assertions.assertEquals("for b only", atB.get(0).plaintextUtf8());
    }

    @Test
    void exchangeRunsOverTcp() throws Exception {
        BundleNode server = node("server", "alerts");
        BundleNode client = node("client", "alerts");
        String fromServer = server.submit("dtn://*/alerts", "alerts", "from server", Priority.NORMAL, Audience.PUBLIC, HOUR_MS);
        String fromClient = client.submit("dtn://*/alerts", "alerts", "from client", Priority.BULK, Audience.PUBLIC, HOUR_MS);

        int port = server.serve(0);
        SessionOutcome outcome = client.connect("127.0.0.1", port).get(20, TimeUnit.SECONDS);

        Assertions.assertTrue(outcome.completed(), outcome.toString());
        Assertions.assertEquals(server.address(), outcome.neighborId());
        Assertions.assertTrue(client.store().contains(fromServer));
        Assertions.assertTrue(server.store().contains(fromClient));
        Assertions.assertEquals(2, list(client.deliveries("alerts", 0L)).size());
    }

    @Test
    void concurrentCreationOnTwoNodesKeepsBothBundles() throws Exception {
        BundleNode a = node("a", "market");
        BundleNode b = node("b", "market");
        CountDownLatch start = new CountDownLatch(1);
        List<String> ids = Collections.synchronizedList(new ArrayList<>());
        Thread ta = new Thread(() -> ids.add(await(start, () ->
                a.submit("dtn://*/market", "market", "listing", Priority.NORMAL, Audience.PUBLIC, HOUR_MS))));
        Thread tb = new Thread(() -> ids.add(await(start, () ->
                b.submit("dtn://*/market", "market", "listing", Priority.NORMAL, Audience.PUBLIC, HOUR_MS))));
        ta.start();
        tb.start();
        start.countDown();
        ta.join(10_000L);
        tb.join(10_000L);

        Assertions.assertEquals(2, ids.size());
        Assertions.assertNotEquals(ids.get(0), ids.get(1));
        sync(a, b);
        for (String id : ids) {
            Assertions.assertTrue(a.store().contains(id));
            Assertions.assertTrue(b.store().contains(id));
        }
        Assertions.assertEquals(2, list(a.deliveries("market", 0L)).size());
        Assertions.assertEquals(2, list(b.deliveries("market", 0L)).size());
    }

    @Test
    void custodyIsReleasedOnceTheDestinationAcknowledges() throws Exception {
        BundleNode a = node("a");
        BundleNode b = node("b");

        String id = a.submit("dtn://" + b.address() + "/direct", "direct",
                "keep this".getBytes(StandardCharsets.UTF_8), Priority.NORMAL, Audience.DESTINATION_ONLY,
                HOUR_MS, 10, true);
        Assertions.assertEquals(CustodyState.PENDING, a.store().custodyState(id).orElseThrow());
        Assertions.assertEquals(1L, a.stats().custodyPending());

        sync(a, b);
        Assertions.assertEquals(1, list(b.deliveries("direct", 0L)).size());
        Assertions.assertEquals(CustodyState.PENDING, a.store().custodyState(id).orElseThrow());

        // The acknowledgement travels on the next contact.
        sync(a, b);
        Assertions.assertEquals(CustodyState.ACKNOWLEDGED, a.store().custodyState(id).orElseThrow());
        Assertions.assertEquals(0L, a.stats().custodyPending());
        Assertions.assertTrue(list(a.deliveries(null, 0L)).isEmpty());
    }

    @Test
    void invalidSubmissionsAreRefused() throws Exception {
        BundleNode a = node("a");
        String other = NodeIdentity.ephemeral(community).address();

        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("dtn://*/custody-acks", "custody-acks", "x", Priority.NORMAL, Audience.PUBLIC, HOUR_MS));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("dtn://*/alerts", "alerts", "x", Priority.NORMAL, Audience.DESTINATION_ONLY, HOUR_MS));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("dtn://*/alerts", "alerts", "x".getBytes(StandardCharsets.UTF_8),
                        Priority.NORMAL, Audience.PUBLIC, HOUR_MS, 10, true));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("dtn://*/alerts", "weather", "x", Priority.NORMAL, Audience.PUBLIC, HOUR_MS));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("mailto://" + other + "/alerts", "alerts", "x", Priority.NORMAL, Audience.PUBLIC, HOUR_MS));
        Assertions.assertThrows(IllegalArgumentException.class, () ->
                a.submit("dtn://*/alerts", "alerts", "x", Priority.NORMAL, Audience.PUBLIC, 0L));
        Assertions.assertEquals(0L, a.stats().bundleCount());
    }

    @Test
    void fullStoreRejectsSubmission() throws Exception {
        BundleMeshConfig config = new BundleMeshConfig(root.resolve("tiny"));
        NodeSettings.defaults().withCapacityBytes(1_024L).save(config.settingsFile());
        BundleNode tiny = track(new BundleNode(config));
        tiny.init();

        SubmissionRejectedException e = Assertions.assertThrows(SubmissionRejectedException.class, () ->
                tiny.submit("dtn://*/bulk", "bulk", new byte[4_096], Priority.BULK, Audience.PUBLIC, HOUR_MS));

        Assertions.assertEquals(RejectReason.STORAGE_FULL, e.reason());
        Assertions.assertFalse(tiny.store().contains(e.bundleId()));
    }

    @Test
    void wipeDisablesCreationButKeepsRelaying() throws Exception {
        BundleNode a = node("a");
        BundleNode b = node("b", "alerts");
        String id = a.submit("dtn://*/alerts", "alerts", "before wipe", Priority.NORMAL, Audience.PUBLIC, HOUR_MS);
        Assertions.assertTrue(a.health().ok());

        a.wipe();

        Assertions.assertFalse(a.health().keysOk());
        Assertions.assertFalse(a.health().ok());
        Assertions.assertThrows(IllegalStateException.class, () ->
                a.submit("dtn://*/alerts", "alerts", "after", Priority.NORMAL, Audience.PUBLIC, HOUR_MS));
        sync(a, b);
        Assertions.assertTrue(b.store().contains(id));
        Path securityDir = new BundleMeshConfig(root.resolve("a")).securityRoot();
        Assertions.assertFalse(Files.exists(securityDir.resolve(NodeIdentity.SIGNING_KEY_FILE)));
        Assertions.assertTrue(Files.exists(securityDir.resolve(NodeIdentity.COMMUNITY_KEY_FILE)));
    }

    @Test
    void statsAndMetricsExposeCountsOnly() throws Exception {
        BundleNode a = node("a", "alerts");
        String id = a.submit("dtn://*/alerts", "alerts", "siren", Priority.EMERGENCY, Audience.PUBLIC, HOUR_MS);

        BundleNode.StatsOutcome stats = a.stats();
        Assertions.assertEquals(1L, stats.bundleCount());
        Assertions.assertEquals(1L, stats.deliveries());
        Assertions.assertEquals(1L, stats.pendingByPriority().get("emergency"));

        String text = a.metricsText();
        Assertions.assertTrue(text.contains("bundlemesh_bundles_created_total{priority=\"emergency\",topic=\"alerts\"} 1"), text);
        Assertions.assertTrue(text.contains("bundlemesh_bundles_delivered_total{priority=\"emergency\",topic=\"alerts\"} 1"), text);
        Assertions.assertTrue(text.contains("bundlemesh_store_bundles 1"), text);
        Assertions.assertTrue(text.contains("# TYPE bundlemesh_active_sessions gauge"), text);
        Assertions.assertFalse(text.contains(id));
        Assertions.assertFalse(text.contains(a.address()));
    }

    @Test
    void auditChainCoversNodeOperations() throws Exception {
        BundleNode a = node("a");
        a.submit("dtn://*/alerts", "alerts", "one", Priority.NORMAL, Audience.PUBLIC, HOUR_MS);
        a.sealSecret("mesh-pass", "hunter2".toCharArray(), new byte[]{1, 2, 3});

        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, a.openSecret("mesh-pass", "hunter2".toCharArray()));
        Assertions.assertThrows(AuthenticationException.class, () -> a.openSecret("mesh-pass", "wrong".toCharArray()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> a.openSecret("../escape", "x".toCharArray()));

        var check = a.verifyAudit();
        Assertions.assertTrue(check.intact(), check.detail());
        Assertions.assertTrue(check.rows() >= 5);
    }

    @Test
    void ephemeralRecordsDisappearAfterPurgeTime() throws Exception {
        AtomicLong now = new AtomicLong(1_800_000_000_000L);
        BundleNode a = track(new BundleNode(new BundleMeshConfig(root.resolve("eph")), now::get));
        a.init();

        a.attachEphemeral("listing-1", "outreach", "call back", now.get() + 1_000L);
        Assertions.assertEquals(1, a.ephemeralRecords("listing-1").size());
        Assertions.assertEquals(0, a.reap().ephemeralRemoved());

        now.addAndGet(2_000L);
        Assertions.assertEquals(1, a.reap().ephemeralRemoved());
        Assertions.assertTrue(a.ephemeralRecords("listing-1").isEmpty());
    }

    @Test
    void subscribingLaterDeliversBundlesAlreadyRelayed() throws Exception {
        BundleNode a = node("a");
        BundleNode b = node("b");

        String id = a.submit("dtn://*/market", "market", "maize at noon", Priority.NORMAL, Audience.PUBLIC, HOUR_MS);
        sync(a, b);
        Assertions.assertTrue(list(b.deliveries("market", 0L)).isEmpty());

        b.subscribe("market");
        List<DeliveredPayload> atB = list(b.deliveries("market", 0L));
        Assertions.assertEquals(1, atB.size());
        Assertions.assertEquals(id, atB.get(0).bundleId());
        Assertions.assertEquals("maize at noon", atB.get(0).plaintextUtf8());

        b.subscribe("market");
        Assertions.assertEquals(1, list(b.deliveries("market", 0L)).size());
    }

    @Test
    void scheduledSweepPurgesEphemeralRecordsWithoutExplicitReap() throws Exception {
        AtomicLong now = new AtomicLong(1_800_000_000_000L);
        BundleMeshConfig config = new BundleMeshConfig(root.resolve("sweep"));
        new NodeSettings(1L << 20, 12, HOUR_MS, 100L, 1_000L, 100L, 1_000L, 2_000L, 2, 8,
                List.of(), List.of(), false).save(config.settingsFile());
        BundleNode a = track(new BundleNode(config, now::get));
        a.init();

        a.attachEphemeral("listing-2", "outreach", "call back", now.get() + 1_000L);
        now.addAndGet(2_000L);

        long deadline = System.currentTimeMillis() + 5_000L;
        while (!a.ephemeralRecords("listing-2").isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20L);
        }
        Assertions.assertTrue(a.ephemeralRecords("listing-2").isEmpty());
    }

    @Test
    void settingsSubscriptionsAreAppliedAtInit() throws Exception {
        BundleMeshConfig config = new BundleMeshConfig(root.resolve("preset"));
        NodeSettings preset = new NodeSettings(1L << 20, 12, HOUR_MS, 100L, 1_000L, 1_000L, 2_000L, 100L, 2, 8,
                List.of("alerts", "market"), List.of(), false);
        preset.save(config.settingsFile());
        BundleNode node = track(new BundleNode(config));
        node.init();

        Assertions.assertEquals(List.of("alerts", "market"), node.subscriptions());
        Assertions.assertTrue(node.unsubscribe("market"));
        Assertions.assertEquals(List.of("alerts"), node.subscriptions());
        Assertions.assertThrows(IllegalStateException.class, () -> new BundleNode(config).address());
    }

    private BundleNode node(String name, String... topics) {
        BundleMeshConfig config = new BundleMeshConfig(root.resolve(name));
        NodeIdentity.installCommunityKey(config.securityRoot(), community);
        BundleNode node = track(new BundleNode(config));
        node.init();
        for (String topic : topics) {
            node.subscribe(topic);
        }
        return node;
    }

    private BundleNode track(BundleNode node) {
        nodes.add(node);
        return node;
    }

    private static void sync(BundleNode left, BundleNode right) throws Exception {
        InMemoryLink.Pair pair = InMemoryLink.pair("left", "right");
        Future<SessionOutcome> a = left.exchange(pair.left());
        Future<SessionOutcome> b = right.exchange(pair.right());
        SessionOutcome outcomeA = a.get(20, TimeUnit.SECONDS);
        SessionOutcome outcomeB = b.get(20, TimeUnit.SECONDS);
        Assertions.assertTrue(outcomeA.completed(), outcomeA.toString());
        Assertions.assertTrue(outcomeB.completed(), outcomeB.toString());
    }

    private static <T> List<T> list(Iterable<T> items) {
        List<T> out = new ArrayList<>();
        items.forEach(out::add);
        return out;
    }

    private static String await(CountDownLatch latch, Supplier<String> action) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return action.get();
    }
}
