package io.bundlemesh.runtime;

import io.bundlemesh.codec.BundleCodec;
import io.bundlemesh.config.BundleMeshConfig;
import io.bundlemesh.config.NodeSettings;
import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.DeliveredPayload;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.EphemeralRecord;
import io.bundlemesh.model.Priority;
import io.bundlemesh.observability.AuditLogger;
import io.bundlemesh.observability.BundleMetrics;
import io.bundlemesh.observability.PrometheusFormatter;
import io.bundlemesh.propagation.BackoffPolicy;
import io.bundlemesh.propagation.ExchangeSession;
import io.bundlemesh.propagation.LocalNode;
import io.bundlemesh.propagation.NeighborLink;
import io.bundlemesh.propagation.PropagationWorker;
import io.bundlemesh.propagation.SessionOutcome;
import io.bundlemesh.propagation.SocketNeighborLink;
import io.bundlemesh.security.AuthenticationException;
import io.bundlemesh.security.NodeIdentity;
import io.bundlemesh.security.SecretVault;
import io.bundlemesh.storage.BundleStore;
import io.bundlemesh.storage.Database;
import io.bundlemesh.storage.EphemeralRecordStore;
import io.bundlemesh.storage.ExpiryReaper;
import io.bundlemesh.storage.PutResult;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * One mesh node: identity, store, reaper and propagation worker over a data
 * root. Producers call {@link #submit}, consumers read {@link #deliveries}.
 * Call {@link #init()} before anything else and {@link #close()} when done.
 */
public final class BundleNode implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BundleNode.class);
    private static final Pattern SECRET_NAME = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final long MIN_ACK_TTL_MS = 1_000L;
    private static final int CONNECT_TIMEOUT_MS = 5_000;

    private final BundleMeshConfig config;
    private final LongSupplier clock;
    private final Database database;
    private final LocalNode localNode = new NodeView();

    private volatile NodeSettings settings;
    private NodeIdentity identity;
    private AuditLogger auditLogger;
    private BundleStore store;
    private EphemeralRecordStore ephemeralStore;
    private ExpiryReaper reaper;
    private BackoffPolicy backoff;
    private PropagationWorker worker;
    private volatile boolean initialized;

    public BundleNode(BundleMeshConfig config) {
        this(config, () -> Instant.now().toEpochMilli());
    }

    public BundleNode(BundleMeshConfig config, LongSupplier clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        database.init();
        settings = NodeSettings.load(config.settingsFile());
        identity = NodeIdentity.loadOrCreate(config.securityRoot());
        auditLogger = new AuditLogger(config.auditRoot().resolve("audit.log"));
        store = new BundleStore(database, auditLogger, settings.capacityBytes(), settings.pageSize(), clock);
        ephemeralStore = new EphemeralRecordStore(database);
        reaper = new ExpiryReaper(store, ephemeralStore, settings.reaperIntervalMs(), clock);
        backoff = new BackoffPolicy(settings.baseBackoffMs(), settings.maxBackoffMs());
        worker = new PropagationWorker(this::newSession, reaper, settings.maxWorkers(), settings.shutdownGraceMs());
        long now = clock.getAsLong();
        for (String topic : settings.subscriptions()) {
            store.subscribe(topic, now);
        }
        reaper.start();
        initialized = true;
        auditLogger.log(AuditLogger.AuditEvent.of(
                "node.init",
                "node",
                "node/" + identity.address(),
                "ok",
                Map.of(
                        "capacity_bytes", settings.capacityBytes(),
                        "subscriptions", settings.subscriptions().size(),
                        "trusted_member", settings.trustedMember()
                )
        ));
        log.info("Node {} ready at {}", identity.address(), config.rootDir());
    }

    public String address() {
        requireInit();
        return identity.address();
    }

    public NodeSettings settings() {
        return settings;
    }

    public BundleStore store() {
        requireInit();
        return store;
    }

    public String submit(String destination, String topic, byte[] plaintext, Priority priority, Audience audience, long ttlMs) {
        requireInit();
        return submit(destination, topic, plaintext, priority, audience, ttlMs, settings.defaultHopLimit(), false);
    }

    /**
     * Encrypts, signs and stores a new bundle, then hands it to local
     * consumers when this node is itself a recipient.
     *
     * @return the bundle id
     * @throws IllegalArgumentException     for malformed input
     * @throws SubmissionRejectedException if the store refuses the bundle
     */
    public String submit(
            String destination,
            String topic,
            byte[] plaintext,
            Priority priority,
            Audience audience,
            long ttlMs,
            int hopLimit,
            boolean custody
    ) {
        requireInit();
        if (identity.isWiped()) {
            throw new IllegalStateException("Node keys have been wiped");
        }
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (topic.getBytes(StandardCharsets.UTF_8).length > BundleCodec.MAX_TEXT_BYTES) {
            throw new IllegalArgumentException("topic too long");
        }
        if (BundleStore.CUSTODY_ACK_TOPIC.equals(topic)) {
            throw new IllegalArgumentException("Topic " + topic + " is reserved");
        }
        if (priority == null || audience == null) {
            throw new IllegalArgumentException("priority and audience are required");
        }
        if (ttlMs <= 0L) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (hopLimit < 1 || hopLimit > Bundle.MAX_HOP_LIMIT) {
            throw new IllegalArgumentException("hopLimit must be in [1," + Bundle.MAX_HOP_LIMIT + "]");
        }
        Destination dest = Destination.parse(destination);
        if (!dest.topic().isEmpty() && !dest.topic().equals(topic)) {
            throw new IllegalArgumentException("Destination topic '" + dest.topic() + "' does not match topic '" + topic + "'");
        }
        boolean unicast = dest.kind() == Destination.Kind.UNICAST;
        if (audience == Audience.DESTINATION_ONLY && !unicast) {
            throw new IllegalArgumentException("destination_only audience needs a unicast destination");
        }
        if (custody && !unicast) {
            throw new IllegalArgumentException("custody transfer needs a unicast destination");
        }
        byte[] ciphertext = unicast
                ? identity.sealFor(plaintext, Hex.decode(dest.nodeAddress()))
                : identity.sealFor(plaintext, identity.communityPublicKey());
        Bundle bundle = create(dest, topic, priority, audience, ttlMs, hopLimit, custody, ciphertext);
        PutResult result = store.put(bundle, null, clock.getAsLong());
        if (result.isRejected()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "bundle.submit",
                    "producer",
                    "bundle/" + bundle.id(),
                    "rejected",
                    Map.of("reason", result.reason().name(), "priority", priority.label(), "topic", topic)
            ));
            throw new SubmissionRejectedException(bundle.id(), result.reason());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "bundle.submit",
                "producer",
                "bundle/" + bundle.id(),
                result.isInserted() ? "accepted" : "duplicate",
                Map.of(
                        "priority", priority.label(),
                        "topic", topic,
                        "audience", audience.label(),
                        "custody", custody,
                        "evicted", result.evictedIds().size()
                )
        ));
        if (result.isInserted() && localNode.isLocalRecipient(bundle)) {
            localNode.deliverLocally(bundle);
        }
        return bundle.id();
    }

    public String submit(String destination, String topic, String text, Priority priority, Audience audience, long ttlMs) {
        return submit(destination, topic, text.getBytes(StandardCharsets.UTF_8), priority, audience, ttlMs);
    }

    private Bundle create(
            Destination destination,
            String topic,
            Priority priority,
            Audience audience,
            long ttlMs,
            int hopLimit,
            boolean custody,
            byte[] payload
    ) {
        long created = clock.getAsLong();
        long expires = created + ttlMs < created ? Long.MAX_VALUE : created + ttlMs;
        byte[] source = identity.signingPublicKey();
        byte[] sourceBox = identity.boxPublicKey();
        byte[] signable = BundleCodec.signableBytes(
                source, sourceBox, destination, topic, priority, audience, created, expires, hopLimit, custody, payload);
        return new Bundle(
                BundleCodec.computeId(signable),
                source,
                sourceBox,
                destination,
                topic,
                priority,
                audience,
                created,
                expires,
                hopLimit,
                0,
                custody,
                identity.sign(signable),
                payload
        );
    }

    /**
     * Custody acknowledgement for a bundle addressed to this node: a signed,
     * expedited unicast back to the origin whose payload is the acked id.
     */
    private void acknowledgeCustody(Bundle delivered) {
        long now = clock.getAsLong();
        long ttl = Math.max(MIN_ACK_TTL_MS, delivered.expiresAtMs() - now);
        Bundle ack = create(
                Destination.unicast(delivered.sourceAddress(), BundleStore.CUSTODY_ACK_TOPIC),
                BundleStore.CUSTODY_ACK_TOPIC,
                Priority.EXPEDITED,
                Audience.PUBLIC,
                ttl,
                settings.defaultHopLimit(),
                false,
                delivered.id().getBytes(StandardCharsets.US_ASCII)
        );
        PutResult result = store.put(ack, null, now);
        if (result.isRejected()) {
            log.warn("Custody ack for {} could not be queued: {}", delivered.id(), result.reason());
            return;
        }
        log.debug("Queued custody ack {} for {}", ack.id(), delivered.id());
    }

    public void subscribe(String topic) {
        requireInit();
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        long now = clock.getAsLong();
        store.subscribe(topic, now);
        int caughtUp = 0;
        for (Bundle held : store.listPending(topic, null, now)) {
            if (localNode.isLocalRecipient(held) && !store.isDelivered(held.id())) {
                localNode.deliverLocally(held);
                caughtUp++;
            }
        }
        if (caughtUp > 0) {
            log.info("Delivered {} already stored bundles on newly subscribed topic {}", caughtUp, topic);
        }
    }

    public boolean unsubscribe(String topic) {
        requireInit();
        return store.unsubscribe(topic);
    }

    public List<String> subscriptions() {
        requireInit();
        return store.subscriptions();
    }

    /**
     * Decrypted local deliveries after {@code afterSequence}, in delivery order.
     * {@code topic} may be {@code null} for every topic. Payloads this node
     * cannot decrypt are logged and skipped.
     */
    public Iterable<DeliveredPayload> deliveries(String topic, long afterSequence) {
        requireInit();
        Iterable<BundleStore.StoredDelivery> stored = store.deliveries(topic, afterSequence);
        return () -> new DecryptingIterator(stored.iterator());
    }

    public Iterable<Bundle> pending(String topic, String destination) {
        requireInit();
        return store.listPending(topic, destination == null ? null : Destination.parse(destination), clock.getAsLong());
    }

    public Future<SessionOutcome> exchange(NeighborLink link) {
        requireInit();
        return worker.submit(link);
    }

    public Future<SessionOutcome> connect(String host, int port) {
        requireInit();
        return exchange(SocketNeighborLink.connect(host, port, CONNECT_TIMEOUT_MS));
    }

    public int serve(int port) {
        requireInit();
        return worker.serve(port);
    }

    public ExpiryReaper.ReapOutcome reap() {
        requireInit();
        return reaper.runOnce();
    }

    public EphemeralRecord attachEphemeral(String parentId, String kind, String body, long purgeAtMs) {
        requireInit();
        return ephemeralStore.attach(parentId, kind, body, purgeAtMs, clock.getAsLong());
    }

    public List<EphemeralRecord> ephemeralRecords(String parentId) {
        requireInit();
        return ephemeralStore.listByParent(parentId);
    }

    public List<BundleStore.NeighborRecord> neighbors() {
        requireInit();
        return store.listNeighbors();
    }

    public Path sealSecret(String name, char[] passphrase, byte[] secret) {
        requireInit();
        Path file = secretFile(name);
        new SecretVault().sealToFile(file, passphrase, secret);
        auditLogger.log(AuditLogger.AuditEvent.of("secret.seal", "cli", "secret/" + name, "ok", Map.of()));
        return file;
    }

    public byte[] openSecret(String name, char[] passphrase) {
        requireInit();
        try {
            byte[] secret = new SecretVault().openFile(secretFile(name), passphrase);
            auditLogger.log(AuditLogger.AuditEvent.of("secret.open", "cli", "secret/" + name, "ok", Map.of()));
            return secret;
        } catch (AuthenticationException e) {
            auditLogger.log(AuditLogger.AuditEvent.of("secret.open", "cli", "secret/" + name, "denied", Map.of()));
            throw e;
        }
    }

    private Path secretFile(String name) {
        if (name == null || !SECRET_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Secret name must match " + SECRET_NAME.pattern());
        }
        return config.secretsRoot().resolve(name + ".sealed");
    }

    /**
     * Destroys this node's keys. The node can still relay stored bundles but
     * can no longer create, sign or decrypt.
     */
    public void wipe() {
        requireInit();
        identity.wipe();
        auditLogger.log(AuditLogger.AuditEvent.of("identity.wipe", "cli", "node/keys", "ok", Map.of()));
        log.warn("Node keys wiped");
    }

    public AuditLogger.ChainCheck verifyAudit() {
        requireInit();
        return auditLogger.verifyChain();
    }

    public HealthOutcome health() {
        requireInit();
        boolean dbOk;
        try (Connection ignored = database.openConnection()) {
            dbOk = true;
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            dbOk = false;
        }
        boolean auditOk = Files.isDirectory(config.auditRoot());
        boolean securityOk = Files.isDirectory(config.securityRoot());
        boolean keysOk = !identity.isWiped();
        BundleStore.StoreStats s = dbOk ? store.stats(clock.getAsLong()) : null;
        boolean storageOk = s != null && s.usedBytes() <= s.capacityBytes();
        boolean ok = dbOk && auditOk && securityOk && keysOk && storageOk;
        return new HealthOutcome(
                ok,
                dbOk,
                auditOk,
                securityOk,
                keysOk,
                s == null ? -1L : s.usedBytes(),
                s == null ? -1L : s.capacityBytes(),
                worker.activeSessions(),
                Instant.ofEpochMilli(clock.getAsLong()).toString()
        );
    }

    public StatsOutcome stats() {
        requireInit();
        long now = clock.getAsLong();
        BundleStore.StoreStats s = store.stats(now);
        List<BundleStore.NeighborRecord> neighbors = store.listNeighbors();
        long suspect = neighbors.stream().filter(n -> n.suspectCount() > 0).count();
        long backingOff = neighbors.stream().filter(n -> n.inBackoff(now)).count();
        return new StatsOutcome(
                s.bundleCount(),
                s.usedBytes(),
                s.capacityBytes(),
                new LinkedHashMap<>(s.pendingByPriority()),
                s.custodyPending(),
                s.queuedUndelivered(),
                s.deliveries(),
                s.neighbors(),
                suspect,
                backingOff,
                worker.activeSessions(),
                store.metricCounters()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    @Override
    public synchronized void close() {
        if (!initialized) {
            return;
        }
        initialized = false;
        worker.close();
        reaper.close();
        log.info("Node {} closed", identity.isWiped() ? "(wiped)" : identity.address());
    }

    private ExchangeSession newSession(NeighborLink link) {
        return new ExchangeSession(link, store, localNode, backoff, settings.receiveTimeoutMs(), clock);
    }

    private void requireInit() {
        if (!initialized) {
            throw new IllegalStateException("BundleNode is not initialized");
        }
    }

    private Optional<byte[]> decrypt(Bundle bundle) {
        try {
            if (bundle.destination().kind() == Destination.Kind.UNICAST) {
                return Optional.of(identity.openFrom(bundle.payload(), bundle.sourceBoxKey()));
            }
            return Optional.of(identity.openCommunity(bundle.payload(), bundle.sourceBoxKey()));
        } catch (AuthenticationException e) {
            log.warn("Skipping bundle {}: payload failed authentication ({})", bundle.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private final class DecryptingIterator implements Iterator<DeliveredPayload> {
        private final Iterator<BundleStore.StoredDelivery> source;
        private DeliveredPayload next;

        private DecryptingIterator(Iterator<BundleStore.StoredDelivery> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                BundleStore.StoredDelivery d = source.next();
                Bundle b = d.bundle();
                if (BundleStore.CUSTODY_ACK_TOPIC.equals(b.topic())) {
                    continue;
                }
                Optional<byte[]> plaintext = decrypt(b);
                if (plaintext.isPresent()) {
                    next = new DeliveredPayload(
                            d.sequence(), b.id(), b.topic(), b.priority(), b.audience(),
                            b.createdAtMs(), d.deliveredAtMs(), plaintext.get());
                }
            }
            return next != null;
        }

        @Override
        public DeliveredPayload next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DeliveredPayload out = next;
            next = null;
            return out;
        }
    }

    /**
     * Session-facing view of this node.
     */
    private final class NodeView implements LocalNode {
        @Override
        public String address() {
            return identity.address();
        }

        @Override
        public List<String> subscribedTopics() {
            return store.subscriptions();
        }

        @Override
        public boolean trustedMember() {
            return settings.trustedMember();
        }

        @Override
        public boolean trustsNeighbor(String neighborId) {
            return settings.isTrustedNeighbor(neighborId);
        }

        @Override
        public boolean isLocalRecipient(Bundle bundle) {
            Destination d = bundle.destination();
            return switch (d.kind()) {
                case UNICAST -> d.nodeAddress().equals(identity.address());
                case MULTICAST -> store.isSubscribed(bundle.topic());
                case TRUSTED_BROADCAST -> settings.trustedMember() && store.isSubscribed(bundle.topic());
            };
        }

        @Override
        public void deliverLocally(Bundle bundle) {
            if (BundleStore.CUSTODY_ACK_TOPIC.equals(bundle.topic())) {
                log.debug("Custody ack {} reached its origin", bundle.id());
                return;
            }
            boolean fresh = store.recordDelivery(bundle.id(), bundle.topic(), clock.getAsLong());
            if (!fresh) {
                return;
            }
            log.debug("Delivered bundle {} on topic {}", bundle.id(), bundle.topic());
            boolean fromElsewhere = !bundle.sourceAddress().equals(identity.address());
            if (bundle.custodyRequested() && fromElsewhere && !identity.isWiped()) {
                acknowledgeCustody(bundle);
            }
        }
    }

    public record HealthOutcome(
            boolean ok,
            boolean dbOk,
            boolean auditDirOk,
            boolean securityDirOk,
            boolean keysOk,
            long usedBytes,
            long capacityBytes,
            int activeSessions,
            String checkedAt
    ) {
    }

    public record StatsOutcome(
            long bundleCount,
            long usedBytes,
            long capacityBytes,
            Map<String, Long> pendingByPriority,
            long custodyPending,
            long queuedUndelivered,
            long deliveries,
            long neighbors,
            long suspectNeighbors,
            long neighborsInBackoff,
            int activeSessions,
            List<BundleMetrics.Counter> counters
    ) {
    }
}
