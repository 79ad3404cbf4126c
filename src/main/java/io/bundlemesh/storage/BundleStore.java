package io.bundlemesh.storage;

import io.bundlemesh.codec.BundleCodec;
import io.bundlemesh.codec.DecodeException;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.CustodyState;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.Priority;
import io.bundlemesh.model.QueueEntry;
import io.bundlemesh.model.RejectReason;
import io.bundlemesh.observability.AuditLogger;
import io.bundlemesh.observability.BundleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Durable, size-bounded set of verified bundles plus the per-neighbor,
 * delivery and subscription state around them.
 *
 * <p>Nothing reaches the {@code bundles} table without passing
 * {@link BundleValidator}. Stored bundles are never overwritten: a second copy
 * of a known id is ignored and the first stored hop count stays.
 */
public final class BundleStore {
    private static final Logger log = LoggerFactory.getLogger(BundleStore.class);
    public static final String CUSTODY_ACK_TOPIC = "custody-acks";
    private static final String BUNDLE_COLUMNS = "bundle_id, priority_rank, expires_at_ms, encoded";

    private final Database database;
    private final AuditLogger auditLogger;
    private final long capacityBytes;
    private final int pageSize;
    private final LongSupplier clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public BundleStore(Database database, AuditLogger auditLogger, long capacityBytes, int pageSize) {
        this(database, auditLogger, capacityBytes, pageSize, () -> Instant.now().toEpochMilli());
    }

    public BundleStore(Database database, AuditLogger auditLogger, long capacityBytes, int pageSize, LongSupplier clock) {
        this.database = database;
        this.auditLogger = auditLogger;
        this.capacityBytes = capacityBytes;
        this.pageSize = Math.max(1, pageSize);
        this.clock = clock;
    }

    public long capacityBytes() {
        return capacityBytes;
    }

    public PutResult put(Bundle bundle) {
        return put(bundle, null, clock.getAsLong());
    }

    public PutResult put(Bundle bundle, String receivedFrom) {
        return put(bundle, receivedFrom, clock.getAsLong());
    }

    /**
     * Verifies and stores a bundle. When the capacity budget is exceeded, bundles
     * that do not outrank the incoming one are evicted first: lowest priority,
     * then soonest expiry, with custody-pending bundles taken only as a last resort.
     */
    public PutResult put(Bundle bundle, String receivedFrom, long nowMs) {
        Optional<RejectReason> invalid = BundleValidator.check(bundle, nowMs);
        if (invalid.isPresent()) {
            return reject(bundle, invalid.get(), receivedFrom);
        }
        byte[] encoded = BundleCodec.encode(bundle);
        String ackFor = ackTarget(bundle);
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                if (exists(c, bundle.id())) {
                    BundleMetrics.increment(c, BundleMetrics.DUPLICATE, bundle.priority(), bundle.topic(), 1L);
                    c.commit();
                    log.debug("Duplicate bundle ignored: {}", bundle.id());
                    return PutResult.duplicate(bundle.id());
                }
                List<String> evicted = List.of();
                long used = usedBytes(c);
                if (used + encoded.length > capacityBytes) {
                    List<Victim> victims = chooseVictims(c, bundle.priority(), used + encoded.length - capacityBytes, nowMs);
                    if (victims == null) {
                        c.rollback();
                        return reject(bundle, RejectReason.STORAGE_FULL, receivedFrom);
                    }
                    evicted = evict(c, victims, bundle.id());
                }
                insert(c, bundle, encoded, receivedFrom, ackFor, nowMs);
                if (ackFor != null) {
                    markAcknowledged(c, ackFor, bundle.sourceAddress());
                }
                BundleMetrics.increment(c,
                        receivedFrom == null ? BundleMetrics.CREATED : BundleMetrics.RECEIVED,
                        bundle.priority(), bundle.topic(), 1L);
                c.commit();
                return PutResult.inserted(bundle.id(), evicted);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store bundle " + bundle.id(), e);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Bundle> get(String bundleId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + BUNDLE_COLUMNS + " FROM bundles WHERE bundle_id=?")) {
            ps.setString(1, bundleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(bundleFrom(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read bundle " + bundleId, e);
        }
    }

    public boolean contains(String bundleId) {
        try (Connection c = database.openConnection()) {
            return exists(c, bundleId);
        } catch (SQLException e) {
            throw new StorageException("Failed to check bundle " + bundleId, e);
        }
    }

    /**
     * Unexpired bundles that are still awaiting propagation, in scheduling order.
     * Either filter may be {@code null}. Lazy and restartable.
     */
    public Iterable<Bundle> listPending(String topic, Destination destination, long nowMs) {
        String destinationText = destination == null ? null : destination.toString();
        return new PagedIterable<>(pageSize, after -> pendingPage(topic, destinationText, nowMs, after));
    }

    private List<Bundle> pendingPage(String topic, String destination, long nowMs, Bundle after) {
        StringBuilder sql = new StringBuilder("SELECT ").append(BUNDLE_COLUMNS).append("""
                 FROM bundles
                WHERE expires_at_ms >= ?
                  AND custody_state <> 'ACKNOWLEDGED'
                """);
        if (topic != null) {
            sql.append(" AND topic = ?");
        }
        if (destination != null) {
            sql.append(" AND destination = ?");
        }
        if (after != null) {
            sql.append("""
                     AND (priority_rank > ?
                      OR (priority_rank = ? AND expires_at_ms > ?)
                      OR (priority_rank = ? AND expires_at_ms = ? AND bundle_id > ?))
                    """);
        }
        sql.append(" ORDER BY priority_rank ASC, expires_at_ms ASC, bundle_id ASC LIMIT ?");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, nowMs);
            if (topic != null) {
                ps.setString(i++, topic);
            }
            if (destination != null) {
                ps.setString(i++, destination);
            }
            if (after != null) {
                int rank = after.priority().rank();
                ps.setInt(i++, rank);
                ps.setInt(i++, rank);
                ps.setLong(i++, after.expiresAtMs());
                ps.setInt(i++, rank);
                ps.setLong(i++, after.expiresAtMs());
                ps.setString(i++, after.id());
            }
            ps.setInt(i, pageSize);
            List<Bundle> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(bundleFrom(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list pending bundles", e);
        }
    }

    /**
     * Bundles that may be offered to a neighbor now: unexpired, forwardable, not
     * acknowledged, not yet delivered to it, not received from it and not waiting
     * out a backoff for it. Audience rules are applied by the caller.
     */
    public List<QueueEntry> forwardableFor(String neighborId, long nowMs) {
        String sql = """
                SELECT b.bundle_id, b.priority_rank, b.expires_at_ms, b.encoded,
                       q.attempts, q.last_attempt_ms, q.next_attempt_ms, q.delivered
                FROM bundles b
                LEFT JOIN queue_state q ON q.bundle_id = b.bundle_id AND q.neighbor_id = ?
                WHERE b.expires_at_ms >= ?
                  AND b.hop_count < b.hop_limit
                  AND b.custody_state <> 'ACKNOWLEDGED'
                  AND (b.received_from IS NULL OR b.received_from <> ?)
                  AND (q.bundle_id IS NULL OR (q.delivered = 0 AND q.next_attempt_ms <= ?))
                ORDER BY b.priority_rank ASC, b.expires_at_ms ASC, b.bundle_id ASC
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, neighborId);
            ps.setLong(2, nowMs);
            ps.setString(3, neighborId);
            ps.setLong(4, nowMs);
            List<QueueEntry> out = new ArrayList<>();
            List<String> corrupt = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Bundle bundle = verifiedFrom(rs, nowMs);
                    if (bundle == null) {
                        corrupt.add(rs.getString("bundle_id"));
                        continue;
                    }
                    out.add(new QueueEntry(
                            bundle,
                            neighborId,
                            rs.getInt("attempts"),
                            rs.getLong("last_attempt_ms"),
                            rs.getLong("next_attempt_ms"),
                            rs.getInt("delivered") == 1
                    ));
                }
            }
            if (!corrupt.isEmpty()) {
                quarantine(corrupt);
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list forwardable bundles for " + neighborId, e);
        }
    }

    public Optional<QueueEntry> queueEntry(String bundleId, String neighborId) {
        Optional<Bundle> bundle = get(bundleId);
        if (bundle.isEmpty()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT attempts, last_attempt_ms, next_attempt_ms, delivered FROM queue_state WHERE bundle_id=? AND neighbor_id=?")) {
            ps.setString(1, bundleId);
            ps.setString(2, neighborId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.of(QueueEntry.fresh(bundle.get(), neighborId));
                }
                return Optional.of(new QueueEntry(
                        bundle.get(),
                        neighborId,
                        rs.getInt("attempts"),
                        rs.getLong("last_attempt_ms"),
                        rs.getLong("next_attempt_ms"),
                        rs.getInt("delivered") == 1
                ));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read queue state for " + bundleId, e);
        }
    }

    public void recordAttempt(String bundleId, String neighborId, long nowMs) {
        executeUpdate("""
                INSERT INTO queue_state(bundle_id, neighbor_id, attempts, last_attempt_ms, next_attempt_ms, delivered)
                VALUES(?,?,1,?,0,0)
                ON CONFLICT(bundle_id, neighbor_id) DO UPDATE SET
                    attempts = attempts + 1,
                    last_attempt_ms = excluded.last_attempt_ms
                """, "record attempt", bundleId, neighborId, nowMs);
    }

    public void recordFailedAttempt(String bundleId, String neighborId, long nextAttemptMs) {
        executeUpdate("""
                INSERT INTO queue_state(bundle_id, neighbor_id, attempts, last_attempt_ms, next_attempt_ms, delivered)
                VALUES(?,?,1,0,?,0)
                ON CONFLICT(bundle_id, neighbor_id) DO UPDATE SET next_attempt_ms = excluded.next_attempt_ms
                """, "record failed attempt", bundleId, neighborId, nextAttemptMs);
    }

    /**
     * Marks the neighbor as holding the bundle. {@code forwarded} counts a
     * transfer we made, as opposed to a copy the neighbor already had.
     */
    public void markDelivered(String bundleId, String neighborId, long nowMs, boolean forwarded) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO queue_state(bundle_id, neighbor_id, attempts, last_attempt_ms, next_attempt_ms, delivered)
                        VALUES(?,?,0,?,0,1)
                        ON CONFLICT(bundle_id, neighbor_id) DO UPDATE SET delivered = 1
                        """)) {
                    ps.setString(1, bundleId);
                    ps.setString(2, neighborId);
                    ps.setLong(3, nowMs);
                    ps.executeUpdate();
                }
                if (forwarded) {
                    BundleHead head = head(c, bundleId);
                    if (head != null) {
                        BundleMetrics.increment(c, BundleMetrics.FORWARDED, head.priority(), head.topic(), 1L);
                    }
                }
                c.commit();
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to mark delivered " + bundleId, e);
        }
    }

    public void recordCustodyHolder(String bundleId, String neighborId) {
        executeUpdate("UPDATE bundles SET custody_holder=? WHERE bundle_id=? AND custody_requested=1",
                "record custody holder", neighborId, bundleId);
    }

    public Optional<String> custodyHolder(String bundleId) {
        return queryString("SELECT custody_holder FROM bundles WHERE bundle_id=?", bundleId);
    }

    public Optional<CustodyState> custodyState(String bundleId) {
        return queryString("SELECT custody_state FROM bundles WHERE bundle_id=?", bundleId).map(CustodyState::valueOf);
    }

    /**
     * Records local delivery. Returns false when the bundle was already delivered.
     */
    public boolean recordDelivery(String bundleId, String topic, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int inserted;
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO deliveries(bundle_id, topic, delivered_at_ms) VALUES(?,?,?)")) {
                    ps.setString(1, bundleId);
                    ps.setString(2, topic);
                    ps.setLong(3, nowMs);
                    inserted = ps.executeUpdate();
                }
                if (inserted > 0) {
                    BundleHead head = head(c, bundleId);
                    if (head != null) {
                        BundleMetrics.increment(c, BundleMetrics.DELIVERED, head.priority(), head.topic(), 1L);
                    }
                }
                c.commit();
                return inserted > 0;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to record delivery " + bundleId, e);
        }
    }

    public boolean isDelivered(String bundleId) {
        return queryString("SELECT bundle_id FROM deliveries WHERE bundle_id=?", bundleId).isPresent();
    }

    /**
     * Locally delivered, unexpired bundles in delivery order. {@code topic} may be
     * {@code null} for all topics. Lazy and restartable.
     */
    public Iterable<StoredDelivery> deliveries(String topic, long afterSequence) {
        return new PagedIterable<>(pageSize, after -> deliveryPage(topic, after == null ? afterSequence : after.sequence()));
    }

    private List<StoredDelivery> deliveryPage(String topic, long afterSequence) {
        String sql = """
                SELECT d.sequence, d.delivered_at_ms, b.bundle_id, b.priority_rank, b.expires_at_ms, b.encoded
                FROM deliveries d
                JOIN bundles b ON b.bundle_id = d.bundle_id
                WHERE d.sequence > ?
                  AND b.expires_at_ms >= ?
                """ + (topic == null ? "" : " AND d.topic = ?") + " ORDER BY d.sequence ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, afterSequence);
            ps.setLong(i++, clock.getAsLong());
            if (topic != null) {
                ps.setString(i++, topic);
            }
            ps.setInt(i, pageSize);
            List<StoredDelivery> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredDelivery(rs.getLong("sequence"), rs.getLong("delivered_at_ms"), bundleFrom(rs)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list deliveries", e);
        }
    }

    public void subscribe(String topic, long nowMs) {
        executeUpdate("INSERT OR IGNORE INTO subscriptions(topic, created_at_ms) VALUES(?,?)", "subscribe", topic, nowMs);
    }

    public boolean unsubscribe(String topic) {
        return executeUpdate("DELETE FROM subscriptions WHERE topic=?", "unsubscribe", topic) > 0;
    }

    public List<String> subscriptions() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT topic FROM subscriptions ORDER BY topic");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list subscriptions", e);
        }
    }

    public boolean isSubscribed(String topic) {
        return queryString("SELECT topic FROM subscriptions WHERE topic=?", topic).isPresent();
    }

    public void recordContactSuccess(String neighborId, long nowMs, int sent, int received) {
        executeUpdate("""
                INSERT INTO neighbors(neighbor_id, last_contact_ms, last_outcome, consecutive_failures, next_contact_ms,
                                      suspect_count, bundles_sent, bundles_received)
                VALUES(?,?,'completed',0,0,0,?,?)
                ON CONFLICT(neighbor_id) DO UPDATE SET
                    last_contact_ms = excluded.last_contact_ms,
                    last_outcome = 'completed',
                    consecutive_failures = 0,
                    next_contact_ms = 0,
                    bundles_sent = bundles_sent + excluded.bundles_sent,
                    bundles_received = bundles_received + excluded.bundles_received
                """, "record contact", neighborId, nowMs, sent, received);
    }

    /**
     * Records a failed or degraded contact and returns the new consecutive failure count.
     */
    public int recordContactFailure(String neighborId, long nowMs, String outcome, long nextContactMs) {
        executeUpdate("""
                INSERT INTO neighbors(neighbor_id, last_contact_ms, last_outcome, consecutive_failures, next_contact_ms)
                VALUES(?,?,?,1,?)
                ON CONFLICT(neighbor_id) DO UPDATE SET
                    last_contact_ms = excluded.last_contact_ms,
                    last_outcome = excluded.last_outcome,
                    consecutive_failures = consecutive_failures + 1,
                    next_contact_ms = excluded.next_contact_ms
                """, "record contact failure", neighborId, nowMs, outcome, nextContactMs);
        return neighbor(neighborId).map(NeighborRecord::consecutiveFailures).orElse(1);
    }

    public void markSuspect(String neighborId) {
        executeUpdate("""
                INSERT INTO neighbors(neighbor_id, suspect_count) VALUES(?,1)
                ON CONFLICT(neighbor_id) DO UPDATE SET suspect_count = suspect_count + 1
                """, "mark suspect", neighborId);
    }

    public int consecutiveFailures(String neighborId) {
        return neighbor(neighborId).map(NeighborRecord::consecutiveFailures).orElse(0);
    }

    public Optional<NeighborRecord> neighbor(String neighborId) {
        List<NeighborRecord> rows = neighbors("SELECT * FROM neighbors WHERE neighbor_id=?", neighborId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<NeighborRecord> listNeighbors() {
        return neighbors("SELECT * FROM neighbors ORDER BY neighbor_id");
    }

    public void recordRejected(Priority priority, String topic) {
        try (Connection c = database.openConnection()) {
            BundleMetrics.increment(c, BundleMetrics.QUARANTINED, priority, topic, 1L);
        } catch (SQLException e) {
            throw new StorageException("Failed to count rejected bundle", e);
        }
    }

    public List<BundleMetrics.Counter> metricCounters() {
        try (Connection c = database.openConnection()) {
            return BundleMetrics.read(c);
        } catch (SQLException e) {
            throw new StorageException("Failed to read metric counters", e);
        }
    }

    public StoreStats stats(long nowMs) {
        try (Connection c = database.openConnection()) {
            Map<String, Long> pendingByPriority = new LinkedHashMap<>();
            for (Priority p : Priority.values()) {
                pendingByPriority.put(p.label(), 0L);
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT priority_rank, COUNT(*) FROM bundles
                    WHERE expires_at_ms >= ? AND custody_state <> 'ACKNOWLEDGED'
                    GROUP BY priority_rank
                    """)) {
                ps.setLong(1, nowMs);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        pendingByPriority.put(Priority.fromRank(rs.getInt(1)).label(), rs.getLong(2));
                    }
                }
            }
            return new StoreStats(
                    count(c, "SELECT COUNT(*) FROM bundles"),
                    usedBytes(c),
                    capacityBytes,
                    pendingByPriority,
                    count(c, "SELECT COUNT(*) FROM bundles WHERE custody_state='PENDING'"),
                    count(c, "SELECT COUNT(*) FROM deliveries"),
                    count(c, "SELECT COUNT(*) FROM neighbors"),
                    count(c, "SELECT COUNT(*) FROM queue_state WHERE delivered=0")
            );
        } catch (SQLException e) {
            throw new StorageException("Failed to compute store stats", e);
        }
    }

    /**
     * Deletes bundles with {@code expires_at_ms < nowMs} and every row that refers
     * to them. Only {@link ExpiryReaper} calls this.
     */
    int purgeExpired(long nowMs) {
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int removed = 0;
                try (PreparedStatement ps = c.prepareStatement("""
                        SELECT priority_rank, topic, COUNT(*) FROM bundles WHERE expires_at_ms < ?
                        GROUP BY priority_rank, topic
                        """)) {
                    ps.setLong(1, nowMs);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            long n = rs.getLong(3);
                            BundleMetrics.increment(c, BundleMetrics.EXPIRED, Priority.fromRank(rs.getInt(1)), rs.getString(2), n);
                        }
                    }
                }
                String expired = "SELECT bundle_id FROM bundles WHERE expires_at_ms < ?";
                try (PreparedStatement q = c.prepareStatement("DELETE FROM queue_state WHERE bundle_id IN (" + expired + ")");
                     PreparedStatement d = c.prepareStatement("DELETE FROM deliveries WHERE bundle_id IN (" + expired + ")");
                     PreparedStatement b = c.prepareStatement("DELETE FROM bundles WHERE expires_at_ms < ?")) {
                    q.setLong(1, nowMs);
                    q.executeUpdate();
                    d.setLong(1, nowMs);
                    d.executeUpdate();
                    b.setLong(1, nowMs);
                    removed = b.executeUpdate();
                }
                c.commit();
                return removed;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to purge expired bundles", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Re-verifies every unexpired stored bundle and deletes those whose row no
     * longer decodes, verifies or matches its id. Only {@link ExpiryReaper} calls this.
     */
    int quarantineCorrupt(long nowMs) {
        List<String> corrupt = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT bundle_id, encoded FROM bundles WHERE expires_at_ms >= ? ORDER BY bundle_id")) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    if (verifiedFrom(rs, nowMs) == null) {
                        corrupt.add(rs.getString("bundle_id"));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to scan stored bundles", e);
        }
        return corrupt.isEmpty() ? 0 : quarantine(corrupt);
    }

    private int quarantine(List<String> bundleIds) {
        writeLock.lock();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                List<String> removed = new ArrayList<>();
                for (String id : bundleIds) {
                    BundleHead head = head(c, id);
                    if (head == null) {
                        continue;
                    }
                    deleteBundle(c, id);
                    BundleMetrics.increment(c, BundleMetrics.QUARANTINED, head.priority(), head.topic(), 1L);
                    removed.add(id);
                }
                c.commit();
                if (auditLogger != null) {
                    for (String id : removed) {
                        auditLogger.log(AuditLogger.AuditEvent.of(
                                "bundle.quarantine", "store", "bundle/" + id, "deleted", Map.of("stage", "stored")));
                    }
                }
                return removed.size();
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to quarantine " + bundleIds.size() + " bundles", e);
        } finally {
            writeLock.unlock();
        }
    }

    private PutResult reject(Bundle bundle, RejectReason reason, String receivedFrom) {
        if (reason == RejectReason.EXPIRED) {
            log.debug("Rejected bundle {}: {}", bundle.id(), reason);
        } else {
            log.warn("Rejected bundle {} from {}: {}", bundle.id(), receivedFrom == null ? "local" : receivedFrom, reason);
        }
        recordRejected(bundle.priority(), bundle.topic());
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", reason.name());
            details.put("from", receivedFrom == null ? "local" : receivedFrom);
            auditLogger.log(AuditLogger.AuditEvent.of("bundle.reject", "store", "bundle/" + bundle.id(), "rejected", details));
        }
        return PutResult.rejected(bundle.id(), reason);
    }

    private List<Victim> chooseVictims(Connection c, Priority incoming, long needBytes, long nowMs) throws SQLException {
        String sql = """
                SELECT bundle_id, size_bytes, priority_rank, topic, custody_state
                FROM bundles
                WHERE priority_rank >= ? OR expires_at_ms < ?
                ORDER BY CASE
                             WHEN expires_at_ms < ? THEN 0
                             WHEN custody_state = 'ACKNOWLEDGED' THEN 1
                             WHEN custody_state = 'PENDING' THEN 3
                             ELSE 2
                         END ASC,
                         priority_rank DESC,
                         expires_at_ms ASC,
                         bundle_id ASC
                """;
        List<Victim> chosen = new ArrayList<>();
        long freed = 0L;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, incoming.rank());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next() && freed < needBytes) {
                    Victim v = new Victim(
                            rs.getString("bundle_id"),
                            rs.getLong("size_bytes"),
                            Priority.fromRank(rs.getInt("priority_rank")),
                            rs.getString("topic"),
                            CustodyState.PENDING.name().equals(rs.getString("custody_state"))
                    );
                    chosen.add(v);
                    freed += v.sizeBytes();
                }
            }
        }
        return freed >= needBytes ? chosen : null;
    }

    private List<String> evict(Connection c, List<Victim> victims, String incomingId) throws SQLException {
        List<String> ids = new ArrayList<>();
        try (PreparedStatement q = c.prepareStatement("DELETE FROM queue_state WHERE bundle_id=?");
             PreparedStatement d = c.prepareStatement("DELETE FROM deliveries WHERE bundle_id=?");
             PreparedStatement b = c.prepareStatement("DELETE FROM bundles WHERE bundle_id=?")) {
            for (Victim v : victims) {
                q.setString(1, v.bundleId());
                q.executeUpdate();
                d.setString(1, v.bundleId());
                d.executeUpdate();
                b.setString(1, v.bundleId());
                b.executeUpdate();
                BundleMetrics.increment(c, BundleMetrics.EVICTED, v.priority(), v.topic(), 1L);
                if (v.custodyPending()) {
                    BundleMetrics.increment(c, BundleMetrics.CUSTODY_LOST, v.priority(), v.topic(), 1L);
                    log.warn("Custody lost: evicted unacknowledged bundle {} to admit {}", v.bundleId(), incomingId);
                    if (auditLogger != null) {
                        auditLogger.log(AuditLogger.AuditEvent.of(
                                "custody.loss",
                                "store",
                                "bundle/" + v.bundleId(),
                                "evicted",
                                Map.of("admitted", incomingId, "priority", v.priority().label())
                        ));
                    }
                } else {
                    log.info("Evicted bundle {} ({}) to admit {}", v.bundleId(), v.priority().label(), incomingId);
                }
                ids.add(v.bundleId());
            }
        }
        return ids;
    }

    private void insert(Connection c, Bundle bundle, byte[] encoded, String receivedFrom, String ackFor, long nowMs)
            throws SQLException {
        CustodyState custody = bundle.custodyRequested()
                ? (ackStored(c, bundle) ? CustodyState.ACKNOWLEDGED : CustodyState.PENDING)
                : CustodyState.NONE;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO bundles(bundle_id, topic, destination, priority_rank, audience, created_at_ms, expires_at_ms,
                                    hop_limit, hop_count, custody_requested, custody_state, custody_holder,
                                    received_from, ack_for, ack_source, size_bytes, stored_at_ms, encoded)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,NULL,?,?,?,?,?,?)
                """)) {
            ps.setString(1, bundle.id());
            ps.setString(2, bundle.topic());
            ps.setString(3, bundle.destination().toString());
            ps.setInt(4, bundle.priority().rank());
            ps.setString(5, bundle.audience().name());
            ps.setLong(6, bundle.createdAtMs());
            ps.setLong(7, bundle.expiresAtMs());
            ps.setInt(8, bundle.hopLimit());
            ps.setInt(9, bundle.hopCount());
            ps.setInt(10, bundle.custodyRequested() ? 1 : 0);
            ps.setString(11, custody.name());
            ps.setString(12, receivedFrom);
            ps.setString(13, ackFor);
            ps.setString(14, ackFor == null ? null : bundle.sourceAddress());
            ps.setLong(15, encoded.length);
            ps.setLong(16, nowMs);
            ps.setBytes(17, encoded);
            ps.executeUpdate();
        }
    }

    private static String ackTarget(Bundle bundle) {
        if (!CUSTODY_ACK_TOPIC.equals(bundle.topic()) || bundle.payload().length != BundleCodec.ID_BYTES * 2) {
            return null;
        }
        String target = new String(bundle.payload(), StandardCharsets.US_ASCII);
        for (int i = 0; i < target.length(); i++) {
            if (Character.digit(target.charAt(i), 16) < 0) {
                return null;
            }
        }
        return target.toLowerCase(Locale.ROOT);
    }

    /**
     * Honours an ack only from the unicast destination of a bundle that asked
     * for custody.
     */
    private static boolean markAcknowledged(Connection c, String bundleId, String ackSource) throws SQLException {
        String destination;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT destination FROM bundles WHERE bundle_id=? AND custody_requested=1 AND custody_state='PENDING'")) {
            ps.setString(1, bundleId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                destination = rs.getString(1);
            }
        }
        String expected = Destination.parse(destination).nodeAddress();
        if (expected.isEmpty() || !expected.equals(ackSource)) {
            log.warn("Ignoring custody ack for {} from {}: not its destination", bundleId, ackSource);
            return false;
        }
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE bundles SET custody_state='ACKNOWLEDGED' WHERE bundle_id=? AND custody_state='PENDING'")) {
            ps.setString(1, bundleId);
            boolean changed = ps.executeUpdate() > 0;
            if (changed) {
                log.info("Bundle {} acknowledged by destination", bundleId);
            }
            return changed;
        }
    }

    private static boolean ackStored(Connection c, Bundle bundle) throws SQLException {
        String destination = bundle.destination().nodeAddress();
        if (destination.isEmpty()) {
            return false;
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM bundles WHERE ack_for=? AND ack_source=? LIMIT 1")) {
            ps.setString(1, bundle.id());
            ps.setString(2, destination);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static boolean exists(Connection c, String bundleId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM bundles WHERE bundle_id=?")) {
            ps.setString(1, bundleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static long usedBytes(Connection c) throws SQLException {
        return count(c, "SELECT COALESCE(SUM(size_bytes), 0) FROM bundles");
    }

    private static long count(Connection c, String sql) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static BundleHead head(Connection c, String bundleId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT priority_rank, topic FROM bundles WHERE bundle_id=?")) {
            ps.setString(1, bundleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new BundleHead(Priority.fromRank(rs.getInt(1)), rs.getString(2)) : null;
            }
        }
    }

    private static Bundle bundleFrom(ResultSet rs) throws SQLException {
        String id = rs.getString("bundle_id");
        try {
            return BundleCodec.decode(rs.getBytes("encoded"));
        } catch (DecodeException e) {
            throw new StorageException("Stored bundle is corrupt: " + id, e);
        }
    }

    /**
     * Decodes and re-validates a stored row; {@code null} when the row is corrupt.
     */
    private static Bundle verifiedFrom(ResultSet rs, long nowMs) throws SQLException {
        String id = rs.getString("bundle_id");
        Bundle bundle;
        try {
            bundle = BundleCodec.decode(rs.getBytes("encoded"));
        } catch (DecodeException e) {
            log.warn("Stored bundle {} no longer decodes: {}", id, e.getMessage());
            return null;
        }
        if (!bundle.id().equals(id)) {
            log.warn("Stored bundle {} decodes to a different id {}", id, bundle.id());
            return null;
        }
        Optional<RejectReason> invalid = BundleValidator.check(bundle, nowMs);
        if (invalid.isPresent() && invalid.get() != RejectReason.EXPIRED) {
            log.warn("Stored bundle {} failed verification: {}", id, invalid.get());
            return null;
        }
        return bundle;
    }

    private static void deleteBundle(Connection c, String bundleId) throws SQLException {
        for (String sql : List.of(
                "DELETE FROM queue_state WHERE bundle_id=?",
                "DELETE FROM deliveries WHERE bundle_id=?",
                "DELETE FROM bundles WHERE bundle_id=?")) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, bundleId);
                ps.executeUpdate();
            }
        }
    }

    private int executeUpdate(String sql, String what, Object... args) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to " + what, e);
        }
    }

    private Optional<String> queryString(String sql, String arg) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, arg);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed query: " + sql, e);
        }
    }

    private List<NeighborRecord> neighbors(String sql, Object... args) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            List<NeighborRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new NeighborRecord(
                            rs.getString("neighbor_id"),
                            rs.getLong("last_contact_ms"),
                            rs.getString("last_outcome"),
                            rs.getInt("consecutive_failures"),
                            rs.getLong("next_contact_ms"),
                            rs.getInt("suspect_count"),
                            rs.getLong("bundles_sent"),
                            rs.getLong("bundles_received")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read neighbors", e);
        }
    }

    private record Victim(String bundleId, long sizeBytes, Priority priority, String topic, boolean custodyPending) {
    }

    private record BundleHead(Priority priority, String topic) {
    }

    public record StoredDelivery(long sequence, long deliveredAtMs, Bundle bundle) {
    }

    public record NeighborRecord(
            String neighborId,
            long lastContactMs,
            String lastOutcome,
            int consecutiveFailures,
            long nextContactMs,
            int suspectCount,
            long bundlesSent,
            long bundlesReceived
    ) {
        public boolean inBackoff(long nowMs) {
            return nextContactMs > nowMs;
        }
    }

    public record StoreStats(
            long bundleCount,
            long usedBytes,
            long capacityBytes,
            Map<String, Long> pendingByPriority,
            long custodyPending,
            long deliveries,
            long neighbors,
            long queuedUndelivered
    ) {
    }
}
