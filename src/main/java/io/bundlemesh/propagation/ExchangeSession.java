package io.bundlemesh.propagation;

import io.bundlemesh.codec.BundleCodec;
import io.bundlemesh.codec.DecodeException;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.LinkState;
import io.bundlemesh.model.QueueEntry;
import io.bundlemesh.model.RejectReason;
import io.bundlemesh.scheduler.PriorityScheduler;
import io.bundlemesh.storage.BundleStore;
import io.bundlemesh.storage.BundleValidator;
import io.bundlemesh.storage.PutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * One store-and-forward exchange with one neighbor over one link.
 *
 * <p>Both ends run the same protocol: HELLO, then MANIFEST of what each side
 * offers, REQUEST of what it lacks, BUNDLE frames in scheduling order each
 * answered by an ACK, and END once the requested bundles are out. The session
 * completes ({@code IDLE}) when both ENDs are exchanged and every sent bundle is
 * acknowledged. Any link failure or silence longer than the receive timeout ends
 * it {@code DISCONNECTED}, with backoff for the unacknowledged bundles and the
 * neighbor. Not thread-safe; one session runs on one thread.
 */
public final class ExchangeSession {
    private static final Logger log = LoggerFactory.getLogger(ExchangeSession.class);

    private final NeighborLink link;
    private final BundleStore store;
    private final LocalNode node;
    private final BackoffPolicy backoff;
    private final long receiveTimeoutMs;
    private final LongSupplier clock;
    private final int protocolVersion;

    private volatile LinkState state = LinkState.DISCOVERED;
    private String neighborId;
    private boolean neighborTrusted;
    private final Set<String> offered = new LinkedHashSet<>();
    private final Map<String, Boolean> awaitingAck = new LinkedHashMap<>();
    private boolean endSent;
    private boolean peerEnded;
    private int sent;
    private int received;
    private int acked;

    public ExchangeSession(
            NeighborLink link,
            BundleStore store,
            LocalNode node,
            BackoffPolicy backoff,
            long receiveTimeoutMs,
            LongSupplier clock
    ) {
        this(link, store, node, backoff, receiveTimeoutMs, clock, ExchangeFrame.PROTOCOL_VERSION);
    }

    public ExchangeSession(
            NeighborLink link,
            BundleStore store,
            LocalNode node,
            BackoffPolicy backoff,
            long receiveTimeoutMs,
            LongSupplier clock,
            int protocolVersion
    ) {
        this.link = link;
        this.store = store;
        this.node = node;
        this.backoff = backoff;
        this.receiveTimeoutMs = receiveTimeoutMs;
        this.clock = clock;
        this.protocolVersion = protocolVersion;
    }

    public LinkState state() {
        return state;
    }

    public SessionOutcome run() {
        try {
            state = LinkState.HANDSHAKING;
            send(ExchangeFrame.hello(protocolVersion, node.address(), node.subscribedTopics(), node.trustedMember()));
            Optional<ExchangeFrame> hello = awaitHello();
            if (hello.isEmpty()) {
                return disconnected("timeout");
            }
            if (!compatible(hello.get())) {
                return incompatible(hello.get());
            }
            neighborId = hello.get().nodeId().toLowerCase(Locale.ROOT);
            neighborTrusted = Boolean.TRUE.equals(hello.get().trusted());
            state = LinkState.EXCHANGING;
            log.debug("Exchanging with {} via {}", neighborId, link.describe());
            sendManifest();
            while (!(endSent && peerEnded && awaitingAck.isEmpty())) {
                Optional<ExchangeFrame> frame = receiveFrame();
                if (frame.isEmpty()) {
                    return disconnected("timeout");
                }
                dispatch(frame.get());
            }
            state = LinkState.IDLE;
            store.recordContactSuccess(neighborId, clock.getAsLong(), sent, received);
            log.info("Exchange with {} completed: sent={} received={}", neighborId, sent, received);
            return outcome("completed");
        } catch (NeighborDisconnectedException e) {
            log.info("Neighbor {} disconnected: {}", label(), e.getMessage());
            return disconnected("disconnected");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return disconnected("interrupted");
        } finally {
            closeLink();
        }
    }

    private Optional<ExchangeFrame> awaitHello() throws InterruptedException {
        while (true) {
            Optional<ExchangeFrame> frame = receiveFrame();
            if (frame.isEmpty() || frame.get().type() == ExchangeFrame.Type.HELLO) {
                return frame;
            }
            log.debug("Dropping {} frame received before HELLO from {}", frame.get().type(), link.describe());
        }
    }

    private boolean compatible(ExchangeFrame hello) {
        return hello.version() != null
                && hello.version() == protocolVersion
                && Destination.isNodeAddress(hello.nodeId());
    }

    private SessionOutcome incompatible(ExchangeFrame hello) {
        state = LinkState.IDLE;
        String peer = Destination.isNodeAddress(hello.nodeId()) ? hello.nodeId().toLowerCase(Locale.ROOT) : null;
        neighborId = peer;
        log.warn("Incompatible neighbor {} (protocol {} vs {}); no bundles exchanged",
                peer == null ? link.describe() : peer, hello.version(), protocolVersion);
        if (peer != null) {
            long now = clock.getAsLong();
            store.recordContactFailure(peer, now, "incompatible", now + backoff.maxDelayMs());
        }
        return outcome("incompatible");
    }

    private void dispatch(ExchangeFrame frame) {
        switch (frame.type()) {
            case MANIFEST -> onManifest(frame);
            case REQUEST -> onRequest(frame);
            case BUNDLE -> onBundle(frame);
            case ACK -> onAck(frame);
            case END -> peerEnded = true;
            case HELLO -> log.debug("Ignoring repeated HELLO from {}", neighborId);
        }
    }

    private void sendManifest() {
        long now = clock.getAsLong();
        List<QueueEntry> candidates = new ArrayList<>();
        for (QueueEntry entry : store.forwardableFor(neighborId, now)) {
            if (eligible(entry.bundle())) {
                candidates.add(entry);
            }
        }
        for (QueueEntry entry : PriorityScheduler.order(candidates)) {
            offered.add(entry.bundleId());
        }
        send(ExchangeFrame.manifest(new ArrayList<>(offered)));
    }

    /**
     * Audience rules: public bundles go anywhere, trusted ones only to a neighbor
     * that declares trust and is on the local trusted list, destination-only ones
     * only to their unicast destination.
     */
    private boolean eligible(Bundle bundle) {
        Destination destination = bundle.destination();
        if (destination.kind() == Destination.Kind.UNICAST && destination.nodeAddress().equals(node.address())) {
            return false;
        }
        return switch (bundle.audience()) {
            case PUBLIC -> true;
            case TRUSTED -> neighborTrusted && node.trustsNeighbor(neighborId);
            case DESTINATION_ONLY -> neighborId.equals(destination.nodeAddress());
        };
    }

    private void onManifest(ExchangeFrame frame) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String id : frame.idsOrEmpty()) {
            if (isBundleId(id) && !store.contains(id)) {
                wanted.add(id);
            }
        }
        send(ExchangeFrame.request(new ArrayList<>(wanted)));
    }

    private void onRequest(ExchangeFrame frame) {
        if (endSent) {
            log.debug("Ignoring second REQUEST from {}", neighborId);
            return;
        }
        long now = clock.getAsLong();
        Set<String> requested = new LinkedHashSet<>(frame.idsOrEmpty());
        List<QueueEntry> toSend = new ArrayList<>();
        for (String id : offered) {
            if (!requested.contains(id)) {
                store.markDelivered(id, neighborId, now, false);
                continue;
            }
            store.queueEntry(id, neighborId)
                    .filter(entry -> !entry.bundle().isExpired(now))
                    .ifPresent(toSend::add);
        }
        for (QueueEntry entry : PriorityScheduler.order(toSend)) {
            awaitingAck.put(entry.bundleId(), Boolean.TRUE);
            store.recordAttempt(entry.bundleId(), neighborId, now);
            send(ExchangeFrame.bundle(entry.bundleId(), BundleCodec.encode(entry.bundle())));
            sent++;
        }
        send(ExchangeFrame.end());
        endSent = true;
    }

    private void onBundle(ExchangeFrame frame) {
        received++;
        String claimedId = frame.bundleId();
        Bundle bundle;
        try {
            if (frame.bundle() == null) {
                throw new DecodeException("BUNDLE frame without bundle bytes");
            }
            bundle = BundleCodec.decode(frame.bundle());
        } catch (DecodeException e) {
            log.warn("Dropping undecodable bundle {} from {}: {}", claimedId, neighborId, e.getMessage());
            store.recordRejected(null, "");
            sendAck(claimedId, false, false, RejectReason.DECODE_ERROR);
            return;
        }
        long now = clock.getAsLong();
        RejectReason reason = null;
        if (claimedId != null && !claimedId.equals(bundle.id())) {
            reason = RejectReason.ID_MISMATCH;
        } else {
            reason = BundleValidator.check(bundle, now).orElse(null);
        }
        if (reason == null && !bundle.isForwardable()) {
            reason = RejectReason.HOP_LIMIT_EXCEEDED;
        }
        if (reason != null) {
            rejectIncoming(bundle, claimedId, reason);
            return;
        }
        Bundle hopped = bundle.withHopCount(bundle.hopCount() + 1);
        boolean localRecipient = node.isLocalRecipient(hopped);
        if (!hopped.isForwardable() && !localRecipient) {
            log.debug("Bundle {} reached its hop limit at {}; not stored", hopped.id(), node.address());
            rejectIncoming(hopped, claimedId, RejectReason.HOP_LIMIT_EXCEEDED);
            return;
        }
        PutResult result = store.put(hopped, neighborId, now);
        switch (result.status()) {
            case INSERTED -> {
                if (localRecipient) {
                    node.deliverLocally(hopped);
                }
                sendAck(hopped.id(), true, hopped.custodyRequested(), null);
            }
            case DUPLICATE_IGNORED -> {
                if (localRecipient) {
                    node.deliverLocally(hopped);
                }
                send(ExchangeFrame.ack(hopped.id(), true, false, ExchangeFrame.ALREADY_HELD));
            }
            case REJECTED -> {
                if (isTamper(result.reason())) {
                    store.markSuspect(neighborId);
                }
                sendAck(hopped.id(), false, false, result.reason());
            }
        }
    }

    private void rejectIncoming(Bundle bundle, String claimedId, RejectReason reason) {
        if (reason == RejectReason.EXPIRED || reason == RejectReason.HOP_LIMIT_EXCEEDED) {
            log.debug("Dropping bundle {} from {}: {}", bundle.id(), neighborId, reason);
        } else {
            log.warn("Rejected bundle {} from {}: {}", bundle.id(), neighborId, reason);
        }
        if (isTamper(reason)) {
            store.markSuspect(neighborId);
        }
        store.recordRejected(bundle.priority(), bundle.topic());
        sendAck(claimedId == null ? bundle.id() : claimedId, false, false, reason);
    }

    private void onAck(ExchangeFrame frame) {
        String id = frame.bundleId();
        if (id == null || awaitingAck.remove(id) == null) {
            log.debug("Unexpected ACK for {} from {}", id, neighborId);
            return;
        }
        acked++;
        long now = clock.getAsLong();
        if (Boolean.TRUE.equals(frame.accepted())) {
            store.markDelivered(id, neighborId, now, !ExchangeFrame.ALREADY_HELD.equals(frame.reason()));
            if (Boolean.TRUE.equals(frame.custodyAccepted())) {
                store.recordCustodyHolder(id, neighborId);
            }
            return;
        }
        if (RejectReason.STORAGE_FULL.name().equals(frame.reason())) {
            int attempts = store.queueEntry(id, neighborId).map(QueueEntry::attempts).orElse(1);
            store.recordFailedAttempt(id, neighborId, now + backoff.computeDelayMs(Math.max(1, attempts)));
        } else {
            log.debug("Neighbor {} refused {}: {}", neighborId, id, frame.reason());
            store.markDelivered(id, neighborId, now, false);
        }
    }

    private SessionOutcome disconnected(String outcome) {
        state = LinkState.DISCONNECTED;
        if (neighborId != null) {
            long now = clock.getAsLong();
            for (String id : awaitingAck.keySet()) {
                int attempts = store.queueEntry(id, neighborId).map(QueueEntry::attempts).orElse(1);
                store.recordFailedAttempt(id, neighborId, now + backoff.computeDelayMs(Math.max(1, attempts)));
            }
            int failures = store.consecutiveFailures(neighborId) + 1;
            store.recordContactFailure(neighborId, now, outcome, now + backoff.computeDelayMs(failures));
        }
        return outcome(outcome);
    }

    private SessionOutcome outcome(String outcome) {
        return new SessionOutcome(
                neighborId == null ? link.describe() : neighborId,
                state,
                outcome,
                sent,
                received,
                acked,
                new ArrayList<>(awaitingAck.keySet())
        );
    }

    private Optional<ExchangeFrame> receiveFrame() throws InterruptedException {
        while (true) {
            Optional<byte[]> raw = link.receive(receiveTimeoutMs);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(ExchangeFrame.fromBytes(raw.get()));
            } catch (DecodeException e) {
                log.warn("Dropping malformed frame from {}: {}", label(), e.getMessage());
            }
        }
    }

    private void sendAck(String bundleId, boolean accepted, boolean custodyAccepted, RejectReason reason) {
        send(ExchangeFrame.ack(bundleId, accepted, custodyAccepted, reason == null ? null : reason.name()));
    }

    private void send(ExchangeFrame frame) {
        link.send(frame.toBytes());
    }

    private void closeLink() {
        try {
            link.close();
        } catch (NeighborDisconnectedException e) {
            log.debug("Closing link {} failed: {}", link.describe(), e.getMessage());
        }
    }

    private String label() {
        return neighborId == null ? link.describe() : neighborId;
    }

    private static boolean isTamper(RejectReason reason) {
        return reason == RejectReason.SIGNATURE_INVALID || reason == RejectReason.ID_MISMATCH;
    }

    private static boolean isBundleId(String id) {
        if (id == null || id.length() != BundleCodec.ID_BYTES * 2) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (Character.digit(id.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
