package io.bundlemesh.model;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Signed, encrypted unit of delay-tolerant transport.
 *
 * <p>Everything except {@code hopCount} is immutable and covered by both the
 * content id and the signature. Instances are built by
 * {@link io.bundlemesh.codec.BundleCodec} or by the producer path in
 * {@link io.bundlemesh.runtime.BundleNode}; the byte arrays are never handed
 * out for mutation by the codebase.
 */
public record Bundle(
        String id,
        byte[] source,
        byte[] sourceBoxKey,
        Destination destination,
        String topic,
        Priority priority,
        Audience audience,
        long createdAtMs,
        long expiresAtMs,
        int hopLimit,
        int hopCount,
        boolean custodyRequested,
        byte[] signature,
        byte[] payload
) {
    public static final int MAX_HOP_LIMIT = 255;

    public Bundle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceBoxKey, "sourceBoxKey");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(payload, "payload");
        if (hopLimit < 1 || hopLimit > MAX_HOP_LIMIT) {
            throw new IllegalArgumentException("hopLimit must be in [1," + MAX_HOP_LIMIT + "]: " + hopLimit);
        }
        if (hopCount < 0 || hopCount > MAX_HOP_LIMIT) {
            throw new IllegalArgumentException("hopCount must be in [0," + MAX_HOP_LIMIT + "]: " + hopCount);
        }
    }

    public Bundle withHopCount(int nextHopCount) {
        return new Bundle(id, source, sourceBoxKey, destination, topic, priority, audience,
                createdAtMs, expiresAtMs, hopLimit, nextHopCount, custodyRequested, signature, payload);
    }

    public boolean isExpired(long nowMs) {
        return nowMs > expiresAtMs;
    }

    public boolean isForwardable() {
        return hopCount < hopLimit;
    }

    public int hopsRemaining() {
        return Math.max(0, hopLimit - hopCount);
    }

    /**
     * Node address of the creator, usable as a unicast scope.
     */
    public String sourceAddress() {
        return Hex.toHexString(sourceBoxKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bundle other)) {
            return false;
        }
        return createdAtMs == other.createdAtMs
                && expiresAtMs == other.expiresAtMs
                && hopLimit == other.hopLimit
                && hopCount == other.hopCount
                && custodyRequested == other.custodyRequested
                && id.equals(other.id)
                && Arrays.equals(source, other.source)
                && Arrays.equals(sourceBoxKey, other.sourceBoxKey)
                && destination.equals(other.destination)
                && topic.equals(other.topic)
                && priority == other.priority
                && audience == other.audience
                && Arrays.equals(signature, other.signature)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, destination, topic, priority, audience,
                createdAtMs, expiresAtMs, hopLimit, hopCount, custodyRequested);
        result = 31 * result + Arrays.hashCode(source);
        result = 31 * result + Arrays.hashCode(sourceBoxKey);
        result = 31 * result + Arrays.hashCode(signature);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "Bundle[id=" + id
                + ", destination=" + destination
                + ", topic=" + topic
                + ", priority=" + priority
                + ", audience=" + audience
                + ", expiresAtMs=" + expiresAtMs
                + ", hops=" + hopCount + "/" + hopLimit
                + ", custodyRequested=" + custodyRequested
                + ", payloadBytes=" + payload.length + "]";
    }
}
