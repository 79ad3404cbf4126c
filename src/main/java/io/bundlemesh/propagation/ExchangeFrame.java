package io.bundlemesh.propagation;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.bundlemesh.codec.DecodeException;
import io.bundlemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One message of the neighbor exchange protocol, carried as compact JSON.
 * Bundles travel base64-encoded in their binary wire form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExchangeFrame(
        Type type,
        Integer version,
        String nodeId,
        List<String> topics,
        Boolean trusted,
        List<String> ids,
        String bundleId,
        byte[] bundle,
        Boolean accepted,
        Boolean custodyAccepted,
        String reason
) {
    public static final int PROTOCOL_VERSION = 1;
    /**
     * ACK reason for an accepted bundle the receiver already held.
     */
    public static final String ALREADY_HELD = "ALREADY_HELD";

    public enum Type {
        HELLO,
        MANIFEST,
        REQUEST,
        BUNDLE,
        ACK,
        END
    }

    public static ExchangeFrame hello(int version, String nodeId, List<String> topics, boolean trusted) {
        return new ExchangeFrame(Type.HELLO, version, nodeId, List.copyOf(topics), trusted, null, null, null, null, null, null);
    }

    public static ExchangeFrame manifest(List<String> ids) {
        return new ExchangeFrame(Type.MANIFEST, null, null, null, null, List.copyOf(ids), null, null, null, null, null);
    }

    public static ExchangeFrame request(List<String> ids) {
        return new ExchangeFrame(Type.REQUEST, null, null, null, null, List.copyOf(ids), null, null, null, null, null);
    }

    public static ExchangeFrame bundle(String bundleId, byte[] encoded) {
        return new ExchangeFrame(Type.BUNDLE, null, null, null, null, null, bundleId, encoded, null, null, null);
    }

    public static ExchangeFrame ack(String bundleId, boolean accepted, boolean custodyAccepted, String reason) {
        return new ExchangeFrame(Type.ACK, null, null, null, null, null, bundleId, null, accepted, custodyAccepted, reason);
    }

    public static ExchangeFrame end() {
        return new ExchangeFrame(Type.END, null, null, null, null, null, null, null, null, null, null);
    }

    public List<String> idsOrEmpty() {
        return ids == null ? List.of() : ids;
    }

    public List<String> topicsOrEmpty() {
        return topics == null ? List.of() : topics;
    }

    public byte[] toBytes() {
        return Jsons.toCompactJson(this).getBytes(StandardCharsets.UTF_8);
    }

    public static ExchangeFrame fromBytes(byte[] raw) {
        ExchangeFrame frame;
        try {
            frame = Jsons.compact().readValue(raw, ExchangeFrame.class);
        } catch (IOException e) {
            throw new DecodeException("Malformed exchange frame", e);
        }
        if (frame == null || frame.type() == null) {
            throw new DecodeException("Exchange frame has no type");
        }
        return frame;
    }
}
