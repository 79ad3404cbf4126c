package io.bundlemesh.storage;

import io.bundlemesh.codec.BundleCodec;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.RejectReason;
import io.bundlemesh.security.Signatures;

import java.util.Optional;

/**
 * Checks a bundle against its own content: id, signature, lifetime and hop bounds.
 * Cheap checks run first; the signature is verified last.
 */
public final class BundleValidator {
    private BundleValidator() {
    }

    public static Optional<RejectReason> check(Bundle bundle, long nowMs) {
        String topicSegment = bundle.destination().topic();
        if (!topicSegment.isEmpty() && !topicSegment.equals(bundle.topic())) {
            return Optional.of(RejectReason.DECODE_ERROR);
        }
        if (bundle.expiresAtMs() < bundle.createdAtMs()) {
            return Optional.of(RejectReason.DECODE_ERROR);
        }
        if (bundle.isExpired(nowMs)) {
            return Optional.of(RejectReason.EXPIRED);
        }
        if (bundle.hopCount() > bundle.hopLimit()) {
            return Optional.of(RejectReason.HOP_LIMIT_EXCEEDED);
        }
        byte[] signable = BundleCodec.signableBytes(bundle);
        if (!BundleCodec.computeId(signable).equals(bundle.id())) {
            return Optional.of(RejectReason.ID_MISMATCH);
        }
        if (!Signatures.verify(signable, bundle.signature(), bundle.source())) {
            return Optional.of(RejectReason.SIGNATURE_INVALID);
        }
        return Optional.empty();
    }
}
