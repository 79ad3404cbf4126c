package io.bundlemesh.storage;

import io.bundlemesh.model.RejectReason;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link BundleStore#put}. {@code reason} is set only for
 * {@link PutStatus#REJECTED}; {@code evictedIds} lists bundles dropped to make room.
 */
public record PutResult(String bundleId, PutStatus status, RejectReason reason, List<String> evictedIds) {
    public PutResult {
        evictedIds = List.copyOf(evictedIds == null ? List.of() : evictedIds);
    }

    public static PutResult inserted(String bundleId, List<String> evictedIds) {
        return new PutResult(bundleId, PutStatus.INSERTED, null, evictedIds);
    }

    public static PutResult duplicate(String bundleId) {
        return new PutResult(bundleId, PutStatus.DUPLICATE_IGNORED, null, List.of());
    }

    public static PutResult rejected(String bundleId, RejectReason reason) {
        return new PutResult(bundleId, PutStatus.REJECTED, reason, List.of());
    }

    public boolean isInserted() {
        return status == PutStatus.INSERTED;
    }

    public boolean isRejected() {
        return status == PutStatus.REJECTED;
    }

    public Optional<RejectReason> rejectReason() {
        return Optional.ofNullable(reason);
    }
}
