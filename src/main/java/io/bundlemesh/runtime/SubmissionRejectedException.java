package io.bundlemesh.runtime;

import io.bundlemesh.model.RejectReason;

/**
 * The local store refused a freshly created bundle.
 */
public class SubmissionRejectedException extends RuntimeException {
    private final String bundleId;
    private final RejectReason reason;

    public SubmissionRejectedException(String bundleId, RejectReason reason) {
        super("Bundle " + bundleId + " rejected: " + reason);
        this.bundleId = bundleId;
        this.reason = reason;
    }

    public String bundleId() {
        return bundleId;
    }

    public RejectReason reason() {
        return reason;
    }
}
