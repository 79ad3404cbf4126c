package io.bundlemesh.propagation;

import io.bundlemesh.model.LinkState;

import java.util.List;

/**
 * Result of one exchange. {@code outcome} is {@code completed},
 * {@code incompatible}, {@code timeout}, {@code disconnected} or {@code interrupted}.
 */
public record SessionOutcome(
        String neighborId,
        LinkState finalState,
        String outcome,
        int bundlesSent,
        int bundlesReceived,
        int bundlesAcked,
        List<String> unackedIds
) {
    public SessionOutcome {
        unackedIds = List.copyOf(unackedIds == null ? List.of() : unackedIds);
    }

    public boolean completed() {
        return "completed".equals(outcome);
    }
}
