package io.bundlemesh.propagation;

/**
 * The link to a neighbor closed or failed. The session that sees it ends
 * {@code DISCONNECTED}; nothing already stored is lost.
 */
public final class NeighborDisconnectedException extends RuntimeException {
    public NeighborDisconnectedException(String message) {
        super(message);
    }

    public NeighborDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
