package io.bundlemesh.propagation;

import java.util.Optional;

/**
 * Frame transport to one neighbor. Frames are delivered whole and in order.
 */
public interface NeighborLink extends AutoCloseable {

    /**
     * Human-readable remote endpoint, for logs only.
     */
    String describe();

    /**
     * @throws NeighborDisconnectedException if the link is closed or broken
     */
    void send(byte[] frame);

    /**
     * Waits up to {@code timeoutMs} for the next frame; empty on timeout.
     *
     * @throws NeighborDisconnectedException if the link is closed or broken
     */
    Optional<byte[]> receive(long timeoutMs) throws InterruptedException;

    @Override
    void close();
}
