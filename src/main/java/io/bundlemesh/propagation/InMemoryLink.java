package io.bundlemesh.propagation;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two connected in-process link ends. Closing either end disconnects both after
 * frames already in flight have been read.
 */
public final class InMemoryLink implements NeighborLink {
    private static final byte[] CLOSED = new byte[0];

    private final String name;
    private final BlockingQueue<byte[]> inbound;
    private final BlockingQueue<byte[]> outbound;
    private final AtomicBoolean closed;
    private final AtomicInteger sendBudget = new AtomicInteger(Integer.MAX_VALUE);

    private InMemoryLink(String name, BlockingQueue<byte[]> inbound, BlockingQueue<byte[]> outbound, AtomicBoolean closed) {
        this.name = name;
        this.inbound = inbound;
        this.outbound = outbound;
        this.closed = closed;
    }

    public static Pair pair(String leftName, String rightName) {
        BlockingQueue<byte[]> leftToRight = new LinkedBlockingQueue<>();
        BlockingQueue<byte[]> rightToLeft = new LinkedBlockingQueue<>();
        AtomicBoolean closed = new AtomicBoolean(false);
        InMemoryLink left = new InMemoryLink(rightName, rightToLeft, leftToRight, closed);
        InMemoryLink right = new InMemoryLink(leftName, leftToRight, rightToLeft, closed);
        return new Pair(left, right);
    }

    /**
     * Breaks the link once this end has sent {@code frames} more frames.
     */
    public InMemoryLink failAfterSends(int frames) {
        sendBudget.set(frames);
        return this;
    }

    @Override
    public String describe() {
        return "mem:" + name;
    }

    @Override
    public void send(byte[] frame) {
        if (closed.get()) {
            throw new NeighborDisconnectedException("Link closed: " + describe());
        }
        if (sendBudget.getAndDecrement() <= 0) {
            close();
            throw new NeighborDisconnectedException("Link dropped: " + describe());
        }
        outbound.add(frame.clone());
    }

    @Override
    public Optional<byte[]> receive(long timeoutMs) throws InterruptedException {
        byte[] frame = inbound.poll(timeoutMs, TimeUnit.MILLISECONDS);
        if (frame == null) {
            if (closed.get() && inbound.isEmpty()) {
                throw new NeighborDisconnectedException("Link closed: " + describe());
            }
            return Optional.empty();
        }
        if (frame == CLOSED) {
            inbound.add(CLOSED);
            throw new NeighborDisconnectedException("Link closed: " + describe());
        }
        return Optional.of(frame);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            outbound.add(CLOSED);
            inbound.add(CLOSED);
        }
    }

    public record Pair(InMemoryLink left, InMemoryLink right) {
    }
}
