package io.bundlemesh.propagation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * TCP link carrying length-prefixed frames ({@code u32 length | bytes}).
 *
 * <p>Writes go through a per-link writer thread so both ends can stream bundles
 * at each other without blocking on full socket buffers. A timeout while waiting
 * for a frame to start is a quiet period; a timeout inside a frame breaks the link.
 */
public final class SocketNeighborLink implements NeighborLink {
    private static final Logger log = LoggerFactory.getLogger(SocketNeighborLink.class);
    public static final int MAX_FRAME_BYTES = 32 * 1024 * 1024;
    private static final int IN_FRAME_TIMEOUT_MS = 30_000;
    private static final long FLUSH_ON_CLOSE_MS = 5_000L;
    private static final byte[] STOP = new byte[0];

    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final String remote;
    private final BlockingQueue<byte[]> outbox = new LinkedBlockingQueue<>();
    private final Thread writer;
    private volatile IOException writeFailure;
    private volatile boolean closing;

    public SocketNeighborLink(Socket socket) throws IOException {
        this.socket = socket;
        this.socket.setTcpNoDelay(true);
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        this.remote = String.valueOf(socket.getRemoteSocketAddress());
        this.writer = new Thread(this::writeLoop, "bundlemesh-link-writer-" + remote);
        this.writer.setDaemon(true);
        this.writer.start();
    }

    public static SocketNeighborLink connect(String host, int port, int connectTimeoutMs) {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            return new SocketNeighborLink(socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new NeighborDisconnectedException("Failed to connect to " + host + ":" + port, e);
        }
    }

    @Override
    public String describe() {
        return "tcp:" + remote;
    }

    @Override
    public void send(byte[] frame) {
        if (frame.length > MAX_FRAME_BYTES) {
            throw new IllegalArgumentException("Frame exceeds " + MAX_FRAME_BYTES + " bytes");
        }
        if (writeFailure != null) {
            throw new NeighborDisconnectedException("Send failed to " + describe(), writeFailure);
        }
        if (closing) {
            throw new NeighborDisconnectedException("Link closed: " + describe());
        }
        outbox.add(frame.clone());
    }

    @Override
    public Optional<byte[]> receive(long timeoutMs) {
        if (writeFailure != null) {
            throw new NeighborDisconnectedException("Link broken: " + describe(), writeFailure);
        }
        int first;
        try {
            socket.setSoTimeout((int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeoutMs)));
            first = in.read();
        } catch (SocketTimeoutException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new NeighborDisconnectedException("Receive failed from " + describe(), e);
        }
        if (first < 0) {
            throw new NeighborDisconnectedException("Peer closed " + describe());
        }
        try {
            socket.setSoTimeout(IN_FRAME_TIMEOUT_MS);
            int length = (first << 24) | (in.readUnsignedByte() << 16) | (in.readUnsignedByte() << 8) | in.readUnsignedByte();
            if (length < 0 || length > MAX_FRAME_BYTES) {
                throw new NeighborDisconnectedException("Bad frame length " + length + " from " + describe());
            }
            byte[] frame = new byte[length];
            in.readFully(frame);
            return Optional.of(frame);
        } catch (EOFException e) {
            throw new NeighborDisconnectedException("Peer closed mid-frame " + describe(), e);
        } catch (IOException e) {
            throw new NeighborDisconnectedException("Receive failed mid-frame from " + describe(), e);
        }
    }

    /**
     * Flushes queued frames (bounded wait), then closes the socket.
     */
    @Override
    public void close() {
        if (closing) {
            return;
        }
        closing = true;
        outbox.add(STOP);
        try {
            writer.join(FLUSH_ON_CLOSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            socket.close();
        } catch (IOException e) {
            throw new NeighborDisconnectedException("Failed to close " + describe(), e);
        }
    }

    private void writeLoop() {
        try {
            while (true) {
                byte[] frame = outbox.take();
                if (frame == STOP) {
                    out.flush();
                    return;
                }
                out.writeInt(frame.length);
                out.write(frame);
                if (outbox.isEmpty()) {
                    out.flush();
                }
            }
        } catch (IOException e) {
            writeFailure = e;
            log.debug("Writer for {} stopped: {}", describe(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
