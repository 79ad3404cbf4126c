package io.bundlemesh.propagation;

import io.bundlemesh.storage.ExpiryReaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs exchange sessions on a bounded worker pool. Each session is preceded by
 * an expiry sweep so nothing expired is offered. Optionally accepts inbound
 * neighbor connections on a TCP port.
 */
public final class PropagationWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PropagationWorker.class);

    private final Function<NeighborLink, ExchangeSession> sessionFactory;
    private final ExpiryReaper reaper;
    private final long shutdownGraceMs;
    private final ExecutorService pool;
    private final Set<NeighborLink> activeLinks = ConcurrentHashMap.newKeySet();

    private volatile boolean stopping;
    private ServerSocket serverSocket;
    private Thread acceptThread;

    public PropagationWorker(
            Function<NeighborLink, ExchangeSession> sessionFactory,
            ExpiryReaper reaper,
            int maxWorkers,
            long shutdownGraceMs
    ) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be > 0");
        }
        this.sessionFactory = sessionFactory;
        this.reaper = reaper;
        this.shutdownGraceMs = shutdownGraceMs;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(maxWorkers, runnable -> {
            Thread t = new Thread(runnable, "bundlemesh-exchange-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Future<SessionOutcome> submit(NeighborLink link) {
        if (stopping) {
            link.close();
            throw new IllegalStateException("PropagationWorker is shutting down");
        }
        activeLinks.add(link);
        try {
            return pool.submit(() -> runSession(link));
        } catch (RejectedExecutionException e) {
            activeLinks.remove(link);
            link.close();
            throw new IllegalStateException("PropagationWorker is shutting down", e);
        }
    }

    private SessionOutcome runSession(NeighborLink link) {
        try {
            reaper.runOnce();
            SessionOutcome outcome = sessionFactory.apply(link).run();
            log.debug("Session {} ended: {}", outcome.neighborId(), outcome.outcome());
            return outcome;
        } catch (RuntimeException e) {
            log.error("Exchange over {} failed", link.describe(), e);
            link.close();
            throw e;
        } finally {
            activeLinks.remove(link);
        }
    }

    /**
     * Starts accepting neighbors on {@code port} (0 picks a free port) and
     * returns the bound port.
     */
    public synchronized int serve(int port) {
        if (acceptThread != null) {
            throw new IllegalStateException("Already serving on port " + serverSocket.getLocalPort());
        }
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(port));
        } catch (IOException e) {
            throw new RuntimeException("Failed to listen on port " + port, e);
        }
        acceptThread = new Thread(this::acceptLoop, "bundlemesh-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Accepting neighbors on port {}", serverSocket.getLocalPort());
        return serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (!stopping) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (!stopping) {
                    log.error("Accept loop stopped", e);
                }
                return;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            try {
                submit(new SocketNeighborLink(socket));
            } catch (IOException | IllegalStateException e) {
                log.warn("Dropping inbound connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
    }

    public int activeSessions() {
        return activeLinks.size();
    }

    /**
     * Stops accepting, lets running sessions finish within {@code graceMs}, then
     * interrupts them and closes their links.
     */
    public synchronized void shutdown(long graceMs) {
        stopping = true;
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(Math.max(0L, graceMs), TimeUnit.MILLISECONDS)) {
                log.warn("Forcing {} exchange session(s) closed after {} ms", activeLinks.size(), graceMs);
                pool.shutdownNow();
                for (NeighborLink link : activeLinks) {
                    link.close();
                }
                pool.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        shutdown(shutdownGraceMs);
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }
}
