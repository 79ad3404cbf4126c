package io.bundlemesh.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Removes expired bundles and due ephemeral records by direct deletion, either
 * on demand or at a fixed interval on a daemon thread. Each cycle also
 * re-verifies the stored bundles and quarantines any that fail.
 */
public final class ExpiryReaper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    private final BundleStore bundleStore;
    private final EphemeralRecordStore ephemeralStore;
    private final long intervalMs;
    private final LongSupplier clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> reapTask;
    private volatile boolean closed;

    public ExpiryReaper(BundleStore bundleStore, EphemeralRecordStore ephemeralStore, long intervalMs) {
        this(bundleStore, ephemeralStore, intervalMs, () -> Instant.now().toEpochMilli());
    }

    public ExpiryReaper(BundleStore bundleStore, EphemeralRecordStore ephemeralStore, long intervalMs, LongSupplier clock) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.bundleStore = bundleStore;
        this.ephemeralStore = ephemeralStore;
        this.intervalMs = intervalMs;
        this.clock = clock;
    }

    public ReapOutcome runOnce() {
        return runOnce(clock.getAsLong());
    }

    public ReapOutcome runOnce(long nowMs) {
        int bundles = bundleStore.purgeExpired(nowMs);
        int records = ephemeralStore.purgeDue(nowMs);
        int quarantined = bundleStore.quarantineCorrupt(nowMs);
        if (bundles > 0 || records > 0) {
            log.info("Reaped {} expired bundles and {} ephemeral records", bundles, records);
        }
        if (quarantined > 0) {
            log.warn("Quarantined {} stored bundles that failed verification", quarantined);
        }
        return new ReapOutcome(bundles, records, quarantined, nowMs);
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ExpiryReaper has been closed");
        }
        if (reapTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, "bundlemesh-reaper");
            t.setDaemon(true);
            return t;
        });
        reapTask = scheduler.scheduleWithFixedDelay(this::scheduledRun, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void scheduledRun() {
        if (closed) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next cycle retries the same deletes.
            log.error("Reaper cycle failed", e);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (reapTask != null) {
            reapTask.cancel(false);
            reapTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public record ReapOutcome(int bundlesRemoved, int ephemeralRemoved, int bundlesQuarantined, long nowMs) {
    }
}
