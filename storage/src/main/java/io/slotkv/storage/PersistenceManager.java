// file: storage/src/main/java/io/slotkv/storage/PersistenceManager.java
package io.slotkv.storage;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ties a {@link KeyValueStore} to a {@link Snapshotter}.
 * <p>
 * Responsibilities:
 *  - Restore the store once at startup, before any client is served.
 *  - Take snapshots on demand (SAVE, admin endpoint, shutdown) and on a
 *    fixed-delay background timer.
 *  - Skip timed snapshots when nothing was written since the last one.
 * <p>
 * At most one snapshot is serialized at a time; concurrent callers queue on
 * this instance's monitor. Writers keep running while a snapshot is being
 * encoded because {@link KeyValueStore#snapshot()} only copies the key table.
 */
public final class PersistenceManager {
    private static final Logger log = Logger.getLogger(PersistenceManager.class.getName());

    private final KeyValueStore store;
    private final Snapshotter snapshotter;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private long savedAtMutation = -1L;
    private volatile long lastSnapshotMillis = -1L;
    private volatile boolean restored;

    /**
     * @param interval timer period; zero or negative disables the timer
     */
    public PersistenceManager(KeyValueStore store, Snapshotter snapshotter, Duration interval) {
        this.store = store;
        this.snapshotter = snapshotter;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Load the latest snapshot into the store. A missing snapshot is a cold
     * start. May be called only once.
     *
     * @return number of keys loaded
     * @throws PersistenceException when the snapshot exists but is unreadable
     */
    public synchronized int restore() {
        if (restored) {
            throw new IllegalStateException("restore() already ran");
        }
        restored = true;
        SnapshotData data = snapshotter.loadLatest();
        if (data == null) {
            log.info("no snapshot " + snapshotter.name() + ", starting empty");
            savedAtMutation = store.mutations();
            return 0;
        }
        store.load(data);
        savedAtMutation = store.mutations();
        lastSnapshotMillis = data.createdAtMillis();
        int keys = (int) store.size();
        log.info("restored " + keys + " keys from " + snapshotter.name());
        return keys;
    }

    /**
     * Write a snapshot now regardless of dirtiness.
     *
     * @return snapshot file name
     * @throws PersistenceException when the write fails; the previous file is kept
     */
    public synchronized String snapshotNow() {
        long mutationsBefore = store.mutations();
        SnapshotData data = store.snapshot();
        String name = snapshotter.writeSnapshot(data);
        savedAtMutation = mutationsBefore;
        lastSnapshotMillis = data.createdAtMillis();
        log.info("snapshot " + name + " written (" + data.entries().size() + " keys)");
        return name;
    }

    /** Snapshot only when the store changed since the last successful snapshot. */
    public synchronized boolean snapshotIfDirty() {
        if (store.mutations() == savedAtMutation) {
            return false;
        }
        snapshotNow();
        return true;
    }

    public void start() {
        if (interval.isZero() || interval.isNegative()) {
            log.info("snapshot timer disabled");
            return;
        }
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tickSafe, millis, millis, TimeUnit.MILLISECONDS);
    }

    /** Stop the timer and take a final snapshot if anything changed. */
    public void stop() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            snapshotIfDirty();
        } catch (PersistenceException e) {
            log.log(Level.WARNING, "final snapshot failed", e);
        }
    }

    /** Epoch millis of the last successful snapshot (or the restored one), -1 if none. */
    public long lastSnapshotMillis() {
        return lastSnapshotMillis;
    }

    public String snapshotName() {
        return snapshotter.name();
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            snapshotIfDirty();
        } catch (Exception e) {
            log.log(Level.WARNING, "timed snapshot failed: " + e.getMessage(), e);
        }
    }
}
