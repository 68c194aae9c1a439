// file: storage/src/main/java/io/slotkv/storage/Snapshotter.java
package io.slotkv.storage;

/**
 * Snapshot abstraction used for restart recovery.
 * <p>
 * A snapshot is a full copy of the store at some point in time. On restart
 * the latest snapshot is loaded once, before the node accepts clients.
 */
public interface Snapshotter {

    /**
     * Persist a full image. The previous image stays intact if this fails.
     *
     * @return snapshot identifier (file name)
     * @throws PersistenceException on any I/O failure
     */
    String writeSnapshot(SnapshotData snapshot);

    /**
     * Load the latest snapshot if present.
     *
     * @return the image, or null when no snapshot exists (cold start)
     * @throws PersistenceException when a snapshot exists but cannot be decoded
     */
    SnapshotData loadLatest();

    /** Identifier that {@link #writeSnapshot} produces. */
    String name();
}
