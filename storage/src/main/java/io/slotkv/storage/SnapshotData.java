package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time image of a store.
 *
 * @param createdAtMillis wall clock when the image was taken
 * @param entries         every live key at that instant; values must be treated as read-only
 */
public record SnapshotData(long createdAtMillis, List<Entry> entries) {

    public SnapshotData {
        entries = List.copyOf(entries);
    }

    /**
     * @param expireAtMillis absolute expiry in epoch millis, or -1 when the key does not expire
     */
    public record Entry(Bytes key, Value value, long expireAtMillis) {
        public Entry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }
}
