package io.slotkv.storage;

/**
 * Closed set of value shapes a key can hold.
 * <p>
 * Collection values are mutable but only ever touched by {@link MemoryStore}
 * under its lock. Each carries the store generation it was created in; a
 * value older than the current generation may be referenced by an in-flight
 * snapshot and is cloned before its first mutation (copy-on-write).
 */
public sealed interface Value permits StringValue, ListValue, HashValue, SetValue {

    ValueType type();

    /** Store generation this instance belongs to. */
    long generation();

    /** Container copy stamped with the given generation. Elements are immutable and shared. */
    Value copy(long generation);
}
