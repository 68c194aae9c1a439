// file: storage/src/main/java/io/slotkv/storage/KeyValueStore.java
package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Typed key-value operations used by the command layer.
 * <p>
 * Semantics:
 *  - Every method is atomic with respect to every other method.
 *  - A method addressing a key of the wrong shape throws {@link WrongTypeException}
 *    and leaves the store untouched.
 *  - Reads of a missing key return null / 0 / an empty collection; writes
 *    that need a collection create it on first use.
 *  - A collection emptied by a removal is deleted together with its expiry.
 *  - Expired keys are treated as absent and physically removed on access,
 *    except in replica mode (see {@link #replicaMode(boolean)}).
 */
public interface KeyValueStore {

    enum SetCondition { ALWAYS, IF_ABSENT, IF_PRESENT }

    /**
     * Run several operations as one atomic unit. The store's lock is held for
     * the whole supplier, so side effects performed inside (for example queueing
     * a replication message) are ordered exactly like the mutations.
     */
    <T> T atomically(Supplier<T> body);

    /**
     * Called with the lock held for every key the store drops because its
     * deadline passed, before the operation that noticed it continues.
     */
    void expiryListener(Consumer<Bytes> listener);

    /**
     * In replica mode the local clock never removes anything: keys past their
     * deadline read as absent, writes still see them, and they stay until an
     * explicit delete. Snapshot loads keep them too.
     */
    void replicaMode(boolean enabled);

    // ---------- keys ----------

    long delete(List<Bytes> keys);

    long exists(List<Bytes> keys);

    /** @return the shape of the key, or null when absent */
    ValueType type(Bytes key);

    /** @return false when the key does not exist */
    boolean expireAt(Bytes key, long epochMillis);

    /** @return -2 when absent, -1 when the key has no expiry, otherwise remaining millis */
    long ttlMillis(Bytes key);

    /** @return true when an expiry was removed */
    boolean persist(Bytes key);

    List<Bytes> keys(Bytes pattern);

    long size();

    void clear();

    // ---------- strings ----------

    Bytes get(Bytes key);

    /**
     * @param expireAtMillis absolute expiry, or -1 for none (clears any previous expiry)
     * @return false when the condition prevented the write
     */
    boolean set(Bytes key, Bytes value, SetCondition condition, long expireAtMillis);

    long append(Bytes key, Bytes suffix);

    long strlen(Bytes key);

    long incrBy(Bytes key, long delta);

    /** Values for each key; null entries for missing or non-string keys. */
    List<Bytes> mget(List<Bytes> keys);

    // ---------- lists ----------

    long push(Bytes key, List<Bytes> elements, boolean head);

    Bytes pop(Bytes key, boolean head);

    long llen(Bytes key);

    List<Bytes> lrange(Bytes key, long start, long stop);

    Bytes lindex(Bytes key, long index);

    void lset(Bytes key, long index, Bytes element);

    /** @return new length, -1 when the pivot is absent, 0 when the key is absent */
    long linsert(Bytes key, boolean before, Bytes pivot, Bytes element);

    long lrem(Bytes key, long count, Bytes element);

    // ---------- hashes ----------

    /** @return number of fields that were newly added */
    long hset(Bytes key, Map<Bytes, Bytes> fields);

    Bytes hget(Bytes key, Bytes field);

    long hdel(Bytes key, List<Bytes> fields);

    Map<Bytes, Bytes> hgetall(Bytes key);

    long hlen(Bytes key);

    boolean hexists(Bytes key, Bytes field);

    // ---------- sets ----------

    long sadd(Bytes key, List<Bytes> members);

    long srem(Bytes key, List<Bytes> members);

    Set<Bytes> smembers(Bytes key);

    long scard(Bytes key);

    boolean sismember(Bytes key, Bytes member);

    /**
     * Walk a set in member order, {@code count} positions per call.
     *
     * @param cursor  0 to start, otherwise the cursor of the previous page
     * @param pattern glob filter, or null for every member
     */
    ScanPage sscan(Bytes key, long cursor, Bytes pattern, int count);

    // ---------- persistence hooks ----------

    /**
     * Point-in-time image of all live keys. Holds the lock only long enough to
     * copy the key table; values are shared copy-on-write with later mutations.
     */
    SnapshotData snapshot();

    /** Replace the whole content with a loaded image. Expired entries are skipped. */
    void load(SnapshotData data);

    /** Monotonic count of applied mutations; lets callers skip snapshots when nothing changed. */
    long mutations();
}
