// file: storage/src/main/java/io/slotkv/storage/MemoryStore.java
package io.slotkv.storage;

import io.slotkv.core.Bytes;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * In-memory key-value store.
 * <p>
 * Responsibilities:
 *  - Maintain key -> {@link Value} plus a separate key -> expireAt table.
 *  - Serialize every operation behind one {@link ReentrantLock}, so no
 *    command observes a half-applied sibling.
 *  - Expire lazily: a key past its deadline is removed the next time it is touched,
 *    and the expiry listener hears about it. In replica mode nothing is removed on
 *    the local clock: expired keys are hidden from reads, writes still see them,
 *    and only an explicit delete drops them.
 *  - Produce point-in-time snapshots without blocking writers for the
 *    duration of serialization (copy-on-write, see {@link Value}).
 * <p>
 * Note:
 * Values handed out by {@link #snapshot()} are never mutated afterwards:
 * snapshot() bumps the generation, and a collection stamped with an older
 * generation is cloned before it is changed.
 */
public class MemoryStore implements KeyValueStore {

    private static final String NOT_INTEGER = "value is not an integer or out of range";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Bytes, Value> data = new HashMap<>();
    private final Map<Bytes, Long> expires = new HashMap<>();
    private final Clock clock;

    private long generation;
    private long mutations;
    private boolean replicaMode;
    private Consumer<Bytes> expiryListener = key -> { };

    public MemoryStore() {
        this(Clock.systemUTC());
    }

    public MemoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> T atomically(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void expiryListener(Consumer<Bytes> listener) {
        atomically(() -> {
            this.expiryListener = listener;
            return null;
        });
    }

    @Override
    public void replicaMode(boolean enabled) {
        atomically(() -> {
            this.replicaMode = enabled;
            return null;
        });
    }

    // ---------- keys ----------

    @Override
    public long delete(List<Bytes> keys) {
        return atomically(() -> {
            long removed = 0;
            for (Bytes k : keys) {
                if (lookupForWrite(k) != null) {
                    remove(k);
                    removed++;
                }
            }
            if (removed > 0) mutations++;
            return removed;
        });
    }

    @Override
    public long exists(List<Bytes> keys) {
        return atomically(() -> {
            long n = 0;
            for (Bytes k : keys) {
                if (lookup(k) != null) n++;
            }
            return n;
        });
    }

    @Override
    public ValueType type(Bytes key) {
        return atomically(() -> {
            Value v = lookup(key);
            return v == null ? null : v.type();
        });
    }

    @Override
    public boolean expireAt(Bytes key, long epochMillis) {
        return atomically(() -> {
            if (lookupForWrite(key) == null) return false;
            mutations++;
            if (epochMillis <= clock.millis() && !replicaMode) {
                remove(key);
                expiryListener.accept(key);
            } else {
                expires.put(key, epochMillis);
            }
            return true;
        });
    }

    @Override
    public long ttlMillis(Bytes key) {
        return atomically(() -> {
            if (lookup(key) == null) return -2L;
            Long at = expires.get(key);
            if (at == null) return -1L;
            return Math.max(0L, at - clock.millis());
        });
    }

    @Override
    public boolean persist(Bytes key) {
        return atomically(() -> {
            if (lookupForWrite(key) == null) return false;
            boolean had = expires.remove(key) != null;
            if (had) mutations++;
            return had;
        });
    }

    @Override
    public List<Bytes> keys(Bytes pattern) {
        return atomically(() -> {
            purgeExpired();
            long now = clock.millis();
            byte[] p = pattern.unsafeArray();
            List<Bytes> out = new ArrayList<>();
            for (Bytes k : data.keySet()) {
                if (isExpired(k, now)) continue;
                if (GlobMatcher.matches(p, k.unsafeArray())) out.add(k);
            }
            out.sort(null);
            return out;
        });
    }

    @Override
    public long size() {
        return atomically(() -> {
            purgeExpired();
            if (!replicaMode) return (long) data.size();
            long now = clock.millis();
            long live = 0;
            for (Bytes k : data.keySet()) {
                if (!isExpired(k, now)) live++;
            }
            return live;
        });
    }

    @Override
    public void clear() {
        atomically(() -> {
            data.clear();
            expires.clear();
            mutations++;
            return null;
        });
    }

    // ---------- strings ----------

    @Override
    public Bytes get(Bytes key) {
        return atomically(() -> {
            StringValue v = stringOrNull(key);
            return v == null ? null : v.bytes();
        });
    }

    @Override
    public boolean set(Bytes key, Bytes value, SetCondition condition, long expireAtMillis) {
        return atomically(() -> {
            boolean present = lookupForWrite(key) != null;
            if (condition == SetCondition.IF_ABSENT && present) return false;
            if (condition == SetCondition.IF_PRESENT && !present) return false;

            data.put(key, new StringValue(value));
            if (expireAtMillis >= 0) {
                expires.put(key, expireAtMillis);
            } else {
                expires.remove(key);
            }
            mutations++;
            return true;
        });
    }

    @Override
    public long append(Bytes key, Bytes suffix) {
        return atomically(() -> {
            StringValue v = asString(lookupForWrite(key));
            Bytes next = v == null ? suffix : v.bytes().concat(suffix);
            data.put(key, new StringValue(next));
            mutations++;
            return (long) next.length();
        });
    }

    @Override
    public long strlen(Bytes key) {
        return atomically(() -> {
            StringValue v = stringOrNull(key);
            return v == null ? 0L : v.bytes().length();
        });
    }

    @Override
    public long incrBy(Bytes key, long delta) {
        return atomically(() -> {
            StringValue v = asString(lookupForWrite(key));
            long current = 0;
            if (v != null) {
                try {
                    current = Long.parseLong(v.bytes().utf8());
                } catch (NumberFormatException e) {
                    throw new StoreException(NOT_INTEGER);
                }
            }
            long next;
            try {
                next = Math.addExact(current, delta);
            } catch (ArithmeticException e) {
                throw new StoreException("increment or decrement would overflow");
            }
            data.put(key, new StringValue(Bytes.of(next)));
            mutations++;
            return next;
        });
    }

    @Override
    public List<Bytes> mget(List<Bytes> keys) {
        return atomically(() -> {
            List<Bytes> out = new ArrayList<>(keys.size());
            for (Bytes k : keys) {
                Value v = lookup(k);
                out.add(v instanceof StringValue s ? s.bytes() : null);
            }
            return out;
        });
    }

    // ---------- lists ----------

    @Override
    public long push(Bytes key, List<Bytes> elements, boolean head) {
        return atomically(() -> {
            ListValue list = listForWrite(key, true);
            List<Bytes> items = list.mutableItems();
            for (Bytes e : elements) {
                if (head) {
                    items.add(0, e);
                } else {
                    items.add(e);
                }
            }
            mutations++;
            return (long) items.size();
        });
    }

    @Override
    public Bytes pop(Bytes key, boolean head) {
        return atomically(() -> {
            ListValue list = listForWrite(key, false);
            if (list == null) return null;
            List<Bytes> items = list.mutableItems();
            Bytes out = head ? items.remove(0) : items.remove(items.size() - 1);
            removeIfEmpty(key, items.isEmpty());
            mutations++;
            return out;
        });
    }

    @Override
    public long llen(Bytes key) {
        return atomically(() -> {
            ListValue list = listOrNull(key);
            return list == null ? 0L : list.mutableItems().size();
        });
    }

    @Override
    public List<Bytes> lrange(Bytes key, long start, long stop) {
        return atomically(() -> {
            ListValue list = listOrNull(key);
            if (list == null) return List.of();
            List<Bytes> items = list.mutableItems();
            int size = items.size();
            long from = start < 0 ? Math.max(0, size + start) : start;
            long to = stop < 0 ? size + stop : Math.min(stop, size - 1L);
            if (from > to || from >= size) return List.of();
            return List.copyOf(items.subList((int) from, (int) to + 1));
        });
    }

    @Override
    public Bytes lindex(Bytes key, long index) {
        return atomically(() -> {
            ListValue list = listOrNull(key);
            if (list == null) return null;
            int i = normalizeIndex(index, list.mutableItems().size());
            return i < 0 ? null : list.mutableItems().get(i);
        });
    }

    @Override
    public void lset(Bytes key, long index, Bytes element) {
        atomically(() -> {
            ListValue current = asList(lookupForWrite(key));
            if (current == null) throw new StoreException("no such key");
            int i = normalizeIndex(index, current.mutableItems().size());
            if (i < 0) throw new StoreException("index out of range");
            listForWrite(key, false).mutableItems().set(i, element);
            mutations++;
            return null;
        });
    }

    @Override
    public long linsert(Bytes key, boolean before, Bytes pivot, Bytes element) {
        return atomically(() -> {
            ListValue current = asList(lookupForWrite(key));
            if (current == null) return 0L;
            int at = current.mutableItems().indexOf(pivot);
            if (at < 0) return -1L;
            List<Bytes> items = listForWrite(key, false).mutableItems();
            items.add(before ? at : at + 1, element);
            mutations++;
            return (long) items.size();
        });
    }

    @Override
    public long lrem(Bytes key, long count, Bytes element) {
        return atomically(() -> {
            ListValue current = asList(lookupForWrite(key));
            if (current == null || !current.mutableItems().contains(element)) return 0L;
            List<Bytes> items = listForWrite(key, false).mutableItems();
            long limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
            long removed = 0;
            if (count >= 0) {
                Iterator<Bytes> it = items.iterator();
                while (it.hasNext() && removed < limit) {
                    if (it.next().equals(element)) {
                        it.remove();
                        removed++;
                    }
                }
            } else {
                ListIterator<Bytes> it = items.listIterator(items.size());
                while (it.hasPrevious() && removed < limit) {
                    if (it.previous().equals(element)) {
                        it.remove();
                        removed++;
                    }
                }
            }
            removeIfEmpty(key, items.isEmpty());
            mutations++;
            return removed;
        });
    }

    // ---------- hashes ----------

    @Override
    public long hset(Bytes key, Map<Bytes, Bytes> fields) {
        return atomically(() -> {
            Map<Bytes, Bytes> target = hashForWrite(key, true).mutableFields();
            long added = 0;
            for (Map.Entry<Bytes, Bytes> e : fields.entrySet()) {
                if (target.put(e.getKey(), e.getValue()) == null) added++;
            }
            mutations++;
            return added;
        });
    }

    @Override
    public Bytes hget(Bytes key, Bytes field) {
        return atomically(() -> {
            HashValue h = hashOrNull(key);
            return h == null ? null : h.mutableFields().get(field);
        });
    }

    @Override
    public long hdel(Bytes key, List<Bytes> fields) {
        return atomically(() -> {
            HashValue current = asHash(lookupForWrite(key));
            if (current == null) return 0L;
            boolean any = false;
            for (Bytes f : fields) {
                if (current.mutableFields().containsKey(f)) {
                    any = true;
                    break;
                }
            }
            if (!any) return 0L;
            Map<Bytes, Bytes> target = hashForWrite(key, false).mutableFields();
            long removed = 0;
            for (Bytes f : fields) {
                if (target.remove(f) != null) removed++;
            }
            removeIfEmpty(key, target.isEmpty());
            mutations++;
            return removed;
        });
    }

    @Override
    public Map<Bytes, Bytes> hgetall(Bytes key) {
        return atomically(() -> {
            HashValue h = hashOrNull(key);
            return h == null ? Map.of() : new LinkedHashMap<>(h.mutableFields());
        });
    }

    @Override
    public long hlen(Bytes key) {
        return atomically(() -> {
            HashValue h = hashOrNull(key);
            return h == null ? 0L : h.mutableFields().size();
        });
    }

    @Override
    public boolean hexists(Bytes key, Bytes field) {
        return atomically(() -> {
            HashValue h = hashOrNull(key);
            return h != null && h.mutableFields().containsKey(field);
        });
    }

    // ---------- sets ----------

    @Override
    public long sadd(Bytes key, List<Bytes> members) {
        return atomically(() -> {
            Set<Bytes> target = setForWrite(key, true).mutableMembers();
            long added = 0;
            for (Bytes m : members) {
                if (target.add(m)) added++;
            }
            mutations++;
            return added;
        });
    }

    @Override
    public long srem(Bytes key, List<Bytes> members) {
        return atomically(() -> {
            SetValue current = asSet(lookupForWrite(key));
            if (current == null) return 0L;
            boolean any = false;
            for (Bytes m : members) {
                if (current.mutableMembers().contains(m)) {
                    any = true;
                    break;
                }
            }
            if (!any) return 0L;
            Set<Bytes> target = setForWrite(key, false).mutableMembers();
            long removed = 0;
            for (Bytes m : members) {
                if (target.remove(m)) removed++;
            }
            removeIfEmpty(key, target.isEmpty());
            mutations++;
            return removed;
        });
    }

    @Override
    public Set<Bytes> smembers(Bytes key) {
        return atomically(() -> {
            SetValue s = setOrNull(key);
            return s == null ? Set.of() : new LinkedHashSet<>(s.mutableMembers());
        });
    }

    @Override
    public long scard(Bytes key) {
        return atomically(() -> {
            SetValue s = setOrNull(key);
            return s == null ? 0L : s.mutableMembers().size();
        });
    }

    @Override
    public boolean sismember(Bytes key, Bytes member) {
        return atomically(() -> {
            SetValue s = setOrNull(key);
            return s != null && s.mutableMembers().contains(member);
        });
    }

    @Override
    public ScanPage sscan(Bytes key, long cursor, Bytes pattern, int count) {
        return atomically(() -> {
            SetValue s = setOrNull(key);
            if (s == null) return new ScanPage(0L, List.of());
            List<Bytes> members = new ArrayList<>(s.mutableMembers());
            members.sort(null);
            if (cursor >= members.size()) return new ScanPage(0L, List.of());
            int from = (int) cursor;
            int to = (int) Math.min(members.size(), (long) from + count);
            List<Bytes> out = new ArrayList<>();
            for (Bytes m : members.subList(from, to)) {
                if (pattern == null || GlobMatcher.matches(pattern.unsafeArray(), m.unsafeArray())) out.add(m);
            }
            return new ScanPage(to >= members.size() ? 0L : to, out);
        });
    }

    // ---------- persistence hooks ----------

    @Override
    public SnapshotData snapshot() {
        return atomically(() -> {
            purgeExpired();
            generation++;
            List<SnapshotData.Entry> entries = new ArrayList<>(data.size());
            for (Map.Entry<Bytes, Value> e : data.entrySet()) {
                Long at = expires.get(e.getKey());
                entries.add(new SnapshotData.Entry(e.getKey(), e.getValue(), at == null ? -1L : at));
            }
            return new SnapshotData(clock.millis(), entries);
        });
    }

    @Override
    public void load(SnapshotData snapshot) {
        atomically(() -> {
            data.clear();
            expires.clear();
            long now = clock.millis();
            for (SnapshotData.Entry e : snapshot.entries()) {
                if (!replicaMode && e.expireAtMillis() >= 0 && e.expireAtMillis() <= now) continue;
                data.put(e.key(), e.value().copy(generation));
                if (e.expireAtMillis() >= 0) expires.put(e.key(), e.expireAtMillis());
            }
            mutations++;
            return null;
        });
    }

    @Override
    public long mutations() {
        return atomically(() -> mutations);
    }

    // ---------- internals (lock held) ----------

    /** Read view: expired keys are absent. */
    private Value lookup(Bytes key) {
        Value v = data.get(key);
        if (v == null) return null;
        if (isExpired(key, clock.millis())) {
            if (!replicaMode) expire(key);
            return null;
        }
        return v;
    }

    /** Write view: in replica mode an expired key stays visible until the primary deletes it. */
    private Value lookupForWrite(Bytes key) {
        return replicaMode ? data.get(key) : lookup(key);
    }

    private boolean isExpired(Bytes key, long now) {
        Long at = expires.get(key);
        return at != null && at <= now;
    }

    private void expire(Bytes key) {
        remove(key);
        expiryListener.accept(key);
    }

    private void remove(Bytes key) {
        data.remove(key);
        expires.remove(key);
    }

    private void removeIfEmpty(Bytes key, boolean empty) {
        if (empty) remove(key);
    }

    private void purgeExpired() {
        if (expires.isEmpty() || replicaMode) return;
        long now = clock.millis();
        List<Bytes> due = new ArrayList<>();
        for (Map.Entry<Bytes, Long> e : expires.entrySet()) {
            if (e.getValue() <= now) due.add(e.getKey());
        }
        due.forEach(this::expire);
    }

    private static int normalizeIndex(long index, int size) {
        long i = index < 0 ? size + index : index;
        return i < 0 || i >= size ? -1 : (int) i;
    }

    private StringValue stringOrNull(Bytes key) {
        return asString(lookup(key));
    }

    private ListValue listOrNull(Bytes key) {
        return asList(lookup(key));
    }

    private HashValue hashOrNull(Bytes key) {
        return asHash(lookup(key));
    }

    private SetValue setOrNull(Bytes key) {
        return asSet(lookup(key));
    }

    private static StringValue asString(Value v) {
        if (v == null) return null;
        if (v instanceof StringValue s) return s;
        throw new WrongTypeException(v.type());
    }

    private static ListValue asList(Value v) {
        if (v == null) return null;
        if (v instanceof ListValue l) return l;
        throw new WrongTypeException(v.type());
    }

    private static HashValue asHash(Value v) {
        if (v == null) return null;
        if (v instanceof HashValue h) return h;
        throw new WrongTypeException(v.type());
    }

    private static SetValue asSet(Value v) {
        if (v == null) return null;
        if (v instanceof SetValue s) return s;
        throw new WrongTypeException(v.type());
    }

    // A value stamped with an older generation may still be read by a snapshot,
    // so the first write after snapshot() clones it.

    private ListValue listForWrite(Bytes key, boolean create) {
        ListValue current = asList(lookupForWrite(key));
        if (current == null) {
            if (!create) return null;
            ListValue fresh = new ListValue(List.of(), generation);
            data.put(key, fresh);
            return fresh;
        }
        if (current.generation() >= generation) return current;
        ListValue copy = current.copy(generation);
        data.put(key, copy);
        return copy;
    }

    private HashValue hashForWrite(Bytes key, boolean create) {
        HashValue current = asHash(lookupForWrite(key));
        if (current == null) {
            if (!create) return null;
            HashValue fresh = new HashValue(Map.of(), generation);
            data.put(key, fresh);
            return fresh;
        }
        if (current.generation() >= generation) return current;
        HashValue copy = current.copy(generation);
        data.put(key, copy);
        return copy;
    }

    private SetValue setForWrite(Bytes key, boolean create) {
        SetValue current = asSet(lookupForWrite(key));
        if (current == null) {
            if (!create) return null;
            SetValue fresh = new SetValue(List.of(), generation);
            data.put(key, fresh);
            return fresh;
        }
        if (current.generation() >= generation) return current;
        SetValue copy = current.copy(generation);
        data.put(key, copy);
        return copy;
    }
}
