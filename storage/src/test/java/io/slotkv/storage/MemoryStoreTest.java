package io.slotkv.storage;

import io.slotkv.core.Bytes;
import io.slotkv.storage.KeyValueStore.SetCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStoreTest {

    private MutableClock clock;
    private MemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        store = new MemoryStore(clock);
    }

    private static Bytes b(String s) {
        return Bytes.of(s);
    }

    private static List<Bytes> bs(String... s) {
        return java.util.Arrays.stream(s).map(Bytes::of).toList();
    }

    // ---------- strings ----------

    @Test
    void set_then_get_returns_value_and_set_is_idempotent() {
        assertTrue(store.set(b("k"), b("v"), SetCondition.ALWAYS, -1));
        assertTrue(store.set(b("k"), b("v"), SetCondition.ALWAYS, -1));

        assertEquals(b("v"), store.get(b("k")));
        assertEquals(1, store.size());
    }

    @Test
    void set_conditions_nx_and_xx() {
        assertFalse(store.set(b("k"), b("v"), SetCondition.IF_PRESENT, -1));
        assertNull(store.get(b("k")));

        assertTrue(store.set(b("k"), b("v1"), SetCondition.IF_ABSENT, -1));
        assertFalse(store.set(b("k"), b("v2"), SetCondition.IF_ABSENT, -1));
        assertEquals(b("v1"), store.get(b("k")));

        assertTrue(store.set(b("k"), b("v3"), SetCondition.IF_PRESENT, -1));
        assertEquals(b("v3"), store.get(b("k")));
    }

    @Test
    void plain_set_clears_previous_expiry() {
        store.set(b("k"), b("v"), SetCondition.ALWAYS, clock.millis() + 1000);
        store.set(b("k"), b("v2"), SetCondition.ALWAYS, -1);

        assertEquals(-1, store.ttlMillis(b("k")));
    }

    @Test
    void incr_creates_missing_key_and_rejects_non_integers() {
        assertEquals(1, store.incrBy(b("n"), 1));
        assertEquals(-4, store.incrBy(b("n"), -5));

        store.set(b("s"), b("abc"), SetCondition.ALWAYS, -1);
        StoreException ex = assertThrows(StoreException.class, () -> store.incrBy(b("s"), 1));
        assertEquals("value is not an integer or out of range", ex.getMessage());
        assertEquals(b("abc"), store.get(b("s")));
    }

    @Test
    void incr_overflow_is_rejected() {
        store.set(b("n"), Bytes.of(Long.MAX_VALUE), SetCondition.ALWAYS, -1);
        assertThrows(StoreException.class, () -> store.incrBy(b("n"), 1));
        assertEquals(Bytes.of(Long.MAX_VALUE), store.get(b("n")));
    }

    @Test
    void append_and_strlen() {
        assertEquals(5, store.append(b("k"), b("hello")));
        assertEquals(11, store.append(b("k"), b(" world")));
        assertEquals(11, store.strlen(b("k")));
        assertEquals(0, store.strlen(b("missing")));
    }

    @Test
    void mget_returns_null_for_missing_and_non_string_keys() {
        store.set(b("a"), b("1"), SetCondition.ALWAYS, -1);
        store.push(b("l"), bs("x"), false);

        List<Bytes> out = store.mget(bs("a", "missing", "l"));

        assertEquals(b("1"), out.get(0));
        assertNull(out.get(1));
        assertNull(out.get(2));
    }

    // ---------- type safety ----------

    @Test
    void wrong_type_leaves_value_untouched() {
        store.set(b("k"), b("text"), SetCondition.ALWAYS, -1);
        long before = store.mutations();

        WrongTypeException ex = assertThrows(WrongTypeException.class,
                () -> store.push(b("k"), bs("a"), true));

        assertEquals(ValueType.STRING, ex.actual());
        assertEquals(b("text"), store.get(b("k")));
        assertEquals(before, store.mutations());
        assertThrows(WrongTypeException.class, () -> store.hget(b("k"), b("f")));
        assertThrows(WrongTypeException.class, () -> store.sadd(b("k"), bs("m")));
    }

    @Test
    void type_reports_shape_or_null() {
        store.set(b("s"), b("v"), SetCondition.ALWAYS, -1);
        store.push(b("l"), bs("v"), false);
        store.hset(b("h"), Map.of(b("f"), b("v")));
        store.sadd(b("z"), bs("m"));

        assertEquals(ValueType.STRING, store.type(b("s")));
        assertEquals(ValueType.LIST, store.type(b("l")));
        assertEquals(ValueType.HASH, store.type(b("h")));
        assertEquals(ValueType.SET, store.type(b("z")));
        assertNull(store.type(b("nope")));
    }

    // ---------- expiry ----------

    @Test
    void expired_key_is_absent_after_deadline() {
        store.set(b("k"), b("v"), SetCondition.ALWAYS, clock.millis() + 100);
        assertEquals(b("v"), store.get(b("k")));
        assertEquals(100, store.ttlMillis(b("k")));

        clock.advance(100);

        assertNull(store.get(b("k")));
        assertEquals(-2, store.ttlMillis(b("k")));
        assertEquals(0, store.size());
    }

    @Test
    void expire_in_the_past_deletes_immediately() {
        store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);
        assertTrue(store.expireAt(b("k"), clock.millis() - 1));
        assertEquals(0, store.exists(bs("k")));
        assertFalse(store.expireAt(b("missing"), clock.millis() + 10));
    }

    @Test
    void persist_removes_expiry() {
        store.set(b("k"), b("v"), SetCondition.ALWAYS, clock.millis() + 50);
        assertTrue(store.persist(b("k")));
        assertFalse(store.persist(b("k")));

        clock.advance(1000);
        assertEquals(b("v"), store.get(b("k")));
    }

    @Test
    void keys_matches_glob_and_skips_expired() {
        store.set(b("doc:1"), b("a"), SetCondition.ALWAYS, -1);
        store.set(b("doc:2"), b("b"), SetCondition.ALWAYS, clock.millis() + 10);
        store.set(b("user:1"), b("c"), SetCondition.ALWAYS, -1);

        assertEquals(bs("doc:1", "doc:2"), store.keys(b("doc:*")));
        clock.advance(10);
        assertEquals(bs("doc:1"), store.keys(b("doc:*")));
        assertEquals(bs("doc:1", "user:1"), store.keys(b("*:1")));
    }

    @Test
    void delete_and_exists_count_distinct_hits() {
        store.set(b("a"), b("1"), SetCondition.ALWAYS, -1);
        store.set(b("b"), b("2"), SetCondition.ALWAYS, -1);

        assertEquals(3, store.exists(bs("a", "a", "b")));
        assertEquals(2, store.delete(bs("a", "b", "c")));
        assertEquals(0, store.size());
    }

    // ---------- lists ----------

    @Test
    void push_pop_and_range() {
        assertEquals(3, store.push(b("l"), bs("a", "b", "c"), false));
        assertEquals(5, store.push(b("l"), bs("x", "y"), true));

        assertEquals(bs("y", "x", "a", "b", "c"), store.lrange(b("l"), 0, -1));
        assertEquals(bs("a", "b"), store.lrange(b("l"), 2, 3));
        assertEquals(bs("b", "c"), store.lrange(b("l"), -2, 100));
        assertEquals(List.of(), store.lrange(b("l"), 4, 2));

        assertEquals(b("y"), store.pop(b("l"), true));
        assertEquals(b("c"), store.pop(b("l"), false));
        assertEquals(3, store.llen(b("l")));
    }

    @Test
    void popping_last_element_removes_the_key() {
        store.push(b("l"), bs("only"), false);
        store.expireAt(b("l"), clock.millis() + 10_000);

        assertEquals(b("only"), store.pop(b("l"), true));

        assertNull(store.type(b("l")));
        assertNull(store.pop(b("l"), true));
        assertEquals(-2, store.ttlMillis(b("l")));
    }

    @Test
    void lindex_lset_and_linsert() {
        store.push(b("l"), bs("a", "b", "c"), false);

        assertEquals(b("c"), store.lindex(b("l"), -1));
        assertNull(store.lindex(b("l"), 3));

        store.lset(b("l"), 1, b("B"));
        assertEquals(b("B"), store.lindex(b("l"), 1));
        StoreException range = assertThrows(StoreException.class, () -> store.lset(b("l"), 9, b("z")));
        assertEquals("index out of range", range.getMessage());
        assertThrows(StoreException.class, () -> store.lset(b("missing"), 0, b("z")));

        assertEquals(4, store.linsert(b("l"), true, b("B"), b("ab")));
        assertEquals(5, store.linsert(b("l"), false, b("c"), b("d")));
        assertEquals(-1, store.linsert(b("l"), true, b("nope"), b("q")));
        assertEquals(0, store.linsert(b("missing"), true, b("a"), b("q")));
        assertEquals(bs("a", "ab", "B", "c", "d"), store.lrange(b("l"), 0, -1));
    }

    @Test
    void lrem_respects_count_direction() {
        store.push(b("l"), bs("x", "a", "x", "b", "x"), false);

        assertEquals(1, store.lrem(b("l"), -1, b("x")));
        assertEquals(bs("x", "a", "x", "b"), store.lrange(b("l"), 0, -1));

        assertEquals(1, store.lrem(b("l"), 1, b("x")));
        assertEquals(bs("a", "x", "b"), store.lrange(b("l"), 0, -1));

        assertEquals(1, store.lrem(b("l"), 0, b("x")));
        assertEquals(0, store.lrem(b("l"), 0, b("x")));
    }

    // ---------- hashes ----------

    @Test
    void hash_fields_add_overwrite_and_delete() {
        Map<Bytes, Bytes> fields = new LinkedHashMap<>();
        fields.put(b("title"), b("Draft"));
        fields.put(b("owner"), b("ana"));

        assertEquals(2, store.hset(b("doc"), fields));
        assertEquals(0, store.hset(b("doc"), Map.of(b("title"), b("Final"))));

        assertEquals(b("Final"), store.hget(b("doc"), b("title")));
        assertTrue(store.hexists(b("doc"), b("owner")));
        assertEquals(2, store.hlen(b("doc")));
        assertEquals(List.of(b("title"), b("owner")), List.copyOf(store.hgetall(b("doc")).keySet()));

        assertEquals(1, store.hdel(b("doc"), bs("owner", "nope")));
        assertEquals(1, store.hdel(b("doc"), bs("title")));
        assertNull(store.type(b("doc")));
    }

    // ---------- sets ----------

    @Test
    void set_members_are_unique() {
        assertEquals(2, store.sadd(b("s"), bs("a", "b", "a")));
        assertEquals(1, store.sadd(b("s"), bs("b", "c")));

        assertEquals(3, store.scard(b("s")));
        assertTrue(store.sismember(b("s"), b("c")));
        assertEquals(Set.of(b("a"), b("b"), b("c")), store.smembers(b("s")));

        assertEquals(3, store.srem(b("s"), bs("a", "b", "c", "d")));
        assertEquals(0, store.scard(b("s")));
        assertNull(store.type(b("s")));
    }

    @Test
    void sscan_pages_through_sorted_members_with_a_filter() {
        store.sadd(b("s"), bs("doc:3", "doc:1", "user:1", "doc:2", "doc:4"));

        ScanPage first = store.sscan(b("s"), 0, null, 2);
        assertEquals(bs("doc:1", "doc:2"), first.items());
        assertEquals(2, first.cursor());

        ScanPage second = store.sscan(b("s"), first.cursor(), b("doc:*"), 2);
        assertEquals(bs("doc:3", "doc:4"), second.items());

        ScanPage last = store.sscan(b("s"), second.cursor(), b("doc:*"), 2);
        assertEquals(List.of(), last.items());
        assertEquals(0, last.cursor());
    }

    @Test
    void sscan_of_missing_key_or_exhausted_cursor_is_empty_and_final() {
        assertEquals(new ScanPage(0, List.of()), store.sscan(b("nope"), 0, null, 10));

        store.sadd(b("s"), bs("a"));
        assertEquals(new ScanPage(0, List.of()), store.sscan(b("s"), 99, null, 10));
    }

    // ---------- expiry ownership ----------

    @Test
    void lazy_expiry_is_reported_to_the_listener() {
        List<Bytes> expired = new ArrayList<>();
        store.expiryListener(expired::add);
        store.set(b("a"), b("1"), SetCondition.ALWAYS, clock.millis() + 100);
        store.set(b("b"), b("2"), SetCondition.ALWAYS, clock.millis() + 100);
        store.set(b("c"), b("3"), SetCondition.ALWAYS, -1);

        clock.advance(100);
        assertNull(store.get(b("a")));
        assertEquals(bs("a"), expired);

        assertEquals(1, store.size());
        assertEquals(bs("a", "b"), expired);
    }

    @Test
    void past_deadline_on_expire_is_reported_to_the_listener() {
        List<Bytes> expired = new ArrayList<>();
        store.expiryListener(expired::add);
        store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);

        assertTrue(store.expireAt(b("k"), clock.millis() - 1));

        assertEquals(bs("k"), expired);
    }

    @Test
    void replica_mode_hides_expired_keys_from_reads_but_keeps_them_for_writes() {
        List<Bytes> expired = new ArrayList<>();
        store.expiryListener(expired::add);
        store.replicaMode(true);
        store.set(b("n"), b("5"), SetCondition.ALWAYS, clock.millis() + 100);

        clock.advance(200);

        // --- reads see nothing ---
        assertNull(store.get(b("n")));
        assertEquals(0, store.exists(bs("n")));
        assertEquals(List.of(), store.keys(b("*")));
        assertEquals(0, store.size());

        // --- writes still see the old value ---
        assertEquals(6, store.incrBy(b("n"), 1));
        assertTrue(expired.isEmpty());

        // --- only an explicit delete drops it ---
        clock.advance(-200);
        assertEquals(b("6"), store.get(b("n")));
        assertEquals(1, store.delete(bs("n")));
        assertNull(store.get(b("n")));
    }

    @Test
    void replica_mode_load_keeps_entries_the_local_clock_considers_expired() {
        store.replicaMode(true);
        store.load(new SnapshotData(clock.millis(), List.of(
                new SnapshotData.Entry(b("k"), new StringValue(b("v")), clock.millis() - 10))));

        assertNull(store.get(b("k")));
        clock.advance(-20);
        assertEquals(b("v"), store.get(b("k")));
    }

    // ---------- snapshots ----------

    @Test
    void snapshot_is_isolated_from_later_writes() {
        store.push(b("l"), bs("a"), false);
        store.hset(b("h"), Map.of(b("f"), b("1")));
        store.sadd(b("s"), bs("m"));
        store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);

        SnapshotData snap = store.snapshot();

        store.push(b("l"), bs("b"), false);
        store.hset(b("h"), Map.of(b("g"), b("2")));
        store.sadd(b("s"), bs("n"));
        store.set(b("k"), b("changed"), SetCondition.ALWAYS, -1);
        store.delete(bs("k"));

        Map<Bytes, Value> byKey = new LinkedHashMap<>();
        for (SnapshotData.Entry e : snap.entries()) byKey.put(e.key(), e.value());

        assertEquals(new ListValue(bs("a"), 0), byKey.get(b("l")));
        assertEquals(new HashValue(Map.of(b("f"), b("1")), 0), byKey.get(b("h")));
        assertEquals(new SetValue(bs("m"), 0), byKey.get(b("s")));
        assertEquals(new StringValue(b("v")), byKey.get(b("k")));
        assertEquals(bs("a", "b"), store.lrange(b("l"), 0, -1));
    }

    @Test
    void load_replaces_content_and_drops_expired_entries() {
        store.set(b("old"), b("x"), SetCondition.ALWAYS, -1);
        SnapshotData data = new SnapshotData(clock.millis(), List.of(
                new SnapshotData.Entry(b("live"), new StringValue(b("1")), -1),
                new SnapshotData.Entry(b("later"), new ListValue(bs("a"), 0), clock.millis() + 500),
                new SnapshotData.Entry(b("dead"), new StringValue(b("2")), clock.millis() - 1)));

        store.load(data);

        assertNull(store.get(b("old")));
        assertEquals(b("1"), store.get(b("live")));
        assertEquals(500, store.ttlMillis(b("later")));
        assertEquals(2, store.size());

        store.push(b("later"), bs("b"), false);
        assertEquals(new ListValue(bs("a"), 0), data.entries().get(1).value());
    }

    @Test
    void mutations_counter_moves_only_on_writes() {
        long start = store.mutations();
        store.get(b("k"));
        store.lrange(b("k"), 0, -1);
        assertEquals(start, store.mutations());

        store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);
        assertTrue(store.mutations() > start);
    }
}
