package io.slotkv.storage;

import io.slotkv.core.Bytes;
import io.slotkv.storage.KeyValueStore.SetCondition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceManagerTest {

    @TempDir Path dir;

    private static Bytes b(String s) {
        return Bytes.of(s);
    }

    private PersistenceManager manager(KeyValueStore store, Duration interval) {
        return new PersistenceManager(store, new FileSnapshotter(dir, "node-0-16383-4000.snap"), interval);
    }

    @Test
    void restart_reproduces_acknowledged_writes() {
        // --- arrange ---
        var store1 = new MemoryStore();
        var pm1 = manager(store1, Duration.ZERO);
        pm1.restore();
        store1.set(b("doc:1"), b("hello"), SetCondition.ALWAYS, -1);
        store1.push(b("ops"), List.of(b("insert"), b("delete")), false);
        store1.hset(b("meta"), Map.of(b("title"), b("t")));
        store1.sadd(b("editors"), List.of(b("ana")));

        // --- act ---
        pm1.stop();
        var store2 = new MemoryStore();
        int loaded = manager(store2, Duration.ZERO).restore();

        // --- assert ---
        assertEquals(4, loaded);
        assertEquals(b("hello"), store2.get(b("doc:1")));
        assertEquals(List.of(b("insert"), b("delete")), store2.lrange(b("ops"), 0, -1));
        assertEquals(b("t"), store2.hget(b("meta"), b("title")));
        assertTrue(store2.sismember(b("editors"), b("ana")));
    }

    @Test
    void cold_start_without_snapshot_is_empty() {
        var store = new MemoryStore();
        assertEquals(0, manager(store, Duration.ZERO).restore());
        assertEquals(0, store.size());
    }

    @Test
    void corrupt_snapshot_fails_restore() throws Exception {
        Files.writeString(dir.resolve("node-0-16383-4000.snap"), "garbage garbage garbage");
        var pm = manager(new MemoryStore(), Duration.ZERO);

        assertThrows(PersistenceException.class, pm::restore);
    }

    @Test
    void restore_runs_only_once() {
        var pm = manager(new MemoryStore(), Duration.ZERO);
        pm.restore();
        assertThrows(IllegalStateException.class, pm::restore);
    }

    @Test
    void clean_store_is_not_rewritten() throws Exception {
        var store = new MemoryStore();
        var pm = manager(store, Duration.ZERO);
        pm.restore();

        assertFalse(pm.snapshotIfDirty());
        assertFalse(Files.exists(dir.resolve(pm.snapshotName())));

        store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);
        assertTrue(pm.snapshotIfDirty());
        assertFalse(pm.snapshotIfDirty());
        assertTrue(pm.lastSnapshotMillis() > 0);
    }

    @Test
    void expired_keys_are_dropped_on_restore() {
        var store1 = new MemoryStore();
        var pm1 = manager(store1, Duration.ZERO);
        pm1.restore();
        store1.set(b("short"), b("v"), SetCondition.ALWAYS, System.currentTimeMillis() + 50);
        store1.set(b("long"), b("v"), SetCondition.ALWAYS, -1);
        pm1.snapshotNow();

        var later = new MutableClock(System.currentTimeMillis() + 60_000);
        var store2 = new MemoryStore(later);
        manager(store2, Duration.ZERO).restore();

        assertNull(store2.get(b("short")));
        assertEquals(b("v"), store2.get(b("long")));
    }

    @Test
    void failed_write_keeps_previous_snapshot_and_stays_dirty() {
        var store = new MemoryStore();
        var failing = new AtomicInteger();
        var real = new FileSnapshotter(dir, "s.snap");
        Snapshotter flaky = new Snapshotter() {
            @Override
            public String writeSnapshot(SnapshotData snapshot) {
                if (failing.get() > 0) throw new PersistenceException("disk full");
                return real.writeSnapshot(snapshot);
            }

            @Override
            public SnapshotData loadLatest() {
                return real.loadLatest();
            }

            @Override
            public String name() {
                return real.name();
            }
        };
        var pm = new PersistenceManager(store, flaky, Duration.ZERO);
        pm.restore();
        store.set(b("a"), b("1"), SetCondition.ALWAYS, -1);
        pm.snapshotNow();

        failing.set(1);
        store.set(b("b"), b("2"), SetCondition.ALWAYS, -1);
        assertThrows(PersistenceException.class, pm::snapshotIfDirty);

        assertEquals(1, real.loadLatest().entries().size());
        failing.set(0);
        assertTrue(pm.snapshotIfDirty());
        assertEquals(2, real.loadLatest().entries().size());
    }

    @Test
    void writers_keep_going_while_snapshot_is_taken() throws Exception {
        var store = new MemoryStore();
        for (int i = 0; i < 1000; i++) {
            store.push(b("list"), List.of(b("v" + i)), false);
        }
        var pm = manager(store, Duration.ZERO);
        pm.restore();

        var started = new CountDownLatch(1);
        Thread writer = new Thread(() -> {
            started.countDown();
            for (int i = 0; i < 1000; i++) {
                store.push(b("list"), List.of(b("w" + i)), false);
            }
        });
        writer.start();
        started.await();
        pm.snapshotNow();
        writer.join();

        var restored = new MemoryStore();
        manager(restored, Duration.ZERO).restore();
        long len = restored.llen(b("list"));
        assertTrue(len >= 1000 && len <= 2000, "len=" + len);
        List<Bytes> items = restored.lrange(b("list"), 0, -1);
        for (int i = 0; i < 1000; i++) {
            assertEquals(b("v" + i), items.get(i));
        }
        assertEquals(2000, store.llen(b("list")));
    }

    @Test
    void timer_snapshots_dirty_store() throws Exception {
        var store = new MemoryStore();
        var pm = manager(store, Duration.ofMillis(50));
        pm.restore();
        pm.start();
        try {
            store.set(b("k"), b("v"), SetCondition.ALWAYS, -1);
            Path file = dir.resolve(pm.snapshotName());
            long deadline = System.currentTimeMillis() + 5_000;
            while (!Files.exists(file) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(Files.exists(file));
        } finally {
            pm.stop();
        }
    }
}
