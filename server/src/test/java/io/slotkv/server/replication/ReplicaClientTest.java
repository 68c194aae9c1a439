package io.slotkv.server.replication;

import io.slotkv.core.resp.Command;
import io.slotkv.server.TestClusters;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.storage.MemoryStore;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue bound and reconnect back-off of a single forwarder, against plain sockets.
 */
class ReplicaClientTest {

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(20);
        }
    }

    private static void enqueue(MemoryStore store, ReplicaClient client, Command command) {
        store.atomically(() -> {
            client.enqueue(command);
            return null;
        });
    }

    @Test
    void full_queue_drops_writes_and_counts_them_as_failed() throws Exception {
        // --- arrange: a replica that accepts the connection but never answers ---
        try (var silent = new ServerSocket(0)) {
            var store = new MemoryStore();
            var client = new ReplicaClient(TestClusters.local(silent.getLocalPort()), "shard-0", null, "secret",
                    store, Duration.ofSeconds(2), 1, Duration.ofMinutes(10));

            // --- act: one in flight, one queued, three over the bound ---
            for (int i = 0; i < 5; i++) {
                enqueue(store, client, Command.of("SET", "k" + i, "v"));
            }

            // --- assert ---
            assertEquals(3, client.failed());
            assertEquals(0, client.forwarded());
            client.stop();
        }
    }

    @Test
    void failed_connect_backs_off_instead_of_retrying_on_every_write() throws Exception {
        // --- arrange ---
        int port = TestClusters.freePort();
        NodeAddress target = TestClusters.local(port);
        var store = new MemoryStore();
        var client = new ReplicaClient(target, "shard-0", null, "secret",
                store, Duration.ofSeconds(1), 100, Duration.ofMinutes(10));
        enqueue(store, client, Command.of("SET", "a", "1"));
        await(() -> client.failed() == 1, "refused connect");

        // --- act: the replica comes up, but the back-off window is still open ---
        try (var late = new ServerSocket(port)) {
            late.setSoTimeout(300);
            enqueue(store, client, Command.of("SET", "b", "2"));
            await(() -> client.failed() == 2, "skipped write");

            // --- assert ---
            assertThrows(SocketTimeoutException.class, late::accept);
            assertEquals(0, client.resyncs());
        } finally {
            client.stop();
        }
    }
}
