// file: server/src/test/java/io/slotkv/server/replication/ReplicationTest.java
package io.slotkv.server.replication;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.MutableClock;
import io.slotkv.server.SlotKvNode;
import io.slotkv.server.TestClient;
import io.slotkv.server.TestClusters;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.server.cluster.ShardDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Primary to replica propagation between two real nodes on loopback.
 */
class ReplicationTest {

    @TempDir
    Path tmp;

    private final List<SlotKvNode> nodes = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (SlotKvNode n : nodes) n.stop();
    }

    private SlotKvNode startNode(List<ShardDescriptor> shards, NodeAddress local, ClusterConfig.Settings settings)
            throws Exception {
        return startNode(shards, local, settings, Clock.systemUTC());
    }

    private SlotKvNode startNode(List<ShardDescriptor> shards, NodeAddress local, ClusterConfig.Settings settings,
                                 Clock clock) throws Exception {
        var node = new SlotKvNode(new ClusterConfig(shards, local, settings), clock);
        node.start();
        nodes.add(node);
        return node;
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(20);
        }
    }

    @Test
    void writes_on_primary_reach_replica_in_order() throws Exception {
        // --- arrange ---
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp);
        SlotKvNode replicaNode = startNode(shards, replica, settings);
        startNode(shards, primary, settings);

        // --- act ---
        try (var c = new TestClient(primary.port())) {
            for (int i = 0; i < 200; i++) {
                assertEquals(Reply.integer(i + 1), c.call("INCR", "counter"));
            }
            c.call("RPUSH", "log", "a", "b");
            c.call("LPOP", "log");
            c.call("SET", "tmp", "x");
            c.call("DEL", "tmp");
        }

        // --- assert ---
        await(() -> Bytes.of("200").equals(replicaNode.store().get(Bytes.of("counter"))), "counter on replica");
        await(() -> replicaNode.store().llen(Bytes.of("log")) == 1, "list on replica");
        assertEquals(List.of(Bytes.of("b")), replicaNode.store().lrange(Bytes.of("log"), 0, -1));
        assertNull(replicaNode.store().get(Bytes.of("tmp")));
    }

    @Test
    void relative_expiry_is_replicated_as_same_deadline() throws Exception {
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp);
        SlotKvNode replicaNode = startNode(shards, replica, settings);
        SlotKvNode primaryNode = startNode(shards, primary, settings);

        try (var c = new TestClient(primary.port())) {
            c.call("SET", "session", "abc", "EX", "100");
        }

        await(() -> replicaNode.store().get(Bytes.of("session")) != null, "session on replica");
        long onPrimary = primaryNode.store().ttlMillis(Bytes.of("session"));
        long onReplica = replicaNode.store().ttlMillis(Bytes.of("session"));
        assertTrue(onReplica > 90_000 && onReplica <= 100_000, "replica ttl " + onReplica);
        assertTrue(Math.abs(onPrimary - onReplica) < 1_000);
    }

    @Test
    void replica_redirects_client_writes_to_primary() throws Exception {
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        startNode(shards, replica, TestClusters.quietSettings(tmp));

        try (var c = new TestClient(replica.port())) {
            Reply r = c.call("SET", "bar", "v");
            assertEquals("MOVED 5061 " + primary, ((Reply.Error) r).message());
            assertEquals(Reply.NULL, c.call("GET", "bar"));
        }
    }

    @Test
    void replication_link_authenticates_when_password_is_set() throws Exception {
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp).withRequirePass("pw");
        SlotKvNode replicaNode = startNode(shards, replica, settings);
        startNode(shards, primary, settings);

        try (var c = new TestClient(primary.port())) {
            assertEquals(Reply.OK, c.call("AUTH", "pw"));
            assertEquals(Reply.OK, c.call("SET", "k", "v"));
        }

        await(() -> replicaNode.store().get(Bytes.of("k")) != null, "k on replica");
    }

    @Test
    void unreachable_replica_does_not_block_primary() throws Exception {
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress missing = TestClusters.local(TestClusters.freePort());
        SlotKvNode primaryNode = startNode(TestClusters.singleShard(primary, missing), primary,
                TestClusters.quietSettings(tmp));

        try (var c = new TestClient(primary.port())) {
            assertEquals(Reply.OK, c.call("SET", "k", "v"));
            assertEquals(Reply.bulk("v"), c.call("GET", "k"));
        }

        ReplicaClient client = primaryNode.replication().clients().get(0);
        await(() -> client.failed() == 1, "failed forward");
        assertEquals(0, client.forwarded());
    }

    @Test
    void replica_joining_late_gets_the_full_state_before_live_writes() throws Exception {
        // --- arrange ---
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp);
        SlotKvNode primaryNode = startNode(shards, primary, settings);
        ReplicaClient link = primaryNode.replication().clients().get(0);
        try (var c = new TestClient(primary.port())) {
            c.call("SET", "early", "1");
            c.call("SADD", "tags", "a", "b", "c");
            c.call("SET", "doomed", "x", "EX", "100");
        }
        await(() -> link.failed() == 3, "writes skipped while the replica is down");

        // --- act ---
        SlotKvNode replicaNode = startNode(shards, replica, settings);
        Thread.sleep(ReplicaClient.DEFAULT_BACKOFF.toMillis() + 100);
        try (var c = new TestClient(primary.port())) {
            c.call("SET", "live", "2");
        }

        // --- assert ---
        await(() -> replicaNode.store().get(Bytes.of("live")) != null, "live write on replica");
        assertEquals(Bytes.of("1"), replicaNode.store().get(Bytes.of("early")));
        assertEquals(3, replicaNode.store().scard(Bytes.of("tags")));
        assertTrue(replicaNode.store().ttlMillis(Bytes.of("doomed")) > 90_000);
        assertEquals(1, link.resyncs());
    }

    @Test
    void restarted_replica_is_resynced_including_deletes_it_missed() throws Exception {
        // --- arrange ---
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp);
        SlotKvNode replicaNode = startNode(shards, replica, settings);
        SlotKvNode primaryNode = startNode(shards, primary, settings);
        ReplicaClient link = primaryNode.replication().clients().get(0);
        try (var c = new TestClient(primary.port())) {
            c.call("SET", "a", "1");
        }
        await(() -> replicaNode.store().get(Bytes.of("a")) != null, "a on replica");

        // --- act ---
        replicaNode.stop();
        nodes.remove(replicaNode);
        try (var c = new TestClient(primary.port())) {
            c.call("DEL", "a");
            c.call("SET", "b", "2");
        }
        await(() -> link.failed() >= 1, "write skipped while the replica is down");
        SlotKvNode restarted = startNode(shards, replica, settings);
        Thread.sleep(ReplicaClient.DEFAULT_BACKOFF.toMillis() + 100);
        try (var c = new TestClient(primary.port())) {
            c.call("SET", "c", "3");
        }

        // --- assert ---
        await(() -> restarted.store().get(Bytes.of("c")) != null, "c on restarted replica");
        assertNull(restarted.store().get(Bytes.of("a")));
        assertEquals(Bytes.of("2"), restarted.store().get(Bytes.of("b")));
        assertEquals(2, link.resyncs());
    }

    @Test
    void replica_with_a_lagging_clock_follows_the_primary_expiry() throws Exception {
        // --- arrange ---
        long t0 = 1_700_000_000_000L;
        var primaryClock = new MutableClock(t0);
        var replicaClock = new MutableClock(t0 + 50);
        NodeAddress primary = TestClusters.local(TestClusters.freePort());
        NodeAddress replica = TestClusters.local(TestClusters.freePort());
        var shards = TestClusters.singleShard(primary, replica);
        var settings = TestClusters.quietSettings(tmp);
        SlotKvNode replicaNode = startNode(shards, replica, settings, replicaClock);
        SlotKvNode primaryNode = startNode(shards, primary, settings, primaryClock);
        Bytes key = Bytes.of("n");

        try (var c = new TestClient(primary.port())) {
            c.call("SET", "n", "5", "PXAT", Long.toString(t0 + 100));
            await(() -> Bytes.of("5").equals(replicaNode.store().get(key)), "n on replica");

            // --- act: primary still sees n alive, the replica clock is already past the deadline ---
            primaryClock.set(t0 + 90);
            replicaClock.set(t0 + 140);
            assertEquals(Reply.integer(6), c.call("INCR", "n"));
            await(() -> primaryNode.replication().clients().get(0).forwarded() >= 2, "INCR forwarded");

            // --- assert: the replica applied INCR to the same value and kept the deadline ---
            assertNull(replicaNode.store().get(key));
            replicaClock.set(t0 + 90);
            assertEquals(Bytes.of("6"), replicaNode.store().get(key));
            assertEquals(10, replicaNode.store().ttlMillis(key));

            // --- act: the primary expires n, the replica clock says it is still alive ---
            primaryClock.set(t0 + 200);
            assertEquals(Reply.NULL, c.call("GET", "n"));
        }

        // --- assert: an explicit DEL removed it ---
        await(() -> replicaNode.store().get(key) == null, "DEL of expired key on replica");
        assertEquals(0, primaryNode.store().size());
    }
}
