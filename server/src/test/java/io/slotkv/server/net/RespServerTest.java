// file: server/src/test/java/io/slotkv/server/net/RespServerTest.java
package io.slotkv.server.net;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.TestClient;
import io.slotkv.server.TestClusters;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.server.command.CommandDispatcher;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.server.replication.ReplicationLink;
import io.slotkv.storage.FileSnapshotter;
import io.slotkv.storage.MemoryStore;
import io.slotkv.storage.PersistenceManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over real sockets: framing, pipelining, protocol errors,
 * QUIT, pub/sub delivery and idle timeouts.
 */
class RespServerTest {

    @TempDir
    Path tmp;

    private RespServer server;
    private PubSubRegistry pubsub;
    private int port;

    @AfterEach
    void tearDown() {
        if (server != null) server.stop();
    }

    private void startServer(Duration idleTimeout) throws Exception {
        port = TestClusters.freePort();
        NodeAddress me = TestClusters.local(port);
        var cluster = new ClusterConfig(TestClusters.singleShard(me), me, TestClusters.quietSettings(tmp));
        var store = new MemoryStore();
        pubsub = new PubSubRegistry();
        var persistence = new PersistenceManager(store, new FileSnapshotter(tmp, "node.snap"), Duration.ZERO);
        var dispatcher = new CommandDispatcher(cluster, store, pubsub,
                new ReplicationLink(cluster, store), persistence, Clock.systemUTC(), () -> { });
        server = new RespServer(port, dispatcher, pubsub, idleTimeout);
        server.start();
    }

    private static Reply bulk(String s) {
        return Reply.bulk(s);
    }

    @Test
    void set_then_get_over_the_wire() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            assertEquals(Reply.OK, c.call("SET", "k", "v"));
            assertEquals(bulk("v"), c.call("GET", "k"));
            assertEquals(Reply.PONG, c.call("PING"));
        }
    }

    @Test
    void frame_split_across_writes_is_reassembled() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            c.writeRaw("*3\r\n$3\r\nSE");
            Thread.sleep(50);
            c.writeRaw("T\r\n$5\r\nsplit\r\n$2\r");
            Thread.sleep(50);
            c.writeRaw("\nok\r\n");

            assertEquals(Reply.OK, c.read());
            assertEquals(bulk("ok"), c.call("GET", "split"));
        }
    }

    @Test
    void pipelined_commands_are_answered_in_order() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            var sb = new StringBuilder();
            for (int i = 0; i < 50; i++) {
                sb.append("*2\r\n$4\r\nINCR\r\n$3\r\nctr\r\n");
            }
            c.writeRaw(sb.toString());

            for (int i = 1; i <= 50; i++) {
                assertEquals(Reply.integer(i), c.read());
            }
        }
    }

    @Test
    void recoverable_protocol_error_keeps_connection_open() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            c.writeRaw("hello there\r\n");

            Reply r = c.read();
            assertInstanceOf(Reply.Error.class, r);
            assertTrue(((Reply.Error) r).message().startsWith("ERR Protocol error"));
            assertEquals(Reply.PONG, c.call("PING"));
        }
    }

    @Test
    void non_bulk_request_elements_are_rejected_but_recoverable() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            c.writeRaw("*1\r\n:5\r\n");

            assertInstanceOf(Reply.Error.class, c.read());
            assertEquals(Reply.PONG, c.call("PING"));
        }
    }

    @Test
    void fatal_protocol_error_closes_after_reply() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            c.writeRaw("*1\r\n$abc\r\n");

            Reply r = c.read();
            assertTrue(((Reply.Error) r).message().startsWith("ERR Protocol error"));
            assertTrue(c.closedByServer(2_000));
        }
    }

    @Test
    void quit_replies_ok_then_closes() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            assertEquals(Reply.OK, c.call("QUIT"));
            assertTrue(c.closedByServer(2_000));
        }
    }

    @Test
    void binary_values_survive_unchanged() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            byte[] value = {0, 1, '\r', '\n', (byte) 0xFF};
            c.send(new Command("SET", List.of(Bytes.of("bin"), Bytes.of(value))));
            assertEquals(Reply.OK, c.read());

            Reply r = c.call("GET", "bin");
            assertArrayEquals(value, ((Reply.BulkString) r).value().toByteArray());
        }
    }

    @Test
    void published_messages_reach_socket_subscribers() throws Exception {
        startServer(Duration.ZERO);
        try (var sub = new TestClient(port); var pub = new TestClient(port)) {
            assertEquals(Reply.array(bulk("subscribe"), bulk("news"), Reply.integer(1)),
                    sub.call("SUBSCRIBE", "news"));

            assertEquals(Reply.integer(1), pub.call("PUBLISH", "news", "first"));
            assertEquals(Reply.integer(1), pub.call("PUBLISH", "news", "second"));

            assertEquals(Reply.array(bulk("message"), bulk("news"), bulk("first")), sub.read());
            assertEquals(Reply.array(bulk("message"), bulk("news"), bulk("second")), sub.read());

            Reply refused = sub.call("GET", "k");
            assertTrue(((Reply.Error) refused).message().startsWith("ERR Can't execute"));
        }
    }

    @Test
    void closed_subscriber_is_removed_from_registry() throws Exception {
        startServer(Duration.ZERO);
        var sub = new TestClient(port);
        sub.call("SUBSCRIBE", "c");
        assertEquals(1, pubsub.channelCount());

        sub.close();

        long deadline = System.currentTimeMillis() + 3_000;
        while (pubsub.channelCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, pubsub.channelCount());
    }

    @Test
    void idle_connection_is_closed_but_subscriber_is_kept() throws Exception {
        startServer(Duration.ofMillis(300));
        try (var idle = new TestClient(port); var sub = new TestClient(port)) {
            assertEquals(Reply.PONG, idle.call("PING"));
            sub.call("SUBSCRIBE", "c");

            assertTrue(idle.closedByServer(3_000));
            assertFalse(sub.closedByServer(1_500));
        }
    }

    @Test
    void stop_closes_open_connections() throws Exception {
        startServer(Duration.ZERO);
        var c = new TestClient(port);
        assertEquals(Reply.PONG, c.call("PING"));

        server.stop();
        server = null;

        assertTrue(c.closedByServer(2_000));
        c.close();
    }

    @Test
    void inline_request_is_rejected_and_connection_stays_usable() throws Exception {
        startServer(Duration.ZERO);
        try (var c = new TestClient(port)) {
            c.writeRaw("GET k\r\n".getBytes(StandardCharsets.UTF_8));

            assertInstanceOf(Reply.Error.class, c.read());
            assertEquals(Reply.NULL, c.call("GET", "k"));
        }
    }
}
