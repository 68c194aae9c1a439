// file: client/src/main/java/io/slotkv/client/ClusterClient.java
package io.slotkv.client;

import io.slotkv.core.Bytes;
import io.slotkv.core.HashSlots;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Slot-aware client for a SlotKV cluster.
 * <p>
 * Responsibilities:
 *  - Keep a slot -> primary cache, filled from {@code CLUSTER SLOTS}.
 *  - Send keyed commands to the node owning the key's slot; the first
 *    argument is the routing key, keyless commands go to the seed node.
 *  - Follow {@code MOVED} redirects (at most {@value #MAX_REDIRECTS}),
 *    updating the cache for the redirected slot.
 *  - Open dedicated connections for subscriptions.
 * <p>
 * Thread-safe: calls are serialized on this client.
 */
public final class ClusterClient implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ClusterClient.class.getName());

    static final int MAX_REDIRECTS = 5;

    private static final Set<String> KEYLESS = Set.of(
            "PING", "ECHO", "QUIT", "AUTH", "SAVE", "CLUSTER", "KEYS", "DBSIZE",
            "FLUSHALL", "PUBLISH", "SUBSCRIBE", "UNSUBSCRIBE");

    private final String seed;
    private final Duration timeout;
    private final String password;
    private final String[] owners = new String[HashSlots.SLOT_COUNT];
    private final Map<String, RespConnection> connections = new HashMap<>();
    private final AtomicLong redirects = new AtomicLong();

    public ClusterClient(String host, int port) {
        this(host, port, null, Duration.ofSeconds(5));
    }

    /**
     * @param password sent with AUTH on every new connection; null for none
     */
    public ClusterClient(String host, int port, String password, Duration timeout) {
        this.seed = host + ":" + port;
        this.password = password;
        this.timeout = timeout;
    }

    /** Reload the slot table from the seed node. */
    public synchronized void refreshSlots() {
        Reply reply = send(seed, Command.of("CLUSTER", "SLOTS"));
        if (!(reply instanceof Reply.Array shards)) {
            throw new ClusterClientException("unexpected CLUSTER SLOTS reply from " + seed + ": " + reply);
        }
        for (Reply entry : shards.elements()) {
            List<Reply> parts = ((Reply.Array) entry).elements();
            int start = (int) ((Reply.Integer) parts.get(0)).value();
            int end = (int) ((Reply.Integer) parts.get(1)).value();
            List<Reply> primary = ((Reply.Array) parts.get(2)).elements();
            String address = ((Reply.BulkString) primary.get(0)).utf8() + ":" + ((Reply.Integer) primary.get(1)).value();
            for (int slot = start; slot <= end; slot++) {
                owners[slot] = address;
            }
        }
        log.fine("slot table loaded from " + seed + " (" + shards.elements().size() + " shards)");
    }

    public Reply call(String... parts) {
        if (parts.length == 0) throw new IllegalArgumentException("empty command");
        String[] args = new String[parts.length - 1];
        System.arraycopy(parts, 1, args, 0, args.length);
        return call(Command.of(parts[0], args));
    }

    /**
     * Route and execute a command, following MOVED redirects.
     *
     * @throws ClusterClientException when a node is unreachable or redirects exceed the limit
     */
    public synchronized Reply call(Command command) {
        int slot = -1;
        String target = seed;
        if (command.argCount() > 0 && !KEYLESS.contains(command.name())) {
            slot = HashSlots.slotFor(command.arg(0));
            if (owners[slot] != null) target = owners[slot];
        }

        for (int followed = 0; ; followed++) {
            Reply reply = send(target, command);
            String moved = movedTarget(reply);
            if (moved == null) return reply;
            if (followed == MAX_REDIRECTS) {
                throw new ClusterClientException("too many redirects for " + command.name()
                        + (slot >= 0 ? " (slot " + slot + ")" : ""));
            }

            redirects.incrementAndGet();
            int movedSlot = movedSlot(reply);
            owners[movedSlot] = moved;
            log.fine(command.name() + " slot " + movedSlot + " moved to " + moved);
            target = moved;
        }
    }

    /** Cached owner of a slot, or null when unknown. */
    public synchronized String ownerOf(int slot) {
        return owners[slot];
    }

    /** Number of MOVED replies followed so far. */
    public long redirects() {
        return redirects.get();
    }

    /**
     * Subscribe to a channel on one node over a dedicated connection.
     * Pub/sub is node-local, so the caller picks the node.
     *
     * @param node {@code host:port}
     */
    public Subscription subscribe(String node, String channel, MessageListener listener) {
        RespConnection conn = open(node);
        try {
            conn.send(Command.of("SUBSCRIBE", channel));
            Reply confirm = conn.read();
            if (confirm instanceof Reply.Error err) {
                throw new ClusterClientException("SUBSCRIBE refused by " + node + ": " + err.message());
            }
            conn.readTimeout(0);
        } catch (IOException e) {
            closeQuietly(conn);
            throw new ClusterClientException("subscribe to " + channel + " on " + node + " failed", e);
        } catch (RuntimeException e) {
            closeQuietly(conn);
            throw e;
        }
        return new Subscription(conn, channel, listener);
    }

    @Override
    public synchronized void close() {
        for (RespConnection c : connections.values()) {
            closeQuietly(c);
        }
        connections.clear();
    }

    // ---------- internals ----------

    private Reply send(String address, Command command) {
        RespConnection conn = connections.get(address);
        if (conn == null) {
            conn = open(address);
            connections.put(address, conn);
        }
        try {
            return conn.call(command);
        } catch (IOException e) {
            connections.remove(address);
            closeQuietly(conn);
            throw new ClusterClientException(command.name() + " to " + address + " failed", e);
        }
    }

    private RespConnection open(String address) {
        int colon = address.lastIndexOf(':');
        String host = address.substring(0, colon);
        int port = Integer.parseInt(address.substring(colon + 1));
        RespConnection conn;
        try {
            conn = new RespConnection(host, port, timeout);
        } catch (IOException e) {
            throw new ClusterClientException("cannot connect to " + address, e);
        }
        if (password != null) {
            try {
                Reply r = conn.call("AUTH", password);
                if (r instanceof Reply.Error err) {
                    closeQuietly(conn);
                    throw new ClusterClientException("AUTH refused by " + address + ": " + err.message());
                }
            } catch (IOException e) {
                closeQuietly(conn);
                throw new ClusterClientException("AUTH to " + address + " failed", e);
            }
        }
        return conn;
    }

    /** @return {@code host:port} of a MOVED error, or null for any other reply */
    static String movedTarget(Reply reply) {
        if (!(reply instanceof Reply.Error err) || !"MOVED".equals(err.code())) return null;
        String[] parts = err.message().split(" ");
        if (parts.length != 3) throw new ClusterClientException("malformed redirect: " + err.message());
        return parts[2];
    }

    private static int movedSlot(Reply reply) {
        String[] parts = ((Reply.Error) reply).message().split(" ");
        try {
            int slot = Integer.parseInt(parts[1]);
            if (slot < 0 || slot >= HashSlots.SLOT_COUNT) throw new NumberFormatException(parts[1]);
            return slot;
        } catch (NumberFormatException e) {
            throw new ClusterClientException("malformed redirect: " + ((Reply.Error) reply).message(), e);
        }
    }

    private static void closeQuietly(RespConnection conn) {
        try {
            conn.close();
        } catch (IOException e) {
            log.log(Level.FINE, "close failed for " + conn.address(), e);
        }
    }

    /**
     * A live subscription; messages are handed to the listener on a daemon
     * reader thread until {@link #close()} or the connection drops.
     */
    public static final class Subscription implements AutoCloseable {
        private final RespConnection conn;
        private final String channel;
        private final Thread reader;
        private volatile boolean closed;

        private Subscription(RespConnection conn, String channel, MessageListener listener) {
            this.conn = conn;
            this.channel = channel;
            this.reader = new Thread(() -> readLoop(listener), "sub-" + channel + "@" + conn.address());
            reader.setDaemon(true);
            reader.start();
        }

        private void readLoop(MessageListener listener) {
            try {
                while (!closed) {
                    Reply frame = conn.read();
                    if (!(frame instanceof Reply.Array arr) || arr.elements().size() != 3) continue;
                    List<Reply> parts = arr.elements();
                    if (!(parts.get(0) instanceof Reply.BulkString kind)
                            || !kind.utf8().toLowerCase(Locale.ROOT).equals("message")) {
                        continue;
                    }
                    String ch = ((Reply.BulkString) parts.get(1)).utf8();
                    Bytes payload = ((Reply.BulkString) parts.get(2)).value();
                    try {
                        listener.onMessage(ch, payload);
                    } catch (RuntimeException e) {
                        log.log(Level.WARNING, "listener for " + ch + " failed", e);
                    }
                }
            } catch (IOException e) {
                if (!closed) {
                    log.log(Level.WARNING, "subscription to " + channel + " on " + conn.address() + " lost", e);
                }
            }
        }

        public boolean isActive() {
            return !closed && reader.isAlive();
        }

        @Override
        public void close() {
            closed = true;
            closeQuietly(conn);
        }
    }
}
