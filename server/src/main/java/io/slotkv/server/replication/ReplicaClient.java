package io.slotkv.server.replication;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.ProtocolException;
import io.slotkv.core.resp.Reply;
import io.slotkv.core.resp.RespDecoder;
import io.slotkv.server.cluster.NodeAddress;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.SnapshotCodec;
import io.slotkv.storage.SnapshotData;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered, asynchronous forwarder of applied writes to one replica.
 * <p>
 * Responsibilities:
 *  - Keep a bounded FIFO of commands and drain it on a dedicated thread, so
 *    the replica applies writes in exactly the order the primary did.
 *  - Connect lazily: AUTH (when a password is configured), then
 *    {@code REPLICATE <shardId> <secret>}, then {@code FULLSYNC <image>} with a
 *    snapshot of the primary, then one request/reply per command.
 *  - Every command carries the sequence number it was queued with. The
 *    snapshot is taken under the store lock together with the current
 *    sequence, so queued commands it already contains are skipped.
 *  - On I/O failure drop the connection and back off; commands dequeued
 *    during the back-off window are skipped without a connect attempt. The
 *    next successful connect resyncs, so nothing skipped is lost for good.
 *  - When the queue is full the command is dropped and the link is flagged
 *    for a resync.
 */
public final class ReplicaClient {
    private static final Logger log = Logger.getLogger(ReplicaClient.class.getName());

    static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);

    private final NodeAddress target;
    private final String shardId;
    private final String password;
    private final String secret;
    private final KeyValueStore store;
    private final Duration timeout;
    private final Duration backoff;
    private final ThreadPoolExecutor executor;

    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong resyncs = new AtomicLong();

    // advanced under the store lock by enqueue() and resync()
    private long sequence;
    private volatile long syncedThrough;
    private volatile boolean resyncRequired;

    // touched only by the executor thread
    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private RespDecoder decoder;
    private boolean backingOff;
    private long retryAtNanos;

    public ReplicaClient(NodeAddress target, String shardId, String password, String secret,
                         KeyValueStore store, Duration timeout) {
        this(target, shardId, password, secret, store, timeout, DEFAULT_QUEUE_CAPACITY, DEFAULT_BACKOFF);
    }

    ReplicaClient(NodeAddress target, String shardId, String password, String secret,
                  KeyValueStore store, Duration timeout, int queueCapacity, Duration backoff) {
        this.target = target;
        this.shardId = shardId;
        this.password = password;
        this.secret = secret;
        this.store = store;
        this.timeout = timeout;
        this.backoff = backoff;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "replica-" + target);
                    t.setDaemon(true);
                    return t;
                },
                (task, pool) -> dropped(pool));
    }

    public NodeAddress target() {
        return target;
    }

    /** Queue a command; returns immediately. Called with the store lock held. */
    public void enqueue(Command command) {
        long seq = ++sequence;
        executor.execute(() -> forwardSafe(seq, command));
    }

    /** Commands the replica received, either one by one or as part of a resync image. */
    public long forwarded() {
        return forwarded.get();
    }

    /** Commands skipped because of a connection failure, a back-off window or a full queue. */
    public long failed() {
        return failed.get();
    }

    /** Number of snapshot images shipped to the replica. */
    public long resyncs() {
        return resyncs.get();
    }

    /** Forward what is already queued (bounded wait), then close the connection. */
    public void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        disconnect();
    }

    private void dropped(ThreadPoolExecutor pool) {
        if (pool.isShutdown()) {
            log.fine("replica client " + target + " stopped, dropping write");
            return;
        }
        failed.incrementAndGet();
        if (!resyncRequired) {
            resyncRequired = true;
            log.warning("replication queue to " + target + " is full, dropping writes until the next resync");
        }
    }

    // ---------- executor thread ----------

    private void forwardSafe(long seq, Command command) {
        if (resyncRequired) {
            disconnect();
        }
        if (socket == null && backingOff && System.nanoTime() - retryAtNanos < 0) {
            failed.incrementAndGet();
            return;
        }
        try {
            ensureConnected();
            if (seq <= syncedThrough) {
                forwarded.incrementAndGet();
                return;
            }
            Reply reply = call(command);
            forwarded.incrementAndGet();
            if (reply instanceof Reply.Error err) {
                log.warning("replica " + target + " rejected " + command.name() + ": " + err.message());
            }
        } catch (ReplicationException e) {
            failed.incrementAndGet();
            log.log(Level.WARNING, "replication to " + target + " failed, skipping "
                    + command.name() + ": " + e.getMessage());
            disconnect();
            backingOff = true;
            retryAtNanos = System.nanoTime() + backoff.toNanos();
        }
    }

    private Reply call(Command command) {
        try {
            out.write(command.encode());
            out.flush();
            return readReply();
        } catch (IOException e) {
            throw new ReplicationException("I/O error talking to " + target, e);
        }
    }

    private void ensureConnected() {
        if (socket != null) return;
        try {
            Socket s = new Socket();
            s.connect(new InetSocketAddress(target.host(), target.port()), (int) timeout.toMillis());
            s.setSoTimeout((int) timeout.toMillis());
            s.setTcpNoDelay(true);
            socket = s;
            in = s.getInputStream();
            out = s.getOutputStream();
            decoder = new RespDecoder();
        } catch (IOException e) {
            disconnect();
            throw new ReplicationException("cannot connect to replica " + target, e);
        }

        if (password != null) {
            handshake(Command.of("AUTH", password));
        }
        handshake(Command.of("REPLICATE", shardId, secret));
        resync();
        backingOff = false;
        log.info("replication link to " + target + " for " + shardId + " is up");
    }

    private void resync() {
        resyncRequired = false;
        SnapshotData image = store.atomically(() -> {
            syncedThrough = sequence;
            return store.snapshot();
        });
        handshake(Command.ofBytes("FULLSYNC", Bytes.wrap(SnapshotCodec.encode(image))));
        resyncs.incrementAndGet();
        log.info("resynced " + target + " with " + image.entries().size() + " keys");
    }

    private void handshake(Command command) {
        try {
            out.write(command.encode());
            out.flush();
            Reply reply = readReply();
            if (reply instanceof Reply.Error err) {
                throw new ReplicationException(command.name() + " refused by " + target + ": " + err.message());
            }
        } catch (IOException e) {
            throw new ReplicationException("handshake with " + target + " failed", e);
        }
    }

    private Reply readReply() throws IOException {
        byte[] buf = new byte[4096];
        while (true) {
            Reply r;
            try {
                r = decoder.next();
            } catch (ProtocolException e) {
                throw new ReplicationException("malformed reply from " + target + ": " + e.getMessage(), e);
            }
            if (r != null) return r;
            int n = in.read(buf);
            if (n < 0) throw new ReplicationException("replica " + target + " closed the connection");
            decoder.feed(buf, 0, n);
        }
    }

    private void disconnect() {
        if (socket == null) return;
        try {
            socket.close();
        } catch (IOException e) {
            log.log(Level.FINE, "close failed for " + target, e);
        }
        socket = null;
        in = null;
        out = null;
        decoder = null;
    }
}
