// file: server/src/main/java/io/slotkv/server/SlotKvNode.java
package io.slotkv.server;

import io.slotkv.core.SlotRange;
import io.slotkv.server.admin.AdminServer;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.command.CommandDispatcher;
import io.slotkv.server.net.RespServer;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.server.replication.ReplicationLink;
import io.slotkv.storage.FileSnapshotter;
import io.slotkv.storage.MemoryStore;
import io.slotkv.storage.PersistenceManager;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One SlotKV node: store, persistence, pub/sub, replication, RESP listener
 * and admin HTTP, wired from a {@link ClusterConfig}.
 *
 * Lifecycle:
 *  - {@link #start()}: restore the snapshot, bind the RESP port, start the
 *    snapshot timer and the admin endpoint.
 *  - {@link #stop()}: stop accepting, close connections, drain replication,
 *    take a final snapshot.
 *  - {@link #requestShutdown()}: the SHUTDOWN command; runs stop() on its own
 *    thread and then the action set with {@link #onShutdown(Runnable)}.
 */
public final class SlotKvNode {
    private static final Logger log = Logger.getLogger(SlotKvNode.class.getName());

    private final ClusterConfig cluster;
    private final MemoryStore store;
    private final PersistenceManager persistence;
    private final PubSubRegistry pubsub;
    private final ReplicationLink replication;
    private final CommandDispatcher dispatcher;
    private final RespServer resp;
    private final AdminServer admin;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private volatile Runnable afterShutdown = () -> { };
    private volatile boolean started;

    public SlotKvNode(ClusterConfig cluster) {
        this(cluster, Clock.systemUTC());
    }

    public SlotKvNode(ClusterConfig cluster, Clock clock) {
        this.cluster = cluster;
        var settings = cluster.settings();
        var local = cluster.localNode();
        SlotRange range = cluster.localShard().range();

        this.store = new MemoryStore(clock);
        var snapshotter = new FileSnapshotter(
                settings.snapshotDir(),
                FileSnapshotter.fileName(range.startSlot(), range.endSlot(), local.port()));
        this.persistence = new PersistenceManager(store, snapshotter, settings.snapshotInterval());
        this.pubsub = new PubSubRegistry();
        this.replication = new ReplicationLink(cluster, store);
        this.dispatcher = new CommandDispatcher(
                cluster, store, pubsub, replication, persistence, clock, this::requestShutdown);
        this.resp = new RespServer(local.port(), dispatcher, pubsub, settings.idleTimeout());
        this.admin = settings.adminPortOffset() > 0
                ? new AdminServer(local.port() + settings.adminPortOffset(), cluster, store, pubsub, persistence, resp)
                : null;
    }

    /**
     * @throws io.slotkv.storage.PersistenceException when the snapshot cannot be restored
     * @throws IOException when the RESP port cannot be bound
     */
    public void start() throws IOException {
        persistence.restore();
        resp.start();
        persistence.start();
        if (admin != null) {
            admin.start();
        }
        started = true;
        log.info(String.format("node %s serving %s %s as %s",
                cluster.localNode(),
                cluster.localShard().shardId(),
                cluster.localShard().range(),
                cluster.localIsPrimary() ? "primary" : "replica"));
    }

    public void stop() {
        if (!started) return;
        started = false;
        resp.stop();
        if (admin != null) {
            try {
                admin.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "admin server stop failed", e);
            }
        }
        replication.stop();
        persistence.stop();
        log.info("node " + cluster.localNode() + " stopped");
    }

    /** Action run after a requested shutdown has stopped the node; Main exits the JVM with 0 here. */
    public void onShutdown(Runnable action) {
        this.afterShutdown = action;
    }

    /** Stop asynchronously so the requesting connection still gets its reply. */
    public void requestShutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) return;
        Thread t = new Thread(() -> {
            try {
                stop();
            } finally {
                afterShutdown.run();
            }
        }, "shutdown-request");
        t.start();
    }

    public ClusterConfig cluster() {
        return cluster;
    }

    public MemoryStore store() {
        return store;
    }

    public PersistenceManager persistence() {
        return persistence;
    }

    public PubSubRegistry pubsub() {
        return pubsub;
    }

    public ReplicationLink replication() {
        return replication;
    }

    public RespServer resp() {
        return resp;
    }
}
