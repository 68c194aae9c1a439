package io.slotkv.server.command;

import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.PersistenceException;
import io.slotkv.storage.PersistenceManager;
import io.slotkv.storage.SnapshotCodec;
import io.slotkv.storage.SnapshotData;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.slotkv.server.command.CommandSpec.Flag.NO_AUTH;
import static io.slotkv.server.command.CommandSpec.Flag.PUBSUB_CONTEXT;

/**
 * Connection and node commands: PING, ECHO, QUIT, AUTH, SAVE, SHUTDOWN,
 * plus the replication handshake REPLICATE and FULLSYNC.
 */
final class ServerCommands {
    private static final Logger log = Logger.getLogger(ServerCommands.class.getName());

    private final ClusterConfig cluster;
    private final KeyValueStore store;
    private final PersistenceManager persistence;
    private final SubscriptionCheck subscriptions;
    private final Runnable shutdown;

    /** Whether a session currently holds subscriptions (changes the PING reply shape). */
    @FunctionalInterface
    interface SubscriptionCheck {
        boolean subscribed(Session session);
    }

    ServerCommands(ClusterConfig cluster, KeyValueStore store, PersistenceManager persistence,
                   SubscriptionCheck subscriptions, Runnable shutdown) {
        this.cluster = cluster;
        this.store = store;
        this.persistence = persistence;
        this.subscriptions = subscriptions;
        this.shutdown = shutdown;
    }

    void registerAll(CommandTable table) {
        table.register("PING", -1, this::ping, PUBSUB_CONTEXT);
        table.register("ECHO", 2, (s, c) -> Reply.bulk(c.arg(0)));
        table.register("QUIT", -1, this::quit, NO_AUTH, PUBSUB_CONTEXT);
        table.register("AUTH", 2, this::auth, NO_AUTH);
        table.register("SAVE", 1, this::save);
        table.register("SHUTDOWN", 1, this::shutdown);
        table.register("REPLICATE", 3, this::replicate);
        table.register("FULLSYNC", 2, this::fullSync);
    }

    private Reply ping(Session session, Command c) {
        if (c.argCount() > 1) throw CommandException.wrongArity(c.name());
        if (subscriptions.subscribed(session)) {
            return Reply.array(Reply.bulk("pong"), c.argCount() == 1 ? Reply.bulk(c.arg(0)) : Reply.bulk(""));
        }
        return c.argCount() == 1 ? Reply.bulk(c.arg(0)) : Reply.PONG;
    }

    private Reply quit(Session session, Command c) {
        session.closeAfterReply();
        return Reply.OK;
    }

    private Reply auth(Session session, Command c) {
        String expected = cluster.settings().requirePass();
        if (expected == null) {
            throw new CommandException("AUTH <password> called without any password configured");
        }
        byte[] given = c.arg(0).unsafeArray();
        if (!MessageDigest.isEqual(given, expected.getBytes(StandardCharsets.UTF_8))) {
            log.warning("failed AUTH from " + session.peer());
            return Reply.error("WRONGPASS invalid password");
        }
        session.authenticate();
        return Reply.OK;
    }

    private Reply save(Session session, Command c) {
        try {
            persistence.snapshotNow();
            return Reply.OK;
        } catch (PersistenceException e) {
            log.log(Level.WARNING, "SAVE failed", e);
            throw new CommandException("snapshot failed: " + e.getMessage());
        }
    }

    private Reply shutdown(Session session, Command c) {
        log.info("SHUTDOWN requested by " + session.peer());
        session.closeAfterReply();
        shutdown.run();
        return Reply.OK;
    }

    private Reply replicate(Session session, Command c) {
        String expected = cluster.settings().replicationSecret();
        if (expected == null) {
            throw new CommandException("replication is disabled: no replicationSecret configured");
        }
        if (!MessageDigest.isEqual(c.arg(1).unsafeArray(), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warning("REPLICATE with a wrong secret from " + session.peer());
            return Reply.error("ERR invalid replication secret");
        }
        String shardId = c.arg(0).utf8();
        if (!cluster.localShard().shardId().equals(shardId) || cluster.localIsPrimary()) {
            throw new CommandException("this node is not a replica of " + shardId);
        }
        session.markReplicationLink();
        log.info("replication link from " + session.peer() + " for " + shardId);
        return Reply.OK;
    }

    private Reply fullSync(Session session, Command c) {
        if (!session.replicationLink()) {
            throw new CommandException("FULLSYNC is only accepted on a replication link");
        }
        SnapshotData image;
        try {
            image = SnapshotCodec.decode(c.arg(0).unsafeArray());
        } catch (PersistenceException e) {
            log.log(Level.WARNING, "unreadable FULLSYNC image from " + session.peer(), e);
            throw new CommandException("bad snapshot image: " + e.getMessage());
        }
        store.load(image);
        log.info("loaded " + image.entries().size() + " keys from primary " + session.peer());
        return Reply.OK;
    }
}
