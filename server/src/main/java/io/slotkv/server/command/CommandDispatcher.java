package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.server.RequestLogger;
import io.slotkv.server.cluster.ClusterConfig;
import io.slotkv.server.cluster.SlotRouting;
import io.slotkv.server.pubsub.PubSubRegistry;
import io.slotkv.server.replication.ReplicationLink;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.PersistenceManager;
import io.slotkv.storage.StoreException;
import io.slotkv.storage.WrongTypeException;

import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.slotkv.server.command.CommandSpec.Flag.NO_AUTH;
import static io.slotkv.server.command.CommandSpec.Flag.PUBSUB_CONTEXT;
import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

/**
 * Turns one decoded {@link Command} into exactly one {@link Reply}.
 * <p>
 * Pipeline:
 *  1) look up the command and check its arity,
 *  2) enforce AUTH and the subscribed-connection restrictions,
 *  3) route keyed commands by hash slot (MOVED / CROSSSLOT),
 *  4) rewrite relative expiries to absolute deadlines,
 *  5) execute; for writes, inside the store lock: apply, then queue the
 *     command to replicas and publish keyspace notifications when the
 *     store actually changed.
 * <p>
 * Domain exceptions become error replies here; nothing a single command
 * does closes the connection.
 */
public final class CommandDispatcher {
    private static final Logger log = Logger.getLogger(CommandDispatcher.class.getName());

    static final String KEYSPACE_PREFIX = "__keyspace@0__:";

    private final ClusterConfig cluster;
    private final KeyValueStore store;
    private final PubSubRegistry pubsub;
    private final ReplicationLink replication;
    private final SlotRouting routing;
    private final Clock clock;
    private final CommandTable table = new CommandTable();

    public CommandDispatcher(
            ClusterConfig cluster,
            KeyValueStore store,
            PubSubRegistry pubsub,
            ReplicationLink replication,
            PersistenceManager persistence,
            Clock clock,
            Runnable shutdown
    ) {
        this.cluster = cluster;
        this.store = store;
        this.pubsub = pubsub;
        this.replication = replication;
        this.routing = new SlotRouting(cluster);
        this.clock = clock;

        new KeyCommands(store).registerAll(table);
        new StringCommands(store).registerAll(table);
        new ListCommands(store).registerAll(table);
        new HashCommands(store).registerAll(table);
        new SetCommands(store).registerAll(table);
        new PubSubCommands(pubsub).registerAll(table);
        new ServerCommands(cluster, store, persistence, this::subscribed, shutdown).registerAll(table);
        new ClusterCommands(cluster).registerAll(table);
    }

    public CommandTable table() {
        return table;
    }

    public Reply dispatch(Session session, Command command) {
        long start = System.nanoTime();
        Reply reply;
        Throwable error = null;
        try {
            reply = execute(session, command);
        } catch (WrongTypeException e) {
            reply = Reply.error("WRONGTYPE " + e.getMessage());
        } catch (CommandException | StoreException e) {
            reply = Reply.error("ERR " + e.getMessage());
        } catch (RuntimeException e) {
            error = e;
            log.log(Level.SEVERE, "command " + command.name() + " failed", e);
            reply = Reply.error("ERR internal error: " + e.getClass().getSimpleName());
        }
        long micros = (System.nanoTime() - start) / 1_000L;
        RequestLogger.logCommand(command.name(), session.peer(), reply, micros, error);
        return reply;
    }

    private Reply execute(Session session, Command command) {
        CommandSpec spec = table.lookup(command.name());
        if (spec == null) {
            return Reply.error("ERR unknown command '" + truncate(command.name()) + "'");
        }
        if (!spec.arityMatches(command)) {
            throw CommandException.wrongArity(spec.name());
        }
        if (cluster.settings().requirePass() != null && !session.authenticated() && !spec.has(NO_AUTH)) {
            return Reply.error("NOAUTH Authentication required.");
        }
        if (!spec.has(PUBSUB_CONTEXT) && subscribed(session)) {
            return Reply.error("ERR Can't execute '" + spec.name().toLowerCase()
                    + "': only SUBSCRIBE / UNSUBSCRIBE / PING / QUIT are allowed in this context");
        }

        boolean write = spec.has(WRITE);
        List<Bytes> keys = spec.keys(command);
        if (!keys.isEmpty()) {
            SlotRouting.Route route = routing.route(keys, write, session.replicationLink());
            if (!route.local()) return route.redirect();
        } else if (write && !cluster.localIsPrimary() && !session.replicationLink()) {
            return Reply.error("READONLY You can't write against a read only replica.");
        }

        Command effective = spec.rewrite(command, clock.millis());
        CommandSpec target = effective == command ? spec : table.lookup(effective.name());

        if (!write) {
            return target.handler().execute(session, effective);
        }
        return store.atomically(() -> {
            long before = store.mutations();
            Reply reply = target.handler().execute(session, effective);
            if (store.mutations() != before) {
                replication.propagate(effective);
                notifyKeyspace(spec, keys);
            }
            return reply;
        });
    }

    private void notifyKeyspace(CommandSpec spec, List<Bytes> keys) {
        if (!cluster.settings().notifyKeyspaceEvents() || keys.isEmpty()) return;
        Bytes event = Bytes.of(spec.name().toLowerCase());
        for (Bytes key : keys) {
            pubsub.publish(Bytes.of(KEYSPACE_PREFIX).concat(key), event);
        }
    }

    private boolean subscribed(Session session) {
        return pubsub.subscriptionCount(session.subscriber()) > 0;
    }

    private static String truncate(String s) {
        return s.length() <= 64 ? s : s.substring(0, 64) + "...";
    }
}
