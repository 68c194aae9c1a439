package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.storage.KeyValueStore;
import io.slotkv.storage.ValueType;

import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

/**
 * Generic keyspace commands: DEL, EXISTS, TYPE, expiry, KEYS, DBSIZE, FLUSHALL.
 * <p>
 * EXPIRE and PEXPIRE are rewritten to PEXPIREAT before they run, so a
 * replica applies the same absolute deadline as the primary.
 */
final class KeyCommands {

    private final KeyValueStore store;

    KeyCommands(KeyValueStore store) {
        this.store = store;
    }

    void registerAll(CommandTable table) {
        table.registerMultiKey("DEL", -2, (s, c) -> Reply.integer(store.delete(c.args())), WRITE);
        table.registerMultiKey("EXISTS", -2, (s, c) -> Reply.integer(store.exists(c.args())));
        table.registerKeyed("TYPE", 2, this::type);
        table.registerRewritten("EXPIRE", 3, this::pexpireAt, (c, now) -> toAbsolute(c, now, 1000L), WRITE);
        table.registerRewritten("PEXPIRE", 3, this::pexpireAt, (c, now) -> toAbsolute(c, now, 1L), WRITE);
        table.registerKeyed("PEXPIREAT", 3, this::pexpireAt, WRITE);
        table.registerKeyed("TTL", 2, (s, c) -> ttl(c, true));
        table.registerKeyed("PTTL", 2, (s, c) -> ttl(c, false));
        table.registerKeyed("PERSIST", 2, (s, c) -> Reply.integer(store.persist(c.arg(0)) ? 1 : 0), WRITE);
        table.register("KEYS", 2, (s, c) -> Reply.bulkArray(store.keys(c.arg(0))));
        table.register("DBSIZE", 1, (s, c) -> Reply.integer(store.size()));
        table.register("FLUSHALL", -1, this::flushAll, WRITE);
    }

    private Reply type(Session session, Command c) {
        ValueType t = store.type(c.arg(0));
        return Reply.simple(t == null ? "none" : t.wireName());
    }

    private Reply pexpireAt(Session session, Command c) {
        long at = Args.parseLong(c.arg(1));
        return Reply.integer(store.expireAt(c.arg(0), at) ? 1 : 0);
    }

    private static Command toAbsolute(Command c, long now, long unitMillis) {
        long amount = Args.parseLong(c.arg(1));
        long at = Args.deadline(now, amount, unitMillis, c.name());
        return Command.ofBytes("PEXPIREAT", c.arg(0), Bytes.of(at));
    }

    private Reply ttl(Command c, boolean seconds) {
        long ms = store.ttlMillis(c.arg(0));
        if (ms < 0 || !seconds) return Reply.integer(ms);
        return Reply.integer((ms + 500) / 1000);
    }

    private Reply flushAll(Session session, Command c) {
        if (c.argCount() > 1) throw new CommandException(CommandException.SYNTAX);
        if (c.argCount() == 1 && !c.arg(0).equalsIgnoreCase("SYNC") && !c.arg(0).equalsIgnoreCase("ASYNC")) {
            throw new CommandException(CommandException.SYNTAX);
        }
        store.clear();
        return Reply.OK;
    }
}
