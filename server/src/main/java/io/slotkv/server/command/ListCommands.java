package io.slotkv.server.command;

import io.slotkv.core.Bytes;
import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;
import io.slotkv.storage.KeyValueStore;

import static io.slotkv.server.command.CommandSpec.Flag.WRITE;

/** List commands. Indexes follow the usual convention: negative counts from the tail. */
final class ListCommands {

    private final KeyValueStore store;

    ListCommands(KeyValueStore store) {
        this.store = store;
    }

    void registerAll(CommandTable table) {
        table.registerKeyed("LPUSH", -3, (s, c) -> push(c, true), WRITE);
        table.registerKeyed("RPUSH", -3, (s, c) -> push(c, false), WRITE);
        table.registerKeyed("LPOP", 2, (s, c) -> Reply.bulk(store.pop(c.arg(0), true)), WRITE);
        table.registerKeyed("RPOP", 2, (s, c) -> Reply.bulk(store.pop(c.arg(0), false)), WRITE);
        table.registerKeyed("LLEN", 2, (s, c) -> Reply.integer(store.llen(c.arg(0))));
        table.registerKeyed("LRANGE", 4, (s, c) -> Reply.bulkArray(
                store.lrange(c.arg(0), Args.parseLong(c.arg(1)), Args.parseLong(c.arg(2)))));
        table.registerKeyed("LINDEX", 3, (s, c) -> Reply.bulk(store.lindex(c.arg(0), Args.parseLong(c.arg(1)))));
        table.registerKeyed("LSET", 4, this::lset, WRITE);
        table.registerKeyed("LINSERT", 5, this::linsert, WRITE);
        table.registerKeyed("LREM", 4, (s, c) -> Reply.integer(
                store.lrem(c.arg(0), Args.parseLong(c.arg(1)), c.arg(2))), WRITE);
    }

    private Reply push(Command c, boolean head) {
        return Reply.integer(store.push(c.arg(0), c.args().subList(1, c.argCount()), head));
    }

    private Reply lset(Session session, Command c) {
        store.lset(c.arg(0), Args.parseLong(c.arg(1)), c.arg(2));
        return Reply.OK;
    }

    private Reply linsert(Session session, Command c) {
        Bytes where = c.arg(1);
        boolean before;
        if (where.equalsIgnoreCase("BEFORE")) {
            before = true;
        } else if (where.equalsIgnoreCase("AFTER")) {
            before = false;
        } else {
            throw new CommandException(CommandException.SYNTAX);
        }
        return Reply.integer(store.linsert(c.arg(0), before, c.arg(2), c.arg(3)));
    }
}
